package se.ironpass_be.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Pageable;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.web.bind.annotation.*;
import se.ironpass_be.dto.request.ManualAccessRequest;
import se.ironpass_be.dto.request.QrValidationRequest;
import se.ironpass_be.dto.response.*;
import se.ironpass_be.pojo.enums.AccessMethod;
import se.ironpass_be.service.AccessLogService;
import se.ironpass_be.service.AccessService;
import se.ironpass_be.service.StaffService;
import se.ironpass_be.util.PaginationUtils;

import java.time.LocalDate;

@RestController
@RequestMapping("/api/v1/access")
@Tag(name = "Access Control",
     description = "Front desk admission: verdict preview, manual check-in, QR check-in and the access log.")
@RequiredArgsConstructor
public class AccessController {

    private final AccessService accessService;
    private final AccessLogService accessLogService;
    private final StaffService staffService;

    @Operation(summary = "Preview the access verdict of a member without logging an entry")
    @GetMapping("/members/{memberId}/validate")
    public ResponseEntity<ApiResponse<AccessVerdict>> validateMemberAccess(@PathVariable Long memberId) {
        AccessVerdict verdict = accessService.validateMemberAccess(memberId);
        return ResponseEntity.ok(ApiResponse.success("Access evaluated", verdict));
    }

    @Operation(
            summary = "Manual check-in",
            description = "Evaluates the member and writes one access log row with the verdict. Denials are returned with HTTP 200, they are outcomes and not errors."
    )
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(
                    responseCode = "200",
                    description = "Entry evaluated and logged",
                    content = @Content(schema = @Schema(implementation = AccessAttemptResponse.class))
            ),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(
                    responseCode = "404",
                    description = "Member not found, nothing logged"
            )
    })
    @PostMapping("/manual")
    public ResponseEntity<ApiResponse<AccessAttemptResponse>> registerManualAccess(
            @Valid @RequestBody ManualAccessRequest request,
            @Parameter(hidden = true) @AuthenticationPrincipal UserDetails currentUser) {
        AccessAttemptResponse result = accessService.registerManualAccess(
                request.getMemberId(), staffService.getCurrentStaff(currentUser));
        return ResponseEntity.ok(ApiResponse.success(result.getVerdict().getReason(), result));
    }

    @Operation(
            summary = "QR check-in",
            description = "Validates and consumes a scanned QR code. Every outcome except an unknown code is written to the access log."
    )
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(
                    responseCode = "200",
                    description = "Entry evaluated and logged",
                    content = @Content(schema = @Schema(implementation = AccessAttemptResponse.class))
            ),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(
                    responseCode = "404",
                    description = "Code matches no issued token"
            ),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(
                    responseCode = "503",
                    description = "Storage unavailable, the member should scan a new code"
            )
    })
    @PostMapping("/qr/validate")
    public ResponseEntity<ApiResponse<AccessAttemptResponse>> validateQrToken(
            @Valid @RequestBody QrValidationRequest request,
            @Parameter(hidden = true) @AuthenticationPrincipal UserDetails currentUser) {
        AccessAttemptResponse result = accessService.validateQrToken(
                request.getToken(), staffService.getCurrentStaff(currentUser));
        return ResponseEntity.ok(ApiResponse.success(result.getVerdict().getReason(), result));
    }

    @GetMapping("/logs")
    public ResponseEntity<ApiResponse<PagedResponse<AccessLogResponse>>> getAccessLogs(
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "20") int size,
            @RequestParam(defaultValue = "accessedAt") String sortBy,
            @RequestParam(defaultValue = "desc") String sortDir,
            @RequestParam(required = false) Long memberId,
            @RequestParam(required = false) Boolean allowed,
            @RequestParam(required = false) AccessMethod method,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {

        Pageable pageable = PaginationUtils.createPageable(page, size, sortBy, sortDir);
        PagedResponse<AccessLogResponse> logs = accessLogService.getAccessLogs(pageable, memberId, allowed, method, from, to);
        return ResponseEntity.ok(ApiResponse.success("Access logs retrieved successfully", logs));
    }

    @GetMapping("/stats/today")
    public ResponseEntity<ApiResponse<AccessStatsResponse>> getTodayStats() {
        return ResponseEntity.ok(ApiResponse.success("Today's access stats", accessLogService.getTodayStats()));
    }
}
