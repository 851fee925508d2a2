package se.ironpass_be.controller;

import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Pageable;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import se.ironpass_be.dto.request.MemberRequest;
import se.ironpass_be.dto.response.ApiResponse;
import se.ironpass_be.dto.response.MemberResponse;
import se.ironpass_be.dto.response.MembershipResponse;
import se.ironpass_be.dto.response.PagedResponse;
import se.ironpass_be.dto.response.PaymentResponse;
import se.ironpass_be.service.MemberService;
import se.ironpass_be.service.MembershipService;
import se.ironpass_be.service.PaymentService;
import se.ironpass_be.util.PaginationUtils;

import java.util.List;

@RestController
@RequestMapping("/api/v1/members")
@Tag(name = "Members", description = "Member records, their memberships and payments")
@RequiredArgsConstructor
public class MemberController {

    private final MemberService memberService;
    private final MembershipService membershipService;
    private final PaymentService paymentService;

    @GetMapping
    public ResponseEntity<ApiResponse<PagedResponse<MemberResponse>>> getMembers(
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "20") int size,
            @RequestParam(defaultValue = "createdAt") String sortBy,
            @RequestParam(defaultValue = "desc") String sortDir,
            @RequestParam(required = false) String search) {

        Pageable pageable = PaginationUtils.createPageable(page, size, sortBy, sortDir);
        return ResponseEntity.ok(ApiResponse.success("Members retrieved successfully",
                memberService.getMembers(pageable, search)));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse<MemberResponse>> getMember(@PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success("Member retrieved successfully", memberService.getMember(id)));
    }

    @PostMapping
    public ResponseEntity<ApiResponse<MemberResponse>> createMember(@Valid @RequestBody MemberRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success("Member created successfully", memberService.createMember(request)));
    }

    @PutMapping("/{id}")
    public ResponseEntity<ApiResponse<MemberResponse>> updateMember(@PathVariable Long id,
                                                                    @Valid @RequestBody MemberRequest request) {
        return ResponseEntity.ok(ApiResponse.success("Member updated successfully", memberService.updateMember(id, request)));
    }

    @PatchMapping("/{id}/deactivate")
    public ResponseEntity<ApiResponse<MemberResponse>> deactivateMember(@PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success("Member deactivated", memberService.setActive(id, false)));
    }

    @PatchMapping("/{id}/activate")
    public ResponseEntity<ApiResponse<MemberResponse>> activateMember(@PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success("Member activated", memberService.setActive(id, true)));
    }

    @GetMapping("/{id}/memberships")
    public ResponseEntity<ApiResponse<List<MembershipResponse>>> getMemberships(@PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success(membershipService.getMembershipsForMember(id)));
    }

    @GetMapping("/{id}/payments")
    public ResponseEntity<ApiResponse<List<PaymentResponse>>> getPayments(@PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success(paymentService.getPaymentsForMember(id)));
    }
}
