package se.ironpass_be.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import se.ironpass_be.dto.request.CreateMembershipRequest;
import se.ironpass_be.dto.request.FreezeMembershipRequest;
import se.ironpass_be.dto.response.ApiResponse;
import se.ironpass_be.dto.response.MembershipPlanResponse;
import se.ironpass_be.dto.response.MembershipResponse;
import se.ironpass_be.dto.response.OverdueMembershipResponse;
import se.ironpass_be.dto.response.PendingPaymentResponse;
import se.ironpass_be.service.MembershipPlanService;
import se.ironpass_be.service.MembershipService;

import java.util.List;

@RestController
@RequestMapping("/api/v1/memberships")
@Tag(name = "Memberships", description = "Membership lifecycle: create, renew, freeze, cancel, and balance reports")
@RequiredArgsConstructor
public class MembershipController {

    private final MembershipService membershipService;
    private final MembershipPlanService membershipPlanService;

    @GetMapping("/plans")
    public ResponseEntity<ApiResponse<List<MembershipPlanResponse>>> getActivePlans() {
        return ResponseEntity.ok(ApiResponse.success(membershipPlanService.getActivePlans()));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse<MembershipResponse>> getMembership(@PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success(membershipService.getMembership(id)));
    }

    @Operation(summary = "Create a membership",
               description = "Starts as PENDING_PAYMENT when payment is required to activate, otherwise ACTIVE.")
    @PostMapping
    public ResponseEntity<ApiResponse<MembershipResponse>> createMembership(@Valid @RequestBody CreateMembershipRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success("Membership created successfully", membershipService.createMembership(request)));
    }

    @Operation(summary = "Renew a member on a plan", description = "Continues from the current end date when it is still ahead.")
    @PostMapping("/members/{memberId}/renew")
    public ResponseEntity<ApiResponse<MembershipResponse>> renewMembership(@PathVariable Long memberId,
                                                                           @RequestParam Long planId) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success("Membership renewed successfully", membershipService.renewMembership(memberId, planId)));
    }

    @PostMapping("/{id}/freeze")
    public ResponseEntity<ApiResponse<MembershipResponse>> freezeMembership(@PathVariable Long id,
                                                                            @Valid @RequestBody FreezeMembershipRequest request) {
        return ResponseEntity.ok(ApiResponse.success("Membership frozen", membershipService.freezeMembership(id, request.getDays())));
    }

    @PostMapping("/{id}/unfreeze")
    public ResponseEntity<ApiResponse<MembershipResponse>> unfreezeMembership(@PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success("Membership unfrozen", membershipService.unfreezeMembership(id)));
    }

    @PostMapping("/{id}/cancel")
    public ResponseEntity<ApiResponse<MembershipResponse>> cancelMembership(@PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success("Membership cancelled", membershipService.cancelMembership(id)));
    }

    @Operation(summary = "Active memberships with an outstanding balance, most urgent deadline first")
    @GetMapping("/pending-payments")
    public ResponseEntity<ApiResponse<List<PendingPaymentResponse>>> getPendingPayments() {
        return ResponseEntity.ok(ApiResponse.success(membershipService.getMembersWithPendingPayments()));
    }

    @Operation(summary = "Expired memberships beyond the morosity tolerance")
    @GetMapping("/overdue")
    public ResponseEntity<ApiResponse<List<OverdueMembershipResponse>>> getOverdueMemberships() {
        return ResponseEntity.ok(ApiResponse.success(membershipService.getOverdueMemberships()));
    }
}
