package se.ironpass_be.controller;

import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;
import se.ironpass_be.dto.request.MembershipPlanRequest;
import se.ironpass_be.dto.response.ApiResponse;
import se.ironpass_be.dto.response.MembershipPlanResponse;
import se.ironpass_be.service.MembershipPlanService;

import java.util.List;

@RestController
@RequestMapping("/api/v1/admin/plans")
@Tag(name = "Admin - Plans", description = "[ADMIN] Membership plan catalogue")
@PreAuthorize("hasRole('ADMIN')")
@RequiredArgsConstructor
public class AdminPlanController {

    private final MembershipPlanService membershipPlanService;

    @GetMapping
    public ResponseEntity<ApiResponse<List<MembershipPlanResponse>>> getAllPlans() {
        return ResponseEntity.ok(ApiResponse.success(membershipPlanService.getAllPlans()));
    }

    @PostMapping
    public ResponseEntity<ApiResponse<MembershipPlanResponse>> createPlan(@Valid @RequestBody MembershipPlanRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success("Plan created successfully", membershipPlanService.createPlan(request)));
    }

    @PutMapping("/{id}")
    public ResponseEntity<ApiResponse<MembershipPlanResponse>> updatePlan(@PathVariable Long id,
                                                                          @Valid @RequestBody MembershipPlanRequest request) {
        return ResponseEntity.ok(ApiResponse.success("Plan updated successfully", membershipPlanService.updatePlan(id, request)));
    }
}
