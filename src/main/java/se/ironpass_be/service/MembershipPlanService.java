package se.ironpass_be.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import se.ironpass_be.dto.request.MembershipPlanRequest;
import se.ironpass_be.dto.response.MembershipPlanResponse;
import se.ironpass_be.exception.BusinessLogicException;
import se.ironpass_be.exception.ResourceNotFoundException;
import se.ironpass_be.mapper.ModelMapper;
import se.ironpass_be.pojo.MembershipPlan;
import se.ironpass_be.repository.MembershipPlanRepository;

import java.util.List;

/**
 * Plan catalogue. Price changes never touch existing memberships, which keep the amount
 * captured when they were created.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MembershipPlanService {

    private final MembershipPlanRepository membershipPlanRepository;
    private final ModelMapper modelMapper;

    @Transactional(readOnly = true)
    public List<MembershipPlanResponse> getActivePlans() {
        return membershipPlanRepository.findByActiveTrueOrderByPriceAsc().stream()
                .map(modelMapper::toMembershipPlanResponse)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<MembershipPlanResponse> getAllPlans() {
        return membershipPlanRepository.findAll().stream()
                .map(modelMapper::toMembershipPlanResponse)
                .toList();
    }

    @Transactional
    public MembershipPlanResponse createPlan(MembershipPlanRequest request) {
        if (membershipPlanRepository.existsByName(request.getName().trim())) {
            throw new BusinessLogicException("A plan with this name already exists");
        }
        MembershipPlan plan = membershipPlanRepository.save(MembershipPlan.builder()
                .name(request.getName().trim())
                .description(request.getDescription())
                .price(request.getPrice())
                .durationDays(request.getDurationDays())
                .active(request.isActive())
                .build());
        log.info("Created membership plan '{}' ({} days, {})", plan.getName(), plan.getDurationDays(), plan.getPrice());
        return modelMapper.toMembershipPlanResponse(plan);
    }

    @Transactional
    public MembershipPlanResponse updatePlan(Long planId, MembershipPlanRequest request) {
        MembershipPlan plan = membershipPlanRepository.findById(planId)
                .orElseThrow(() -> new ResourceNotFoundException("Membership plan not found with id: " + planId));
        String name = request.getName().trim();
        if (!name.equals(plan.getName()) && membershipPlanRepository.existsByName(name)) {
            throw new BusinessLogicException("A plan with this name already exists");
        }
        plan.setName(name);
        plan.setDescription(request.getDescription());
        plan.setPrice(request.getPrice());
        plan.setDurationDays(request.getDurationDays());
        plan.setActive(request.isActive());
        log.info("Updated membership plan {}", planId);
        return modelMapper.toMembershipPlanResponse(membershipPlanRepository.save(plan));
    }
}
