package se.ironpass_be.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import se.ironpass_be.pojo.MembershipPlan;

import java.util.List;

public interface MembershipPlanRepository extends JpaRepository<MembershipPlan, Long> {
    List<MembershipPlan> findByActiveTrueOrderByPriceAsc();
    boolean existsByName(String name);
}
