package se.ironpass_be.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import se.ironpass_be.pojo.Payment;

import java.math.BigDecimal;
import java.util.List;

public interface PaymentRepository extends JpaRepository<Payment, Long> {

    List<Payment> findByMembershipMembershipIdAndCancelledAtIsNull(Long membershipId);

    List<Payment> findByMemberMemberIdOrderByPaidAtDesc(Long memberId);

    // Cancelled payments never count towards the paid amount
    @Query("SELECT COALESCE(SUM(p.amount), 0) FROM Payment p " +
           "WHERE p.membership.membershipId = :membershipId AND p.cancelledAt IS NULL")
    BigDecimal sumActiveAmountByMembership(@Param("membershipId") Long membershipId);
}
