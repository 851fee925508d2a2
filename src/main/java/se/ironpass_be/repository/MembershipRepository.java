package se.ironpass_be.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;
import se.ironpass_be.pojo.Membership;
import se.ironpass_be.pojo.enums.MembershipStatus;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface MembershipRepository extends JpaRepository<Membership, Long> {

    // Latest end date first, the "current" membership of a member is the first row
    @Query("SELECT m FROM Membership m JOIN FETCH m.plan " +
           "WHERE m.member.memberId = :memberId AND m.status IN :statuses " +
           "ORDER BY m.endsAt DESC")
    List<Membership> findByMemberAndStatuses(@Param("memberId") Long memberId,
                                             @Param("statuses") Collection<MembershipStatus> statuses);

    default Optional<Membership> findLatestByMemberAndStatuses(Long memberId, Collection<MembershipStatus> statuses) {
        return findByMemberAndStatuses(memberId, statuses).stream().findFirst();
    }

    Optional<Membership> findFirstByMemberMemberIdAndStatusOrderByCreatedAtDesc(Long memberId, MembershipStatus status);

    List<Membership> findByMemberMemberIdOrderByCreatedAtDesc(Long memberId);

    @Query("SELECT m FROM Membership m JOIN FETCH m.member JOIN FETCH m.plan WHERE m.status = :status")
    List<Membership> findByStatusWithDetails(@Param("status") MembershipStatus status);

    // Rows in the given status that ended before the cutoff, oldest first
    @Query("SELECT m FROM Membership m JOIN FETCH m.member JOIN FETCH m.plan " +
           "WHERE m.status = :status AND m.endsAt <= :cutoff ORDER BY m.endsAt ASC")
    List<Membership> findByStatusEndedBefore(@Param("status") MembershipStatus status,
                                             @Param("cutoff") Instant cutoff);

    @Modifying
    @Transactional
    @Query("UPDATE Membership m SET m.status = :to, m.updatedAt = :now " +
           "WHERE m.status = :from AND m.endsAt <= :now")
    int transitionLapsed(@Param("from") MembershipStatus from,
                         @Param("to") MembershipStatus to,
                         @Param("now") Instant now);
}
