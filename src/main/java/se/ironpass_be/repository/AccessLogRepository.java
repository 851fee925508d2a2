package se.ironpass_be.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import se.ironpass_be.pojo.AccessLog;

import java.time.Instant;
import java.util.Optional;

public interface AccessLogRepository extends JpaRepository<AccessLog, Long>, JpaSpecificationExecutor<AccessLog> {

    Optional<AccessLog> findFirstByMemberMemberIdAndAllowedTrueAndAccessedAtGreaterThanEqualOrderByAccessedAtDesc(
            Long memberId, Instant since);

    long countByAccessedAtGreaterThanEqual(Instant since);

    long countByAllowedAndAccessedAtGreaterThanEqual(boolean allowed, Instant since);

    long countByMemberMemberId(Long memberId);
}
