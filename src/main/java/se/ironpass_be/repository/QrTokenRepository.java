package se.ironpass_be.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;
import se.ironpass_be.pojo.QrToken;

import java.time.Instant;
import java.util.Optional;

public interface QrTokenRepository extends JpaRepository<QrToken, Long> {

    @Query("SELECT t FROM QrToken t JOIN FETCH t.member WHERE t.tokenHash = :tokenHash")
    Optional<QrToken> findByTokenHash(@Param("tokenHash") String tokenHash);

    /**
     * Compare-and-set on {@code usedAt}: the row is claimed only if nobody claimed it before.
     * Runs in its own transaction so the claim is committed before the caller goes on.
     *
     * @return 1 for the caller that won the token, 0 for everybody else
     */
    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("UPDATE QrToken t SET t.usedAt = :usedAt WHERE t.id = :id AND t.usedAt IS NULL")
    int markUsedIfUnused(@Param("id") Long id, @Param("usedAt") Instant usedAt);

    @Modifying
    @Transactional
    @Query("DELETE FROM QrToken t WHERE t.expiresAt <= :cutoff")
    int deleteAllExpiredBefore(@Param("cutoff") Instant cutoff);
}
