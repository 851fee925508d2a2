package se.ironpass_be.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import se.ironpass_be.pojo.StaffUser;

import java.util.Optional;

public interface StaffUserRepository extends JpaRepository<StaffUser, Long> {
    Optional<StaffUser> findByEmail(String email);
    boolean existsByEmail(String email);
}
