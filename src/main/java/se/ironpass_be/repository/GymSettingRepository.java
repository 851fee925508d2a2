package se.ironpass_be.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import se.ironpass_be.pojo.GymSetting;

public interface GymSettingRepository extends JpaRepository<GymSetting, String> {
}
