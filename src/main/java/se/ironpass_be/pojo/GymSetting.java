package se.ironpass_be.pojo;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;

@Entity
@Table(name = "gym_settings")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class GymSetting {

    @Id
    @Column(name = "setting_key", length = 100)
    private String settingKey;

    @Column(name = "setting_value", nullable = false, columnDefinition = "text")
    private String value;

    @UpdateTimestamp
    private Instant updatedAt;
}
