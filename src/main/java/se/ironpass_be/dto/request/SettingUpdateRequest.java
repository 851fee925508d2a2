package se.ironpass_be.dto.request;

import jakarta.validation.constraints.NotEmpty;
import lombok.Data;

import java.util.Map;

@Data
public class SettingUpdateRequest {

    @NotEmpty(message = "At least one setting is required")
    private Map<String, String> settings;
}
