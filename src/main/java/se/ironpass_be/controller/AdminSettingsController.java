package se.ironpass_be.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;
import se.ironpass_be.dto.request.SettingUpdateRequest;
import se.ironpass_be.dto.response.ApiResponse;
import se.ironpass_be.service.SettingsService;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/admin/settings")
@Tag(name = "Admin - Settings", description = "[ADMIN] Gym-wide runtime settings")
@PreAuthorize("hasRole('ADMIN')")
@RequiredArgsConstructor
public class AdminSettingsController {

    private final SettingsService settingsService;

    @GetMapping
    public ResponseEntity<ApiResponse<Map<String, String>>> getSettings() {
        return ResponseEntity.ok(ApiResponse.success(settingsService.getAllSettings()));
    }

    @Operation(summary = "Update settings", description = "Unknown keys and malformed values are rejected as a whole request.")
    @PatchMapping
    public ResponseEntity<ApiResponse<Map<String, String>>> updateSettings(@Valid @RequestBody SettingUpdateRequest request) {
        return ResponseEntity.ok(ApiResponse.success("Settings updated", settingsService.updateSettings(request.getSettings())));
    }
}
