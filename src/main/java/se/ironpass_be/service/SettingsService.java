package se.ironpass_be.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import se.ironpass_be.dto.PartialPaymentsConfig;
import se.ironpass_be.exception.BusinessLogicException;
import se.ironpass_be.pojo.GymSetting;
import se.ironpass_be.repository.GymSettingRepository;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Gym-wide settings stored as key/value rows. Every read falls back to the built-in default
 * when a key is missing or its value cannot be parsed, so a bad row never blocks the door.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SettingsService {

    public static final String GYM_NAME = "gym_name";
    public static final String TIMEZONE = "timezone";
    public static final String QR_DURATION_SECONDS = "qr_duration_seconds";
    public static final String QR_RECENT_ACCESS_MINUTES = "qr_recent_access_minutes";
    public static final String MOROSITY_TOLERANCE_DAYS = "morosity_tolerance_days";
    public static final String PARTIAL_PAYMENTS_ENABLED = "partial_payments_enabled";
    public static final String PARTIAL_PAYMENTS_DEADLINE_DAYS = "partial_payments_deadline_days";
    public static final String PARTIAL_PAYMENTS_GRACE_DAYS = "partial_payments_grace_days";
    public static final String PARTIAL_PAYMENTS_ALLOW_ACCESS = "partial_payments_allow_access";
    public static final String REQUIRE_PAYMENT_TO_ACTIVATE = "require_payment_to_activate";

    public static final Map<String, String> DEFAULT_SETTINGS;

    private static final Set<String> INTEGER_KEYS = Set.of(
            QR_DURATION_SECONDS, QR_RECENT_ACCESS_MINUTES, MOROSITY_TOLERANCE_DAYS,
            PARTIAL_PAYMENTS_DEADLINE_DAYS, PARTIAL_PAYMENTS_GRACE_DAYS);

    private static final Set<String> BOOLEAN_KEYS = Set.of(
            PARTIAL_PAYMENTS_ENABLED, PARTIAL_PAYMENTS_ALLOW_ACCESS, REQUIRE_PAYMENT_TO_ACTIVATE);

    static {
        Map<String, String> defaults = new LinkedHashMap<>();
        defaults.put(GYM_NAME, "IronPass Gym");
        defaults.put(TIMEZONE, "America/Bogota");
        defaults.put(MOROSITY_TOLERANCE_DAYS, "5");
        defaults.put(QR_DURATION_SECONDS, "30");
        defaults.put(QR_RECENT_ACCESS_MINUTES, "10");
        defaults.put(PARTIAL_PAYMENTS_ENABLED, "false");
        defaults.put(PARTIAL_PAYMENTS_DEADLINE_DAYS, "15");
        defaults.put(PARTIAL_PAYMENTS_GRACE_DAYS, "5");
        defaults.put(PARTIAL_PAYMENTS_ALLOW_ACCESS, "true");
        defaults.put(REQUIRE_PAYMENT_TO_ACTIVATE, "false");
        DEFAULT_SETTINGS = Collections.unmodifiableMap(defaults);
    }

    private final GymSettingRepository gymSettingRepository;

    /**
     * Defaults overlaid with whatever is stored.
     */
    @Transactional(readOnly = true)
    public Map<String, String> getAllSettings() {
        Map<String, String> settings = new LinkedHashMap<>(DEFAULT_SETTINGS);
        for (GymSetting setting : gymSettingRepository.findAll()) {
            if (setting.getValue() != null && !setting.getValue().isBlank()) {
                settings.put(setting.getSettingKey(), setting.getValue());
            }
        }
        return settings;
    }

    @Transactional(readOnly = true)
    public String getString(String key) {
        return gymSettingRepository.findById(key)
                .map(GymSetting::getValue)
                .filter(value -> !value.isBlank())
                .orElse(DEFAULT_SETTINGS.get(key));
    }

    @Transactional(readOnly = true)
    public int getInt(String key) {
        return parseInt(key, getString(key));
    }

    @Transactional(readOnly = true)
    public boolean getBoolean(String key) {
        return parseBoolean(key, getString(key));
    }

    public int getQrDurationSeconds() {
        return getInt(QR_DURATION_SECONDS);
    }

    public int getRecentAccessMinutes() {
        return getInt(QR_RECENT_ACCESS_MINUTES);
    }

    public int getMorosityToleranceDays() {
        return getInt(MOROSITY_TOLERANCE_DAYS);
    }

    public ZoneId getZoneId() {
        String zone = getString(TIMEZONE);
        try {
            return ZoneId.of(zone);
        } catch (DateTimeException e) {
            log.warn("Invalid value '{}' for setting {}, falling back to {}", zone, TIMEZONE, DEFAULT_SETTINGS.get(TIMEZONE));
            return ZoneId.of(DEFAULT_SETTINGS.get(TIMEZONE));
        }
    }

    // One round trip for the five partial payment keys
    @Transactional(readOnly = true)
    public PartialPaymentsConfig getPartialPaymentsConfig() {
        Map<String, String> settings = getAllSettings();
        return PartialPaymentsConfig.builder()
                .enabled(parseBoolean(PARTIAL_PAYMENTS_ENABLED, settings.get(PARTIAL_PAYMENTS_ENABLED)))
                .deadlineDays(parseInt(PARTIAL_PAYMENTS_DEADLINE_DAYS, settings.get(PARTIAL_PAYMENTS_DEADLINE_DAYS)))
                .gracePeriodDays(parseInt(PARTIAL_PAYMENTS_GRACE_DAYS, settings.get(PARTIAL_PAYMENTS_GRACE_DAYS)))
                .allowAccessWithPartial(parseBoolean(PARTIAL_PAYMENTS_ALLOW_ACCESS, settings.get(PARTIAL_PAYMENTS_ALLOW_ACCESS)))
                .requirePaymentToActivate(parseBoolean(REQUIRE_PAYMENT_TO_ACTIVATE, settings.get(REQUIRE_PAYMENT_TO_ACTIVATE)))
                .build();
    }

    @Transactional
    public Map<String, String> updateSettings(Map<String, String> updates) {
        updates.forEach((key, value) -> {
            validate(key, value);
            GymSetting setting = gymSettingRepository.findById(key)
                    .orElseGet(() -> GymSetting.builder().settingKey(key).build());
            setting.setValue(value.trim());
            gymSettingRepository.save(setting);
            log.info("Setting {} updated to '{}'", key, value.trim());
        });
        return getAllSettings();
    }

    /**
     * Writes the defaults for keys that have no row yet. Existing values are left alone.
     *
     * @return number of rows created
     */
    @Transactional
    public int seedDefaultSettings() {
        int created = 0;
        for (Map.Entry<String, String> entry : DEFAULT_SETTINGS.entrySet()) {
            if (!gymSettingRepository.existsById(entry.getKey())) {
                gymSettingRepository.save(GymSetting.builder()
                        .settingKey(entry.getKey())
                        .value(entry.getValue())
                        .build());
                created++;
            }
        }
        return created;
    }

    private void validate(String key, String value) {
        if (!DEFAULT_SETTINGS.containsKey(key)) {
            throw new BusinessLogicException("Unknown setting: " + key);
        }
        if (value == null) {
            throw new BusinessLogicException("Setting " + key + " requires a value");
        }
        String trimmed = value.trim();
        if (INTEGER_KEYS.contains(key)) {
            try {
                if (Integer.parseInt(trimmed) < 0) {
                    throw new BusinessLogicException("Setting " + key + " cannot be negative");
                }
            } catch (NumberFormatException e) {
                throw new BusinessLogicException("Setting " + key + " must be a whole number");
            }
            if (QR_DURATION_SECONDS.equals(key) && Integer.parseInt(trimmed) == 0) {
                throw new BusinessLogicException("QR duration must be at least one second");
            }
        }
        if (BOOLEAN_KEYS.contains(key) && !"true".equalsIgnoreCase(trimmed) && !"false".equalsIgnoreCase(trimmed)) {
            throw new BusinessLogicException("Setting " + key + " must be true or false");
        }
        if (TIMEZONE.equals(key)) {
            try {
                ZoneId.of(trimmed);
            } catch (DateTimeException e) {
                throw new BusinessLogicException("Unknown timezone: " + trimmed);
            }
        }
    }

    private int parseInt(String key, String value) {
        String fallback = DEFAULT_SETTINGS.get(key);
        if (value == null) {
            return Integer.parseInt(fallback);
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid value '{}' for setting {}, falling back to {}", value, key, fallback);
            return Integer.parseInt(fallback);
        }
    }

    private boolean parseBoolean(String key, String value) {
        if (value != null) {
            String trimmed = value.trim();
            if ("true".equalsIgnoreCase(trimmed)) {
                return true;
            }
            if ("false".equalsIgnoreCase(trimmed)) {
                return false;
            }
            log.warn("Invalid value '{}' for setting {}, falling back to {}", value, key, DEFAULT_SETTINGS.get(key));
        }
        return Boolean.parseBoolean(DEFAULT_SETTINGS.get(key));
    }
}
