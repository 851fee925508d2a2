package se.ironpass_be.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PartialPaymentsConfig {
    private boolean enabled;
    private int deadlineDays;
    private int gracePeriodDays;
    private boolean allowAccessWithPartial;
    private boolean requirePaymentToActivate;
}
