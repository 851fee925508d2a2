package se.ironpass_be.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class OverdueStatus {
    private boolean overdue;
    private long daysPastDue;
    private BigDecimal overdueAmount;

    public static OverdueStatus notOverdue() {
        return new OverdueStatus(false, 0, BigDecimal.ZERO);
    }
}
