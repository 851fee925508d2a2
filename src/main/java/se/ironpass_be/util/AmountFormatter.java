package se.ironpass_be.util;

import java.math.BigDecimal;
import java.text.NumberFormat;
import java.util.Locale;

public final class AmountFormatter {

    private AmountFormatter() {
    }

    // 100000.00 -> "$100,000", 40000.50 -> "$40,000.5"
    public static String format(BigDecimal amount) {
        NumberFormat format = NumberFormat.getNumberInstance(Locale.US);
        format.setMinimumFractionDigits(0);
        format.setMaximumFractionDigits(2);
        return "$" + format.format(amount == null ? BigDecimal.ZERO : amount);
    }
}
