package com.priceprediction.service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.Locale;

/** Presentation rounding and compact price strings ("2.09M", "850K"). */
final class PriceFormat {

    static final double RANGE_SPREAD = 0.10;

    private PriceFormat() {
    }

    static double round2(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }

    static String compact(double price) {
        if (price >= 1_000_000) {
            double millions = price / 1_000_000;
            return millions >= 10
                ? String.format(Locale.ROOT, "%.1fM", millions)
                : String.format(Locale.ROOT, "%.2fM", millions);
        }
        if (price >= 1_000) {
            return String.format(Locale.ROOT, "%.0fK", price / 1_000);
        }
        return String.format(Locale.ROOT, "%.0f", price);
    }

    static String grouped(double price) {
        DecimalFormat format = new DecimalFormat("#,##0", DecimalFormatSymbols.getInstance(Locale.ROOT));
        return format.format(price) + " AED";
    }
}
