package com.priceprediction.engine;

import java.util.Locale;

/** Lenient matching of display labels ("Off-Plan Properties", "OffPlan", "OFF_PLAN"). */
final class Labels {

    private Labels() {
    }

    static String key(String value) {
        return value.toUpperCase(Locale.ROOT).replaceAll("[^A-Z0-9]", "");
    }

    static boolean matches(String value, String label, String constant) {
        String k = key(value);
        return k.equals(key(label)) || k.equals(key(constant));
    }
}
