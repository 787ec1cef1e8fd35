package com.spotladder.application.config;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/** Comma-separated decimals, e.g. {@code 0.02,0.05,0.08}. */
public final class DecimalList {

    private DecimalList() {
    }

    public static List<BigDecimal> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("empty decimal list");
        }
        List<BigDecimal> out = new ArrayList<>();
        for (String part : raw.split(",")) {
            String t = part.trim();
            if (t.isEmpty()) continue;
            try {
                out.add(new BigDecimal(t));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("not a decimal: " + t, e);
            }
        }
        if (out.isEmpty()) {
            throw new IllegalArgumentException("empty decimal list");
        }
        return List.copyOf(out);
    }
}
