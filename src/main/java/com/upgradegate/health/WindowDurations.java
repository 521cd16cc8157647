package com.upgradegate.health;

import java.time.Duration;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses look-back windows written as an integer and a unit: s, m, h, d or w.
 */
public final class WindowDurations {

    private static final Pattern WINDOW = Pattern.compile("^\\s*(\\d+)\\s*([smhdwSMHDW])\\s*$");

    private WindowDurations() {
    }

    public static Duration parse(String window) {
        if (window == null) {
            throw new IllegalArgumentException("window is required");
        }
        Matcher matcher = WINDOW.matcher(window);
        if (!matcher.matches()) {
            throw new IllegalArgumentException("window must look like 30m, 2h or 1d, got: " + window);
        }
        long value = Long.parseLong(matcher.group(1));
        if (value == 0) {
            throw new IllegalArgumentException("window must be positive, got: " + window);
        }
        return switch (matcher.group(2).toLowerCase(Locale.ROOT)) {
            case "s" -> Duration.ofSeconds(value);
            case "m" -> Duration.ofMinutes(value);
            case "h" -> Duration.ofHours(value);
            case "d" -> Duration.ofDays(value);
            case "w" -> Duration.ofDays(value * 7);
            default -> throw new IllegalArgumentException("unsupported window unit: " + window);
        };
    }
}
