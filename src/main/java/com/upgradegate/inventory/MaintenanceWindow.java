package com.upgradegate.inventory;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Collection;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Recurring window during which upgrades may start.
 *
 * <p>Hours are {@code [startHour, endHour)} in {@code zone}. When
 * {@code startHour > endHour} the window wraps past midnight and the
 * early-morning part belongs to the day the window opened. Equal hours
 * mean the whole day. An empty {@code allowedDays} set allows every day.</p>
 */
public record MaintenanceWindow(
    @JsonProperty("start_hour") int startHour,
    @JsonProperty("end_hour") int endHour,
    @JsonProperty("allowed_days") Set<DayOfWeek> allowedDays,
    @JsonProperty("zone") ZoneId zone
) {

    public MaintenanceWindow {
        if (startHour < 0 || startHour > 23) {
            throw new IllegalArgumentException("start_hour must be within 0..23, got " + startHour);
        }
        if (endHour < 1 || endHour > 24) {
            throw new IllegalArgumentException("end_hour must be within 1..24, got " + endHour);
        }
        allowedDays = allowedDays == null || allowedDays.isEmpty()
            ? Set.of()
            : Set.copyOf(EnumSet.copyOf(allowedDays));
        zone = zone != null ? zone : ZoneId.of("UTC");
    }

    public static MaintenanceWindow of(int startHour, int endHour, Collection<String> dayNames, String zone) {
        Set<DayOfWeek> days = dayNames == null
            ? Set.of()
            : dayNames.stream()
                .map(name -> DayOfWeek.valueOf(name.trim().toUpperCase(Locale.ROOT)))
                .collect(Collectors.toSet());
        return new MaintenanceWindow(startHour, endHour, days,
            zone == null || zone.isBlank() ? ZoneId.of("UTC") : ZoneId.of(zone));
    }

    public boolean contains(Instant instant) {
        ZonedDateTime local = instant.atZone(zone);
        int hour = local.getHour();
        DayOfWeek day = local.getDayOfWeek();

        if (startHour == endHour % 24) {
            return dayAllowed(day);
        }
        if (startHour < endHour) {
            return hour >= startHour && hour < endHour && dayAllowed(day);
        }
        if (hour >= startHour) {
            return dayAllowed(day);
        }
        return hour < endHour && dayAllowed(day.minus(1));
    }

    public String describe() {
        String days = allowedDays.isEmpty()
            ? "any day"
            : allowedDays.stream()
                .sorted()
                .map(d -> d.name().toLowerCase(Locale.ROOT))
                .collect(Collectors.joining(","));
        return String.format("%02d:00-%02d:00 %s (%s)", startHour, endHour, zone.getId(), days);
    }

    private boolean dayAllowed(DayOfWeek day) {
        return allowedDays.isEmpty() || allowedDays.contains(day);
    }
}
