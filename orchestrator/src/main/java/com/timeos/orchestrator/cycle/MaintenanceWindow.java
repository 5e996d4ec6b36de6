package com.timeos.orchestrator.cycle;

import com.timeos.orchestrator.pipeline.StageSchedule;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Optional;

/**
 * Daily low-activity window: the stage is due once per window, on the first
 * cycle that falls inside {@code [startHour, endHour)} local time.
 * A window may wrap midnight (e.g. 22 to 4).
 */
public class MaintenanceWindow implements StageSchedule {

    private final ZoneId zone;
    private final int    startHour;
    private final int    endHour;

    public MaintenanceWindow(ZoneId zone, int startHour, int endHour) {
        if (startHour < 0 || startHour > 23 || endHour < 0 || endHour > 24 || startHour == endHour) {
            throw new IllegalArgumentException(
                    "invalid maintenance window " + startHour + "h-" + endHour + "h");
        }
        this.zone      = zone;
        this.startHour = startHour;
        this.endHour   = endHour;
    }

    @Override
    public boolean isDue(Instant now, Optional<Instant> lastRunAt) {
        Optional<Instant> opened = currentWindowStart(now);
        if (opened.isEmpty()) {
            return false;
        }
        return lastRunAt.map(last -> last.isBefore(opened.get())).orElse(true);
    }

    /** Start of the window containing {@code now}, or empty outside any window. */
    Optional<Instant> currentWindowStart(Instant now) {
        ZonedDateTime local = now.atZone(zone);
        int       hour  = local.getHour();
        LocalDate today = local.toLocalDate();

        if (startHour < endHour) {
            return hour >= startHour && hour < endHour
                    ? Optional.of(today.atTime(startHour, 0).atZone(zone).toInstant())
                    : Optional.empty();
        }
        if (hour >= startHour) {
            return Optional.of(today.atTime(startHour, 0).atZone(zone).toInstant());
        }
        if (hour < endHour) {
            return Optional.of(today.minusDays(1).atTime(startHour, 0).atZone(zone).toInstant());
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return "daily " + startHour + "h-" + endHour + "h " + zone;
    }
}
