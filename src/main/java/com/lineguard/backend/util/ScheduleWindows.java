package com.lineguard.backend.util;

import com.lineguard.backend.model.RouteSchedule;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Monitoring window arithmetic, always in the route's local timezone.
 */
public final class ScheduleWindows {

    private ScheduleWindows() {
    }

    public static String dayCode(DayOfWeek day) {
        return day.name().substring(0, 3);
    }

    /** Inclusive on both ends. */
    public static boolean isWithinWindow(LocalTime now, String day, RouteSchedule schedule) {
        if (schedule.getDaysOfWeek() == null || !schedule.getDaysOfWeek().contains(day)) {
            return false;
        }
        LocalTime start = LocalTime.parse(schedule.getStartTime());
        LocalTime end = LocalTime.parse(schedule.getEndTime());
        return !now.isBefore(start) && !now.isAfter(end);
    }

    public static Optional<RouteSchedule> findActiveSchedule(List<RouteSchedule> schedules, ZonedDateTime nowLocal) {
        if (schedules == null) {
            return Optional.empty();
        }
        String day = dayCode(nowLocal.getDayOfWeek());
        LocalTime time = nowLocal.toLocalTime();
        return schedules.stream()
                .filter(s -> isWithinWindow(time, day, s))
                .findFirst();
    }

    /**
     * Whole seconds from {@code nowLocal} until today's {@code endTime} in
     * {@code zone}. Zero or negative once the window has closed.
     */
    public static long secondsUntilEnd(ZonedDateTime now, ZoneId zone, LocalTime endTime) {
        ZonedDateTime nowLocal = now.withZoneSameInstant(zone);
        ZonedDateTime end = nowLocal.toLocalDate().atTime(endTime).atZone(zone);
        return Duration.between(nowLocal, end).getSeconds();
    }
}
