package com.apex.guardian.service.risk;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Weekly UTC trading windows, e.g. {@code {"Monday":[["09:00","17:00"]]}}. Both window ends are
 * inclusive and a weekday without windows allows no trading.
 *
 * A schedule that fails to parse is kept as {@link #isMalformed() malformed} rather than rejected.
 */
public final class TradingSchedule {

    private static final DateTimeFormatter WINDOW_FORMAT = DateTimeFormatter.ofPattern("HH:mm");
    private static final TypeReference<Map<String, List<List<String>>>> SCHEDULE_TYPE = new TypeReference<>() {};

    private final Map<DayOfWeek, List<Window>> windows;
    private final String parseError;

    public record Window(LocalTime start, LocalTime end) {

        boolean contains(LocalTime time) {
            return !time.isBefore(start) && !time.isAfter(end);
        }
    }

    private TradingSchedule(Map<DayOfWeek, List<Window>> windows, String parseError) {
        this.windows = windows;
        this.parseError = parseError;
    }

    public static TradingSchedule empty() {
        return new TradingSchedule(Collections.emptyMap(), null);
    }

    public static TradingSchedule parse(String json, ObjectMapper objectMapper) {
        if (json == null || json.isBlank()) {
            return empty();
        }
        try {
            Map<String, List<List<String>>> raw = objectMapper.readValue(json, SCHEDULE_TYPE);
            Map<DayOfWeek, List<Window>> parsed = new EnumMap<>(DayOfWeek.class);
            for (Map.Entry<String, List<List<String>>> day : raw.entrySet()) {
                DayOfWeek dayOfWeek = DayOfWeek.valueOf(day.getKey().trim().toUpperCase(Locale.ROOT));
                List<Window> dayWindows = new ArrayList<>();
                for (List<String> pair : day.getValue() == null ? List.<List<String>>of() : day.getValue()) {
                    if (pair == null || pair.size() != 2) {
                        throw new IllegalArgumentException("window must be [start, end] on " + day.getKey());
                    }
                    dayWindows.add(new Window(LocalTime.parse(pair.get(0).trim(), WINDOW_FORMAT),
                            LocalTime.parse(pair.get(1).trim(), WINDOW_FORMAT)));
                }
                parsed.put(dayOfWeek, List.copyOf(dayWindows));
            }
            return new TradingSchedule(Collections.unmodifiableMap(parsed), null);
        } catch (Exception e) {
            return new TradingSchedule(Collections.emptyMap(), e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    public boolean isMalformed() {
        return parseError != null;
    }

    public String parseError() {
        return parseError;
    }

    public List<Window> windowsFor(DayOfWeek day) {
        return windows.getOrDefault(day, List.of());
    }

    public boolean allows(Instant instant) {
        if (isMalformed()) {
            throw new IllegalStateException("Malformed schedule: " + parseError);
        }
        ZonedDateTime utc = instant.atZone(ZoneOffset.UTC);
        LocalTime time = utc.toLocalTime();
        return windowsFor(utc.getDayOfWeek()).stream().anyMatch(window -> window.contains(time));
    }
}
