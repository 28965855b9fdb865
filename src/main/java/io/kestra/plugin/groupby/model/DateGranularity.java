package io.kestra.plugin.groupby.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import java.util.Locale;

/**
 * Bucket a timestamp is floored to before grouping. Timestamps are UTC instants.
 */
public enum DateGranularity {
    SECOND("S"),
    MINUTE("T"),
    HOUR("H"),
    DAY("D"),
    WEEK("W"),
    MONTH("M"),
    QUARTER("Q"),
    YEAR("Y");

    private final String code;

    DateGranularity(String code) {
        this.code = code;
    }

    /**
     * Accepts the lower-case name ({@code "month"}) or the legacy one-letter code ({@code "M"}).
     */
    @JsonCreator
    public static DateGranularity from(String value) {
        if (value == null) {
            throw new IllegalArgumentException("date granularity is required");
        }
        String trimmed = value.trim();
        for (DateGranularity granularity : values()) {
            if (granularity.code.equals(trimmed)) {
                return granularity;
            }
        }
        for (DateGranularity granularity : values()) {
            if (granularity.unit().equals(trimmed.toLowerCase(Locale.ROOT))) {
                return granularity;
            }
        }
        throw new IllegalArgumentException("Unsupported date granularity: " + value);
    }

    public String code() {
        return code;
    }

    @JsonValue
    public String unit() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Finer than a day: the bucket is a rounded timestamp rather than a calendar date.
     */
    public boolean isSubDaily() {
        return this == SECOND || this == MINUTE || this == HOUR;
    }

    public Instant floor(Instant instant) {
        if (isSubDaily()) {
            ChronoUnit unit = switch (this) {
                case SECOND -> ChronoUnit.SECONDS;
                case MINUTE -> ChronoUnit.MINUTES;
                default -> ChronoUnit.HOURS;
            };
            return instant.truncatedTo(unit);
        }
        LocalDate date = LocalDate.ofInstant(instant, ZoneOffset.UTC);
        LocalDate start = switch (this) {
            case WEEK -> date.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
            case MONTH -> date.withDayOfMonth(1);
            case QUARTER -> LocalDate.of(date.getYear(), (date.getMonthValue() - 1) / 3 * 3 + 1, 1);
            case YEAR -> date.withDayOfYear(1);
            default -> date;
        };
        return start.atStartOfDay(ZoneOffset.UTC).toInstant();
    }
}
