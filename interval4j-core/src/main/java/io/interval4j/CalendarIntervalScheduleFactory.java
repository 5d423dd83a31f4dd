package io.interval4j;

import io.interval4j.core.IntervalUnit;
import io.interval4j.core.MisfireInstruction;

import java.util.Objects;

/**
 * Hands out new {@link CalendarIntervalScheduleBuilder}s pre-configured with application-wide
 * defaults. Immutable, safe to share.
 */
public class CalendarIntervalScheduleFactory {

    private final int defaultInterval;
    private final IntervalUnit defaultUnit;
    private final MisfireInstruction defaultMisfireInstruction;

    public CalendarIntervalScheduleFactory(int defaultInterval,
                                           IntervalUnit defaultUnit,
                                           MisfireInstruction defaultMisfireInstruction) {
        this.defaultUnit = Objects.requireNonNull(defaultUnit, "defaultUnit must not be null");
        this.defaultMisfireInstruction = Objects.requireNonNull(
                defaultMisfireInstruction, "defaultMisfireInstruction must not be null");
        if (defaultInterval <= 0) {
            throw new IllegalArgumentException("defaultInterval must be a positive value: " + defaultInterval);
        }
        this.defaultInterval = defaultInterval;
    }

    /**
     * Factory matching {@link CalendarIntervalScheduleBuilder#create()}.
     */
    public static CalendarIntervalScheduleFactory withBuiltInDefaults() {
        return new CalendarIntervalScheduleFactory(1, IntervalUnit.DAY, MisfireInstruction.SMART_POLICY);
    }

    /**
     * A new builder on every call; builders are never shared between callers.
     */
    public CalendarIntervalScheduleBuilder newSchedule() {
        return CalendarIntervalScheduleBuilder.create()
                .withInterval(defaultInterval, defaultUnit)
                .withMisfireHandlingInstruction(defaultMisfireInstruction);
    }

    public TriggerDescriptor defaults() {
        return newSchedule().build();
    }

    public int getDefaultInterval() {
        return defaultInterval;
    }

    public IntervalUnit getDefaultUnit() {
        return defaultUnit;
    }

    public MisfireInstruction getDefaultMisfireInstruction() {
        return defaultMisfireInstruction;
    }
}
