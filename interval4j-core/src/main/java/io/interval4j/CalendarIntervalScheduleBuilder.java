package io.interval4j;

import io.interval4j.core.IntervalUnit;
import io.interval4j.core.MisfireInstruction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Fluent builder for calendar-interval schedules (every N seconds, days, months, ...).
 *
 * <p>Typical usage:
 * <pre>{@code
 * TriggerDescriptor trigger = CalendarIntervalScheduleBuilder.create()
 *         .withIntervalInMonths(3)
 *         .withMisfireHandlingInstructionDoNothing()
 *         .build();
 * }</pre>
 *
 * <p>Note:
 * <ul>
 *   <li>every {@code with...} call mutates this builder and returns the same instance</li>
 *   <li>build(): returns a new descriptor and leaves the builder as it was, so one builder can
 *   produce several descriptors</li>
 *   <li>not thread-safe; configure and build within one unit of work</li>
 * </ul>
 */
public final class CalendarIntervalScheduleBuilder implements ScheduleBuilder<TriggerDescriptor> {
    private static final Logger log = LoggerFactory.getLogger(CalendarIntervalScheduleBuilder.class);

    private int interval = 1;
    private IntervalUnit intervalUnit = IntervalUnit.DAY;

    private int misfireInstruction = MisfireInstruction.SMART_POLICY.value();

    private CalendarIntervalScheduleBuilder() {
    }

    /**
     * Create a builder with defaults: every 1 DAY, smart misfire policy.
     */
    public static CalendarIntervalScheduleBuilder create() {
        return new CalendarIntervalScheduleBuilder();
    }

    @Override
    public TriggerDescriptor build() {
        TriggerDescriptor descriptor = new TriggerDescriptor();
        descriptor.setRepeatInterval(interval);
        descriptor.setRepeatIntervalUnit(intervalUnit);
        descriptor.setMisfireInstruction(misfireInstruction);
        return descriptor;
    }

    /**
     * Set the interval and its unit together. Neither changes if the interval is rejected.
     *
     * @throws IllegalArgumentException if {@code interval <= 0}
     */
    public CalendarIntervalScheduleBuilder withInterval(int interval, IntervalUnit unit) {
        validateInterval(interval);
        Objects.requireNonNull(unit, "unit must not be null");

        this.interval = interval;
        this.intervalUnit = unit;
        return this;
    }

    public CalendarIntervalScheduleBuilder withIntervalInSeconds(int intervalInSeconds) {
        return withInterval(intervalInSeconds, IntervalUnit.SECOND);
    }

    public CalendarIntervalScheduleBuilder withIntervalInMinutes(int intervalInMinutes) {
        return withInterval(intervalInMinutes, IntervalUnit.MINUTE);
    }

    public CalendarIntervalScheduleBuilder withIntervalInHours(int intervalInHours) {
        return withInterval(intervalInHours, IntervalUnit.HOUR);
    }

    public CalendarIntervalScheduleBuilder withIntervalInDays(int intervalInDays) {
        return withInterval(intervalInDays, IntervalUnit.DAY);
    }

    public CalendarIntervalScheduleBuilder withIntervalInWeeks(int intervalInWeeks) {
        return withInterval(intervalInWeeks, IntervalUnit.WEEK);
    }

    public CalendarIntervalScheduleBuilder withIntervalInMonths(int intervalInMonths) {
        return withInterval(intervalInMonths, IntervalUnit.MONTH);
    }

    public CalendarIntervalScheduleBuilder withIntervalInYears(int intervalInYears) {
        return withInterval(intervalInYears, IntervalUnit.YEAR);
    }

    /**
     * On misfire, fire every missed execution as soon as possible.
     */
    public CalendarIntervalScheduleBuilder withMisfireHandlingInstructionIgnoreMisfires() {
        this.misfireInstruction = MisfireInstruction.IGNORE_MISFIRE_POLICY.value();
        return this;
    }

    /**
     * On misfire, skip and wait for the next scheduled fire time.
     */
    public CalendarIntervalScheduleBuilder withMisfireHandlingInstructionDoNothing() {
        this.misfireInstruction = MisfireInstruction.DO_NOTHING.value();
        return this;
    }

    /**
     * On misfire, fire once now and then resume the schedule.
     */
    public CalendarIntervalScheduleBuilder withMisfireHandlingInstructionFireAndProceed() {
        this.misfireInstruction = MisfireInstruction.FIRE_ONCE_NOW.value();
        return this;
    }

    /**
     * Set the misfire policy by name.
     */
    public CalendarIntervalScheduleBuilder withMisfireHandlingInstruction(MisfireInstruction instruction) {
        Objects.requireNonNull(instruction, "instruction must not be null");
        this.misfireInstruction = instruction.value();
        return this;
    }

    /**
     * Set a raw misfire code without validation.
     *
     * <p>Only for trusted callers restoring a previously persisted schedule. The firing engine
     * decides whether the code is legal.
     */
    CalendarIntervalScheduleBuilder withMisfireHandlingInstruction(int rawInstruction) {
        if (MisfireInstruction.fromValue(rawInstruction).isEmpty()) {
            log.warn("Accepting unrecognized misfire instruction {} for calendar-interval schedule", rawInstruction);
        }
        this.misfireInstruction = rawInstruction;
        return this;
    }

    private static void validateInterval(int interval) {
        if (interval <= 0) {
            throw new IllegalArgumentException("Interval must be a positive value.");
        }
    }
}
