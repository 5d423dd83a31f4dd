package io.interval4j.quartz;

import io.interval4j.TriggerDescriptor;
import io.interval4j.core.IntervalUnit;
import org.quartz.CalendarIntervalTrigger;
import org.quartz.DateBuilder;
import org.quartz.impl.triggers.CalendarIntervalTriggerImpl;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Converts between {@link TriggerDescriptor} and Quartz calendar-interval triggers.
 *
 * <p>Quartz validates the misfire code when it is set, so an illegal raw code restored from
 * storage fails here rather than in the builder.
 */
public final class QuartzTriggers {
    private static final Logger log = LoggerFactory.getLogger(QuartzTriggers.class);

    private QuartzTriggers() {
    }

    /**
     * Populate a new Quartz trigger with the descriptor's schedule. Identity, job binding and
     * start time are left for the caller.
     *
     * @throws IllegalArgumentException if the interval is not positive or Quartz rejects the
     *                                  misfire code
     */
    public static CalendarIntervalTriggerImpl toMutableTrigger(TriggerDescriptor descriptor) {
        Objects.requireNonNull(descriptor, "descriptor must not be null");
        Objects.requireNonNull(descriptor.getRepeatIntervalUnit(), "repeatIntervalUnit must not be null");
        // Quartz itself accepts 0
        if (descriptor.getRepeatInterval() <= 0) {
            throw new IllegalArgumentException("Interval must be a positive value.");
        }

        CalendarIntervalTriggerImpl trigger = new CalendarIntervalTriggerImpl();
        trigger.setRepeatInterval(descriptor.getRepeatInterval());
        trigger.setRepeatIntervalUnit(toQuartzUnit(descriptor.getRepeatIntervalUnit()));
        trigger.setMisfireInstruction(descriptor.getMisfireInstruction());

        log.debug("Mapped {} to Quartz calendar-interval trigger", descriptor);
        return trigger;
    }

    /**
     * Read the schedule half of an existing Quartz trigger.
     *
     * @throws IllegalArgumentException for {@code MILLISECOND} intervals
     */
    public static TriggerDescriptor fromTrigger(CalendarIntervalTrigger trigger) {
        Objects.requireNonNull(trigger, "trigger must not be null");

        TriggerDescriptor descriptor = new TriggerDescriptor();
        descriptor.setRepeatInterval(trigger.getRepeatInterval());
        descriptor.setRepeatIntervalUnit(fromQuartzUnit(trigger.getRepeatIntervalUnit()));
        descriptor.setMisfireInstruction(trigger.getMisfireInstruction());
        return descriptor;
    }

    static DateBuilder.IntervalUnit toQuartzUnit(IntervalUnit unit) {
        return DateBuilder.IntervalUnit.valueOf(unit.name());
    }

    static IntervalUnit fromQuartzUnit(DateBuilder.IntervalUnit unit) {
        Objects.requireNonNull(unit, "unit must not be null");
        if (unit == DateBuilder.IntervalUnit.MILLISECOND) {
            throw new IllegalArgumentException("Unsupported interval unit for calendar schedules: " + unit);
        }
        return IntervalUnit.valueOf(unit.name());
    }
}
