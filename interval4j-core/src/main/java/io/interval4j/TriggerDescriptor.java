package io.interval4j;

import io.interval4j.core.IntervalUnit;
import io.interval4j.core.MisfireInstruction;

import java.util.Objects;
import java.util.Optional;

/**
 * Schedule settings of a calendar-interval trigger, produced by
 * {@link CalendarIntervalScheduleBuilder#build()}.
 *
 * <p>Mutable: the trigger-assembly layer owns the instance once it is built and may adjust it
 * before registering the trigger.
 */
public class TriggerDescriptor {

    private int repeatInterval;
    private IntervalUnit repeatIntervalUnit;
    private int misfireInstruction;

    public TriggerDescriptor() {
    }

    public int getRepeatInterval() {
        return repeatInterval;
    }

    public void setRepeatInterval(int repeatInterval) {
        this.repeatInterval = repeatInterval;
    }

    public IntervalUnit getRepeatIntervalUnit() {
        return repeatIntervalUnit;
    }

    public void setRepeatIntervalUnit(IntervalUnit repeatIntervalUnit) {
        this.repeatIntervalUnit = repeatIntervalUnit;
    }

    public int getMisfireInstruction() {
        return misfireInstruction;
    }

    public void setMisfireInstruction(int misfireInstruction) {
        this.misfireInstruction = misfireInstruction;
    }

    /**
     * The stored code as a known policy, empty if it was restored from a raw code outside the
     * documented set.
     */
    public Optional<MisfireInstruction> getMisfirePolicy() {
        return MisfireInstruction.fromValue(misfireInstruction);
    }

    /**
     * Rebuild a schedule builder that reproduces this descriptor, misfire code included.
     *
     * @throws IllegalArgumentException if the stored interval is not positive
     */
    public CalendarIntervalScheduleBuilder getScheduleBuilder() {
        return CalendarIntervalScheduleBuilder.create()
                .withInterval(repeatInterval, repeatIntervalUnit)
                .withMisfireHandlingInstruction(misfireInstruction);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TriggerDescriptor that)) return false;
        return repeatInterval == that.repeatInterval
                && misfireInstruction == that.misfireInstruction
                && repeatIntervalUnit == that.repeatIntervalUnit;
    }

    @Override
    public int hashCode() {
        return Objects.hash(repeatInterval, repeatIntervalUnit, misfireInstruction);
    }

    @Override
    public String toString() {
        return "TriggerDescriptor{"
                + "repeatInterval=" + repeatInterval
                + ", repeatIntervalUnit=" + repeatIntervalUnit
                + ", misfireInstruction=" + misfireInstruction
                + '}';
    }
}
