package io.interval4j;

/**
 * Produces the schedule half of a trigger.
 *
 * <p>Implementations accumulate schedule settings through a fluent API; the trigger-assembly
 * layer calls {@link #build()} and adds identity, job binding and start/end bounds itself.
 *
 * @param <T> the trigger descriptor type produced
 */
public interface ScheduleBuilder<T> {

    /**
     * Build a new descriptor from the current settings. Must not reset the builder.
     */
    T build();
}
