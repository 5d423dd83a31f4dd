package io.interval4j.core;

/**
 * Calendar granularity used to interpret a repeat interval.
 *
 * <p>The interval is an opaque multiplier: "3 MONTH" is not a fixed number of seconds, the
 * firing engine resolves it against the calendar.
 */
public enum IntervalUnit {
    SECOND,
    MINUTE,
    HOUR,
    DAY,
    WEEK,
    MONTH,
    YEAR
}
