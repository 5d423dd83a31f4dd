package io.interval4j;

/**
 * Persisted form of a calendar-interval schedule.
 *
 * <p>Field names match the JSON stored by callers:
 * <pre>
 *   { "repeatInterval": 3, "repeatIntervalUnit": "MONTH", "misfireInstruction": 2 }
 * </pre>
 * A missing {@code misfireInstruction} means the smart policy.
 */
public class ScheduleDocument {

    private Integer repeatInterval;
    private String repeatIntervalUnit;
    private Integer misfireInstruction;

    public ScheduleDocument() {
    }

    public Integer getRepeatInterval() {
        return repeatInterval;
    }

    public void setRepeatInterval(Integer repeatInterval) {
        this.repeatInterval = repeatInterval;
    }

    public String getRepeatIntervalUnit() {
        return repeatIntervalUnit;
    }

    public void setRepeatIntervalUnit(String repeatIntervalUnit) {
        this.repeatIntervalUnit = repeatIntervalUnit;
    }

    public Integer getMisfireInstruction() {
        return misfireInstruction;
    }

    public void setMisfireInstruction(Integer misfireInstruction) {
        this.misfireInstruction = misfireInstruction;
    }
}
