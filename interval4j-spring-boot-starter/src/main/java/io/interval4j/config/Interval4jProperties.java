package io.interval4j.config;

import io.interval4j.core.IntervalUnit;
import io.interval4j.core.MisfireInstruction;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Application-wide defaults for calendar-interval schedules.
 */
@ConfigurationProperties(prefix = "interval4j")
public class Interval4jProperties {
    private boolean enabled = true;
    private int defaultInterval = 1;
    private IntervalUnit defaultUnit = IntervalUnit.DAY;
    private MisfireInstruction defaultMisfireInstruction = MisfireInstruction.SMART_POLICY;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public int getDefaultInterval() {
        return defaultInterval;
    }

    public void setDefaultInterval(int defaultInterval) {
        this.defaultInterval = defaultInterval;
    }

    public IntervalUnit getDefaultUnit() {
        return defaultUnit;
    }

    public void setDefaultUnit(IntervalUnit defaultUnit) {
        this.defaultUnit = defaultUnit;
    }

    public MisfireInstruction getDefaultMisfireInstruction() {
        return defaultMisfireInstruction;
    }

    public void setDefaultMisfireInstruction(MisfireInstruction defaultMisfireInstruction) {
        this.defaultMisfireInstruction = defaultMisfireInstruction;
    }
}
