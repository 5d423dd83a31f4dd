package io.interval4j.core;

import java.util.Locale;
import java.util.Optional;

/**
 * Misfire-handling codes understood by calendar-interval triggers.
 *
 * <p>Values are the ones the Quartz firing engine uses, so descriptors can be handed over
 * without translation.
 */
public enum MisfireInstruction {

    /**
     * Defer to the firing engine's default resolution. Shared by every trigger kind.
     */
    SMART_POLICY(0),

    /**
     * Fire every missed execution as soon as possible. Shared by every trigger kind.
     */
    IGNORE_MISFIRE_POLICY(-1),

    /**
     * Fire once now, then resume the regular schedule.
     */
    FIRE_ONCE_NOW(1),

    /**
     * Skip missed executions and wait for the next scheduled fire time.
     */
    DO_NOTHING(2);

    private static final String QUARTZ_PREFIX = "MISFIRE_INSTRUCTION_";

    private final int value;

    MisfireInstruction(int value) {
        this.value = value;
    }

    public int value() {
        return value;
    }

    /**
     * Look up the instruction for a raw code. Empty for codes outside the documented set.
     */
    public static Optional<MisfireInstruction> fromValue(int value) {
        for (MisfireInstruction instruction : values()) {
            if (instruction.value == value) {
                return Optional.of(instruction);
            }
        }
        return Optional.empty();
    }

    /**
     * Resolve a policy name such as {@code "do-nothing"}, {@code "FIRE_ONCE_NOW"} or
     * {@code "MISFIRE_INSTRUCTION_IGNORE_MISFIRE_POLICY"}.
     */
    public static MisfireInstruction parse(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("misfire instruction name must not be blank");
        }

        String normalized = name.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        if (normalized.startsWith(QUARTZ_PREFIX)) {
            normalized = normalized.substring(QUARTZ_PREFIX.length());
        }

        for (MisfireInstruction instruction : values()) {
            if (instruction.name().equals(normalized)) {
                return instruction;
            }
        }
        throw new IllegalArgumentException("Unsupported misfire instruction: " + name);
    }
}
