package io.interval4j;

import io.interval4j.core.IntervalUnit;
import io.interval4j.core.MisfireInstruction;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

class CalendarIntervalScheduleBuilderTest {

    @Test
    void buildWithoutConfigurationShouldUseDefaults() {
        TriggerDescriptor descriptor = CalendarIntervalScheduleBuilder.create().build();

        assertEquals(1, descriptor.getRepeatInterval());
        assertEquals(IntervalUnit.DAY, descriptor.getRepeatIntervalUnit());
        assertEquals(MisfireInstruction.SMART_POLICY.value(), descriptor.getMisfireInstruction());
    }

    @ParameterizedTest
    @ValueSource(ints = {1, 15, 59, 1440, Integer.MAX_VALUE})
    void withIntervalInMinutesShouldKeepSmartPolicy(int minutes) {
        TriggerDescriptor descriptor = CalendarIntervalScheduleBuilder.create()
                .withIntervalInMinutes(minutes)
                .build();

        assertEquals(minutes, descriptor.getRepeatInterval());
        assertEquals(IntervalUnit.MINUTE, descriptor.getRepeatIntervalUnit());
        assertEquals(MisfireInstruction.SMART_POLICY.value(), descriptor.getMisfireInstruction());
    }

    @ParameterizedTest
    @EnumSource(IntervalUnit.class)
    void nonPositiveIntervalShouldBeRejectedWithoutMutation(IntervalUnit unit) {
        CalendarIntervalScheduleBuilder builder = CalendarIntervalScheduleBuilder.create()
                .withIntervalInHours(6);

        for (int interval : new int[]{0, -1, Integer.MIN_VALUE}) {
            IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                    () -> builder.withInterval(interval, unit));
            assertEquals("Interval must be a positive value.", ex.getMessage());
        }

        TriggerDescriptor descriptor = builder.build();
        assertEquals(6, descriptor.getRepeatInterval());
        assertEquals(IntervalUnit.HOUR, descriptor.getRepeatIntervalUnit());
    }

    @Test
    void unitShortcutsShouldRejectNonPositiveIntervals() {
        CalendarIntervalScheduleBuilder builder = CalendarIntervalScheduleBuilder.create();

        assertThrows(IllegalArgumentException.class, () -> builder.withIntervalInSeconds(0));
        assertThrows(IllegalArgumentException.class, () -> builder.withIntervalInMinutes(-5));
        assertThrows(IllegalArgumentException.class, () -> builder.withIntervalInHours(0));
        assertThrows(IllegalArgumentException.class, () -> builder.withIntervalInDays(-1));
        assertThrows(IllegalArgumentException.class, () -> builder.withIntervalInWeeks(0));
        assertThrows(IllegalArgumentException.class, () -> builder.withIntervalInMonths(-12));
        assertThrows(IllegalArgumentException.class, () -> builder.withIntervalInYears(0));

        assertEquals(CalendarIntervalScheduleBuilder.create().build(), builder.build());
    }

    @Test
    void unitShortcutsShouldSetMatchingUnit() {
        assertEquals(IntervalUnit.SECOND, CalendarIntervalScheduleBuilder.create().withIntervalInSeconds(2).build().getRepeatIntervalUnit());
        assertEquals(IntervalUnit.MINUTE, CalendarIntervalScheduleBuilder.create().withIntervalInMinutes(2).build().getRepeatIntervalUnit());
        assertEquals(IntervalUnit.HOUR, CalendarIntervalScheduleBuilder.create().withIntervalInHours(2).build().getRepeatIntervalUnit());
        assertEquals(IntervalUnit.DAY, CalendarIntervalScheduleBuilder.create().withIntervalInDays(2).build().getRepeatIntervalUnit());
        assertEquals(IntervalUnit.WEEK, CalendarIntervalScheduleBuilder.create().withIntervalInWeeks(2).build().getRepeatIntervalUnit());
        assertEquals(IntervalUnit.MONTH, CalendarIntervalScheduleBuilder.create().withIntervalInMonths(2).build().getRepeatIntervalUnit());
        assertEquals(IntervalUnit.YEAR, CalendarIntervalScheduleBuilder.create().withIntervalInYears(2).build().getRepeatIntervalUnit());
    }

    @Test
    void nullUnitShouldBeRejectedWithoutMutation() {
        CalendarIntervalScheduleBuilder builder = CalendarIntervalScheduleBuilder.create();

        assertThrows(NullPointerException.class, () -> builder.withInterval(5, null));

        assertEquals(1, builder.build().getRepeatInterval());
        assertEquals(IntervalUnit.DAY, builder.build().getRepeatIntervalUnit());
    }

    @Test
    void zeroDayIntervalShouldLeaveDefaultsIntact() {
        CalendarIntervalScheduleBuilder builder = CalendarIntervalScheduleBuilder.create();

        assertThrows(IllegalArgumentException.class, () -> builder.withInterval(0, IntervalUnit.DAY));

        TriggerDescriptor descriptor = builder.build();
        assertEquals(1, descriptor.getRepeatInterval());
        assertEquals(IntervalUnit.DAY, descriptor.getRepeatIntervalUnit());
        assertEquals(MisfireInstruction.SMART_POLICY.value(), descriptor.getMisfireInstruction());
    }

    @Test
    void misfireSettersShouldSetDocumentedCodes() {
        assertEquals(-1, CalendarIntervalScheduleBuilder.create()
                .withMisfireHandlingInstructionIgnoreMisfires().build().getMisfireInstruction());
        assertEquals(2, CalendarIntervalScheduleBuilder.create()
                .withIntervalInWeeks(3)
                .withMisfireHandlingInstructionDoNothing().build().getMisfireInstruction());
        assertEquals(1, CalendarIntervalScheduleBuilder.create()
                .withIntervalInYears(1)
                .withMisfireHandlingInstructionFireAndProceed().build().getMisfireInstruction());
    }

    @Test
    void misfireSettersShouldNotTouchInterval() {
        TriggerDescriptor descriptor = CalendarIntervalScheduleBuilder.create()
                .withIntervalInMonths(3)
                .withMisfireHandlingInstructionFireAndProceed()
                .withMisfireHandlingInstructionIgnoreMisfires()
                .build();

        assertEquals(3, descriptor.getRepeatInterval());
        assertEquals(IntervalUnit.MONTH, descriptor.getRepeatIntervalUnit());
        assertEquals(MisfireInstruction.IGNORE_MISFIRE_POLICY.value(), descriptor.getMisfireInstruction());
    }

    @ParameterizedTest
    @EnumSource(MisfireInstruction.class)
    void namedPolicySetterShouldSetEnumValue(MisfireInstruction instruction) {
        TriggerDescriptor descriptor = CalendarIntervalScheduleBuilder.create()
                .withMisfireHandlingInstructionDoNothing()
                .withMisfireHandlingInstruction(instruction)
                .build();

        assertEquals(instruction.value(), descriptor.getMisfireInstruction());
    }

    @Test
    void namedPolicySetterShouldRejectNull() {
        CalendarIntervalScheduleBuilder builder = CalendarIntervalScheduleBuilder.create();
        assertThrows(NullPointerException.class, () -> builder.withMisfireHandlingInstruction((MisfireInstruction) null));
    }

    @Test
    void rawSetterShouldAcceptAnyCode() {
        TriggerDescriptor descriptor = CalendarIntervalScheduleBuilder.create()
                .withMisfireHandlingInstruction(42)
                .build();

        assertEquals(42, descriptor.getMisfireInstruction());
        assertEquals(1, descriptor.getRepeatInterval());
    }

    @Test
    void lastUnitSetterShouldWin() {
        TriggerDescriptor descriptor = CalendarIntervalScheduleBuilder.create()
                .withIntervalInHours(2)
                .withIntervalInDays(3)
                .build();

        assertEquals(3, descriptor.getRepeatInterval());
        assertEquals(IntervalUnit.DAY, descriptor.getRepeatIntervalUnit());
    }

    @Test
    void repeatedBuildShouldReturnEqualButIndependentDescriptors() {
        CalendarIntervalScheduleBuilder builder = CalendarIntervalScheduleBuilder.create()
                .withIntervalInWeeks(2)
                .withMisfireHandlingInstructionDoNothing();

        TriggerDescriptor first = builder.build();
        TriggerDescriptor second = builder.build();

        assertEquals(first, second);
        assertNotSame(first, second);

        first.setRepeatInterval(99);
        assertEquals(2, second.getRepeatInterval());
        assertEquals(2, builder.build().getRepeatInterval());
    }

    @Test
    void buildShouldReflectLaterConfiguration() {
        CalendarIntervalScheduleBuilder builder = CalendarIntervalScheduleBuilder.create();
        TriggerDescriptor before = builder.build();

        builder.withIntervalInSeconds(45);
        TriggerDescriptor after = builder.build();

        assertEquals(1, before.getRepeatInterval());
        assertEquals(45, after.getRepeatInterval());
        assertEquals(IntervalUnit.SECOND, after.getRepeatIntervalUnit());
    }

    @Test
    void configurationCallsShouldReturnSameBuilder() {
        CalendarIntervalScheduleBuilder builder = CalendarIntervalScheduleBuilder.create();

        assertSame(builder, builder.withInterval(4, IntervalUnit.WEEK));
        assertSame(builder, builder.withIntervalInSeconds(1));
        assertSame(builder, builder.withMisfireHandlingInstructionIgnoreMisfires());
        assertSame(builder, builder.withMisfireHandlingInstructionDoNothing());
        assertSame(builder, builder.withMisfireHandlingInstructionFireAndProceed());
        assertSame(builder, builder.withMisfireHandlingInstruction(MisfireInstruction.SMART_POLICY));
    }

    @Test
    void thirtySecondsDoNothingScenario() {
        TriggerDescriptor descriptor = CalendarIntervalScheduleBuilder.create()
                .withIntervalInSeconds(30)
                .withMisfireHandlingInstructionDoNothing()
                .build();

        TriggerDescriptor expected = new TriggerDescriptor();
        expected.setRepeatInterval(30);
        expected.setRepeatIntervalUnit(IntervalUnit.SECOND);
        expected.setMisfireInstruction(MisfireInstruction.DO_NOTHING.value());

        assertEquals(expected, descriptor);
    }
}
