package io.jobs4j.core;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JobFlagsTest {

    @Test
    void hasShouldRequireEveryBitWhileHasAnyNeedsOne() {
        JobFlags flags = new JobFlags();
        flags.set(JobFlags.KILLED);

        assertTrue(flags.hasAny(JobFlags.DONE));
        assertFalse(flags.has(JobFlags.DONE));
        assertTrue(flags.has(JobFlags.KILLED));
    }

    @Test
    void setWithValueShouldSetAndClear() {
        JobFlags flags = new JobFlags();
        flags.set(JobFlags.IS_IDLING | JobFlags.STOPPED, true);
        flags.set(JobFlags.IS_IDLING, false);

        assertFalse(flags.has(JobFlags.IS_IDLING));
        assertTrue(flags.has(JobFlags.STOPPED));
        assertEquals(JobFlags.STOPPED, flags.get());
    }

    @Test
    void setUnlessShouldRefuseWhenBlockingBitIsSet() {
        JobFlags flags = new JobFlags();

        assertTrue(flags.setUnless(JobFlags.TOLD_TO_STOP, JobFlags.TOLD_TO_FINISH));
        flags.set(JobFlags.TOLD_TO_BE_KILLED);
        flags.clear(JobFlags.TOLD_TO_STOP);

        assertFalse(flags.setUnless(JobFlags.TOLD_TO_STOP, JobFlags.TOLD_TO_FINISH));
        assertFalse(flags.has(JobFlags.TOLD_TO_STOP));
    }
}
