package com.ordoAetheris.pthreadext.sync;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DeadlineClock, Timeouts, SyncResult")
class DeadlineClockTest {

    @Nested
    @DisplayName("DeadlineClock")
    class Clock {

        @Test
        @DisplayName("deadline lies timeout ms after the call")
        void deadlineIsRelativeToNow() {
            long before = System.nanoTime();
            long deadline = DeadlineClock.toDeadline(1_500);
            long after = System.nanoTime();

            long nanos = TimeUnit.MILLISECONDS.toNanos(1_500);
            assertTrue(deadline - before >= nanos);
            assertTrue(deadline - after <= nanos);
        }

        @Test
        @DisplayName("remaining time shrinks and goes non-positive once passed")
        void remainingRunsOut() throws Exception {
            long deadline = DeadlineClock.toDeadline(20);
            assertTrue(DeadlineClock.remainingNanos(deadline) > 0);
            Thread.sleep(40);
            assertTrue(DeadlineClock.remainingNanos(deadline) <= 0);
        }

        @Test
        @DisplayName("huge timeouts do not overflow into the past")
        void hugeTimeoutStaysInFuture() {
            long deadline = DeadlineClock.toDeadline(Long.MAX_VALUE);
            assertTrue(DeadlineClock.remainingNanos(deadline) > TimeUnit.DAYS.toNanos(365));
        }
    }

    @Nested
    @DisplayName("Timeouts")
    class TimeoutModes {

        @Test
        @DisplayName("FOREVER, POLL and positive values are valid")
        void validValues() {
            assertTrue(Timeouts.isValid(Timeouts.FOREVER));
            assertTrue(Timeouts.isValid(Timeouts.POLL));
            assertTrue(Timeouts.isValid(1));
            assertTrue(Timeouts.isValid(Long.MAX_VALUE));
        }

        @Test
        @DisplayName("other negatives are rejected")
        void negativeValues() {
            assertFalse(Timeouts.isValid(-2));
            assertFalse(Timeouts.isValid(Long.MIN_VALUE));
        }

        @Test
        @DisplayName("only positive timeouts compute a deadline")
        void boundedOnlyForPositive() {
            assertFalse(Timeouts.isBounded(Timeouts.FOREVER));
            assertFalse(Timeouts.isBounded(Timeouts.POLL));
            assertTrue(Timeouts.isBounded(250));
            assertEquals(0L, ConditionWait.deadlineFor(Timeouts.FOREVER));
            assertEquals(0L, ConditionWait.deadlineFor(Timeouts.POLL));
        }
    }

    @Nested
    @DisplayName("SyncResult")
    class Results {

        @Test
        @DisplayName("errno values match POSIX (Linux)")
        void errnoValues() {
            assertEquals(0, SyncResult.SUCCESS.errno());
            assertEquals(12, SyncResult.OUT_OF_MEMORY.errno());
            assertEquals(22, SyncResult.INVALID_ARGUMENT.errno());
            assertEquals(110, SyncResult.TIMED_OUT.errno());
            assertEquals(125, SyncResult.CANCELED.errno());
        }

        @Test
        @DisplayName("fromErrno maps back and rejects unknown codes")
        void fromErrno() {
            for (SyncResult r : SyncResult.values()) {
                assertSame(r, SyncResult.fromErrno(r.errno()));
            }
            assertThrows(IllegalArgumentException.class, () -> SyncResult.fromErrno(4));
        }

        @Test
        @DisplayName("only SUCCESS is a success")
        void isSuccess() {
            assertTrue(SyncResult.SUCCESS.isSuccess());
            assertFalse(SyncResult.TIMED_OUT.isSuccess());
            assertFalse(SyncResult.CANCELED.isSuccess());
        }
    }
}
