package in.lockvault.domain.deposit;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class DepositRecordTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    @Test
    void stateAdvancesOnlyOnceLockRunsOut() {
        DepositRecord record = DepositRecord.open(BigDecimal.ONE, T0, LockPeriod.SHORT).withIndex(0);
        Instant lockUntil = T0.plus(LockPeriod.SHORT.getDuration());

        assertEquals(lockUntil, record.lockUntil());
        assertSame(record, record.advanceState(lockUntil.minusSeconds(1)));
        assertEquals(DepositState.UNLOCKED, record.advanceState(lockUntil).state());
    }

    @Test
    void zeroedSlotKeepsItsIndex() {
        DepositRecord zeroed = DepositRecord.open(new BigDecimal("2.5"), T0, LockPeriod.MEDIUM).withIndex(3).zeroed();

        assertEquals(3, zeroed.index());
        assertEquals(0, zeroed.amount().signum());
        assertEquals(Instant.EPOCH, zeroed.createdAt());
        assertEquals(Instant.EPOCH, zeroed.lockUntil());
        assertEquals(DepositState.UNLOCKED, zeroed.state());
        assertTrue(zeroed.withdrawn());
        assertFalse(zeroed.isActiveAt(T0));
    }
}
