package in.lockvault.domain.role;

import in.lockvault.domain.deposit.LockPeriod;

import java.math.BigDecimal;

/**
 * Ordered issuance rules, evaluated once per deposit. The first matching rule wins;
 * a single deposit never yields two roles.
 */
public enum RoleRule {
    LONG_LOCK(Role.LONG_TERM_COMMITTER) {
        @Override
        public boolean matches(DepositContext ctx) {
            return ctx.amount().compareTo(ONE_UNIT) >= 0 && ctx.lockPeriod() == LockPeriod.LONG;
        }
    },
    REPEAT_DEPOSITS(Role.FREQUENT_DEPOSITOR) {
        @Override
        public boolean matches(DepositContext ctx) {
            return ctx.amount().compareTo(ONE_UNIT) >= 0 && ctx.depositCount() >= FREQUENT_DEPOSIT_COUNT;
        }
    },
    LARGE_AMOUNT(Role.BIG_DEPOSITOR) {
        @Override
        public boolean matches(DepositContext ctx) {
            return ctx.amount().compareTo(BIG_DEPOSIT) >= 0;
        }
    },
    MIN_ACTIVITY(Role.ACTIVE_PARTICIPANT) {
        @Override
        public boolean matches(DepositContext ctx) {
            return ctx.amount().compareTo(ACTIVITY_FLOOR) > 0;
        }
    };

    public static final BigDecimal ONE_UNIT = BigDecimal.ONE;
    public static final BigDecimal BIG_DEPOSIT = new BigDecimal("5");
    public static final BigDecimal ACTIVITY_FLOOR = new BigDecimal("0.001");
    public static final int FREQUENT_DEPOSIT_COUNT = 3;

    private final Role role;

    RoleRule(Role role) {
        this.role = role;
    }

    public Role getRole() {
        return role;
    }

    public abstract boolean matches(DepositContext ctx);

    /**
     * Inputs to rule evaluation for one deposit.
     *
     * @param depositCount number of records the account holds including this one
     */
    public record DepositContext(BigDecimal amount, LockPeriod lockPeriod, int depositCount) {}
}
