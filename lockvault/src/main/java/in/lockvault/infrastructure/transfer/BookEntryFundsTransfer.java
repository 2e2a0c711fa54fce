package in.lockvault.infrastructure.transfer;

import in.lockvault.application.port.output.FundsTransfer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Funds transfer that credits an internal per-account payout balance.
 *
 * An optional per-payout ceiling makes larger payouts fail, which stands in for a
 * recipient that refuses the transfer.
 */
public final class BookEntryFundsTransfer implements FundsTransfer {
    private static final Logger log = LoggerFactory.getLogger(BookEntryFundsTransfer.class);

    private final Map<String, BigDecimal> paidOut = new ConcurrentHashMap<>();
    private final BigDecimal payoutCeiling;

    public BookEntryFundsTransfer() {
        this(null);
    }

    /**
     * @param payoutCeiling largest single payout accepted, null for no limit
     */
    public BookEntryFundsTransfer(BigDecimal payoutCeiling) {
        this.payoutCeiling = payoutCeiling;
    }

    @Override
    public boolean transfer(String account, BigDecimal amount) {
        if (payoutCeiling != null && amount.compareTo(payoutCeiling) > 0) {
            log.warn("Payout of {} to {} refused: above ceiling {}",
                amount.toPlainString(), account, payoutCeiling.toPlainString());
            return false;
        }
        paidOut.merge(account, amount, BigDecimal::add);
        log.debug("Paid {} to {}, {} paid in total", amount.toPlainString(), account,
            paidOutTo(account).toPlainString());
        return true;
    }

    public BigDecimal paidOutTo(String account) {
        return paidOut.getOrDefault(account, BigDecimal.ZERO);
    }
}
