package in.lockvault.application.port.output;

import java.math.BigDecimal;

/**
 * Currency payout primitive used on withdrawal.
 *
 * A transfer either moves the full amount or moves nothing. Returning false or throwing both
 * mean nothing moved.
 */
public interface FundsTransfer {

    boolean transfer(String account, BigDecimal amount);
}
