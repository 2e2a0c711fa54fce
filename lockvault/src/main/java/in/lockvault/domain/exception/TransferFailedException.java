package in.lockvault.domain.exception;

import in.lockvault.domain.common.VaultErrorCode;

import java.math.BigDecimal;

/**
 * The payout of a withdrawal failed. The withdrawal was rolled back and the deposit is untouched.
 */
public class TransferFailedException extends VaultException {

    private final int depositIndex;

    public TransferFailedException(String account, int depositIndex, BigDecimal amount, String message) {
        super(VaultErrorCode.TRANSFER_FAILED,
            String.format("Payout of %s to %s for deposit #%d failed: %s",
                amount.toPlainString(), account, depositIndex, message));
        this.depositIndex = depositIndex;
    }

    public TransferFailedException(String account, int depositIndex, BigDecimal amount,
                                   String message, Throwable cause) {
        super(VaultErrorCode.TRANSFER_FAILED,
            String.format("Payout of %s to %s for deposit #%d failed: %s",
                amount.toPlainString(), account, depositIndex, message), cause);
        this.depositIndex = depositIndex;
    }

    public int getDepositIndex() {
        return depositIndex;
    }
}
