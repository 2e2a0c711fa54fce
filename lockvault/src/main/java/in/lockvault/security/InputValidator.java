package in.lockvault.security;

import in.lockvault.domain.common.VaultErrorCode;
import in.lockvault.domain.exception.VaultException;

import java.math.BigDecimal;
import java.util.regex.Pattern;

/**
 * Input validator for request data reaching the vault.
 *
 * Validation Rules:
 * - Accounts: 0x-prefixed 40-hex-digit address, or a plain id (a-z, A-Z, 0-9, _, -) of at most 64 chars
 *   that does not start with 0x
 * - Amounts: at most 18 decimal places, below 10^30
 * - Indexes: non-negative
 *
 * Usage:
 * <pre>
 * InputValidator validator = new InputValidator();
 * validator.validateAccount(request.account());   // Throws VaultException(INVALID_ACCOUNT)
 * validator.validateAmount(request.amount());     // Throws IllegalArgumentException
 * </pre>
 */
public class InputValidator {

    private static final Pattern ADDRESS_PATTERN = Pattern.compile("^0x[0-9a-fA-F]{40}$");
    private static final Pattern ACCOUNT_ID_PATTERN = Pattern.compile("^[a-zA-Z0-9_-]+$");

    private static final int MAX_ACCOUNT_LENGTH = 64;
    private static final int MAX_AMOUNT_SCALE = 18;
    private static final BigDecimal MAX_AMOUNT = new BigDecimal("1e30");
    private static final int MAX_STRING_LENGTH = 1000;

    /**
     * Check account identifier format.
     *
     * @param account Account identifier
     * @return true if valid
     */
    public boolean isValidAccount(String account) {
        if (account == null || account.isBlank()) {
            return false;
        }

        if (account.length() > MAX_ACCOUNT_LENGTH) {
            return false;
        }

        // 0x-prefixed ids must be well-formed addresses
        if (account.startsWith("0x") || account.startsWith("0X")) {
            return ADDRESS_PATTERN.matcher(account).matches();
        }

        return ACCOUNT_ID_PATTERN.matcher(account).matches();
    }

    /**
     * @throws VaultException INVALID_ACCOUNT if the identifier is malformed
     */
    public String validateAccount(String account) {
        if (!isValidAccount(account)) {
            throw new VaultException(VaultErrorCode.INVALID_ACCOUNT, "Malformed account: " + sanitize(account));
        }
        return account;
    }

    /**
     * Validate amount precision and magnitude. Sign is left to the ledger, which reports ZERO_AMOUNT.
     *
     * @param amount Deposit amount
     * @throws IllegalArgumentException if invalid
     */
    public void validateAmount(BigDecimal amount) {
        if (amount == null) {
            throw new IllegalArgumentException("Amount cannot be null");
        }

        if (amount.stripTrailingZeros().scale() > MAX_AMOUNT_SCALE) {
            throw new IllegalArgumentException("Amount scale must be <= " + MAX_AMOUNT_SCALE + " decimal places: " + amount);
        }

        if (amount.abs().compareTo(MAX_AMOUNT) >= 0) {
            throw new IllegalArgumentException("Amount exceeds maximum: " + amount.toPlainString());
        }
    }

    /**
     * @throws IllegalArgumentException if negative
     */
    public void validateIndex(int index) {
        if (index < 0) {
            throw new IllegalArgumentException("Index must be non-negative: " + index);
        }
    }

    /**
     * Trim, drop control characters and cap length. Used before echoing input into messages.
     */
    public String sanitize(String input) {
        if (input == null) {
            return null;
        }

        String result = input.trim().replaceAll("\\p{Cntrl}", "");

        if (result.length() > MAX_STRING_LENGTH) {
            result = result.substring(0, MAX_STRING_LENGTH);
        }

        return result;
    }
}
