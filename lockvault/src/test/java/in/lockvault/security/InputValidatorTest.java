package in.lockvault.security;

import in.lockvault.domain.common.VaultErrorCode;
import in.lockvault.domain.exception.VaultException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for InputValidator.
 */
@DisplayName("Input Validator Tests")
public class InputValidatorTest {

    private InputValidator validator;

    @BeforeEach
    public void setUp() {
        validator = new InputValidator();
    }

    @Test
    @DisplayName("Valid accounts pass validation")
    public void testValidAccounts() {
        assertTrue(validator.isValidAccount("0x52908400098527886E0F7030069857D2E4169EE7"));
        assertTrue(validator.isValidAccount("0xde709f2102306220921060314715629080e2fb77"));
        assertTrue(validator.isValidAccount("vault-admin"));
        assertTrue(validator.isValidAccount("member_42"));
    }

    @Test
    @DisplayName("Invalid accounts fail validation")
    public void testInvalidAccounts() {
        assertFalse(validator.isValidAccount(null));
        assertFalse(validator.isValidAccount(""));
        assertFalse(validator.isValidAccount("   "));
        assertFalse(validator.isValidAccount("0x1234"));
        assertFalse(validator.isValidAccount("0x52908400098527886E0F7030069857D2E4169EZ7"));
        assertFalse(validator.isValidAccount("alice; DROP TABLE vault_deposits--"));
        assertFalse(validator.isValidAccount("a".repeat(65)));
    }

    @Test
    @DisplayName("validateAccount reports INVALID_ACCOUNT")
    public void testValidateAccount() {
        assertEquals("vault-admin", validator.validateAccount("vault-admin"));

        VaultException e = assertThrows(VaultException.class, () -> validator.validateAccount("bad account"));
        assertEquals(VaultErrorCode.INVALID_ACCOUNT, e.getCode());
    }

    @Test
    @DisplayName("Amount precision and magnitude are enforced")
    public void testAmounts() {
        assertDoesNotThrow(() -> validator.validateAmount(new BigDecimal("0.000000000000000001")));
        assertDoesNotThrow(() -> validator.validateAmount(new BigDecimal("1.500000000000000000000")));
        assertDoesNotThrow(() -> validator.validateAmount(BigDecimal.ZERO));

        assertThrows(IllegalArgumentException.class, () -> validator.validateAmount(null));
        assertThrows(IllegalArgumentException.class,
            () -> validator.validateAmount(new BigDecimal("0.0000000000000000001")));
        assertThrows(IllegalArgumentException.class, () -> validator.validateAmount(new BigDecimal("1e30")));
    }

    @Test
    @DisplayName("Negative indexes are rejected")
    public void testIndexes() {
        assertDoesNotThrow(() -> validator.validateIndex(0));
        assertThrows(IllegalArgumentException.class, () -> validator.validateIndex(-1));
    }

    @Test
    @DisplayName("Sanitization trims, strips control characters and caps length")
    public void testSanitization() {
        assertEquals("hello", validator.sanitize("  hello\u0000 "));
        assertEquals(1000, validator.sanitize("a".repeat(2000)).length());
        assertNull(validator.sanitize(null));
    }
}
