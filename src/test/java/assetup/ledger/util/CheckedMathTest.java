package assetup.ledger.util;

import static assetup.ledger.support.LedgerAssertions.assertLedgerError;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import assetup.ledger.exception.LedgerError;
import java.math.BigInteger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class CheckedMathTest {

    @Test
    @DisplayName("Should accept the exact edges of the 128-bit range")
    void shouldAcceptRangeEdges() {
        assertThat(CheckedMath.add(CheckedMath.MAX_AMOUNT, BigInteger.ZERO)).isEqualTo(CheckedMath.MAX_AMOUNT);
        assertThat(CheckedMath.subtract(CheckedMath.MIN_AMOUNT, BigInteger.ZERO)).isEqualTo(CheckedMath.MIN_AMOUNT);
    }

    @Test
    @DisplayName("Should fail on overflow instead of wrapping")
    void shouldFailOnOverflow() {
        assertLedgerError(() -> CheckedMath.add(CheckedMath.MAX_AMOUNT, BigInteger.ONE), LedgerError.MATH_OVERFLOW);
        assertLedgerError(() -> CheckedMath.multiply(CheckedMath.MAX_AMOUNT, BigInteger.TWO),
            LedgerError.MATH_OVERFLOW);
    }

    @Test
    @DisplayName("Should fail on underflow")
    void shouldFailOnUnderflow() {
        assertLedgerError(() -> CheckedMath.subtract(CheckedMath.MIN_AMOUNT, BigInteger.ONE),
            LedgerError.MATH_UNDERFLOW);
    }

    @Test
    @DisplayName("Should truncate division toward zero and reject a zero divisor")
    void shouldDivide() {
        assertThat(CheckedMath.divide(BigInteger.valueOf(7), BigInteger.valueOf(2))).isEqualTo(BigInteger.valueOf(3));
        assertThat(CheckedMath.divide(BigInteger.valueOf(-7), BigInteger.valueOf(2))).isEqualTo(BigInteger.valueOf(-3));
        assertLedgerError(() -> CheckedMath.divide(BigInteger.ONE, BigInteger.ZERO), LedgerError.MATH_OVERFLOW);
    }

    @Test
    @DisplayName("Should require a caller supplied amount")
    void shouldRequireAmount() {
        assertThatThrownBy(() -> CheckedMath.requireInRange(null)).isInstanceOf(IllegalArgumentException.class);
        assertLedgerError(() -> CheckedMath.requireInRange(CheckedMath.MAX_AMOUNT.add(BigInteger.ONE)),
            LedgerError.MATH_OVERFLOW);
    }
}
