package assetup.ledger.util;

import assetup.ledger.exception.LedgerError;
import assetup.ledger.exception.LedgerException;
import java.math.BigInteger;

/**
 * Arithmetic on ledger amounts. Amounts live in the signed 128-bit range;
 * results outside it fail instead of wrapping.
 */
public final class CheckedMath {

    public static final BigInteger MAX_AMOUNT = BigInteger.ONE.shiftLeft(127).subtract(BigInteger.ONE);
    public static final BigInteger MIN_AMOUNT = BigInteger.ONE.shiftLeft(127).negate();

    private CheckedMath() {
        // Utility class
    }

    public static BigInteger add(BigInteger a, BigInteger b) {
        return checked(a.add(b));
    }

    public static BigInteger subtract(BigInteger a, BigInteger b) {
        return checked(a.subtract(b));
    }

    public static BigInteger multiply(BigInteger a, BigInteger b) {
        return checked(a.multiply(b));
    }

    /**
     * Integer division truncating toward zero.
     */
    public static BigInteger divide(BigInteger dividend, BigInteger divisor) {
        if (divisor.signum() == 0) {
            throw new LedgerException(LedgerError.MATH_OVERFLOW, "Division by zero");
        }
        return checked(dividend.divide(divisor));
    }

    /**
     * Verifies a caller supplied amount fits the ledger range.
     */
    public static BigInteger requireInRange(BigInteger value) {
        if (value == null) {
            throw new IllegalArgumentException("Amount is required");
        }
        return checked(value);
    }

    private static BigInteger checked(BigInteger value) {
        if (value.compareTo(MAX_AMOUNT) > 0) {
            throw new LedgerException(LedgerError.MATH_OVERFLOW, "Amount exceeds the 128-bit ledger range");
        }
        if (value.compareTo(MIN_AMOUNT) < 0) {
            throw new LedgerException(LedgerError.MATH_UNDERFLOW, "Amount is below the 128-bit ledger range");
        }
        return value;
    }
}
