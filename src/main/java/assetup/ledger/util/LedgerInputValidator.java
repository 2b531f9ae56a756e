package assetup.ledger.util;

import java.util.Locale;
import org.web3j.crypto.Keys;
import org.web3j.utils.Numeric;

/**
 * Parses and validates identifiers arriving over the HTTP surface: account
 * addresses and unsigned 64-bit asset/proposal ids.
 */
public final class LedgerInputValidator {

    private static final int ADDRESS_LENGTH_WITH_PREFIX = 42; // 0x + 40 hex chars

    private LedgerInputValidator() {
        // Utility class
    }

    /**
     * Validates an account address. Lowercase addresses are accepted as is,
     * mixed or upper case ones must carry a valid EIP-55 checksum.
     */
    public static boolean isValidAddress(String address) {
        if (address == null || !address.startsWith("0x") || address.length() != ADDRESS_LENGTH_WITH_PREFIX) {
            return false;
        }
        try {
            Numeric.toBigInt(address);
        } catch (Exception e) {
            return false;
        }
        String body = address.substring(2);
        if (body.equals(body.toLowerCase(Locale.ROOT))) {
            return true;
        }
        try {
            return Keys.toChecksumAddress(address.toLowerCase(Locale.ROOT)).equals(address);
        } catch (Exception e) {
            return false;
        }
    }

    /**
     * Validates an address and returns its canonical lowercase form, which is
     * the form balances, locks and whitelists are keyed by.
     *
     * @throws IllegalArgumentException if the address is malformed
     */
    public static String normalizeAddress(String address, String fieldName) {
        if (!isValidAddress(address)) {
            throw new IllegalArgumentException("Invalid " + fieldName + " address: " + LogSanitizer.sanitize(address));
        }
        return address.toLowerCase(Locale.ROOT);
    }

    /**
     * Parses an unsigned 64-bit identifier. Values above {@link Long#MAX_VALUE}
     * are carried in the two's complement bit pattern of a {@code long}.
     */
    public static long parseUnsignedId(String value, String fieldName) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(fieldName + " cannot be null or empty");
        }
        try {
            return Long.parseUnsignedLong(value.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(fieldName + " must be an unsigned 64-bit number: "
                + LogSanitizer.sanitize(value), ex);
        }
    }

    public static String formatUnsignedId(long id) {
        return Long.toUnsignedString(id);
    }
}
