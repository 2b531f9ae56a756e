package assetup.ledger.security;

/**
 * Asserts that the current request acts for a principal.
 */
@FunctionalInterface
public interface AuthVerifier {

    /**
     * @throws assetup.ledger.exception.LedgerException with
     *         {@code UNAUTHORIZED} when the caller cannot prove control of
     *         {@code principal}
     */
    void requireAuth(String principal);
}
