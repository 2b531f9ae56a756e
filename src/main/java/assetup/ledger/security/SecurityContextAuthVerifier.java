package assetup.ledger.security;

import assetup.ledger.exception.LedgerError;
import assetup.ledger.exception.LedgerException;
import assetup.ledger.util.LogSanitizer;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;

/**
 * Checks the principal against the wallet authenticated for this request by
 * {@link WalletSignatureAuthenticationFilter}.
 */
@Component
public class SecurityContextAuthVerifier implements AuthVerifier {

    @Override
    public void requireAuth(String principal) {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication == null
            || !authentication.isAuthenticated()
            || !(authentication.getPrincipal() instanceof String wallet)
            || principal == null
            || !wallet.equalsIgnoreCase(principal)) {
            throw new LedgerException(LedgerError.UNAUTHORIZED,
                "Request is not authorized for " + LogSanitizer.maskAddress(principal));
        }
    }
}
