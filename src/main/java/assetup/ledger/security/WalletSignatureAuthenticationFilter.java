package assetup.ledger.security;

import assetup.ledger.config.LedgerProperties;
import assetup.ledger.service.auth.WalletSignatureVerifier;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.List;
import java.util.Locale;
import org.springframework.lang.NonNull;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Authenticates the wallet named in the request headers when it carries a
 * valid signature. Requests without the headers continue anonymously; the
 * ledger rejects them wherever an acting party must be authenticated.
 */
public class WalletSignatureAuthenticationFilter extends OncePerRequestFilter {

    private final WalletSignatureVerifier verifier;
    private final LedgerProperties.Auth settings;

    public WalletSignatureAuthenticationFilter(WalletSignatureVerifier verifier, LedgerProperties properties) {
        this.verifier = verifier;
        this.settings = properties.getAuth();
    }

    @Override
    protected void doFilterInternal(
        @NonNull HttpServletRequest request,
        @NonNull HttpServletResponse response,
        @NonNull FilterChain filterChain
    ) throws ServletException, IOException {
        String address = request.getHeader(settings.getAddressHeader());
        if (address == null || address.isBlank()) {
            filterChain.doFilter(request, response);
            return;
        }

        String timestampHeader = request.getHeader(settings.getTimestampHeader());
        String signature = request.getHeader(settings.getSignatureHeader());
        long timestamp;
        try {
            timestamp = Long.parseLong(timestampHeader == null ? "" : timestampHeader.trim());
        } catch (NumberFormatException e) {
            response.sendError(HttpServletResponse.SC_UNAUTHORIZED, "Invalid signature timestamp");
            return;
        }

        String wallet = address.trim();
        if (!verifier.verify(wallet, timestamp, signature)) {
            response.sendError(HttpServletResponse.SC_UNAUTHORIZED, "Invalid wallet signature");
            return;
        }

        UsernamePasswordAuthenticationToken authentication = new UsernamePasswordAuthenticationToken(
            wallet.toLowerCase(Locale.ROOT),
            null,
            List.of(new SimpleGrantedAuthority("ROLE_WALLET"))
        );
        SecurityContextHolder.getContext().setAuthentication(authentication);
        filterChain.doFilter(request, response);
    }
}
