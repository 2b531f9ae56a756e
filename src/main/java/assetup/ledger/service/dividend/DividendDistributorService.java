package assetup.ledger.service.dividend;

import assetup.ledger.event.LedgerEventSink;
import assetup.ledger.exception.LedgerError;
import assetup.ledger.exception.LedgerException;
import assetup.ledger.model.TokenizedAsset;
import assetup.ledger.security.AuthVerifier;
import assetup.ledger.service.token.TokenRegistryService;
import assetup.ledger.store.LedgerKeys;
import assetup.ledger.store.LedgerStore;
import assetup.ledger.store.LedgerTransactionManager;
import assetup.ledger.util.CheckedMath;
import assetup.ledger.util.LogSanitizer;
import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Pro-rata revenue distribution to the current holders of an asset.
 *
 * Shares are floored per holder; the rounding remainder of a distribution is
 * not carried over. Distributions and the revenue sharing switch are reserved
 * to the asset's tokenizer.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DividendDistributorService {

    private final LedgerStore store;
    private final LedgerTransactionManager transactions;
    private final AuthVerifier authVerifier;
    private final LedgerEventSink events;
    private final TokenRegistryService tokenRegistry;

    /**
     * Credits every current holder with {@code totalAmount * balance / totalSupply}.
     *
     * @return the sum actually credited, which may be below {@code totalAmount}
     */
    public BigInteger distribute(long assetId, BigInteger totalAmount) {
        return transactions.execute("distribute", () -> {
            if (totalAmount == null || totalAmount.signum() <= 0) {
                throw new LedgerException(LedgerError.INVALID_DIVIDEND_AMOUNT, "Dividend amount must be positive");
            }
            CheckedMath.requireInRange(totalAmount);
            TokenizedAsset asset = tokenRegistry.requireActiveAsset(assetId);
            authVerifier.requireAuth(asset.tokenizer());
            if (!readRevenueSharing(assetId)) {
                throw new LedgerException(LedgerError.REVENUE_SHARING_DISABLED,
                    "Revenue sharing is disabled for asset " + Long.toUnsignedString(assetId));
            }

            BigInteger credited = BigInteger.ZERO;
            List<String> holders = tokenRegistry.holders(assetId);
            for (String holder : holders) {
                BigInteger balance = tokenRegistry.balance(assetId, holder);
                BigInteger share = CheckedMath.divide(
                    CheckedMath.multiply(totalAmount, balance), asset.totalSupply());
                if (share.signum() == 0) {
                    continue;
                }
                LedgerKeys.UnclaimedDividend key = new LedgerKeys.UnclaimedDividend(assetId, holder);
                store.set(key, CheckedMath.add(store.get(key).orElse(BigInteger.ZERO), share));
                credited = CheckedMath.add(credited, share);
            }

            events.publish("dividend/distributed", Map.of(
                "assetId", assetId, "amount", totalAmount, "credited", credited, "holders", holders.size()));
            log.info("Distributed {} on asset {} across {} holders (credited {})",
                totalAmount, assetId, holders.size(), credited);
            return credited;
        });
    }

    public BigInteger claim(long assetId, String holder) {
        return transactions.execute("claim", () -> {
            authVerifier.requireAuth(holder);
            LedgerKeys.UnclaimedDividend key = new LedgerKeys.UnclaimedDividend(assetId, holder);
            BigInteger amount = store.get(key).orElse(BigInteger.ZERO);
            if (amount.signum() == 0) {
                throw new LedgerException(LedgerError.NO_DIVIDENDS_TO_CLAIM,
                    "No dividends to claim for " + LogSanitizer.maskAddress(holder));
            }
            store.remove(key);
            events.publish("dividend/claimed", Map.of("assetId", assetId, "holder", holder, "amount", amount));
            log.info("{} claimed {} in dividends on asset {}", LogSanitizer.maskAddress(holder), amount, assetId);
            return amount;
        });
    }

    public BigInteger unclaimed(long assetId, String holder) {
        return transactions.execute("unclaimed", () ->
            store.get(new LedgerKeys.UnclaimedDividend(assetId, holder)).orElse(BigInteger.ZERO));
    }

    public void enableRevenueSharing(long assetId) {
        setRevenueSharing(assetId, true);
    }

    /**
     * Stops new distributions. Amounts already credited stay claimable.
     */
    public void disableRevenueSharing(long assetId) {
        setRevenueSharing(assetId, false);
    }

    public boolean isRevenueSharingEnabled(long assetId) {
        return transactions.execute("is_revenue_sharing_enabled", () -> readRevenueSharing(assetId));
    }

    private void setRevenueSharing(long assetId, boolean enabled) {
        transactions.run(enabled ? "enable_revenue_sharing" : "disable_revenue_sharing", () -> {
            authVerifier.requireAuth(tokenRegistry.requireAsset(assetId).tokenizer());
            store.set(new LedgerKeys.RevenueSharing(assetId), enabled);
            log.info("Revenue sharing {} for asset {}", enabled ? "enabled" : "disabled", assetId);
        });
    }

    private boolean readRevenueSharing(long assetId) {
        return store.get(new LedgerKeys.RevenueSharing(assetId)).orElse(false);
    }
}
