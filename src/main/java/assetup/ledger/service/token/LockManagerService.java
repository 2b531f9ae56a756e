package assetup.ledger.service.token;

import assetup.ledger.clock.LedgerClock;
import assetup.ledger.event.LedgerEventSink;
import assetup.ledger.exception.LedgerError;
import assetup.ledger.exception.LedgerException;
import assetup.ledger.model.TokenizedAsset;
import assetup.ledger.security.AuthVerifier;
import assetup.ledger.store.LedgerKeys;
import assetup.ledger.store.LedgerStore;
import assetup.ledger.store.LedgerTransactionManager;
import assetup.ledger.util.LogSanitizer;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Time locks on a holder's balance of one asset. A live lock blocks transfer
 * and burn of the whole balance; it does not change voting or dividend weight.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class LockManagerService {

    private final LedgerStore store;
    private final LedgerTransactionManager transactions;
    private final AuthVerifier authVerifier;
    private final LedgerClock clock;
    private final LedgerEventSink events;

    /**
     * Locks {@code holder}'s tokens until {@code untilTimestamp}. Only the
     * asset's tokenizer may lock, including its own tokens.
     */
    public void lock(long assetId, String holder, long untilTimestamp, String caller) {
        transactions.run("lock", () -> {
            authVerifier.requireAuth(caller);
            if (untilTimestamp < 0) {
                throw new LedgerException(LedgerError.INVALID_TIMESTAMPS, "Lock expiry cannot be negative");
            }
            TokenizedAsset asset = store.get(new LedgerKeys.Asset(assetId))
                .orElseThrow(() -> new LedgerException(LedgerError.ASSET_NOT_TOKENIZED,
                    "Asset " + Long.toUnsignedString(assetId) + " is not tokenized"));
            if (!asset.tokenizer().equals(caller)) {
                throw new LedgerException(LedgerError.UNAUTHORIZED, "Only the tokenizer can lock tokens");
            }
            store.set(new LedgerKeys.Lock(assetId, holder), untilTimestamp);
            events.publish("token/locked", Map.of(
                "assetId", assetId, "holder", holder, "until", untilTimestamp));
            log.info("Locked {} on asset {} until {}", LogSanitizer.maskAddress(holder), assetId, untilTimestamp);
        });
    }

    /**
     * Clears any lock on the holder. Callable by anyone; no-op when unlocked.
     */
    public void unlock(long assetId, String holder) {
        transactions.run("unlock", () -> {
            LedgerKeys.Lock key = new LedgerKeys.Lock(assetId, holder);
            if (!store.has(key)) {
                return;
            }
            store.remove(key);
            events.publish("token/unlocked", Map.of("assetId", assetId, "holder", holder));
        });
    }

    public boolean isLocked(long assetId, String holder) {
        return transactions.execute("is_locked", () -> store.get(new LedgerKeys.Lock(assetId, holder))
            .map(until -> until > clock.currentTimestamp())
            .orElse(false));
    }
}
