package assetup.ledger.service.restriction;

import assetup.ledger.event.LedgerEventSink;
import assetup.ledger.exception.LedgerError;
import assetup.ledger.exception.LedgerException;
import assetup.ledger.model.TokenizedAsset;
import assetup.ledger.model.TransferRestriction;
import assetup.ledger.security.AuthVerifier;
import assetup.ledger.store.LedgerKeys;
import assetup.ledger.store.LedgerStore;
import assetup.ledger.store.LedgerTransactionManager;
import assetup.ledger.util.LogSanitizer;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Per-asset transfer policy and recipient whitelist.
 *
 * The whitelist is also the accreditation registry: a recipient counts as
 * accredited for an asset when it is whitelisted on that asset. Geographic
 * codes are stored with the policy but not evaluated. Only the tokenizer of
 * an asset may change its policy or whitelist.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class RestrictionGateService {

    private final LedgerStore store;
    private final LedgerTransactionManager transactions;
    private final AuthVerifier authVerifier;
    private final LedgerEventSink events;

    public void setRestriction(long assetId, TransferRestriction restriction) {
        transactions.run("set_restriction", () -> {
            requireTokenizerAuth(assetId);
            store.set(new LedgerKeys.Restriction(assetId), restriction);
            events.publish("transfer/restriction_set", Map.of(
                "assetId", assetId, "requireAccredited", restriction.requireAccredited()));
            log.info("Transfer restriction set on asset {} (requireAccredited={}, regions={})",
                assetId, restriction.requireAccredited(), restriction.geographicAllowed().size());
        });
    }

    public Optional<TransferRestriction> getRestriction(long assetId) {
        return transactions.execute("get_restriction", () -> store.get(new LedgerKeys.Restriction(assetId)));
    }

    public boolean hasRestriction(long assetId) {
        return transactions.execute("has_restriction", () -> store.has(new LedgerKeys.Restriction(assetId)));
    }

    public void clearRestriction(long assetId) {
        transactions.run("clear_restriction", () -> {
            requireTokenizerAuth(assetId);
            LedgerKeys.Restriction key = new LedgerKeys.Restriction(assetId);
            if (store.has(key)) {
                store.remove(key);
                events.publish("transfer/restriction_cleared", Map.of("assetId", assetId));
            }
        });
    }

    public void addToWhitelist(long assetId, String address) {
        transactions.run("add_to_whitelist", () -> {
            requireTokenizerAuth(assetId);
            List<String> whitelist = new ArrayList<>(readWhitelist(assetId));
            if (whitelist.contains(address)) {
                return;
            }
            whitelist.add(address);
            store.set(new LedgerKeys.Whitelist(assetId), List.copyOf(whitelist));
            events.publish("transfer/whitelisted", Map.of("assetId", assetId, "address", address));
            log.info("Whitelisted {} on asset {}", LogSanitizer.maskAddress(address), assetId);
        });
    }

    public void removeFromWhitelist(long assetId, String address) {
        transactions.run("remove_from_whitelist", () -> {
            requireTokenizerAuth(assetId);
            List<String> whitelist = new ArrayList<>(readWhitelist(assetId));
            if (!whitelist.remove(address)) {
                return;
            }
            if (whitelist.isEmpty()) {
                store.remove(new LedgerKeys.Whitelist(assetId));
            } else {
                store.set(new LedgerKeys.Whitelist(assetId), List.copyOf(whitelist));
            }
            events.publish("transfer/unwhitelisted", Map.of("assetId", assetId, "address", address));
            log.info("Removed {} from whitelist of asset {}", LogSanitizer.maskAddress(address), assetId);
        });
    }

    public boolean isWhitelisted(long assetId, String address) {
        return transactions.execute("is_whitelisted", () -> readWhitelist(assetId).contains(address));
    }

    public List<String> whitelist(long assetId) {
        return transactions.execute("whitelist", () -> readWhitelist(assetId));
    }

    /**
     * Rejects a transfer whose recipient is not allowed to receive the asset.
     * An asset with an empty whitelist and no restriction record accepts any
     * recipient.
     */
    public void validateTransfer(long assetId, String from, String to) {
        transactions.run("validate_transfer", () -> {
            List<String> whitelist = readWhitelist(assetId);
            if (!whitelist.isEmpty() && !whitelist.contains(to)) {
                throw new LedgerException(LedgerError.TRANSFER_RESTRICTION_FAILED,
                    "Recipient " + LogSanitizer.maskAddress(to) + " is not whitelisted");
            }
            Optional<TransferRestriction> restriction = store.get(new LedgerKeys.Restriction(assetId));
            if (restriction.isPresent() && restriction.get().requireAccredited() && !whitelist.contains(to)) {
                throw new LedgerException(LedgerError.ACCREDITED_INVESTOR_REQUIRED,
                    "Recipient " + LogSanitizer.maskAddress(to) + " is not an accredited investor");
            }
            log.debug("Transfer on asset {} from {} to {} passed restrictions",
                assetId, LogSanitizer.maskAddress(from), LogSanitizer.maskAddress(to));
        });
    }

    private void requireTokenizerAuth(long assetId) {
        TokenizedAsset asset = store.get(new LedgerKeys.Asset(assetId))
            .orElseThrow(() -> new LedgerException(LedgerError.ASSET_NOT_TOKENIZED,
                "Asset " + Long.toUnsignedString(assetId) + " is not tokenized"));
        authVerifier.requireAuth(asset.tokenizer());
    }

    private List<String> readWhitelist(long assetId) {
        return store.get(new LedgerKeys.Whitelist(assetId)).orElse(List.of());
    }
}
