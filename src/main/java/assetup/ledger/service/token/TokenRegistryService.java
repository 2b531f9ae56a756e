package assetup.ledger.service.token;

import assetup.ledger.clock.LedgerClock;
import assetup.ledger.config.LedgerProperties;
import assetup.ledger.event.LedgerEventSink;
import assetup.ledger.exception.LedgerError;
import assetup.ledger.exception.LedgerException;
import assetup.ledger.model.TokenMetadata;
import assetup.ledger.model.TokenizedAsset;
import assetup.ledger.security.AuthVerifier;
import assetup.ledger.service.restriction.RestrictionGateService;
import assetup.ledger.store.LedgerKeys;
import assetup.ledger.store.LedgerStore;
import assetup.ledger.store.LedgerTransactionManager;
import assetup.ledger.util.CheckedMath;
import assetup.ledger.util.LogSanitizer;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Supply, balances and holder sets of tokenized assets.
 *
 * Invariants kept by every mutation:
 * - total supply equals the sum of all balances and is never negative
 * - a principal is in the holder set iff its balance is positive
 * - a detokenized asset accepts no further mint, burn or transfer
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TokenRegistryService {

    private static final BigInteger BASIS_POINTS = BigInteger.valueOf(10_000);

    private final LedgerStore store;
    private final LedgerTransactionManager transactions;
    private final AuthVerifier authVerifier;
    private final LedgerClock clock;
    private final LedgerEventSink events;
    private final LedgerProperties properties;
    private final LockManagerService lockManager;
    private final RestrictionGateService restrictionGate;

    /**
     * Registers an asset and credits the whole supply to the tokenizer.
     */
    public TokenizedAsset tokenize(
        long assetId,
        String symbol,
        BigInteger totalSupply,
        int decimals,
        BigInteger minVotingThreshold,
        String tokenizer,
        TokenMetadata metadata
    ) {
        return transactions.execute("tokenize", () -> {
            authVerifier.requireAuth(tokenizer);
            if (store.has(new LedgerKeys.Asset(assetId))) {
                throw new LedgerException(LedgerError.ASSET_ALREADY_TOKENIZED,
                    "Asset " + Long.toUnsignedString(assetId) + " is already tokenized");
            }
            if (totalSupply == null || totalSupply.signum() <= 0) {
                throw new LedgerException(LedgerError.INVALID_TOKEN_SUPPLY, "Total supply must be positive");
            }
            CheckedMath.requireInRange(totalSupply);
            int maxDecimals = properties.getToken().getMaxDecimals();
            if (decimals < 0 || decimals > maxDecimals) {
                throw new LedgerException(LedgerError.INVALID_TOKEN_DECIMALS,
                    "Decimals must be between 0 and " + maxDecimals);
            }

            TokenizedAsset asset = TokenizedAsset.builder()
                .assetId(assetId)
                .symbol(symbol)
                .totalSupply(totalSupply)
                .decimals(decimals)
                .tokenizer(tokenizer)
                .minVotingThreshold(minVotingThreshold == null
                    ? BigInteger.ZERO : CheckedMath.requireInRange(minVotingThreshold))
                .valuation(BigInteger.ZERO)
                .metadata(metadata)
                .tokenizedAt(clock.currentTimestamp())
                .detokenized(false)
                .build();
            store.set(new LedgerKeys.Asset(assetId), asset);
            store.set(new LedgerKeys.Balance(assetId, tokenizer), totalSupply);
            store.set(new LedgerKeys.HolderSet(assetId), List.of(tokenizer));

            events.publish("token/tokenized", Map.of(
                "assetId", assetId, "symbol", symbol, "totalSupply", totalSupply, "tokenizer", tokenizer));
            log.info("Asset {} tokenized as {} with supply {} (tokenizer={})",
                assetId, LogSanitizer.sanitize(symbol), totalSupply, LogSanitizer.maskAddress(tokenizer));
            return asset;
        });
    }

    public TokenizedAsset mint(long assetId, BigInteger amount, String minter) {
        return transactions.execute("mint", () -> {
            authVerifier.requireAuth(minter);
            TokenizedAsset asset = requireActiveAsset(assetId);
            requireTokenizer(asset, minter);
            requirePositive(amount, LedgerError.INVALID_TOKEN_SUPPLY, "Mint amount must be positive");

            TokenizedAsset updated = asset.toBuilder()
                .totalSupply(CheckedMath.add(asset.totalSupply(), amount))
                .build();
            credit(assetId, minter, amount);
            store.set(new LedgerKeys.Asset(assetId), updated);

            events.publish("token/minted", Map.of(
                "assetId", assetId, "amount", amount, "totalSupply", updated.totalSupply()));
            return updated;
        });
    }

    public TokenizedAsset burn(long assetId, BigInteger amount, String burner) {
        return transactions.execute("burn", () -> {
            authVerifier.requireAuth(burner);
            TokenizedAsset asset = requireActiveAsset(assetId);
            requireTokenizer(asset, burner);
            requirePositive(amount, LedgerError.INVALID_TOKEN_SUPPLY, "Burn amount must be positive");
            requireUnlocked(assetId, burner);
            requireBalance(assetId, burner, amount);

            debit(assetId, burner, amount);
            TokenizedAsset updated = asset.toBuilder()
                .totalSupply(CheckedMath.subtract(asset.totalSupply(), amount))
                .build();
            store.set(new LedgerKeys.Asset(assetId), updated);

            events.publish("token/burned", Map.of(
                "assetId", assetId, "amount", amount, "totalSupply", updated.totalSupply()));
            return updated;
        });
    }

    /**
     * Moves tokens after the transfer passed the asset's restriction gate.
     */
    public void transfer(long assetId, String from, String to, BigInteger amount) {
        transactions.run("transfer", () -> {
            authVerifier.requireAuth(from);
            requireActiveAsset(assetId);
            restrictionGate.validateTransfer(assetId, from, to);
            requirePositive(amount, LedgerError.INVALID_TOKEN_SUPPLY, "Transfer amount must be positive");
            requireUnlocked(assetId, from);
            requireBalance(assetId, from, amount);

            debit(assetId, from, amount);
            credit(assetId, to, amount);

            events.publish("token/transferred", Map.of(
                "assetId", assetId, "from", from, "to", to, "amount", amount));
            log.info("Transferred {} of asset {} from {} to {}", amount, assetId,
                LogSanitizer.maskAddress(from), LogSanitizer.maskAddress(to));
        });
    }

    public BigInteger balance(long assetId, String holder) {
        return transactions.execute("balance", () -> readBalance(assetId, holder));
    }

    public List<String> holders(long assetId) {
        return transactions.execute("holders", () -> readHolders(assetId));
    }

    public TokenizedAsset tokenizedAsset(long assetId) {
        return transactions.execute("tokenized_asset", () -> requireAsset(assetId));
    }

    /**
     * Share of the supply held by {@code holder}, in basis points (10000 = 100%).
     */
    public BigInteger ownershipPercentage(long assetId, String holder) {
        return transactions.execute("ownership_percentage", () -> {
            TokenizedAsset asset = requireAsset(assetId);
            if (asset.totalSupply().signum() == 0) {
                throw new LedgerException(LedgerError.ASSET_NOT_TOKENIZED,
                    "Asset " + Long.toUnsignedString(assetId) + " has no supply");
            }
            BigInteger scaled = CheckedMath.multiply(readBalance(assetId, holder), BASIS_POINTS);
            return CheckedMath.divide(scaled, asset.totalSupply());
        });
    }

    /**
     * Records a new appraisal. Only the tokenizer may revalue its asset.
     */
    public TokenizedAsset updateValuation(long assetId, BigInteger newValuation) {
        return transactions.execute("update_valuation", () -> {
            TokenizedAsset asset = requireAsset(assetId);
            authVerifier.requireAuth(asset.tokenizer());
            requirePositive(newValuation, LedgerError.INVALID_VALUATION, "Valuation must be positive");
            TokenizedAsset updated = asset.toBuilder().valuation(newValuation).build();
            store.set(new LedgerKeys.Asset(assetId), updated);
            events.publish("token/valuation", Map.of("assetId", assetId, "valuation", newValuation));
            return updated;
        });
    }

    /**
     * Flags the asset as detokenized. Called by the detokenization workflow
     * once a proposal has been approved.
     */
    public TokenizedAsset markDetokenized(long assetId) {
        return transactions.execute("mark_detokenized", () -> {
            TokenizedAsset updated = requireActiveAsset(assetId).toBuilder().detokenized(true).build();
            store.set(new LedgerKeys.Asset(assetId), updated);
            return updated;
        });
    }

    public TokenizedAsset requireAsset(long assetId) {
        return store.get(new LedgerKeys.Asset(assetId))
            .orElseThrow(() -> new LedgerException(LedgerError.ASSET_NOT_TOKENIZED,
                "Asset " + Long.toUnsignedString(assetId) + " is not tokenized"));
    }

    public TokenizedAsset requireActiveAsset(long assetId) {
        TokenizedAsset asset = requireAsset(assetId);
        if (asset.detokenized()) {
            throw new LedgerException(LedgerError.ASSET_NOT_TOKENIZED,
                "Asset " + Long.toUnsignedString(assetId) + " has been detokenized");
        }
        return asset;
    }

    BigInteger readBalance(long assetId, String holder) {
        return store.get(new LedgerKeys.Balance(assetId, holder)).orElse(BigInteger.ZERO);
    }

    List<String> readHolders(long assetId) {
        return store.get(new LedgerKeys.HolderSet(assetId)).orElse(List.of());
    }

    private void credit(long assetId, String holder, BigInteger amount) {
        BigInteger current = readBalance(assetId, holder);
        store.set(new LedgerKeys.Balance(assetId, holder), CheckedMath.add(current, amount));
        if (current.signum() == 0) {
            List<String> holders = new ArrayList<>(readHolders(assetId));
            if (!holders.contains(holder)) {
                holders.add(holder);
                store.set(new LedgerKeys.HolderSet(assetId), List.copyOf(holders));
            }
        }
    }

    private void debit(long assetId, String holder, BigInteger amount) {
        BigInteger remaining = CheckedMath.subtract(readBalance(assetId, holder), amount);
        if (remaining.signum() < 0) {
            throw new LedgerException(LedgerError.MATH_UNDERFLOW, "Balance would become negative");
        }
        if (remaining.signum() == 0) {
            store.remove(new LedgerKeys.Balance(assetId, holder));
            List<String> holders = new ArrayList<>(readHolders(assetId));
            holders.remove(holder);
            store.set(new LedgerKeys.HolderSet(assetId), List.copyOf(holders));
        } else {
            store.set(new LedgerKeys.Balance(assetId, holder), remaining);
        }
    }

    private void requireTokenizer(TokenizedAsset asset, String caller) {
        if (!asset.tokenizer().equals(caller)) {
            throw new LedgerException(LedgerError.UNAUTHORIZED,
                "Only the tokenizer of asset " + Long.toUnsignedString(asset.assetId()) + " can do this");
        }
    }

    private void requireUnlocked(long assetId, String holder) {
        if (lockManager.isLocked(assetId, holder)) {
            throw new LedgerException(LedgerError.TOKENS_ARE_LOCKED,
                "Tokens of " + LogSanitizer.maskAddress(holder) + " are locked");
        }
    }

    private void requireBalance(long assetId, String holder, BigInteger amount) {
        if (readBalance(assetId, holder).compareTo(amount) < 0) {
            throw new LedgerException(LedgerError.INSUFFICIENT_BALANCE,
                "Insufficient balance for " + LogSanitizer.maskAddress(holder));
        }
    }

    private static void requirePositive(BigInteger amount, LedgerError error, String message) {
        if (amount == null || amount.signum() <= 0) {
            throw new LedgerException(error, message);
        }
        CheckedMath.requireInRange(amount);
    }
}
