package assetup.ledger.store;

import assetup.ledger.model.DetokenizationProposal;
import assetup.ledger.model.TokenizedAsset;
import assetup.ledger.model.TransferRestriction;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.type.TypeFactory;
import java.math.BigInteger;
import java.util.List;

/**
 * Every key shape persisted by the ledger.
 */
public final class LedgerKeys {

    private LedgerKeys() {
    }

    public record Asset(long assetId) implements LedgerKey<TokenizedAsset> {
        @Override
        public JavaType valueType(TypeFactory types) {
            return types.constructType(TokenizedAsset.class);
        }
    }

    public record Balance(long assetId, String holder) implements LedgerKey<BigInteger> {
        @Override
        public JavaType valueType(TypeFactory types) {
            return types.constructType(BigInteger.class);
        }
    }

    /** Holders with a positive balance, in order of first credit. */
    public record HolderSet(long assetId) implements LedgerKey<List<String>> {
        @Override
        public JavaType valueType(TypeFactory types) {
            return types.constructCollectionType(List.class, String.class);
        }
    }

    /** Lock expiry in ledger seconds. */
    public record Lock(long assetId, String holder) implements LedgerKey<Long> {
        @Override
        public JavaType valueType(TypeFactory types) {
            return types.constructType(Long.class);
        }
    }

    public record Whitelist(long assetId) implements LedgerKey<List<String>> {
        @Override
        public JavaType valueType(TypeFactory types) {
            return types.constructCollectionType(List.class, String.class);
        }
    }

    public record Restriction(long assetId) implements LedgerKey<TransferRestriction> {
        @Override
        public JavaType valueType(TypeFactory types) {
            return types.constructType(TransferRestriction.class);
        }
    }

    public record UnclaimedDividend(long assetId, String holder) implements LedgerKey<BigInteger> {
        @Override
        public JavaType valueType(TypeFactory types) {
            return types.constructType(BigInteger.class);
        }
    }

    public record RevenueSharing(long assetId) implements LedgerKey<Boolean> {
        @Override
        public JavaType valueType(TypeFactory types) {
            return types.constructType(Boolean.class);
        }
    }

    public record VoteTally(long assetId, long proposalId) implements LedgerKey<BigInteger> {
        @Override
        public JavaType valueType(TypeFactory types) {
            return types.constructType(BigInteger.class);
        }
    }

    public record VotedSet(long assetId, long proposalId) implements LedgerKey<List<String>> {
        @Override
        public JavaType valueType(TypeFactory types) {
            return types.constructCollectionType(List.class, String.class);
        }
    }

    /** Ledger time at which a proposal's tally first reached the asset threshold. */
    public record ThresholdReached(long assetId, long proposalId) implements LedgerKey<Long> {
        @Override
        public JavaType valueType(TypeFactory types) {
            return types.constructType(Long.class);
        }
    }

    public record Detokenization(long assetId) implements LedgerKey<DetokenizationProposal> {
        @Override
        public JavaType valueType(TypeFactory types) {
            return types.constructType(DetokenizationProposal.class);
        }
    }

    /** Last issued proposal id within a scope. */
    public record ProposalSequence(String scope) implements LedgerKey<Long> {
        @Override
        public JavaType valueType(TypeFactory types) {
            return types.constructType(Long.class);
        }
    }
}
