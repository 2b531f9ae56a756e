package assetup.ledger.store;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.type.TypeFactory;

/**
 * Composite key of one ledger entry. Each key kind is a distinct record type,
 * so two kinds can never collide even when their components are equal.
 *
 * @param <V> type of the value stored under the key
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
    @JsonSubTypes.Type(value = LedgerKeys.Asset.class, name = "Asset"),
    @JsonSubTypes.Type(value = LedgerKeys.Balance.class, name = "Balance"),
    @JsonSubTypes.Type(value = LedgerKeys.HolderSet.class, name = "HolderSet"),
    @JsonSubTypes.Type(value = LedgerKeys.Lock.class, name = "Lock"),
    @JsonSubTypes.Type(value = LedgerKeys.Whitelist.class, name = "Whitelist"),
    @JsonSubTypes.Type(value = LedgerKeys.Restriction.class, name = "TransferRestriction"),
    @JsonSubTypes.Type(value = LedgerKeys.UnclaimedDividend.class, name = "UnclaimedDividend"),
    @JsonSubTypes.Type(value = LedgerKeys.RevenueSharing.class, name = "RevenueSharingEnabled"),
    @JsonSubTypes.Type(value = LedgerKeys.VoteTally.class, name = "VoteTally"),
    @JsonSubTypes.Type(value = LedgerKeys.VotedSet.class, name = "VotedSet"),
    @JsonSubTypes.Type(value = LedgerKeys.ThresholdReached.class, name = "ThresholdReached"),
    @JsonSubTypes.Type(value = LedgerKeys.Detokenization.class, name = "DetokenizationProposal"),
    @JsonSubTypes.Type(value = LedgerKeys.ProposalSequence.class, name = "ProposalSequence")
})
public interface LedgerKey<V> {

    /**
     * Resolves the Jackson type of the value, used when reloading a snapshot.
     */
    JavaType valueType(TypeFactory types);
}
