package assetup.ledger.service.voting;

import assetup.ledger.clock.LedgerClock;
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
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Token-weighted, one-vote-per-holder proposals. A vote weighs the voter's
 * balance at the moment it is cast; later transfers do not change the tally.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class GovernanceVotingService {

    private final LedgerStore store;
    private final LedgerTransactionManager transactions;
    private final AuthVerifier authVerifier;
    private final LedgerClock clock;
    private final LedgerEventSink events;
    private final TokenRegistryService tokenRegistry;

    public BigInteger castVote(long assetId, long proposalId, String voter) {
        return transactions.execute("cast_vote", () -> {
            authVerifier.requireAuth(voter);
            TokenizedAsset asset = tokenRegistry.requireAsset(assetId);

            LedgerKeys.VotedSet votedKey = new LedgerKeys.VotedSet(assetId, proposalId);
            List<String> voted = new ArrayList<>(store.get(votedKey).orElse(List.of()));
            if (voted.contains(voter)) {
                throw new LedgerException(LedgerError.ALREADY_VOTED,
                    LogSanitizer.maskAddress(voter) + " already voted on proposal " + Long.toUnsignedString(proposalId));
            }
            BigInteger weight = tokenRegistry.balance(assetId, voter);
            if (weight.signum() <= 0) {
                throw new LedgerException(LedgerError.INSUFFICIENT_VOTING_POWER,
                    LogSanitizer.maskAddress(voter) + " holds no tokens of asset " + Long.toUnsignedString(assetId));
            }

            LedgerKeys.VoteTally tallyKey = new LedgerKeys.VoteTally(assetId, proposalId);
            BigInteger tally = CheckedMath.add(store.get(tallyKey).orElse(BigInteger.ZERO), weight);
            store.set(tallyKey, tally);
            voted.add(voter);
            store.set(votedKey, List.copyOf(voted));
            LedgerKeys.ThresholdReached reachedKey = new LedgerKeys.ThresholdReached(assetId, proposalId);
            if (tally.compareTo(asset.minVotingThreshold()) >= 0 && !store.has(reachedKey)) {
                store.set(reachedKey, clock.currentTimestamp());
            }

            events.publish("vote/cast", Map.of(
                "assetId", assetId, "proposalId", proposalId, "voter", voter, "weight", weight));
            log.info("Vote by {} on asset {} proposal {} with weight {} (tally {})",
                LogSanitizer.maskAddress(voter), assetId, Long.toUnsignedString(proposalId), weight, tally);
            return tally;
        });
    }

    public BigInteger tally(long assetId, long proposalId) {
        return transactions.execute("tally", () -> store.get(new LedgerKeys.VoteTally(assetId, proposalId))
            .orElseThrow(() -> new LedgerException(LedgerError.PROPOSAL_NOT_FOUND,
                "No votes recorded for proposal " + Long.toUnsignedString(proposalId))));
    }

    public boolean hasVoted(long assetId, long proposalId, String voter) {
        return transactions.execute("has_voted", () -> store.get(new LedgerKeys.VotedSet(assetId, proposalId))
            .map(voted -> voted.contains(voter))
            .orElse(false));
    }

    /**
     * Ledger time of the vote that first brought the tally to the asset
     * threshold; empty while the proposal has not passed.
     */
    public Optional<Long> thresholdReachedAt(long assetId, long proposalId) {
        return transactions.execute("threshold_reached_at",
            () -> store.get(new LedgerKeys.ThresholdReached(assetId, proposalId)));
    }

    /**
     * True once the tally reaches the asset's minimum voting threshold. A
     * proposal nobody voted on has not passed.
     */
    public boolean passed(long assetId, long proposalId) {
        return transactions.execute("passed", () -> {
            TokenizedAsset asset = tokenRegistry.requireAsset(assetId);
            return store.get(new LedgerKeys.VoteTally(assetId, proposalId))
                .map(tally -> tally.compareTo(asset.minVotingThreshold()) >= 0)
                .orElse(false);
        });
    }
}
