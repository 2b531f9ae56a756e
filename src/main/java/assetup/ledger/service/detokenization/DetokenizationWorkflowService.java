package assetup.ledger.service.detokenization;

import assetup.ledger.clock.LedgerClock;
import assetup.ledger.config.LedgerProperties;
import assetup.ledger.event.LedgerEventSink;
import assetup.ledger.exception.LedgerError;
import assetup.ledger.exception.LedgerException;
import assetup.ledger.model.DetokenizationProposal;
import assetup.ledger.model.DetokenizationStatus;
import assetup.ledger.security.AuthVerifier;
import assetup.ledger.service.token.TokenRegistryService;
import assetup.ledger.service.voting.GovernanceVotingService;
import assetup.ledger.store.LedgerKeys;
import assetup.ledger.store.LedgerStore;
import assetup.ledger.store.LedgerTransactionManager;
import assetup.ledger.util.LogSanitizer;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Vote-gated teardown of a tokenized asset.
 *
 * A proposal is voted on through {@link GovernanceVotingService} under its
 * own proposal id. It PASSES when a vote cast within the voting period brings
 * the tally to the asset threshold and is REJECTED once the period elapses
 * otherwise. Votes arriving after the deadline are recorded but cannot
 * revive a rejected proposal.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DetokenizationWorkflowService {

    static final String PROPOSAL_SCOPE = "detokenization";

    private final LedgerStore store;
    private final LedgerTransactionManager transactions;
    private final AuthVerifier authVerifier;
    private final LedgerClock clock;
    private final LedgerEventSink events;
    private final LedgerProperties properties;
    private final TokenRegistryService tokenRegistry;
    private final GovernanceVotingService voting;

    public DetokenizationProposal propose(long assetId, String proposer) {
        return transactions.execute("propose_detokenization", () -> {
            authVerifier.requireAuth(proposer);
            tokenRegistry.requireActiveAsset(assetId);
            DetokenizationStatus current = resolveStatus(assetId);
            if (current.isLive()) {
                throw new LedgerException(LedgerError.DETOKENIZATION_ALREADY_PROPOSED,
                    "Asset " + Long.toUnsignedString(assetId) + " already has a " + current.getWireValue() + " proposal");
            }

            DetokenizationProposal proposal = new DetokenizationProposal(
                nextProposalId(assetId), proposer, clock.currentTimestamp(), false);
            store.set(new LedgerKeys.Detokenization(assetId), proposal);

            events.publish("detokenize/proposed", Map.of(
                "assetId", assetId, "proposalId", proposal.proposalId(), "proposer", proposer));
            log.info("Detokenization of asset {} proposed by {} as proposal {}",
                assetId, LogSanitizer.maskAddress(proposer), Long.toUnsignedString(proposal.proposalId()));
            return proposal;
        });
    }

    public DetokenizationProposal execute(long assetId, long proposalId) {
        return transactions.execute("execute_detokenization", () -> {
            DetokenizationProposal proposal = store.get(new LedgerKeys.Detokenization(assetId))
                .filter(found -> found.proposalId() == proposalId)
                .orElseThrow(() -> new LedgerException(LedgerError.PROPOSAL_NOT_FOUND,
                    "No detokenization proposal " + Long.toUnsignedString(proposalId)
                        + " for asset " + Long.toUnsignedString(assetId)));
            if (proposal.executed()) {
                throw new LedgerException(LedgerError.ASSET_NOT_TOKENIZED,
                    "Asset " + Long.toUnsignedString(assetId) + " has already been detokenized");
            }
            DetokenizationStatus current = resolveStatus(assetId);
            if (current != DetokenizationStatus.PASSED) {
                throw new LedgerException(LedgerError.DETOKENIZATION_NOT_APPROVED,
                    "Detokenization proposal " + Long.toUnsignedString(proposalId) + " is " + current.getWireValue());
            }

            tokenRegistry.markDetokenized(assetId);
            DetokenizationProposal executed = proposal.markExecuted();
            store.set(new LedgerKeys.Detokenization(assetId), executed);

            events.publish("detokenize/executed", Map.of("assetId", assetId, "proposalId", proposalId));
            log.info("Asset {} detokenized by proposal {}", assetId, Long.toUnsignedString(proposalId));
            return executed;
        });
    }

    public Optional<DetokenizationProposal> proposal(long assetId) {
        return transactions.execute("detokenization_proposal",
            () -> store.get(new LedgerKeys.Detokenization(assetId)));
    }

    public DetokenizationStatus status(long assetId) {
        return transactions.execute("detokenization_status", () -> resolveStatus(assetId));
    }

    /**
     * True while a proposal exists and has not been executed.
     */
    public boolean isActive(long assetId) {
        return transactions.execute("is_detokenization_active", () -> store.get(new LedgerKeys.Detokenization(assetId))
            .map(found -> !found.executed())
            .orElse(false));
    }

    private DetokenizationStatus resolveStatus(long assetId) {
        Optional<DetokenizationProposal> found = store.get(new LedgerKeys.Detokenization(assetId));
        if (found.isEmpty()) {
            return DetokenizationStatus.NONE;
        }
        DetokenizationProposal proposal = found.get();
        if (proposal.executed()) {
            return DetokenizationStatus.EXECUTED;
        }
        long deadline = proposal.createdAt() + properties.getDetokenization().getVotingPeriod().getSeconds();
        boolean passedInTime = voting.thresholdReachedAt(assetId, proposal.proposalId())
            .map(reachedAt -> reachedAt <= deadline)
            .orElse(false);
        if (passedInTime) {
            return DetokenizationStatus.PASSED;
        }
        if (clock.currentTimestamp() > deadline) {
            return DetokenizationStatus.REJECTED;
        }
        return DetokenizationStatus.PROPOSED;
    }

    /**
     * Next id of the global sequence that has no votes on this asset yet.
     * Votes may be cast on any id, so ids voted on ahead of time are skipped.
     */
    private long nextProposalId(long assetId) {
        LedgerKeys.ProposalSequence key = new LedgerKeys.ProposalSequence(PROPOSAL_SCOPE);
        long next = store.get(key).orElse(0L);
        do {
            next++;
        } while (store.has(new LedgerKeys.VoteTally(assetId, next))
            || store.has(new LedgerKeys.VotedSet(assetId, next)));
        store.set(key, next);
        return next;
    }
}
