package assetup.ledger.controller.governance;

import assetup.ledger.dto.governance.TallyResponse;
import assetup.ledger.dto.governance.VoteRequest;
import assetup.ledger.dto.governance.VoteStatusResponse;
import assetup.ledger.service.voting.GovernanceVotingService;
import assetup.ledger.util.LedgerInputValidator;
import jakarta.validation.Valid;
import java.math.BigInteger;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/tokens/{assetId}/proposals/{proposalId}")
@RequiredArgsConstructor
public class VotingController {

    private final GovernanceVotingService voting;

    @PostMapping("/votes")
    public ResponseEntity<TallyResponse> castVote(
        @PathVariable String assetId,
        @PathVariable String proposalId,
        @Valid @RequestBody VoteRequest request
    ) {
        long asset = LedgerInputValidator.parseUnsignedId(assetId, "assetId");
        long proposal = LedgerInputValidator.parseUnsignedId(proposalId, "proposalId");
        BigInteger tally = voting.castVote(asset, proposal,
            LedgerInputValidator.normalizeAddress(request.getVoter(), "voter"));
        return ResponseEntity.ok(tallyResponse(asset, proposal, tally));
    }

    @GetMapping("/tally")
    public ResponseEntity<TallyResponse> tally(@PathVariable String assetId, @PathVariable String proposalId) {
        long asset = LedgerInputValidator.parseUnsignedId(assetId, "assetId");
        long proposal = LedgerInputValidator.parseUnsignedId(proposalId, "proposalId");
        return ResponseEntity.ok(tallyResponse(asset, proposal, voting.tally(asset, proposal)));
    }

    @GetMapping("/votes/{voter}")
    public ResponseEntity<VoteStatusResponse> hasVoted(
        @PathVariable String assetId,
        @PathVariable String proposalId,
        @PathVariable String voter
    ) {
        long asset = LedgerInputValidator.parseUnsignedId(assetId, "assetId");
        long proposal = LedgerInputValidator.parseUnsignedId(proposalId, "proposalId");
        String address = LedgerInputValidator.normalizeAddress(voter, "voter");
        return ResponseEntity.ok(VoteStatusResponse.builder()
            .assetId(LedgerInputValidator.formatUnsignedId(asset))
            .proposalId(LedgerInputValidator.formatUnsignedId(proposal))
            .voter(address)
            .voted(voting.hasVoted(asset, proposal, address))
            .build());
    }

    private TallyResponse tallyResponse(long assetId, long proposalId, BigInteger tally) {
        return TallyResponse.builder()
            .assetId(LedgerInputValidator.formatUnsignedId(assetId))
            .proposalId(LedgerInputValidator.formatUnsignedId(proposalId))
            .tally(tally)
            .passed(voting.passed(assetId, proposalId))
            .build();
    }
}
