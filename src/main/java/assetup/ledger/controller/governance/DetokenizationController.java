package assetup.ledger.controller.governance;

import assetup.ledger.dto.governance.DetokenizationRequest;
import assetup.ledger.dto.governance.DetokenizationResponse;
import assetup.ledger.service.detokenization.DetokenizationWorkflowService;
import assetup.ledger.util.LedgerInputValidator;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Detokenization proposals. Votes on a proposal go through
 * {@code /tokens/{assetId}/proposals/{proposalId}/votes}.
 */
@RestController
@RequestMapping("/tokens/{assetId}/detokenization")
@RequiredArgsConstructor
public class DetokenizationController {

    private final DetokenizationWorkflowService workflow;

    @PostMapping
    public ResponseEntity<DetokenizationResponse> propose(
        @PathVariable String assetId,
        @Valid @RequestBody DetokenizationRequest request
    ) {
        long id = LedgerInputValidator.parseUnsignedId(assetId, "assetId");
        workflow.propose(id, LedgerInputValidator.normalizeAddress(request.getProposer(), "proposer"));
        return ResponseEntity.status(HttpStatus.CREATED).body(describe(id));
    }

    @GetMapping
    public ResponseEntity<DetokenizationResponse> get(@PathVariable String assetId) {
        return ResponseEntity.ok(describe(LedgerInputValidator.parseUnsignedId(assetId, "assetId")));
    }

    @PostMapping("/{proposalId}/execute")
    public ResponseEntity<DetokenizationResponse> execute(
        @PathVariable String assetId,
        @PathVariable String proposalId
    ) {
        long id = LedgerInputValidator.parseUnsignedId(assetId, "assetId");
        workflow.execute(id, LedgerInputValidator.parseUnsignedId(proposalId, "proposalId"));
        return ResponseEntity.ok(describe(id));
    }

    private DetokenizationResponse describe(long assetId) {
        return DetokenizationResponse.of(
            assetId,
            workflow.status(assetId),
            workflow.isActive(assetId),
            workflow.proposal(assetId).orElse(null)
        );
    }
}
