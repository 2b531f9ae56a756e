package assetup.ledger.dto.governance;

import assetup.ledger.model.DetokenizationProposal;
import assetup.ledger.model.DetokenizationStatus;
import assetup.ledger.util.LedgerInputValidator;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Detokenization state of an asset. Proposal fields are null when no
 * proposal was ever made.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DetokenizationResponse {
    private String assetId;
    private DetokenizationStatus status;
    private boolean active;
    private String proposalId;
    private String proposer;
    private Long createdAt;
    private boolean executed;

    public static DetokenizationResponse of(long assetId, DetokenizationStatus status, boolean active,
                                            DetokenizationProposal proposal) {
        DetokenizationResponseBuilder builder = DetokenizationResponse.builder()
            .assetId(LedgerInputValidator.formatUnsignedId(assetId))
            .status(status)
            .active(active);
        if (proposal != null) {
            builder.proposalId(LedgerInputValidator.formatUnsignedId(proposal.proposalId()))
                .proposer(proposal.proposer())
                .createdAt(proposal.createdAt())
                .executed(proposal.executed());
        }
        return builder.build();
    }
}
