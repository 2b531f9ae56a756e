package assetup.ledger.model;

public record DetokenizationProposal(long proposalId, String proposer, long createdAt, boolean executed) {

    public DetokenizationProposal markExecuted() {
        return new DetokenizationProposal(proposalId, proposer, createdAt, true);
    }
}
