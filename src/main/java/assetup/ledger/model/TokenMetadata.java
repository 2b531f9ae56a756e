package assetup.ledger.model;

import java.util.List;
import lombok.Builder;

/**
 * Descriptive data attached to a tokenized asset at tokenization time.
 *
 * @param ipfsUri optional, may be null
 * @param legalDocsHash optional, may be null
 * @param valuationReportHash optional, may be null
 */
@Builder
public record TokenMetadata(
    String name,
    String description,
    AssetType assetType,
    String ipfsUri,
    String legalDocsHash,
    String valuationReportHash,
    boolean accreditedInvestorRequired,
    List<String> geographicRestrictions
) {
    public TokenMetadata {
        geographicRestrictions = geographicRestrictions == null ? List.of() : List.copyOf(geographicRestrictions);
    }
}
