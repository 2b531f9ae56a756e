package assetup.ledger.model;

import java.util.List;

/**
 * Transfer policy of an asset.
 *
 * @param requireAccredited recipients must appear on the asset whitelist
 * @param geographicAllowed region codes recorded with the policy
 */
public record TransferRestriction(boolean requireAccredited, List<String> geographicAllowed) {

    public TransferRestriction {
        geographicAllowed = geographicAllowed == null ? List.of() : List.copyOf(geographicAllowed);
    }
}
