package assetup.ledger.dto.token;

import java.math.BigInteger;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * An amount tied to one holder of one asset: a balance, an ownership share in
 * basis points, or a dividend.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HolderAmountResponse {
    private String assetId;
    private String holder;
    private BigInteger amount;
}
