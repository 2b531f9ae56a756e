package assetup.ledger.dto.dividend;

import java.math.BigInteger;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DistributionResponse {
    private String assetId;
    private BigInteger amount;
    private BigInteger credited; // sum of floored shares
}
