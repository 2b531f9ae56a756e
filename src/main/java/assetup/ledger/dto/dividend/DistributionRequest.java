package assetup.ledger.dto.dividend;

import jakarta.validation.constraints.NotNull;
import java.math.BigInteger;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DistributionRequest {

    @NotNull(message = "Amount is required")
    private BigInteger amount;
}
