package assetup.ledger.dto.token;

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
public class ValuationRequest {

    @NotNull(message = "Valuation is required")
    private BigInteger valuation;
}
