package assetup.ledger.dto.token;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.math.BigInteger;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of mint and burn requests. The caller must be the asset tokenizer.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SupplyChangeRequest {

    @NotNull(message = "Amount is required")
    private BigInteger amount;

    @NotBlank(message = "Caller address is required")
    private String caller;
}
