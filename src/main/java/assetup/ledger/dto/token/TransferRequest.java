package assetup.ledger.dto.token;

import jakarta.validation.constraints.NotBlank;
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
public class TransferRequest {

    @NotBlank(message = "Sender address is required")
    private String from;

    @NotBlank(message = "Recipient address is required")
    private String to;

    @NotNull(message = "Amount is required")
    private BigInteger amount;
}
