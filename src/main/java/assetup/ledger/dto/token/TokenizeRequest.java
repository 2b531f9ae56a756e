package assetup.ledger.dto.token;

import assetup.ledger.model.TokenMetadata;
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
public class TokenizeRequest {

    @NotBlank(message = "Asset id is required")
    private String assetId;

    @NotBlank(message = "Symbol is required")
    private String symbol;

    @NotNull(message = "Total supply is required")
    private BigInteger totalSupply;

    @NotNull(message = "Decimals are required")
    private Integer decimals;

    private BigInteger minVotingThreshold; // defaults to 0

    @NotBlank(message = "Tokenizer address is required")
    private String tokenizer;

    @NotNull(message = "Metadata is required")
    private TokenMetadata metadata;
}
