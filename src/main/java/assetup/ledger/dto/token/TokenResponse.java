package assetup.ledger.dto.token;

import assetup.ledger.model.TokenMetadata;
import assetup.ledger.model.TokenizedAsset;
import assetup.ledger.util.LedgerInputValidator;
import java.math.BigInteger;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TokenResponse {
    private String assetId;
    private String symbol;
    private BigInteger totalSupply;
    private int decimals;
    private String tokenizer;
    private BigInteger minVotingThreshold;
    private BigInteger valuation;
    private TokenMetadata metadata;
    private long tokenizedAt;
    private boolean detokenized;

    public static TokenResponse from(TokenizedAsset asset) {
        return TokenResponse.builder()
            .assetId(LedgerInputValidator.formatUnsignedId(asset.assetId()))
            .symbol(asset.symbol())
            .totalSupply(asset.totalSupply())
            .decimals(asset.decimals())
            .tokenizer(asset.tokenizer())
            .minVotingThreshold(asset.minVotingThreshold())
            .valuation(asset.valuation())
            .metadata(asset.metadata())
            .tokenizedAt(asset.tokenizedAt())
            .detokenized(asset.detokenized())
            .build();
    }
}
