package assetup.ledger.model;

import java.math.BigInteger;
import lombok.Builder;

/**
 * Registry entry of a tokenized asset. Immutable; updates store a modified copy.
 *
 * @param totalSupply always equals the sum of all holder balances
 * @param valuation zero until the first valuation update
 * @param detokenized set once a detokenization proposal has been executed
 */
@Builder(toBuilder = true)
public record TokenizedAsset(
    long assetId,
    String symbol,
    BigInteger totalSupply,
    int decimals,
    String tokenizer,
    BigInteger minVotingThreshold,
    BigInteger valuation,
    TokenMetadata metadata,
    long tokenizedAt,
    boolean detokenized
) {
}
