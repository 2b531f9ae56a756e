package assetup.ledger.service.token;

import static assetup.ledger.support.LedgerTestHarness.ALICE;
import static assetup.ledger.support.LedgerTestHarness.BOB;
import static assetup.ledger.support.LedgerTestHarness.CAROL;
import static assetup.ledger.support.LedgerAssertions.assertLedgerError;
import static org.assertj.core.api.Assertions.assertThat;

import assetup.ledger.exception.LedgerError;
import assetup.ledger.model.TokenizedAsset;
import assetup.ledger.support.LedgerTestHarness;
import assetup.ledger.util.CheckedMath;
import java.math.BigInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class TokenRegistryServiceTest {

    private static final long ASSET = 42L;

    private LedgerTestHarness ledger;
    private TokenRegistryService registry;

    @BeforeEach
    void setUp() {
        ledger = new LedgerTestHarness();
        registry = ledger.tokenRegistry;
    }

    private static BigInteger big(long value) {
        return BigInteger.valueOf(value);
    }

    @Nested
    @DisplayName("Tokenize")
    class TokenizeTests {

        @Test
        @DisplayName("Should credit the whole supply to the tokenizer")
        void shouldCreditWholeSupplyToTokenizer() {
            TokenizedAsset asset = ledger.tokenize(ASSET, 1000, ALICE);

            assertThat(asset.totalSupply()).isEqualTo(big(1000));
            assertThat(asset.tokenizer()).isEqualTo(ALICE);
            assertThat(asset.tokenizedAt()).isEqualTo(LedgerTestHarness.START_TIME);
            assertThat(asset.valuation()).isEqualTo(BigInteger.ZERO);
            assertThat(registry.balance(ASSET, ALICE)).isEqualTo(big(1000));
            assertThat(registry.holders(ASSET)).containsExactly(ALICE);
            assertThat(ledger.topics()).containsExactly("token/tokenized");
        }

        @Test
        @DisplayName("Should reject a second tokenization of the same asset")
        void shouldRejectDuplicateTokenization() {
            ledger.tokenize(ASSET, 1000, ALICE);

            assertLedgerError(() -> ledger.tokenize(ASSET, 500, BOB), LedgerError.ASSET_ALREADY_TOKENIZED);
            assertThat(registry.tokenizedAsset(ASSET).tokenizer()).isEqualTo(ALICE);
        }

        @Test
        @DisplayName("Should reject a non-positive supply")
        void shouldRejectNonPositiveSupply() {
            assertLedgerError(() -> ledger.tokenize(ASSET, 0, ALICE), LedgerError.INVALID_TOKEN_SUPPLY);
        }

        @Test
        @DisplayName("Should reject decimals above the configured maximum")
        void shouldRejectTooManyDecimals() {
            assertLedgerError(() -> registry.tokenize(ASSET, "WH7", big(1000), 19, BigInteger.ZERO, ALICE,
                LedgerTestHarness.sampleMetadata()), LedgerError.INVALID_TOKEN_DECIMALS);
        }

        @Test
        @DisplayName("Should accept unsigned asset ids above Long.MAX_VALUE")
        void shouldAcceptLargeUnsignedIds() {
            long id = Long.parseUnsignedLong("18446744073709551615");
            ledger.tokenize(id, 10, ALICE);

            assertThat(registry.tokenizedAsset(id).assetId()).isEqualTo(id);
        }

        @Test
        @DisplayName("Should require the tokenizer to be authenticated")
        void shouldRequireTokenizerAuthentication() {
            ledger.rejectAuthFor(ALICE);

            assertLedgerError(() -> ledger.tokenize(ASSET, 1000, ALICE), LedgerError.UNAUTHORIZED);
            assertThat(ledger.backend.size()).isZero();
        }
    }

    @Nested
    @DisplayName("Mint and burn")
    class SupplyTests {

        @BeforeEach
        void tokenize() {
            ledger.tokenize(ASSET, 1000, ALICE);
        }

        @Test
        @DisplayName("Should increase supply and tokenizer balance on mint")
        void shouldIncreaseSupplyOnMint() {
            TokenizedAsset asset = registry.mint(ASSET, big(250), ALICE);

            assertThat(asset.totalSupply()).isEqualTo(big(1250));
            assertThat(registry.balance(ASSET, ALICE)).isEqualTo(big(1250));
            assertThat(ledger.sumOfBalances(ASSET)).isEqualTo(asset.totalSupply());
        }

        @Test
        @DisplayName("Should re-add the tokenizer to the holder set when minting from zero")
        void shouldReAddTokenizerWhenMintingFromZero() {
            registry.transfer(ASSET, ALICE, BOB, big(1000));
            assertThat(registry.holders(ASSET)).containsExactly(BOB);

            registry.mint(ASSET, big(10), ALICE);

            assertThat(registry.holders(ASSET)).containsExactlyInAnyOrder(ALICE, BOB);
        }

        @Test
        @DisplayName("Should only let the tokenizer mint")
        void shouldOnlyLetTokenizerMint() {
            assertLedgerError(() -> registry.mint(ASSET, big(10), BOB), LedgerError.UNAUTHORIZED);
        }

        @Test
        @DisplayName("Should reject a zero mint amount")
        void shouldRejectZeroMint() {
            assertLedgerError(() -> registry.mint(ASSET, BigInteger.ZERO, ALICE), LedgerError.INVALID_TOKEN_SUPPLY);
        }

        @Test
        @DisplayName("Should fail with overflow when supply leaves the 128-bit range")
        void shouldFailWithOverflow() {
            BigInteger headroom = CheckedMath.MAX_AMOUNT.subtract(big(1000));
            registry.mint(ASSET, headroom, ALICE);

            assertLedgerError(() -> registry.mint(ASSET, BigInteger.ONE, ALICE), LedgerError.MATH_OVERFLOW);
            assertThat(registry.tokenizedAsset(ASSET).totalSupply()).isEqualTo(CheckedMath.MAX_AMOUNT);
        }

        @Test
        @DisplayName("Should decrease supply on burn")
        void shouldDecreaseSupplyOnBurn() {
            TokenizedAsset asset = registry.burn(ASSET, big(100), ALICE);

            assertThat(asset.totalSupply()).isEqualTo(big(900));
            assertThat(registry.balance(ASSET, ALICE)).isEqualTo(big(900));
        }

        @Test
        @DisplayName("Should drop the burner from holders when burning everything")
        void shouldDropBurnerAtZero() {
            registry.burn(ASSET, big(1000), ALICE);

            assertThat(registry.holders(ASSET)).isEmpty();
            assertThat(registry.tokenizedAsset(ASSET).totalSupply()).isEqualTo(BigInteger.ZERO);
        }

        @Test
        @DisplayName("Should reject burning more than the balance")
        void shouldRejectBurnAboveBalance() {
            registry.transfer(ASSET, ALICE, BOB, big(500));

            assertLedgerError(() -> registry.burn(ASSET, big(501), ALICE), LedgerError.INSUFFICIENT_BALANCE);
        }
    }

    @Nested
    @DisplayName("Transfer")
    class TransferTests {

        @BeforeEach
        void tokenize() {
            ledger.tokenize(ASSET, 1000, ALICE);
            ledger.publishedEvents.clear();
        }

        @Test
        @DisplayName("Should move balance and update both holder sets")
        void shouldMoveBalance() {
            registry.transfer(ASSET, ALICE, BOB, big(250));

            assertThat(registry.balance(ASSET, ALICE)).isEqualTo(big(750));
            assertThat(registry.balance(ASSET, BOB)).isEqualTo(big(250));
            assertThat(registry.holders(ASSET)).containsExactly(ALICE, BOB);
            assertThat(ledger.sumOfBalances(ASSET)).isEqualTo(big(1000));
            assertThat(ledger.topics()).containsExactly("token/transferred");
        }

        @Test
        @DisplayName("Should remove the sender when the full balance is transferred")
        void shouldRemoveSenderOnFullTransfer() {
            registry.transfer(ASSET, ALICE, BOB, big(1000));

            assertThat(registry.holders(ASSET)).containsExactly(BOB);
            assertThat(registry.balance(ASSET, ALICE)).isEqualTo(BigInteger.ZERO);
        }

        @Test
        @DisplayName("Should reject transferring balance plus one without any state change")
        void shouldRejectBalancePlusOne() {
            assertLedgerError(() -> registry.transfer(ASSET, ALICE, BOB, big(1001)), LedgerError.INSUFFICIENT_BALANCE);

            assertThat(registry.balance(ASSET, ALICE)).isEqualTo(big(1000));
            assertThat(registry.holders(ASSET)).containsExactly(ALICE);
            assertThat(ledger.publishedEvents).isEmpty();
        }

        @Test
        @DisplayName("Should reject a transfer not signed by the sender")
        void shouldRejectUnsignedTransfer() {
            ledger.rejectAuthFor(ALICE);

            assertLedgerError(() -> registry.transfer(ASSET, ALICE, BOB, big(1)), LedgerError.UNAUTHORIZED);
        }

        @Test
        @DisplayName("Should run the restriction gate before moving tokens")
        void shouldApplyRestrictionGate() {
            ledger.restrictionGate.addToWhitelist(ASSET, CAROL);

            assertLedgerError(() -> registry.transfer(ASSET, ALICE, BOB, big(1)), LedgerError.TRANSFER_RESTRICTION_FAILED);

            registry.transfer(ASSET, ALICE, CAROL, big(1));
            assertThat(registry.balance(ASSET, CAROL)).isEqualTo(BigInteger.ONE);
        }

        @Test
        @DisplayName("Should reject transfers of a locked sender")
        void shouldRejectLockedSender() {
            ledger.lockManager.lock(ASSET, ALICE, LedgerTestHarness.START_TIME + 60, ALICE);

            assertLedgerError(() -> registry.transfer(ASSET, ALICE, BOB, big(1)), LedgerError.TOKENS_ARE_LOCKED);
        }

        @Test
        @DisplayName("Should reject non-positive amounts")
        void shouldRejectNonPositiveAmount() {
            assertLedgerError(() -> registry.transfer(ASSET, ALICE, BOB, big(-5)), LedgerError.INVALID_TOKEN_SUPPLY);
        }

        @Test
        @DisplayName("Should keep supply equal to the sum of balances across many moves")
        void shouldKeepSupplyInvariant() {
            registry.transfer(ASSET, ALICE, BOB, big(300));
            registry.transfer(ASSET, BOB, CAROL, big(100));
            registry.mint(ASSET, big(50), ALICE);
            registry.transfer(ASSET, CAROL, ALICE, big(100));
            registry.burn(ASSET, big(20), ALICE);

            assertThat(ledger.sumOfBalances(ASSET)).isEqualTo(registry.tokenizedAsset(ASSET).totalSupply());
            assertThat(registry.holders(ASSET)).containsExactly(ALICE, BOB);
        }
    }

    @Nested
    @DisplayName("Queries and valuation")
    class QueryTests {

        @Test
        @DisplayName("Should report ownership in basis points")
        void shouldReportOwnershipInBasisPoints() {
            ledger.tokenize(ASSET, 1000, ALICE);
            assertThat(registry.ownershipPercentage(ASSET, ALICE)).isEqualTo(big(10_000));

            registry.transfer(ASSET, ALICE, BOB, big(250));

            assertThat(registry.ownershipPercentage(ASSET, BOB)).isEqualTo(big(2500));
            assertThat(registry.ownershipPercentage(ASSET, ALICE)).isEqualTo(big(7500));
        }

        @Test
        @DisplayName("Should fail ownership queries when the supply is zero")
        void shouldFailOwnershipWithZeroSupply() {
            ledger.tokenize(ASSET, 1000, ALICE);
            registry.burn(ASSET, big(1000), ALICE);

            assertLedgerError(() -> registry.ownershipPercentage(ASSET, ALICE), LedgerError.ASSET_NOT_TOKENIZED);
        }

        @Test
        @DisplayName("Should fail lookups of unknown assets")
        void shouldFailUnknownAsset() {
            assertLedgerError(() -> registry.tokenizedAsset(7L), LedgerError.ASSET_NOT_TOKENIZED);
        }

        @Test
        @DisplayName("Should update a positive valuation and reject zero")
        void shouldUpdateValuation() {
            ledger.tokenize(ASSET, 1000, ALICE);

            assertThat(registry.updateValuation(ASSET, big(5_000_000)).valuation()).isEqualTo(big(5_000_000));
            assertLedgerError(() -> registry.updateValuation(ASSET, BigInteger.ZERO), LedgerError.INVALID_VALUATION);
            assertThat(registry.tokenizedAsset(ASSET).valuation()).isEqualTo(big(5_000_000));
        }

        @Test
        @DisplayName("Should only let the tokenizer revalue the asset")
        void shouldRequireTokenizerForValuation() {
            ledger.tokenize(ASSET, 1000, ALICE);
            ledger.rejectAuthFor(ALICE);

            assertLedgerError(() -> registry.updateValuation(ASSET, big(5_000_000)), LedgerError.UNAUTHORIZED);
            assertThat(registry.tokenizedAsset(ASSET).valuation()).isEqualTo(BigInteger.ZERO);
        }
    }

    @Nested
    @DisplayName("Detokenized assets")
    class DetokenizedTests {

        @BeforeEach
        void detokenize() {
            ledger.tokenize(ASSET, 1000, ALICE);
            registry.markDetokenized(ASSET);
        }

        @Test
        @DisplayName("Should reject mint, burn and transfer after detokenization")
        void shouldRejectMutations() {
            assertLedgerError(() -> registry.mint(ASSET, big(1), ALICE), LedgerError.ASSET_NOT_TOKENIZED);
            assertLedgerError(() -> registry.burn(ASSET, big(1), ALICE), LedgerError.ASSET_NOT_TOKENIZED);
            assertLedgerError(() -> registry.transfer(ASSET, ALICE, BOB, big(1)), LedgerError.ASSET_NOT_TOKENIZED);
        }

        @Test
        @DisplayName("Should still answer balance queries")
        void shouldStillAnswerQueries() {
            assertThat(registry.balance(ASSET, ALICE)).isEqualTo(big(1000));
            assertThat(registry.tokenizedAsset(ASSET).detokenized()).isTrue();
        }
    }
}
