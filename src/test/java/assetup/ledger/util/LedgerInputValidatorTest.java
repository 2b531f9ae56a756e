package assetup.ledger.util;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;
import org.web3j.crypto.Keys;

class LedgerInputValidatorTest {

    private static final String LOWERCASE = "0x5aaeb6053f3e94c9b9a09f33669435e7ef1beaed";

    @Nested
    @DisplayName("Addresses")
    class Addresses {

        @Test
        @DisplayName("Should accept lowercase and checksummed addresses")
        void shouldAcceptValidAddresses() {
            assertThat(LedgerInputValidator.isValidAddress(LOWERCASE)).isTrue();
            assertThat(LedgerInputValidator.isValidAddress(Keys.toChecksumAddress(LOWERCASE))).isTrue();
        }

        @ParameterizedTest
        @NullAndEmptySource
        @ValueSource(strings = {
            "5aaeb6053f3e94c9b9a09f33669435e7ef1beaed",
            "0x5aaeb6053f3e94c9b9a09f33669435e7ef1bea",
            "0xzzaeb6053f3e94c9b9a09f33669435e7ef1beaed",
            "0x5AAEB6053F3E94C9B9A09F33669435E7EF1BEAED"
        })
        @DisplayName("Should reject malformed addresses and bad checksums")
        void shouldRejectInvalidAddresses(String address) {
            assertThat(LedgerInputValidator.isValidAddress(address)).isFalse();
        }

        @Test
        @DisplayName("Should normalize to lowercase")
        void shouldNormalize() {
            assertThat(LedgerInputValidator.normalizeAddress(Keys.toChecksumAddress(LOWERCASE), "holder"))
                .isEqualTo(LOWERCASE);
        }

        @Test
        @DisplayName("Should name the field when normalization fails")
        void shouldNameField() {
            assertThatThrownBy(() -> LedgerInputValidator.normalizeAddress("0x12\n", "holder"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("holder")
                .hasMessageNotContaining("\n");
        }
    }

    @Nested
    @DisplayName("Unsigned ids")
    class UnsignedIds {

        @Test
        @DisplayName("Should carry ids above Long.MAX_VALUE in the sign bit")
        void shouldParseFullRange() {
            long id = LedgerInputValidator.parseUnsignedId("18446744073709551615", "assetId");

            assertThat(id).isEqualTo(-1L);
            assertThat(LedgerInputValidator.formatUnsignedId(id)).isEqualTo("18446744073709551615");
        }

        @ParameterizedTest
        @ValueSource(strings = {"", " ", "-1", "18446744073709551616", "abc"})
        @DisplayName("Should reject values outside the unsigned 64-bit range")
        void shouldRejectInvalidIds(String value) {
            assertThatThrownBy(() -> LedgerInputValidator.parseUnsignedId(value, "assetId"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("assetId");
        }
    }
}
