package assetup.ledger.service.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import assetup.ledger.config.LedgerProperties;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.web3j.crypto.Credentials;
import org.web3j.crypto.Keys;
import org.web3j.crypto.Sign;
import org.web3j.utils.Numeric;

@ExtendWith(MockitoExtension.class)
class WalletSignatureVerifierTest {

    @Mock
    private AntiReplayService antiReplayService;

    private WalletSignatureVerifier verifier;
    private Credentials credentials;

    @BeforeEach
    void setUp() throws Exception {
        verifier = new WalletSignatureVerifier(antiReplayService, new LedgerProperties());
        credentials = Credentials.create(Keys.createEcKeyPair());
        lenient().when(antiReplayService.isTimestampUsed(anyString(), anyLong())).thenReturn(false);
    }

    private String sign(String message) {
        Sign.SignatureData signature = Sign.signPrefixedMessage(
            message.getBytes(StandardCharsets.UTF_8), credentials.getEcKeyPair());
        byte[] bytes = new byte[65];
        System.arraycopy(signature.getR(), 0, bytes, 0, 32);
        System.arraycopy(signature.getS(), 0, bytes, 32, 32);
        bytes[64] = signature.getV()[0];
        return Numeric.toHexString(bytes);
    }

    @Nested
    @DisplayName("Signature recovery")
    class RecoveryTests {

        @Test
        @DisplayName("Should recover the signing address")
        void shouldRecoverSigner() throws Exception {
            String message = WalletSignatureVerifier.messageFor(1234L);

            assertThat(verifier.recoverAddress(message, sign(message)))
                .isEqualToIgnoringCase(credentials.getAddress());
        }

        @Test
        @DisplayName("Should accept recovery ids without the 27 offset")
        void shouldAcceptZeroBasedRecoveryId() throws Exception {
            String message = WalletSignatureVerifier.messageFor(1234L);
            byte[] bytes = Numeric.hexStringToByteArray(sign(message));
            bytes[64] = (byte) (bytes[64] - 27);

            assertThat(verifier.recoverAddress(message, Numeric.toHexString(bytes)))
                .isEqualToIgnoringCase(credentials.getAddress());
        }
    }

    @Nested
    @DisplayName("Request verification")
    class VerifyTests {

        @Test
        @DisplayName("Should accept a fresh signature by the claimed wallet")
        void shouldAcceptFreshSignature() {
            long now = System.currentTimeMillis();

            assertThat(verifier.verify(credentials.getAddress(), now,
                sign(WalletSignatureVerifier.messageFor(now)))).isTrue();
            verify(antiReplayService).isTimestampUsed(credentials.getAddress(), now);
        }

        @Test
        @DisplayName("Should reject a signature by another wallet")
        void shouldRejectOtherSigner() {
            long now = System.currentTimeMillis();
            String other = "0x" + "1".repeat(40);

            assertThat(verifier.verify(other, now, sign(WalletSignatureVerifier.messageFor(now)))).isFalse();
        }

        @Test
        @DisplayName("Should reject a timestamp outside the window")
        void shouldRejectStaleTimestamp() {
            long stale = System.currentTimeMillis() - 10 * 60 * 1000;

            assertThat(verifier.verify(credentials.getAddress(), stale,
                sign(WalletSignatureVerifier.messageFor(stale)))).isFalse();
            verify(antiReplayService, never()).isTimestampUsed(anyString(), anyLong());
        }

        @Test
        @DisplayName("Should reject a replayed timestamp")
        void shouldRejectReplay() {
            long now = System.currentTimeMillis();
            when(antiReplayService.isTimestampUsed(credentials.getAddress(), now)).thenReturn(true);

            assertThat(verifier.verify(credentials.getAddress(), now,
                sign(WalletSignatureVerifier.messageFor(now)))).isFalse();
        }

        @Test
        @DisplayName("Should reject malformed input")
        void shouldRejectMalformedInput() {
            long now = System.currentTimeMillis();

            assertThat(verifier.verify("not-an-address", now, "0x1234")).isFalse();
            assertThat(verifier.verify(credentials.getAddress(), now, "0x1234")).isFalse();
            assertThat(verifier.verify(credentials.getAddress(), now, "")).isFalse();
        }
    }
}
