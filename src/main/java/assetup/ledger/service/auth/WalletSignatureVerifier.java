package assetup.ledger.service.auth;

import assetup.ledger.config.LedgerProperties;
import assetup.ledger.util.LedgerInputValidator;
import assetup.ledger.util.LogSanitizer;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.SignatureException;
import java.util.Arrays;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.web3j.crypto.Hash;
import org.web3j.crypto.Keys;
import org.web3j.crypto.Sign;
import org.web3j.utils.Numeric;

/**
 * Verifies personal-sign signatures that ledger callers attach to requests.
 * The signed message is {@code "AssetUp ledger request: <timestamp-ms>"}.
 */
@Service
@Slf4j
public class WalletSignatureVerifier {

    static final String MESSAGE_PREFIX = "AssetUp ledger request: ";

    private final AntiReplayService antiReplayService;
    private final long windowMs;

    public WalletSignatureVerifier(AntiReplayService antiReplayService, LedgerProperties properties) {
        this.antiReplayService = antiReplayService;
        this.windowMs = properties.getAuth().getSignatureWindow().toMillis();
    }

    public static String messageFor(long timestampMs) {
        return MESSAGE_PREFIX + timestampMs;
    }

    /**
     * Verifies that {@code signatureHex} was produced by {@code address} over
     * the message for {@code timestampMs}, that the timestamp is fresh and has
     * not been used before.
     *
     * @return true if the request may act as {@code address}
     */
    public boolean verify(String address, long timestampMs, String signatureHex) {
        if (!LedgerInputValidator.isValidAddress(address) || signatureHex == null || signatureHex.isBlank()) {
            return false;
        }
        if (Math.abs(System.currentTimeMillis() - timestampMs) > windowMs) {
            log.warn("Signed request from {} rejected: timestamp outside window", LogSanitizer.maskAddress(address));
            return false;
        }
        String recovered;
        try {
            recovered = recoverAddress(messageFor(timestampMs), signatureHex);
        } catch (SignatureException | RuntimeException e) {
            log.warn("Signature verification failed for {}: {}", LogSanitizer.maskAddress(address), e.getMessage());
            return false;
        }
        if (!address.equalsIgnoreCase(recovered)) {
            log.warn("Signature of {} recovered to a different address", LogSanitizer.maskAddress(address));
            return false;
        }
        return !antiReplayService.isTimestampUsed(address, timestampMs);
    }

    /**
     * Recovers the signing address of an EIP-191 personal message.
     */
    String recoverAddress(String message, String signatureHex) throws SignatureException {
        byte[] messageBytes = message.getBytes(StandardCharsets.UTF_8);
        String prefixed = "\u0019Ethereum Signed Message:\n" + messageBytes.length + message;
        byte[] messageHash = Hash.sha3(prefixed.getBytes(StandardCharsets.UTF_8));

        byte[] signatureBytes = Numeric.hexStringToByteArray(signatureHex);
        if (signatureBytes.length != 65) {
            throw new SignatureException("Invalid signature length: " + signatureBytes.length);
        }

        int recoveryId = signatureBytes[64] & 0xFF;
        if (recoveryId < 27) {
            recoveryId += 27;
        }
        Sign.SignatureData signatureData = new Sign.SignatureData(
            (byte) recoveryId,
            Arrays.copyOfRange(signatureBytes, 0, 32),
            Arrays.copyOfRange(signatureBytes, 32, 64)
        );

        BigInteger publicKey = Sign.signedMessageHashToKey(messageHash, signatureData);
        return "0x" + Keys.getAddress(publicKey);
    }
}
