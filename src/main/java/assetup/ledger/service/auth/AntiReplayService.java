package assetup.ledger.service.auth;

import assetup.ledger.config.LedgerProperties;
import assetup.ledger.util.LogSanitizer;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Remembers signed request timestamps per wallet so a captured signature
 * cannot be replayed within the signature window.
 */
@Service
@Slf4j
public class AntiReplayService {

    private final long windowMs;

    // wallet-timestamp -> insertion time
    private final Map<String, Long> usedTimestamps = new ConcurrentHashMap<>();

    public AntiReplayService(LedgerProperties properties) {
        this.windowMs = properties.getAuth().getSignatureWindow().toMillis();
    }

    /**
     * Checks if a timestamp has been used and marks it as used.
     *
     * @return true if the timestamp was already used (replay), false if it is new
     */
    public boolean isTimestampUsed(String walletAddress, long timestamp) {
        String key = walletAddress.toLowerCase() + "-" + timestamp;

        cleanupExpiredTimestamps();

        if (usedTimestamps.putIfAbsent(key, System.currentTimeMillis()) != null) {
            log.warn("Replay detected for wallet {} with timestamp {}",
                LogSanitizer.maskAddress(walletAddress), timestamp);
            return true;
        }
        return false;
    }

    public int getTrackedTimestampCount() {
        return usedTimestamps.size();
    }

    private void cleanupExpiredTimestamps() {
        long cutoff = System.currentTimeMillis() - windowMs;
        usedTimestamps.entrySet().removeIf(entry -> entry.getValue() < cutoff);
    }
}
