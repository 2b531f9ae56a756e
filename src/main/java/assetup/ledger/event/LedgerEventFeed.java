package assetup.ledger.event;

import assetup.ledger.config.LedgerProperties;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Logs committed ledger events and keeps the most recent ones for indexers
 * and UIs polling {@code GET /events}.
 */
@Component
@Slf4j
public class LedgerEventFeed {

    private final Deque<LedgerEvent> recent = new ArrayDeque<>();
    private final int retained;

    public LedgerEventFeed(LedgerProperties properties) {
        this.retained = Math.max(1, properties.getEvents().getRetained());
    }

    @EventListener
    public void onLedgerEvent(LedgerEvent event) {
        log.info("Ledger event {} {}", event.getTopic(), event.getPayload());
        synchronized (recent) {
            recent.addLast(event);
            while (recent.size() > retained) {
                recent.removeFirst();
            }
        }
    }

    /**
     * Returns retained events oldest first, optionally limited to one asset.
     */
    public List<LedgerEvent> recent(Long assetId) {
        synchronized (recent) {
            List<LedgerEvent> result = new ArrayList<>(recent.size());
            for (LedgerEvent event : recent) {
                if (assetId == null || Objects.equals(event.getPayload().get("assetId"), assetId)) {
                    result.add(event);
                }
            }
            return result;
        }
    }
}
