package assetup.ledger.event;

import static org.assertj.core.api.Assertions.assertThat;

import assetup.ledger.config.LedgerProperties;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class LedgerEventFeedTest {

    private static LedgerEvent event(String topic, long assetId, long timestamp) {
        return new LedgerEvent(LedgerEventFeedTest.class, topic, Map.of("assetId", assetId), timestamp);
    }

    @Test
    @DisplayName("Should keep only the most recent events")
    void shouldBoundRetainedEvents() {
        LedgerProperties properties = new LedgerProperties();
        properties.getEvents().setRetained(2);
        LedgerEventFeed feed = new LedgerEventFeed(properties);

        feed.onLedgerEvent(event("token/tokenized", 1L, 1L));
        feed.onLedgerEvent(event("token/minted", 1L, 2L));
        feed.onLedgerEvent(event("token/burned", 1L, 3L));

        assertThat(feed.recent(null))
            .extracting(LedgerEvent::getTopic)
            .containsExactly("token/minted", "token/burned");
    }

    @Test
    @DisplayName("Should filter by asset")
    void shouldFilterByAsset() {
        LedgerEventFeed feed = new LedgerEventFeed(new LedgerProperties());

        feed.onLedgerEvent(event("token/tokenized", 1L, 1L));
        feed.onLedgerEvent(event("token/tokenized", 2L, 2L));

        assertThat(feed.recent(2L))
            .singleElement()
            .extracting(LedgerEvent::getLedgerTimestamp)
            .isEqualTo(2L);
        assertThat(feed.recent(3L)).isEmpty();
    }

    @Test
    @DisplayName("Should snapshot the payload")
    void shouldCopyPayload() {
        Map<String, Object> payload = new HashMap<>();
        payload.put("assetId", 1L);
        LedgerEvent event = new LedgerEvent(this, "token/tokenized", payload, 1L);

        payload.put("assetId", 2L);

        assertThat(event.getPayload()).containsEntry("assetId", 1L);
    }
}
