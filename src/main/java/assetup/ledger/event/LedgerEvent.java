package assetup.ledger.event;

import java.util.Map;
import lombok.Getter;
import org.springframework.context.ApplicationEvent;

/**
 * Notification emitted by a committed ledger call, e.g. topic
 * {@code token/transferred}. Published to Spring listeners only after the
 * call that produced it has committed.
 */
@Getter
public class LedgerEvent extends ApplicationEvent {

    private final String topic;
    private final Map<String, Object> payload;
    private final long ledgerTimestamp;

    public LedgerEvent(Object source, String topic, Map<String, Object> payload, long ledgerTimestamp) {
        super(source);
        this.topic = topic;
        this.payload = Map.copyOf(payload);
        this.ledgerTimestamp = ledgerTimestamp;
    }
}
