package assetup.ledger.event;

import java.util.Map;

/**
 * Fire-and-forget notifications for external observers. Nothing published
 * here is read back by the ledger.
 */
public interface LedgerEventSink {

    void publish(String topic, Map<String, Object> payload);
}
