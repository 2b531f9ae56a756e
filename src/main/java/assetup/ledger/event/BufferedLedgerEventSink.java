package assetup.ledger.event;

import assetup.ledger.clock.LedgerClock;
import assetup.ledger.store.LedgerTransactionManager;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Queues events on the active ledger call; they reach Spring listeners once
 * the call commits.
 */
@Component
public class BufferedLedgerEventSink implements LedgerEventSink {

    private final LedgerTransactionManager transactions;
    private final LedgerClock clock;

    public BufferedLedgerEventSink(LedgerTransactionManager transactions, LedgerClock clock) {
        this.transactions = transactions;
        this.clock = clock;
    }

    @Override
    public void publish(String topic, Map<String, Object> payload) {
        transactions.enqueueEvent(new LedgerEvent(this, topic, payload, clock.currentTimestamp()));
    }
}
