package assetup.ledger.store;

import java.util.Objects;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * {@link LedgerStore} view over the active call frame: reads see the call's
 * own pending writes first, then committed state.
 */
@Component
public class TransactionalLedgerStore implements LedgerStore {

    private final LedgerTransactionManager transactions;

    public TransactionalLedgerStore(LedgerTransactionManager transactions) {
        this.transactions = transactions;
    }

    @Override
    @SuppressWarnings("unchecked")
    public <V> Optional<V> get(LedgerKey<V> key) {
        LedgerTransactionManager.CallFrame frame = transactions.requireFrame();
        Optional<Object> value = frame.isStaged(key)
            ? frame.staged(key)
            : transactions.backend().read(key);
        return value.map(v -> (V) v);
    }

    @Override
    public <V> void set(LedgerKey<V> key, V value) {
        Objects.requireNonNull(value, "Ledger values cannot be null, use remove()");
        transactions.requireFrame().stage(key, Optional.of(value));
    }

    @Override
    public boolean has(LedgerKey<?> key) {
        return get(key).isPresent();
    }

    @Override
    public void remove(LedgerKey<?> key) {
        transactions.requireFrame().stage(key, Optional.empty());
    }
}
