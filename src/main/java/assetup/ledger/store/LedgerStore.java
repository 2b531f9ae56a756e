package assetup.ledger.store;

import java.util.Optional;

/**
 * Keyed persistent storage seen by ledger services. All calls take part in
 * the enclosing ledger call and become visible to others only on commit.
 */
public interface LedgerStore {

    <V> Optional<V> get(LedgerKey<V> key);

    <V> void set(LedgerKey<V> key, V value);

    boolean has(LedgerKey<?> key);

    void remove(LedgerKey<?> key);
}
