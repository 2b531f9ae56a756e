package assetup.ledger.store;

import java.util.Map;
import java.util.Optional;

/**
 * Committed ledger state. Change sets are applied all at once; an empty
 * optional in a change set removes the key.
 */
public interface LedgerBackend {

    Optional<Object> read(LedgerKey<?> key);

    void commit(Map<LedgerKey<?>, Optional<Object>> changes);

    int size();
}
