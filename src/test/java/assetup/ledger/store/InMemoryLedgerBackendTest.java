package assetup.ledger.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import assetup.ledger.config.LedgerProperties;
import assetup.ledger.model.DetokenizationProposal;
import assetup.ledger.model.TokenizedAsset;
import assetup.ledger.model.TransferRestriction;
import assetup.ledger.support.LedgerTestHarness;
import java.math.BigInteger;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class InMemoryLedgerBackendTest {

    private static final String ALICE_ID = LedgerTestHarness.ALICE;

    @TempDir
    Path tempDir;

    private LedgerProperties persistentProperties(Path file) {
        LedgerProperties properties = new LedgerProperties();
        properties.getPersistence().setEnabled(true);
        properties.getPersistence().setFilePath(file.toString());
        return properties;
    }

    @Test
    @DisplayName("Should keep state in memory only when persistence is disabled")
    void shouldStayInMemoryByDefault() {
        InMemoryLedgerBackend backend = new InMemoryLedgerBackend(new LedgerProperties());
        backend.loadSnapshot();

        backend.commit(Map.<LedgerKey<?>, Optional<Object>>of(new LedgerKeys.RevenueSharing(1L), Optional.of(true)));

        assertThat(backend.read(new LedgerKeys.RevenueSharing(1L))).contains(true);
        assertThat(backend.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should reload committed state from the snapshot file")
    void shouldReloadSnapshot() {
        Path file = tempDir.resolve("ledger/snapshot.json");
        InMemoryLedgerBackend writer = new InMemoryLedgerBackend(persistentProperties(file));

        LedgerTestHarness fixture = new LedgerTestHarness();
        TokenizedAsset asset = fixture.tokenize(42L, 1000, ALICE_ID);

        Map<LedgerKey<?>, Optional<Object>> changes = new LinkedHashMap<>();
        changes.put(new LedgerKeys.Asset(42L), Optional.of(asset));
        changes.put(new LedgerKeys.Balance(42L, ALICE_ID), Optional.of(BigInteger.valueOf(1000)));
        changes.put(new LedgerKeys.HolderSet(42L), Optional.of(List.of(ALICE_ID)));
        changes.put(new LedgerKeys.Lock(42L, ALICE_ID), Optional.of(1_800_000_000L));
        changes.put(new LedgerKeys.Restriction(42L), Optional.of(new TransferRestriction(true, List.of("ES"))));
        changes.put(new LedgerKeys.Detokenization(42L), Optional.of(new DetokenizationProposal(3L, ALICE_ID, 5L, false)));
        changes.put(new LedgerKeys.ProposalSequence("detokenization"), Optional.of(3L));
        writer.commit(changes);

        assertThat(Files.exists(file)).isTrue();

        InMemoryLedgerBackend reader = new InMemoryLedgerBackend(persistentProperties(file));
        reader.loadSnapshot();

        assertThat(reader.size()).isEqualTo(7);
        assertThat(reader.read(new LedgerKeys.Asset(42L))).contains(asset);
        assertThat(reader.read(new LedgerKeys.Balance(42L, ALICE_ID))).contains(BigInteger.valueOf(1000));
        assertThat(reader.read(new LedgerKeys.HolderSet(42L))).contains(List.of(ALICE_ID));
        assertThat(reader.read(new LedgerKeys.Lock(42L, ALICE_ID))).contains(1_800_000_000L);
        assertThat(reader.read(new LedgerKeys.Restriction(42L)))
            .contains(new TransferRestriction(true, List.of("ES")));
        assertThat(reader.read(new LedgerKeys.ProposalSequence("detokenization"))).contains(3L);
    }

    @Test
    @DisplayName("Should drop removed entries from the snapshot")
    void shouldDropRemovedEntries() {
        Path file = tempDir.resolve("snapshot.json");
        InMemoryLedgerBackend writer = new InMemoryLedgerBackend(persistentProperties(file));
        writer.commit(Map.<LedgerKey<?>, Optional<Object>>of(new LedgerKeys.RevenueSharing(1L), Optional.of(true)));
        writer.commit(Map.<LedgerKey<?>, Optional<Object>>of(new LedgerKeys.RevenueSharing(1L), Optional.empty()));

        InMemoryLedgerBackend reader = new InMemoryLedgerBackend(persistentProperties(file));
        reader.loadSnapshot();

        assertThat(reader.size()).isZero();
    }

    @Test
    @DisplayName("Should leave state untouched when a committed value cannot be serialized")
    void shouldRejectUnserializableCommit() {
        Path file = tempDir.resolve("snapshot.json");
        InMemoryLedgerBackend backend = new InMemoryLedgerBackend(persistentProperties(file));
        backend.commit(Map.<LedgerKey<?>, Optional<Object>>of(new LedgerKeys.RevenueSharing(1L), Optional.of(true)));

        Map<LedgerKey<?>, Optional<Object>> changes = new LinkedHashMap<>();
        changes.put(new LedgerKeys.RevenueSharing(1L), Optional.empty());
        changes.put(new LedgerKeys.RevenueSharing(2L), Optional.of(new Object()));

        assertThatThrownBy(() -> backend.commit(changes)).isInstanceOf(IllegalArgumentException.class);
        assertThat(backend.read(new LedgerKeys.RevenueSharing(1L))).contains(true);
        assertThat(backend.read(new LedgerKeys.RevenueSharing(2L))).isEmpty();

        InMemoryLedgerBackend reader = new InMemoryLedgerBackend(persistentProperties(file));
        reader.loadSnapshot();
        assertThat(reader.read(new LedgerKeys.RevenueSharing(1L))).contains(true);
        assertThat(reader.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should refuse to start from a corrupt snapshot")
    void shouldRefuseCorruptSnapshot() throws Exception {
        Path file = tempDir.resolve("snapshot.json");
        Files.writeString(file, "{not json");

        InMemoryLedgerBackend backend = new InMemoryLedgerBackend(persistentProperties(file));

        assertThatThrownBy(backend::loadSnapshot).isInstanceOf(IllegalStateException.class);
    }
}
