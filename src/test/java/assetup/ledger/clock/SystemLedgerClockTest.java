package assetup.ledger.clock;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class SystemLedgerClockTest {

    private static final class SteppingClock extends Clock {

        private final AtomicReference<Instant> now;

        SteppingClock(Instant start) {
            this.now = new AtomicReference<>(start);
        }

        void set(Instant instant) {
            now.set(instant);
        }

        @Override
        public ZoneOffset getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now.get();
        }
    }

    @Test
    @DisplayName("Should report epoch seconds")
    void shouldReportEpochSeconds() {
        SystemLedgerClock clock = new SystemLedgerClock(
            Clock.fixed(Instant.ofEpochSecond(1_700_000_000L, 900_000_000L), ZoneOffset.UTC));

        assertThat(clock.currentTimestamp()).isEqualTo(1_700_000_000L);
    }

    @Test
    @DisplayName("Should never go backwards when the wall clock steps back")
    void shouldBeMonotonic() {
        SteppingClock wallClock = new SteppingClock(Instant.ofEpochSecond(1_700_000_100L));
        SystemLedgerClock clock = new SystemLedgerClock(wallClock);

        assertThat(clock.currentTimestamp()).isEqualTo(1_700_000_100L);
        wallClock.set(Instant.ofEpochSecond(1_700_000_000L));
        assertThat(clock.currentTimestamp()).isEqualTo(1_700_000_100L);
        wallClock.set(Instant.ofEpochSecond(1_700_000_200L));
        assertThat(clock.currentTimestamp()).isEqualTo(1_700_000_200L);
    }
}
