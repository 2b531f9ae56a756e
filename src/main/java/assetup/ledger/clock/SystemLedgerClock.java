package assetup.ledger.clock;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicLong;
import org.springframework.stereotype.Component;

/**
 * Ledger clock backed by the system UTC clock, clamped so that a wall clock
 * step backwards never produces an earlier ledger timestamp.
 */
@Component
public class SystemLedgerClock implements LedgerClock {

    private final Clock clock;
    private final AtomicLong lastIssued = new AtomicLong(Long.MIN_VALUE);

    public SystemLedgerClock() {
        this(Clock.systemUTC());
    }

    SystemLedgerClock(Clock clock) {
        this.clock = clock;
    }

    @Override
    public long currentTimestamp() {
        long now = clock.instant().getEpochSecond();
        return lastIssued.accumulateAndGet(now, Math::max);
    }
}
