package assetup.ledger.store;

import assetup.ledger.event.LedgerEvent;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Runs ledger calls as atomic units of work.
 *
 * Calls are serialized behind a single writer lock. Writes and events of a
 * call are buffered in a call frame; the frame is committed to the backend
 * and its events published only when the call returns normally. Any exception
 * discards the frame. A call started while another is active on the same
 * thread joins the outer frame.
 */
@Component
@Slf4j
public class LedgerTransactionManager {

    private final LedgerBackend backend;
    private final ApplicationEventPublisher eventPublisher;
    private final ReentrantLock writerLock = new ReentrantLock(true);
    private final ThreadLocal<CallFrame> currentFrame = new ThreadLocal<>();

    public LedgerTransactionManager(LedgerBackend backend, ApplicationEventPublisher eventPublisher) {
        this.backend = backend;
        this.eventPublisher = eventPublisher;
    }

    public <T> T execute(String operation, Supplier<T> work) {
        if (currentFrame.get() != null) {
            return work.get();
        }
        writerLock.lock();
        CallFrame frame = new CallFrame();
        currentFrame.set(frame);
        List<LedgerEvent> committedEvents;
        T result;
        try {
            result = work.get();
            backend.commit(frame.writes);
            committedEvents = frame.events;
            log.debug("Ledger call {} committed ({} writes, {} events)",
                operation, frame.writes.size(), frame.events.size());
        } catch (RuntimeException ex) {
            log.debug("Ledger call {} aborted, discarded {} writes: {}",
                operation, frame.writes.size(), ex.getMessage());
            throw ex;
        } finally {
            currentFrame.remove();
            writerLock.unlock();
        }
        committedEvents.forEach(eventPublisher::publishEvent);
        return result;
    }

    public void run(String operation, Runnable work) {
        execute(operation, () -> {
            work.run();
            return null;
        });
    }

    CallFrame requireFrame() {
        CallFrame frame = currentFrame.get();
        if (frame == null) {
            throw new IllegalStateException("Ledger state accessed outside of a ledger call");
        }
        return frame;
    }

    LedgerBackend backend() {
        return backend;
    }

    /**
     * Buffers an event in the active call. It is dropped if the call aborts.
     */
    public void enqueueEvent(LedgerEvent event) {
        requireFrame().events.add(event);
    }

    static final class CallFrame {

        // Optional.empty() marks a removal
        private final Map<LedgerKey<?>, Optional<Object>> writes = new LinkedHashMap<>();
        private final List<LedgerEvent> events = new ArrayList<>();

        Optional<Object> staged(LedgerKey<?> key) {
            return writes.get(key);
        }

        boolean isStaged(LedgerKey<?> key) {
            return writes.containsKey(key);
        }

        void stage(LedgerKey<?> key, Optional<Object> value) {
            writes.put(key, value);
        }
    }
}
