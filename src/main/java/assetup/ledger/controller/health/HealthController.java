package assetup.ledger.controller.health;

import assetup.ledger.clock.LedgerClock;
import assetup.ledger.config.LedgerProperties;
import assetup.ledger.store.LedgerBackend;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/health")
@RequiredArgsConstructor
@Slf4j
public class HealthController {

    private final LedgerBackend backend;
    private final LedgerClock clock;
    private final LedgerProperties properties;

    @GetMapping
    @CrossOrigin(origins = "*")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> healthStatus = new HashMap<>();

        try {
            healthStatus.put("status", "UP");
            healthStatus.put("timestamp", Instant.now().toString());
            healthStatus.put("service", "assetup-ledger-service");
            healthStatus.put("version", "1.0.0");
            healthStatus.put("ledger_timestamp", clock.currentTimestamp());
            healthStatus.put("ledger_entries", backend.size());
            healthStatus.put("persistence_enabled", properties.getPersistence().isEnabled());
            return ResponseEntity.ok(healthStatus);
        } catch (Exception e) {
            log.error("Health check failed", e);
            healthStatus.put("status", "DOWN");
            healthStatus.put("error", e.getMessage());
            healthStatus.put("timestamp", Instant.now().toString());
            healthStatus.put("service", "assetup-ledger-service");

            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(healthStatus);
        }
    }
}
