package assetup.ledger.controller.event;

import assetup.ledger.dto.event.LedgerEventResponse;
import assetup.ledger.event.LedgerEventFeed;
import assetup.ledger.util.LedgerInputValidator;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * GET /events
 * Recently committed ledger events, oldest first
 */
@RestController
@RequestMapping("/events")
@RequiredArgsConstructor
public class LedgerEventController {

    private final LedgerEventFeed eventFeed;

    @GetMapping
    public ResponseEntity<List<LedgerEventResponse>> recent(@RequestParam(required = false) String assetId) {
        Long filter = assetId == null ? null : LedgerInputValidator.parseUnsignedId(assetId, "assetId");
        return ResponseEntity.ok(eventFeed.recent(filter).stream()
            .map(LedgerEventResponse::from)
            .toList());
    }
}
