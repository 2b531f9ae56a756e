package assetup.ledger.controller.token;

import assetup.ledger.dto.token.LockRequest;
import assetup.ledger.dto.token.LockStatusResponse;
import assetup.ledger.service.token.LockManagerService;
import assetup.ledger.util.LedgerInputValidator;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/tokens/{assetId}/locks")
@RequiredArgsConstructor
public class LockController {

    private final LockManagerService lockManager;

    @PostMapping
    public ResponseEntity<LockStatusResponse> lock(@PathVariable String assetId, @Valid @RequestBody LockRequest request) {
        long id = LedgerInputValidator.parseUnsignedId(assetId, "assetId");
        String holder = LedgerInputValidator.normalizeAddress(request.getHolder(), "holder");
        lockManager.lock(id, holder, request.getUntilTimestamp(),
            LedgerInputValidator.normalizeAddress(request.getCaller(), "caller"));
        return ResponseEntity.ok(status(id, holder));
    }

    /**
     * DELETE /tokens/{assetId}/locks/{holder}
     * Clears a lock; needs no signature
     */
    @DeleteMapping("/{holder}")
    public ResponseEntity<LockStatusResponse> unlock(@PathVariable String assetId, @PathVariable String holder) {
        long id = LedgerInputValidator.parseUnsignedId(assetId, "assetId");
        String address = LedgerInputValidator.normalizeAddress(holder, "holder");
        lockManager.unlock(id, address);
        return ResponseEntity.ok(status(id, address));
    }

    @GetMapping("/{holder}")
    public ResponseEntity<LockStatusResponse> isLocked(@PathVariable String assetId, @PathVariable String holder) {
        long id = LedgerInputValidator.parseUnsignedId(assetId, "assetId");
        return ResponseEntity.ok(status(id, LedgerInputValidator.normalizeAddress(holder, "holder")));
    }

    private LockStatusResponse status(long assetId, String holder) {
        return LockStatusResponse.builder()
            .assetId(LedgerInputValidator.formatUnsignedId(assetId))
            .holder(holder)
            .locked(lockManager.isLocked(assetId, holder))
            .build();
    }
}
