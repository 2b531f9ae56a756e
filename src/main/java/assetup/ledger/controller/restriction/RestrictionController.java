package assetup.ledger.controller.restriction;

import assetup.ledger.dto.restriction.RestrictionRequest;
import assetup.ledger.dto.restriction.RestrictionResponse;
import assetup.ledger.dto.restriction.WhitelistRequest;
import assetup.ledger.dto.restriction.WhitelistResponse;
import assetup.ledger.dto.restriction.WhitelistStatusResponse;
import assetup.ledger.model.TransferRestriction;
import assetup.ledger.service.restriction.RestrictionGateService;
import assetup.ledger.util.LedgerInputValidator;
import jakarta.validation.Valid;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Transfer policy and whitelist of an asset.
 */
@RestController
@RequestMapping("/tokens/{assetId}")
@RequiredArgsConstructor
public class RestrictionController {

    private final RestrictionGateService restrictionGate;

    @PutMapping("/restriction")
    public ResponseEntity<RestrictionResponse> setRestriction(
        @PathVariable String assetId,
        @Valid @RequestBody RestrictionRequest request
    ) {
        long id = parseAssetId(assetId);
        TransferRestriction restriction =
            new TransferRestriction(request.isRequireAccredited(), request.getGeographicAllowed());
        restrictionGate.setRestriction(id, restriction);
        return ResponseEntity.ok(toResponse(id, restriction));
    }

    @GetMapping("/restriction")
    public ResponseEntity<RestrictionResponse> getRestriction(@PathVariable String assetId) {
        long id = parseAssetId(assetId);
        return restrictionGate.getRestriction(id)
            .map(restriction -> ResponseEntity.ok(toResponse(id, restriction)))
            .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @DeleteMapping("/restriction")
    public ResponseEntity<Map<String, Object>> clearRestriction(@PathVariable String assetId) {
        restrictionGate.clearRestriction(parseAssetId(assetId));
        return ResponseEntity.ok(Map.of("success", true));
    }

    @GetMapping("/whitelist")
    public ResponseEntity<WhitelistResponse> whitelist(@PathVariable String assetId) {
        long id = parseAssetId(assetId);
        return ResponseEntity.ok(WhitelistResponse.builder()
            .assetId(LedgerInputValidator.formatUnsignedId(id))
            .addresses(restrictionGate.whitelist(id))
            .build());
    }

    @PostMapping("/whitelist")
    public ResponseEntity<WhitelistStatusResponse> addToWhitelist(
        @PathVariable String assetId,
        @Valid @RequestBody WhitelistRequest request
    ) {
        long id = parseAssetId(assetId);
        String address = LedgerInputValidator.normalizeAddress(request.getAddress(), "whitelist");
        restrictionGate.addToWhitelist(id, address);
        return ResponseEntity.ok(status(id, address));
    }

    @DeleteMapping("/whitelist/{address}")
    public ResponseEntity<WhitelistStatusResponse> removeFromWhitelist(
        @PathVariable String assetId,
        @PathVariable String address
    ) {
        long id = parseAssetId(assetId);
        String normalized = LedgerInputValidator.normalizeAddress(address, "whitelist");
        restrictionGate.removeFromWhitelist(id, normalized);
        return ResponseEntity.ok(status(id, normalized));
    }

    @GetMapping("/whitelist/{address}")
    public ResponseEntity<WhitelistStatusResponse> isWhitelisted(
        @PathVariable String assetId,
        @PathVariable String address
    ) {
        long id = parseAssetId(assetId);
        return ResponseEntity.ok(status(id, LedgerInputValidator.normalizeAddress(address, "whitelist")));
    }

    private WhitelistStatusResponse status(long assetId, String address) {
        return WhitelistStatusResponse.builder()
            .assetId(LedgerInputValidator.formatUnsignedId(assetId))
            .address(address)
            .whitelisted(restrictionGate.isWhitelisted(assetId, address))
            .build();
    }

    private static RestrictionResponse toResponse(long assetId, TransferRestriction restriction) {
        return RestrictionResponse.builder()
            .assetId(LedgerInputValidator.formatUnsignedId(assetId))
            .requireAccredited(restriction.requireAccredited())
            .geographicAllowed(restriction.geographicAllowed())
            .build();
    }

    private static long parseAssetId(String assetId) {
        return LedgerInputValidator.parseUnsignedId(assetId, "assetId");
    }
}
