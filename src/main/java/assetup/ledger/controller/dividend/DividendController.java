package assetup.ledger.controller.dividend;

import assetup.ledger.dto.dividend.DistributionRequest;
import assetup.ledger.dto.dividend.DistributionResponse;
import assetup.ledger.dto.dividend.RevenueSharingResponse;
import assetup.ledger.dto.token.HolderAmountResponse;
import assetup.ledger.service.dividend.DividendDistributorService;
import assetup.ledger.util.LedgerInputValidator;
import jakarta.validation.Valid;
import java.math.BigInteger;
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

@RestController
@RequestMapping("/tokens/{assetId}")
@RequiredArgsConstructor
public class DividendController {

    private final DividendDistributorService dividends;

    /**
     * POST /tokens/{assetId}/dividends
     * Splits a deposited amount across current holders
     */
    @PostMapping("/dividends")
    public ResponseEntity<DistributionResponse> distribute(
        @PathVariable String assetId,
        @Valid @RequestBody DistributionRequest request
    ) {
        long id = parseAssetId(assetId);
        BigInteger credited = dividends.distribute(id, request.getAmount());
        return ResponseEntity.ok(DistributionResponse.builder()
            .assetId(LedgerInputValidator.formatUnsignedId(id))
            .amount(request.getAmount())
            .credited(credited)
            .build());
    }

    @PostMapping("/dividends/{holder}/claim")
    public ResponseEntity<HolderAmountResponse> claim(@PathVariable String assetId, @PathVariable String holder) {
        long id = parseAssetId(assetId);
        String address = LedgerInputValidator.normalizeAddress(holder, "holder");
        return ResponseEntity.ok(holderAmount(id, address, dividends.claim(id, address)));
    }

    @GetMapping("/dividends/{holder}")
    public ResponseEntity<HolderAmountResponse> unclaimed(@PathVariable String assetId, @PathVariable String holder) {
        long id = parseAssetId(assetId);
        String address = LedgerInputValidator.normalizeAddress(holder, "holder");
        return ResponseEntity.ok(holderAmount(id, address, dividends.unclaimed(id, address)));
    }

    @PutMapping("/revenue-sharing")
    public ResponseEntity<RevenueSharingResponse> enable(@PathVariable String assetId) {
        long id = parseAssetId(assetId);
        dividends.enableRevenueSharing(id);
        return ResponseEntity.ok(revenueSharing(id));
    }

    @DeleteMapping("/revenue-sharing")
    public ResponseEntity<RevenueSharingResponse> disable(@PathVariable String assetId) {
        long id = parseAssetId(assetId);
        dividends.disableRevenueSharing(id);
        return ResponseEntity.ok(revenueSharing(id));
    }

    @GetMapping("/revenue-sharing")
    public ResponseEntity<RevenueSharingResponse> status(@PathVariable String assetId) {
        return ResponseEntity.ok(revenueSharing(parseAssetId(assetId)));
    }

    private RevenueSharingResponse revenueSharing(long assetId) {
        return RevenueSharingResponse.builder()
            .assetId(LedgerInputValidator.formatUnsignedId(assetId))
            .enabled(dividends.isRevenueSharingEnabled(assetId))
            .build();
    }

    private static HolderAmountResponse holderAmount(long assetId, String holder, BigInteger amount) {
        return HolderAmountResponse.builder()
            .assetId(LedgerInputValidator.formatUnsignedId(assetId))
            .holder(holder)
            .amount(amount)
            .build();
    }

    private static long parseAssetId(String assetId) {
        return LedgerInputValidator.parseUnsignedId(assetId, "assetId");
    }
}
