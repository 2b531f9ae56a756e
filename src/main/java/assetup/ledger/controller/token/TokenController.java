package assetup.ledger.controller.token;

import assetup.ledger.dto.token.HolderAmountResponse;
import assetup.ledger.dto.token.HoldersResponse;
import assetup.ledger.dto.token.SupplyChangeRequest;
import assetup.ledger.dto.token.TokenResponse;
import assetup.ledger.dto.token.TokenizeRequest;
import assetup.ledger.dto.token.TransferRequest;
import assetup.ledger.dto.token.ValuationRequest;
import assetup.ledger.model.TokenizedAsset;
import assetup.ledger.service.token.TokenRegistryService;
import assetup.ledger.util.LedgerInputValidator;
import jakarta.validation.Valid;
import java.math.BigInteger;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Tokenization, supply changes, transfers and balance queries.
 * Rejected operations are mapped to error bodies by the global handler.
 */
@RestController
@RequestMapping("/tokens")
@RequiredArgsConstructor
public class TokenController {

    private final TokenRegistryService tokenRegistry;

    /**
     * POST /tokens
     * Tokenizes an asset and credits the whole supply to the tokenizer
     */
    @PostMapping
    public ResponseEntity<TokenResponse> tokenize(@Valid @RequestBody TokenizeRequest request) {
        TokenizedAsset asset = tokenRegistry.tokenize(
            LedgerInputValidator.parseUnsignedId(request.getAssetId(), "assetId"),
            request.getSymbol(),
            request.getTotalSupply(),
            request.getDecimals(),
            request.getMinVotingThreshold(),
            LedgerInputValidator.normalizeAddress(request.getTokenizer(), "tokenizer"),
            request.getMetadata()
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(TokenResponse.from(asset));
    }

    @GetMapping("/{assetId}")
    public ResponseEntity<TokenResponse> getToken(@PathVariable String assetId) {
        return ResponseEntity.ok(TokenResponse.from(tokenRegistry.tokenizedAsset(parseAssetId(assetId))));
    }

    @PostMapping("/{assetId}/mint")
    public ResponseEntity<TokenResponse> mint(
        @PathVariable String assetId,
        @Valid @RequestBody SupplyChangeRequest request
    ) {
        TokenizedAsset asset = tokenRegistry.mint(parseAssetId(assetId), request.getAmount(),
            LedgerInputValidator.normalizeAddress(request.getCaller(), "caller"));
        return ResponseEntity.ok(TokenResponse.from(asset));
    }

    @PostMapping("/{assetId}/burn")
    public ResponseEntity<TokenResponse> burn(
        @PathVariable String assetId,
        @Valid @RequestBody SupplyChangeRequest request
    ) {
        TokenizedAsset asset = tokenRegistry.burn(parseAssetId(assetId), request.getAmount(),
            LedgerInputValidator.normalizeAddress(request.getCaller(), "caller"));
        return ResponseEntity.ok(TokenResponse.from(asset));
    }

    /**
     * POST /tokens/{assetId}/transfer
     * Transfers tokens from the authenticated sender, subject to the asset's restrictions
     */
    @PostMapping("/{assetId}/transfer")
    public ResponseEntity<Map<String, Object>> transfer(
        @PathVariable String assetId,
        @Valid @RequestBody TransferRequest request
    ) {
        long id = parseAssetId(assetId);
        String from = LedgerInputValidator.normalizeAddress(request.getFrom(), "from");
        String to = LedgerInputValidator.normalizeAddress(request.getTo(), "to");
        tokenRegistry.transfer(id, from, to, request.getAmount());
        return ResponseEntity.ok(Map.of(
            "success", true,
            "fromBalance", tokenRegistry.balance(id, from),
            "toBalance", tokenRegistry.balance(id, to)
        ));
    }

    @GetMapping("/{assetId}/balances/{holder}")
    public ResponseEntity<HolderAmountResponse> balance(@PathVariable String assetId, @PathVariable String holder) {
        long id = parseAssetId(assetId);
        String address = LedgerInputValidator.normalizeAddress(holder, "holder");
        return ResponseEntity.ok(holderAmount(id, address, tokenRegistry.balance(id, address)));
    }

    @GetMapping("/{assetId}/holders")
    public ResponseEntity<HoldersResponse> holders(@PathVariable String assetId) {
        long id = parseAssetId(assetId);
        return ResponseEntity.ok(HoldersResponse.builder()
            .assetId(LedgerInputValidator.formatUnsignedId(id))
            .holders(tokenRegistry.holders(id))
            .build());
    }

    /**
     * GET /tokens/{assetId}/ownership/{holder}
     * Ownership share in basis points
     */
    @GetMapping("/{assetId}/ownership/{holder}")
    public ResponseEntity<HolderAmountResponse> ownership(@PathVariable String assetId, @PathVariable String holder) {
        long id = parseAssetId(assetId);
        String address = LedgerInputValidator.normalizeAddress(holder, "holder");
        return ResponseEntity.ok(holderAmount(id, address, tokenRegistry.ownershipPercentage(id, address)));
    }

    @PutMapping("/{assetId}/valuation")
    public ResponseEntity<TokenResponse> updateValuation(
        @PathVariable String assetId,
        @Valid @RequestBody ValuationRequest request
    ) {
        return ResponseEntity.ok(TokenResponse.from(
            tokenRegistry.updateValuation(parseAssetId(assetId), request.getValuation())));
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
