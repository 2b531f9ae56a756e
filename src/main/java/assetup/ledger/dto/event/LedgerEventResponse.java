package assetup.ledger.dto.event;

import assetup.ledger.event.LedgerEvent;
import assetup.ledger.util.LedgerInputValidator;
import java.util.HashMap;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LedgerEventResponse {
    private String topic;
    private Map<String, Object> payload;
    private long ledgerTimestamp;

    public static LedgerEventResponse from(LedgerEvent event) {
        Map<String, Object> payload = new HashMap<>(event.getPayload());
        // ids are unsigned 64-bit on the wire
        payload.computeIfPresent("assetId", LedgerEventResponse::unsignedId);
        payload.computeIfPresent("proposalId", LedgerEventResponse::unsignedId);
        return LedgerEventResponse.builder()
            .topic(event.getTopic())
            .payload(payload)
            .ledgerTimestamp(event.getLedgerTimestamp())
            .build();
    }

    private static Object unsignedId(String key, Object value) {
        return value instanceof Long id ? LedgerInputValidator.formatUnsignedId(id) : value;
    }
}
