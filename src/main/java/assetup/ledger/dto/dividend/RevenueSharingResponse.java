package assetup.ledger.dto.dividend;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RevenueSharingResponse {
    private String assetId;
    private boolean enabled;
}
