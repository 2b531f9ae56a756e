package assetup.ledger.dto.restriction;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WhitelistStatusResponse {
    private String assetId;
    private String address;
    private boolean whitelisted;
}
