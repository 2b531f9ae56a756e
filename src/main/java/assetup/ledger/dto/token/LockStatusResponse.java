package assetup.ledger.dto.token;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LockStatusResponse {
    private String assetId;
    private String holder;
    private boolean locked;
}
