package assetup.ledger.dto.restriction;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RestrictionResponse {
    private String assetId;
    private boolean requireAccredited;
    private List<String> geographicAllowed;
}
