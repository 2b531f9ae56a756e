package assetup.ledger.dto.restriction;

import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RestrictionRequest {

    private boolean requireAccredited;

    @Builder.Default
    private List<String> geographicAllowed = new ArrayList<>();
}
