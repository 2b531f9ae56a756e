package assetup.ledger.dto.governance;

import java.math.BigInteger;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TallyResponse {
    private String assetId;
    private String proposalId;
    private BigInteger tally;
    private boolean passed;
}
