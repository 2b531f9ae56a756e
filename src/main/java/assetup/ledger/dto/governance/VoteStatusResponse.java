package assetup.ledger.dto.governance;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VoteStatusResponse {
    private String assetId;
    private String proposalId;
    private String voter;
    private boolean voted;
}
