package assetup.ledger.dto.governance;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DetokenizationRequest {

    @NotBlank(message = "Proposer address is required")
    private String proposer;
}
