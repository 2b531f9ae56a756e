package assetup.ledger.dto.token;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LockRequest {

    @NotBlank(message = "Holder address is required")
    private String holder;

    @NotNull(message = "Lock expiry is required")
    private Long untilTimestamp; // ledger seconds

    @NotBlank(message = "Caller address is required")
    private String caller;
}
