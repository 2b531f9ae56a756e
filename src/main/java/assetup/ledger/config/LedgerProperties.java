package assetup.ledger.config;

import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Data
@Component
@ConfigurationProperties(prefix = "ledger")
public class LedgerProperties {

    private Token token = new Token();

    private Detokenization detokenization = new Detokenization();

    private Persistence persistence = new Persistence();

    private Events events = new Events();

    private Auth auth = new Auth();

    @Data
    public static class Token {

        /** Highest decimal count accepted by tokenize. */
        private int maxDecimals = 18;
    }

    @Data
    public static class Detokenization {

        /** How long a detokenization proposal may collect votes before it is rejected. */
        private Duration votingPeriod = Duration.ofDays(7);
    }

    @Data
    public static class Persistence {

        /** Write a JSON snapshot of the committed state after every call. */
        private boolean enabled = false;

        private String filePath = "./data/ledger-snapshot.json";
    }

    @Data
    public static class Events {

        /** Number of committed events kept for the /events feed. */
        private int retained = 500;
    }

    @Data
    public static class Auth {

        /** Maximum age of a signed request timestamp. */
        private Duration signatureWindow = Duration.ofMinutes(5);

        private String addressHeader = "X-Ledger-Address";

        private String timestampHeader = "X-Ledger-Timestamp";

        private String signatureHeader = "X-Ledger-Signature";
    }
}
