package dao.tron.anchor.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "ledger")
@Data
public class LedgerProperties {

    /**
     * TRON network the anchoring wallet lives on: nile, shasta or mainnet
     */
    private String network = "nile";

    /**
     * Anchoring wallet private key (hex format, 64 characters)
     */
    private String privateKey;

    /**
     * TronGrid API key, required on mainnet
     */
    private String apiKey;

    /**
     * Anchor contract address (base58 format). The contract exposes anchor(bytes32).
     */
    private String contractAddress;

    /**
     * Fee limit for anchor transactions, in sun
     */
    private long feeLimit = 100_000_000L;

    /**
     * Blocks on top of the anchoring block before a batch counts as confirmed.
     * 19 matches TRON's solidification depth.
     */
    private int minConfirmations = 19;
}
