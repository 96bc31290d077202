package com.idovenue.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Venue-wide settings: privileged wallet, custody and treasury destinations,
 * delay limits and the bundled token vault.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "ido")
public class IdoVenueProperties {

    /**
     * Wallet allowed to call privileged round and MetaIDO operations.
     */
    private String ownerAddress = "0x0000000000000000000000000000000000000001";

    /**
     * Wallet holding pooled contributions and sale-token inventory.
     */
    private String custodyAddress = "0x00000000000000000000000000000000000000c0";

    /**
     * Destination of raised funds when participants claim.
     */
    private String treasuryAddress = "0x00000000000000000000000000000000000000f0";

    private Delay delay = new Delay();
    private Vault vault = new Vault();

    @Getter
    @Setter
    public static class Delay {
        /**
         * Upper bound on how far end and claimable times may move past their initial value.
         */
        private Duration maxDelay = Duration.ofDays(14);
    }

    @Getter
    @Setter
    public static class Vault {
        private String mode = "custodial";
        private int defaultDecimals = 18;
        private Map<String, Integer> tokenDecimals = new LinkedHashMap<>();
    }
}
