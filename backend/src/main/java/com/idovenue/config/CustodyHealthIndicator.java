package com.idovenue.config;

import com.idovenue.gateway.TokenMetadataGateway;
import com.idovenue.model.IdoRound;
import com.idovenue.repository.IdoRoundRepository;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.List;

@Component
public class CustodyHealthIndicator implements HealthIndicator {

    private final IdoRoundRepository idoRoundRepository;
    private final TokenMetadataGateway tokenMetadataGateway;
    private final IdoVenueProperties idoVenueProperties;

    public CustodyHealthIndicator(IdoRoundRepository idoRoundRepository,
                                  TokenMetadataGateway tokenMetadataGateway,
                                  IdoVenueProperties idoVenueProperties) {
        this.idoRoundRepository = idoRoundRepository;
        this.tokenMetadataGateway = tokenMetadataGateway;
        this.idoVenueProperties = idoVenueProperties;
    }

    @Override
    public Health health() {
        String custody = idoVenueProperties.getCustodyAddress();
        try {
            List<IdoRound> rounds = idoRoundRepository.findAllByOrderByRoundIdAsc();
            long openRounds = rounds.stream()
                    .filter(round -> !round.getClock().isFinalized())
                    .count();
            Health.Builder builder = Health.up()
                    .withDetail("custodyAddress", custody)
                    .withDetail("rounds", rounds.size())
                    .withDetail("openRounds", openRounds);
            if (!rounds.isEmpty()) {
                IdoRound latest = rounds.get(rounds.size() - 1);
                BigInteger inventory = tokenMetadataGateway.balanceOf(custody, latest.getIdoToken());
                builder.withDetail("latestRoundId", latest.getRoundId())
                        .withDetail("latestRoundInventory", inventory.toString());
            }
            return builder.build();
        } catch (Exception e) {
            return Health.down()
                    .withDetail("custodyAddress", custody)
                    .withException(e)
                    .build();
        }
    }
}
