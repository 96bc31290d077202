package com.idovenue.gateway;

import com.idovenue.config.IdoVenueProperties;
import com.idovenue.service.WalletAddresses;
import com.idovenue.web.IdoVenueException;
import org.springframework.stereotype.Component;

@Component
public class ConfiguredOwnershipGate implements OwnershipGate {

    private final IdoVenueProperties idoVenueProperties;

    public ConfiguredOwnershipGate(IdoVenueProperties idoVenueProperties) {
        this.idoVenueProperties = idoVenueProperties;
    }

    @Override
    public void requireOwner(String caller) {
        if (caller == null || caller.isBlank()) {
            throw IdoVenueException.unauthorized("<anonymous>");
        }
        String configuredOwner = idoVenueProperties.getOwnerAddress();
        // Without a configured owner nobody can administer rounds
        if (configuredOwner == null || configuredOwner.isBlank()) {
            throw IdoVenueException.unauthorized(caller);
        }
        String owner = WalletAddresses.normalize(configuredOwner);
        if (!owner.equals(WalletAddresses.normalize(caller))) {
            throw IdoVenueException.unauthorized(caller);
        }
    }
}
