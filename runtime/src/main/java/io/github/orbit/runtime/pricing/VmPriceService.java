package io.github.orbit.runtime.pricing;

import io.github.orbit.protocol.api.ProviderType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/** Routes hourly price lookups to the pricing client for the provider's type. */
@Service
public class VmPriceService {

    private static final Logger log = LoggerFactory.getLogger(VmPriceService.class);

    private final Map<ProviderType, PricingClient> clients = new EnumMap<>(ProviderType.class);

    public VmPriceService(List<PricingClient> pricingClients) {
        for (PricingClient client : pricingClients) {
            clients.put(client.providerType(), client);
        }
        log.info("Pricing available for providers: {}", clients.keySet());
    }

    public OptionalDouble hourlyPrice(ProviderSettings provider, String sizeSlug) throws PricingLookupException {
        PricingClient client = clients.get(provider.providerType());
        if (client == null) {
            throw new PricingLookupException("Unsupported provider type: " + provider.providerType());
        }
        return client.hourlyPrice(provider, sizeSlug);
    }
}
