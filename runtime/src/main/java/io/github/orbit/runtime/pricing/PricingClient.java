package io.github.orbit.runtime.pricing;

import io.github.orbit.protocol.api.ProviderType;

import java.util.OptionalDouble;

public interface PricingClient {

    ProviderType providerType();

    /**
     * Hourly price of {@code sizeSlug} in {@code region}, or empty when the catalog
     * has no matching size.
     */
    OptionalDouble hourlyPrice(ProviderSettings provider, String sizeSlug) throws PricingLookupException;
}
