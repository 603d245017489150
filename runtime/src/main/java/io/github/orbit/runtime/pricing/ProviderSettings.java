package io.github.orbit.runtime.pricing;

import io.github.orbit.persistence.document.ProviderDocument;
import io.github.orbit.protocol.api.ProviderType;

import java.util.Optional;

/**
 * Validated pricing-relevant settings of a VM provider. Built once from the stored
 * provider so that a missing region fails here, not halfway through a price lookup.
 * {@code defaultSize} is null when the provider has none.
 */
public record ProviderSettings(
        String providerId,
        ProviderType providerType,
        String region,
        String defaultSize
) {

    public static ProviderSettings from(ProviderDocument provider) {
        if (provider.getProviderType() == null) {
            throw new InvalidProviderSettingsException("Provider " + provider.getProviderId() + " has no provider type");
        }
        ProviderDocument.Settings settings = provider.getSettings();
        if (settings == null || settings.getRegion() == null || settings.getRegion().isBlank()) {
            throw new InvalidProviderSettingsException("Provider " + provider.getProviderId() + " has no region configured");
        }
        String size = settings.getSize() == null || settings.getSize().isBlank() ? null : settings.getSize();
        return new ProviderSettings(provider.getProviderId(), provider.getProviderType(), settings.getRegion(), size);
    }

    /** The scan's pinned size, or the provider default when the scan did not pin one. */
    public Optional<String> sizeFor(String scanVmSize) {
        if (scanVmSize != null && !scanVmSize.isBlank()) return Optional.of(scanVmSize);
        return Optional.ofNullable(defaultSize);
    }
}
