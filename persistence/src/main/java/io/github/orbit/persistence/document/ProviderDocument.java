package io.github.orbit.persistence.document;

import io.github.orbit.protocol.api.ProviderType;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

@Document(collection = "providers")
public class ProviderDocument {

    @Id
    private String providerId;
    private String name;
    private ProviderType providerType;
    private Settings settings;
    private boolean enabled = true;
    private Instant createdAt;

    public ProviderDocument() {}

    // Embedded: Settings
    public static class Settings {
        private String region;
        private String size;

        public Settings() {}

        public String getRegion() { return region; }
        public void setRegion(String region) { this.region = region; }
        public String getSize() { return size; }
        public void setSize(String size) { this.size = size; }
    }

    public String getProviderId() { return providerId; }
    public void setProviderId(String providerId) { this.providerId = providerId; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public ProviderType getProviderType() { return providerType; }
    public void setProviderType(ProviderType providerType) { this.providerType = providerType; }
    public Settings getSettings() { return settings; }
    public void setSettings(Settings settings) { this.settings = settings; }
    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }
    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
}
