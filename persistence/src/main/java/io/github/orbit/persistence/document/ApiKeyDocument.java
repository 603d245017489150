package io.github.orbit.persistence.document;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

@Document(collection = "api_keys")
public class ApiKeyDocument {

    public static final String KEY_TYPE_API_KEY = "api_key";

    @Id
    private String keyId;
    @Indexed
    private String providerId;
    private String keyType;
    private String key;
    private Instant createdAt;

    public ApiKeyDocument() {}

    public String getKeyId() { return keyId; }
    public void setKeyId(String keyId) { this.keyId = keyId; }

    public String getProviderId() { return providerId; }
    public void setProviderId(String providerId) { this.providerId = providerId; }

    public String getKeyType() { return keyType; }
    public void setKeyType(String keyType) { this.keyType = keyType; }

    public String getKey() { return key; }
    public void setKey(String key) { this.key = key; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
}
