package io.github.orbit.persistence.document;

import io.github.orbit.protocol.api.ScanStatus;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * A scan owned by the scan management surface. The scheduler moves it through
 * the deployment states; the cost reconciler fills in {@code cost} once both VM
 * timestamps are known. VM timestamps are stored as RFC 3339 strings, exactly as
 * the provisioning playbooks report them.
 */
@Document(collection = "scans")
public class ScanDocument {

    @Id
    private String scanId;
    private String name;
    @Indexed
    private ScanStatus status = ScanStatus.IDLE;
    private Instant startTime;
    private String vmStartTime;
    private String vmStopTime;
    private String vmProviderId;
    private String vmSize;
    private Double cost;
    private int totalTargets;
    private String clientId;
    private String apiKey;
    private Instant createdAt;

    public ScanDocument() {}

    public String getScanId() { return scanId; }
    public void setScanId(String scanId) { this.scanId = scanId; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public ScanStatus getStatus() { return status; }
    public void setStatus(ScanStatus status) { this.status = status; }

    public Instant getStartTime() { return startTime; }
    public void setStartTime(Instant startTime) { this.startTime = startTime; }

    public String getVmStartTime() { return vmStartTime; }
    public void setVmStartTime(String vmStartTime) { this.vmStartTime = vmStartTime; }

    public String getVmStopTime() { return vmStopTime; }
    public void setVmStopTime(String vmStopTime) { this.vmStopTime = vmStopTime; }

    public String getVmProviderId() { return vmProviderId; }
    public void setVmProviderId(String vmProviderId) { this.vmProviderId = vmProviderId; }

    public String getVmSize() { return vmSize; }
    public void setVmSize(String vmSize) { this.vmSize = vmSize; }

    public Double getCost() { return cost; }
    public void setCost(Double cost) { this.cost = cost; }

    public int getTotalTargets() { return totalTargets; }
    public void setTotalTargets(int totalTargets) { this.totalTargets = totalTargets; }

    public String getClientId() { return clientId; }
    public void setClientId(String clientId) { this.clientId = clientId; }

    public String getApiKey() { return apiKey; }
    public void setApiKey(String apiKey) { this.apiKey = apiKey; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
}
