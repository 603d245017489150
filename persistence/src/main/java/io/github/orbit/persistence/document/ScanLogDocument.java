package io.github.orbit.persistence.document;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

@Document(collection = "scan_logs")
@CompoundIndex(name = "scan_ts_idx", def = "{'scanId': 1, 'timestamp': 1}")
public class ScanLogDocument {

    @Id
    private String logId;
    private String scanId;
    private String stream;
    private String content;
    private Instant timestamp;

    public ScanLogDocument() {}

    public String getLogId() { return logId; }
    public void setLogId(String logId) { this.logId = logId; }

    public String getScanId() { return scanId; }
    public void setScanId(String scanId) { this.scanId = scanId; }

    public String getStream() { return stream; }
    public void setStream(String stream) { this.stream = stream; }

    public String getContent() { return content; }
    public void setContent(String content) { this.content = content; }

    public Instant getTimestamp() { return timestamp; }
    public void setTimestamp(Instant timestamp) { this.timestamp = timestamp; }
}
