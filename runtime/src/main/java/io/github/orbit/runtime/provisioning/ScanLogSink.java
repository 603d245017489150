package io.github.orbit.runtime.provisioning;

import io.github.orbit.persistence.document.ScanLogDocument;
import io.github.orbit.persistence.repository.ScanLogRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Buffers provisioning output per scan and writes it to the {@code scan_logs}
 * collection in batches. Lines from stderr, and lines starting with {@code ERROR!},
 * are flushed immediately so failures show up while the playbook is still running.
 *
 * <p>Lines that fail to store are retried on the next flush. While the store stays
 * unavailable at most {@link #MAX_PENDING} lines are retained per scan; older ones are dropped.
 */
@Component
public class ScanLogSink {

    private static final Logger log = LoggerFactory.getLogger(ScanLogSink.class);
    static final int FLUSH_THRESHOLD = 100;
    static final long FLUSH_INTERVAL_MS = 1_000;
    static final int MAX_PENDING = 5_000;

    private final ScanLogRepository scanLogRepository;
    private final int maxPending;

    @Autowired
    public ScanLogSink(ScanLogRepository scanLogRepository) {
        this(scanLogRepository, MAX_PENDING);
    }

    ScanLogSink(ScanLogRepository scanLogRepository, int maxPending) {
        this.scanLogRepository = scanLogRepository;
        this.maxPending = maxPending;
    }

    public Writer open(String scanId) {
        return new Writer(scanId);
    }

    public final class Writer implements AutoCloseable {

        private final String scanId;
        private final List<ScanLogDocument> pending = new ArrayList<>();
        private long lastFlush = System.currentTimeMillis();

        private Writer(String scanId) {
            this.scanId = scanId;
        }

        public synchronized void append(String stream, String line) {
            if (line == null || line.isBlank()) return;

            ScanLogDocument entry = new ScanLogDocument();
            entry.setLogId(UUID.randomUUID().toString());
            entry.setScanId(scanId);
            entry.setStream(stream);
            entry.setContent(line);
            entry.setTimestamp(Instant.now());
            pending.add(entry);

            boolean urgent = "stderr".equals(stream) || line.startsWith("ERROR!");
            if (urgent || pending.size() >= FLUSH_THRESHOLD
                    || System.currentTimeMillis() - lastFlush > FLUSH_INTERVAL_MS) {
                flush();
            }
        }

        public synchronized void flush() {
            if (pending.isEmpty()) return;
            try {
                scanLogRepository.saveAll(new ArrayList<>(pending));
                pending.clear();
                lastFlush = System.currentTimeMillis();
            } catch (DataAccessException e) {
                // Kept in memory; the next flush retries them.
                log.warn("Failed to store {} log lines for scan {}: {}", pending.size(), scanId, e.getMessage());
                if (pending.size() > maxPending) {
                    int dropped = pending.size() - maxPending;
                    pending.subList(0, dropped).clear();
                    log.warn("Dropped {} oldest unstored log lines for scan {}", dropped, scanId);
                }
            }
        }

        @Override
        public void close() {
            flush();
        }
    }
}
