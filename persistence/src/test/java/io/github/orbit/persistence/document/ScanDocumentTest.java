package io.github.orbit.persistence.document;

import io.github.orbit.protocol.api.ScanStatus;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ScanDocumentTest {

    @Test
    void newScanIsIdleAndUncosted() {
        ScanDocument scan = new ScanDocument();

        assertThat(scan.getStatus()).isEqualTo(ScanStatus.IDLE);
        assertThat(scan.getCost()).isNull();
        assertThat(scan.getVmStartTime()).isNull();
    }
}
