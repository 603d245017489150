package io.github.orbit.runtime.cost;

import io.github.orbit.persistence.document.ProviderDocument;
import io.github.orbit.persistence.document.ScanDocument;
import io.github.orbit.persistence.repository.ProviderRepository;
import io.github.orbit.persistence.repository.ScanRepository;
import io.github.orbit.protocol.api.ProviderType;
import io.github.orbit.protocol.api.ScanStatus;
import io.github.orbit.runtime.config.TestProperties;
import io.github.orbit.runtime.pricing.PricingLookupException;
import io.github.orbit.runtime.pricing.ProviderSettings;
import io.github.orbit.runtime.pricing.VmPriceService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ScanCostReconcilerTest {

    private static final String VM_START = "2025-03-01T10:00:00Z";

    @Mock private ScanRepository scanRepository;
    @Mock private ProviderRepository providerRepository;
    @Mock private VmPriceService vmPriceService;
    @Captor private ArgumentCaptor<ScanDocument> scanCaptor;
    @Captor private ArgumentCaptor<Pageable> pageCaptor;
    @Captor private ArgumentCaptor<String> sizeCaptor;

    private ScanCostReconciler reconciler;

    @BeforeEach
    void setUp() throws Exception {
        reconciler = new ScanCostReconciler(scanRepository, providerRepository, vmPriceService,
                TestProperties.defaults());
        when(providerRepository.findById("p1")).thenReturn(Optional.of(provider("s-1vcpu-1gb")));
        when(vmPriceService.hourlyPrice(any(ProviderSettings.class), anyString())).thenReturn(OptionalDouble.of(0.5));
        when(scanRepository.save(any(ScanDocument.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    // ------------------------------------------------------------------
    // Billing
    // ------------------------------------------------------------------

    @Test
    void sixtyOneMinutesBillsTwoHours() {
        ScanDocument scan = scan("scan-1", VM_START, "2025-03-01T11:01:00Z");
        givenCandidates(scan);

        reconciler.reconcile();

        verify(scanRepository).save(scanCaptor.capture());
        assertThat(scanCaptor.getValue().getCost()).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void billableHours_roundsUp() {
        Instant start = Instant.parse(VM_START);

        assertThat(ScanCostReconciler.billableHours(start, start.plus(61, ChronoUnit.MINUTES))).isEqualTo(2);
        assertThat(ScanCostReconciler.billableHours(start, start.plus(60, ChronoUnit.MINUTES))).isEqualTo(1);
        assertThat(ScanCostReconciler.billableHours(start, start.plusMillis(1))).isEqualTo(1);
        assertThat(ScanCostReconciler.billableHours(start, start)).isZero();
    }

    @Test
    void offsetTimestampsAreNormalized() {
        ScanDocument scan = scan("scan-1", "2025-03-01T12:00:00+02:00", "2025-03-01T10:30:00Z");
        givenCandidates(scan);

        reconciler.reconcile();

        verify(scanRepository).save(scanCaptor.capture());
        assertThat(scanCaptor.getValue().getCost()).isCloseTo(0.5, within(1e-9));
    }

    @Test
    void queryExcludesManualAndIsBounded() {
        givenCandidates();

        reconciler.reconcile();

        verify(scanRepository).findUncostedCompletedScans(eq(ScanStatus.MANUAL), pageCaptor.capture());
        Pageable page = pageCaptor.getValue();
        assertThat(page.getPageSize()).isEqualTo(100);
        assertThat(page.getSort().getOrderFor("createdAt").getDirection()).isEqualTo(Sort.Direction.DESC);
    }

    @Test
    void scanSizeIsPreferredOverProviderDefault() throws Exception {
        ScanDocument pinned = scan("scan-1", VM_START, "2025-03-01T11:00:00Z");
        pinned.setVmSize("c-4");
        ScanDocument unpinned = scan("scan-2", VM_START, "2025-03-01T11:00:00Z");
        givenCandidates(pinned, unpinned);

        reconciler.reconcile();

        verify(vmPriceService, times(2)).hourlyPrice(any(ProviderSettings.class), sizeCaptor.capture());
        assertThat(sizeCaptor.getAllValues()).containsExactly("c-4", "s-1vcpu-1gb");
    }

    // ------------------------------------------------------------------
    // Skips
    // ------------------------------------------------------------------

    @Test
    void alreadyCostedScanIsNeverTouched() throws Exception {
        ScanDocument scan = scan("scan-1", VM_START, "2025-03-01T11:01:00Z");
        scan.setCost(3.25);
        givenCandidates(scan);

        reconciler.reconcile();

        verify(scanRepository, never()).save(any());
        verify(vmPriceService, never()).hourlyPrice(any(), anyString());
        assertThat(scan.getCost()).isEqualTo(3.25);
    }

    @Test
    void manualScanIsNeverCosted() {
        ScanDocument scan = scan("scan-1", VM_START, "2025-03-01T11:01:00Z");
        scan.setStatus(ScanStatus.MANUAL);
        givenCandidates(scan);

        reconciler.reconcile();

        verify(scanRepository, never()).save(any());
    }

    @Test
    void unparseableTimestampSkipsOnlyThatScan() {
        ScanDocument bad = scan("scan-bad", "yesterday-ish", "2025-03-01T11:01:00Z");
        ScanDocument good = scan("scan-good", VM_START, "2025-03-01T12:00:00Z");
        givenCandidates(bad, good);

        reconciler.reconcile();

        verify(scanRepository, times(1)).save(scanCaptor.capture());
        assertThat(scanCaptor.getValue().getScanId()).isEqualTo("scan-good");
        assertThat(bad.getCost()).isNull();
    }

    @Test
    void stopBeforeStartIsSkipped() {
        ScanDocument scan = scan("scan-1", "2025-03-01T11:00:00Z", VM_START);
        givenCandidates(scan);

        reconciler.reconcile();

        verify(scanRepository, never()).save(any());
    }

    @Test
    void missingPriceLeavesCostNull() throws Exception {
        when(vmPriceService.hourlyPrice(any(ProviderSettings.class), anyString())).thenReturn(OptionalDouble.empty());
        ScanDocument scan = scan("scan-1", VM_START, "2025-03-01T11:01:00Z");
        givenCandidates(scan);

        reconciler.reconcile();

        verify(scanRepository, never()).save(any());
        assertThat(scan.getCost()).isNull();
    }

    @Test
    void pricingFailureSkipsOnlyThatScan() throws Exception {
        ScanDocument first = scan("scan-1", VM_START, "2025-03-01T11:00:00Z");
        first.setVmSize("broken");
        ScanDocument second = scan("scan-2", VM_START, "2025-03-01T11:00:00Z");
        when(vmPriceService.hourlyPrice(any(ProviderSettings.class), eq("broken")))
                .thenThrow(new PricingLookupException("HTTP 503"));
        givenCandidates(first, second);

        reconciler.reconcile();

        verify(scanRepository, times(1)).save(scanCaptor.capture());
        assertThat(scanCaptor.getValue().getScanId()).isEqualTo("scan-2");
    }

    @Test
    void unknownOrInvalidProviderIsSkipped() {
        ScanDocument unknown = scan("scan-1", VM_START, "2025-03-01T11:00:00Z");
        unknown.setVmProviderId("p-missing");
        ProviderDocument noRegion = provider(null);
        noRegion.setProviderId("p-noregion");
        noRegion.getSettings().setRegion(null);
        when(providerRepository.findById("p-noregion")).thenReturn(Optional.of(noRegion));
        ScanDocument invalid = scan("scan-2", VM_START, "2025-03-01T11:00:00Z");
        invalid.setVmProviderId("p-noregion");
        givenCandidates(unknown, invalid);

        reconciler.reconcile();

        verify(scanRepository, never()).save(any());
    }

    @Test
    void noSizeOnScanOrProviderIsSkipped() throws Exception {
        when(providerRepository.findById("p1")).thenReturn(Optional.of(provider(null)));
        givenCandidates(scan("scan-1", VM_START, "2025-03-01T11:00:00Z"));

        reconciler.reconcile();

        verify(vmPriceService, never()).hourlyPrice(any(), anyString());
        verify(scanRepository, never()).save(any());
    }

    // ------------------------------------------------------------------
    // Failures never escape the tick
    // ------------------------------------------------------------------

    @Test
    void saveFailureContinuesWithNextScan() {
        ScanDocument first = scan("scan-1", VM_START, "2025-03-01T11:00:00Z");
        ScanDocument second = scan("scan-2", VM_START, "2025-03-01T11:00:00Z");
        doThrow(new DataAccessResourceFailureException("mongo down"))
                .doAnswer(inv -> inv.getArgument(0))
                .when(scanRepository).save(any(ScanDocument.class));
        givenCandidates(first, second);

        reconciler.reconcile();

        verify(scanRepository, times(2)).save(any(ScanDocument.class));
    }

    @Test
    void queryFailureEndsTickQuietly() {
        when(scanRepository.findUncostedCompletedScans(any(), any()))
                .thenThrow(new DataAccessResourceFailureException("mongo down"));

        reconciler.reconcile();

        verifyNoInteractions(vmPriceService);
    }

    @Test
    void unexpectedErrorOnOneScanDoesNotStopBatch() {
        when(providerRepository.findById("p-boom")).thenThrow(new IllegalStateException("boom"));
        ScanDocument boom = scan("scan-1", VM_START, "2025-03-01T11:00:00Z");
        boom.setVmProviderId("p-boom");
        ScanDocument fine = scan("scan-2", VM_START, "2025-03-01T11:00:00Z");
        givenCandidates(boom, fine);

        reconciler.reconcile();

        verify(scanRepository, times(1)).save(scanCaptor.capture());
        assertThat(scanCaptor.getValue().getScanId()).isEqualTo("scan-2");
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private void givenCandidates(ScanDocument... scans) {
        when(scanRepository.findUncostedCompletedScans(eq(ScanStatus.MANUAL), any(Pageable.class)))
                .thenReturn(List.of(scans));
    }

    private static ScanDocument scan(String id, String vmStart, String vmStop) {
        ScanDocument scan = new ScanDocument();
        scan.setScanId(id);
        scan.setStatus(ScanStatus.STOPPED);
        scan.setVmStartTime(vmStart);
        scan.setVmStopTime(vmStop);
        scan.setVmProviderId("p1");
        scan.setCreatedAt(Instant.parse(VM_START));
        return scan;
    }

    private static ProviderDocument provider(String defaultSize) {
        ProviderDocument doc = new ProviderDocument();
        doc.setProviderId("p1");
        doc.setProviderType(ProviderType.DIGITALOCEAN);
        ProviderDocument.Settings settings = new ProviderDocument.Settings();
        settings.setRegion("nyc3");
        settings.setSize(defaultSize);
        doc.setSettings(settings);
        return doc;
    }
}
