package com.snapback.drop.service;

import com.snapback.drop.config.DropScannerProperties;
import com.snapback.drop.model.Availability;
import com.snapback.drop.model.DomainCandidate;
import com.snapback.drop.model.DropRecord;
import com.snapback.drop.model.IndexPresence;
import com.snapback.drop.model.IndexVerdict;
import com.snapback.drop.model.Namespace;
import com.snapback.drop.model.Report;
import com.snapback.drop.model.ReportRow;
import com.snapback.drop.model.ScanOptions;
import com.snapback.drop.output.ReportPaths;
import com.snapback.drop.output.ReportWriteException;
import com.snapback.drop.output.ReportWriter;
import com.snapback.drop.service.index.IndexSignalProber;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DomainScanServiceTest {

    private static final LocalDate TARGET = LocalDate.of(2026, 1, 11);

    @Mock
    private DropListFetcher fetcher;
    @Mock
    private AvailabilityProber availabilityProber;
    @Mock
    private IndexSignalProber indexSignalProber;
    @Mock
    private ReportWriter reportWriter;

    private final MutableClock clock = new MutableClock(Instant.parse("2026-01-10T20:00:00Z"));

    private DomainScanService service;

    @BeforeEach
    void setUp() {
        service = new DomainScanService(
                fetcher,
                new DropDateFilter(clock),
                availabilityProber,
                indexSignalProber,
                new ValueFilter(new DropScannerProperties()),
                new ReportAssembler(),
                reportWriter,
                clock);
    }

    @Test
    void runsEveryStageAndWritesValuableDomains() {
        when(fetcher.fetch(Namespace.SE)).thenReturn(List.of(
                record("alpha.se", TARGET, Namespace.SE),
                record("beta.se", TARGET, Namespace.SE),
                record("later.se", TARGET.plusDays(1), Namespace.SE)));
        when(fetcher.fetch(Namespace.NU)).thenReturn(List.of(record("gamma.nu", TARGET, Namespace.NU)));
        markAvailable();
        applyVerdicts(Map.of(
                "alpha.se", IndexVerdict.present("archive", 12),
                "beta.se", IndexVerdict.absent("google"),
                "gamma.nu", IndexVerdict.present("archive", 40)));
        ReportPaths paths = new ReportPaths(Path.of("reports/2026-01-11.csv"), Path.of("reports/2026-01-11.json"));
        when(reportWriter.write(any(), eq(TARGET))).thenReturn(paths);

        ScanOutcome outcome = service.scan(ScanOptions.defaults().withTargetDate(TARGET));

        assertThat(outcome.targetDate()).isEqualTo(TARGET);
        assertThat(outcome.dropping()).isEqualTo(3);
        assertThat(outcome.paths()).isEqualTo(paths);
        assertThat(outcome.report().getDomains())
                .extracting(ReportRow::getDomain)
                .containsExactly("gamma.nu", "alpha.se");
        assertThat(outcome.report().getDomains())
                .allSatisfy(row -> assertThat(row.getAvailable()).isEqualTo(Availability.AVAILABLE));
    }

    @Test
    void probesCandidatesInDropListOrder() {
        when(fetcher.fetch(Namespace.SE)).thenReturn(List.of(
                record("b.se", TARGET, Namespace.SE), record("a.se", TARGET, Namespace.SE)));
        when(fetcher.fetch(Namespace.NU)).thenReturn(List.of(record("c.nu", TARGET, Namespace.NU)));

        service.scan(ScanOptions.defaults().withTargetDate(TARGET).withDryRun(true));

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<DomainCandidate>> probed = ArgumentCaptor.forClass(List.class);
        verify(indexSignalProber).probeAll(probed.capture(), eq(true));
        assertThat(probed.getValue())
                .extracting(DomainCandidate::getName)
                .containsExactly("b.se", "a.se", "c.nu");
    }

    @Test
    void oneEmptyNamespaceDoesNotStopTheScan() {
        when(fetcher.fetch(Namespace.SE)).thenReturn(List.of());
        when(fetcher.fetch(Namespace.NU)).thenReturn(List.of(record("gamma.nu", TARGET, Namespace.NU)));
        applyVerdicts(Map.of("gamma.nu", IndexVerdict.present("archive", 3)));

        ScanOutcome outcome = service.scan(ScanOptions.defaults().withTargetDate(TARGET).withDryRun(true));

        assertThat(outcome.dropping()).isEqualTo(1);
        assertThat(outcome.reported()).isEqualTo(1);
    }

    @Test
    void nothingDroppingSkipsProbesButStillWritesReport() {
        when(fetcher.fetch(any())).thenReturn(List.of());

        ScanOutcome outcome = service.scan(ScanOptions.defaults().withTargetDate(TARGET));

        assertThat(outcome.reported()).isZero();
        verify(availabilityProber, never()).probeAll(anyList());
        verify(indexSignalProber, never()).probeAll(anyList(), anyBoolean());
        verify(reportWriter).write(any(Report.class), eq(TARGET));
    }

    @Test
    void dryRunDoesNotWrite() {
        when(fetcher.fetch(any())).thenReturn(List.of());

        ScanOutcome outcome = service.scan(ScanOptions.defaults().withTargetDate(TARGET).withDryRun(true));

        assertThat(outcome.paths()).isNull();
        verify(reportWriter, never()).write(any(), any());
    }

    @Test
    void disabledProbesLeaveFieldsUnknown() {
        when(fetcher.fetch(Namespace.SE)).thenReturn(List.of(record("alpha.se", TARGET, Namespace.SE)));
        when(fetcher.fetch(Namespace.NU)).thenReturn(List.of());

        ScanOutcome outcome = service.scan(ScanOptions.defaults()
                .withTargetDate(TARGET)
                .withCheckAvailability(false)
                .withCheckIndex(false)
                .withFilterValuable(false)
                .withDryRun(true));

        verify(availabilityProber, never()).probeAll(anyList());
        verify(indexSignalProber, never()).probeAll(anyList(), anyBoolean());
        ReportRow row = outcome.report().getDomains().get(0);
        assertThat(row.getAvailable()).isEqualTo(Availability.UNKNOWN);
        assertThat(row.getIndexed()).isEqualTo(IndexPresence.UNKNOWN);
        assertThat(row.getEstimatedPages()).isNull();
    }

    @Test
    void valueFilterRemovesUnindexedDomains() {
        when(fetcher.fetch(Namespace.SE)).thenReturn(List.of(
                record("alpha.se", TARGET, Namespace.SE), record("beta.se", TARGET, Namespace.SE)));
        when(fetcher.fetch(Namespace.NU)).thenReturn(List.of());
        applyVerdicts(Map.of(
                "alpha.se", IndexVerdict.unknown("archive: timeout"),
                "beta.se", IndexVerdict.absent("archive")));

        ScanOutcome filtered = service.scan(ScanOptions.defaults().withTargetDate(TARGET).withDryRun(true));
        ScanOutcome unfiltered = service.scan(ScanOptions.defaults()
                .withTargetDate(TARGET).withDryRun(true).withFilterValuable(false));

        assertThat(filtered.reported()).isZero();
        assertThat(unfiltered.reported()).isEqualTo(2);
    }

    @Test
    void fallbackSwitchIsPassedToIndexProber() {
        when(fetcher.fetch(Namespace.SE)).thenReturn(List.of(record("alpha.se", TARGET, Namespace.SE)));
        when(fetcher.fetch(Namespace.NU)).thenReturn(List.of());

        service.scan(ScanOptions.defaults().withTargetDate(TARGET).withDryRun(true).withUseFallback(false));

        verify(indexSignalProber).probeAll(anyList(), eq(false));
    }

    @Test
    void missingTargetDateMeansTomorrow() {
        when(fetcher.fetch(Namespace.SE)).thenReturn(List.of(
                record("today.se", LocalDate.of(2026, 1, 10), Namespace.SE),
                record("tomorrow.se", LocalDate.of(2026, 1, 11), Namespace.SE)));
        when(fetcher.fetch(Namespace.NU)).thenReturn(List.of());

        ScanOutcome outcome = service.scan(ScanOptions.defaults().withDryRun(true).withFilterValuable(false));

        assertThat(outcome.targetDate()).isEqualTo(LocalDate.of(2026, 1, 11));
        assertThat(outcome.report().getDomains()).extracting(ReportRow::getDomain).containsExactly("tomorrow.se");
    }

    @Test
    void writeFailurePropagates() {
        when(fetcher.fetch(any())).thenReturn(List.of());
        when(reportWriter.write(any(), any())).thenThrow(new ReportWriteException("disk full", null));

        assertThatThrownBy(() -> service.scan(ScanOptions.defaults().withTargetDate(TARGET)))
                .isInstanceOf(ReportWriteException.class)
                .hasMessageContaining("disk full");
    }

    private void markAvailable() {
        doAnswer(inv -> {
            List<DomainCandidate> candidates = inv.getArgument(0);
            candidates.forEach(c -> c.setAvailable(Availability.AVAILABLE));
            return candidates;
        }).when(availabilityProber).probeAll(anyList());
    }

    private void applyVerdicts(Map<String, IndexVerdict> verdicts) {
        doAnswer(inv -> {
            List<DomainCandidate> candidates = inv.getArgument(0);
            candidates.forEach(c -> c.applyIndexVerdict(verdicts.get(c.getName())));
            return candidates;
        }).when(indexSignalProber).probeAll(anyList(), anyBoolean());
    }

    private static DropRecord record(String name, LocalDate date, Namespace namespace) {
        return DropRecord.builder().name(name).releaseDate(date).namespace(namespace).build();
    }
}
