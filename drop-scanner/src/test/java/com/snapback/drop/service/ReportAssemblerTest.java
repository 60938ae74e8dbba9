package com.snapback.drop.service;

import com.snapback.drop.model.Availability;
import com.snapback.drop.model.DomainCandidate;
import com.snapback.drop.model.IndexPresence;
import com.snapback.drop.model.Namespace;
import com.snapback.drop.model.Report;
import com.snapback.drop.model.ReportRow;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ReportAssemblerTest {

    private static final Instant GENERATED_AT = Instant.parse("2026-01-10T21:15:00Z");

    private final ReportAssembler assembler = new ReportAssembler();

    @Test
    void equalPageCountsAreOrderedByName() {
        Report report = assembler.assemble(List.of(candidate("b.se", 5), candidate("a.se", 5)), GENERATED_AT);

        assertThat(report.getDomains()).extracting(ReportRow::getDomain).containsExactly("a.se", "b.se");
    }

    @Test
    void sortsByPagesDescendingWithMissingCountsAsZero() {
        Report report = assembler.assemble(List.of(
                candidate("zeta.nu", null),
                candidate("mid.se", 40),
                candidate("alpha.se", null),
                candidate("top.se", 150),
                candidate("aaa.se", 0)), GENERATED_AT);

        assertThat(report.getDomains()).extracting(ReportRow::getDomain)
                .containsExactly("top.se", "mid.se", "aaa.se", "alpha.se", "zeta.nu");

        List<ReportRow> rows = report.getDomains();
        for (int i = 0; i + 1 < rows.size(); i++) {
            ReportRow a = rows.get(i);
            ReportRow b = rows.get(i + 1);
            if (a.pagesOrZero() != b.pagesOrZero()) {
                assertThat(a.pagesOrZero()).isGreaterThan(b.pagesOrZero());
            } else {
                assertThat(a.getDomain()).isLessThanOrEqualTo(b.getDomain());
            }
        }
    }

    @Test
    void mapsCandidateFieldsToCanonicalRow() {
        DomainCandidate candidate = DomainCandidate.builder()
                .name("example.nu")
                .namespace(Namespace.NU)
                .releaseDate(LocalDate.of(2026, 1, 11))
                .available(Availability.AVAILABLE)
                .indexed(IndexPresence.PRESENT)
                .estimatedPages(42)
                .indexSource("archive")
                .checkedAt(Instant.parse("2026-01-10T21:00:00Z"))
                .build();

        Report report = assembler.assemble(List.of(candidate), GENERATED_AT);

        assertThat(report.getGeneratedAt()).isEqualTo("2026-01-10T21:15:00Z");
        assertThat(report.getTotalDomains()).isEqualTo(1);
        ReportRow row = report.getDomains().get(0);
        assertThat(row.getDomain()).isEqualTo("example.nu");
        assertThat(row.getTld()).isEqualTo("nu");
        assertThat(row.getReleaseDate()).isEqualTo("2026-01-11");
        assertThat(row.getAvailable()).isEqualTo(Availability.AVAILABLE);
        assertThat(row.getIndexed()).isEqualTo(IndexPresence.PRESENT);
        assertThat(row.getEstimatedPages()).isEqualTo(42);
        assertThat(row.getIndexSource()).isEqualTo("archive");
        assertThat(row.getCheckedAt()).isEqualTo("2026-01-10T21:00:00Z");
    }

    @Test
    void unknownStatesSurviveAssembly() {
        DomainCandidate candidate = DomainCandidate.builder().name("x.se").namespace(Namespace.SE).build();

        ReportRow row = assembler.assemble(List.of(candidate), GENERATED_AT).getDomains().get(0);

        assertThat(row.getAvailable()).isEqualTo(Availability.UNKNOWN);
        assertThat(row.getIndexed()).isEqualTo(IndexPresence.UNKNOWN);
        assertThat(row.getIndexSource()).isEmpty();
    }

    @Test
    void emptyCandidateListGivesEmptyReport() {
        Report report = assembler.assemble(List.of(), GENERATED_AT);

        assertThat(report.getTotalDomains()).isZero();
        assertThat(report.getDomains()).isEmpty();
    }

    @Test
    void summaryListsTopDomains() {
        Report report = assembler.assemble(List.of(candidate("big.se", 150), candidate("small.nu", 2),
                candidate("nocount.se", null)), GENERATED_AT);

        String summary = assembler.summarize(report);

        assertThat(summary)
                .contains("Total domains scanned: 3")
                .contains("Indexed in search engines: 3")
                .contains("With page count data: 2")
                .contains("Highest page count: 150")
                .contains("  - big.se: 150 pages")
                .contains("  - nocount.se: ? pages");
    }

    private DomainCandidate candidate(String name, Integer pages) {
        return DomainCandidate.builder()
                .name(name)
                .namespace(name.endsWith(".nu") ? Namespace.NU : Namespace.SE)
                .releaseDate(LocalDate.of(2026, 1, 11))
                .indexed(IndexPresence.PRESENT)
                .estimatedPages(pages)
                .build();
    }
}
