package com.snapback.drop.output;

import com.opencsv.CSVWriter;
import com.snapback.drop.config.DropScannerProperties;
import com.snapback.drop.model.Report;
import com.snapback.drop.model.ReportRow;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Writer;

/**
 * Renders a report as CSV, one row per domain in report order.
 *
 * Tri-state columns use "true", "false" or "unknown"; a missing page count is an empty cell.
 */
@Component
@RequiredArgsConstructor
public class CsvReportWriter {

    static final String[] HEADERS = {
            "domain", "tld", "release_date", "available",
            "indexed", "estimated_pages", "index_source", "checked_at"
    };

    private final DropScannerProperties properties;

    public void write(Report report, Writer out) throws IOException {
        CSVWriter writer = new CSVWriter(out,
                CSVWriter.DEFAULT_SEPARATOR,
                CSVWriter.DEFAULT_QUOTE_CHARACTER,
                CSVWriter.DEFAULT_ESCAPE_CHARACTER,
                CSVWriter.DEFAULT_LINE_END);

        if (properties.getOutput().isIncludeHeader()) {
            writer.writeNext(HEADERS, false);
        }
        for (ReportRow row : report.getDomains()) {
            writer.writeNext(toRow(row), false);
        }
        writer.flush();
        if (writer.checkError()) {
            throw new IOException("CSV writer reported an error");
        }
    }

    private String[] toRow(ReportRow r) {
        return new String[]{
                str(r.getDomain()),
                str(r.getTld()),
                str(r.getReleaseDate()),
                r.getAvailable().asToken(),
                r.getIndexed().asToken(),
                str(r.getEstimatedPages()),
                str(r.getIndexSource()),
                str(r.getCheckedAt())
        };
    }

    private String str(Object val) {
        return val == null ? "" : val.toString();
    }
}
