package com.snapback.drop.output;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.snapback.drop.model.Report;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Writer;

/**
 * Renders a report as {generated_at, total_domains, domains[]}.
 * Tri-state fields serialise as true, false or null.
 */
@Component
@RequiredArgsConstructor
public class JsonReportWriter {

    private final ObjectMapper objectMapper;

    public void write(Report report, Writer out) throws IOException {
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(out, report);
    }
}
