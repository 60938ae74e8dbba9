package com.snapback.drop.output;

import com.snapback.drop.config.DropScannerProperties;
import com.snapback.drop.model.Report;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.LocalDate;

/**
 * Persists a report as {reportDir}/{date}.csv and {reportDir}/{date}.json.
 *
 * Both files are rendered to temp files in the report directory first and only
 * moved into place once both renders succeed, so a failed run never leaves a
 * half-written report behind.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ReportWriter {

    private final CsvReportWriter csvReportWriter;
    private final JsonReportWriter jsonReportWriter;
    private final DropScannerProperties properties;

    public ReportPaths write(Report report, LocalDate reportDate) {
        Path outputDir = Paths.get(properties.getOutput().getReportDir());
        Path csvPath = outputDir.resolve(reportDate + ".csv");
        Path jsonPath = outputDir.resolve(reportDate + ".json");

        Path csvTemp = null;
        Path jsonTemp = null;
        try {
            Files.createDirectories(outputDir);

            csvTemp = Files.createTempFile(outputDir, reportDate + "-", ".csv.tmp");
            try (Writer out = Files.newBufferedWriter(csvTemp, StandardCharsets.UTF_8)) {
                csvReportWriter.write(report, out);
            }

            jsonTemp = Files.createTempFile(outputDir, reportDate + "-", ".json.tmp");
            try (Writer out = Files.newBufferedWriter(jsonTemp, StandardCharsets.UTF_8)) {
                jsonReportWriter.write(report, out);
            }

            publish(csvTemp, csvPath, jsonTemp, jsonPath);
        } catch (IOException e) {
            deleteQuietly(csvTemp);
            deleteQuietly(jsonTemp);
            log.error("Failed to write report for {}: {}", reportDate, e.getMessage(), e);
            throw new ReportWriteException("Report write failed for " + reportDate, e);
        }

        log.info("Written {} domains to {} and {}", report.getTotalDomains(), csvPath, jsonPath);
        return new ReportPaths(csvPath, jsonPath);
    }

    /**
     * Moves both renders into place. If the JSON move fails the previous CSV
     * (or no CSV, if there was none) is restored, so the pair stays consistent.
     */
    private void publish(Path csvTemp, Path csvPath, Path jsonTemp, Path jsonPath) throws IOException {
        Path csvBackup = null;
        if (Files.exists(csvPath)) {
            csvBackup = Files.createTempFile(csvPath.getParent(), csvPath.getFileName() + "-", ".bak");
            moveIntoPlace(csvPath, csvBackup);
        }
        try {
            moveIntoPlace(csvTemp, csvPath);
            moveIntoPlace(jsonTemp, jsonPath);
        } catch (IOException e) {
            restore(csvBackup, csvPath, e);
            throw e;
        }
        deleteQuietly(csvBackup);
    }

    private void restore(Path backup, Path target, IOException failure) {
        try {
            if (backup == null) {
                Files.deleteIfExists(target);
            } else {
                moveIntoPlace(backup, target);
            }
        } catch (IOException e) {
            failure.addSuppressed(e);
            log.error("Could not restore {} after failed report write: {}", target, e.getMessage());
        }
    }

    private void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void deleteQuietly(Path temp) {
        if (temp == null) return;
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Could not remove temp report file {}: {}", temp, e.getMessage());
        }
    }
}
