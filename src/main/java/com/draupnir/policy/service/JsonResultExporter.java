package com.draupnir.policy.service;

import com.draupnir.policy.model.api.PostureExport;
import com.draupnir.policy.model.report.PostureChecklist;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;

import javax.enterprise.context.ApplicationScoped;
import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;

/**
 * Service for exporting posture checklists to JSON format
 */
@Slf4j
@ApplicationScoped
public class JsonResultExporter {

    private final ObjectMapper objectMapper;

    public JsonResultExporter() {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    /**
     * Wrap a checklist with the scan context
     */
    public PostureExport toExport(PostureChecklist checklist, Path dataDir, String pathGlob) {
        return PostureExport.builder()
                .generatedAt(Instant.now())
                .dataDir(dataDir.toString())
                .pathGlob(pathGlob)
                .stats(checklist.getStats())
                .details(checklist.getDetails())
                .build();
    }

    /**
     * Export a posture checklist to a JSON file
     *
     * @param checklist Scan result
     * @param dataDir Data directory that was scanned
     * @param pathGlob Glob the scan was restricted to
     * @param outputFile Output file path
     */
    public void exportToJson(PostureChecklist checklist, Path dataDir, String pathGlob, File outputFile) throws IOException {
        log.info("Exporting posture checklist to JSON: {}", outputFile.getAbsolutePath());

        objectMapper.writeValue(outputFile, toExport(checklist, dataDir, pathGlob));

        log.info("Successfully exported JSON results: {} policies, {} with L7, {} with DNS handled",
                checklist.getStats().getTotal(),
                checklist.getStats().getWithL7Count(),
                checklist.getStats().getDnsOkCount());
    }
}
