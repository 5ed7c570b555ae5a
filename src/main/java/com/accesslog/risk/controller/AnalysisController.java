package com.accesslog.risk.controller;

import com.accesslog.risk.config.AnalysisConfig;
import com.accesslog.risk.exception.TableFormatException;
import com.accesslog.risk.ingest.CsvTableReader;
import com.accesslog.risk.model.AnalysisReport;
import com.accesslog.risk.model.RawTable;
import com.accesslog.risk.model.TableRequest;
import com.accesslog.risk.service.LogAnalysisService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/analysis")
@Tag(name = "Analysis", description = "Score an access-log batch for behavioral risk per source address")
public class AnalysisController {

    private final LogAnalysisService analysisService;
    private final CsvTableReader csvTableReader;
    private final AnalysisConfig analysisConfig;

    public AnalysisController(LogAnalysisService analysisService,
                              CsvTableReader csvTableReader,
                              AnalysisConfig analysisConfig) {
        this.analysisService = analysisService;
        this.csvTableReader = csvTableReader;
        this.analysisConfig = analysisConfig;
    }

    @Operation(summary = "Analyze an uploaded CSV access log",
            description = "Reads the CSV, resolves the address / timestamp / endpoint / status columns, " +
                    "and returns per address-window risk results sorted by risk score descending, plus a batch summary. " +
                    "Rows with an unparsable timestamp or status are dropped and counted.")
    @PostMapping(value = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<AnalysisReport> upload(
            @Parameter(description = "CSV file with a header row")
            @RequestParam("file") MultipartFile file) {
        String filename = file.getOriginalFilename();
        if (filename == null || !filename.toLowerCase(Locale.ROOT).endsWith(".csv")) {
            throw new TableFormatException("Please upload a CSV file.");
        }

        RawTable table;
        try (InputStream input = file.getInputStream()) {
            table = csvTableReader.read(input);
        } catch (IOException e) {
            throw new TableFormatException("Could not read upload " + filename, e);
        }

        AnalysisReport report = analysisService.analyze(table);
        return ResponseEntity.ok(report);
    }

    @Operation(summary = "Analyze a pre-parsed table",
            description = "Same pipeline as the CSV upload, for callers that already hold the header and rows.")
    @PostMapping("/table")
    public ResponseEntity<AnalysisReport> analyzeTable(@RequestBody TableRequest request) {
        if (request.getHeaders() == null || request.getRows() == null) {
            throw new TableFormatException("headers and rows are required");
        }
        AnalysisReport report = analysisService.analyze(request.toRawTable());
        return ResponseEntity.ok(report);
    }

    @Operation(summary = "Get effective analysis settings")
    @GetMapping("/settings")
    public ResponseEntity<Map<String, Object>> getSettings() {
        AnalysisConfig.Forest forest = analysisConfig.getForest();
        Map<String, Object> settings = new LinkedHashMap<>();
        settings.put("windowMinutes", analysisConfig.getWindowMinutes());
        settings.put("numTrees", forest.getNumTrees());
        settings.put("sampleSize", forest.getSampleSize());
        settings.put("contamination", forest.getContamination());
        settings.put("parallel", forest.isParallel());
        settings.put("seeded", forest.getSeed() != null);
        return ResponseEntity.ok(settings);
    }
}
