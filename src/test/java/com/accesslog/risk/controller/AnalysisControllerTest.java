package com.accesslog.risk.controller;

import com.accesslog.risk.config.AnalysisConfig;
import com.accesslog.risk.exception.EmptyBatchException;
import com.accesslog.risk.exception.SchemaValidationException;
import com.accesslog.risk.ingest.CsvTableReader;
import com.accesslog.risk.model.AnalysisReport;
import com.accesslog.risk.model.AnomalyResult;
import com.accesslog.risk.model.RawTable;
import com.accesslog.risk.model.TableRequest;
import com.accesslog.risk.service.BatchSummaryService;
import com.accesslog.risk.service.LogAnalysisService;
import com.accesslog.risk.testutil.TestDataFactory;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(AnalysisController.class)
@Import(CsvTableReader.class)
class AnalysisControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private LogAnalysisService analysisService;

    @MockBean
    private AnalysisConfig analysisConfig;

    private AnalysisReport report;

    @BeforeEach
    void setUp() {
        List<AnomalyResult> results = List.of(
                TestDataFactory.createAnomalyResult("10.0.0.99", 100.0, true),
                TestDataFactory.createAnomalyResult("10.0.0.1", 0.0, false));
        report = AnalysisReport.builder()
                .results(results)
                .summary(new BatchSummaryService().summarize(results, 1))
                .build();
        when(analysisConfig.getForest()).thenReturn(new AnalysisConfig.Forest());
        when(analysisConfig.getWindowMinutes()).thenReturn(5);
    }

    @Test
    void upload_csv_returnsReport() throws Exception {
        when(analysisService.analyze(any(RawTable.class))).thenReturn(report);
        MockMultipartFile file = new MockMultipartFile("file", "access.CSV", "text/csv",
                "IP,Time,URL,staus\n10.0.0.1,2024-03-01T10:00:00Z,/,200\n".getBytes(StandardCharsets.UTF_8));

        mockMvc.perform(multipart("/api/v1/analysis/upload").file(file))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.results[0].address").value("10.0.0.99"))
                .andExpect(jsonPath("$.results[0].riskScore").value(100.0))
                .andExpect(jsonPath("$.results[0].riskLevel").value("HIGH"))
                .andExpect(jsonPath("$.results[0].anomaly").value(true))
                .andExpect(jsonPath("$.results[0].windowStart").value("2024-03-01T10:00:00Z"))
                .andExpect(jsonPath("$.summary.totalAddresses").value(2))
                .andExpect(jsonPath("$.summary.highRiskCount").value(1))
                .andExpect(jsonPath("$.summary.droppedRowCount").value(1));

        ArgumentCaptor<RawTable> captor = ArgumentCaptor.forClass(RawTable.class);
        verify(analysisService).analyze(captor.capture());
        assertThat(captor.getValue().headers()).containsExactly("IP", "Time", "URL", "staus");
        assertThat(captor.getValue().rows()).hasSize(1);
    }

    @Test
    void upload_nonCsvFile_badRequest() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "access.log", "text/plain",
                "ip timestamp".getBytes(StandardCharsets.UTF_8));

        mockMvc.perform(multipart("/api/v1/analysis/upload").file(file))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("TABLE_FORMAT"));

        verify(analysisService, never()).analyze(any(RawTable.class));
    }

    @Test
    void upload_missingColumn_badRequestNamingField() throws Exception {
        when(analysisService.analyze(any(RawTable.class)))
                .thenThrow(new SchemaValidationException(List.of("status"), List.of("ip", "time", "url")));
        MockMultipartFile file = new MockMultipartFile("file", "access.csv", "text/csv",
                "ip,time,url\n10.0.0.1,2024-03-01T10:00:00Z,/\n".getBytes(StandardCharsets.UTF_8));

        mockMvc.perform(multipart("/api/v1/analysis/upload").file(file))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("SCHEMA_VALIDATION"))
                .andExpect(jsonPath("$.field").value("status"))
                .andExpect(jsonPath("$.results").doesNotExist());
    }

    @Test
    void analyzeTable_emptyBatch_unprocessable() throws Exception {
        when(analysisService.analyze(any(RawTable.class))).thenThrow(new EmptyBatchException(3));
        TableRequest request = TableRequest.builder()
                .headers(List.of("ip", "timestamp", "endpoint", "status"))
                .rows(List.of(List.of("10.0.0.1", "bad", "/", "200")))
                .build();

        mockMvc.perform(post("/api/v1/analysis/table")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("EMPTY_BATCH"))
                .andExpect(jsonPath("$.droppedRowCount").value(3));
    }

    @Test
    void analyzeTable_success() throws Exception {
        when(analysisService.analyze(any(RawTable.class))).thenReturn(report);
        TableRequest request = TableRequest.builder()
                .headers(List.of("ip", "timestamp", "endpoint", "status"))
                .rows(List.of(List.of("10.0.0.1", "2024-03-01T10:00:00Z", "/", "200")))
                .build();

        mockMvc.perform(post("/api/v1/analysis/table")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.results").isArray())
                .andExpect(jsonPath("$.summary.topThreat.address").value("10.0.0.99"));
    }

    @Test
    void analyzeTable_missingRows_badRequest() throws Exception {
        mockMvc.perform(post("/api/v1/analysis/table")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"headers\": [\"ip\"]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("TABLE_FORMAT"));
    }

    @Test
    void getSettings_returnsEffectiveConfiguration() throws Exception {
        mockMvc.perform(get("/api/v1/analysis/settings"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.windowMinutes").value(5))
                .andExpect(jsonPath("$.numTrees").value(100))
                .andExpect(jsonPath("$.sampleSize").value(256))
                .andExpect(jsonPath("$.seeded").value(false));
    }
}
