package tw.gc.greyoak.score.controllers;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import tw.gc.greyoak.score.config.ScoringConfig;
import tw.gc.greyoak.score.enums.Band;
import tw.gc.greyoak.score.enums.GuardrailFlag;
import tw.gc.greyoak.score.enums.Pillar;
import tw.gc.greyoak.score.enums.ScoringMode;
import tw.gc.greyoak.score.exceptions.InvalidScoringInputException;
import tw.gc.greyoak.score.exceptions.ScoringConfigurationException;
import tw.gc.greyoak.score.exceptions.SnapshotNotFoundException;
import tw.gc.greyoak.score.model.BatchScoreResult;
import tw.gc.greyoak.score.model.ScoreDiagnostics;
import tw.gc.greyoak.score.model.ScoreExplanation;
import tw.gc.greyoak.score.model.ScoreOutput;
import tw.gc.greyoak.score.model.ScoringFailure;
import tw.gc.greyoak.score.services.BatchScoringService;
import tw.gc.greyoak.score.services.ScoreExplanationService;
import tw.gc.greyoak.score.services.ScoringInputValidator;
import tw.gc.greyoak.score.services.ScorePersistenceService;

import java.time.LocalDate;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ScoreController.class)
class ScoreControllerTest {

    private static final LocalDate DATE = LocalDate.of(2024, 6, 14);

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private BatchScoringService batchScoringService;

    @MockBean
    private ScorePersistenceService persistenceService;

    @MockBean
    private ScoreExplanationService explanationService;

    @MockBean
    private ScoringInputValidator validator;

    @MockBean
    private ScoringConfig config;

    private static ScoreOutput output(String ticker, double score, Band band) {
        Map<Pillar, Double> pillars = new EnumMap<>(Pillar.class);
        for (Pillar pillar : Pillar.values()) {
            pillars.put(pillar, 60.0);
        }
        return ScoreOutput.builder()
                .ticker(ticker)
                .date(DATE)
                .mode(ScoringMode.TRADER)
                .score(score)
                .band(band)
                .pillars(pillars)
                .riskPenalty(3.0)
                .confidence(1.0)
                .guardrailFlags(List.of(GuardrailFlag.PLEDGE_CAP))
                .configHash("abc123")
                .codeVersion("1.0.0")
                .diagnostics(ScoreDiagnostics.builder().weightedScore(65.0).build())
                .build();
    }

    @Test
    void score_withValidRequest_shouldScoreSaveAndReturnOutput() throws Exception {
        ScoreOutput output = output("TCS.NS", 66.5, Band.BUY);
        when(batchScoringService.scoreTicker("TCS.NS", DATE, ScoringMode.TRADER)).thenReturn(output);

        mockMvc.perform(post("/api/v1/score")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"ticker": "TCS.NS", "date": "2024-06-14", "mode": "trader"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ticker").value("TCS.NS"))
                .andExpect(jsonPath("$.date").value("2024-06-14"))
                .andExpect(jsonPath("$.mode").value("Trader"))
                .andExpect(jsonPath("$.band").value("Buy"))
                .andExpect(jsonPath("$.score").value(66.5))
                .andExpect(jsonPath("$.pillars.F").value(60.0))
                .andExpect(jsonPath("$.guardrailFlags[0]").value("PledgeCap"))
                .andExpect(jsonPath("$.diagnostics").doesNotExist());

        verify(persistenceService).save(output);
    }

    @Test
    void score_withUnknownMode_shouldReturnBadRequest() throws Exception {
        mockMvc.perform(post("/api/v1/score")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"ticker": "TCS.NS", "date": "2024-06-14", "mode": "Swing"}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value(400))
                .andExpect(jsonPath("$.message").value(org.hamcrest.Matchers.containsString("Swing")));

        verifyNoInteractions(batchScoringService);
    }

    @Test
    void score_withMissingTicker_shouldReturnBadRequest() throws Exception {
        mockMvc.perform(post("/api/v1/score")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"date": "2024-06-14", "mode": "Trader"}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value(org.hamcrest.Matchers.containsString("ticker")));
    }

    @Test
    void score_withMalformedDate_shouldReturnBadRequest() throws Exception {
        mockMvc.perform(post("/api/v1/score")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"ticker": "TCS.NS", "date": "14/06/2024", "mode": "Trader"}
                                """))
                .andExpect(status().isBadRequest());
    }

    @Test
    void score_whenSnapshotMissing_shouldReturnNotFound() throws Exception {
        when(batchScoringService.scoreTicker(anyString(), any(), any()))
                .thenThrow(new SnapshotNotFoundException("TCS.NS", DATE));

        mockMvc.perform(post("/api/v1/score")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"ticker": "TCS.NS", "date": "2024-06-14", "mode": "Trader"}
                                """))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("No snapshot for TCS.NS on 2024-06-14"));
    }

    @Test
    void score_whenConfigurationBroken_shouldReturnServerError() throws Exception {
        when(batchScoringService.scoreTicker(anyString(), any(), any()))
                .thenThrow(new ScoringConfigurationException("Unknown sector group: crypto"));

        mockMvc.perform(post("/api/v1/score")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"ticker": "TCS.NS", "date": "2024-06-14", "mode": "Trader"}
                                """))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.status").value(500));
    }

    @Test
    void scoreBatch_shouldSaveOutputsAndReportFailures() throws Exception {
        BatchScoreResult result = new BatchScoreResult(DATE, ScoringMode.INVESTOR, 3,
                List.of(output("INFY.NS", 70.0, Band.BUY), output("TCS.NS", 52.0, Band.HOLD)),
                List.of(new ScoringFailure("ODD.NS", "Unknown sector group 'crypto' for ODD.NS")));
        when(batchScoringService.scoreDate(DATE, ScoringMode.INVESTOR)).thenReturn(result);

        mockMvc.perform(post("/api/v1/score/batch")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"date": "2024-06-14", "mode": "Investor"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.universeSize").value(3))
                .andExpect(jsonPath("$.outputs.length()").value(2))
                .andExpect(jsonPath("$.outputs[0].diagnostics").doesNotExist())
                .andExpect(jsonPath("$.failures[0].ticker").value("ODD.NS"));

        verify(persistenceService).saveAll(result.outputs());
    }

    @Test
    void latest_withMode_shouldFilterByMode() throws Exception {
        when(persistenceService.findLatest(ScoringMode.INVESTOR)).thenReturn(List.of(output("TCS.NS", 71.0, Band.BUY)));

        mockMvc.perform(get("/api/v1/scores/latest").param("mode", "investor"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].ticker").value("TCS.NS"));
    }

    @Test
    void byBand_shouldParseBandLabel() throws Exception {
        when(persistenceService.findByBand(Band.STRONG_BUY, DATE, null))
                .thenReturn(List.of(output("INFY.NS", 80.0, Band.STRONG_BUY)));

        mockMvc.perform(get("/api/v1/scores/band/Strong Buy").param("date", "2024-06-14"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].band").value("Strong Buy"));
    }

    @Test
    void byBand_withUnknownBand_shouldReturnBadRequest() throws Exception {
        mockMvc.perform(get("/api/v1/scores/band/Sell").param("date", "2024-06-14"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void history_shouldPassRangeAndMode() throws Exception {
        when(persistenceService.findHistory("TCS.NS", DATE.minusDays(30), DATE, ScoringMode.TRADER))
                .thenReturn(List.of(output("TCS.NS", 60.0, Band.HOLD)));

        mockMvc.perform(get("/api/v1/scores/TCS.NS")
                        .param("start", "2024-05-15")
                        .param("end", "2024-06-14")
                        .param("mode", "Trader"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].score").value(60.0));
    }

    @Test
    void history_withBadTicker_shouldReturnBadRequest() throws Exception {
        doThrow(new InvalidScoringInputException("Invalid ticker 'tcs'")).when(validator).validateTicker("tcs");

        mockMvc.perform(get("/api/v1/scores/tcs"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Invalid ticker 'tcs'"));
    }

    @Test
    void explain_whenStored_shouldReturnExplanation() throws Exception {
        ScoreOutput stored = output("TCS.NS", 66.5, Band.BUY).withoutDiagnostics();
        when(persistenceService.find("TCS.NS", DATE, ScoringMode.TRADER)).thenReturn(Optional.of(stored));
        when(explanationService.explain(stored)).thenReturn(new ScoreExplanation("TCS.NS", DATE, ScoringMode.TRADER,
                66.5, Band.BUY, "TCS.NS scored 66.50 (Buy) in Trader mode on 2024-06-14", Map.of(),
                "3.00 points", List.of("PledgeCap: High promoter pledge"), "confidence 100%", "S_z 0.000 (sector in line)"));

        mockMvc.perform(get("/api/v1/score/TCS.NS/2024-06-14/Trader/explain"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.summary").value("TCS.NS scored 66.50 (Buy) in Trader mode on 2024-06-14"))
                .andExpect(jsonPath("$.guardrails[0]").value("PledgeCap: High promoter pledge"));
    }

    @Test
    void explain_whenNotStored_shouldReturnNotFound() throws Exception {
        when(persistenceService.find("TCS.NS", DATE, ScoringMode.INVESTOR)).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/v1/score/TCS.NS/2024-06-14/investor/explain"))
                .andExpect(status().isNotFound());
    }

    @Test
    void health_shouldReportConfigHash() throws Exception {
        when(config.getHash()).thenReturn("abc123");
        when(config.getCodeVersion()).thenReturn("1.0.0");

        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"))
                .andExpect(jsonPath("$.configHash").value("abc123"));
    }
}
