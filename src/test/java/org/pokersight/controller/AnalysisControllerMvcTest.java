package org.pokersight.controller;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.web.servlet.MockMvc;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
@TestPropertySource(properties = {
        "poker.equity.seed=42",
        "poker.equity.sample-size=50"
})
class AnalysisControllerMvcTest {

    @Autowired
    private MockMvc mockMvc;

    @Test
    void postSnapshot_thenReadTournament_thenClose() throws Exception {
        String body = """
                {
                  "heroCards": ["A♠", "K♠"],
                  "communityCards": ["Q♠", "J♠", "10♠", "2♥", "3♦"],
                  "pot": "$1,250",
                  "blinds": "25/50",
                  "tournamentSeats": {
                    "Hero": {"name": "HeroGuy", "stack": "2000"},
                    "Position_1": {"name": "Bob", "stack": "1500"}
                  }
                }
                """;

        mockMvc.perform(post("/api/sessions/table-1/snapshots")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.sessionId").value("table-1"))
                .andExpect(jsonPath("$.stage").value("River"))
                .andExpect(jsonPath("$.handEvaluation.category").value("Royal Flush"))
                .andExpect(jsonPath("$.probabilityAnalysis.equity.winPercentage").value(100.0))
                .andExpect(jsonPath("$.tournamentMetrics.activePlayers").value(2))
                .andExpect(jsonPath("$.pot").value(1250.0));

        mockMvc.perform(get("/api/sessions/table-1/tournament"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.metrics.chipLeader.name").value("HeroGuy"))
                .andExpect(jsonPath("$.metrics.bigBlind").value(50));

        mockMvc.perform(delete("/api/sessions/table-1"))
                .andExpect(status().isNoContent());

        mockMvc.perform(get("/api/sessions/table-1/tournament"))
                .andExpect(status().isNotFound());
    }

    @Test
    void postSnapshot_tooManyHeroCards_badRequest() throws Exception {
        mockMvc.perform(post("/api/sessions/table-2/snapshots")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"heroCards\": [\"A♠\", \"K♠\", \"Q♠\"]}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void postSnapshot_activeOpponentCardCountAlias_isHonoured() throws Exception {
        mockMvc.perform(post("/api/sessions/table-3/snapshots")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"heroCards\": [\"A♠\", \"K♠\"], \"activeOpponentCardCount\": 2}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.probabilityAnalysis.opponents").value(2))
                .andExpect(jsonPath("$.probabilityAnalysis.equity.winPercentage").value(30.0));
    }

    @Test
    void deleteUnknownSession_notFound() throws Exception {
        mockMvc.perform(delete("/api/sessions/nobody"))
                .andExpect(status().isNotFound());
    }
}
