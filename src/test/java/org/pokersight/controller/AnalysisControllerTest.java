package org.pokersight.controller;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.pokersight.dto.AnalysisResult;
import org.pokersight.dto.SeatReading;
import org.pokersight.dto.TableSnapshot;
import org.pokersight.dto.TournamentSummaryDto;
import org.pokersight.service.poker.engine.AnalysisEngine;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.server.ResponseStatusException;

import java.util.*;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AnalysisControllerTest {

    @Mock
    private AnalysisEngine engine;

    @InjectMocks
    private AnalysisController controller;

    private final Validator validator = Validation.buildDefaultValidatorFactory().getValidator();

    // --------------------------------------------------------------
    // POST /{sessionId}/snapshots
    // --------------------------------------------------------------
    @Test
    void submit_delegatesToEngine() {
        TableSnapshot snapshot = new TableSnapshot();
        AnalysisResult result = AnalysisResult.builder().sessionId("t1").passNumber(1).build();
        when(engine.analyze("t1", snapshot)).thenReturn(result);

        ResponseEntity<AnalysisResult> response = controller.submit("t1", snapshot);

        assertThat(response.getStatusCode().is2xxSuccessful()).isTrue();
        assertThat(response.getBody()).isSameAs(result);
        verify(engine).analyze("t1", snapshot);
    }

    @Test
    void snapshot_validation_limitsCardsAndSeats() {
        TableSnapshot ok = new TableSnapshot();
        ok.setHeroCards(List.of("A♠", "K♠"));
        assertThat(validator.validate(ok)).isEmpty();

        TableSnapshot tooMany = new TableSnapshot();
        tooMany.setHeroCards(List.of("A♠", "K♠", "Q♠"));
        tooMany.setCommunityCards(List.of("2♦", "3♦", "4♦", "5♦", "6♦", "7♦"));
        Map<String, SeatReading> seats = new LinkedHashMap<>();
        for (int i = 0; i < 10; i++) seats.put("Position_" + i, new SeatReading("P" + i, "100"));
        tooMany.setTournamentSeats(seats);
        tooMany.setActiveOpponentCount(-1);

        Set<ConstraintViolation<TableSnapshot>> violations = validator.validate(tooMany);
        assertThat(violations).extracting(v -> v.getPropertyPath().toString())
                .contains("heroCards", "communityCards", "tournamentSeats", "activeOpponentCount");
    }

    // --------------------------------------------------------------
    // GET /{sessionId}/tournament
    // --------------------------------------------------------------
    @Test
    void tournament_knownSession_ok() {
        TournamentSummaryDto summary = TournamentSummaryDto.builder().sessionId("t1").build();
        when(engine.tournament("t1")).thenReturn(Optional.of(summary));

        ResponseEntity<TournamentSummaryDto> response = controller.tournament("t1");

        assertThat(response.getBody()).isSameAs(summary);
    }

    @Test
    void tournament_unknownSession_404() {
        when(engine.tournament("ghost")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> controller.tournament("ghost"))
                .isInstanceOf(ResponseStatusException.class)
                .satisfies(ex -> assertThat(((ResponseStatusException) ex).getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND));
    }

    // --------------------------------------------------------------
    // DELETE /{sessionId}
    // --------------------------------------------------------------
    @Test
    void close_knownSession_noContent() {
        when(engine.close("t1")).thenReturn(true);

        ResponseEntity<?> response = controller.close("t1");

        assertThat(response.getStatusCode().value()).isEqualTo(204);
    }

    @Test
    void close_unknownSession_404() {
        when(engine.close("ghost")).thenReturn(false);

        assertThatThrownBy(() -> controller.close("ghost"))
                .isInstanceOf(ResponseStatusException.class)
                .hasMessageContaining("Unknown session");
    }
}
