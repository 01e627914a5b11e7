package org.pokersight.service.poker.registry;

import org.junit.jupiter.api.Test;
import org.pokersight.model.poker.AnalysisSession;

import static org.assertj.core.api.Assertions.assertThat;

class SessionRegistryTest {

    private final SessionRegistry registry = new SessionRegistry();

    @Test
    void getOrCreate_returnsSameSessionForSameId() {
        AnalysisSession a = registry.getOrCreate("table-1");
        assertThat(registry.getOrCreate("table-1")).isSameAs(a);
        assertThat(registry.getOrCreate("table-2")).isNotSameAs(a);
        assertThat(registry.all()).hasSize(2);
    }

    @Test
    void sessions_doNotShareState() {
        AnalysisSession a = registry.getOrCreate("a");
        AnalysisSession b = registry.getOrCreate("b");
        assertThat(a.getHandProgress()).isNotSameAs(b.getHandProgress());
        assertThat(a.getTournament()).isNotSameAs(b.getTournament());
    }

    @Test
    void find_unknownSession_isEmpty() {
        assertThat(registry.find("nope")).isEmpty();
        assertThat(registry.all()).isEmpty();
    }

    @Test
    void remove_forgetsSession() {
        registry.getOrCreate("x");
        assertThat(registry.remove("x")).isTrue();
        assertThat(registry.remove("x")).isFalse();
        assertThat(registry.find("x")).isEmpty();
    }
}
