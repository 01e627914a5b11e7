package org.pokersight.model.poker;

import lombok.Data;

import java.time.Instant;

/**
 * Everything one observed table carries from pass to pass.
 */
@Data
public class AnalysisSession {
    private final String id;
    private final HandProgress handProgress = new HandProgress();
    private final TournamentState tournament;
    private final Instant createdAt;

    private long passCount = 0;
    private Instant lastPassAt;

    public AnalysisSession(String id, Instant createdAt) {
        this.id = id;
        this.createdAt = createdAt;
        this.tournament = new TournamentState(createdAt);
    }

    public AnalysisSession(String id) { this(id, Instant.now()); }

    /** Time of the last pass, or of creation when no pass ran yet. */
    public Instant lastActivity() {
        return lastPassAt != null ? lastPassAt : createdAt;
    }

    public long nextPass(Instant at) {
        lastPassAt = at;
        return ++passCount;
    }
}
