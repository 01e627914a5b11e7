package org.pokersight.service.poker.registry;

import org.pokersight.model.poker.AnalysisSession;
import org.pokersight.service.poker.util.Locks;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Closes sessions nobody has posted a snapshot to for a while. Recognizers that stop
 * without a DELETE would otherwise keep their session forever.
 */
@Component
public class IdleSessionSweeper {
    private final Logger log = LoggerFactory.getLogger(getClass());
    private final SessionRegistry registry;
    private final Locks locks;
    private final Duration idleTimeout;

    public IdleSessionSweeper(SessionRegistry registry, Locks locks,
                              @Value("${poker.session.idle-timeout-ms:1800000}") long idleTimeoutMs) {
        this.registry = registry;
        this.locks = locks;
        this.idleTimeout = Duration.ofMillis(Math.max(1_000L, idleTimeoutMs));
    }

    @Scheduled(fixedRateString = "${poker.session.sweep-interval-ms:600000}",
            initialDelayString = "${poker.session.sweep-interval-ms:600000}")
    public void closeIdleSessions() {
        int closed = sweep(Instant.now());
        if (closed > 0) log.info("Closed {} idle session(s), {} open", closed, registry.all().size());
    }

    /** @return how many sessions were closed */
    int sweep(Instant now) {
        Instant cutoff = now.minus(idleTimeout);
        List<String> idle = new ArrayList<>();
        for (AnalysisSession s : registry.all()) {
            if (s.lastActivity().isBefore(cutoff)) idle.add(s.getId());
        }
        int closed = 0;
        for (String id : idle) {
            synchronized (locks.of(id)) {
                // a pass may have landed since the scan
                AnalysisSession s = registry.find(id).orElse(null);
                if (s == null || !s.lastActivity().isBefore(cutoff)) continue;
                if (registry.remove(id)) {
                    log.debug("Session {} idle since {}", id, s.lastActivity());
                    closed++;
                }
            }
        }
        return closed;
    }
}
