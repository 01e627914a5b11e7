package org.pokersight.service.poker.registry;

import org.pokersight.model.poker.AnalysisSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

@Service
public class SessionRegistry {
    private final Logger log = LoggerFactory.getLogger(getClass());
    private final Map<String, AnalysisSession> sessions = new ConcurrentHashMap<>();

    public AnalysisSession getOrCreate(String id) {
        return sessions.computeIfAbsent(id, k -> {
            log.info("Opening analysis session {}", k);
            return new AnalysisSession(k);
        });
    }

    public Optional<AnalysisSession> find(String id) { return Optional.ofNullable(sessions.get(id)); }
    public boolean remove(String id) {
        boolean removed = sessions.remove(id) != null;
        if (removed) log.info("Closed analysis session {}", id);
        return removed;
    }
    public Collection<AnalysisSession> all() { return sessions.values(); }
}
