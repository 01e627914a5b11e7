package org.pokersight.service.poker.util;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Per-session monitors. Session ids are spread over a fixed, power-of-two number of stripes,
 * so two ids may share one; a pass only ever holds the stripe of its own session.
 */
@Component
public class Locks {
    static final int MAX_STRIPES = 4096;

    private final Object[] stripes;

    public Locks(@Value("${poker.session.lock-stripes:128}") int stripeCount) {
        int n = Integer.highestOneBit(Math.max(1, Math.min(MAX_STRIPES, stripeCount)));
        this.stripes = new Object[n];
        for (int i = 0; i < n; i++) stripes[i] = new Object();
    }

    public Object of(String sessionId) {
        int h = Objects.hashCode(sessionId);
        return stripes[(h ^ (h >>> 16)) & (stripes.length - 1)];
    }

    int stripeCount() { return stripes.length; }
}
