package org.ptnet.model;

import java.util.HashMap;
import java.util.Map;

/**
 * Deterministic ids for entities built in code rather than decoded.
 *
 * One generator covers one net-construction session; each prefix has its own
 * counter starting at 1, so a fresh generator always yields {@code Place1},
 * {@code Place2}, {@code Transition1}, ...
 */
public class IdGenerator {

    public static final String PLACE_PREFIX = "Place";
    public static final String TRANSITION_PREFIX = "Transition";
    public static final String ARC_PREFIX = "Arc";

    private final Map<String, Long> counters = new HashMap<>();

    public synchronized String next(String prefix) {
        long n = counters.merge(prefix, 1L, Long::sum);
        return prefix + n;
    }

    public String nextPlaceId() {
        return next(PLACE_PREFIX);
    }

    public String nextTransitionId() {
        return next(TRANSITION_PREFIX);
    }

    public String nextArcId() {
        return next(ARC_PREFIX);
    }
}
