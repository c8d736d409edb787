package com.structural.topology.export;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * LRFD combinations of the primary load cases. A combination is only written when every
 * case it refers to is present.
 */
public enum LoadCombination {
    FACTORED_DEAD("1.4 DL", factors(1.4, 0.0, 0.0)),
    DEAD_AND_LIVE("1.2 DL + 1.6 LL", factors(1.2, 1.6, 0.0)),
    DEAD_LIVE_AND_WIND("1.2 DL + 1.0 LL + 1.0 WL", factors(1.2, 1.0, 1.0));

    private final String title;
    private final Map<LoadCase, Double> factors;

    LoadCombination(String title, Map<LoadCase, Double> factors) {
        this.title = title;
        this.factors = factors;
    }

    public String getTitle() {
        return title;
    }

    /**
     * Cases with a non-zero factor, in load case order.
     */
    public Set<LoadCase> getCases() {
        return factors.keySet();
    }

    public double factorFor(LoadCase loadCase) {
        return factors.getOrDefault(loadCase, 0.0);
    }

    private static Map<LoadCase, Double> factors(double dead, double live, double wind) {
        Map<LoadCase, Double> factors = new EnumMap<>(LoadCase.class);
        if (dead != 0.0) {
            factors.put(LoadCase.DEAD, dead);
        }
        if (live != 0.0) {
            factors.put(LoadCase.LIVE, live);
        }
        if (wind != 0.0) {
            factors.put(LoadCase.WIND, wind);
        }
        return Collections.unmodifiableMap(factors);
    }
}
