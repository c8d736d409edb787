package com.structural.topology.export;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

/**
 * Formats id lists the way structural command files expect them: runs of three or
 * more consecutive ids collapse to {@code a TO b}.
 */
public final class IdRanges {

    private IdRanges() {
    }

    public static String format(Iterable<Integer> ids) {
        TreeSet<Integer> sorted = new TreeSet<>();
        ids.forEach(sorted::add);

        List<String> parts = new ArrayList<>();
        Integer runStart = null;
        Integer previous = null;
        for (Integer id : sorted) {
            if (previous != null && id == previous + 1) {
                previous = id;
                continue;
            }
            if (runStart != null) {
                appendRun(parts, runStart, previous);
            }
            runStart = id;
            previous = id;
        }
        if (runStart != null) {
            appendRun(parts, runStart, previous);
        }
        return String.join(" ", parts);
    }

    private static void appendRun(List<String> parts, int from, int to) {
        if (to - from >= 2) {
            parts.add(from + " TO " + to);
        } else {
            for (int id = from; id <= to; id++) {
                parts.add(String.valueOf(id));
            }
        }
    }
}
