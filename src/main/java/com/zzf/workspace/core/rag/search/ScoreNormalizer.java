package com.zzf.workspace.core.rag.search;

import java.util.ArrayList;
import java.util.List;

/**
 * Min-max normalization into [0, 1]. A zero range (including a single result) maps
 * every score to 1.
 */
final class ScoreNormalizer {

    private ScoreNormalizer() {
    }

    static List<ScoredPath> normalize(List<ScoredPath> results) {
        if (results.isEmpty()) {
            return results;
        }
        double max = Double.NEGATIVE_INFINITY;
        double min = Double.POSITIVE_INFINITY;
        for (ScoredPath r : results) {
            max = Math.max(max, r.score);
            min = Math.min(min, r.score);
        }
        double range = max - min;
        List<ScoredPath> out = new ArrayList<>(results.size());
        for (ScoredPath r : results) {
            out.add(new ScoredPath(r.path, range <= 0 ? 1.0 : (r.score - min) / range));
        }
        return out;
    }

    static final class ScoredPath {
        final String path;
        final double score;

        ScoredPath(String path, double score) {
            this.path = path;
            this.score = score;
        }
    }
}
