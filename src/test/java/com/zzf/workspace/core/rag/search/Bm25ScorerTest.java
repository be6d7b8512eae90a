package com.zzf.workspace.core.rag.search;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class Bm25ScorerTest {

    @Test
    public void testIdfIsPositiveEvenForUbiquitousTerms() {
        assertTrue(Bm25Scorer.idf(10, 10) > 0.0);
        assertTrue(Bm25Scorer.idf(10, 1) > Bm25Scorer.idf(10, 5));
    }

    @Test
    public void testTermScoreNeverDecreasesWithFrequency() {
        double previous = 0.0;
        for (int f = 1; f <= 50; f++) {
            double score = Bm25Scorer.termScore(f, 3, 10, 40, 25.0);
            assertTrue(score >= previous, "score dropped at tf=" + f);
            previous = score;
        }
    }

    @Test
    public void testLongerDocumentsScoreLower() {
        double shortDoc = Bm25Scorer.termScore(2, 1, 5, 10, 20.0);
        double longDoc = Bm25Scorer.termScore(2, 1, 5, 80, 20.0);

        assertTrue(shortDoc > longDoc);
    }

    @Test
    public void testZeroAverageLengthIsTreatedAsOne() {
        assertEquals(Bm25Scorer.termScore(1, 1, 2, 1, 1.0), Bm25Scorer.termScore(1, 1, 2, 1, 0.0), 1e-12);
    }

    @Test
    public void testAbsentTermContributesNothing() {
        assertEquals(0.0, Bm25Scorer.termScore(0, 1, 2, 3, 3.0));
    }
}
