package com.zzf.workspace.core.rag.search;

/**
 * Okapi BM25 with k1 = 1.2, b = 0.75 and the non-negative idf variant
 * {@code ln(1 + (N - df + 0.5) / (df + 0.5))}.
 */
public final class Bm25Scorer {
    public static final double K1 = 1.2;
    public static final double B = 0.75;

    private Bm25Scorer() {
    }

    public static double idf(int totalDocs, int docFrequency) {
        return Math.log(1.0 + (totalDocs - docFrequency + 0.5) / (docFrequency + 0.5));
    }

    /**
     * Contribution of one query term occurring {@code termFrequency} times in a document
     * of {@code docLength} tokens. A zero average length is treated as 1.
     */
    public static double termScore(int termFrequency, int docFrequency, int totalDocs, int docLength, double avgDocLength) {
        if (termFrequency <= 0) {
            return 0.0;
        }
        double avg = avgDocLength == 0.0 ? 1.0 : avgDocLength;
        double denom = termFrequency + K1 * (1.0 - B + B * docLength / avg);
        return idf(totalDocs, docFrequency) * (termFrequency * (K1 + 1.0)) / denom;
    }
}
