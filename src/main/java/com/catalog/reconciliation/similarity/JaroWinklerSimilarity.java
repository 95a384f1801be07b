package com.catalog.reconciliation.similarity;

/**
 * Jaro-Winkler similarity; rewards a shared prefix of up to four characters.
 */
public class JaroWinklerSimilarity implements SimilarityAlgorithm {

    private static final double PREFIX_SCALE = 0.1;
    private static final int PREFIX_LIMIT = 4;

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        if (s1.equals(s2)) {
            return 1.0;
        }
        if (s1.isEmpty() || s2.isEmpty()) {
            return 0.0;
        }
        double jaro = jaro(s1, s2);
        int prefix = commonPrefix(s1, s2);
        return jaro + prefix * PREFIX_SCALE * (1.0 - jaro);
    }

    @Override
    public String getName() {
        return "jaro-winkler";
    }

    private static int commonPrefix(String a, String b) {
        int limit = Math.min(PREFIX_LIMIT, Math.min(a.length(), b.length()));
        int i = 0;
        while (i < limit && a.charAt(i) == b.charAt(i)) {
            i++;
        }
        return i;
    }

    private static double jaro(String a, String b) {
        int window = Math.max(0, Math.max(a.length(), b.length()) / 2 - 1);
        boolean[] matchedA = new boolean[a.length()];
        boolean[] matchedB = new boolean[b.length()];

        int matches = 0;
        for (int i = 0; i < a.length(); i++) {
            int from = Math.max(0, i - window);
            int to = Math.min(b.length(), i + window + 1);
            for (int j = from; j < to; j++) {
                if (!matchedB[j] && a.charAt(i) == b.charAt(j)) {
                    matchedA[i] = true;
                    matchedB[j] = true;
                    matches++;
                    break;
                }
            }
        }
        if (matches == 0) {
            return 0.0;
        }

        int halfTranspositions = 0;
        int j = 0;
        for (int i = 0; i < a.length(); i++) {
            if (matchedA[i]) {
                while (!matchedB[j]) {
                    j++;
                }
                if (a.charAt(i) != b.charAt(j)) {
                    halfTranspositions++;
                }
                j++;
            }
        }

        double m = matches;
        return (m / a.length() + m / b.length() + (m - halfTranspositions / 2.0) / m) / 3.0;
    }
}
