package com.studygroups.studygroups_api.matching;

import java.util.List;

/**
 * Symmetric pairwise score table for one roster, indexed by roster position.
 */
public final class CompatibilityMatrix {

    private final int[][] scores;

    private CompatibilityMatrix(int[][] scores) {
        this.scores = scores;
    }

    public static CompatibilityMatrix build(List<StudentProfile> roster, CompatibilityScorer scorer) {
        int n = roster.size();
        int[][] scores = new int[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                int score = scorer.score(roster.get(i), roster.get(j));
                scores[i][j] = score;
                scores[j][i] = score;
            }
        }
        return new CompatibilityMatrix(scores);
    }

    int score(int i, int j) {
        return i == j ? 0 : scores[i][j];
    }

    /** Sum of scores between {@code candidate} and every index in {@code others}, skipping itself. */
    public int sum(int candidate, Iterable<Integer> others) {
        int total = 0;
        for (int other : others) {
            if (other != candidate) {
                total += scores[candidate][other];
            }
        }
        return total;
    }

    public double average(int candidate, List<Integer> members) {
        if (members.isEmpty()) {
            return 0.0;
        }
        return (double) sum(candidate, members) / members.size();
    }

    int size() {
        return scores.length;
    }
}
