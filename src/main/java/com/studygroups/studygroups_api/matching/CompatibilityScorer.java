package com.studygroups.studygroups_api.matching;

/**
 * Scores how well two students of the same course fit together.
 *
 * <p>Starts from a base score, adds one point per shared availability slot and
 * subtracts {@code sizeDiff - 1} when the preferred group sizes differ by two or more.
 * The result is never negative.
 */
public class CompatibilityScorer {

    public static final int DEFAULT_BASE_SCORE = 5;

    private final int baseScore;

    public CompatibilityScorer() {
        this(DEFAULT_BASE_SCORE);
    }

    public CompatibilityScorer(int baseScore) {
        this.baseScore = baseScore;
    }

    public int score(StudentProfile a, StudentProfile b) {
        int overlap = 0;
        for (String slotId : a.availabilitySlotIds()) {
            if (b.availabilitySlotIds().contains(slotId)) {
                overlap++;
            }
        }

        int sizeDiff = Math.abs(a.preferredGroupSize() - b.preferredGroupSize());
        int penalty = sizeDiff >= 2 ? sizeDiff - 1 : 0;

        return Math.max(0, baseScore + overlap - penalty);
    }
}
