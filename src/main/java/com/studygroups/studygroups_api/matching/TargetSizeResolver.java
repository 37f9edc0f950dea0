package com.studygroups.studygroups_api.matching;

import java.util.Arrays;
import java.util.List;

/**
 * Derives the target group size for a roster from the median of the clamped
 * individual preferences.
 */
public class TargetSizeResolver {

    private final int minSize;
    private final int maxSize;
    private final int defaultSize;

    public TargetSizeResolver() {
        this(2, 5, 3);
    }

    public TargetSizeResolver(int minSize, int maxSize, int defaultSize) {
        if (minSize < 1 || maxSize < minSize) {
            throw new IllegalArgumentException("Invalid group size range [" + minSize + ", " + maxSize + "]");
        }
        this.minSize = minSize;
        this.maxSize = maxSize;
        this.defaultSize = clamp(defaultSize);
    }

    public int resolve(List<StudentProfile> students) {
        if (students == null || students.isEmpty()) {
            return defaultSize;
        }

        int[] prefs = new int[students.size()];
        for (int i = 0; i < prefs.length; i++) {
            prefs[i] = clamp(students.get(i).preferredGroupSize());
        }
        Arrays.sort(prefs);

        int mid = prefs.length / 2;
        double median = prefs.length % 2 == 1
                ? prefs[mid]
                : (prefs[mid - 1] + prefs[mid]) / 2.0;

        return clamp((int) median);
    }

    public int clamp(int size) {
        return Math.max(minSize, Math.min(maxSize, size));
    }

    public int getMinSize() { return minSize; }
    public int getMaxSize() { return maxSize; }
    public int getDefaultSize() { return defaultSize; }
}
