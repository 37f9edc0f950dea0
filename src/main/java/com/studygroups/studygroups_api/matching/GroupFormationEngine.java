package com.studygroups.studygroups_api.matching;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Greedy seed-and-grow grouping of one course's roster.
 *
 * <p>Every choice iterates the roster by position and keeps the first strictly better
 * candidate, so ties always go to the lowest roster position (or, when placing a
 * leftover student, to the earliest formed group). Given the same roster in the same
 * order the output is identical run after run.
 */
public class GroupFormationEngine {

    private static final Logger logger = LoggerFactory.getLogger(GroupFormationEngine.class);

    private final CompatibilityScorer scorer;
    private final TargetSizeResolver targetSizeResolver;

    public GroupFormationEngine(CompatibilityScorer scorer, TargetSizeResolver targetSizeResolver) {
        this.scorer = scorer;
        this.targetSizeResolver = targetSizeResolver;
    }

    public List<List<StudentProfile>> formGroups(List<StudentProfile> roster) {
        if (roster == null || roster.isEmpty()) {
            return new ArrayList<>();
        }
        if (roster.size() == 1) {
            List<List<StudentProfile>> single = new ArrayList<>();
            single.add(new ArrayList<>(roster));
            return single;
        }

        int targetSize = targetSizeResolver.resolve(roster);
        CompatibilityMatrix matrix = CompatibilityMatrix.build(roster, scorer);
        logger.debug("Forming groups for {} students with target size {}", roster.size(), targetSize);

        TreeSet<Integer> unassigned = new TreeSet<>();
        for (int i = 0; i < roster.size(); i++) {
            unassigned.add(i);
        }

        List<List<Integer>> groups = new ArrayList<>();
        while (!unassigned.isEmpty()) {
            int seed = pickSeed(unassigned, matrix);
            unassigned.remove(seed);

            List<Integer> group = new ArrayList<>();
            group.add(seed);

            while (group.size() < targetSize && !unassigned.isEmpty()) {
                int next = pickBestCandidate(unassigned, group, matrix);
                unassigned.remove(next);
                group.add(next);
            }
            groups.add(group);
        }

        reconcileLeftover(groups, matrix);

        List<List<StudentProfile>> result = new ArrayList<>(groups.size());
        for (List<Integer> group : groups) {
            List<StudentProfile> members = new ArrayList<>(group.size());
            for (int index : group) {
                members.add(roster.get(index));
            }
            result.add(members);
        }
        return result;
    }

    private int pickSeed(TreeSet<Integer> unassigned, CompatibilityMatrix matrix) {
        int bestSeed = unassigned.first();
        long bestTotal = -1;
        for (int candidate : unassigned) {
            long total = matrix.sum(candidate, unassigned);
            if (total > bestTotal) {
                bestTotal = total;
                bestSeed = candidate;
            }
        }
        return bestSeed;
    }

    // A slot is filled even if every candidate averages zero.
    private int pickBestCandidate(TreeSet<Integer> unassigned, List<Integer> group, CompatibilityMatrix matrix) {
        int bestCandidate = unassigned.first();
        double bestAverage = -1.0;
        for (int candidate : unassigned) {
            double average = matrix.average(candidate, group);
            if (average > bestAverage) {
                bestAverage = average;
                bestCandidate = candidate;
            }
        }
        return bestCandidate;
    }

    /**
     * Folds a trailing singleton group into the group it fits best. Only the last formed
     * group is inspected; a lone group stays as it is.
     */
    private void reconcileLeftover(List<List<Integer>> groups, CompatibilityMatrix matrix) {
        if (groups.size() < 2 || groups.get(groups.size() - 1).size() != 1) {
            return;
        }

        int leftover = groups.remove(groups.size() - 1).get(0);
        int bestGroup = 0;
        double bestAverage = -1.0;
        for (int i = 0; i < groups.size(); i++) {
            double average = matrix.average(leftover, groups.get(i));
            if (average > bestAverage) {
                bestAverage = average;
                bestGroup = i;
            }
        }
        groups.get(bestGroup).add(leftover);
        logger.debug("Merged leftover student at position {} into group {}", leftover, bestGroup + 1);
    }
}
