package com.signlingo.leaderboard.service;

import com.signlingo.leaderboard.model.RankedEntry;
import com.signlingo.leaderboard.model.ScoreRecord;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Dense-rank arithmetic: every distinct score value takes exactly one position,
 * so ties share a position and the next lower score follows without a gap.
 */
final class DenseRanking {

    private DenseRanking() {
    }

    static long positionAfter(long distinctHigherCount) {
        return distinctHigherCount + 1;
    }

    static long topScore(List<ScoreRecord> page) {
        return page.stream()
            .mapToLong(ScoreRecord::getScore)
            .max()
            .orElseThrow(() -> new IllegalArgumentException("Cannot rank an empty page"));
    }

    /**
     * Ranks a page whose best score has {@code distinctHigherCount} distinct scores
     * above it in the whole table. Page order is preserved.
     */
    static List<RankedEntry> rankPage(List<ScoreRecord> page, long distinctHigherCount) {
        long baseRank = positionAfter(distinctHigherCount);

        List<Long> distinctScoresDesc = page.stream()
            .map(ScoreRecord::getScore)
            .distinct()
            .sorted(Comparator.reverseOrder())
            .toList();
        Map<Long, Integer> offsetByScore = new HashMap<>();
        for (int i = 0; i < distinctScoresDesc.size(); i++) {
            offsetByScore.put(distinctScoresDesc.get(i), i);
        }

        List<RankedEntry> ranked = new ArrayList<>(page.size());
        for (ScoreRecord record : page) {
            ranked.add(RankedEntry.of(record, baseRank + offsetByScore.get(record.getScore())));
        }
        return ranked;
    }
}
