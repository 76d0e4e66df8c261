package com.signlingo.leaderboard.service;

import com.signlingo.leaderboard.exception.InvalidRequestException;
import com.signlingo.leaderboard.model.RankedEntry;
import com.signlingo.leaderboard.model.ScoreRecord;
import com.signlingo.leaderboard.repository.InMemoryScoreStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Ranking laws checked against a randomly generated table with heavy ties,
 * including records that share both score and created_at.
 */
class LeaderboardRankingPropertiesTest {

    private static final Instant EPOCH = Instant.parse("2024-01-01T00:00:00Z");

    private static List<ScoreRecord> randomTable(long seed, int size) {
        Random random = new Random(seed);
        List<ScoreRecord> records = new ArrayList<>();
        for (int i = 0; i < size; i++) {
            records.add(ScoreRecord.builder()
                .id(String.format("user-%04d", random.nextInt(10_000)) + "-" + i)
                .username("player" + i)
                .score((long) random.nextInt(20) * 5)
                .createdAt(EPOCH.plusSeconds(random.nextInt(50)))
                .build());
        }
        return records;
    }

    private static List<RankedEntry> allPages(LeaderboardService service, int pageSize) {
        List<RankedEntry> all = new ArrayList<>();
        for (int page = 1; ; page++) {
            List<RankedEntry> items = service.getLeaderboardPage(page, pageSize);
            assertThat(items.size()).isLessThanOrEqualTo(pageSize);
            if (items.isEmpty()) {
                return all;
            }
            all.addAll(items);
        }
    }

    @ParameterizedTest
    @ValueSource(ints = {1, 3, 7, 10, 64, 100})
    void concatenatedPagesReproduceTotalOrder(int pageSize) {
        InMemoryScoreStore store = new InMemoryScoreStore(randomTable(42L, 237));
        LeaderboardService service = new LeaderboardService(store);

        List<String> paged = allPages(service, pageSize).stream().map(RankedEntry::getId).toList();
        List<String> expected = store.allInRankingOrder().stream().map(ScoreRecord::getId).toList();

        assertThat(paged).containsExactlyElementsOf(expected);
        assertThat(paged).doesNotHaveDuplicates();
    }

    @ParameterizedTest
    @ValueSource(ints = {1, 4, 9, 25, 100})
    void positionsAreDenseAndConsistentAcrossPages(int pageSize) {
        InMemoryScoreStore store = new InMemoryScoreStore(randomTable(7L, 180));
        LeaderboardService service = new LeaderboardService(store);

        List<RankedEntry> entries = allPages(service, pageSize);

        Map<Long, Long> positionByScore = new HashMap<>();
        for (RankedEntry entry : entries) {
            Long previous = positionByScore.putIfAbsent(entry.getScore(), entry.getPosition());
            if (previous != null) {
                assertThat(entry.getPosition()).as("tied score %d", entry.getScore()).isEqualTo(previous);
            }
        }

        for (int i = 1; i < entries.size(); i++) {
            RankedEntry higher = entries.get(i - 1);
            RankedEntry lower = entries.get(i);
            if (higher.getScore() > lower.getScore()) {
                // strictly better score, strictly better position, and no gap
                assertThat(lower.getPosition()).isEqualTo(higher.getPosition() + 1);
            } else {
                assertThat(lower.getPosition()).isEqualTo(higher.getPosition());
            }
        }

        assertThat(entries.get(0).getPosition()).isEqualTo(1L);
        assertThat(entries.get(entries.size() - 1).getPosition()).isEqualTo((long) positionByScore.size());
    }

    @Test
    void userRankAgreesWithPagePosition() {
        InMemoryScoreStore store = new InMemoryScoreStore(randomTable(99L, 120));
        LeaderboardService service = new LeaderboardService(store);

        for (RankedEntry entry : allPages(service, 13)) {
            RankedEntry single = service.getUserRank(entry.getId());
            assertThat(single).isEqualTo(entry);
        }
    }

    @Test
    void repeatedCallsAreIdempotent() {
        InMemoryScoreStore store = new InMemoryScoreStore(randomTable(5L, 60));
        LeaderboardService service = new LeaderboardService(store);

        assertThat(service.getLeaderboardPage(2, 10)).isEqualTo(service.getLeaderboardPage(2, 10));
        String someUser = store.allInRankingOrder().get(17).getId();
        assertThat(service.getUserRank(someUser)).isEqualTo(service.getUserRank(someUser));
    }

    @Test
    void eachOperationIssuesTwoStoreQueries() {
        InMemoryScoreStore store = new InMemoryScoreStore(randomTable(11L, 40));
        LeaderboardService service = new LeaderboardService(store);

        service.getLeaderboardPage(2, 10);
        assertThat(store.getQueryCount()).isEqualTo(2);

        service.getUserRank(store.allInRankingOrder().get(0).getId());
        assertThat(store.getQueryCount()).isEqualTo(4);
    }

    @Test
    void fourRowScenario() {
        InMemoryScoreStore store = new InMemoryScoreStore(List.of(
            ScoreRecord.builder().id("1").username("a").score(100L).createdAt(EPOCH).build(),
            ScoreRecord.builder().id("2").username("b").score(100L).createdAt(EPOCH.plusSeconds(1)).build(),
            ScoreRecord.builder().id("3").username("c").score(90L).createdAt(EPOCH.plusSeconds(2)).build(),
            ScoreRecord.builder().id("4").username("d").score(80L).createdAt(EPOCH.plusSeconds(3)).build()));
        LeaderboardService service = new LeaderboardService(store);

        List<RankedEntry> firstPage = service.getLeaderboardPage(1, 10);
        assertThat(firstPage).extracting(RankedEntry::getId).containsExactly("1", "2", "3", "4");
        assertThat(firstPage).extracting(RankedEntry::getPosition).containsExactly(1L, 1L, 2L, 3L);

        assertThat(service.getUserRank("3").getPosition()).isEqualTo(2L);

        List<RankedEntry> secondPage = service.getLeaderboardPage(2, 2);
        assertThat(secondPage).extracting(RankedEntry::getId).containsExactly("3", "4");
        assertThat(secondPage).extracting(RankedEntry::getPosition).containsExactly(2L, 3L);

        assertThat(service.getLeaderboardPage(5, 10)).isEmpty();

        int queriesBefore = store.getQueryCount();
        assertThatThrownBy(() -> service.getLeaderboardPage(0, 10)).isInstanceOf(InvalidRequestException.class);
        assertThat(store.getQueryCount()).isEqualTo(queriesBefore);
    }

    @Test
    void emptyTableYieldsEmptyFirstPage() {
        LeaderboardService service = new LeaderboardService(new InMemoryScoreStore(List.of()));

        assertThat(service.getLeaderboardPage(1, 10)).isEmpty();
    }
}
