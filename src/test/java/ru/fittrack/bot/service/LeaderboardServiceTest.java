package ru.fittrack.bot.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import ru.fittrack.bot.exception.ValidationException;
import ru.fittrack.bot.model.LeaderboardEntry;
import ru.fittrack.bot.support.TestDb;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LeaderboardServiceTest {

    private static final long A = 100L;
    private static final long B = 200L;
    private static final long C = 300L;

    @TempDir
    Path dir;

    private TestDb t;
    private LeaderboardService leaderboard;

    @BeforeEach
    void setUp() throws Exception {
        t = TestDb.create(dir);
        leaderboard = t.facade.leaderboard();
    }

    @Test
    void monthlyLeaderboard_shouldBeEmpty_whenNoUsers() {
        assertThat(leaderboard.monthlyLeaderboard()).isEmpty();
    }

    @Test
    void monthlyLeaderboard_shouldCountOnlyInWindow_andIncludeUsersWithoutCompletions() {
        UserService users = t.facade.users();
        users.registerUser(A, "alice", "Alice");
        t.clock.advance(Duration.ofSeconds(1));
        users.registerUser(B, "bob", "Bob");
        t.clock.advance(Duration.ofSeconds(1));
        users.registerUser(C, "carol", "Carol");

        t.facade.challenges().setChallenge(A, "10 pushups", "daily");
        // two check-ins 40 days ago, outside a 30 day window
        t.clock.advance(Duration.ofDays(-40));
        t.facade.completions().recordCompletion(A);
        t.facade.completions().recordCompletion(A);
        t.clock.advance(Duration.ofDays(40));
        // B has a challenge but never checked in; C never set one
        t.facade.challenges().setChallenge(B, "20 squats", "weekly");
        for (int i = 0; i < 3; i++) {
            t.clock.advance(Duration.ofMinutes(1));
            t.facade.completions().recordCompletion(A);
        }

        List<LeaderboardEntry> board = leaderboard.monthlyLeaderboard(30);

        assertThat(board).extracting(LeaderboardEntry::userId).containsExactly(A, B, C);
        assertThat(board).extracting(LeaderboardEntry::count).containsExactly(3, 0, 0);
        assertThat(board).extracting(LeaderboardEntry::rank).containsExactly(1, 2, 3);
        assertThat(board.get(0).name()).isEqualTo("Alice");
        assertThat(board.get(0).handle()).isEqualTo("alice");

        // a wide window sees the old check-ins too
        assertThat(leaderboard.monthlyLeaderboard(60).get(0).count()).isEqualTo(5);
    }

    @Test
    void monthlyLeaderboard_shouldRankByCountThenRegistrationOrder() {
        UserService users = t.facade.users();
        users.registerUser(C, "carol", "Carol");
        t.clock.advance(Duration.ofSeconds(1));
        users.registerUser(A, "alice", "Alice");
        t.clock.advance(Duration.ofSeconds(1));
        users.registerUser(B, "bob", "Bob");

        t.facade.challenges().setChallenge(B, "run", "daily");
        t.facade.completions().recordCompletion(B);

        // re-registering must not move C to the back of the tie
        users.registerUser(C, "carol2", "Carol Renamed");

        List<LeaderboardEntry> board = leaderboard.monthlyLeaderboard();

        assertThat(board).extracting(LeaderboardEntry::userId).containsExactly(B, C, A);
        assertThat(board.get(1).name()).isEqualTo("Carol Renamed");
        assertThat(leaderboard.monthlyLeaderboard()).isEqualTo(board);
    }

    @Test
    void monthlyLeaderboard_shouldFallBackToHandleThenUnknown() {
        t.facade.users().registerUser(A, "alice", null);
        t.clock.advance(Duration.ofSeconds(1));
        t.facade.users().registerUser(B, null, null);

        List<LeaderboardEntry> board = leaderboard.monthlyLeaderboard();

        assertThat(board).extracting(LeaderboardEntry::name).containsExactly("alice", "Unknown");
    }

    @Test
    void monthlyLeaderboard_shouldRejectNonPositiveWindow() {
        assertThatThrownBy(() -> leaderboard.monthlyLeaderboard(0)).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> leaderboard.monthlyLeaderboard(-5)).isInstanceOf(ValidationException.class);
    }

    @Test
    void monthlyLeaderboard_shouldUseConfiguredWindow() throws Exception {
        TestDb weekly = TestDb.create(dir.resolve("weekly"), java.util.Map.of("LEADERBOARD_WINDOW_DAYS", "7"));
        weekly.facade.users().registerUser(A, "alice", "Alice");
        weekly.facade.challenges().setChallenge(A, "run", "daily");
        weekly.clock.advance(Duration.ofDays(-10));
        weekly.facade.completions().recordCompletion(A);
        weekly.clock.advance(Duration.ofDays(10));
        weekly.facade.completions().recordCompletion(A);

        assertThat(weekly.facade.leaderboard().defaultWindowDays()).isEqualTo(7);
        assertThat(weekly.facade.leaderboard().monthlyLeaderboard().get(0).count()).isEqualTo(1);
    }
}
