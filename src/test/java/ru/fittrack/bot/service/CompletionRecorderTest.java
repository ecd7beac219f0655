package ru.fittrack.bot.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import ru.fittrack.bot.exception.NoActiveChallengeException;
import ru.fittrack.bot.model.Completion;
import ru.fittrack.bot.support.TestDb;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CompletionRecorderTest {

    @TempDir
    Path dir;

    private TestDb t;
    private CompletionRecorder recorder;

    @BeforeEach
    void setUp() throws Exception {
        t = TestDb.create(dir);
        recorder = t.facade.completions();
        t.facade.users().registerUser(1L, "u1", "User One");
        t.facade.users().registerUser(2L, "u2", "User Two");
    }

    @Test
    void recordCompletion_withoutChallenge_shouldFail() throws Exception {
        assertThatThrownBy(() -> recorder.recordCompletion(2L))
                .isInstanceOf(NoActiveChallengeException.class)
                .satisfies(e -> assertThat(((NoActiveChallengeException) e).getUserId()).isEqualTo(2L));

        assertThat(t.count("SELECT COUNT(*) FROM completions")).isZero();
    }

    @Test
    void recordCompletion_twiceWithinAMinute_shouldKeepBothRows() {
        t.facade.challenges().setChallenge(1L, "10 pushups", "daily");

        long first = recorder.recordCompletion(1L);
        t.clock.advance(Duration.ofSeconds(20));
        long second = recorder.recordCompletion(1L);

        assertThat(second).isNotEqualTo(first);
        List<Completion> rows = recorder.listCompletions(1L);
        assertThat(rows).hasSize(2);
        assertThat(rows.get(0).completedAt).isNotEqualTo(rows.get(1).completedAt);
        assertThat(rows.get(1).completedAt).isEqualTo(rows.get(0).completedAt.plusSeconds(20));
    }

    @Test
    void recordCompletion_shouldAttachToChallengeActiveAtRecordTime() {
        long pushups = t.facade.challenges().setChallenge(1L, "10 pushups", "daily");
        recorder.recordCompletion(1L);
        long squats = t.facade.challenges().setChallenge(1L, "20 squats", "weekly");
        recorder.recordCompletion(1L);

        assertThat(recorder.listCompletions(1L))
                .extracting(c -> c.challengeId)
                .containsExactly(pushups, squats);
    }

    @Test
    void completions_shouldOnlyGrow() {
        t.facade.challenges().setChallenge(1L, "plank", "daily");
        int last = recorder.countCompletions(1L);
        for (int i = 0; i < 5; i++) {
            recorder.recordCompletion(1L);
            // replacing the challenge must not touch recorded completions
            if (i == 2) t.facade.challenges().setChallenge(1L, "longer plank", "weekly");
            int now = recorder.countCompletions(1L);
            assertThat(now).isEqualTo(last + 1);
            last = now;
        }
        assertThat(recorder.countCompletions(2L)).isZero();
    }
}
