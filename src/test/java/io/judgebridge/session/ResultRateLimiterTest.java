package io.judgebridge.session;

import io.judgebridge.model.ResultEvent;
import io.judgebridge.model.ResultEventType;
import io.judgebridge.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

final class ResultRateLimiterTest {

    @Test
    void burstIsCappedAndOnlyLatestUpdateSurvives() {
        AtomicLong now = new AtomicLong(1_000L);
        ResultRateLimiter limiter = new ResultRateLimiter(5, 500L, now::get);
        List<ResultEvent> forwarded = new ArrayList<>();
        int flushRequests = 0;
        for (int i = 1; i <= 12; i++) {
            ResultRateLimiter.Admission admission = limiter.offer(testCase("s1", i));
            if (admission.forwarded()) {
                forwarded.add(admission.forward());
            }
            if (admission.scheduleFlush()) {
                flushRequests++;
                Assertions.assertTrue(admission.retryAfterMs() > 0L);
            }
        }
        Assertions.assertEquals(5, forwarded.size());
        Assertions.assertEquals(1, flushRequests);
        Assertions.assertTrue(limiter.hasPending("s1"));

        Optional<ResultEvent> drained = limiter.drain("s1");
        Assertions.assertTrue(drained.isPresent());
        Assertions.assertEquals(12, drained.get().payload().path("position").asInt());
        Assertions.assertEquals(0, limiter.tracked());
        Assertions.assertTrue(limiter.drain("s1").isEmpty());
    }

    @Test
    void heldUpdateIsReleasedOnlyAfterWindowCloses() {
        AtomicLong now = new AtomicLong(0L);
        ResultRateLimiter limiter = new ResultRateLimiter(2, 500L, now::get);
        limiter.offer(testCase("s1", 1));
        limiter.offer(testCase("s1", 2));
        Assertions.assertFalse(limiter.offer(testCase("s1", 3)).forwarded());

        now.set(400L);
        Assertions.assertTrue(limiter.flushDue("s1").isEmpty());

        now.set(501L);
        Optional<ResultEvent> due = limiter.flushDue("s1");
        Assertions.assertEquals(3, due.orElseThrow().payload().path("position").asInt());
        Assertions.assertFalse(limiter.hasPending("s1"));

        // The flushed update counts against the new window.
        Assertions.assertTrue(limiter.offer(testCase("s1", 4)).forwarded());
        Assertions.assertFalse(limiter.offer(testCase("s1", 5)).forwarded());
    }

    @Test
    void newWindowForwardsAgainAndDropsStalePending() {
        AtomicLong now = new AtomicLong(0L);
        ResultRateLimiter limiter = new ResultRateLimiter(1, 500L, now::get);
        Assertions.assertTrue(limiter.offer(testCase("s1", 1)).forwarded());
        Assertions.assertFalse(limiter.offer(testCase("s1", 2)).forwarded());
        now.set(600L);
        ResultRateLimiter.Admission admission = limiter.offer(testCase("s1", 3));
        Assertions.assertTrue(admission.forwarded());
        Assertions.assertFalse(limiter.hasPending("s1"));
    }

    @Test
    void submissionsAreLimitedIndependently() {
        AtomicLong now = new AtomicLong(0L);
        ResultRateLimiter limiter = new ResultRateLimiter(1, 500L, now::get);
        Assertions.assertTrue(limiter.offer(testCase("a", 1)).forwarded());
        Assertions.assertTrue(limiter.offer(testCase("b", 1)).forwarded());
        Assertions.assertFalse(limiter.offer(testCase("a", 2)).forwarded());
        Assertions.assertEquals(2, limiter.tracked());
        limiter.clear();
        Assertions.assertEquals(0, limiter.tracked());
    }

    private static ResultEvent testCase(String submission, int position) {
        return new ResultEvent(
                ResultEventType.TEST_CASE,
                submission,
                Jsons.object().put("position", position),
                0L
        );
    }
}
