// SPDX-License-Identifier: Apache-2.0
package org.hiero.harness.convergence;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Lock;
import org.hiero.harness.time.FakeTime;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

/**
 * Unit tests for {@link ConvergencePoller}.
 */
class ConvergencePollerTest {

    private static final Duration INTERVAL = Duration.ofMillis(50);
    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(60);

    private FakeTime time;
    private ConvergencePoller poller;

    @BeforeEach
    void setUp() {
        time = new FakeTime();
        poller = new ConvergencePoller(time, INTERVAL, DEFAULT_TIMEOUT);
    }

    @Test
    void satisfiedPredicateConvergesOnFirstAttempt() {
        final PollResult result = poller.poll(() -> true, PollBounds.unbounded());

        assertThat(result.outcome()).isEqualTo(PollOutcome.CONVERGED);
        assertThat(result.attempts()).isEqualTo(1);
        assertThat(time.sleeps()).isZero();
    }

    @Test
    void predicateIsRetriedUntilSatisfied() {
        final AtomicInteger evaluations = new AtomicInteger();

        poller.waitUntil(() -> evaluations.incrementAndGet() == 4, PollBounds.timeout(Duration.ofSeconds(1)));

        assertThat(evaluations).hasValue(4);
        assertThat(time.elapsed()).isEqualTo(INTERVAL.multipliedBy(3));
    }

    @Test
    void attemptBoundStopsAfterExactlyThatManyEvaluations() {
        final AtomicInteger evaluations = new AtomicInteger();

        assertThatThrownBy(() -> poller.waitUntil(
                        () -> {
                            evaluations.incrementAndGet();
                            return false;
                        },
                        PollBounds.attempts(3)))
                .isInstanceOfSatisfying(ConvergenceTimeoutException.class, e -> {
                    assertThat(e.bound()).isEqualTo(ExhaustedBound.ATTEMPTS);
                    assertThat(e.attempts()).isEqualTo(3);
                });
        assertThat(evaluations).hasValue(3);
    }

    @Test
    void timeoutBoundIsReportedAsTimeout() {
        final PollResult result = poller.poll(() -> false, PollBounds.timeout(Duration.ofMillis(500)));

        assertThat(result.outcome()).isEqualTo(PollOutcome.TIMED_OUT);
        assertThat(result.bound()).isEqualTo(ExhaustedBound.TIMEOUT);
        assertThat(result.attempts()).isEqualTo(10);
        assertThat(result.elapsed()).isEqualTo(Duration.ofMillis(500));
    }

    @Test
    void attemptBoundIsCheckedBeforeTimeoutWhenBothRunOut() {
        final PollResult result = poller.poll(() -> false, PollBounds.of(10, Duration.ofMillis(500)));

        assertThat(result.bound()).isEqualTo(ExhaustedBound.ATTEMPTS);
    }

    @Test
    void unboundedPollFallsBackToDefaultTimeout() {
        final PollResult result = poller.poll(() -> false, PollBounds.unbounded());

        assertThat(result.bound()).isEqualTo(ExhaustedBound.TIMEOUT);
        assertThat(result.elapsed()).isEqualTo(DEFAULT_TIMEOUT);
    }

    @Test
    void exceptionFromPredicateIsNotRetried() {
        final AtomicInteger evaluations = new AtomicInteger();
        final IllegalStateException failure = new IllegalStateException("node down");

        final PollResult result = poller.poll(
                () -> {
                    evaluations.incrementAndGet();
                    throw failure;
                },
                PollBounds.attempts(5));

        assertThat(result.outcome()).isEqualTo(PollOutcome.HARD_FAILED);
        assertThat(result.failure()).isSameAs(failure);
        assertThat(evaluations).hasValue(1);
        assertThatThrownBy(() -> result.orThrow("anything")).isSameAs(failure);
    }

    @Test
    void lockIsHeldDuringEachEvaluation() {
        final Lock lock = mock(Lock.class);
        final AtomicInteger evaluations = new AtomicInteger();

        poller.waitUntil(() -> evaluations.incrementAndGet() == 2, PollBounds.attempts(5), lock);

        final InOrder order = inOrder(lock);
        order.verify(lock).lock();
        order.verify(lock).unlock();
        order.verify(lock).lock();
        order.verify(lock).unlock();
        order.verifyNoMoreInteractions();
    }

    @Test
    void timeoutMessageNamesDescriptionAndObservedState() {
        final PollResult result = poller.poll(() -> false, PollBounds.attempts(2));

        assertThatThrownBy(() -> result.orThrow("Heights equal", () -> "[node0=5, node1=6]"))
                .isInstanceOf(ConvergenceTimeoutException.class)
                .hasMessageContaining("Heights equal")
                .hasMessageContaining("ATTEMPTS")
                .hasMessageContaining("[node0=5, node1=6]");
    }

    @Test
    void invalidBoundsAreRejected() {
        assertThatThrownBy(() -> PollBounds.attempts(0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> PollBounds.timeout(Duration.ZERO)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ConvergencePoller(time, Duration.ofMillis(-1), DEFAULT_TIMEOUT))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
