package io.github.hongjungwan.avl.core.resilience;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * 연속 실패 기반 Circuit Breaker. failurePredicate에 해당하는 실패만 카운트한다.
 *
 * <p>N번 연속 실패하면 OPEN이 되어 openDuration 동안 fast-fail.
 * Durable backend에서는 OPEN 전환이 곧 "지속적 연결 손실" 신호다.</p>
 */
@Slf4j
public final class CircuitBreaker {

    private final String name;
    private final int failureThreshold;
    private final long openDurationMs;
    private final Predicate<RuntimeException> failurePredicate;
    private final LongSupplier clock;
    private final StateChangeListener stateChangeListener;
    private final ReentrantLock lock = new ReentrantLock();

    private int consecutiveFailures = 0;
    private long openedAt = 0;

    /** CLOSED: 정상, OPEN: 차단 */
    public enum State {
        CLOSED,
        OPEN
    }

    private CircuitBreaker(Builder builder) {
        this.name = builder.name;
        this.failureThreshold = builder.failureThreshold;
        this.openDurationMs = builder.openDurationMs;
        this.failurePredicate = builder.failurePredicate;
        this.clock = builder.clock;
        this.stateChangeListener = builder.stateChangeListener;
    }

    /**
     * Circuit Breaker로 보호되는 작업 실행
     */
    public <T> T execute(Supplier<T> operation) {
        if (getState() == State.OPEN) {
            throw new CircuitBreakerOpenException(name);
        }
        try {
            T result = operation.get();
            onSuccess();
            return result;
        } catch (RuntimeException e) {
            if (failurePredicate.test(e)) {
                onFailure();
            }
            throw e;
        }
    }

    public void onSuccess() {
        lock.lock();
        try {
            consecutiveFailures = 0;
        } finally {
            lock.unlock();
        }
    }

    public void onFailure() {
        State transitionedTo = null;
        lock.lock();
        try {
            consecutiveFailures++;
            if (consecutiveFailures == failureThreshold) {
                openedAt = clock.getAsLong();
                transitionedTo = State.OPEN;
            }
        } finally {
            lock.unlock();
        }
        if (transitionedTo != null) {
            log.warn("Circuit breaker '{}' OPEN after {} consecutive failures", name, failureThreshold);
            notifyStateChange(State.CLOSED, State.OPEN);
        }
    }

    public State getState() {
        boolean closedNow = false;
        lock.lock();
        try {
            if (consecutiveFailures < failureThreshold) {
                return State.CLOSED;
            }
            if (clock.getAsLong() - openedAt < openDurationMs) {
                return State.OPEN;
            }
            // open 기간 경과: 다음 호출을 시험적으로 허용
            consecutiveFailures = 0;
            closedNow = true;
            return State.CLOSED;
        } finally {
            lock.unlock();
            if (closedNow) {
                log.info("Circuit breaker '{}' reset to CLOSED", name);
                notifyStateChange(State.OPEN, State.CLOSED);
            }
        }
    }

    public void reset() {
        lock.lock();
        try {
            consecutiveFailures = 0;
            openedAt = 0;
        } finally {
            lock.unlock();
        }
    }

    public String getName() {
        return name;
    }

    public int getFailureCount() {
        lock.lock();
        try {
            return consecutiveFailures;
        } finally {
            lock.unlock();
        }
    }

    private void notifyStateChange(State from, State to) {
        if (stateChangeListener == null) {
            return;
        }
        try {
            stateChangeListener.onStateChange(name, from, to);
        } catch (RuntimeException e) {
            log.warn("State change listener of '{}' threw exception", name, e);
        }
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    /**
     * 상태 변경 리스너
     */
    @FunctionalInterface
    public interface StateChangeListener {
        void onStateChange(String name, State from, State to);
    }

    public static class Builder {
        private final String name;
        private int failureThreshold = 3;
        private long openDurationMs = 30_000;
        private Predicate<RuntimeException> failurePredicate = e -> true;
        private LongSupplier clock = System::currentTimeMillis;
        private StateChangeListener stateChangeListener;

        public Builder(String name) {
            this.name = name;
        }

        /**
         * 실패 임계값 (기본: 3회)
         */
        public Builder failureThreshold(int threshold) {
            if (threshold < 1) {
                throw new IllegalArgumentException("failureThreshold must be >= 1, got: " + threshold);
            }
            this.failureThreshold = threshold;
            return this;
        }

        /**
         * OPEN 유지 시간 (기본: 30초)
         */
        public Builder openDuration(Duration duration) {
            this.openDurationMs = duration.toMillis();
            return this;
        }

        /**
         * 실패로 카운트할 예외 조건 (기본: 모든 예외)
         */
        public Builder countFailuresWhen(Predicate<RuntimeException> predicate) {
            this.failurePredicate = predicate;
            return this;
        }

        /**
         * 테스트용 시계 (epoch millis)
         */
        public Builder clock(LongSupplier clock) {
            this.clock = clock;
            return this;
        }

        public Builder onStateChange(StateChangeListener listener) {
            this.stateChangeListener = listener;
            return this;
        }

        public CircuitBreaker build() {
            return new CircuitBreaker(this);
        }
    }

    /**
     * Circuit 열림 시 발생하는 예외
     */
    public static class CircuitBreakerOpenException extends RuntimeException {
        private final String circuitBreakerName;

        public CircuitBreakerOpenException(String name) {
            super("Circuit breaker '" + name + "' is OPEN");
            this.circuitBreakerName = name;
        }

        public String getCircuitBreakerName() {
            return circuitBreakerName;
        }
    }
}
