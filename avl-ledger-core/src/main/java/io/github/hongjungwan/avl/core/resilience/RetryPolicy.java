package io.github.hongjungwan.avl.core.resilience;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.function.BiConsumer;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * 고정 간격, 최대 횟수 제한 재시도. 재시도 대상이 아닌 예외는 그대로 전파.
 */
@Slf4j
public final class RetryPolicy {

    private final String name;
    private final int maxAttempts;
    private final long delayMs;
    private final Predicate<RuntimeException> retryPredicate;
    private final BiConsumer<Integer, RuntimeException> retryListener;

    private RetryPolicy(Builder builder) {
        this.name = builder.name;
        this.maxAttempts = builder.maxAttempts;
        this.delayMs = builder.delayMs;
        this.retryPredicate = builder.retryPredicate;
        this.retryListener = builder.retryListener;
    }

    /**
     * 재시도 정책에 따라 작업 실행.
     *
     * @throws RetryExhaustedException 재시도 대상 예외가 maxAttempts번 연속 발생
     */
    public <T> T execute(Supplier<T> operation) {
        RuntimeException lastException = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return operation.get();
            } catch (RuntimeException e) {
                if (!retryPredicate.test(e)) {
                    throw e;
                }
                lastException = e;
                if (attempt < maxAttempts) {
                    log.debug("[{}] retry {}/{} after {}ms: {}", name, attempt, maxAttempts, delayMs, e.getMessage());
                    retryListener.accept(attempt, e);
                    sleep(delayMs);
                }
            }
        }

        throw new RetryExhaustedException(name, maxAttempts, lastException);
    }

    public void execute(Runnable operation) {
        execute(() -> {
            operation.run();
            return null;
        });
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    private void sleep(long ms) {
        if (ms <= 0) {
            return;
        }
        try {
            Thread.sleep(ms);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting to retry " + name, e);
        }
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public static class Builder {
        private final String name;
        private int maxAttempts = 3;
        private long delayMs = 50;
        private Predicate<RuntimeException> retryPredicate = e -> true;
        private BiConsumer<Integer, RuntimeException> retryListener = (attempt, e) -> {};

        public Builder(String name) {
            this.name = name;
        }

        /**
         * 최대 시도 횟수 (기본: 3, 최초 시도 포함)
         */
        public Builder maxAttempts(int maxAttempts) {
            if (maxAttempts < 1) {
                throw new IllegalArgumentException("maxAttempts must be >= 1, got: " + maxAttempts);
            }
            this.maxAttempts = maxAttempts;
            return this;
        }

        /**
         * 고정 딜레이 (기본: 50ms)
         */
        public Builder fixedDelay(Duration delay) {
            this.delayMs = delay.toMillis();
            return this;
        }

        /**
         * 재시도할 예외 타입
         */
        @SafeVarargs
        public final Builder retryOnExceptions(Class<? extends RuntimeException>... exceptions) {
            this.retryPredicate = e -> {
                for (Class<? extends RuntimeException> type : exceptions) {
                    if (type.isInstance(e)) {
                        return true;
                    }
                }
                return false;
            };
            return this;
        }

        /**
         * 재시도 직전 콜백 (예: 캐시된 tail 무효화)
         */
        public Builder onRetry(BiConsumer<Integer, RuntimeException> listener) {
            this.retryListener = listener;
            return this;
        }

        public RetryPolicy build() {
            return new RetryPolicy(this);
        }
    }

    /**
     * 재시도 소진 시 발생하는 예외. cause는 마지막 실패.
     */
    public static class RetryExhaustedException extends RuntimeException {
        private final int attempts;

        public RetryExhaustedException(String name, int attempts, Throwable cause) {
            super(String.format("[%s] exhausted %d attempts", name, attempts), cause);
            this.attempts = attempts;
        }

        public int getAttempts() {
            return attempts;
        }
    }
}
