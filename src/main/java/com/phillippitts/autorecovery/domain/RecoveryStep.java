package com.phillippitts.autorecovery.domain;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * One ordered step of a {@link RecoveryPlan}.
 *
 * <p>An attempt succeeds when the action returns {@code true} and, if present, the
 * verification also returns {@code true}. The step is tried {@code retryCount + 1} times
 * before the whole plan fails; the rollback, if present, runs once after the last failed attempt.
 */
public final class RecoveryStep {

    private final String name;
    private final StepAction action;
    private final Duration timeout;
    private final Integer retryCount;
    private final StepAction verify;
    private final StepAction rollback;
    private final String description;

    private RecoveryStep(Builder b) {
        this.name = b.name;
        this.action = b.action;
        this.timeout = b.timeout;
        this.retryCount = b.retryCount;
        this.verify = b.verify;
        this.rollback = b.rollback;
        this.description = b.description == null ? b.name : b.description;
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String name() {
        return name;
    }

    public StepAction action() {
        return action;
    }

    public Duration timeout() {
        return timeout;
    }

    /** Retry count declared on the step; empty means "use the plan's retry policy". */
    public Optional<Integer> retryCount() {
        return Optional.ofNullable(retryCount);
    }

    /** Effective number of attempts under the given plan policy. */
    public int attempts(RetryPolicy policy) {
        int retries = retryCount != null ? retryCount : policy.maxRetries();
        return retries + 1;
    }

    public Optional<StepAction> verify() {
        return Optional.ofNullable(verify);
    }

    public Optional<StepAction> rollback() {
        return Optional.ofNullable(rollback);
    }

    public String description() {
        return description;
    }

    @Override
    public String toString() {
        return "RecoveryStep[" + name + "]";
    }

    public static final class Builder {
        private final String name;
        private StepAction action = StepAction.noop();
        private Duration timeout = Duration.ofSeconds(10);
        private Integer retryCount;
        private StepAction verify;
        private StepAction rollback;
        private String description;

        private Builder(String name) {
            this.name = name;
        }

        public Builder action(StepAction action) {
            this.action = Objects.requireNonNull(action, "action");
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = Objects.requireNonNull(timeout, "timeout");
            return this;
        }

        public Builder retryCount(int retryCount) {
            if (retryCount < 0) {
                throw new IllegalArgumentException("retryCount must be >= 0");
            }
            this.retryCount = retryCount;
            return this;
        }

        public Builder verify(StepAction verify) {
            this.verify = verify;
            return this;
        }

        public Builder rollback(StepAction rollback) {
            this.rollback = rollback;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public RecoveryStep build() {
            return new RecoveryStep(this);
        }
    }
}
