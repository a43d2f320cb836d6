package com.phillippitts.autorecovery.domain;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Immutable, reusable recovery procedure tagged with a {@link RecoveryStrategy}.
 *
 * <p>A plan targets either one service by name or every service ({@link #WILDCARD}).
 * Plans are validated once when registered with the catalog and never change afterwards.
 */
public final class RecoveryPlan {

    /** Target name of plans that apply to any service. */
    public static final String WILDCARD = "*";

    private final String id;
    private final String serviceName;
    private final RecoveryStrategy strategy;
    private final int priority;
    private final Duration estimatedDuration;
    private final UserImpact userImpact;
    private final List<RecoveryStep> steps;
    private final List<RecoveryStep> rollbackSteps;
    private final Duration timeout;
    private final RetryPolicy retryPolicy;

    private RecoveryPlan(Builder b) {
        this.id = b.id;
        this.serviceName = b.serviceName;
        this.strategy = b.strategy;
        this.priority = b.priority;
        this.estimatedDuration = b.estimatedDuration;
        this.userImpact = b.userImpact;
        this.steps = List.copyOf(b.steps);
        this.rollbackSteps = List.copyOf(b.rollbackSteps);
        this.timeout = b.timeout;
        this.retryPolicy = b.retryPolicy;
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public String id() {
        return id;
    }

    public String serviceName() {
        return serviceName;
    }

    public boolean isWildcard() {
        return WILDCARD.equals(serviceName);
    }

    public RecoveryStrategy strategy() {
        return strategy;
    }

    public int priority() {
        return priority;
    }

    public Duration estimatedDuration() {
        return estimatedDuration;
    }

    public UserImpact userImpact() {
        return userImpact;
    }

    public List<RecoveryStep> steps() {
        return steps;
    }

    public List<RecoveryStep> rollbackSteps() {
        return rollbackSteps;
    }

    public Duration timeout() {
        return timeout;
    }

    public RetryPolicy retryPolicy() {
        return retryPolicy;
    }

    @Override
    public String toString() {
        return "RecoveryPlan[id=" + id + ", service=" + serviceName + ", strategy=" + strategy
                + ", steps=" + steps.size() + "]";
    }

    public static final class Builder {
        private final String id;
        private String serviceName = WILDCARD;
        private RecoveryStrategy strategy;
        private int priority = 100;
        private Duration estimatedDuration = Duration.ofSeconds(30);
        private UserImpact userImpact = UserImpact.NONE;
        private final List<RecoveryStep> steps = new ArrayList<>();
        private final List<RecoveryStep> rollbackSteps = new ArrayList<>();
        private Duration timeout = Duration.ofMinutes(5);
        private RetryPolicy retryPolicy = RetryPolicy.none();

        private Builder(String id) {
            this.id = id;
        }

        public Builder serviceName(String serviceName) {
            this.serviceName = serviceName;
            return this;
        }

        public Builder strategy(RecoveryStrategy strategy) {
            this.strategy = strategy;
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder estimatedDuration(Duration estimatedDuration) {
            this.estimatedDuration = Objects.requireNonNull(estimatedDuration, "estimatedDuration");
            return this;
        }

        public Builder userImpact(UserImpact userImpact) {
            this.userImpact = Objects.requireNonNull(userImpact, "userImpact");
            return this;
        }

        public Builder step(RecoveryStep step) {
            this.steps.add(Objects.requireNonNull(step, "step"));
            return this;
        }

        public Builder rollbackStep(RecoveryStep step) {
            this.rollbackSteps.add(Objects.requireNonNull(step, "step"));
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
            return this;
        }

        public RecoveryPlan build() {
            return new RecoveryPlan(this);
        }
    }
}
