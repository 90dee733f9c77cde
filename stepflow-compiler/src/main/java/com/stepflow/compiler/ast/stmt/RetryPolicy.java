package com.stepflow.compiler.ast.stmt;

import com.stepflow.compiler.ast.expr.Expression;

/**
 * Try 步骤的重试策略：预定义策略（限定名）或自定义策略。
 */
public abstract class RetryPolicy {

    private RetryPolicy() {
    }

    /** 预定义策略，如 http.default_retry */
    public static final class Named extends RetryPolicy {
        private final Expression policy;

        public Named(Expression policy) {
            this.policy = policy;
        }

        public Expression getPolicy() {
            return policy;
        }
    }

    /** 自定义策略：predicate + max_retries + backoff */
    public static final class Custom extends RetryPolicy {
        private final Expression predicate;
        private final Expression maxRetries;   // 可选
        private final Expression initialDelay; // 可选
        private final Expression maxDelay;     // 可选
        private final Expression multiplier;   // 可选

        public Custom(Expression predicate, Expression maxRetries,
                      Expression initialDelay, Expression maxDelay, Expression multiplier) {
            this.predicate = predicate;
            this.maxRetries = maxRetries;
            this.initialDelay = initialDelay;
            this.maxDelay = maxDelay;
            this.multiplier = multiplier;
        }

        public Expression getPredicate() {
            return predicate;
        }

        public Expression getMaxRetries() {
            return maxRetries;
        }

        public Expression getInitialDelay() {
            return initialDelay;
        }

        public Expression getMaxDelay() {
            return maxDelay;
        }

        public Expression getMultiplier() {
            return multiplier;
        }
    }
}
