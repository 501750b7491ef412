package com.connretry.core.predicate;

import com.connretry.core.spi.RetryPredicate;

import java.time.Duration;
import java.util.Objects;

/**
 * 常用判定器
 */
public final class RetryPredicates {

    private static final RetryPredicate ALWAYS = ctx -> true;

    private static final RetryPredicate NEVER = ctx -> false;

    private RetryPredicates() {
    }

    /** 默认判定器: 总是重试, 仅受最大尝试次数约束 */
    public static RetryPredicate always() {
        return ALWAYS;
    }

    public static RetryPredicate never() {
        return NEVER;
    }

    /**
     * 外层调用开始后超过 budget 即停止重试
     */
    public static RetryPredicate withDeadline(Duration budget) {
        Objects.requireNonNull(budget, "budget");
        return ctx -> ctx.getElapsed().compareTo(budget) < 0;
    }

    /** 依次求值, 任一返回 false 即短路 */
    public static RetryPredicate and(RetryPredicate... predicates) {
        RetryPredicate[] copy = predicates.clone();
        for (RetryPredicate p : copy) {
            Objects.requireNonNull(p, "predicate");
        }
        return ctx -> {
            for (RetryPredicate p : copy) {
                if (!p.shouldRetry(ctx)) {
                    return false;
                }
            }
            return true;
        };
    }
}
