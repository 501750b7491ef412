package com.connretry.core.spi;

import com.connretry.model.ctx.RetryContext;

/**
 * 重试判定器
 * 每次失败（未达上限时）调用一次, 返回 false 则原异常抛出; 判定器自身抛出的异常会替代原异常
 */
@FunctionalInterface
public interface RetryPredicate {

    boolean shouldRetry(RetryContext ctx);
}
