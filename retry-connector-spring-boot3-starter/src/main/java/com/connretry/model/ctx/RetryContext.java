package com.connretry.model.ctx;

import com.connretry.model.enums.ConnectionMode;
import com.connretry.model.enums.FailureKind;
import com.connretry.model.enums.LoopState;
import lombok.AccessLevel;
import lombok.Getter;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * 单次 run/txn 外层调用的重试上下文
 * <p>
 * 每次外层调用新建, 只由 RetryLoopExecutor 修改; 判定器通过它读取尝试次数与失败记录。
 * 非线程安全。
 */
@Getter
public class RetryContext {

    /** 最大尝试次数 */
    private final int maxAttempts;

    /** 本次调用生效的模式 */
    private final ConnectionMode mode;

    /** 是否事务性单元 */
    private final boolean transactional;

    /** 外层调用开始时间 */
    private final Instant startTime;

    private final Clock clock;

    /** 已失败的尝试次数 */
    private int attemptCount;

    private LoopState state = LoopState.RUNNING;

    /** 最近一次失败的类型 */
    private FailureKind lastFailureKind;

    @Getter(AccessLevel.NONE)
    private final ExceptionStack exceptionStack = new ExceptionStack();

    public RetryContext(int maxAttempts, ConnectionMode mode, boolean transactional, Clock clock) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got " + maxAttempts);
        }
        this.maxAttempts = maxAttempts;
        this.mode = mode;
        this.transactional = transactional;
        this.clock = clock;
        this.startTime = clock.instant();
    }

    /**
     * 记录一次失败: 先入栈再计数, 保证 size == attemptCount
     */
    public void recordFailure(Throwable error, FailureKind kind) {
        exceptionStack.push(error);
        attemptCount++;
        lastFailureKind = kind;
    }

    public void transition(LoopState next) {
        this.state = next;
    }

    /** 已到达 SUCCESS 或 FATAL */
    public boolean isFinished() {
        return state.isTerminal();
    }

    public boolean isCeilingReached() {
        return attemptCount >= maxAttempts;
    }

    public Throwable getLastException() {
        return exceptionStack.last();
    }

    /** 失败记录快照 */
    public List<Throwable> getExceptions() {
        return exceptionStack.snapshot();
    }

    public Duration getElapsed() {
        return Duration.between(startTime, clock.instant());
    }

    @Override
    public String toString() {
        return String.format("RetryContext[attempt=%d/%d, mode=%s, txn=%s, state=%s, lastError=%s]",
                attemptCount, maxAttempts, mode, transactional, state, exceptionStack.last());
    }
}
