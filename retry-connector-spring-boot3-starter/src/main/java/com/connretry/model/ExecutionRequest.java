package com.connretry.model;

import com.connretry.core.spi.ConnectorCallback;
import com.connretry.core.spi.RetryPredicate;
import com.connretry.model.enums.ConnectionMode;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;

/**
 * 一次外层调用的请求, 只在调用期间存在
 */
@Getter
@Builder
public class ExecutionRequest<T> {

    /** 为空则使用实例默认模式 */
    private final ConnectionMode mode;

    /** 是否包裹在事务中 */
    private final boolean transactional;

    @NonNull
    private final ConnectorCallback<T> callback;

    /** 仅本次调用生效的判定器, 为空则使用已配置的判定器 */
    private final RetryPredicate retryPredicate;
}
