package com.connretry.core.spi;

import com.connretry.config.RetryConnectorProperties;

/**
 * 退避策略（计算两次尝试之间的等待时长）
 */
public interface BackoffPolicy {

    /** 策略唯一名称（如 "fixed"、"exponential"、"myPolicy"） */
    String name();

    /**
     * 计算下一次尝试前的等待毫秒数
     * @param attempt    已失败次数（从1开始）
     * @param props      全局配置（读取 base/min/max/jitterRatio 等）
     * @return 等待毫秒数, >= 0
     */
    long delayMillis(int attempt, RetryConnectorProperties props);
}
