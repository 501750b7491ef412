package com.connretry.core.metric;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.List;

/**
 * 重试指标使用的注册表
 * 应用已有注册表时全部挂入组合注册表, 没有时退回 SimpleMeterRegistry; 统一打上 component 标签
 */
public class RetryMeterRegistryProvider {

    public static final String COMPONENT_TAG = "component";

    public static final String COMPONENT = "retry-connector";

    private final CompositeMeterRegistry composite = new CompositeMeterRegistry();

    public RetryMeterRegistryProvider(List<MeterRegistry> discovered) {
        if (discovered != null) {
            // 组合注册表展开, 避免重复计数
            discovered.forEach(this::attach);
        }
        if (composite.getRegistries().isEmpty()) {
            composite.add(new SimpleMeterRegistry());
        }
        composite.config().commonTags(COMPONENT_TAG, COMPONENT);
    }

    private void attach(MeterRegistry registry) {
        if (registry instanceof CompositeMeterRegistry c) {
            c.getRegistries().forEach(this::attach);
        } else {
            composite.add(registry);
        }
    }

    public MeterRegistry getRegistry() { return composite; }
}
