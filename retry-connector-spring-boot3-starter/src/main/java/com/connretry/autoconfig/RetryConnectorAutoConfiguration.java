package com.connretry.autoconfig;

import com.connretry.config.RetryConnectorProperties;
import com.connretry.core.RetryConnector;
import com.connretry.core.RetryConnectorLifecycle;
import com.connretry.core.backoff.BackoffRegistry;
import com.connretry.core.connection.DataSourceConnectionManager;
import com.connretry.core.failure.FailureClassifier;
import com.connretry.core.metric.RetryMetrics;
import com.connretry.core.predicate.RetryPredicates;
import com.connretry.core.predicate.TransientFailureRetryPredicate;
import com.connretry.core.spi.BackoffPolicy;
import com.connretry.core.spi.ConnectionManager;
import com.connretry.core.spi.RetryPredicate;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.jdbc.support.JdbcUtils;

import javax.sql.DataSource;
import java.time.Clock;

/**
 * 连接重试组件装配, 存在 DataSource 时生效
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@EnableConfigurationProperties(RetryConnectorProperties.class)
@ConditionalOnClass({DataSource.class, JdbcUtils.class})
@ConditionalOnBean(DataSource.class)
public class RetryConnectorAutoConfiguration {

    /**
     * 连接管理
     */
    @Bean
    @ConditionalOnMissingBean(ConnectionManager.class)
    public ConnectionManager retryConnectionManager(DataSource dataSource, RetryConnectorProperties props) {
        return new DataSourceConnectionManager(dataSource, props.getProbeTimeout());
    }

    /**
     * 失败分类
     */
    @Bean
    @ConditionalOnMissingBean(FailureClassifier.class)
    public FailureClassifier failureClassifier(RetryConnectorProperties props) {
        RetryConnectorProperties.TransientRetry tr = props.getTransientRetry();
        return new FailureClassifier(tr.getTransientErrorCodes(), tr.getConnectionErrorCodes());
    }

    /**
     * 退避策略注册中心
     */
    @Bean
    @ConditionalOnMissingBean(BackoffRegistry.class)
    public BackoffRegistry backoffRegistry(RetryConnectorProperties props,
                                           ObjectProvider<BackoffPolicy> discoveredPolicies) {
        return new BackoffRegistry(props, discoveredPolicies.orderedStream().toList());
    }

    /**
     * 默认判定器: 开启 transient-retry 时只重试瞬时失败, 否则总是重试
     */
    @Bean
    @ConditionalOnMissingBean(RetryPredicate.class)
    public RetryPredicate retryPredicate(RetryConnectorProperties props, BackoffRegistry backoffRegistry) {
        if (props.getTransientRetry().isEnabled()) {
            return new TransientFailureRetryPredicate(backoffRegistry, props.getTransientRetry().getMaxDuration());
        }
        return RetryPredicates.always();
    }

    /**
     * 重试执行入口
     */
    @Bean
    @ConditionalOnMissingBean(RetryConnector.class)
    public RetryConnector retryConnector(ConnectionManager connectionManager,
                                         RetryConnectorProperties props,
                                         ObjectProvider<RetryMetrics> meter,
                                         FailureClassifier failureClassifier,
                                         RetryPredicate retryPredicate) {
        return new RetryConnector(connectionManager, props,
                meter.getIfAvailable(RetryMetrics::standalone),
                failureClassifier, retryPredicate, Clock.systemUTC());
    }

    @Bean
    @ConditionalOnMissingBean(RetryConnectorLifecycle.class)
    public RetryConnectorLifecycle retryConnectorLifecycle(RetryConnector connector, RetryConnectorProperties props) {
        return new RetryConnectorLifecycle(connector, props);
    }
}
