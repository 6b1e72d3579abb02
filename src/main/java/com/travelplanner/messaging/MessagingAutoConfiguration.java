package com.travelplanner.messaging;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rabbitmq.client.ConnectionFactory;
import com.travelplanner.messaging.exception.MessagingException;
import com.travelplanner.messaging.internal.JobCodec;
import com.travelplanner.messaging.internal.JobListenerProcessor;
import com.travelplanner.messaging.internal.MessagingMetrics;
import com.travelplanner.messaging.rabbitmq.BrokerConnectionEvent;
import com.travelplanner.messaging.rabbitmq.BrokerHealthIndicator;
import com.travelplanner.messaging.rabbitmq.ChannelPool;
import com.travelplanner.messaging.rabbitmq.ConnectionManager;
import com.travelplanner.messaging.rabbitmq.ConsumerLoop;
import com.travelplanner.messaging.rabbitmq.JobPublisher;
import com.travelplanner.messaging.rabbitmq.TopologyConfigurator;
import com.travelplanner.messaging.rabbitmq.TopologyRegistry;
import com.travelplanner.messaging.retry.ExponentialBackoff;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.validation.Validator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.autoconfigure.validation.ValidationAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationContext;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.lang.Nullable;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Auto-configuration for the job messaging layer.
 *
 * <p>Enabled by default; disable with:
 *
 * <pre>
 *   messaging.enabled = false
 * </pre>
 *
 * <p>The application's {@link ObjectMapper} and Bean Validation {@link Validator} are used for
 * job bodies when present. The {@link MeterRegistry} is optional; metrics are a no-op without it.
 */
@Slf4j
@AutoConfiguration(after = {JacksonAutoConfiguration.class, ValidationAutoConfiguration.class})
@EnableConfigurationProperties(MessagingProperties.class)
@ConditionalOnProperty(prefix = "messaging", name = "enabled", havingValue = "true", matchIfMissing = true)
public class MessagingAutoConfiguration {

    public static final String SCHEDULER_BEAN_NAME = "messagingScheduler";
    public static final String HANDLER_EXECUTOR_BEAN_NAME = "messagingHandlerExecutor";

    // =====================================================================
    // CONNECTION
    // =====================================================================

    @Bean
    @ConditionalOnMissingBean
    public ConnectionFactory messagingConnectionFactory(MessagingProperties props) {
        ConnectionFactory factory = new ConnectionFactory();
        try {
            factory.setUri(props.getUrl());
        } catch (Exception e) {
            throw new MessagingException("Invalid messaging.url", e);
        }
        factory.setConnectionTimeout((int) props.getConnection().getConnectionTimeout().toMillis());
        // reconnects are driven by ConnectionManager
        factory.setAutomaticRecoveryEnabled(false);
        factory.setTopologyRecoveryEnabled(false);
        return factory;
    }

    @Bean(name = SCHEDULER_BEAN_NAME, destroyMethod = "shutdownNow")
    @ConditionalOnMissingBean(name = SCHEDULER_BEAN_NAME)
    public ScheduledExecutorService messagingScheduler() {
        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("broker-scheduler-");
        threadFactory.setDaemon(true);
        return Executors.newScheduledThreadPool(2, threadFactory);
    }

    @Bean(name = HANDLER_EXECUTOR_BEAN_NAME, destroyMethod = "shutdown")
    @ConditionalOnMissingBean(name = HANDLER_EXECUTOR_BEAN_NAME)
    public ExecutorService messagingHandlerExecutor() {
        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("job-handler-");
        threadFactory.setDaemon(true);
        return Executors.newCachedThreadPool(threadFactory);
    }

    @Bean
    @ConditionalOnMissingBean
    public ConnectionManager connectionManager(
            MessagingProperties props,
            ConnectionFactory messagingConnectionFactory,
            @Qualifier(SCHEDULER_BEAN_NAME) ScheduledExecutorService scheduler,
            ApplicationEventPublisher eventPublisher) {

        MessagingProperties.ConnectionConfig conn = props.getConnection();
        ConnectionManager manager = new ConnectionManager(
                messagingConnectionFactory,
                scheduler,
                props.getConnectionName(),
                conn.getInitialRetries(),
                new ExponentialBackoff(conn.getInitialRetryDelay(), conn.getMaxReconnectDelay(), conn.getMaxJitter()),
                conn.getMaxReconnectAttempts(),
                new ExponentialBackoff(conn.getReconnectDelay(), conn.getMaxReconnectDelay(), conn.getMaxJitter()));

        manager.addListener((previous, current, cause) -> {
            BrokerConnectionEvent.Type type = BrokerConnectionEvent.typeFor(current);
            if (type != null) {
                eventPublisher.publishEvent(new BrokerConnectionEvent(manager, type, cause));
            }
        });
        return manager;
    }

    // =====================================================================
    // CHANNELS & TOPOLOGY
    // =====================================================================

    @Bean
    @ConditionalOnMissingBean
    public TopologyRegistry topologyRegistry() {
        return new TopologyRegistry();
    }

    @Bean
    @ConditionalOnMissingBean
    public ChannelPool channelPool(MessagingProperties props,
                                   ConnectionManager connectionManager,
                                   TopologyRegistry topologyRegistry) {
        ChannelPool pool = new ChannelPool(connectionManager, topologyRegistry, props.getPublisher().isConfirms());
        connectionManager.addListener(pool);
        return pool;
    }

    @Bean
    @ConditionalOnMissingBean
    public TopologyConfigurator topologyConfigurator(ChannelPool channelPool, TopologyRegistry topologyRegistry) {
        return new TopologyConfigurator(channelPool, topologyRegistry);
    }

    // =====================================================================
    // PUBLISH & CONSUME
    // =====================================================================

    /**
     * Job body codec. Falls back to a plain {@link ObjectMapper} and skips validation when the
     * application provides neither.
     */
    @Bean
    @ConditionalOnMissingBean
    public JobCodec jobCodec(@Nullable ObjectMapper objectMapper, @Nullable Validator validator) {
        ObjectMapper mapper = objectMapper != null ? objectMapper : new ObjectMapper();
        if (validator == null) {
            log.warn("No Bean Validation provider available, job bodies will not be validated");
        }
        return new JobCodec(mapper, validator);
    }

    @Bean
    @ConditionalOnMissingBean
    public MessagingMetrics messagingMetrics(@Nullable MeterRegistry meterRegistry) {
        return new MessagingMetrics(meterRegistry);
    }

    @Bean
    @ConditionalOnMissingBean
    public JobPublisher jobPublisher(MessagingProperties props,
                                     ConnectionManager connectionManager,
                                     ChannelPool channelPool,
                                     JobCodec jobCodec,
                                     MessagingMetrics messagingMetrics) {
        MessagingProperties.PublisherConfig publisher = props.getPublisher();
        return new JobPublisher(
                connectionManager,
                channelPool,
                jobCodec,
                messagingMetrics,
                publisher.isConfirms(),
                publisher.getConfirmTimeout(),
                publisher.getDrainTimeout());
    }

    @Bean
    @ConditionalOnMissingBean
    public ConsumerLoop consumerLoop(ConnectionManager connectionManager,
                                     ChannelPool channelPool,
                                     TopologyConfigurator topologyConfigurator,
                                     JobCodec jobCodec,
                                     @Qualifier(HANDLER_EXECUTOR_BEAN_NAME) ExecutorService handlerExecutor,
                                     MessagingMetrics messagingMetrics) {
        ConsumerLoop loop = new ConsumerLoop(channelPool, topologyConfigurator, jobCodec, handlerExecutor, messagingMetrics);
        connectionManager.addListener(loop);
        return loop;
    }

    // =====================================================================
    // LISTENERS & LIFECYCLE
    // =====================================================================

    @Bean
    public JobListenerProcessor jobListenerProcessor(MessagingProperties props,
                                                     ApplicationContext context,
                                                     TopologyConfigurator topologyConfigurator,
                                                     ConsumerLoop consumerLoop,
                                                     JobPublisher jobPublisher,
                                                     JobCodec jobCodec,
                                                     MessagingMetrics messagingMetrics) {
        return new JobListenerProcessor(props, context, topologyConfigurator, consumerLoop,
                jobPublisher, jobCodec, messagingMetrics);
    }

    @Bean
    public MessagingLifecycle messagingLifecycle(ConnectionManager connectionManager,
                                                 ConsumerLoop consumerLoop,
                                                 JobListenerProcessor jobListenerProcessor,
                                                 MessagingProperties props) {
        return new MessagingLifecycle(connectionManager, consumerLoop, jobListenerProcessor, props);
    }

    // =====================================================================
    // HEALTH
    // =====================================================================

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(HealthIndicator.class)
    static class HealthConfiguration {

        @Bean(name = "brokerHealthIndicator")
        @ConditionalOnMissingBean(name = "brokerHealthIndicator")
        public BrokerHealthIndicator brokerHealthIndicator(ConnectionManager connectionManager) {
            return new BrokerHealthIndicator(connectionManager);
        }
    }
}
