package com.travelplanner.messaging.internal;

import com.travelplanner.messaging.JobHandler;
import com.travelplanner.messaging.MessagingProperties;
import com.travelplanner.messaging.RetryableJob;
import com.travelplanner.messaging.annotation.JobListener;
import com.travelplanner.messaging.rabbitmq.ConsumerLoop;
import com.travelplanner.messaging.rabbitmq.JobPublisher;
import com.travelplanner.messaging.rabbitmq.JobQueueNames;
import com.travelplanner.messaging.rabbitmq.QueueTopology;
import com.travelplanner.messaging.rabbitmq.TopologyConfigurator;
import com.travelplanner.messaging.retry.RetryCoordinator;
import com.travelplanner.messaging.retry.RetryPolicy;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.aop.support.AopUtils;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.context.ApplicationContext;
import org.springframework.core.annotation.AnnotationUtils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Turns {@link JobListener} beans into running consumers.
 *
 * <p><b>Responsibilities:</b></p>
 * <ul>
 *     <li>Discovers {@link JobListener} beans once all singletons exist</li>
 *     <li>Declares each family's queue, DLX and DLQ</li>
 *     <li>Wraps handlers of {@link RetryableJob} types in a {@link RetryCoordinator}</li>
 *     <li>Subscribes them with the configured concurrency</li>
 * </ul>
 *
 * <p>Discovery happens at context refresh; declaration and subscription need an open
 * connection and run from {@link #startListeners()}.
 */
@Slf4j
@RequiredArgsConstructor
public class JobListenerProcessor implements SmartInitializingSingleton {

    private final MessagingProperties properties;
    private final ApplicationContext context;
    private final TopologyConfigurator topologyConfigurator;
    private final ConsumerLoop consumerLoop;
    private final JobPublisher publisher;
    private final JobCodec codec;
    private final MessagingMetrics metrics;

    private final List<ListenerDefinition> definitions = new ArrayList<>();

    // =====================================================================
    // DISCOVERY
    // =====================================================================

    @Override
    public void afterSingletonsInstantiated() {
        log.info("Discovering job listeners...");

        context.getBeansWithAnnotation(JobListener.class)
                .forEach(this::registerListenerBean);
    }

    private void registerListenerBean(String beanName, Object bean) {
        Class<?> clazz = AopUtils.getTargetClass(bean);
        JobListener listener = AnnotationUtils.findAnnotation(clazz, JobListener.class);
        if (listener == null) {
            return;
        }

        if (!(bean instanceof JobHandler<?> handler)) {
            throw new IllegalStateException("@JobListener bean '" + beanName + "' ("
                    + clazz.getName() + ") must implement " + JobHandler.class.getName());
        }
        if (listener.domain().isBlank()) {
            throw new IllegalStateException("@JobListener bean '" + beanName + "' declares a blank domain");
        }
        boolean duplicate = definitions.stream().anyMatch(d -> d.getDomain().equals(listener.domain()));
        if (duplicate) {
            throw new IllegalStateException("More than one @JobListener for domain '" + listener.domain() + "'");
        }

        definitions.add(new ListenerDefinition(
                listener.domain(),
                listener.type(),
                handler,
                listener.concurrency(),
                Arrays.asList(listener.noRetryFor())));
        log.info("Job listener registered → domain={} type={} bean={}",
                listener.domain(), listener.type().getSimpleName(), beanName);
    }

    public List<ListenerDefinition> getDefinitions() {
        return Collections.unmodifiableList(definitions);
    }

    // =====================================================================
    // START
    // =====================================================================

    /**
     * Declares topology and subscribes every discovered listener.
     */
    public void startListeners() {
        definitions.forEach(this::start);
    }

    private void start(ListenerDefinition definition) {
        String domain = definition.getDomain();
        String queue = JobQueueNames.queue(domain);
        MessagingProperties.JobConfig config = properties.jobConfig(domain);
        if (!config.isEnabled()) {
            log.info("Job listener for domain {} disabled by configuration", domain);
            return;
        }

        topologyConfigurator.setupQueueWithDlx(topologyFor(domain, config));

        int concurrency = definition.getConcurrency() > 0
                ? definition.getConcurrency()
                : config.concurrencyOr(properties.getConsumer().getDefaultConcurrency());

        subscribe(queue, definition, decorate(definition, queue, config), concurrency);

        log.info("Job listener started → domain={} queue={} concurrency={} maxRetries={}",
                domain, queue, concurrency, config.getMaxRetries());
    }

    static QueueTopology topologyFor(String domain, MessagingProperties.JobConfig config) {
        QueueTopology topology = config.isDeadLetter()
                ? QueueTopology.forDomain(domain)
                : QueueTopology.plain(JobQueueNames.queue(domain));
        if (config.getMessageTtl() != null) {
            topology = topology.toBuilder().messageTtl(config.getMessageTtl().toMillis()).build();
        }
        return topology;
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private JobHandler<Object> decorate(ListenerDefinition definition,
                                        String queue,
                                        MessagingProperties.JobConfig config) {
        JobHandler<Object> handler = (JobHandler<Object>) definition.getHandler();
        if (!RetryableJob.class.isAssignableFrom(definition.getType())) {
            return handler;
        }

        RetryPolicy policy = new RetryPolicy(
                config.getMaxRetries(),
                config.getBaseDelay(),
                config.getMaxPendingRetries(),
                retryableFailures(definition.getNoRetryFor()));

        return new RetryCoordinator(handler, queue, policy, publisher, codec, metrics);
    }

    static Predicate<Throwable> retryableFailures(List<Class<? extends Throwable>> noRetryFor) {
        return failure -> noRetryFor.stream().noneMatch(type -> type.isInstance(failure));
    }

    @SuppressWarnings("unchecked")
    private void subscribe(String queue,
                           ListenerDefinition definition,
                           JobHandler<Object> handler,
                           int concurrency) {
        consumerLoop.subscribe(queue, (Class<Object>) definition.getType(), handler, concurrency);
    }

    /**
     * A discovered {@link JobListener}.
     */
    @Value
    public static class ListenerDefinition {
        String domain;
        Class<?> type;
        JobHandler<?> handler;
        int concurrency;
        List<Class<? extends Throwable>> noRetryFor;
    }
}
