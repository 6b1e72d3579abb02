package com.travelplanner.messaging.internal;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.travelplanner.messaging.JobHandler;
import com.travelplanner.messaging.MessagingProperties;
import com.travelplanner.messaging.annotation.JobListener;
import com.travelplanner.messaging.email.EmailJob;
import com.travelplanner.messaging.email.EmailJobHandler;
import com.travelplanner.messaging.email.EmailSender;
import com.travelplanner.messaging.rabbitmq.ConsumerLoop;
import com.travelplanner.messaging.rabbitmq.JobPublisher;
import com.travelplanner.messaging.rabbitmq.QueueTopology;
import com.travelplanner.messaging.rabbitmq.TopologyConfigurator;
import com.travelplanner.messaging.retry.RetryCoordinator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.context.ApplicationContext;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@DisplayName("JobListenerProcessor - listener discovery and startup")
class JobListenerProcessorTest {

    private MessagingProperties properties;
    private ApplicationContext context;
    private TopologyConfigurator topologyConfigurator;
    private ConsumerLoop consumerLoop;
    private JobListenerProcessor processor;
    private final Map<String, Object> beans = new LinkedHashMap<>();

    @BeforeEach
    void setUp() {
        properties = new MessagingProperties();
        context = mock(ApplicationContext.class);
        topologyConfigurator = mock(TopologyConfigurator.class);
        consumerLoop = mock(ConsumerLoop.class);
        when(context.getBeansWithAnnotation(JobListener.class)).thenReturn(beans);

        processor = new JobListenerProcessor(properties, context, topologyConfigurator, consumerLoop,
                mock(JobPublisher.class), new JobCodec(new ObjectMapper(), null), MessagingMetrics.NOOP);
    }

    @JobListener(domain = "audit", type = AuditEntry.class, concurrency = 2)
    static class AuditHandler implements JobHandler<AuditEntry> {
        @Override
        public boolean handle(AuditEntry job) {
            return true;
        }
    }

    static class AuditEntry {
        public String action;
    }

    @JobListener(domain = "audit", type = AuditEntry.class)
    static class SecondAuditHandler implements JobHandler<AuditEntry> {
        @Override
        public boolean handle(AuditEntry job) {
            return true;
        }
    }

    @JobListener(domain = "broken", type = AuditEntry.class)
    static class NotAHandler {
    }

    @JobListener(domain = " ", type = AuditEntry.class)
    static class BlankDomainHandler implements JobHandler<AuditEntry> {
        @Override
        public boolean handle(AuditEntry job) {
            return true;
        }
    }

    @Test
    @DisplayName("afterSingletonsInstantiated - should register annotated handlers")
    void testDiscovery() {
        // Given
        EmailJobHandler emailHandler = new EmailJobHandler(mock(EmailSender.class));
        beans.put("emailJobHandler", emailHandler);
        beans.put("auditHandler", new AuditHandler());

        // When
        processor.afterSingletonsInstantiated();

        // Then
        List<JobListenerProcessor.ListenerDefinition> definitions = processor.getDefinitions();
        assertEquals(2, definitions.size());
        assertEquals("email", definitions.get(0).getDomain());
        assertEquals(EmailJob.class, definitions.get(0).getType());
        assertSame(emailHandler, definitions.get(0).getHandler());
        assertEquals(2, definitions.get(1).getConcurrency());
    }

    @Test
    @DisplayName("afterSingletonsInstantiated - bean that is not a JobHandler should fail")
    void testNotAHandler() {
        // Given
        beans.put("notAHandler", new NotAHandler());

        // When / Then
        assertThrows(IllegalStateException.class, () -> processor.afterSingletonsInstantiated());
    }

    @Test
    @DisplayName("afterSingletonsInstantiated - two listeners for one domain should fail")
    void testDuplicateDomain() {
        // Given
        beans.put("auditHandler", new AuditHandler());
        beans.put("secondAuditHandler", new SecondAuditHandler());

        // When / Then
        IllegalStateException failure =
                assertThrows(IllegalStateException.class, () -> processor.afterSingletonsInstantiated());
        assertTrue(failure.getMessage().contains("audit"));
    }

    @Test
    @DisplayName("afterSingletonsInstantiated - blank domain should fail")
    void testBlankDomain() {
        // Given
        beans.put("blank", new BlankDomainHandler());

        // When / Then
        assertThrows(IllegalStateException.class, () -> processor.afterSingletonsInstantiated());
    }

    @Test
    @DisplayName("startListeners - should declare the DLX topology and subscribe a retrying handler")
    void testStartRetryableListener() {
        // Given
        beans.put("emailJobHandler", new EmailJobHandler(mock(EmailSender.class)));
        processor.afterSingletonsInstantiated();

        // When
        processor.startListeners();

        // Then
        verify(topologyConfigurator).setupQueueWithDlx(QueueTopology.forDomain("email"));
        verify(consumerLoop).subscribe(eq("email_job_queue"), eq(EmailJob.class), any(RetryCoordinator.class), eq(5));
    }

    @Test
    @DisplayName("startListeners - concurrency falls back from annotation to job config to consumer default")
    void testConcurrencyResolution() {
        // Given
        MessagingProperties.JobConfig emailConfig = new MessagingProperties.JobConfig();
        emailConfig.setConcurrency(8);
        properties.getJobs().put("email", emailConfig);
        properties.getJobs().put("audit", emailConfig);
        beans.put("emailJobHandler", new EmailJobHandler(mock(EmailSender.class)));
        beans.put("auditHandler", new AuditHandler());
        processor.afterSingletonsInstantiated();

        // When
        processor.startListeners();

        // Then
        verify(consumerLoop).subscribe(eq("email_job_queue"), eq(EmailJob.class), any(), eq(8));
        verify(consumerLoop).subscribe(eq("audit_job_queue"), eq(AuditEntry.class), any(), eq(2));
    }

    @Test
    @DisplayName("startListeners - handlers of non-retryable types are subscribed undecorated")
    void testNonRetryableType() {
        // Given
        AuditHandler handler = new AuditHandler();
        beans.put("auditHandler", handler);
        processor.afterSingletonsInstantiated();

        // When
        processor.startListeners();

        // Then
        verify(consumerLoop).subscribe(eq("audit_job_queue"), eq(AuditEntry.class), same(handler), eq(2));
    }

    @Test
    @DisplayName("startListeners - disabled job family is neither declared nor subscribed")
    void testDisabledFamily() {
        // Given
        MessagingProperties.JobConfig disabled = new MessagingProperties.JobConfig();
        disabled.setEnabled(false);
        properties.getJobs().put("email", disabled);
        beans.put("emailJobHandler", new EmailJobHandler(mock(EmailSender.class)));
        processor.afterSingletonsInstantiated();

        // When
        processor.startListeners();

        // Then
        verifyNoInteractions(topologyConfigurator, consumerLoop);
    }

    @Test
    @DisplayName("topologyFor - should honour dead-letter and TTL settings")
    void testTopologyFor() {
        // Given
        MessagingProperties.JobConfig config = new MessagingProperties.JobConfig();
        config.setDeadLetter(false);
        config.setMessageTtl(Duration.ofMinutes(1));

        // When
        QueueTopology topology = JobListenerProcessor.topologyFor("audit", config);

        // Then
        assertEquals("audit_job_queue", topology.getQueueName());
        assertFalse(topology.hasDeadLetterExchange());
        assertEquals(60_000L, topology.getMessageTtl());
    }

    @Test
    @DisplayName("retryableFailures - listed failure types and their subclasses are not retried")
    void testRetryableFailures() {
        // When
        Predicate<Throwable> retryable = JobListenerProcessor.retryableFailures(List.of(IllegalArgumentException.class));

        // Then
        assertFalse(retryable.test(new IllegalArgumentException("bad address")));
        assertFalse(retryable.test(new NumberFormatException("bad number")));
        assertTrue(retryable.test(new IllegalStateException("smtp down")));
    }
}
