package com.chatpulse.config;

import com.chatpulse.auth.AuthFlow;
import com.chatpulse.client.AckTracker;
import com.chatpulse.client.ClientRuntime;
import com.chatpulse.client.OutboundOperation;
import com.chatpulse.connection.ConnectionManager;
import com.chatpulse.event.EventPublisherHelper;
import com.chatpulse.queue.RetryQueue;
import com.chatpulse.ratelimit.RateLimiter;
import com.chatpulse.session.FileSessionStore;
import com.chatpulse.session.SessionCodec;
import com.chatpulse.session.SessionStore;
import com.chatpulse.transport.EnvelopeCodec;
import com.chatpulse.transport.Transport;
import com.chatpulse.transport.WebSocketTransport;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;

/**
 * Wires the client runtime. Every component shares one {@link ClientContext}, so all timers
 * (heartbeat, backoff, challenge expiry and refresh, queue dispatch, ack expiry, rate-limit
 * cleanup) run on the same small scheduler.
 */
@Configuration
@EnableConfigurationProperties(ChatPulseProperties.class)
public class ClientConfig {

    private static final Logger log = LoggerFactory.getLogger(ClientConfig.class);

    @Bean(destroyMethod = "shutdown")
    public ThreadPoolTaskScheduler chatPulseScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("chatpulse-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setErrorHandler(t -> log.error("Scheduled task failed: {}", t.getMessage(), t));
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.initialize();
        return scheduler;
    }

    @Bean
    public ClientContext clientContext(
            ThreadPoolTaskScheduler chatPulseScheduler,
            EventPublisherHelper eventPublisherHelper,
            ChatPulseProperties properties) {
        return new ClientContext(chatPulseScheduler, eventPublisherHelper, properties);
    }

    @Bean
    public EnvelopeCodec envelopeCodec(ObjectMapper objectMapper) {
        return new EnvelopeCodec(objectMapper);
    }

    @Bean
    public SessionCodec sessionCodec(ObjectMapper objectMapper) {
        return new SessionCodec(objectMapper);
    }

    @Bean
    public Transport transport(EnvelopeCodec envelopeCodec, ChatPulseProperties properties) {
        ChatPulseProperties.Transport config = properties.getTransport();
        return new WebSocketTransport(
                new StandardWebSocketClient(),
                envelopeCodec,
                config.getSendTimeLimitMs(),
                config.getSendBufferSizeLimit());
    }

    @Bean
    public SessionStore sessionStore(ChatPulseProperties properties) {
        log.info("Session store directory: {}", properties.getSessionDir());
        return new FileSessionStore(Path.of(properties.getSessionDir()));
    }

    @Bean
    public RateLimiter rateLimiter(ClientContext clientContext) {
        return new RateLimiter(clientContext);
    }

    @Bean
    public RetryQueue<OutboundOperation> retryQueue(ClientContext clientContext) {
        return new RetryQueue<>(clientContext);
    }

    @Bean
    public AuthFlow authFlow(ClientContext clientContext, Transport transport) {
        return new AuthFlow(clientContext, transport);
    }

    @Bean
    public ConnectionManager connectionManager(
            ClientContext clientContext,
            Transport transport,
            AuthFlow authFlow,
            SessionStore sessionStore,
            SessionCodec sessionCodec) {
        return new ConnectionManager(clientContext, transport, authFlow, sessionStore, sessionCodec);
    }

    @Bean
    public AckTracker ackTracker(ClientContext clientContext) {
        return new AckTracker(clientContext);
    }

    @Bean
    public ClientRuntime clientRuntime(
            ClientContext clientContext,
            ConnectionManager connectionManager,
            RateLimiter rateLimiter,
            RetryQueue<OutboundOperation> retryQueue,
            AckTracker ackTracker) {
        return new ClientRuntime(clientContext, connectionManager, rateLimiter, retryQueue, ackTracker);
    }
}
