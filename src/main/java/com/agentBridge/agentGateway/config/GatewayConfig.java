package com.agentBridge.agentGateway.config;

import com.agentBridge.agentGateway.audit.LogSink;
import com.agentBridge.agentGateway.audit.Slf4jLogSink;
import com.agentBridge.agentGateway.backend.BackendFactory;
import com.agentBridge.agentGateway.backend.chat.ChatCompletionsBackendFactory;
import com.agentBridge.agentGateway.backend.chat.ChatCompletionsClient;
import com.agentBridge.agentGateway.backend.model.BackendOptions;
import com.agentBridge.agentGateway.batch.BatchProcessingEngine;
import com.agentBridge.agentGateway.batch.BatchSettings;
import com.agentBridge.agentGateway.gateway.filter.RequestContextFilter;
import com.agentBridge.agentGateway.gateway.service.MessagesService;
import com.agentBridge.agentGateway.gateway.service.ModelCatalog;
import com.agentBridge.agentGateway.session.SessionPool;
import com.agentBridge.agentGateway.session.SessionPoolSettings;
import com.agentBridge.agentGateway.streaming.StreamingResponseBridge;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Wires the gateway core: backend adapter, model catalog, session pool,
 * streaming bridge, batch engine and the request context filter.
 *
 * The pool and the batch engine are owned components with an explicit
 * lifecycle, started and stopped with the application context.
 */
@Slf4j
@Configuration
public class GatewayConfig {

    @Bean
    public LogSink logSink(@Value("${gateway.audit.sink:slf4j}") String sink) {
        if ("none".equalsIgnoreCase(sink)) {
            log.info("Audit records disabled (gateway.audit.sink=none)");
            return LogSink.noOp();
        }
        if (!"slf4j".equalsIgnoreCase(sink)) {
            log.warn("Unknown audit sink '{}', falling back to slf4j", sink);
        }
        return new Slf4jLogSink();
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService backendCallExecutor() {
        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("backend-call-");
        threadFactory.setDaemon(true);
        return Executors.newCachedThreadPool(threadFactory);
    }

    @Bean
    public ChatCompletionsClient chatCompletionsClient(
            @Value("${gateway.backend.base-url:https://api.groq.com/openai/v1}") String baseUrl,
            @Value("${gateway.backend.api-key:}") String apiKey,
            @Value("${gateway.backend.connect-timeout:10s}") Duration connectTimeout,
            @Value("${gateway.backend.read-timeout:300s}") Duration readTimeout) {
        if (apiKey.isBlank()) {
            log.warn("No backend API key configured (gateway.backend.api-key); backend calls will be rejected");
        }
        return new ChatCompletionsClient(baseUrl, apiKey, connectTimeout, readTimeout);
    }

    @Bean
    public BackendFactory backendFactory(
            ChatCompletionsClient chatCompletionsClient,
            ExecutorService backendCallExecutor,
            ObjectMapper objectMapper,
            @Value("${gateway.backend.temperature:#{null}}") Double temperature,
            @Value("${gateway.backend.max-completion-tokens:#{null}}") Integer maxCompletionTokens) {
        return new ChatCompletionsBackendFactory(chatCompletionsClient, backendCallExecutor, objectMapper,
                temperature, maxCompletionTokens);
    }

    @Bean
    public BackendOptions backendOptions(
            @Value("${gateway.backend.model:llama-3.3-70b-versatile}") String model,
            @Value("${gateway.backend.system-prompt:#{null}}") String systemPrompt,
            @Value("${gateway.backend.allowed-tools:}") List<String> allowedTools,
            @Value("${gateway.backend.max-turns:10}") int maxTurns) {
        return BackendOptions.builder()
                .model(model)
                .systemPrompt(systemPrompt)
                .allowedTools(allowedTools)
                .maxTurns(maxTurns)
                .build();
    }

    /**
     * Served models: the default backend model first, then {@code gateway.models.available}.
     */
    @Bean
    public ModelCatalog modelCatalog(
            BackendOptions backendOptions,
            @Value("${gateway.models.available:}") List<String> available,
            @Value("${gateway.models.aliases:}") List<String> aliases) {
        List<String> modelIds = new ArrayList<>();
        modelIds.add(backendOptions.getModel());
        modelIds.addAll(available);
        return new ModelCatalog(modelIds, ModelCatalog.parseAliases(aliases), Instant.now());
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    public SessionPool sessionPool(
            BackendFactory backendFactory,
            BackendOptions backendOptions,
            @Value("${gateway.session.max-sessions:100}") int maxSessions,
            @Value("${gateway.session.ttl:3600s}") Duration ttl,
            @Value("${gateway.session.cleanup-interval:60s}") Duration cleanupInterval,
            @Value("${gateway.session.acquire-timeout:30s}") Duration acquireTimeout,
            @Value("${gateway.session.clear-on-release:true}") boolean clearOnRelease) {
        if (!clearOnRelease) {
            log.warn("gateway.session.clear-on-release=false is ignored; released sessions are always cleared");
        }
        SessionPoolSettings settings = SessionPoolSettings.builder()
                .maxSessions(maxSessions)
                .ttl(ttl)
                .cleanupInterval(cleanupInterval)
                .acquireTimeout(acquireTimeout)
                .build();
        return new SessionPool(backendFactory, backendOptions, settings);
    }

    @Bean
    public StreamingResponseBridge streamingResponseBridge(LogSink logSink) {
        return new StreamingResponseBridge(logSink);
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    public BatchProcessingEngine batchProcessingEngine(
            MessagesService messagesService,
            LogSink logSink,
            @Value("${gateway.batch.concurrency:5}") int concurrency,
            @Value("${gateway.batch.max-batch-size:100}") int maxBatchSize,
            @Value("${gateway.batch.retention:29d}") Duration retention,
            @Value("${gateway.batch.sweep-interval:60s}") Duration sweepInterval,
            @Value("${gateway.request.timeout:300s}") Duration entryTimeout) {
        BatchSettings settings = BatchSettings.builder()
                .concurrency(concurrency)
                .maxBatchSize(maxBatchSize)
                .retention(retention)
                .sweepInterval(sweepInterval)
                .entryTimeout(entryTimeout)
                .build();
        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("batch-worker-");
        threadFactory.setDaemon(true);
        return new BatchProcessingEngine(messagesService, Executors.newCachedThreadPool(threadFactory), logSink, settings);
    }

    @Bean
    public FilterRegistrationBean<RequestContextFilter> gatewayRequestContextFilter(LogSink logSink) {
        FilterRegistrationBean<RequestContextFilter> registration = new FilterRegistrationBean<>(new RequestContextFilter(logSink));
        registration.addUrlPatterns("/*");
        registration.setOrder(Ordered.HIGHEST_PRECEDENCE);
        return registration;
    }
}
