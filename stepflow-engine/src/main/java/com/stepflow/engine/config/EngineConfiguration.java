package com.stepflow.engine.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.stepflow.core.definition.DefinitionParser;
import com.stepflow.core.definition.ProgramValidator;
import com.stepflow.core.path.JsonPathEvaluator;
import com.stepflow.core.path.PathEvaluator;
import com.stepflow.engine.history.HistoryListener;
import com.stepflow.engine.interpreter.ExecutionEngine;
import com.stepflow.engine.metrics.ExecutionMetrics;
import com.stepflow.scheduler.TimerScheduler;
import com.stepflow.scheduler.TimerService;
import com.stepflow.worker.ResourceInvoker;
import com.stepflow.worker.ResourceRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring wiring for the interpreter.
 * 
 * Provides, unless the application defines its own:
 * - a JSON path evaluator and a definition parser
 * - a timer scheduler and a resource registry
 * - execution metrics bound to the meter registry
 * - the execution engine, closed with the context
 */
@Configuration
@EnableConfigurationProperties(EngineProperties.class)
public class EngineConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    @Bean
    public MeterRegistryCustomizer<MeterRegistry> metricsCommonTags() {
        return registry -> registry.config()
            .commonTags("application", "stepflow");
    }

    @Bean
    @ConditionalOnMissingBean
    public ObjectMapper objectMapper() {
        return new ObjectMapper();
    }

    @Bean
    @ConditionalOnMissingBean
    public PathEvaluator pathEvaluator() {
        return new JsonPathEvaluator();
    }

    @Bean
    @ConditionalOnMissingBean
    public DefinitionParser definitionParser(ObjectMapper objectMapper) {
        return new DefinitionParser(objectMapper, new ProgramValidator());
    }

    @Bean(destroyMethod = "stop")
    @ConditionalOnMissingBean(TimerService.class)
    public TimerScheduler timerScheduler(EngineProperties properties) {
        return new TimerScheduler(properties.getTimerThreads());
    }

    @Bean(destroyMethod = "stop")
    @ConditionalOnMissingBean(ResourceInvoker.class)
    public ResourceRegistry resourceRegistry(EngineProperties properties) {
        return new ResourceRegistry(properties.getResourceThreads());
    }

    @Bean
    @ConditionalOnMissingBean
    public ExecutionMetrics executionMetrics(MeterRegistry meterRegistry) {
        ExecutionMetrics metrics = new ExecutionMetrics();
        metrics.bindTo(meterRegistry);
        return metrics;
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public ExecutionEngine executionEngine(
        EngineProperties properties,
        ResourceInvoker resourceInvoker,
        TimerService timerService,
        PathEvaluator pathEvaluator,
        ExecutionMetrics executionMetrics,
        ObjectMapper objectMapper,
        ObjectProvider<HistoryListener> historyListeners
    ) {
        ExecutionEngine.Builder builder = ExecutionEngine.builder()
            .properties(properties)
            .resourceInvoker(resourceInvoker)
            .timerService(timerService)
            .pathEvaluator(pathEvaluator)
            .metrics(executionMetrics)
            .objectMapper(objectMapper);
        historyListeners.orderedStream().forEach(builder::historyListener);
        return builder.build();
    }
}
