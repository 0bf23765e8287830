package com.tamma.orchestrator.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tamma.orchestrator.core.audit.AuditEventSink;
import com.tamma.orchestrator.core.repository.DurableStore;
import com.tamma.orchestrator.engine.audit.Slf4jAuditEventSink;
import com.tamma.orchestrator.engine.lifecycle.ActiveWorkProbe;
import com.tamma.orchestrator.engine.lifecycle.Orchestrator;
import com.tamma.orchestrator.engine.lifecycle.Transport;
import com.tamma.orchestrator.engine.metrics.OrchestratorMetrics;
import com.tamma.orchestrator.engine.persistence.InMemoryDurableStore;
import com.tamma.orchestrator.engine.persistence.jdbc.JdbcDurableStore;
import com.tamma.orchestrator.recovery.StaleTaskReaper;
import com.tamma.orchestrator.recovery.WorkflowRecoveryService;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.sql.init.dependency.DependsOnDatabaseInitialization;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.time.Clock;
import java.util.stream.Collectors;

/**
 * Wires the orchestrator and its recovery services from {@link OrchestratorProperties}.
 *
 * The orchestrator is started when its bean is initialized and shut down when the context
 * closes, see {@link OrchestratorShutdownListener}.
 */
@Configuration
public class OrchestratorConfiguration {

    // ========== Store ==========

    @Bean
    @DependsOnDatabaseInitialization
    @ConditionalOnProperty(name = "tamma.orchestrator.store", havingValue = "jdbc", matchIfMissing = true)
    public DurableStore jdbcDurableStore(DataSource dataSource, ObjectMapper objectMapper) {
        return new JdbcDurableStore(dataSource, objectMapper);
    }

    @Bean
    @ConditionalOnProperty(name = "tamma.orchestrator.store", havingValue = "memory")
    public DurableStore inMemoryDurableStore() {
        return new InMemoryDurableStore();
    }

    // ========== Ambient ==========

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public AuditEventSink auditEventSink() {
        return new Slf4jAuditEventSink();
    }

    @Bean
    public OrchestratorMetrics orchestratorMetrics() {
        return new OrchestratorMetrics();
    }

    @Bean
    public MeterRegistryCustomizer<MeterRegistry> metricsCommonTags() {
        return registry -> registry.config()
            .commonTags("application", "tamma-orchestrator");
    }

    // ========== Orchestrator ==========

    @Bean
    @ConditionalOnProperty(name = "tamma.orchestrator.recovery.enabled", havingValue = "true", matchIfMissing = true)
    public WorkflowRecoveryService workflowRecoveryService(OrchestratorProperties properties) {
        return new WorkflowRecoveryService(properties.getRecovery().getMode());
    }

    @Bean(initMethod = "start", destroyMethod = "shutdown")
    public Orchestrator orchestrator(
            OrchestratorProperties properties,
            DurableStore store,
            AuditEventSink auditEventSink,
            Clock clock,
            OrchestratorMetrics metrics,
            ObjectProvider<Transport> transports,
            ObjectProvider<ActiveWorkProbe> activeWorkProbe,
            ObjectProvider<WorkflowRecoveryService> recovery) {
        return Orchestrator.builder()
            .store(store)
            .auditSink(auditEventSink)
            .clock(clock)
            .settings(properties.toSettings())
            .metrics(metrics)
            .transports(transports.orderedStream().collect(Collectors.toList()))
            .activeWorkProbe(activeWorkProbe.getIfAvailable(ActiveWorkProbe::none))
            .startupHooks(recovery.stream().collect(Collectors.toList()))
            .build();
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    @ConditionalOnProperty(name = "tamma.orchestrator.reaper.enabled", havingValue = "true", matchIfMissing = true)
    public StaleTaskReaper staleTaskReaper(OrchestratorProperties properties, Orchestrator orchestrator, Clock clock) {
        return new StaleTaskReaper(orchestrator, clock, properties.getReaper().getInterval());
    }
}
