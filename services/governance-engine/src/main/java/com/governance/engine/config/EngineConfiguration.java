package com.governance.engine.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.governance.engine.audit.Auditor;
import com.governance.engine.events.GovernanceEvents;
import com.governance.engine.events.LoggingGovernanceEvents;
import com.governance.engine.fix.Remediator;
import com.governance.engine.governor.Governor;
import com.governance.engine.governor.ScaffoldTemplates;
import com.governance.engine.grpc.EmbeddedGrpcServer;
import com.governance.engine.scan.FileScanner;
import com.governance.engine.sync.GitRepositoryStatusProvider;
import com.governance.engine.sync.RepositoryStatusProvider;
import com.governance.engine.sync.Synchronizer;
import com.governance.engine.validate.Validator;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(GovernanceProperties.class)
public class EngineConfiguration {

    @Bean
    public ObjectMapper objectMapper() {
        return JsonMappers.standard();
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public GovernanceEvents governanceEvents() {
        return new LoggingGovernanceEvents();
    }

    @Bean
    public GovernanceConfigLoader governanceConfigLoader(ObjectMapper mapper) {
        return new GovernanceConfigLoader(mapper);
    }

    @Bean
    public RepositoryStatusProvider repositoryStatusProvider(GovernanceProperties properties) {
        GovernanceProperties.RepositoryStatus status = properties.getRepositoryStatus();
        if (!status.isEnabled()) {
            return RepositoryStatusProvider.none();
        }
        return new GitRepositoryStatusProvider(status.getTimeout());
    }

    @Bean
    public Remediator remediator(GovernanceConfigLoader loader) {
        return new Remediator(loader);
    }

    @Bean
    public Validator validator(ObjectMapper mapper, GovernanceConfigLoader loader, Remediator remediator,
                               GovernanceEvents events) {
        return new Validator(mapper, loader, remediator, events);
    }

    @Bean
    public Synchronizer synchronizer(RepositoryStatusProvider repositoryStatus, GovernanceEvents events) {
        return new Synchronizer(new FileScanner(), repositoryStatus, events);
    }

    @Bean
    public Auditor auditor(ObjectMapper mapper, GovernanceEvents events) {
        return new Auditor(mapper, events);
    }

    @Bean
    public Governor governor(GovernanceConfigLoader loader, Validator validator, Synchronizer synchronizer,
                             Auditor auditor, Remediator remediator, GovernanceEvents events, Clock clock) {
        return new Governor(loader, validator, synchronizer, auditor, remediator, new ScaffoldTemplates(), events, clock);
    }

    @Bean(destroyMethod = "stop")
    public EmbeddedGrpcServer embeddedGrpcServer(Governor governor, ObjectMapper mapper, GovernanceProperties properties) {
        return new EmbeddedGrpcServer(governor, mapper, properties.getProjectRoot());
    }

    @Bean
    @ConditionalOnProperty(prefix = "governance.grpc", name = "enabled", havingValue = "true", matchIfMissing = true)
    public ApplicationRunner grpcServerRunner(EmbeddedGrpcServer server, GovernanceProperties properties) {
        return args -> server.start(properties.getGrpc().getPort());
    }
}
