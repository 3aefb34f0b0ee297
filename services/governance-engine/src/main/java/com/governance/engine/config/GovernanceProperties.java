package com.governance.engine.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "governance")
public class GovernanceProperties {

    /** Project analyzed when a request carries no path. */
    private String projectRoot = ".";

    private final Grpc grpc = new Grpc();

    private final RepositoryStatus repositoryStatus = new RepositoryStatus();

    public String getProjectRoot() {
        return projectRoot;
    }

    public void setProjectRoot(String projectRoot) {
        this.projectRoot = projectRoot;
    }

    public Grpc getGrpc() {
        return grpc;
    }

    public RepositoryStatus getRepositoryStatus() {
        return repositoryStatus;
    }

    public static class Grpc {

        private boolean enabled = true;

        private int port = 9192;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getPort() {
            return port;
        }

        public void setPort(int port) {
            this.port = port;
        }
    }

    public static class RepositoryStatus {

        private boolean enabled = true;

        /** Upper bound for each git invocation. */
        private Duration timeout = Duration.ofSeconds(10);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }
    }
}
