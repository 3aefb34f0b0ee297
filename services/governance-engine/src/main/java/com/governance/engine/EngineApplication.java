package com.governance.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class EngineApplication {

    private static final Logger log = LoggerFactory.getLogger(EngineApplication.class);

    public static void main(String[] args) {
        // Allow the gRPC port to be overridden from `GOVERNANCE_GRPC_PORT`.
        // Accepted formats: "port" or "host:port".
        String addr = System.getenv("GOVERNANCE_GRPC_PORT");
        if (addr != null && !addr.isBlank()) {
            String portStr = addr.trim();
            int colon = portStr.lastIndexOf(':');
            if (colon != -1 && colon < portStr.length() - 1) {
                portStr = portStr.substring(colon + 1);
            }
            try {
                int port = Integer.parseInt(portStr);
                System.setProperty("governance.grpc.port", Integer.toString(port));
            } catch (NumberFormatException e) {
                log.warn("Ignoring GOVERNANCE_GRPC_PORT={}, not a port number", addr);
            }
        }

        SpringApplication.run(EngineApplication.class, args);
        log.info("Governance engine started");
    }
}
