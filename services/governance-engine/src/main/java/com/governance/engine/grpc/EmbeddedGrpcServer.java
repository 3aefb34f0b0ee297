package com.governance.engine.grpc;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.governance.engine.config.ConfigurationException;
import com.governance.engine.events.LogSanitizer;
import com.governance.engine.governor.Governor;
import com.governance.engine.grpc.GovernanceMessages.AuditRequest;
import com.governance.engine.grpc.GovernanceMessages.ComplianceRequest;
import com.governance.engine.grpc.GovernanceMessages.ComplianceResponse;
import com.governance.engine.grpc.GovernanceMessages.InitRequest;
import com.governance.engine.grpc.GovernanceMessages.ProjectRequest;
import com.governance.engine.grpc.GovernanceMessages.RemediationResponse;
import com.governance.engine.grpc.GovernanceMessages.SyncRequest;
import com.governance.engine.grpc.GovernanceMessages.ValidateRequest;
import com.governance.engine.model.AuditResult;
import com.governance.engine.model.AuditType;
import com.governance.engine.model.GovernanceStatus;
import com.governance.engine.model.GovernanceViolation;
import com.governance.engine.model.InitOptions;
import com.governance.engine.model.InitResult;
import com.governance.engine.model.SyncOptions;
import com.governance.engine.model.SyncResult;
import com.governance.engine.model.SyncValidation;
import com.governance.engine.model.ValidationResult;
import com.governance.engine.scan.SafePaths;
import io.grpc.MethodDescriptor;
import io.grpc.Server;
import io.grpc.ServerCallHandler;
import io.grpc.ServerBuilder;
import io.grpc.ServerServiceDefinition;
import io.grpc.Status;
import io.grpc.stub.ServerCalls;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Exposes the {@link Governor} operations as unary gRPC methods with JSON payloads.
 */
public class EmbeddedGrpcServer {

    private static final Logger log = LoggerFactory.getLogger(EmbeddedGrpcServer.class);

    public static final String SERVICE_NAME = "governance.engine.GovernanceEngine";

    private final Governor governor;
    private final ObjectMapper mapper;
    private final String defaultProjectRoot;
    private Server server;

    public EmbeddedGrpcServer(Governor governor, ObjectMapper mapper, String defaultProjectRoot) {
        this.governor = governor;
        this.mapper = mapper;
        this.defaultProjectRoot = defaultProjectRoot;
    }

    @FunctionalInterface
    interface Call<Q, R> {
        R apply(Q request) throws IOException;
    }

    /**
     * Unary descriptor for one method of the service. Clients may use their own
     * payload types as long as they map to the same JSON.
     */
    public static <Q, R> MethodDescriptor<Q, R> method(String name, ObjectMapper mapper,
                                                       Class<Q> requestType, Class<R> responseType) {
        return MethodDescriptor.<Q, R>newBuilder()
                .setType(MethodDescriptor.MethodType.UNARY)
                .setFullMethodName(MethodDescriptor.generateFullMethodName(SERVICE_NAME, name))
                .setRequestMarshaller(new JsonMarshaller<>(mapper, requestType))
                .setResponseMarshaller(new JsonMarshaller<>(mapper, responseType))
                .build();
    }

    public ServerServiceDefinition bindService() {
        return ServerServiceDefinition.builder(SERVICE_NAME)
                .addMethod(method("Validate", mapper, ValidateRequest.class, ValidationResult.class),
                        unary("Validate", this::validate))
                .addMethod(method("ValidateSync", mapper, ProjectRequest.class, SyncValidation.class),
                        unary("ValidateSync", (ProjectRequest request) -> governor.validateSync(root(request.projectPath()))))
                .addMethod(method("Sync", mapper, SyncRequest.class, SyncResult.class),
                        unary("Sync", (SyncRequest request) -> governor.sync(root(request.projectPath()),
                                new SyncOptions(request.dryRun(), request.force(), request.ignoreRemote()))))
                .addMethod(method("Audit", mapper, AuditRequest.class, AuditResult.class),
                        unary("Audit", this::audit))
                .addMethod(method("CheckCompliance", mapper, ComplianceRequest.class, ComplianceResponse.class),
                        unary("CheckCompliance", (ComplianceRequest request) -> new ComplianceResponse(
                                governor.checkCompliance(root(request.projectPath()), request.strict()))))
                .addMethod(method("Status", mapper, ProjectRequest.class, GovernanceStatus.class),
                        unary("Status", (ProjectRequest request) -> governor.getStatus(root(request.projectPath()))))
                .addMethod(method("Init", mapper, InitRequest.class, InitResult.class),
                        unary("Init", (InitRequest request) -> governor.init(root(request.projectPath()),
                                new InitOptions(request.force(), request.projectName()))))
                .addMethod(method("Remediate", mapper, ComplianceRequest.class, RemediationResponse.class),
                        unary("Remediate", this::remediate))
                .build();
    }

    public void start(int port) throws IOException {
        server = ServerBuilder.forPort(port)
                .addService(bindService())
                .build()
                .start();
        log.info("Embedded gRPC server started on port {}", port);

        // Netty threads are daemons; keep the JVM alive while serving.
        Thread awaiter = new Thread(() -> {
            try {
                server.awaitTermination();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "grpc-await");
        awaiter.setDaemon(false);
        awaiter.start();
    }

    public void stop() {
        if (server != null) {
            log.info("Shutting down gRPC server");
            server.shutdown();
            try {
                if (!server.awaitTermination(5, TimeUnit.SECONDS)) {
                    server.shutdownNow();
                }
            } catch (InterruptedException e) {
                server.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }

    private ValidationResult validate(ValidateRequest request) throws IOException {
        Path root = root(request.projectPath());
        ValidationResult result = governor.validate(root, request.fix());
        if (request.reportPath() != null && !request.reportPath().isBlank()) {
            governor.auditor().saveValidationReport(result, SafePaths.within(root, request.reportPath()));
        }
        return result;
    }

    private AuditResult audit(AuditRequest request) throws IOException {
        Path root = root(request.projectPath());
        AuditType type = request.type() == null || request.type().isBlank()
                ? AuditType.COMPREHENSIVE
                : AuditType.fromCode(request.type());
        AuditResult result = governor.audit(root, type);
        if (request.outputPath() != null && !request.outputPath().isBlank()) {
            governor.auditor().saveResults(result, SafePaths.within(root, request.outputPath()));
        }
        return result;
    }

    private RemediationResponse remediate(ComplianceRequest request) {
        Path root = root(request.projectPath());
        List<GovernanceViolation> found = governor.checkCompliance(root, request.strict());
        int fixed = governor.autoFix(root, found);
        List<GovernanceViolation> remaining = fixed == 0 ? found : governor.checkCompliance(root, request.strict());
        return new RemediationResponse(found.size(), fixed, remaining);
    }

    private Path root(String projectPath) {
        return SafePaths.projectRoot(projectPath == null || projectPath.isBlank() ? defaultProjectRoot : projectPath);
    }

    private <Q, R> ServerCallHandler<Q, R> unary(String name, Call<Q, R> call) {
        return ServerCalls.asyncUnaryCall((request, observer) -> {
            try {
                observer.onNext(call.apply(request));
                observer.onCompleted();
            } catch (ConfigurationException e) {
                log.warn("{} rejected: {}", name, LogSanitizer.sanitize(e));
                observer.onError(Status.FAILED_PRECONDITION.withDescription(LogSanitizer.sanitize(e.getMessage()))
                        .asRuntimeException());
            } catch (IllegalArgumentException e) {
                log.warn("{} rejected: {}", name, LogSanitizer.sanitize(e));
                observer.onError(Status.INVALID_ARGUMENT.withDescription(LogSanitizer.sanitize(e.getMessage()))
                        .asRuntimeException());
            } catch (IOException | UncheckedIOException e) {
                log.error("{} failed: {}", name, LogSanitizer.sanitize(e));
                observer.onError(Status.INTERNAL.withDescription(LogSanitizer.sanitize(e.getMessage()))
                        .withCause(e).asRuntimeException());
            }
        });
    }
}
