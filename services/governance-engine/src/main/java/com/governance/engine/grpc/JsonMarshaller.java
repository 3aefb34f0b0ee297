package com.governance.engine.grpc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.grpc.MethodDescriptor;
import io.grpc.Status;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;

/**
 * Carries gRPC messages as UTF-8 JSON documents.
 */
public final class JsonMarshaller<T> implements MethodDescriptor.Marshaller<T> {

    private final ObjectMapper mapper;
    private final Class<T> type;

    public JsonMarshaller(ObjectMapper mapper, Class<T> type) {
        this.mapper = mapper;
        this.type = type;
    }

    @Override
    public InputStream stream(T value) {
        try {
            return new ByteArrayInputStream(mapper.writeValueAsBytes(value));
        } catch (JsonProcessingException e) {
            throw Status.INTERNAL.withDescription("Failed to encode " + type.getSimpleName())
                    .withCause(e).asRuntimeException();
        }
    }

    @Override
    public T parse(InputStream stream) {
        try {
            return mapper.readValue(stream, type);
        } catch (IOException e) {
            throw Status.INVALID_ARGUMENT.withDescription("Malformed " + type.getSimpleName() + ": " + e.getMessage())
                    .withCause(e).asRuntimeException();
        }
    }
}
