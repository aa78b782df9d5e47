package com.intteq.reliable.message.broker.binding;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.intteq.reliable.message.broker.MessageContext;
import com.intteq.reliable.message.broker.exception.InvalidMessageException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;

import java.io.IOException;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletionStage;
import java.util.stream.Collectors;

/**
 * Handler that turns the JSON body into a typed payload before calling application code.
 *
 * <p>A body that cannot be read as {@code T}, or a payload that violates its bean-validation
 * constraints, raises {@link InvalidMessageException}: the message is dead-lettered without retry.
 *
 * <pre>
 * {@code
 * PayloadHandler.of(OrderCreated.class, objectMapper, validator,
 *         (order, ctx) -> orderService.accept(order));
 * }
 * </pre>
 *
 * @param <T> payload type
 */
public class PayloadHandler<T> implements MessageHandler {

    private final Class<T> payloadType;
    private final ObjectMapper objectMapper;
    private final Validator validator;
    private final PayloadConsumer<T> consumer;

    private PayloadHandler(Class<T> payloadType, ObjectMapper objectMapper, Validator validator,
                           PayloadConsumer<T> consumer) {
        this.payloadType = Objects.requireNonNull(payloadType, "payloadType must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.validator = validator;
        this.consumer = Objects.requireNonNull(consumer, "consumer must not be null");
    }

    /**
     * @param validator may be {@code null} to skip bean validation
     */
    public static <T> PayloadHandler<T> of(Class<T> payloadType, ObjectMapper objectMapper,
                                           Validator validator, PayloadConsumer<T> consumer) {
        return new PayloadHandler<>(payloadType, objectMapper, validator, consumer);
    }

    @Override
    public CompletionStage<?> handle(MessageContext context) throws Exception {
        T payload = read(context);
        validate(payload);
        return consumer.accept(payload, context);
    }

    private T read(MessageContext context) {
        try {
            T payload = objectMapper.readValue(context.body(), payloadType);
            if (payload == null) {
                throw new InvalidMessageException("Empty payload, expected " + payloadType.getSimpleName());
            }
            return payload;
        } catch (JsonProcessingException e) {
            throw new InvalidMessageException(
                    "Payload is not a valid " + payloadType.getSimpleName() + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new InvalidMessageException("Failed to read payload as " + payloadType.getSimpleName(), e);
        }
    }

    private void validate(T payload) {
        if (validator == null) {
            return;
        }
        Set<ConstraintViolation<T>> violations = validator.validate(payload);
        if (!violations.isEmpty()) {
            String details = violations.stream()
                    .map(v -> v.getPropertyPath() + " " + v.getMessage())
                    .sorted()
                    .collect(Collectors.joining(", "));
            throw new InvalidMessageException(payloadType.getSimpleName() + " failed validation: " + details);
        }
    }

    /**
     * Application callback receiving the parsed payload.
     */
    @FunctionalInterface
    public interface PayloadConsumer<T> {
        CompletionStage<?> accept(T payload, MessageContext context) throws Exception;
    }
}
