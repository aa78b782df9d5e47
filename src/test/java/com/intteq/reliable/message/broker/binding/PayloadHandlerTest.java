package com.intteq.reliable.message.broker.binding;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.intteq.reliable.message.broker.MessageContext;
import com.intteq.reliable.message.broker.exception.InvalidMessageException;
import com.intteq.reliable.message.broker.retry.FailureClassifier;
import com.intteq.reliable.message.broker.retry.FailureKind;
import com.rabbitmq.client.Channel;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageProperties;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

class PayloadHandlerTest {

    private static ValidatorFactory validatorFactory;
    private static Validator validator;

    private final ObjectMapper objectMapper = new ObjectMapper();

    @BeforeAll
    static void setUpValidator() {
        validatorFactory = Validation.buildDefaultValidatorFactory();
        validator = validatorFactory.getValidator();
    }

    @AfterAll
    static void closeValidator() {
        validatorFactory.close();
    }

    @Test
    void passesParsedPayloadToConsumer() throws Exception {
        AtomicReference<OrderCreated> received = new AtomicReference<>();
        PayloadHandler<OrderCreated> handler = PayloadHandler.of(OrderCreated.class, objectMapper, validator,
                (order, ctx) -> {
                    received.set(order);
                    return CompletableFuture.completedFuture(null);
                });

        handler.handle(context("{\"orderId\":\"o-1\",\"amount\":3}")).toCompletableFuture().join();

        assertThat(received.get().orderId).isEqualTo("o-1");
        assertThat(received.get().amount).isEqualTo(3);
    }

    @Test
    void malformedJsonIsAValidationFault() {
        PayloadHandler<OrderCreated> handler = PayloadHandler.of(OrderCreated.class, objectMapper, validator,
                (order, ctx) -> null);

        assertThatThrownBy(() -> handler.handle(context("{not json")))
                .isInstanceOf(InvalidMessageException.class)
                .satisfies(e -> assertThat(FailureClassifier.defaultClassifier().classify(e))
                        .isEqualTo(FailureKind.VALIDATION));
    }

    @Test
    void constraintViolationsAreValidationFaults() {
        PayloadHandler<OrderCreated> handler = PayloadHandler.of(OrderCreated.class, objectMapper, validator,
                (order, ctx) -> null);

        assertThatThrownBy(() -> handler.handle(context("{\"orderId\":\"\",\"amount\":-1}")))
                .isInstanceOf(InvalidMessageException.class)
                .hasMessageContaining("amount")
                .hasMessageContaining("orderId");
    }

    @Test
    void validationIsSkippedWithoutValidator() throws Exception {
        AtomicReference<OrderCreated> received = new AtomicReference<>();
        PayloadHandler<OrderCreated> handler = PayloadHandler.of(OrderCreated.class, objectMapper, null,
                (order, ctx) -> {
                    received.set(order);
                    return null;
                });

        handler.handle(context("{\"orderId\":\"\",\"amount\":-1}"));

        assertThat(received.get().amount).isEqualTo(-1);
    }

    private static MessageContext context(String body) {
        MessageProperties properties = new MessageProperties();
        properties.setDeliveryTag(1L);
        return MessageContext.forRabbitMQ(mock(Channel.class),
                new Message(body.getBytes(StandardCharsets.UTF_8), properties));
    }

    static class OrderCreated {
        @NotBlank
        public String orderId;

        @Positive
        public int amount;
    }
}
