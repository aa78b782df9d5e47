package com.intteq.reliable.message.broker.inspection;

import com.intteq.reliable.message.broker.binding.Binding;
import com.intteq.reliable.message.broker.exception.RoutingConfigurationException;
import com.intteq.reliable.message.broker.retry.DeliveryStatus;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.Nullable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.core.Message;

import java.util.concurrent.TimeUnit;

/**
 * Default {@link DeliveryInspector}: one log line per delivery or publish, plus Micrometer
 * meters when a registry is available.
 *
 * <p>Log format:
 * <pre>
 * [AMQP] [INBOUND] [orders.exchange] [orders.*.created] [orders] [Nack::Retry] attempt=1 messageId=...
 * [AMQP] [OUTBOUND] [delayed.retrial.v1.exchange] [orders] [OK] messageId=...
 * </pre>
 * Acknowledged deliveries log at INFO, invalid messages at WARN, everything else at ERROR.
 * Meters are recorded regardless of {@link InspectTraffic}.
 */
@Slf4j
public class LoggingDeliveryInspector implements DeliveryInspector {

    static final String DELIVERY_COUNTER = "reliability.delivery";
    static final String HANDLER_TIMER = "reliability.handler.latency";
    static final String UNMATCHED_COUNTER = "reliability.routing.unmatched";

    private final InspectTraffic traffic;

    /** Optional Micrometer registry (null-safe). */
    @Nullable
    private final MeterRegistry meterRegistry;

    public LoggingDeliveryInspector(InspectTraffic traffic, @Nullable MeterRegistry meterRegistry) {
        this.traffic = traffic;
        this.meterRegistry = meterRegistry;
    }

    // =====================================================================
    // INBOUND
    // =====================================================================

    @Override
    public void inspectInbound(InspectionRecord record) {
        recordMetrics(record);

        if (!traffic.includesInbound()) {
            return;
        }

        Binding binding = record.getBinding();
        String line = String.format("[AMQP] [INBOUND] [%s] [%s] [%s] [%s] attempt=%d routingKey=%s messageId=%s",
                binding.getExchange(),
                binding.getRoutingKey(),
                binding.getQueue(),
                record.getStatus().getLabel(),
                record.getAttemptCount(),
                record.getRoutingKey(),
                record.getMessageId());

        DeliveryStatus status = record.getStatus();
        if (status == DeliveryStatus.ACK) {
            log.info(line);
        } else if (status == DeliveryStatus.DEAD_LETTER_INVALID) {
            log.warn("{} error={}", line, describe(record.getError()));
        } else {
            log.error(line, record.getError());
        }
    }

    // =====================================================================
    // OUTBOUND
    // =====================================================================

    @Override
    public void inspectOutbound(String exchange, String routingKey, Message message, Throwable error) {
        if (!traffic.includesOutbound()) {
            return;
        }

        String messageId = message.getMessageProperties().getMessageId();
        if (error == null) {
            log.info("[AMQP] [OUTBOUND] [{}] [{}] [OK] messageId={}", exchange, routingKey, messageId);
        } else {
            log.error("[AMQP] [OUTBOUND] [{}] [{}] [FAILED] messageId={}", exchange, routingKey, messageId, error);
        }
    }

    // =====================================================================
    // ROUTING
    // =====================================================================

    @Override
    public void inspectUnmatched(RoutingConfigurationException error) {
        if (meterRegistry != null) {
            meterRegistry.counter(UNMATCHED_COUNTER, "queue", error.getQueue()).increment();
        }
        log.error("[AMQP] [INBOUND] [{}] [{}] dropped: {}", error.getQueue(), error.getRoutingKey(), error.getMessage());
    }

    // =====================================================================
    // METRICS
    // =====================================================================

    private void recordMetrics(InspectionRecord record) {
        if (meterRegistry == null) return;

        String queue = record.getBinding().getQueue();
        meterRegistry.counter(DELIVERY_COUNTER, "queue", queue, "status", record.getStatus().getLabel())
                .increment();

        if (record.getHandlerDuration() != null) {
            meterRegistry.timer(HANDLER_TIMER, "queue", queue)
                    .record(record.getHandlerDuration().toNanos(), TimeUnit.NANOSECONDS);
        }
    }

    private static String describe(Throwable error) {
        return error == null ? "none" : error.getMessage();
    }
}
