package com.swiftload.loadservice.job;

import com.swiftload.loadservice.config.OutboxProperties;
import com.swiftload.loadservice.model.OutboxEvent;
import com.swiftload.loadservice.repository.OutboxRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageProperties;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Relays lifecycle events from the outbox table to the load events exchange.
 * The event type doubles as the routing key (load.assigned, bid.placed, ...).
 * Delivery is at-least-once: a crash between send and commit re-sends the batch.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OutboxPublisher {

  private final OutboxRepository outboxRepository;
  private final RabbitTemplate rabbitTemplate;
  private final OutboxProperties outboxProperties;

  @Scheduled(fixedDelayString = "${swiftload.outbox.publish-delay-ms:2000}")
  @Transactional
  public void publishOutboxEvents() {
    if (!outboxProperties.isEnabled()) {
      return;
    }

    List<OutboxEvent> events = outboxRepository.findTop50ByProcessedFalseOrderByCreatedAtAsc();
    if (events.isEmpty()) {
      return;
    }

    log.debug("Found {} outbox events to publish", events.size());

    for (OutboxEvent event : events) {
      try {
        // payload is already JSON, send it as-is
        MessageProperties props = new MessageProperties();
        props.setContentType(MessageProperties.CONTENT_TYPE_JSON);
        props.setHeader("aggregateType", event.getAggregateType());
        props.setHeader("aggregateId", event.getAggregateId());

        Message message = new Message(event.getPayload().getBytes(StandardCharsets.UTF_8), props);
        rabbitTemplate.send(outboxProperties.getExchange(), event.getType(), message);

        event.setProcessed(true);
        outboxRepository.save(event);

        log.info("Published outbox event: id={}, type={}", event.getId(), event.getType());

      } catch (Exception e) {
        // left unprocessed, picked up again on the next run
        log.error("Failed to publish outbox event: id={}, type={}", event.getId(), event.getType(), e);
      }
    }
  }

  @Scheduled(cron = "${swiftload.outbox.cleanup-cron:0 0 3 * * *}")
  @Transactional
  public void cleanupProcessedEvents() {
    LocalDateTime cutoff = LocalDateTime.now().minusDays(outboxProperties.getRetentionDays());
    log.info("Starting cleanup of processed outbox events older than {}", cutoff);

    int totalDeleted = 0;
    while (true) {
      List<OutboxEvent> batch = outboxRepository.findTop1000ByProcessedTrueAndCreatedAtBefore(cutoff);
      if (batch.isEmpty()) {
        break;
      }
      outboxRepository.deleteAll(batch);
      totalDeleted += batch.size();
      log.debug("Deleted batch of {} processed events", batch.size());
    }

    log.info("Cleanup completed. Total deleted: {}", totalDeleted);
  }
}
