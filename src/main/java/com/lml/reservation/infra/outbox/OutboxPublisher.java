package com.lml.reservation.infra.outbox;

import com.lml.reservation.domain.outbox.OutboxEvent;
import com.lml.reservation.domain.outbox.OutboxStatus;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * outbox -> Kafka 릴레이. at-least-once (소비 쪽은 중복 이벤트를 받아도 된다).
 */
@Slf4j
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(name = "ticketing.notifier.mode", havingValue = "kafka")
public class OutboxPublisher {

    private final OutboxEventRepository outboxEventRepository;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final MeterRegistry meterRegistry;

    @Value("${ticketing.outbox.batch-size:100}")
    private int batchSize;

    @Value("${ticketing.outbox.publish-timeout-ms:3000}")
    private long publishTimeoutMs;

    @Scheduled(fixedDelayString = "${ticketing.outbox.publish-interval-ms:300}")
    @Transactional
    public void publish() {
        final long startNs = System.nanoTime();

        int success = 0;
        int retry = 0;
        int failed = 0;

        try {
            LocalDateTime now = LocalDateTime.now();
            List<OutboxEvent> batch = outboxEventRepository.lockPendingBatch(now, batchSize);
            if (batch.isEmpty()) {
                return;
            }

            meterRegistry.summary("ticketing.outbox.batch.size").record(batch.size());

            for (OutboxEvent e : batch) {
                try {
                    kafkaTemplate
                            .send(e.getTopic(), e.getEventKey(), e.getPayload())
                            .get(publishTimeoutMs, TimeUnit.MILLISECONDS);

                    e.markPublished(now);
                    success++;

                } catch (ExecutionException | TimeoutException | RuntimeException ex) {
                    e.markRetryOrFail(ex.toString(), now);

                    if (e.getStatus() == OutboxStatus.FAILED) {
                        failed++;
                        log.error("Outbox publish failed permanently. eventId={}, topic={}, key={}, retryCount={}, err={}",
                                e.getEventId(), e.getTopic(), e.getEventKey(), e.getRetryCount(), ex.toString());
                    } else {
                        retry++;
                        log.warn("Outbox publish retry scheduled. eventId={}, key={}, retryCount={}, nextRetryAt={}, err={}",
                                e.getEventId(), e.getEventKey(), e.getRetryCount(), e.getNextRetryAt(), ex.toString());
                    }
                } catch (InterruptedException ex) {
                    Thread.currentThread().interrupt();
                    e.markRetryOrFail("interrupted", now);
                    retry++;
                    break;
                }
            }

            outboxEventRepository.saveAll(batch);

            count("published", success);
            count("retry", retry);
            count("failed", failed);
            log.debug("Outbox batch done. total={}, success={}, retry={}, failed={}",
                    batch.size(), success, retry, failed);

        } finally {
            meterRegistry.timer("ticketing.outbox.publish.loop")
                    .record(System.nanoTime() - startNs, TimeUnit.NANOSECONDS);
        }
    }

    private void count(String result, int n) {
        if (n > 0) {
            meterRegistry.counter("ticketing.outbox.events", "result", result).increment(n);
        }
    }
}
