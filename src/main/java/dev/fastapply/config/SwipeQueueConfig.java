package dev.fastapply.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.fastapply.batch.BatchListener;
import dev.fastapply.client.AutomationWorkerClient;
import dev.fastapply.metrics.QueueMetrics;
import dev.fastapply.session.QueueSession;
import dev.fastapply.store.KeyValueStore;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;

/**
 * Wires the queue session of the configured namespace.
 */
@Configuration
public class SwipeQueueConfig {

    @Bean(destroyMethod = "dispose")
    public Scheduler swipeQueueScheduler() {
        return Schedulers.newSingle("swipe-queue-timer", true);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(initMethod = "init", destroyMethod = "close")
    public QueueSession queueSession(KeyValueStore store, ObjectMapper objectMapper, AutomationWorkerClient client,
            SwipeQueueProperties properties, QueueMetrics metrics, ObjectProvider<BatchListener> listener,
            Scheduler swipeQueueScheduler, Clock clock) {
        return new QueueSession(properties.getNamespace(), store, objectMapper, client, properties, metrics,
                listener.getIfAvailable(() -> BatchListener.NO_OP), swipeQueueScheduler, clock);
    }
}
