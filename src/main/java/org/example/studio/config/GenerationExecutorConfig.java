package org.example.studio.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread pools for generation work. Batches wait on their items, so batch and item work must
 * never share a pool.
 */
@Configuration
public class GenerationExecutorConfig {

    @Bean(name = "generationBatchExecutor", destroyMethod = "shutdownNow")
    public ExecutorService generationBatchExecutor(
            @Value("${generation.batch.max-concurrent:2}") int maxConcurrent) {
        return Executors.newFixedThreadPool(Math.max(1, maxConcurrent), new NamedThreadFactory("generation-batch"));
    }

    @Bean(name = "generationItemExecutor", destroyMethod = "shutdownNow")
    public ExecutorService generationItemExecutor(
            @Value("${generation.item.max-concurrent:4}") int maxConcurrent) {
        return Executors.newFixedThreadPool(Math.max(1, maxConcurrent), new NamedThreadFactory("generation-item"));
    }

    @Bean(name = "generationFollowUpExecutor", destroyMethod = "shutdownNow")
    public ExecutorService generationFollowUpExecutor(
            @Value("${generation.follow-up.max-concurrent:2}") int maxConcurrent) {
        return Executors.newFixedThreadPool(Math.max(1, maxConcurrent), new NamedThreadFactory("generation-sketch"));
    }

    @Bean(name = "notificationExecutor", destroyMethod = "shutdownNow")
    public ExecutorService notificationExecutor() {
        return Executors.newSingleThreadExecutor(new NamedThreadFactory("notification"));
    }

    static final class NamedThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger nextThreadId = new AtomicInteger(1);

        NamedThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, prefix + "-" + nextThreadId.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        }
    }
}
