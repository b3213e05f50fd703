package uk.gegc.lessondocs.shared.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pool for batch document rendering.
 * <p>
 * Each render is single-threaded; the pool only runs independent renders side by side. When the queue
 * is full the submitting thread renders the document itself.
 */
@Configuration
@Slf4j
public class AsyncConfig {

    @Value("${async.render.core-pool-size:4}")
    private int renderCorePoolSize;

    @Value("${async.render.max-pool-size:8}")
    private int renderMaxPoolSize;

    @Value("${async.render.queue-capacity:200}")
    private int renderQueueCapacity;

    @Value("${async.render.keep-alive-seconds:60}")
    private int renderKeepAliveSeconds;

    @Bean(name = "renderTaskExecutor")
    public ThreadPoolTaskExecutor renderTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(renderCorePoolSize);
        executor.setMaxPoolSize(renderMaxPoolSize);
        executor.setQueueCapacity(renderQueueCapacity);
        executor.setKeepAliveSeconds(renderKeepAliveSeconds);
        executor.setThreadNamePrefix("render-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());

        // Wait for in-flight renders on shutdown
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);

        executor.initialize();

        log.info("Render Task Executor configured - Core: {}, Max: {}, Queue: {}, KeepAlive: {}s",
                renderCorePoolSize, renderMaxPoolSize, renderQueueCapacity, renderKeepAliveSeconds);

        return executor;
    }
}
