package com.ontheform.shared.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pools for work that runs beside a request, currently confirmation email dispatch.
 */
@Configuration
@Slf4j
public class AsyncConfig {

    public static final String NOTIFICATION_EXECUTOR = "notificationTaskExecutor";

    @Value("${async.notification.core-pool-size:2}")
    private int corePoolSize;

    @Value("${async.notification.max-pool-size:8}")
    private int maxPoolSize;

    @Value("${async.notification.queue-capacity:100}")
    private int queueCapacity;

    @Value("${async.notification.keep-alive-seconds:60}")
    private int keepAliveSeconds;

    @Bean(name = NOTIFICATION_EXECUTOR)
    public ThreadPoolTaskExecutor notificationTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setKeepAliveSeconds(keepAliveSeconds);
        executor.setThreadNamePrefix("notify-");
        // a rejected dispatch is reported to the submitter as a failed send
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();

        log.info("Notification executor configured - Core: {}, Max: {}, Queue: {}, KeepAlive: {}s",
                corePoolSize, maxPoolSize, queueCapacity, keepAliveSeconds);
        return executor;
    }
}
