package uk.gegc.codejudge.shared.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.aop.interceptor.AsyncUncaughtExceptionHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.AsyncConfigurer;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Arrays;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Asynchronous processing for work that runs after a submission has been judged
 * (activity tracking, achievements). Judging itself stays on the request thread.
 */
@Configuration
@EnableAsync
@Slf4j
public class AsyncConfig implements AsyncConfigurer {

    @Value("${async.activity.core-pool-size:2}")
    private int corePoolSize;

    @Value("${async.activity.max-pool-size:4}")
    private int maxPoolSize;

    @Value("${async.activity.queue-capacity:100}")
    private int queueCapacity;

    @Value("${async.activity.keep-alive-seconds:60}")
    private int keepAliveSeconds;

    @Bean(name = "activityTaskExecutor")
    public Executor activityTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setKeepAliveSeconds(keepAliveSeconds);
        executor.setThreadNamePrefix("activity-");
        // caller runs when saturated
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();

        log.info("Activity Task Executor configured - Core: {}, Max: {}, Queue: {}, KeepAlive: {}s",
                corePoolSize, maxPoolSize, queueCapacity, keepAliveSeconds);

        return executor;
    }

    @Override
    public Executor getAsyncExecutor() {
        return activityTaskExecutor();
    }

    @Override
    public AsyncUncaughtExceptionHandler getAsyncUncaughtExceptionHandler() {
        return (ex, method, params) -> log.error("Uncaught exception in async method: {}.{}() with parameters: {}",
                method.getDeclaringClass().getSimpleName(),
                method.getName(),
                Arrays.toString(params), ex);
    }
}
