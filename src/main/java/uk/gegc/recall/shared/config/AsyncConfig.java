package uk.gegc.recall.shared.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.aop.interceptor.AsyncUncaughtExceptionHandler;
import org.springframework.aop.interceptor.SimpleAsyncUncaughtExceptionHandler;
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
 * Thread pools for work that must never run on a request-serving thread.
 *
 * <p>The generation executor runs deferred job steps, each of which blocks on at most one
 * content-generation call. The timeout executor bounds those calls.
 */
@Configuration
@EnableAsync
@Slf4j
public class AsyncConfig implements AsyncConfigurer {

    @Value("${async.generation.core-pool-size:4}")
    private int generationCorePoolSize;

    @Value("${async.generation.max-pool-size:8}")
    private int generationMaxPoolSize;

    @Value("${async.generation.queue-capacity:100}")
    private int generationQueueCapacity;

    @Value("${async.generation.keep-alive-seconds:60}")
    private int generationKeepAliveSeconds;

    @Value("${async.ai-call.pool-size:8}")
    private int aiCallPoolSize;

    /**
     * Executor that runs job pipeline steps scheduled by the job step scheduler.
     */
    @Bean(name = "generationTaskExecutor")
    public ThreadPoolTaskExecutor generationTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(generationCorePoolSize);
        executor.setMaxPoolSize(generationMaxPoolSize);
        executor.setQueueCapacity(generationQueueCapacity);
        executor.setKeepAliveSeconds(generationKeepAliveSeconds);
        executor.setThreadNamePrefix("job-step-");

        // Caller runs the step if the queue is full
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());

        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();

        log.info("Generation Task Executor configured - Core: {}, Max: {}, Queue: {}, KeepAlive: {}s",
                generationCorePoolSize, generationMaxPoolSize, generationQueueCapacity, generationKeepAliveSeconds);

        return executor;
    }

    /**
     * Executor the AI client submits model calls to so that callers can wait with a hard timeout.
     */
    @Bean(name = "aiCallExecutor")
    public ThreadPoolTaskExecutor aiCallExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(aiCallPoolSize);
        executor.setMaxPoolSize(aiCallPoolSize);
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix("ai-call-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();

        log.info("AI Call Executor configured - Pool: {}", aiCallPoolSize);
        return executor;
    }

    @Override
    public Executor getAsyncExecutor() {
        return generationTaskExecutor();
    }

    @Override
    public AsyncUncaughtExceptionHandler getAsyncUncaughtExceptionHandler() {
        return new SimpleAsyncUncaughtExceptionHandler() {
            @Override
            public void handleUncaughtException(Throwable ex, java.lang.reflect.Method method, Object... params) {
                log.error("Uncaught exception in async method: {}.{}() with parameters: {}",
                        method.getDeclaringClass().getSimpleName(),
                        method.getName(),
                        Arrays.toString(params), ex);
                super.handleUncaughtException(ex, method, params);
            }
        };
    }
}
