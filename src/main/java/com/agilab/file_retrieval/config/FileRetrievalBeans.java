package com.agilab.file_retrieval.config;

import com.agilab.file_retrieval.exception.TransientFileCheckException;
import org.slf4j.MDC;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.Map;

/**
 * Bean configuration for the file check pipeline.
 */
@Configuration
public class FileRetrievalBeans {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * RetryTemplate for scheduler-originated checks.
     * Retries only failures classified as transient; permanent ones already failed the execution.
     */
    @Bean
    public RetryTemplate retryTemplate(FileRetrievalProperties properties) {
        return RetryTemplate.builder()
                .maxAttempts(properties.getRetryAttempts())
                .fixedBackoff(properties.getRetryDelay().toMillis())
                .retryOn(TransientFileCheckException.class)
                .build();
    }

    /**
     * Runs scheduled checks. Sized to the gate, so a permit holder always finds a thread.
     */
    @Bean
    public ThreadPoolTaskExecutor fileCheckExecutor(FileRetrievalProperties properties) {
        var executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getMaxConcurrentExecutions());
        executor.setMaxPoolSize(properties.getMaxConcurrentExecutions());
        executor.setQueueCapacity(properties.getMaxConcurrentExecutions());
        executor.setThreadNamePrefix("file-check-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }

    /**
     * Runs adapter listings so the dispatcher can bound and cancel them.
     */
    @Bean
    public ThreadPoolTaskExecutor listingExecutor(FileRetrievalProperties properties) {
        var executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getMaxConcurrentExecutions());
        executor.setMaxPoolSize(properties.getMaxConcurrentExecutions());
        executor.setQueueCapacity(properties.getMaxConcurrentExecutions());
        executor.setThreadNamePrefix("file-listing-");
        executor.setTaskDecorator(FileRetrievalBeans::withCallerMdc);
        return executor;
    }

    static Runnable withCallerMdc(Runnable task) {
        var callerContext = MDC.getCopyOfContextMap();
        return () -> {
            var previous = MDC.getCopyOfContextMap();
            setContext(callerContext);
            try {
                task.run();
            } finally {
                setContext(previous);
            }
        };
    }

    private static void setContext(Map<String, String> context) {
        if (context == null) {
            MDC.clear();
        } else {
            MDC.setContextMap(context);
        }
    }
}
