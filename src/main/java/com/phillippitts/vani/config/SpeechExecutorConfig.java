package com.phillippitts.vani.config;

import com.phillippitts.vani.config.properties.SpeechExecutorProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Executor for fire-and-forget speech synthesis.
 *
 * <p>Rejection policy: {@link ThreadPoolExecutor.AbortPolicy}. A full queue drops the reply
 * (the voice session logs it) rather than running speech on the listening thread.
 *
 * <p>MDC propagation: copies the Log4j2 ThreadContext of the turn into the speech worker so
 * synthesis logs carry the turn id.
 */
@Configuration
public class SpeechExecutorConfig {

    private final SpeechExecutorProperties properties;

    public SpeechExecutorConfig(SpeechExecutorProperties properties) {
        this.properties = properties;
    }

    @Bean(name = "speechExecutor")
    public Executor speechExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getCorePoolSize());
        executor.setMaxPoolSize(Math.max(properties.getCorePoolSize(), properties.getMaxPoolSize()));
        executor.setQueueCapacity(properties.getQueueCapacity());
        executor.setThreadNamePrefix(properties.getThreadNamePrefix());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        executor.setTaskDecorator(threadContextPropagating());
        executor.initialize();
        return executor;
    }

    static TaskDecorator threadContextPropagating() {
        return runnable -> {
            Map<String, String> contextMap = ThreadContext.getImmutableContext();
            return () -> {
                Map<String, String> previous = ThreadContext.getImmutableContext();
                try {
                    if (contextMap != null && !contextMap.isEmpty()) {
                        ThreadContext.putAll(contextMap);
                    }
                    runnable.run();
                } finally {
                    ThreadContext.clearAll();
                    if (previous != null && !previous.isEmpty()) {
                        ThreadContext.putAll(previous);
                    }
                }
            };
        };
    }
}
