package com.phillippitts.vani.config;

import com.phillippitts.vani.config.properties.SpeechExecutorProperties;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SpeechExecutorConfigTest {

    @AfterEach
    void tearDown() {
        ThreadContext.clearAll();
    }

    @Test
    void shouldCreateSingleSpeakerExecutorFromDefaults() {
        Executor executor = new SpeechExecutorConfig(new SpeechExecutorProperties()).speechExecutor();

        assertThat(executor).isInstanceOf(ThreadPoolTaskExecutor.class);
        ThreadPoolTaskExecutor pool = (ThreadPoolTaskExecutor) executor;
        assertThat(pool.getCorePoolSize()).isEqualTo(1);
        assertThat(pool.getMaxPoolSize()).isEqualTo(1);
        assertThat(pool.getThreadNamePrefix()).isEqualTo("speech-");
        pool.shutdown();
    }

    @Test
    void shouldRejectWhenQueueIsFull() throws InterruptedException {
        SpeechExecutorProperties properties = new SpeechExecutorProperties();
        properties.setQueueCapacity(1);
        ThreadPoolTaskExecutor pool = (ThreadPoolTaskExecutor) new SpeechExecutorConfig(properties).speechExecutor();
        CountDownLatch release = new CountDownLatch(1);
        Runnable blocking = () -> {
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        };
        try {
            pool.execute(blocking);
            pool.execute(blocking);

            assertThatThrownBy(() -> pool.execute(blocking)).isInstanceOf(RejectedExecutionException.class);
        } finally {
            release.countDown();
            pool.shutdown();
        }
    }

    @Test
    void shouldCarryTurnIdIntoWorker() {
        TaskDecorator decorator = SpeechExecutorConfig.threadContextPropagating();
        AtomicReference<String> seen = new AtomicReference<>();
        ThreadContext.put("turnId", "abc12345");
        Runnable decorated = decorator.decorate(() -> seen.set(ThreadContext.get("turnId")));
        ThreadContext.clearAll();
        ThreadContext.put("turnId", "worker-own");

        decorated.run();

        assertThat(seen.get()).isEqualTo("abc12345");
        assertThat(ThreadContext.get("turnId")).isEqualTo("worker-own");
    }
}
