package com.example.signalrag.infrastructure.llm;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;
import org.springframework.context.annotation.AnnotationConfigApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryListener;
import org.springframework.retry.annotation.EnableRetry;

/**
 * Runs {@link LlmClient} behind the Spring Retry proxy and counts failed attempts.
 */
class LlmClientRetryTest {

    @Test
    void missingApiKeyIsNotRetried() {
        try (AnnotationConfigApplicationContext ctx = new AnnotationConfigApplicationContext(NoKeyConfig.class)) {
            LlmClient client = ctx.getBean(LlmClient.class);
            AttemptCounter counter = ctx.getBean(AttemptCounter.class);

            assertThrows(LlmNotConfiguredException.class, () -> client.complete("hello"));
            assertEquals(1, counter.errors.get());
        }
    }

    @Test
    void transportFailureIsRetried() {
        try (AnnotationConfigApplicationContext ctx = new AnnotationConfigApplicationContext(KeyedConfig.class)) {
            LlmClient client = ctx.getBean(LlmClient.class);
            AttemptCounter counter = ctx.getBean(AttemptCounter.class);

            assertThrows(IllegalStateException.class, () -> client.complete("hello"));
            // default signalrag.llm.retries=2
            assertEquals(3, counter.errors.get());
        }
    }

    @Configuration
    @EnableRetry
    static class NoKeyConfig {

        @Bean
        LlmClient llmClient() {
            return new LlmClient(new ObjectMapper(), "http://localhost:1", "", "test-model", 0.1, 100, 200, 200);
        }

        @Bean
        AttemptCounter attemptCounter() {
            return new AttemptCounter();
        }
    }

    @Configuration
    @EnableRetry
    static class KeyedConfig {

        @Bean
        LlmClient llmClient() {
            return new LlmClient(new ObjectMapper(), "http://localhost:1", "sk-test", "test-model", 0.1, 100, 200, 200);
        }

        @Bean
        AttemptCounter attemptCounter() {
            return new AttemptCounter();
        }
    }

    static class AttemptCounter implements RetryListener {
        private final AtomicInteger errors = new AtomicInteger();

        @Override
        public <T, E extends Throwable> void onError(RetryContext context, RetryCallback<T, E> callback,
                                                     Throwable throwable) {
            errors.incrementAndGet();
        }
    }
}
