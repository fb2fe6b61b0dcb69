package com.ai.codeindex.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class RetrievalConfig {

    /**
     * Runs the lexical and vector branches of a query side by side.
     */
    @Bean(destroyMethod = "shutdownNow")
    ExecutorService searchExecutor(RetrievalProperties properties) {
        AtomicInteger count = new AtomicInteger();
        return Executors.newFixedThreadPool(Math.max(2, properties.getThreads()), r -> {
            Thread t = new Thread(r, "search-branch-" + count.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}
