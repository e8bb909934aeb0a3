package com.catalog.config;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class CatalogConfig {

    /**
     * The pool that builds the parameters and responses of exported operations.
     *
     * @param parallelism Number of worker threads.
     * @return A fixed pool of daemon threads, shut down with the context.
     */
    @Bean(name = "exportExecutor", destroyMethod = "shutdown")
    public ExecutorService exportExecutor(@Value("${catalog.export.parallelism:4}") int parallelism) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(Math.max(1, parallelism), runnable -> {
            Thread thread = new Thread(runnable, "catalog-export-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }
}
