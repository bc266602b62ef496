package com.example.musiclibrary.common.config;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import javax.annotation.PreDestroy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TaskExecutionConfig {

    /** Debouncer and synchronizer loops, one long-lived thread each. */
    private static final int PIPELINE_STAGES = 2;

    private ExecutorService pipelineExecutor;
    private ExecutorService rescanExecutor;

    @Bean
    public ExecutorService pipelineExecutor() {
        this.pipelineExecutor = new ThreadPoolExecutor(
                PIPELINE_STAGES,
                PIPELINE_STAGES,
                0L,
                TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(PIPELINE_STAGES),
                new NamedThreadFactory("library-pipeline-"),
                new ThreadPoolExecutor.AbortPolicy());
        return this.pipelineExecutor;
    }

    @Bean
    public ExecutorService rescanExecutor() {
        this.rescanExecutor = new ThreadPoolExecutor(
                1,
                1,
                60L,
                TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(1),
                new NamedThreadFactory("library-rescan-"),
                new ThreadPoolExecutor.AbortPolicy());
        return this.rescanExecutor;
    }

    @PreDestroy
    public void shutdown() {
        if (pipelineExecutor != null) {
            pipelineExecutor.shutdownNow();
        }
        if (rescanExecutor != null) {
            rescanExecutor.shutdownNow();
        }
    }

    private static class NamedThreadFactory implements ThreadFactory {

        private final AtomicInteger idx = new AtomicInteger(1);
        private final String prefix;

        private NamedThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, prefix + idx.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        }
    }
}
