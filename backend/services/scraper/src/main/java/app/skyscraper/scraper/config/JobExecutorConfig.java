package app.skyscraper.scraper.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class JobExecutorConfig {

    static final int DEFAULT_WORKER_THREADS = 4;
    static final int DEFAULT_QUEUE_CAPACITY = 100;

    /**
     * Fixed worker pool with a bounded backlog. Submissions beyond the backlog are rejected
     * with {@link java.util.concurrent.RejectedExecutionException}.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService scrapeJobExecutor(ScraperJobProps props) {
        int threads = props.workerThreads() == null ? DEFAULT_WORKER_THREADS : Math.max(props.workerThreads(), 1);
        int capacity = props.queueCapacity() == null ? DEFAULT_QUEUE_CAPACITY : Math.max(props.queueCapacity(), 1);
        return new ThreadPoolExecutor(threads, threads, 0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(capacity), namedThreads("scrape-job-worker-"),
                new ThreadPoolExecutor.AbortPolicy());
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        };
    }
}
