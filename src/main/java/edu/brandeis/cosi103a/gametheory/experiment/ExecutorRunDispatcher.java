package edu.brandeis.cosi103a.gametheory.experiment;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import jakarta.annotation.PreDestroy;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Dispatches run workers onto a fixed thread pool.
 */
@Component
public class ExecutorRunDispatcher implements RunDispatcher {

    private final ExecutorService executorService;

    public ExecutorRunDispatcher(@Value("${experiment.worker-pool-size:4}") int poolSize) {
        this.executorService = Executors.newFixedThreadPool(Math.max(1, poolSize),
            new ThreadFactoryBuilder().setNameFormat("run-worker-%d").setDaemon(true).build());
    }

    @Override
    public void dispatch(Runnable task) {
        executorService.execute(task);
    }

    /**
     * Shuts down the worker pool. Runs still executing get ten seconds to finish.
     */
    @PreDestroy
    public void shutdown() {
        executorService.shutdown();
        try {
            if (!executorService.awaitTermination(10, TimeUnit.SECONDS)) {
                executorService.shutdownNow();
            }
        } catch (InterruptedException e) {
            executorService.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
