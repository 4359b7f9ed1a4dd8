package software.amazon.pattern.scanner;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Worker pools for the build and search phases, and the run-to-completion barrier both phases use.
 */
final class Workers {

    private Workers() { }

    static ExecutorService newFixedPool(final int workerCount, final String namePrefix) {
        return new ThreadPoolExecutor(workerCount, workerCount,
                0L, TimeUnit.MILLISECONDS, new LinkedBlockingQueue<Runnable>(),
                new NamedDaemonThreadFactory(namePrefix));
    }

    /**
     * Runs all tasks and waits for every one of them. Results come back in task order. If a task failed, its
     * exception is rethrown as is when unchecked and wrapped otherwise.
     */
    static <T> List<T> invokeAll(final ExecutorService executor, final List<? extends Callable<T>> tasks) {
        final List<Future<T>> futures;
        try {
            futures = executor.invokeAll(tasks);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for workers", e);
        }

        final List<T> results = new ArrayList<>(futures.size());
        for (Future<T> future : futures) {
            try {
                results.add(future.get());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while waiting for workers", e);
            } catch (ExecutionException e) {
                final Throwable cause = e.getCause();
                if (cause instanceof RuntimeException) {
                    throw (RuntimeException) cause;
                }
                if (cause instanceof Error) {
                    throw (Error) cause;
                }
                throw new IllegalStateException("Worker failed", cause);
            }
        }
        return results;
    }

    private static final class NamedDaemonThreadFactory implements ThreadFactory {
        private final String namePrefix;
        private final AtomicInteger count = new AtomicInteger();

        NamedDaemonThreadFactory(final String namePrefix) {
            this.namePrefix = namePrefix;
        }

        @Override
        public Thread newThread(final Runnable runnable) {
            final Thread thread = new Thread(runnable, namePrefix + "-" + count.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        }
    }
}
