package com.github.yoep.paging.core.environment;

import lombok.extern.slf4j.Slf4j;

import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;

/**
 * A {@link PlatformProvider} which uses a single dedicated thread as renderer.
 * This provider can be used by applications which don't run on a UI toolkit thread.
 */
@Slf4j
public class SingleThreadPlatformProvider implements PlatformProvider, AutoCloseable {
    static final String THREAD_NAME = "paging-renderer";

    private final ExecutorService executorService;
    private volatile Thread rendererThread;

    public SingleThreadPlatformProvider() {
        this.executorService = Executors.newSingleThreadExecutor(runnable -> {
            var thread = new Thread(runnable, THREAD_NAME);
            thread.setDaemon(true);
            rendererThread = thread;
            return thread;
        });
    }

    /**
     * Check if the current thread is the renderer thread of this provider.
     *
     * @return Returns true when invoked from the renderer thread, else false.
     */
    public boolean isRendererThread() {
        return Thread.currentThread() == rendererThread;
    }

    @Override
    public void runOnRenderer(Runnable runnable) {
        Objects.requireNonNull(runnable, "runnable cannot be null");
        try {
            executorService.execute(() -> executeRunnable(runnable));
        } catch (RejectedExecutionException ex) {
            log.debug("Renderer has been shut down, ignoring action {}", runnable);
        }
    }

    @Override
    public void close() {
        log.debug("Shutting down the renderer thread");
        executorService.shutdownNow();
    }

    private void executeRunnable(Runnable runnable) {
        try {
            runnable.run();
        } catch (Exception ex) {
            log.error(ex.getMessage(), ex);
        }
    }
}
