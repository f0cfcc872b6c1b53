package com.github.yoep.paging.core.environment;

/**
 * Provider of the presentation thread of the hosting application.
 * All mutations of a paginated collection are executed through this provider.
 */
@FunctionalInterface
public interface PlatformProvider {
    /**
     * Run the given action on the renderer (presentation) thread.
     * Actions must be executed in the order in which they have been submitted.
     *
     * @param runnable The action to execute.
     */
    void runOnRenderer(Runnable runnable);
}
