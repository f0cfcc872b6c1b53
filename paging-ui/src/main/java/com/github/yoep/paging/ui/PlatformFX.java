package com.github.yoep.paging.ui;

import com.github.yoep.paging.core.environment.PlatformProvider;
import javafx.application.Platform;

import java.util.Objects;

/**
 * {@link PlatformProvider} which uses the JavaFX application thread as renderer.
 */
public class PlatformFX implements PlatformProvider {
    @Override
    public void runOnRenderer(Runnable runnable) {
        Objects.requireNonNull(runnable, "runnable cannot be null");
        if (Platform.isFxApplicationThread()) {
            runnable.run();
        } else {
            Platform.runLater(runnable);
        }
    }
}
