package com.jobhost.plugin;

import lombok.Getter;

import java.net.URLClassLoader;
import java.util.UUID;

/**
 * Disposable isolation boundary for one firing. Holds at most one class loader; once closed it
 * cannot be loaded into again.
 */
@Getter
public final class PluginContext {

    private final UUID id = UUID.randomUUID();
    private URLClassLoader classLoader;
    private volatile boolean closed;

    PluginContext() {
    }

    void attach(URLClassLoader loader) {
        if (closed) {
            throw new IllegalStateException("Plugin context " + id + " is closed");
        }
        if (classLoader != null) {
            throw new IllegalStateException("Plugin context " + id + " already holds a loaded artifact");
        }
        this.classLoader = loader;
    }

    void markClosed() {
        closed = true;
        classLoader = null;
    }

    @Override
    public String toString() {
        return "PluginContext[" + id + (closed ? ", closed" : "") + "]";
    }
}
