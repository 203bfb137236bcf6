package com.jobhost.plugin;

import com.jobhost.api.ScheduledJob;

import java.util.List;
import java.util.stream.Stream;

/**
 * Parent of every plugin class loader. Exposes only the JDK, the job API, SLF4J and any extra
 * configured prefixes from the host; every other class must come from the artifact itself, so
 * each context gets its own copy of the plugin's classes and their static state.
 */
final class RestrictedParentClassLoader extends ClassLoader {

    private static final List<String> BASE_PACKAGES = List.of(
            "java.", "javax.", "com.jobhost.api.", "org.slf4j.");

    private final ClassLoader hostLoader;
    private final List<String> allowedPackages;

    RestrictedParentClassLoader(List<String> extraPackages) {
        super(null);
        this.hostLoader = ScheduledJob.class.getClassLoader();
        this.allowedPackages = extraPackages == null || extraPackages.isEmpty()
                ? BASE_PACKAGES
                : Stream.concat(BASE_PACKAGES.stream(), extraPackages.stream()).toList();
    }

    @Override
    protected Class<?> loadClass(String name, boolean resolve) throws ClassNotFoundException {
        synchronized (getClassLoadingLock(name)) {
            if (!isAllowed(name)) {
                throw new ClassNotFoundException("Access denied: " + name);
            }
            Class<?> c = hostLoader.loadClass(name);
            if (resolve) {
                resolveClass(c);
            }
            return c;
        }
    }

    boolean isAllowed(String name) {
        for (String prefix : allowedPackages) {
            if (name.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }
}
