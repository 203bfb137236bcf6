package com.jobhost.plugin;

import com.jobhost.api.ScheduledJob;
import com.jobhost.config.JobHostProperties;
import com.jobhost.exception.ArtifactLoadException;
import com.jobhost.exception.EntryInstantiationException;
import com.jobhost.exception.NoEntryTypeFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Modifier;
import java.net.URLClassLoader;
import java.util.ArrayList;
import java.util.List;
import java.util.jar.JarEntry;
import java.util.jar.JarFile;

@Component
@Slf4j
public class JarPluginLoader implements PluginLoader {

    private final List<String> extraPackages;

    public JarPluginLoader(JobHostProperties properties) {
        this.extraPackages = properties.plugins().allowedPackages();
    }

    @Override
    public PluginContext openContext() {
        PluginContext context = new PluginContext();
        log.debug("Opened {}", context);
        return context;
    }

    @Override
    public Class<? extends ScheduledJob> load(PluginContext context, LoadableUnit unit) {
        URLClassLoader loader = new URLClassLoader(
                "plugin-" + context.getId(), unit.urls(), new RestrictedParentClassLoader(extraPackages));
        context.attach(loader);

        List<Class<? extends ScheduledJob>> candidates = new ArrayList<>();
        for (String className : listClassNames(unit)) {
            Class<?> type;
            try {
                type = Class.forName(className, false, loader);
            } catch (ClassNotFoundException | LinkageError e) {
                log.debug("Skipping {} in {}: {}", className, unit.mainJar().getFileName(), e.toString());
                continue;
            }
            if (isEntryType(type)) {
                candidates.add(type.asSubclass(ScheduledJob.class));
            }
        }

        if (candidates.isEmpty()) {
            throw new NoEntryTypeFoundException("No concrete type implementing " + ScheduledJob.class.getName()
                    + " found in " + unit.mainJar().getFileName());
        }
        if (candidates.size() > 1) {
            log.warn("Found {} entry types in {}, using {}: {}", candidates.size(), unit.mainJar().getFileName(),
                    candidates.get(0).getName(), candidates.stream().map(Class::getName).toList());
        }
        return candidates.get(0);
    }

    @Override
    public ScheduledJob instantiate(Class<? extends ScheduledJob> entryType) {
        try {
            return entryType.getDeclaredConstructor().newInstance();
        } catch (InvocationTargetException e) {
            throw new EntryInstantiationException("Constructor of " + entryType.getName() + " failed: "
                    + e.getCause(), e.getCause());
        } catch (ReflectiveOperationException | LinkageError e) {
            throw new EntryInstantiationException("Cannot instantiate " + entryType.getName() + ": " + e, e);
        }
    }

    @Override
    public void closeContext(PluginContext context) {
        if (context.isClosed()) {
            return;
        }
        URLClassLoader loader = context.getClassLoader();
        context.markClosed();
        if (loader != null) {
            try {
                loader.close();
            } catch (IOException e) {
                log.warn("Failed to close class loader of {}: {}", context, e.getMessage());
            }
        }
        log.debug("Closed {}", context);
    }

    private static boolean isEntryType(Class<?> type) {
        return ScheduledJob.class.isAssignableFrom(type)
                && !type.isInterface()
                && !Modifier.isAbstract(type.getModifiers())
                && !type.isAnonymousClass()
                && !type.isLocalClass();
    }

    /** Class names of the main jar in name order, so the choice among several entry types is stable. */
    private static List<String> listClassNames(LoadableUnit unit) {
        List<String> names = new ArrayList<>();
        try (JarFile jar = new JarFile(unit.mainJar().toFile())) {
            jar.stream()
                    .map(JarEntry::getName)
                    .filter(n -> n.endsWith(".class"))
                    .filter(n -> !n.endsWith("module-info.class") && !n.endsWith("package-info.class"))
                    .filter(n -> !n.startsWith("META-INF/"))
                    .map(n -> n.substring(0, n.length() - ".class".length()).replace('/', '.'))
                    .sorted()
                    .forEach(names::add);
        } catch (IOException e) {
            throw new ArtifactLoadException("Cannot read " + unit.mainJar() + ": " + e.getMessage(), e);
        }
        return names;
    }
}
