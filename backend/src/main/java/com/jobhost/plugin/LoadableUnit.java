package com.jobhost.plugin;

import com.jobhost.exception.ArtifactLoadException;

import java.net.MalformedURLException;
import java.net.URL;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/** The jar holding the entry type plus the jars it depends on. */
public record LoadableUnit(Path mainJar, List<Path> dependencyJars) {

    public LoadableUnit {
        dependencyJars = List.copyOf(dependencyJars);
    }

    public URL[] urls() {
        List<URL> urls = new ArrayList<>(dependencyJars.size() + 1);
        try {
            urls.add(mainJar.toUri().toURL());
            for (Path jar : dependencyJars) {
                urls.add(jar.toUri().toURL());
            }
        } catch (MalformedURLException e) {
            throw new ArtifactLoadException("Invalid artifact path: " + e.getMessage(), e);
        }
        return urls.toArray(URL[]::new);
    }
}
