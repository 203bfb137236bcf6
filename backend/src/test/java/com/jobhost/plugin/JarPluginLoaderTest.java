package com.jobhost.plugin;

import com.jobhost.api.ScheduledJob;
import com.jobhost.config.JobHostProperties;
import com.jobhost.exception.EntryInstantiationException;
import com.jobhost.exception.NoEntryTypeFoundException;
import com.jobhost.plugin.fixtures.AbstractBaseJob;
import com.jobhost.plugin.fixtures.CountingJob;
import com.jobhost.plugin.fixtures.ExplodingConstructorJob;
import com.jobhost.plugin.fixtures.FailingJob;
import com.jobhost.plugin.fixtures.Helper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JarPluginLoaderTest {

    @TempDir
    Path tempDir;

    private JarPluginLoader loader;

    @BeforeEach
    void setUp() {
        loader = new JarPluginLoader(new JobHostProperties(
                new JobHostProperties.Artifacts(tempDir.toString()),
                new JobHostProperties.Scheduler(false),
                new JobHostProperties.Plugins(List.of())));
    }

    @Test
    void load_findsEntryTypeInsideTheArtifact() throws Exception {
        LoadableUnit unit = unitOf("counting.jar", CountingJob.class, Helper.class);
        PluginContext context = loader.openContext();
        try {
            Class<? extends ScheduledJob> entryType = loader.load(context, unit);

            assertEquals(CountingJob.class.getName(), entryType.getName());
            assertNotSame(CountingJob.class, entryType);
            assertSame(context.getClassLoader(), entryType.getClassLoader());
        } finally {
            loader.closeContext(context);
        }
    }

    @Test
    void load_givesEachContextItsOwnTypesAndStaticState() throws Exception {
        LoadableUnit unit = unitOf("counting.jar", CountingJob.class);
        PluginContext first = loader.openContext();
        PluginContext second = loader.openContext();
        try {
            Class<? extends ScheduledJob> firstType = loader.load(first, unit);
            Class<? extends ScheduledJob> secondType = loader.load(second, unit);
            assertNotSame(firstType, secondType);

            loader.instantiate(firstType).execute(TestArtifacts.context(Map.of("count", 5)));
            loader.instantiate(secondType).execute(TestArtifacts.context(Map.of("count", 2)));

            assertEquals(5, firstType.getField("total").getInt(null));
            assertEquals(2, secondType.getField("total").getInt(null));
            assertEquals(0, CountingJob.total);
        } finally {
            loader.closeContext(first);
            loader.closeContext(second);
        }
    }

    @Test
    void load_picksFirstEntryTypeByClassName() throws Exception {
        LoadableUnit unit = unitOf("two.jar", FailingJob.class, CountingJob.class);
        PluginContext context = loader.openContext();
        try {
            assertEquals(CountingJob.class.getName(), loader.load(context, unit).getName());
        } finally {
            loader.closeContext(context);
        }
    }

    @Test
    void load_failsWhenNoConcreteEntryTypeExists() throws Exception {
        LoadableUnit unit = unitOf("abstract.jar", AbstractBaseJob.class, Helper.class);
        PluginContext context = loader.openContext();
        try {
            assertThrows(NoEntryTypeFoundException.class, () -> loader.load(context, unit));
        } finally {
            loader.closeContext(context);
        }
    }

    @Test
    void load_rejectsClosedContext() throws Exception {
        LoadableUnit unit = unitOf("counting.jar", CountingJob.class);
        PluginContext context = loader.openContext();
        loader.closeContext(context);

        assertThrows(IllegalStateException.class, () -> loader.load(context, unit));
    }

    @Test
    void load_rejectsSecondLoadIntoSameContext() throws Exception {
        LoadableUnit unit = unitOf("counting.jar", CountingJob.class);
        PluginContext context = loader.openContext();
        try {
            loader.load(context, unit);
            assertThrows(IllegalStateException.class, () -> loader.load(context, unit));
        } finally {
            loader.closeContext(context);
        }
    }

    @Test
    void instantiate_wrapsConstructorFailure() throws Exception {
        LoadableUnit unit = unitOf("exploding.jar", ExplodingConstructorJob.class);
        PluginContext context = loader.openContext();
        try {
            Class<? extends ScheduledJob> entryType = loader.load(context, unit);
            EntryInstantiationException e = assertThrows(EntryInstantiationException.class,
                    () -> loader.instantiate(entryType));
            assertTrue(e.getCause() instanceof IllegalStateException);
        } finally {
            loader.closeContext(context);
        }
    }

    @Test
    void closeContext_isIdempotent() throws Exception {
        PluginContext context = loader.openContext();
        loader.load(context, unitOf("counting.jar", CountingJob.class));
        assertFalse(context.isClosed());

        loader.closeContext(context);
        loader.closeContext(context);

        assertTrue(context.isClosed());
        assertNull(context.getClassLoader());
    }

    @Test
    void restrictedParent_hidesHostClasses() {
        RestrictedParentClassLoader parent = new RestrictedParentClassLoader(List.of("com.acme.shared."));

        assertTrue(parent.isAllowed("java.util.List"));
        assertTrue(parent.isAllowed("com.jobhost.api.ScheduledJob"));
        assertTrue(parent.isAllowed("org.slf4j.Logger"));
        assertTrue(parent.isAllowed("com.acme.shared.Util"));
        assertFalse(parent.isAllowed("com.jobhost.service.JobService"));
        assertFalse(parent.isAllowed("org.springframework.context.ApplicationContext"));
        assertThrows(ClassNotFoundException.class,
                () -> parent.loadClass("com.jobhost.service.JobService"));
    }

    private LoadableUnit unitOf(String jarName, Class<?>... classes) throws Exception {
        return new LoadableUnit(TestArtifacts.writeJar(tempDir.resolve(jarName), classes), List.of());
    }
}
