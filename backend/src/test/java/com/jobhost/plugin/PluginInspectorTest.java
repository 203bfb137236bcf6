package com.jobhost.plugin;

import com.jobhost.config.JobHostProperties;
import com.jobhost.exception.NoEntryTypeFoundException;
import com.jobhost.exception.ParameterConversionException;
import com.jobhost.exception.UnsupportedParameterTypeException;
import com.jobhost.model.ParameterDefinition;
import com.jobhost.plugin.fixtures.BadDefaultJob;
import com.jobhost.plugin.fixtures.CountingJob;
import com.jobhost.plugin.fixtures.DuplicateParameterJob;
import com.jobhost.plugin.fixtures.Helper;
import com.jobhost.plugin.fixtures.UnsupportedTypeJob;
import com.jobhost.service.ParameterTypeRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;

class PluginInspectorTest {

    @TempDir
    Path tempDir;

    private JarPluginLoader loader;
    private PluginInspector inspector;

    @BeforeEach
    void setUp() {
        loader = spy(new JarPluginLoader(new JobHostProperties(
                new JobHostProperties.Artifacts(tempDir.toString()),
                new JobHostProperties.Scheduler(false),
                new JobHostProperties.Plugins(List.of()))));
        inspector = new PluginInspector(loader, new ParameterTypeRegistry());
    }

    @Test
    void inspect_readsEntryTypeAndParameterDefinitions() throws Exception {
        PluginInspector.Inspection inspection = inspector.inspect(unitOf(CountingJob.class, Helper.class));

        assertEquals(CountingJob.class.getName(), inspection.entryType());
        Map<String, ParameterDefinition> byName = inspection.parameterDefinitions().stream()
                .collect(Collectors.toMap(ParameterDefinition::getName, Function.identity()));
        assertEquals(3, byName.size());

        ParameterDefinition count = byName.get("count");
        assertEquals("int", count.getType());
        assertTrue(count.isRequired());
        assertNull(count.getDefaultValue());
        assertEquals("How many to add", count.getDescription());

        ParameterDefinition label = byName.get("label");
        assertEquals("java.lang.String", label.getType());
        assertFalse(label.isRequired());
        assertEquals("hello", label.getDefaultValue());
        assertNull(label.getDescription());

        assertEquals("java.time.LocalDate", byName.get("runDate").getType());
    }

    @Test
    void inspect_rejectsUnsupportedParameterType() throws Exception {
        assertThrows(UnsupportedParameterTypeException.class,
                () -> inspector.inspect(unitOf(UnsupportedTypeJob.class)));
    }

    @Test
    void inspect_rejectsDefaultThatDoesNotConvert() throws Exception {
        assertThrows(ParameterConversionException.class,
                () -> inspector.inspect(unitOf(BadDefaultJob.class)));
    }

    @Test
    void inspect_rejectsDuplicateParameterNames() throws Exception {
        assertThrows(IllegalArgumentException.class,
                () -> inspector.inspect(unitOf(DuplicateParameterJob.class)));
    }

    @Test
    void inspect_closesContextWhenLoadingFails() throws Exception {
        assertThrows(NoEntryTypeFoundException.class, () -> inspector.inspect(unitOf(Helper.class)));

        verify(loader).closeContext(any(PluginContext.class));
    }

    private LoadableUnit unitOf(Class<?>... classes) throws Exception {
        return new LoadableUnit(TestArtifacts.writeJar(tempDir.resolve("job.jar"), classes), List.of());
    }
}
