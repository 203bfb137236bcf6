package com.jobhost.plugin;

import com.jobhost.api.JobParameter;
import com.jobhost.api.ScheduledJob;
import com.jobhost.exception.UnsupportedParameterTypeException;
import com.jobhost.model.ParameterDefinition;
import com.jobhost.service.ParameterType;
import com.jobhost.service.ParameterTypeRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Reads an artifact's entry type and its {@link JobParameter} declarations once, when a version
 * is registered.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PluginInspector {

    private final PluginLoader pluginLoader;
    private final ParameterTypeRegistry typeRegistry;

    public record Inspection(String entryType, List<ParameterDefinition> parameterDefinitions) {
    }

    public Inspection inspect(LoadableUnit unit) {
        PluginContext context = pluginLoader.openContext();
        try {
            Class<? extends ScheduledJob> entryType = pluginLoader.load(context, unit);
            List<ParameterDefinition> definitions = readDefinitions(entryType);
            log.info("Inspected {}: entry type {}, {} parameter(s)",
                    unit.mainJar().getFileName(), entryType.getName(), definitions.size());
            return new Inspection(entryType.getName(), definitions);
        } finally {
            pluginLoader.closeContext(context);
        }
    }

    private List<ParameterDefinition> readDefinitions(Class<?> entryType) {
        List<ParameterDefinition> definitions = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (JobParameter declared : entryType.getAnnotationsByType(JobParameter.class)) {
            if (!seen.add(declared.name())) {
                throw new IllegalArgumentException("Parameter '" + declared.name() + "' is declared more than once on "
                        + entryType.getName());
            }
            ParameterType type = typeRegistry.forJavaType(declared.type())
                    .orElseThrow(() -> new UnsupportedParameterTypeException(declared.type().getName(),
                            String.join(", ", typeRegistry.supportedTags())));
            String defaultValue = declared.defaultValue().isEmpty() ? null : declared.defaultValue();
            // fail registration rather than every firing
            typeRegistry.convert(defaultValue, type);
            definitions.add(ParameterDefinition.builder()
                    .name(declared.name())
                    .type(type.tag())
                    .required(declared.required())
                    .defaultValue(defaultValue)
                    .description(declared.description().isEmpty() ? null : declared.description())
                    .build());
        }
        return definitions;
    }
}
