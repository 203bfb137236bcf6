package com.jobhost.service;

import com.jobhost.exception.MissingRequiredParameterException;
import com.jobhost.model.ParameterDefinition;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Computes the effective parameters of a firing. For each definition the job's own value wins
 * when non-empty, then the definition's default when non-empty; otherwise a required parameter
 * fails and an optional one is left out.
 */
@Component
@RequiredArgsConstructor
public class ParameterResolver {

    private final ParameterTypeRegistry typeRegistry;

    public Map<String, Object> resolve(Collection<ParameterDefinition> definitions, Map<String, String> jobValues) {
        Map<String, Object> resolved = new LinkedHashMap<>();
        for (ParameterDefinition definition : definitions) {
            String raw = jobValues.get(definition.getName());
            if (isEmpty(raw)) {
                raw = definition.getDefaultValue();
            }
            if (isEmpty(raw)) {
                if (definition.isRequired()) {
                    throw new MissingRequiredParameterException(
                            "Required parameter '" + definition.getName() + "' has no value and no default");
                }
                continue;
            }
            Object value = typeRegistry.convert(raw, definition.getType());
            if (value != null) {
                resolved.put(definition.getName(), value);
            }
        }
        return resolved;
    }

    private static boolean isEmpty(String value) {
        return value == null || value.isEmpty();
    }
}
