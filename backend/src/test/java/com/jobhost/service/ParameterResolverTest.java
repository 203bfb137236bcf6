package com.jobhost.service;

import com.jobhost.exception.MissingRequiredParameterException;
import com.jobhost.exception.ParameterConversionException;
import com.jobhost.model.ParameterDefinition;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ParameterResolverTest {

    private final ParameterResolver resolver = new ParameterResolver(new ParameterTypeRegistry());

    @Test
    void jobValueWinsOverDefault() {
        Map<String, Object> resolved = resolver.resolve(
                List.of(definition("retries", "int", false, "3")),
                Map.of("retries", "5"));

        assertEquals(Map.of("retries", 5), resolved);
    }

    @Test
    void defaultAppliesWhenJobValueMissingOrEmpty() {
        Map<String, String> values = new HashMap<>();
        values.put("retries", "");
        values.put("label", null);

        Map<String, Object> resolved = resolver.resolve(
                List.of(definition("retries", "int", true, "3"),
                        definition("label", "java.lang.String", false, "nightly")),
                values);

        assertEquals(3, resolved.get("retries"));
        assertEquals("nightly", resolved.get("label"));
    }

    @Test
    void optionalWithoutValueOrDefaultIsLeftOut() {
        Map<String, Object> resolved = resolver.resolve(
                List.of(definition("since", "java.time.LocalDate", false, null)),
                Map.of());

        assertTrue(resolved.isEmpty());
        assertFalse(resolved.containsKey("since"));
    }

    @Test
    void requiredWithoutValueOrDefaultFails() {
        MissingRequiredParameterException e = assertThrows(MissingRequiredParameterException.class,
                () -> resolver.resolve(List.of(definition("target", "java.lang.String", true, "")), Map.of()));
        assertTrue(e.getMessage().contains("target"));
    }

    @Test
    void unconvertibleValueFails() {
        assertThrows(ParameterConversionException.class,
                () -> resolver.resolve(List.of(definition("retries", "int", false, null)), Map.of("retries", "x")));
    }

    @Test
    void valuesWithoutDefinitionAreIgnored() {
        Map<String, Object> resolved = resolver.resolve(
                List.of(definition("retries", "java.lang.Integer", false, null)),
                Map.of("retries", "1", "stale", "value"));

        assertEquals(Map.of("retries", 1), resolved);
    }

    static ParameterDefinition definition(String name, String type, boolean required, String defaultValue) {
        return ParameterDefinition.builder()
                .name(name)
                .type(type)
                .required(required)
                .defaultValue(defaultValue)
                .build();
    }
}
