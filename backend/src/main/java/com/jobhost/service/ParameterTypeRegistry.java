package com.jobhost.service;

import com.jobhost.exception.ParameterConversionException;
import com.jobhost.exception.UnsupportedParameterTypeException;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Resolves stored type tags to {@link ParameterType}s and converts string-encoded values.
 * Stateless; empty or missing raw values convert to {@code null}, meaning "absent".
 */
@Component
public class ParameterTypeRegistry {

    private static final Map<String, ParameterType> BY_TAG = Arrays.stream(ParameterType.values())
            .collect(Collectors.toMap(ParameterType::tag, t -> t, (a, b) -> a, LinkedHashMap::new));

    public Set<String> supportedTags() {
        return Collections.unmodifiableSet(BY_TAG.keySet());
    }

    public boolean isSupported(String tag) {
        return tag != null && BY_TAG.containsKey(tag);
    }

    public ParameterType resolve(String tag) {
        ParameterType type = tag == null ? null : BY_TAG.get(tag);
        if (type == null) {
            throw new UnsupportedParameterTypeException(tag, String.join(", ", BY_TAG.keySet()));
        }
        return type;
    }

    public Optional<ParameterType> forJavaType(Class<?> javaType) {
        return javaType == null ? Optional.empty() : Optional.ofNullable(BY_TAG.get(javaType.getName()));
    }

    public Object convert(String rawValue, String tag) {
        return convert(rawValue, resolve(tag));
    }

    public Object convert(String rawValue, ParameterType type) {
        if (rawValue == null || rawValue.isEmpty()) {
            return null;
        }
        try {
            return type.parse(rawValue);
        } catch (RuntimeException e) {
            throw new ParameterConversionException(rawValue, type.tag(), e);
        }
    }
}
