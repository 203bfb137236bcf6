package com.jobhost.service;

import com.jobhost.exception.ParameterConversionException;
import com.jobhost.exception.UnsupportedParameterTypeException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ParameterTypeRegistryTest {

    private final ParameterTypeRegistry registry = new ParameterTypeRegistry();

    @Test
    void supportedTags_coverPrimitiveAndBoxedForms() {
        assertEquals(13, registry.supportedTags().size());
        assertTrue(registry.isSupported("int"));
        assertTrue(registry.isSupported("java.lang.Integer"));
        assertTrue(registry.isSupported("java.time.LocalDateTime"));
        assertTrue(registry.isSupported("java.util.UUID"));
        assertFalse(registry.isSupported("java.math.BigDecimal"));
        assertFalse(registry.isSupported(null));
    }

    @Test
    void resolve_distinguishesNullableVariants() {
        assertSame(ParameterType.INT, registry.resolve("int"));
        assertFalse(registry.resolve("int").isNullable());
        assertSame(ParameterType.NULLABLE_INT, registry.resolve("java.lang.Integer"));
        assertTrue(registry.resolve("java.lang.Integer").isNullable());
        assertSame(ParameterType.CHAR, registry.resolve("char"));
    }

    @Test
    void resolve_rejectsUnknownTag() {
        UnsupportedParameterTypeException e = assertThrows(UnsupportedParameterTypeException.class,
                () -> registry.resolve("java.math.BigDecimal"));
        assertTrue(e.getMessage().contains("java.lang.String"));
    }

    @Test
    void forJavaType_mapsDeclaredClasses() {
        assertEquals(Optional.of(ParameterType.LONG), registry.forJavaType(long.class));
        assertEquals(Optional.of(ParameterType.NULLABLE_DOUBLE), registry.forJavaType(Double.class));
        assertEquals(Optional.empty(), registry.forJavaType(Object.class));
    }

    @Test
    void convert_parsesEveryType() {
        UUID id = UUID.randomUUID();
        assertEquals("plain text", registry.convert("plain text", "java.lang.String"));
        assertEquals('x', registry.convert("x", "char"));
        assertEquals(42, registry.convert(" 42 ", "int"));
        assertEquals(-7, registry.convert("-7", "java.lang.Integer"));
        assertEquals(9_000_000_000L, registry.convert("9000000000", "long"));
        assertEquals(2.5, registry.convert("2.5", "double"));
        assertEquals(LocalDateTime.of(2024, 3, 1, 8, 30), registry.convert("2024-03-01T08:30", "java.time.LocalDateTime"));
        assertEquals(LocalTime.of(23, 59, 1), registry.convert("23:59:01", "java.time.LocalTime"));
        assertEquals(LocalDate.of(2024, 2, 29), registry.convert("2024-02-29", "java.time.LocalDate"));
        assertEquals(id, registry.convert(id.toString(), "java.util.UUID"));
    }

    @Test
    void convert_treatsEmptyAsAbsent() {
        assertNull(registry.convert("", "int"));
        assertNull(registry.convert(null, "java.lang.Integer"));
        assertNull(registry.convert("", "java.lang.String"));
    }

    @Test
    void convert_keepsStringWhitespace() {
        assertEquals("  padded ", registry.convert("  padded ", "java.lang.String"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"abc", "1.5", "99999999999"})
    void convert_rejectsMalformedInt(String raw) {
        ParameterConversionException e = assertThrows(ParameterConversionException.class,
                () -> registry.convert(raw, "int"));
        assertEquals(raw, e.getRawValue());
        assertEquals("int", e.getTargetType());
    }

    @Test
    void convert_rejectsMultiCharacterChar() {
        assertThrows(ParameterConversionException.class, () -> registry.convert("ab", "char"));
    }

    @Test
    void convert_rejectsMalformedDateAndUuid() {
        assertThrows(ParameterConversionException.class, () -> registry.convert("2024-13-01", "java.time.LocalDate"));
        assertThrows(ParameterConversionException.class, () -> registry.convert("not-a-uuid", "java.util.UUID"));
    }
}
