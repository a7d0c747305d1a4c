package com.phylotree.service;

import com.phylotree.model.TypedValue;
import com.phylotree.model.ValueKind;

/**
 * Maps a value's kind to the XML Schema datatype written in a property's {@code datatype} attribute.
 */
public final class XsdDatatypeResolver {

    public static final String FALLBACK = "xsd:string";

    private XsdDatatypeResolver() {
    }

    public static String datatypeOf(TypedValue value) {
        return value == null ? FALLBACK : datatypeOf(value.kind());
    }

    public static String datatypeOf(ValueKind kind) {
        if (kind == null) {
            return FALLBACK;
        }
        return switch (kind) {
            case BOOLEAN -> "xsd:boolean";
            case BYTE -> "xsd:byte";
            case UNSIGNED_BYTE -> "xsd:unsignedByte";
            case UNSIGNED_SHORT -> "xsd:unsignedShort";
            case SHORT -> "xsd:short";
            case INT -> "xsd:integer";
            case UNSIGNED_INT -> "xsd:unsignedInt";
            case LONG -> "xsd:long";
            case UNSIGNED_LONG -> "xsd:unsignedLong";
            case FLOAT -> "xsd:float";
            case DOUBLE -> "xsd:double";
            case STRING, OBJECT -> FALLBACK;
        };
    }
}
