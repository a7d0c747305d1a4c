package com.phylotree.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Primitive kinds a {@link TypedValue} can carry.
 * Type names follow the C-style spelling used by most tree toolkits ("unsigned char", "__int64"),
 * with Java-style aliases accepted when parsing.
 */
public enum ValueKind {
    BOOLEAN("bit", "boolean", "bool"),
    BYTE("char", "signed char", "byte"),
    UNSIGNED_BYTE("unsigned char", "unsigned byte", "ubyte"),
    SHORT("short"),
    UNSIGNED_SHORT("unsigned short", "ushort"),
    INT("int", "integer"),
    UNSIGNED_INT("unsigned int", "uint"),
    LONG("__int64", "long", "long long"),
    UNSIGNED_LONG("unsigned long", "unsigned __int64", "idtype", "ulong"),
    FLOAT("float"),
    DOUBLE("double"),
    STRING("string"),
    OBJECT("object");

    private final String typeName;
    private final String[] aliases;

    ValueKind(String typeName, String... aliases) {
        this.typeName = typeName;
        this.aliases = aliases;
    }

    public String typeName() {
        return typeName;
    }

    /**
     * Look up a kind by its type name or one of its aliases.
     * Case-insensitive; underscores are accepted in place of spaces ("unsigned_char").
     */
    public static Optional<ValueKind> fromTypeName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        String spaced = normalized.startsWith("__") ? normalized : normalized.replace('_', ' ');
        return Arrays.stream(values())
                .filter(kind -> kind.matches(normalized) || kind.matches(spaced))
                .findFirst();
    }

    private boolean matches(String name) {
        if (typeName.equals(name) || name().toLowerCase(Locale.ROOT).equals(name)) {
            return true;
        }
        for (String alias : aliases) {
            if (alias.equals(name)) {
                return true;
            }
        }
        return false;
    }
}
