package com.geico.poc.policyjobs.routine;

import com.geico.poc.policyjobs.errors.JobException;

import java.util.Objects;

/**
 * A possibly schema-qualified routine name. Unqualified names resolve in the
 * default schema.
 */
public final class RoutineName {

    public static final String DEFAULT_SCHEMA = "public";

    private final String schemaName;
    private final String name;

    public RoutineName(String schemaName, String name) {
        this.schemaName = Objects.requireNonNull(schemaName, "schemaName");
        this.name = Objects.requireNonNull(name, "name");
    }

    /**
     * Parse "name" or "schema.name".
     */
    public static RoutineName parse(String text) {
        if (text == null || text.isBlank()) {
            throw JobException.invalidParameter("function or procedure cannot be NULL");
        }
        String trimmed = text.trim();
        int dot = trimmed.indexOf('.');
        if (dot < 0) {
            return new RoutineName(DEFAULT_SCHEMA, trimmed);
        }
        String schema = trimmed.substring(0, dot);
        String name = trimmed.substring(dot + 1);
        if (schema.isEmpty() || name.isEmpty() || name.indexOf('.') >= 0) {
            throw JobException.invalidParameter("improper qualified name: \"" + text + "\"");
        }
        return new RoutineName(schema, name);
    }

    public String getSchemaName() {
        return schemaName;
    }

    public String getName() {
        return name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RoutineName)) {
            return false;
        }
        RoutineName other = (RoutineName) o;
        return schemaName.equals(other.schemaName) && name.equals(other.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(schemaName, name);
    }

    @Override
    public String toString() {
        return schemaName + "." + name;
    }
}
