package com.geico.poc.policyjobs.storage;

import java.util.Objects;

/**
 * Schema-qualified relation name.
 */
public final class RelationName {

    private final String schemaName;
    private final String name;

    public RelationName(String schemaName, String name) {
        this.schemaName = Objects.requireNonNull(schemaName, "schemaName");
        this.name = Objects.requireNonNull(name, "name");
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
        if (!(o instanceof RelationName)) {
            return false;
        }
        RelationName other = (RelationName) o;
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
