package com.geico.poc.policyjobs.routine;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A typed constant bound as a routine argument. A null literal still carries
 * its type.
 */
public final class Literal {

    private final ArgumentType type;
    private final Object value;

    private Literal(ArgumentType type, Object value) {
        this.type = type;
        this.value = value;
    }

    public static Literal of(ArgumentType type, Object value) {
        if (value == null) {
            return nullOf(type);
        }
        switch (type) {
            case INTEGER:
                if (!(value instanceof Integer)) {
                    throw new IllegalArgumentException("integer literal expected, got " + value.getClass().getSimpleName());
                }
                break;
            case JSONB:
                if (!(value instanceof JsonNode)) {
                    throw new IllegalArgumentException("jsonb literal expected, got " + value.getClass().getSimpleName());
                }
                // literals are immutable, the caller keeps its document
                return new Literal(type, ((JsonNode) value).deepCopy());
            default:
                break;
        }
        return new Literal(type, value);
    }

    public static Literal nullOf(ArgumentType type) {
        return new Literal(type, null);
    }

    public ArgumentType getType() {
        return type;
    }

    public boolean isNull() {
        return value == null;
    }

    public Object getValue() {
        return value;
    }

    public int asInt() {
        if (type != ArgumentType.INTEGER || value == null) {
            throw new IllegalStateException("not a non-null integer literal: " + this);
        }
        return (Integer) value;
    }

    /**
     * The document value, or null for a null literal.
     */
    public JsonNode asJson() {
        if (type != ArgumentType.JSONB) {
            throw new IllegalStateException("not a jsonb literal: " + this);
        }
        return value == null ? null : ((JsonNode) value).deepCopy();
    }

    @Override
    public String toString() {
        return (value == null ? "NULL" : value.toString()) + "::" + type.getSqlName();
    }
}
