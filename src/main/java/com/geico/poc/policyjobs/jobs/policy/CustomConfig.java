package com.geico.poc.policyjobs.jobs.policy;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Config of a user-defined action, passed through to the routine untouched.
 */
public final class CustomConfig extends PolicyConfig {

    private final JsonNode document;

    CustomConfig(JsonNode document) {
        this.document = document;
    }

    @Override
    public PolicyKind getKind() {
        return PolicyKind.CUSTOM;
    }

    @Override
    public Integer getHypertableId() {
        return null;
    }

    public JsonNode getDocument() {
        return document;
    }

    @Override
    public String toString() {
        return "CustomConfig{" + document + '}';
    }
}
