package com.geico.poc.policyjobs.storage;

/**
 * A continuous aggregate: a user-facing view over a raw hypertable, backed by
 * a hidden materialization hypertable.
 */
public class ContinuousAggregate {

    private final int rawHypertableId;
    private final int matHypertableId;
    private final String userViewSchema;
    private final String userViewName;

    public ContinuousAggregate(int rawHypertableId, int matHypertableId, String userViewSchema, String userViewName) {
        this.rawHypertableId = rawHypertableId;
        this.matHypertableId = matHypertableId;
        this.userViewSchema = userViewSchema;
        this.userViewName = userViewName;
    }

    public int getRawHypertableId() {
        return rawHypertableId;
    }

    public int getMatHypertableId() {
        return matHypertableId;
    }

    public String getUserViewSchema() {
        return userViewSchema;
    }

    public String getUserViewName() {
        return userViewName;
    }

    public RelationName getUserView() {
        return new RelationName(userViewSchema, userViewName);
    }

    @Override
    public String toString() {
        return userViewSchema + "." + userViewName;
    }
}
