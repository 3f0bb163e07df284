package com.geico.poc.policyjobs.storage;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Metadata for a hypertable: a table partitioned into chunks along one open
 * (time) dimension and optionally further closed (space) dimensions.
 */
public class Hypertable {

    private final int id;
    private final String schemaName;
    private final String tableName;
    private final List<Dimension> dimensions = new ArrayList<>();
    private volatile boolean compressionEnabled;

    public Hypertable(int id, String schemaName, String tableName) {
        this.id = id;
        this.schemaName = schemaName;
        this.tableName = tableName;
    }

    public int getId() {
        return id;
    }

    public String getSchemaName() {
        return schemaName;
    }

    public String getTableName() {
        return tableName;
    }

    public RelationName getRelationName() {
        return new RelationName(schemaName, tableName);
    }

    public List<Dimension> getDimensions() {
        return Collections.unmodifiableList(dimensions);
    }

    void addDimension(Dimension dimension) {
        dimensions.add(dimension);
    }

    /**
     * The n-th open dimension, or null if there is none.
     */
    public Dimension getOpenDimension(int n) {
        int seen = 0;
        for (Dimension dimension : dimensions) {
            if (dimension.isOpen()) {
                if (seen == n) {
                    return dimension;
                }
                seen++;
            }
        }
        return null;
    }

    /**
     * The primary (first open) dimension.
     */
    public Dimension getTimeDimension() {
        return getOpenDimension(0);
    }

    public boolean isCompressionEnabled() {
        return compressionEnabled;
    }

    public void setCompressionEnabled(boolean compressionEnabled) {
        this.compressionEnabled = compressionEnabled;
    }

    @Override
    public String toString() {
        return schemaName + "." + tableName;
    }
}
