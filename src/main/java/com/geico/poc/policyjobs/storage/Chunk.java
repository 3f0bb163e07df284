package com.geico.poc.policyjobs.storage;

import java.util.Collections;
import java.util.List;

/**
 * A physical partition of a hypertable, bounded by one slice per dimension.
 */
public class Chunk {

    private final int id;
    private final int hypertableId;
    private final String schemaName;
    private final String tableName;
    private final List<DimensionSlice> slices;
    private volatile boolean compressed;
    private volatile boolean dropped;
    private volatile String clusteredIndex;

    public Chunk(int id, int hypertableId, String schemaName, String tableName, List<DimensionSlice> slices) {
        this.id = id;
        this.hypertableId = hypertableId;
        this.schemaName = schemaName;
        this.tableName = tableName;
        this.slices = Collections.unmodifiableList(slices);
    }

    public int getId() {
        return id;
    }

    public int getHypertableId() {
        return hypertableId;
    }

    public String getSchemaName() {
        return schemaName;
    }

    public String getTableName() {
        return tableName;
    }

    public List<DimensionSlice> getSlices() {
        return slices;
    }

    /**
     * The slice this chunk occupies on the given dimension, or null.
     */
    public DimensionSlice getSlice(int dimensionId) {
        for (DimensionSlice slice : slices) {
            if (slice.getDimensionId() == dimensionId) {
                return slice;
            }
        }
        return null;
    }

    public boolean isCompressed() {
        return compressed;
    }

    public void setCompressed(boolean compressed) {
        this.compressed = compressed;
    }

    public boolean isDropped() {
        return dropped;
    }

    public void setDropped(boolean dropped) {
        this.dropped = dropped;
    }

    /**
     * Name of the index the chunk was last reordered on, null if never reordered.
     */
    public String getClusteredIndex() {
        return clusteredIndex;
    }

    public void setClusteredIndex(String clusteredIndex) {
        this.clusteredIndex = clusteredIndex;
    }

    @Override
    public String toString() {
        return schemaName + "." + tableName;
    }
}
