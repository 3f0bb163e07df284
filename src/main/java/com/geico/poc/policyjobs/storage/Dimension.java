package com.geico.poc.policyjobs.storage;

import java.util.function.LongSupplier;

/**
 * A partitioning dimension of a hypertable.
 *
 * Open dimensions (time) are range partitioned and grow with the data; closed
 * dimensions (space) hash into a fixed number of slices. Integer open
 * dimensions may carry an integer-now function that tells policies what
 * "now" means for that column.
 */
public class Dimension {

    private final int id;
    private final int hypertableId;
    private final String columnName;
    private final PartitioningType type;
    private final boolean open;
    private volatile LongSupplier integerNowFunction;

    public Dimension(int id, int hypertableId, String columnName, PartitioningType type, boolean open) {
        this.id = id;
        this.hypertableId = hypertableId;
        this.columnName = columnName;
        this.type = type;
        this.open = open;
    }

    public int getId() {
        return id;
    }

    public int getHypertableId() {
        return hypertableId;
    }

    public String getColumnName() {
        return columnName;
    }

    public PartitioningType getType() {
        return type;
    }

    public boolean isOpen() {
        return open;
    }

    public LongSupplier getIntegerNowFunction() {
        return integerNowFunction;
    }

    public void setIntegerNowFunction(LongSupplier integerNowFunction) {
        this.integerNowFunction = integerNowFunction;
    }

    @Override
    public String toString() {
        return "Dimension{id=" + id + ", column=" + columnName + ", type=" + type + ", open=" + open + '}';
    }
}
