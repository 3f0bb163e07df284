package com.geico.poc.policyjobs.storage;

/**
 * An index defined on a hypertable's main table.
 */
public class IndexMetadata {

    private final String schemaName;
    private final String indexName;
    private final int hypertableId;

    public IndexMetadata(String schemaName, String indexName, int hypertableId) {
        this.schemaName = schemaName;
        this.indexName = indexName;
        this.hypertableId = hypertableId;
    }

    public String getSchemaName() {
        return schemaName;
    }

    public String getIndexName() {
        return indexName;
    }

    /**
     * Id of the hypertable whose main table this index is built on.
     */
    public int getHypertableId() {
        return hypertableId;
    }

    @Override
    public String toString() {
        return schemaName + "." + indexName;
    }
}
