package com.geico.poc.policyjobs.storage;

import com.geico.poc.policyjobs.errors.JobException;
import com.geico.poc.policyjobs.transaction.TransactionContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.*;
import java.util.function.LongSupplier;

/**
 * In-memory hypertable catalog and storage actions.
 *
 * Holds hypertables, their dimensions, slices and chunks, indexes, continuous
 * aggregates and the per (job, chunk) stats table. All access is serialized
 * on the instance, standing in for the storage layer's lock manager.
 */
@Component
public class InMemoryStorageBackend implements HypertableCatalog, StorageBackend, ChunkStatsStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryStorageBackend.class);

    public static final String CHUNK_SCHEMA = "_chunks";
    public static final String MATERIALIZATION_SCHEMA = "_materialized";

    private final Map<Integer, Hypertable> hypertables = new LinkedHashMap<>();
    private final Map<Integer, Chunk> chunks = new LinkedHashMap<>();
    private final Map<Integer, List<DimensionSlice>> slicesByDimension = new HashMap<>();
    private final Map<RelationName, IndexMetadata> indexes = new HashMap<>();
    private final Map<Integer, ContinuousAggregate> caggsByMatId = new HashMap<>();
    private final Map<String, ChunkStats> chunkStats = new HashMap<>();

    // Requests recorded for inspection
    private final List<RelationName> dropRequests = new ArrayList<>();
    private final Map<Integer, List<RefreshWindow>> refreshHistory = new HashMap<>();

    private int nextHypertableId = 1;
    private int nextDimensionId = 1;
    private int nextSliceId = 1;
    private int nextChunkId = 1;

    // ========================================
    // Catalog setup
    // ========================================

    public synchronized Hypertable createHypertable(String schemaName, String tableName,
                                                    String timeColumn, PartitioningType timeType) {
        RelationName name = new RelationName(schemaName, tableName);
        if (findHypertable(name) != null) {
            throw JobException.invalidParameter("table \"" + name + "\" is already a hypertable");
        }
        Hypertable ht = new Hypertable(nextHypertableId++, schemaName, tableName);
        ht.addDimension(new Dimension(nextDimensionId++, ht.getId(), timeColumn, timeType, true));
        hypertables.put(ht.getId(), ht);
        log.debug("Created hypertable {} (id {}) partitioned on {} {}", name, ht.getId(), timeColumn, timeType);
        return ht;
    }

    public synchronized Dimension addSpaceDimension(int hypertableId, String column) {
        Hypertable ht = requireHypertable(hypertableId);
        Dimension dimension = new Dimension(nextDimensionId++, ht.getId(), column, PartitioningType.INTEGER, false);
        ht.addDimension(dimension);
        return dimension;
    }

    public synchronized void setIntegerNowFunction(int hypertableId, LongSupplier integerNow) {
        Dimension time = requireHypertable(hypertableId).getTimeDimension();
        if (!time.getType().isInteger()) {
            throw JobException.invalidParameter("integer_now function is only valid for integer time dimensions");
        }
        time.setIntegerNowFunction(integerNow);
    }

    public synchronized void enableCompression(int hypertableId) {
        requireHypertable(hypertableId).setCompressionEnabled(true);
    }

    public synchronized IndexMetadata createIndex(int hypertableId, String indexName) {
        Hypertable ht = requireHypertable(hypertableId);
        IndexMetadata index = new IndexMetadata(ht.getSchemaName(), indexName, ht.getId());
        indexes.put(new RelationName(ht.getSchemaName(), indexName), index);
        return index;
    }

    /**
     * Create a chunk covering [rangeStart, rangeEnd) on the time dimension.
     */
    public synchronized Chunk createChunk(int hypertableId, long rangeStart, long rangeEnd) {
        Hypertable ht = requireHypertable(hypertableId);
        if (ht.getDimensions().size() != 1) {
            throw new IllegalArgumentException("hypertable " + ht + " has space dimensions; give a space range");
        }
        return addChunk(ht, Collections.singletonList(slice(ht.getTimeDimension(), rangeStart, rangeEnd)));
    }

    /**
     * Create a chunk on a hypertable with one time and one space dimension.
     */
    public synchronized Chunk createChunk(int hypertableId, long rangeStart, long rangeEnd,
                                          long spaceStart, long spaceEnd) {
        Hypertable ht = requireHypertable(hypertableId);
        if (ht.getDimensions().size() != 2) {
            throw new IllegalArgumentException("hypertable " + ht + " must have exactly one space dimension");
        }
        List<DimensionSlice> slices = new ArrayList<>();
        slices.add(slice(ht.getTimeDimension(), rangeStart, rangeEnd));
        slices.add(slice(ht.getDimensions().get(1), spaceStart, spaceEnd));
        return addChunk(ht, slices);
    }

    /**
     * Create a continuous aggregate over a raw hypertable together with its
     * materialization hypertable, partitioned like the raw one.
     */
    public synchronized ContinuousAggregate createContinuousAggregate(int rawHypertableId,
                                                                      String viewSchema, String viewName) {
        Hypertable raw = requireHypertable(rawHypertableId);
        Dimension rawTime = raw.getTimeDimension();
        Hypertable mat = createHypertable(MATERIALIZATION_SCHEMA,
            "_materialized_hypertable_" + nextHypertableId, rawTime.getColumnName(), rawTime.getType());
        ContinuousAggregate cagg = new ContinuousAggregate(raw.getId(), mat.getId(), viewSchema, viewName);
        caggsByMatId.put(mat.getId(), cagg);
        log.debug("Created continuous aggregate {} materialized in {}", cagg, mat);
        return cagg;
    }

    // ========================================
    // HypertableCatalog
    // ========================================

    @Override
    public synchronized Hypertable getHypertableById(int hypertableId) {
        return hypertables.get(hypertableId);
    }

    @Override
    public synchronized Hypertable getHypertableByName(RelationName name) {
        return findHypertable(name);
    }

    @Override
    public synchronized Chunk getChunkById(int chunkId) {
        return chunks.get(chunkId);
    }

    @Override
    public synchronized IndexMetadata findIndex(String schemaName, String indexName) {
        return indexes.get(new RelationName(schemaName, indexName));
    }

    @Override
    public synchronized ContinuousAggregate findContinuousAggByMatHypertableId(int matHypertableId) {
        return caggsByMatId.get(matHypertableId);
    }

    @Override
    public synchronized ContinuousAggregate findContinuousAggByView(RelationName view) {
        for (ContinuousAggregate cagg : caggsByMatId.values()) {
            if (cagg.getUserView().equals(view)) {
                return cagg;
            }
        }
        return null;
    }

    @Override
    public synchronized DimensionSlice nthLatestSlice(int dimensionId, int n) {
        if (n <= 0) {
            throw new IllegalArgumentException("n must be positive, got: " + n);
        }
        Map<Integer, DimensionSlice> live = new HashMap<>();
        for (Chunk chunk : chunks.values()) {
            DimensionSlice slice = chunk.getSlice(dimensionId);
            if (slice != null && !chunk.isDropped()) {
                live.put(slice.getId(), slice);
            }
        }
        if (live.size() < n) {
            return null;
        }
        List<DimensionSlice> ordered = new ArrayList<>(live.values());
        ordered.sort(Comparator.comparingLong(DimensionSlice::getRangeStart).reversed());
        return ordered.get(n - 1);
    }

    @Override
    public synchronized Chunk oldestChunkForReorder(int jobId, int dimensionId, long rangeStartBefore) {
        Chunk oldest = null;
        for (Chunk chunk : chunks.values()) {
            DimensionSlice slice = chunk.getSlice(dimensionId);
            if (slice == null || chunk.isDropped() || chunk.isCompressed()) {
                continue;
            }
            if (slice.getRangeStart() >= rangeStartBefore) {
                continue;
            }
            if (chunkStats.containsKey(statsKey(jobId, chunk.getId()))) {
                continue;
            }
            if (oldest == null || isOlder(chunk, oldest, dimensionId)) {
                oldest = chunk;
            }
        }
        return oldest;
    }

    @Override
    public synchronized Chunk chunkToCompress(int dimensionId, long rangeEndBefore) {
        Chunk candidate = null;
        for (Chunk chunk : chunks.values()) {
            DimensionSlice slice = chunk.getSlice(dimensionId);
            if (slice == null || chunk.isDropped() || chunk.isCompressed()) {
                continue;
            }
            if (slice.getRangeEnd() >= rangeEndBefore) {
                continue;
            }
            if (candidate == null || isOlder(chunk, candidate, dimensionId)) {
                candidate = chunk;
            }
        }
        return candidate;
    }

    // ========================================
    // StorageBackend
    // ========================================

    @Override
    public synchronized List<Chunk> dropChunks(RelationName relation, long olderThan, PartitioningType boundaryType) {
        dropRequests.add(relation);

        Hypertable ht = findHypertable(relation);
        if (ht != null && caggsByMatId.containsKey(ht.getId())) {
            throw JobException.invalidParameter(
                "cannot drop chunks directly from materialization hypertable \"" + relation + "\"",
                null,
                "Drop chunks from the continuous aggregate \"" + caggsByMatId.get(ht.getId()) + "\" instead.");
        }
        if (ht == null) {
            ContinuousAggregate cagg = findContinuousAggByView(relation);
            if (cagg == null) {
                throw JobException.undefinedObject("relation \"" + relation + "\" does not exist");
            }
            ht = hypertables.get(cagg.getMatHypertableId());
        }

        Dimension time = ht.getTimeDimension();
        if (time.getType().isInteger() != boundaryType.isInteger()) {
            throw JobException.invalidParameter("invalid time argument type \"" + boundaryType + "\"",
                null, "Use a boundary of the same type as the time column \"" + time.getColumnName() + "\".");
        }

        List<Chunk> dropped = new ArrayList<>();
        for (Chunk chunk : chunks.values()) {
            if (chunk.getHypertableId() != ht.getId() || chunk.isDropped()) {
                continue;
            }
            if (chunk.getSlice(time.getId()).getRangeEnd() <= olderThan) {
                chunk.setDropped(true);
                dropped.add(chunk);
            }
        }
        log.debug("Dropped {} chunk(s) of {} older than {}", dropped.size(), relation,
            boundaryType.toDisplayString(olderThan));
        return dropped;
    }

    @Override
    public synchronized void compressChunk(Chunk chunk) {
        Chunk live = requireLiveChunk(chunk.getId());
        Hypertable ht = hypertables.get(live.getHypertableId());
        if (!ht.isCompressionEnabled()) {
            throw JobException.featureNotSupported("compression not enabled on hypertable \"" + ht + "\"");
        }
        if (live.isCompressed()) {
            throw JobException.invalidParameter("chunk \"" + live + "\" is already compressed");
        }
        live.setCompressed(true);
    }

    @Override
    public synchronized void reorderChunk(Chunk chunk, IndexMetadata index) {
        Chunk live = requireLiveChunk(chunk.getId());
        if (index.getHypertableId() != live.getHypertableId()) {
            throw JobException.invalidParameter("index \"" + index + "\" is not an index on the hypertable of chunk \"" + live + "\"");
        }
        if (live.isCompressed()) {
            throw JobException.featureNotSupported("cannot reorder compressed chunk \"" + live + "\"");
        }
        live.setClusteredIndex(index.getIndexName());
    }

    @Override
    public void refreshContinuousAggregate(ContinuousAggregate cagg, RefreshWindow window, TransactionContext tx) {
        synchronized (this) {
            if (!caggsByMatId.containsKey(cagg.getMatHypertableId())) {
                throw JobException.undefinedObject("continuous aggregate \"" + cagg + "\" does not exist");
            }
        }
        // invalidations are processed and committed before materializing
        tx.commitAndChain();
        synchronized (this) {
            refreshHistory.computeIfAbsent(cagg.getMatHypertableId(), k -> new ArrayList<>()).add(window);
        }
        log.debug("Materialized {} over {}", cagg, window);
    }

    @Override
    public String getBackendType() {
        return "in-memory";
    }

    // ========================================
    // ChunkStatsStore
    // ========================================

    @Override
    public synchronized void recordJobRun(int jobId, int chunkId, Instant when) {
        chunkStats.computeIfAbsent(statsKey(jobId, chunkId), k -> new ChunkStats(jobId, chunkId)).recordRun(when);
    }

    @Override
    public synchronized ChunkStats find(int jobId, int chunkId) {
        ChunkStats stats = chunkStats.get(statsKey(jobId, chunkId));
        return stats != null ? new ChunkStats(stats) : null;
    }

    // ========================================
    // Inspection
    // ========================================

    public synchronized List<Chunk> getChunks(int hypertableId) {
        List<Chunk> result = new ArrayList<>();
        for (Chunk chunk : chunks.values()) {
            if (chunk.getHypertableId() == hypertableId) {
                result.add(chunk);
            }
        }
        return result;
    }

    public synchronized List<RelationName> getDropRequests() {
        return new ArrayList<>(dropRequests);
    }

    public synchronized List<RefreshWindow> getRefreshHistory(int matHypertableId) {
        return new ArrayList<>(refreshHistory.getOrDefault(matHypertableId, Collections.emptyList()));
    }

    // ========================================
    // Helpers
    // ========================================

    private Hypertable findHypertable(RelationName name) {
        for (Hypertable ht : hypertables.values()) {
            if (ht.getRelationName().equals(name)) {
                return ht;
            }
        }
        return null;
    }

    private Hypertable requireHypertable(int hypertableId) {
        Hypertable ht = hypertables.get(hypertableId);
        if (ht == null) {
            throw JobException.undefinedObject("hypertable with id " + hypertableId + " does not exist");
        }
        return ht;
    }

    private Chunk requireLiveChunk(int chunkId) {
        Chunk chunk = chunks.get(chunkId);
        if (chunk == null || chunk.isDropped()) {
            throw JobException.undefinedObject("chunk with id " + chunkId + " does not exist");
        }
        return chunk;
    }

    private DimensionSlice slice(Dimension dimension, long rangeStart, long rangeEnd) {
        List<DimensionSlice> existing = slicesByDimension.computeIfAbsent(dimension.getId(), k -> new ArrayList<>());
        for (DimensionSlice slice : existing) {
            if (slice.getRangeStart() == rangeStart && slice.getRangeEnd() == rangeEnd) {
                return slice;
            }
        }
        DimensionSlice slice = new DimensionSlice(nextSliceId++, dimension.getId(), rangeStart, rangeEnd);
        existing.add(slice);
        return slice;
    }

    private Chunk addChunk(Hypertable ht, List<DimensionSlice> slices) {
        int id = nextChunkId++;
        Chunk chunk = new Chunk(id, ht.getId(), CHUNK_SCHEMA, "_hyper_" + ht.getId() + "_" + id + "_chunk", slices);
        chunks.put(id, chunk);
        return chunk;
    }

    private static boolean isOlder(Chunk a, Chunk b, int dimensionId) {
        long startA = a.getSlice(dimensionId).getRangeStart();
        long startB = b.getSlice(dimensionId).getRangeStart();
        if (startA != startB) {
            return startA < startB;
        }
        return a.getId() < b.getId();
    }

    private static String statsKey(int jobId, int chunkId) {
        return jobId + ":" + chunkId;
    }
}
