package com.umitunal.elric.storage;

import com.umitunal.elric.config.StorageConfig;
import com.umitunal.elric.core.JobStore;
import com.umitunal.elric.core.JobStoreException;
import com.umitunal.elric.core.StoreOutcome;
import com.umitunal.elric.core.StoredJob;
import org.rocksdb.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * RocksDB-backed job store that survives restarts.
 *
 * Records live in the default column family keyed by job id. A second column family,
 * {@code schedule}, holds one empty-valued key per job ordered by (next run time, sequence),
 * which serves both due-selection and the closest-upcoming query. Every mutation updates
 * both families in a single {@link WriteBatch}.
 *
 * Not thread-safe; the owner serializes access.
 */
public class RocksJobStore implements JobStore {
    private static final Logger log = LoggerFactory.getLogger(RocksJobStore.class);
    private static final byte[] SCHEDULE_FAMILY = "schedule".getBytes(UTF_8);
    private static final byte[] EMPTY = new byte[0];

    private final RocksDB database;
    private final ColumnFamilyHandle jobsFamily;
    private final ColumnFamilyHandle scheduleFamily;
    private final DBOptions dbOptions;
    private final ColumnFamilyOptions familyOptions;
    private final WriteOptions writeOpts;
    private final ReadOptions scanReadOpts;
    private final Cache blockCache;
    private final Filter bloomFilter;

    private long sequence;
    private int count;

    public RocksJobStore(StorageConfig config) throws RocksDBException {
        RocksDB.loadLibrary();

        this.blockCache = new LRUCache(config.getBlockCacheSizeMB() * 1024L * 1024L);
        this.bloomFilter = new BloomFilter(10, false);

        BlockBasedTableConfig tableConfig = new BlockBasedTableConfig()
                .setBlockCache(blockCache)
                .setFilterPolicy(bloomFilter)
                .setCacheIndexAndFilterBlocks(true)
                .setPinL0FilterAndIndexBlocksInCache(true);

        this.familyOptions = new ColumnFamilyOptions()
                .setCompressionType(CompressionType.LZ4_COMPRESSION)
                .setWriteBufferSize(config.getMemoryBufferSizeMB() * 1024L * 1024L)
                .setMaxWriteBufferNumber(config.getMaxMemoryBuffers())
                .setTargetFileSizeBase(64L * 1024 * 1024)
                .setTableFormatConfig(tableConfig);

        this.dbOptions = new DBOptions()
                .setCreateIfMissing(true)
                .setCreateMissingColumnFamilies(true)
                .setMaxBackgroundJobs(config.getBackgroundThreads())
                .setIncreaseParallelism(Runtime.getRuntime().availableProcessors())
                .setAllowConcurrentMemtableWrite(true)
                .setEnableWriteThreadAdaptiveYield(true)
                .setMaxOpenFiles(-1);

        List<ColumnFamilyDescriptor> descriptors = Arrays.asList(
                new ColumnFamilyDescriptor(RocksDB.DEFAULT_COLUMN_FAMILY, familyOptions),
                new ColumnFamilyDescriptor(SCHEDULE_FAMILY, familyOptions));
        List<ColumnFamilyHandle> handles = new ArrayList<>();
        this.database = RocksDB.open(dbOptions, config.getDataDirectory(), descriptors, handles);
        this.jobsFamily = handles.get(0);
        this.scheduleFamily = handles.get(1);

        this.writeOpts = new WriteOptions()
                .setSync(config.isDurableWrites());

        // Don't pollute the block cache with full scans
        this.scanReadOpts = new ReadOptions()
                .setFillCache(false);

        recoverCounters();
        log.info("Opened job store at {} with {} pending jobs", config.getDataDirectory(), count);
    }

    @Override
    public StoreOutcome add(String jobId, String routingKey, long nextRunTime, byte[] payload) {
        byte[] idKey = jobId.getBytes(UTF_8);
        try {
            if (database.get(jobsFamily, idKey) != null) {
                return StoreOutcome.ALREADY_EXISTS;
            }
            long seq = sequence + 1;
            StoredJob job = new StoredJob(jobId, routingKey, nextRunTime, payload);
            try (WriteBatch batch = new WriteBatch()) {
                batch.put(jobsFamily, idKey, StoredJobSerializer.serialize(job, seq));
                batch.put(scheduleFamily, StoredJobSerializer.scheduleKey(nextRunTime, seq, jobId), EMPTY);
                database.write(writeOpts, batch);
            }
            sequence = seq;
            count++;
            return StoreOutcome.ADDED;
        } catch (RocksDBException e) {
            throw new JobStoreException("Failed to add job " + jobId, e);
        }
    }

    @Override
    public StoreOutcome replace(String jobId, String routingKey, long nextRunTime, byte[] payload) {
        byte[] idKey = jobId.getBytes(UTF_8);
        try {
            byte[] existing = database.get(jobsFamily, idKey);
            if (existing == null) {
                return StoreOutcome.NOT_FOUND;
            }
            long seq = StoredJobSerializer.readSequence(existing);
            StoredJob previous = StoredJobSerializer.deserialize(jobId, existing);
            StoredJob job = new StoredJob(jobId, routingKey, nextRunTime, payload);

            try (WriteBatch batch = new WriteBatch()) {
                batch.delete(scheduleFamily, StoredJobSerializer.scheduleKey(previous.getNextRunTime(), seq, jobId));
                batch.put(jobsFamily, idKey, StoredJobSerializer.serialize(job, seq));
                batch.put(scheduleFamily, StoredJobSerializer.scheduleKey(nextRunTime, seq, jobId), EMPTY);
                database.write(writeOpts, batch);
            }
            return StoreOutcome.REPLACED;
        } catch (RocksDBException e) {
            throw new JobStoreException("Failed to replace job " + jobId, e);
        }
    }

    @Override
    public StoreOutcome remove(String jobId) {
        byte[] idKey = jobId.getBytes(UTF_8);
        try {
            byte[] existing = database.get(jobsFamily, idKey);
            if (existing == null) {
                return StoreOutcome.NOT_FOUND;
            }
            long seq = StoredJobSerializer.readSequence(existing);
            StoredJob previous = StoredJobSerializer.deserialize(jobId, existing);

            try (WriteBatch batch = new WriteBatch()) {
                batch.delete(scheduleFamily, StoredJobSerializer.scheduleKey(previous.getNextRunTime(), seq, jobId));
                batch.delete(jobsFamily, idKey);
                database.write(writeOpts, batch);
            }
            count--;
            return StoreOutcome.REMOVED;
        } catch (RocksDBException e) {
            throw new JobStoreException("Failed to remove job " + jobId, e);
        }
    }

    @Override
    public List<StoredJob> dueBefore(long instant) {
        List<String> dueIds = new ArrayList<>();
        try (final RocksIterator iter = database.newIterator(scheduleFamily, scanReadOpts)) {
            iter.seekToFirst();

            while (iter.isValid()) {
                byte[] key = iter.key();
                if (StoredJobSerializer.scheduleTime(key) > instant) {
                    break;
                }
                dueIds.add(StoredJobSerializer.scheduleJobId(key));
                iter.next();
            }
        }

        List<StoredJob> due = new ArrayList<>(dueIds.size());
        for (String jobId : dueIds) {
            get(jobId).ifPresent(due::add);
        }
        return due;
    }

    @Override
    public OptionalLong closestUpcoming() {
        try (final RocksIterator iter = database.newIterator(scheduleFamily, scanReadOpts)) {
            iter.seekToFirst();
            if (!iter.isValid()) {
                return OptionalLong.empty();
            }
            return OptionalLong.of(StoredJobSerializer.scheduleTime(iter.key()));
        }
    }

    @Override
    public Optional<StoredJob> get(String jobId) {
        try {
            byte[] value = database.get(jobsFamily, jobId.getBytes(UTF_8));
            return value == null
                    ? Optional.empty()
                    : Optional.of(StoredJobSerializer.deserialize(jobId, value));
        } catch (RocksDBException e) {
            throw new JobStoreException("Failed to read job " + jobId, e);
        }
    }

    @Override
    public int size() {
        return count;
    }

    @Override
    public void close() {
        if (scanReadOpts != null) {
            scanReadOpts.close();
        }
        if (writeOpts != null) {
            writeOpts.close();
        }
        if (scheduleFamily != null) {
            scheduleFamily.close();
        }
        if (jobsFamily != null) {
            jobsFamily.close();
        }
        if (database != null) {
            database.close();
        }
        if (dbOptions != null) {
            dbOptions.close();
        }
        // Table config is owned by the column family options
        if (familyOptions != null) {
            familyOptions.close();
        }
        if (blockCache != null) {
            blockCache.close();
        }
        if (bloomFilter != null) {
            bloomFilter.close();
        }
    }

    private void recoverCounters() {
        long maxSequence = 0;
        int records = 0;

        try (final RocksIterator iter = database.newIterator(jobsFamily, scanReadOpts)) {
            iter.seekToFirst();

            while (iter.isValid()) {
                records++;
                maxSequence = Math.max(maxSequence, StoredJobSerializer.readSequence(iter.value()));
                iter.next();
            }
        }

        this.sequence = maxSequence;
        this.count = records;
    }
}
