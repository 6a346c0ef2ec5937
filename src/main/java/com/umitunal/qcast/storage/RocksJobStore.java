package com.umitunal.qcast.storage;

import com.umitunal.qcast.config.StorageConfig;
import com.umitunal.qcast.core.BroadcastJob;
import com.umitunal.qcast.core.JobStore;
import com.umitunal.qcast.core.ScheduleUpdate;
import com.umitunal.qcast.serialization.JobCodecs;
import com.umitunal.qcast.serialization.PayloadCodec;
import org.rocksdb.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.UnaryOperator;

/**
 * RocksDB-backed implementation of JobStore.
 *
 * Job records live under {@code j|<id>}; active jobs also have an entry in a
 * time-ordered schedule index so that finding due jobs is a short prefix scan
 * rather than a full table scan. A record and its index entry are always
 * changed together in one optimistic transaction.
 */
public class RocksJobStore implements JobStore {
    private static final Logger log = LoggerFactory.getLogger(RocksJobStore.class);

    static final int MAX_TXN_ATTEMPTS = 5;

    private final OptimisticTransactionDB transactionDB;
    private final PayloadCodec<BroadcastJob> codec;
    private final WriteOptions writeOpts;
    private final OptimisticTransactionOptions txnOpts;
    private final ReadOptions readOpts;
    private final ReadOptions scanReadOpts;
    private final Options dbOptions;
    private final Cache blockCache;
    private final Filter bloomFilter;
    private final AtomicLong txnRetryCount = new AtomicLong(0);

    public RocksJobStore(StorageConfig config) throws RocksDBException {
        this(config, JobCodecs.forCodec(config.getCodec()));
    }

    public RocksJobStore(StorageConfig config, PayloadCodec<BroadcastJob> codec) throws RocksDBException {
        this.codec = codec;

        RocksDB.loadLibrary();

        this.blockCache = new LRUCache(config.getBlockCacheSizeMB() * 1024L * 1024L);
        this.bloomFilter = new BloomFilter(10, false);

        BlockBasedTableConfig tableConfig = new BlockBasedTableConfig()
                .setBlockCache(blockCache)
                .setFilterPolicy(bloomFilter)
                .setCacheIndexAndFilterBlocks(true)
                .setPinL0FilterAndIndexBlocksInCache(true);

        this.dbOptions = new Options()
                .setCreateIfMissing(true)
                .setCompressionType(CompressionType.LZ4_COMPRESSION)
                .setWriteBufferSize(config.getMemoryBufferSizeMB() * 1024L * 1024L)
                .setMaxWriteBufferNumber(config.getMaxMemoryBuffers())
                .setMaxBackgroundJobs(config.getBackgroundThreads())
                .setTableFormatConfig(tableConfig);

        this.transactionDB = OptimisticTransactionDB.open(dbOptions, config.getDataDirectory());

        this.writeOpts = new WriteOptions()
                .setSync(config.isDurableWrites());

        this.txnOpts = new OptimisticTransactionOptions()
                .setSetSnapshot(true);

        this.readOpts = new ReadOptions();

        // Scans should not push hot records out of the block cache
        this.scanReadOpts = new ReadOptions()
                .setFillCache(false);

        log.info("Opened job store at {} (codec={}, durable={})",
                config.getDataDirectory(), config.getCodec(), config.isDurableWrites());
    }

    @Override
    public List<BroadcastJob> listDueActiveJobs(Instant now) throws RocksDBException {
        long nowMillis = now.toEpochMilli();
        List<BroadcastJob> due = new ArrayList<>();

        try (final RocksIterator iter = transactionDB.newIterator(scanReadOpts)) {
            iter.seek(JobKeys.SCHEDULE_PREFIX);

            while (iter.isValid()) {
                byte[] key = iter.key();
                if (!JobKeys.isScheduleKey(key) || JobKeys.scheduleMillis(key) > nowMillis) {
                    break;
                }

                BroadcastJob job = getJob(JobKeys.scheduleJobId(key));
                if (job != null && job.isDue(now)) {
                    due.add(job);
                }
                iter.next();
            }
        }

        return due;
    }

    @Override
    public BroadcastJob getJob(String jobId) throws RocksDBException {
        byte[] value = transactionDB.get(readOpts, JobKeys.jobKey(jobId));
        return value == null ? null : codec.decode(value);
    }

    @Override
    public boolean updateJobSchedule(String jobId, ScheduleUpdate update) throws RocksDBException {
        return updateJob(jobId, update::applyTo) != null;
    }

    @Override
    public BroadcastJob updateJob(String jobId, UnaryOperator<BroadcastJob> change) throws RocksDBException {
        byte[] jobKey = JobKeys.jobKey(jobId);

        for (int attempt = 1; ; attempt++) {
            try (Transaction txn = transactionDB.beginTransaction(writeOpts, txnOpts)) {
                byte[] value = txn.getForUpdate(readOpts, jobKey, true);
                if (value == null) {
                    return null;
                }

                BroadcastJob current = codec.decode(value);
                BroadcastJob updated = change.apply(current);
                if (!updated.getId().equals(jobId)) {
                    throw new IllegalArgumentException("Job id cannot change: " + jobId + " -> " + updated.getId());
                }

                deleteIndexEntry(txn, current);
                txn.put(jobKey, codec.encode(updated));
                putIndexEntry(txn, updated);
                txn.commit();
                return updated;
            } catch (RocksDBException e) {
                retryOrRethrow(e, attempt, jobId);
            }
        }
    }

    @Override
    public void saveJob(BroadcastJob job) throws RocksDBException {
        byte[] jobKey = JobKeys.jobKey(job.getId());

        for (int attempt = 1; ; attempt++) {
            try (Transaction txn = transactionDB.beginTransaction(writeOpts, txnOpts)) {
                byte[] previous = txn.getForUpdate(readOpts, jobKey, true);
                if (previous != null) {
                    deleteIndexEntry(txn, codec.decode(previous));
                }

                txn.put(jobKey, codec.encode(job));
                putIndexEntry(txn, job);
                txn.commit();
                return;
            } catch (RocksDBException e) {
                retryOrRethrow(e, attempt, job.getId());
            }
        }
    }

    @Override
    public boolean deleteJob(String jobId) throws RocksDBException {
        byte[] jobKey = JobKeys.jobKey(jobId);

        for (int attempt = 1; ; attempt++) {
            try (Transaction txn = transactionDB.beginTransaction(writeOpts, txnOpts)) {
                byte[] previous = txn.getForUpdate(readOpts, jobKey, true);
                if (previous == null) {
                    return false;
                }

                deleteIndexEntry(txn, codec.decode(previous));
                txn.delete(jobKey);
                txn.commit();
                return true;
            } catch (RocksDBException e) {
                retryOrRethrow(e, attempt, jobId);
            }
        }
    }

    @Override
    public List<BroadcastJob> listJobs() throws RocksDBException {
        List<BroadcastJob> jobs = new ArrayList<>();

        try (final RocksIterator iter = transactionDB.newIterator(scanReadOpts)) {
            iter.seek(JobKeys.JOB_PREFIX);

            while (iter.isValid() && JobKeys.isJobKey(iter.key())) {
                jobs.add(codec.decode(iter.value()));
                iter.next();
            }
        }

        return jobs;
    }

    /**
     * Get the number of transaction retries that occurred.
     * Useful for monitoring contention between the scheduler and operator edits.
     */
    public long getTransactionRetryCount() {
        return txnRetryCount.get();
    }

    @Override
    public void close() {
        if (scanReadOpts != null) {
            scanReadOpts.close();
        }
        if (readOpts != null) {
            readOpts.close();
        }
        if (txnOpts != null) {
            txnOpts.close();
        }
        if (writeOpts != null) {
            writeOpts.close();
        }
        if (transactionDB != null) {
            transactionDB.close();
        }
        if (dbOptions != null) {
            dbOptions.close();
        }
        if (blockCache != null) {
            blockCache.close();
        }
        if (bloomFilter != null) {
            bloomFilter.close();
        }
        log.info("Closed job store");
    }

    private static void putIndexEntry(Transaction txn, BroadcastJob job) throws RocksDBException {
        if (job.isActive() && job.getNextRunAt() != null) {
            txn.put(JobKeys.scheduleKey(job.getNextRunAt(), job.getId()), new byte[0]);
        }
    }

    private static void deleteIndexEntry(Transaction txn, BroadcastJob job) throws RocksDBException {
        if (job.getNextRunAt() != null) {
            txn.delete(JobKeys.scheduleKey(job.getNextRunAt(), job.getId()));
        }
    }

    private void retryOrRethrow(RocksDBException e, int attempt, String jobId) throws RocksDBException {
        if (!isConflict(e) || attempt >= MAX_TXN_ATTEMPTS) {
            throw e;
        }
        txnRetryCount.incrementAndGet();
        log.debug("Write conflict on job {}, attempt {}/{}", jobId, attempt, MAX_TXN_ATTEMPTS);
    }

    private static boolean isConflict(RocksDBException e) {
        Status status = e.getStatus();
        return status != null
                && (status.getCode() == Status.Code.Busy || status.getCode() == Status.Code.TryAgain);
    }
}
