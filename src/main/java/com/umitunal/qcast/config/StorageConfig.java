package com.umitunal.qcast.config;

import java.util.Locale;
import java.util.Properties;

/**
 * Configuration for the RocksDB job store.
 */
public class StorageConfig {
    private final String dataDirectory;
    private final boolean durableWrites;
    private final int memoryBufferSizeMB;
    private final int maxMemoryBuffers;
    private final int backgroundThreads;
    private final int blockCacheSizeMB;
    private final Codec codec;

    private StorageConfig(Builder builder) {
        this.dataDirectory = builder.dataDirectory;
        this.durableWrites = builder.durableWrites;
        this.memoryBufferSizeMB = builder.memoryBufferSizeMB;
        this.maxMemoryBuffers = builder.maxMemoryBuffers;
        this.backgroundThreads = builder.backgroundThreads;
        this.blockCacheSizeMB = builder.blockCacheSizeMB;
        this.codec = builder.codec;
    }

    public String getDataDirectory() { return dataDirectory; }
    public boolean isDurableWrites() { return durableWrites; }
    public int getMemoryBufferSizeMB() { return memoryBufferSizeMB; }
    public int getMaxMemoryBuffers() { return maxMemoryBuffers; }
    public int getBackgroundThreads() { return backgroundThreads; }
    public int getBlockCacheSizeMB() { return blockCacheSizeMB; }
    public Codec getCodec() { return codec; }

    public static Builder newBuilder(String dataDirectory) {
        return new Builder(dataDirectory);
    }

    /**
     * Read {@code qcast.storage.*} keys, falling back to builder defaults.
     */
    public static StorageConfig fromProperties(Properties properties) {
        PropertyReader reader = new PropertyReader(properties);
        Builder defaults = new Builder(reader.getString("qcast.storage.data-dir", "data/qcast"));
        String codecName = reader.getString("qcast.storage.codec", defaults.codec.name());
        Codec codec;
        try {
            codec = Codec.valueOf(codecName.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid value for qcast.storage.codec: " + codecName, e);
        }
        return defaults
                .withDurableWrites(reader.getBoolean("qcast.storage.durable-writes", defaults.durableWrites))
                .withMemoryBufferSize(reader.getInt("qcast.storage.memory-buffer-mb", defaults.memoryBufferSizeMB))
                .withMaxMemoryBuffers(reader.getInt("qcast.storage.max-memory-buffers", defaults.maxMemoryBuffers))
                .withBackgroundThreads(reader.getInt("qcast.storage.background-threads", defaults.backgroundThreads))
                .withBlockCacheSize(reader.getInt("qcast.storage.block-cache-mb", defaults.blockCacheSizeMB))
                .withCodec(codec)
                .build();
    }

    /**
     * Encoding used for job values.
     */
    public enum Codec {
        JSON,
        KRYO
    }

    public static class Builder {
        private final String dataDirectory;
        private boolean durableWrites = true;
        private int memoryBufferSizeMB = 16;
        private int maxMemoryBuffers = 2;
        private int backgroundThreads = 2;
        private int blockCacheSizeMB = 8;
        private Codec codec = Codec.JSON;

        private Builder(String dataDirectory) {
            this.dataDirectory = dataDirectory;
        }

        /**
         * Sync the WAL on every write.
         * Job records are small and rarely written, so this is on by default.
         */
        public Builder withDurableWrites(boolean enable) {
            this.durableWrites = enable;
            return this;
        }

        /**
         * Set memtable size in MB.
         * Default: 16 MB
         */
        public Builder withMemoryBufferSize(int sizeMB) {
            this.memoryBufferSizeMB = sizeMB;
            return this;
        }

        /**
         * Set maximum number of memtables.
         * Default: 2
         */
        public Builder withMaxMemoryBuffers(int count) {
            this.maxMemoryBuffers = count;
            return this;
        }

        /**
         * Set number of background flush/compaction jobs.
         * Default: 2
         */
        public Builder withBackgroundThreads(int count) {
            this.backgroundThreads = count;
            return this;
        }

        /**
         * Set LRU block cache size in MB.
         * Default: 8 MB
         */
        public Builder withBlockCacheSize(int sizeMB) {
            this.blockCacheSizeMB = sizeMB;
            return this;
        }

        public Builder withCodec(Codec codec) {
            this.codec = codec;
            return this;
        }

        public StorageConfig build() {
            if (dataDirectory == null || dataDirectory.isBlank()) {
                throw new IllegalArgumentException("dataDirectory must not be blank");
            }
            return new StorageConfig(this);
        }
    }
}
