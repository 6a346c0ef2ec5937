package com.umitunal.qcast.serialization;

import com.umitunal.qcast.config.StorageConfig;
import com.umitunal.qcast.core.BroadcastJob;

/**
 * Selects the job record codec named in the storage configuration.
 */
public final class JobCodecs {

    private JobCodecs() {
    }

    public static PayloadCodec<BroadcastJob> forCodec(StorageConfig.Codec codec) {
        return switch (codec) {
            case JSON -> new JsonCodec<>(BroadcastJob.class);
            case KRYO -> KryoCodec.forJobs();
        };
    }
}
