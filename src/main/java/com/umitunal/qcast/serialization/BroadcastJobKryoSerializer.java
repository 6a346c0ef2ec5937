package com.umitunal.qcast.serialization;

import com.esotericsoftware.kryo.Kryo;
import com.esotericsoftware.kryo.Serializer;
import com.esotericsoftware.kryo.io.Input;
import com.esotericsoftware.kryo.io.Output;
import com.umitunal.qcast.core.BroadcastJob;
import com.umitunal.qcast.core.RecurrenceType;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Explicit field layout for {@link BroadcastJob}. The first byte is a format
 * version so the layout can evolve without breaking stored records.
 */
public class BroadcastJobKryoSerializer extends Serializer<BroadcastJob> {
    private static final byte FORMAT_VERSION = 1;
    private static final long NO_INSTANT = Long.MIN_VALUE;

    public BroadcastJobKryoSerializer() {
        setImmutable(true);
    }

    @Override
    public void write(Kryo kryo, Output output, BroadcastJob job) {
        output.writeByte(FORMAT_VERSION);
        output.writeString(job.getId());
        output.writeString(job.getMessageText());
        output.writeVarInt(job.getRecurrenceType().ordinal(), true);
        output.writeString(job.getCronExpression());
        writeInstant(output, job.getNextRunAt());
        output.writeBoolean(job.isActive());
        output.writeVarInt(job.getRecipientGroupIds().size(), true);
        for (String groupId : job.getRecipientGroupIds()) {
            output.writeString(groupId);
        }
        writeInstant(output, job.getCreatedAt());
        output.writeString(job.getOwnerId());
    }

    @Override
    public BroadcastJob read(Kryo kryo, Input input, Class<? extends BroadcastJob> type) {
        byte version = input.readByte();
        if (version != FORMAT_VERSION) {
            throw new IllegalStateException("Unsupported job record version: " + version);
        }
        String id = input.readString();
        String messageText = input.readString();
        RecurrenceType recurrenceType = RecurrenceType.values()[input.readVarInt(true)];
        String cronExpression = input.readString();
        Instant nextRunAt = readInstant(input);
        boolean active = input.readBoolean();
        int groupCount = input.readVarInt(true);
        Set<String> groups = new LinkedHashSet<>(groupCount * 2);
        for (int i = 0; i < groupCount; i++) {
            groups.add(input.readString());
        }
        Instant createdAt = readInstant(input);
        String ownerId = input.readString();

        return new BroadcastJob(id, messageText, recurrenceType, cronExpression, nextRunAt,
                active, groups, createdAt, ownerId);
    }

    private static void writeInstant(Output output, Instant instant) {
        if (instant == null) {
            output.writeLong(NO_INSTANT);
            return;
        }
        output.writeLong(instant.getEpochSecond());
        output.writeInt(instant.getNano());
    }

    private static Instant readInstant(Input input) {
        long seconds = input.readLong();
        if (seconds == NO_INSTANT) {
            return null;
        }
        return Instant.ofEpochSecond(seconds, input.readInt());
    }
}
