package io.recovery.redis;

import io.recovery.model.GroupCreation;
import io.recovery.model.PendingEntry;
import io.recovery.model.StreamEntry;
import io.recovery.spi.StoreException;
import io.recovery.spi.StreamStore;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Range;
import org.springframework.data.redis.connection.Limit;
import org.springframework.data.redis.connection.RedisStreamCommands.XAddOptions;
import org.springframework.data.redis.connection.stream.Consumer;
import org.springframework.data.redis.connection.stream.MapRecord;
import org.springframework.data.redis.connection.stream.PendingMessage;
import org.springframework.data.redis.connection.stream.PendingMessages;
import org.springframework.data.redis.connection.stream.PendingMessagesSummary;
import org.springframework.data.redis.connection.stream.ReadOffset;
import org.springframework.data.redis.connection.stream.RecordId;
import org.springframework.data.redis.connection.stream.StreamOffset;
import org.springframework.data.redis.connection.stream.StreamReadOptions;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StreamOperations;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link StreamStore} on Redis Streams through Spring Data Redis.
 *
 * <p>Every Redis call is translated to a single stream command ({@code XADD},
 * {@code XREADGROUP}, {@code XACK}, {@code XCLAIM}, ...), so the atomicity
 * guarantees are those of Redis itself. {@link DataAccessException}s are
 * rethrown as {@link StoreException}.
 */
public final class RedisStreamStore implements StreamStore {
    private static final Logger logger = Logger.getLogger(RedisStreamStore.class.getName());

    private final StringRedisTemplate redisTemplate;

    public RedisStreamStore(StringRedisTemplate redisTemplate) {
        this.redisTemplate = Objects.requireNonNull(redisTemplate, "redisTemplate");
    }

    @Override
    public GroupCreation createGroup(String stream, String group) {
        return call("create group " + group + " on " + stream, () -> {
            if (groupExists(stream, group)) {
                return GroupCreation.ALREADY_EXISTS;
            }
            try {
                // MKSTREAM: the stream may not exist yet
                streams().createGroup(stream, ReadOffset.from("0"), group);
                logger.log(Level.INFO, "Created consumer group {0} on {1}", new Object[]{group, stream});
                return GroupCreation.CREATED;
            } catch (DataAccessException e) {
                // lost a creation race to another process
                if (groupExists(stream, group)) {
                    return GroupCreation.ALREADY_EXISTS;
                }
                throw e;
            }
        });
    }

    private boolean groupExists(String stream, String group) {
        if (!Boolean.TRUE.equals(redisTemplate.hasKey(stream))) {
            return false;
        }
        return streams().groups(stream).stream()
                .anyMatch(info -> group.equals(info.groupName()));
    }

    @Override
    public String add(String stream, Map<String, String> fields, long maxLength) {
        return call("append to " + stream, () -> {
            byte[] rawKey = raw(stream);
            Map<byte[], byte[]> rawFields = new LinkedHashMap<>();
            fields.forEach((k, v) -> rawFields.put(raw(k), raw(v)));
            XAddOptions options = maxLength > 0
                    ? XAddOptions.maxlen(maxLength).approximateTrimming(true)
                    : XAddOptions.none();
            RecordId id = redisTemplate.execute((RedisCallback<RecordId>) connection ->
                    connection.streamCommands().xAdd(MapRecord.create(rawKey, rawFields), options));
            if (id == null) {
                throw new StoreException("XADD to " + stream + " returned no id");
            }
            return id.getValue();
        });
    }

    @Override
    public List<StreamEntry> readGroup(String stream, String group, String consumer, int count, Duration block) {
        return call("read group " + group + " from " + stream, () -> {
            StreamReadOptions options = StreamReadOptions.empty().count(count);
            // BLOCK 0 would wait forever; omit it for a non-blocking read
            if (block != null && !block.isZero() && !block.isNegative()) {
                options = options.block(block);
            }
            List<MapRecord<String, Object, Object>> records = streams().read(
                    Consumer.from(group, consumer), options,
                    StreamOffset.create(stream, ReadOffset.lastConsumed()));
            return toEntries(records);
        });
    }

    @Override
    public long ack(String stream, String group, List<String> ids) {
        if (ids.isEmpty()) {
            return 0;
        }
        return call("acknowledge on " + stream,
                () -> orZero(streams().acknowledge(stream, group, ids.toArray(String[]::new))));
    }

    @Override
    public long delete(String stream, List<String> ids) {
        if (ids.isEmpty()) {
            return 0;
        }
        return call("delete from " + stream,
                () -> orZero(streams().delete(stream, ids.toArray(String[]::new))));
    }

    @Override
    public List<PendingEntry> pending(String stream, String group, int count) {
        return call("list pending of " + group + " on " + stream, () -> {
            PendingMessages messages = streams().pending(stream, group, Range.unbounded(), count);
            List<PendingEntry> entries = new ArrayList<>(messages.size());
            for (PendingMessage message : messages) {
                entries.add(new PendingEntry(
                        message.getIdAsString(),
                        message.getConsumerName(),
                        message.getElapsedTimeSinceLastDelivery(),
                        message.getTotalDeliveryCount()));
            }
            return entries;
        });
    }

    @Override
    public long pendingCount(String stream, String group) {
        return call("count pending of " + group + " on " + stream, () -> {
            PendingMessagesSummary summary = streams().pending(stream, group);
            return summary == null ? 0L : summary.getTotalPendingMessages();
        });
    }

    @Override
    public List<StreamEntry> claim(String stream, String group, String consumer, Duration minIdle, List<String> ids) {
        if (ids.isEmpty()) {
            return List.of();
        }
        return call("claim on " + stream, () -> {
            RecordId[] recordIds = ids.stream().map(RecordId::of).toArray(RecordId[]::new);
            return toEntries(streams().claim(stream, group, consumer, minIdle, recordIds));
        });
    }

    @Override
    public List<StreamEntry> range(String stream, String afterExclusive, int count) {
        return call("range over " + stream, () -> {
            if (afterExclusive == null) {
                return toEntries(streams().range(stream, Range.unbounded(), Limit.limit().count(count)));
            }
            // inclusive start, then drop the cursor entry itself
            List<StreamEntry> page = toEntries(streams().range(stream,
                    Range.rightUnbounded(Range.Bound.inclusive(afterExclusive)), Limit.limit().count(count + 1)));
            List<StreamEntry> result = new ArrayList<>(page.size());
            for (StreamEntry entry : page) {
                if (!entry.id().equals(afterExclusive) && result.size() < count) {
                    result.add(entry);
                }
            }
            return result;
        });
    }

    @Override
    public List<StreamEntry> reverseRange(String stream, int count) {
        return call("reverse range over " + stream,
                () -> toEntries(streams().reverseRange(stream, Range.unbounded(), Limit.limit().count(count))));
    }

    @Override
    public Optional<StreamEntry> get(String stream, String id) {
        return call("read " + id + " from " + stream,
                () -> toEntries(streams().range(stream, Range.closed(id, id))).stream().findFirst());
    }

    @Override
    public long length(String stream) {
        return call("length of " + stream, () -> orZero(streams().size(stream)));
    }

    private StreamOperations<String, Object, Object> streams() {
        return redisTemplate.opsForStream();
    }

    private static List<StreamEntry> toEntries(List<MapRecord<String, Object, Object>> records) {
        if (records == null || records.isEmpty()) {
            return List.of();
        }
        List<StreamEntry> entries = new ArrayList<>(records.size());
        for (MapRecord<String, Object, Object> record : records) {
            Map<String, String> fields = new LinkedHashMap<>();
            record.getValue().forEach((k, v) -> fields.put(String.valueOf(k), String.valueOf(v)));
            entries.add(new StreamEntry(record.getId().getValue(), fields));
        }
        return entries;
    }

    private static byte[] raw(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }

    private static long orZero(Long value) {
        return value == null ? 0L : value;
    }

    private static <T> T call(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            throw new StoreException("Redis failed to " + operation, e);
        }
    }
}
