package io.recovery.stream;

import io.recovery.model.GroupCreation;
import io.recovery.model.PendingEntry;
import io.recovery.model.StreamEntry;
import io.recovery.spi.StreamStore;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Heap-backed {@link StreamStore} with Redis Streams consumer-group semantics:
 * {@code <ms>-<seq>} ids, per-group delivery cursor, pending-entry list with
 * delivery counts, and claim-by-idle-time.
 *
 * <p>Idle times are measured against the supplied {@link Clock}, so tests can
 * advance time without sleeping. Blocking reads wait in real time. All methods
 * are synchronized on the store.
 */
public final class InMemoryStreamStore implements StreamStore {
    private final Clock clock;
    private final Map<String, Stream> streams = new HashMap<>();

    public InMemoryStreamStore() {
        this(Clock.systemUTC());
    }

    public InMemoryStreamStore(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public synchronized GroupCreation createGroup(String stream, String group) {
        Stream s = stream(stream);
        if (s.groups.containsKey(group)) {
            return GroupCreation.ALREADY_EXISTS;
        }
        s.groups.put(group, new Group());
        return GroupCreation.CREATED;
    }

    @Override
    public synchronized String add(String stream, Map<String, String> fields, long maxLength) {
        Stream s = stream(stream);
        long millis = clock.millis();
        if (millis > s.lastMillis) {
            s.lastMillis = millis;
            s.lastSequence = 0;
        } else {
            s.lastSequence++;
        }
        EntryId id = new EntryId(s.lastMillis, s.lastSequence);
        s.entries.put(id, Map.copyOf(fields));
        if (maxLength > 0) {
            while (s.entries.size() > maxLength) {
                s.entries.pollFirstEntry();
            }
        }
        notifyAll();
        return id.toString();
    }

    @Override
    public synchronized List<StreamEntry> readGroup(String stream, String group, String consumer,
            int count, Duration block) {
        long deadline = System.nanoTime() + (block == null ? 0L : Math.max(0L, block.toNanos()));
        while (true) {
            List<StreamEntry> delivered = deliverNew(stream, group, consumer, count);
            long remainingMs = (deadline - System.nanoTime()) / 1_000_000L;
            if (!delivered.isEmpty() || remainingMs <= 0) {
                return delivered;
            }
            try {
                wait(remainingMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return List.of();
            }
        }
    }

    private List<StreamEntry> deliverNew(String stream, String group, String consumer, int count) {
        Group g = requireGroup(stream, group);
        Stream s = streams.get(stream);
        List<StreamEntry> delivered = new ArrayList<>();
        Instant now = clock.instant();
        for (Map.Entry<EntryId, Map<String, String>> entry : s.entries.tailMap(g.lastDelivered, false).entrySet()) {
            if (delivered.size() >= count) {
                break;
            }
            g.lastDelivered = entry.getKey();
            g.pending.put(entry.getKey(), new Delivery(consumer, now, 1));
            delivered.add(new StreamEntry(entry.getKey().toString(), entry.getValue()));
        }
        return delivered;
    }

    @Override
    public synchronized long ack(String stream, String group, List<String> ids) {
        Group g = requireGroup(stream, group);
        long acked = 0;
        for (String id : ids) {
            if (g.pending.remove(EntryId.parse(id)) != null) {
                acked++;
            }
        }
        return acked;
    }

    @Override
    public synchronized long delete(String stream, List<String> ids) {
        Stream s = streams.get(stream);
        if (s == null) {
            return 0;
        }
        long deleted = 0;
        for (String id : ids) {
            if (s.entries.remove(EntryId.parse(id)) != null) {
                deleted++;
            }
        }
        return deleted;
    }

    @Override
    public synchronized List<PendingEntry> pending(String stream, String group, int count) {
        Group g = requireGroup(stream, group);
        Instant now = clock.instant();
        List<PendingEntry> result = new ArrayList<>();
        for (Map.Entry<EntryId, Delivery> entry : g.pending.entrySet()) {
            if (result.size() >= count) {
                break;
            }
            Delivery d = entry.getValue();
            result.add(new PendingEntry(entry.getKey().toString(), d.consumer,
                    Duration.between(d.deliveredAt, now), d.count));
        }
        return result;
    }

    @Override
    public synchronized long pendingCount(String stream, String group) {
        return requireGroup(stream, group).pending.size();
    }

    @Override
    public synchronized List<StreamEntry> claim(String stream, String group, String consumer,
            Duration minIdle, List<String> ids) {
        Group g = requireGroup(stream, group);
        Stream s = streams.get(stream);
        Instant now = clock.instant();
        List<StreamEntry> claimed = new ArrayList<>();
        for (String rawId : ids) {
            EntryId id = EntryId.parse(rawId);
            Delivery d = g.pending.get(id);
            if (d == null || Duration.between(d.deliveredAt, now).compareTo(minIdle) < 0) {
                continue;
            }
            Map<String, String> fields = s.entries.get(id);
            if (fields == null) {
                // entry deleted while pending
                g.pending.remove(id);
                continue;
            }
            g.pending.put(id, new Delivery(consumer, now, d.count + 1));
            claimed.add(new StreamEntry(rawId, fields));
        }
        return claimed;
    }

    @Override
    public synchronized List<StreamEntry> range(String stream, String afterExclusive, int count) {
        Stream s = streams.get(stream);
        if (s == null) {
            return List.of();
        }
        NavigableMap<EntryId, Map<String, String>> view = afterExclusive == null
                ? s.entries
                : s.entries.tailMap(EntryId.parse(afterExclusive), false);
        return collect(view, count);
    }

    @Override
    public synchronized List<StreamEntry> reverseRange(String stream, int count) {
        Stream s = streams.get(stream);
        if (s == null) {
            return List.of();
        }
        return collect(s.entries.descendingMap(), count);
    }

    @Override
    public synchronized Optional<StreamEntry> get(String stream, String id) {
        Stream s = streams.get(stream);
        if (s == null) {
            return Optional.empty();
        }
        Map<String, String> fields = s.entries.get(EntryId.parse(id));
        return fields == null ? Optional.empty() : Optional.of(new StreamEntry(id, fields));
    }

    @Override
    public synchronized long length(String stream) {
        Stream s = streams.get(stream);
        return s == null ? 0 : s.entries.size();
    }

    private static List<StreamEntry> collect(NavigableMap<EntryId, Map<String, String>> view, int count) {
        List<StreamEntry> result = new ArrayList<>();
        for (Map.Entry<EntryId, Map<String, String>> entry : view.entrySet()) {
            if (result.size() >= count) {
                break;
            }
            result.add(new StreamEntry(entry.getKey().toString(), entry.getValue()));
        }
        return result;
    }

    private Stream stream(String key) {
        return streams.computeIfAbsent(key, k -> new Stream());
    }

    private Group requireGroup(String stream, String group) {
        Stream s = streams.get(stream);
        Group g = s == null ? null : s.groups.get(group);
        if (g == null) {
            throw new IllegalStateException("No consumer group " + group + " on stream " + stream);
        }
        return g;
    }

    private static final class Stream {
        final TreeMap<EntryId, Map<String, String>> entries = new TreeMap<>();
        final Map<String, Group> groups = new HashMap<>();
        long lastMillis = -1;
        long lastSequence;
    }

    private static final class Group {
        EntryId lastDelivered = new EntryId(0, 0);
        final TreeMap<EntryId, Delivery> pending = new TreeMap<>();
    }

    private record Delivery(String consumer, Instant deliveredAt, long count) {
    }

    private record EntryId(long millis, long sequence) implements Comparable<EntryId> {

        static EntryId parse(String id) {
            int dash = id.indexOf('-');
            try {
                if (dash < 0) {
                    return new EntryId(Long.parseLong(id), 0);
                }
                return new EntryId(Long.parseLong(id.substring(0, dash)), Long.parseLong(id.substring(dash + 1)));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid stream id: " + id, e);
            }
        }

        @Override
        public int compareTo(EntryId other) {
            int byMillis = Long.compare(millis, other.millis);
            return byMillis != 0 ? byMillis : Long.compare(sequence, other.sequence);
        }

        @Override
        public String toString() {
            return millis + "-" + sequence;
        }
    }
}
