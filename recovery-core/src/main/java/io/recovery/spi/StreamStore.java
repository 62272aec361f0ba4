package io.recovery.spi;

import io.recovery.model.GroupCreation;
import io.recovery.model.PendingEntry;
import io.recovery.model.StreamEntry;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Adapter over an append-only log with consumer-group support.
 *
 * <p>Every method takes the stream key explicitly so one store instance serves
 * both the work stream and the dead-letter stream. Implementations wrap client
 * failures in {@link StoreException}.
 *
 * @see io.recovery.stream.InMemoryStreamStore
 */
public interface StreamStore {

    /**
     * Registers a consumer group reading from the start of the stream, creating
     * the stream if it does not exist.
     *
     * @return {@link GroupCreation#ALREADY_EXISTS} if the group was already registered
     */
    GroupCreation createGroup(String stream, String group);

    /**
     * Appends an entry.
     *
     * @param maxLength approximate length bound; older entries may be trimmed.
     *                  {@code <= 0} disables trimming
     * @return the assigned id
     */
    String add(String stream, Map<String, String> fields, long maxLength);

    /**
     * Reads entries never delivered to the group, marking them pending for {@code consumer}.
     *
     * @param block how long to wait for new entries; zero or negative returns immediately
     * @return delivered entries, empty on timeout
     */
    List<StreamEntry> readGroup(String stream, String group, String consumer, int count, Duration block);

    /**
     * Removes entries from the group's pending-entry list.
     *
     * @return number of entries acknowledged
     */
    long ack(String stream, String group, List<String> ids);

    /**
     * Deletes entries from the stream.
     *
     * @return number of entries deleted
     */
    long delete(String stream, List<String> ids);

    /**
     * Lists pending entries in id order.
     */
    List<PendingEntry> pending(String stream, String group, int count);

    long pendingCount(String stream, String group);

    /**
     * Transfers ownership of pending entries idle for at least {@code minIdle}.
     * Atomic per entry: of two concurrent claimers only one receives a given entry.
     *
     * @return the entries now owned by {@code consumer}
     */
    List<StreamEntry> claim(String stream, String group, String consumer, Duration minIdle, List<String> ids);

    /**
     * Reads entries in id order.
     *
     * @param afterExclusive start after this id, or {@code null} to start at the oldest entry
     */
    List<StreamEntry> range(String stream, String afterExclusive, int count);

    /**
     * Reads the newest entries, newest first.
     */
    List<StreamEntry> reverseRange(String stream, int count);

    Optional<StreamEntry> get(String stream, String id);

    long length(String stream);
}
