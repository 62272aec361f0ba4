package io.recovery.model;

/**
 * Point-in-time statistics for a stream and one of its consumer groups.
 *
 * @param stream       stream key
 * @param group        consumer group name
 * @param length       number of entries in the stream
 * @param pendingCount number of delivered but unacknowledged entries in the group
 */
public record StreamInfo(String stream, String group, long length, long pendingCount) {
}
