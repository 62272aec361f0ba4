package io.recovery.spi;

/**
 * Short-lived record of replayed dead-letter ids, consulted in addition to the
 * durable {@link ReplayLogStore}. Entries may expire; the ledger is authoritative.
 */
public interface ReplayTracker {

    boolean isReplayed(String dlMsgId);

    void markReplayed(String dlMsgId);
}
