package io.recovery.model;

/**
 * Outcome of registering a consumer group on a stream.
 */
public enum GroupCreation {
    CREATED,
    ALREADY_EXISTS
}
