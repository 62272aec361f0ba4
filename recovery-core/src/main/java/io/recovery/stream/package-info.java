/**
 * In-memory stream, counter and tracker stores for tests and single-process use.
 */
package io.recovery.stream;
