/**
 * Small shared helpers: thread naming, best-effort side effects, timestamps and
 * flat JSON encoding.
 */
package io.recovery.util;
