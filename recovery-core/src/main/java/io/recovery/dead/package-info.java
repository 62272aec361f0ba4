/**
 * Dead-letter stream handling: move, replay and archive-then-trim.
 */
package io.recovery.dead;
