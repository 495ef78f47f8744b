/**
 * Typed construction, rendering, parsing and validation of Temporal visibility filter strings.
 *
 * <p>Everything in this package is free of I/O. Server round trips go through {@link
 * io.wfpath.query.CountFunction}, supplied by the caller.
 */
package io.wfpath.query;
