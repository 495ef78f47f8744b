/**
 * Workflow history inspection: parsing raw event records, selecting and shaping events, and
 * decoding their payloads. No I/O; raw histories come from a {@link
 * io.wfpath.history.HistorySource}.
 */
package io.wfpath.history;
