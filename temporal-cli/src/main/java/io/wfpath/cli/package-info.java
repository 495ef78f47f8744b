/**
 * Bridge to the {@code temporal} command line client: command building, process execution with a
 * timeout, and decoding of its JSON output.
 */
package io.wfpath.cli;
