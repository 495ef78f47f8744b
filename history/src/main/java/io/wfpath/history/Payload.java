package io.wfpath.history;

/**
 * A payload reference found inside event attributes.
 *
 * @param path dotted location of the enclosing {@code payloads} array within the attributes, e.g.
 *     {@code input} or {@code failure.cause.details}
 * @param encoding value of the payload's {@code encoding} metadata entry, or null if absent
 * @param data base64 payload bytes exactly as recorded
 */
public record Payload(String path, String encoding, String data) {}
