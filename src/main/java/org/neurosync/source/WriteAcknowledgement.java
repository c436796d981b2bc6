package org.neurosync.source;

/**
 * Outcome of a write.
 *
 * @param id       id of the written annotation, built from the acknowledged key
 * @param key      key acknowledged by the backend, or the locally derived key
 * @param uploaded whether the annotation was sent to the backend
 */
public record WriteAcknowledgement(String id, String key, boolean uploaded) {
}
