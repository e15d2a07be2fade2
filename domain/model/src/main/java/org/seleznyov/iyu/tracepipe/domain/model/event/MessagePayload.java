package org.seleznyov.iyu.tracepipe.domain.model.event;

/**
 * Message send or receive. {@code contentHash} is taken from the full content before any
 * truncation so that a send and its receive keep the same signature.
 */
public record MessagePayload(
    String senderId,
    String receiverId,
    Object content,
    long contentHash
) implements EventPayload {

}
