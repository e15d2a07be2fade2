package org.seleznyov.iyu.tracepipe.core.correlation;

/**
 * Key pairing a send with its receive.
 */
public record MessageSignature(
    String senderId,
    String receiverId,
    long contentHash
) {

}
