package org.seleznyov.iyu.tracepipe.core.correlation;

import java.util.UUID;

public record PendingMessage(
    UUID correlationId,
    long sentAtMillis
) {

}
