package org.seleznyov.iyu.tracepipe.core.correlation;

import java.util.UUID;

record SpawnRecord(
    UUID spawnCorrelationId,
    String parentProducerId,
    long createdAtMillis
) {

}
