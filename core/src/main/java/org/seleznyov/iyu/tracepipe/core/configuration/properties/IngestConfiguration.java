package org.seleznyov.iyu.tracepipe.core.configuration.properties;

public record IngestConfiguration(
    int maxPayloadBytes
) {

}
