package org.seleznyov.iyu.tracepipe.domain.model.event;

import java.util.Map;

public record MetricPayload(
    String name,
    double value,
    Map<String, Object> metadata
) implements EventPayload {

}
