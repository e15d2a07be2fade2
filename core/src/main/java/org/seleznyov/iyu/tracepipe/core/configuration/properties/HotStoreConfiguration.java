package org.seleznyov.iyu.tracepipe.core.configuration.properties;

import java.time.Duration;

public record HotStoreConfiguration(
    int maxEvents,
    Duration maxAge,
    Duration pruneInterval
) {

}
