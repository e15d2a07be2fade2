package org.seleznyov.iyu.tracepipe.core.ingest;

import java.util.List;

public record BatchIngestResult(
    int ok,
    List<FailedIngest> failed
) {

    public boolean allAccepted() {
        return failed.isEmpty();
    }
}
