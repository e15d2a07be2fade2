package org.seleznyov.iyu.tracepipe.core.store;

import org.seleznyov.iyu.tracepipe.domain.model.correlation.CorrelatedEvent;

import java.util.List;

public record QueryResult(
    List<CorrelatedEvent> events,
    QueryStatus status
) {

    static final QueryResult INVALID_RANGE = new QueryResult(List.of(), QueryStatus.INVALID_RANGE);
    static final QueryResult INVALID_LIMIT = new QueryResult(List.of(), QueryStatus.INVALID_LIMIT);

    static QueryResult ok(List<CorrelatedEvent> events) {
        return new QueryResult(List.copyOf(events), QueryStatus.OK);
    }

    public boolean isOk() {
        return status == QueryStatus.OK;
    }

    public int size() {
        return events.size();
    }
}
