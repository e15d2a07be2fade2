package org.seleznyov.iyu.tracepipe.domain.model.correlation;

public enum RelationKind {
    /** Nested call: target is the enclosing call's correlation id. */
    CHILD_OF,
    /** Message receive: target is the matching send's correlation id. */
    RECEIVES,
    /** First call on a spawned producer: target is the spawning correlation id. */
    SPAWNED_BY,
    /** State change: target is the last matched receive on the same producer. */
    TRIGGERED_BY
}
