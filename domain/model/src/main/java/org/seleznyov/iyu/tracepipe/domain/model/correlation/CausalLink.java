package org.seleznyov.iyu.tracepipe.domain.model.correlation;

import java.util.UUID;

public record CausalLink(
    RelationKind relation,
    UUID targetId
) {

}
