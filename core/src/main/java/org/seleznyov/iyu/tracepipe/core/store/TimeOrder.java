package org.seleznyov.iyu.tracepipe.core.store;

public enum TimeOrder {
    ASC,
    DESC
}
