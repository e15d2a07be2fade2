package org.seleznyov.iyu.tracepipe.domain.model.event;

public record StateDiff(
    boolean changed,
    long sizeDelta
) {

    public static final StateDiff NO_CHANGE = new StateDiff(false, 0L);

    public static StateDiff changed(long sizeDelta) {
        return new StateDiff(true, sizeDelta);
    }
}
