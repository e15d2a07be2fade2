package org.seleznyov.iyu.tracepipe.domain.model.correlation;

/**
 * Confidence levels assigned by the correlator. Monotonic: more matching evidence never
 * lowers the score.
 */
public final class Confidence {

    /** Entry/exit matched on the stack, send/receive paired, or a fresh root. */
    public static final double FULL = 1.0;

    /** Chain recorded but one side is missing: orphan exit, receive without send. */
    public static final double PARTIAL = 0.5;

    /** Malformed input, id assigned only so the event is not lost. */
    public static final double NONE = 0.0;

    private Confidence() {

    }
}
