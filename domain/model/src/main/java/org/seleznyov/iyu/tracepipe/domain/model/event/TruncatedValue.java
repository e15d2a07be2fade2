package org.seleznyov.iyu.tracepipe.domain.model.event;

/**
 * Marker left in place of a payload value that exceeded the size threshold.
 *
 * @param originalSize serialized size of the dropped value in bytes
 * @param typeHint     simple type name of the dropped value, e.g. {@code List} or {@code String}
 */
public record TruncatedValue(
    long originalSize,
    String typeHint
) {

    public boolean truncated() {
        return true;
    }
}
