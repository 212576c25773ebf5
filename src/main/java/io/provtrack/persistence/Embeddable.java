package io.provtrack.persistence;

/**
 * A value stored inline inside its owner's record rather than as a record of
 * its own. Embedded values have no identity and are never shared.
 */
public interface Embeddable {
    String embeddedType();

    void writeTo(StateWriter out);
}
