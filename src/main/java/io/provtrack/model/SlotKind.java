package io.provtrack.model;

public enum SlotKind {
    INPUT("inputs", "input"),
    OUTPUT("outputs", "output"),
    PARAMETER("parameters", "parameter");

    private final String idSegment;
    private final String defaultName;

    SlotKind(String idSegment, String defaultName) {
        this.idSegment = idSegment;
        this.defaultName = defaultName;
    }

    public String idSegment() {
        return idSegment;
    }

    public String defaultName() {
        return defaultName;
    }
}
