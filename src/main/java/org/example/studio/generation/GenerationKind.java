package org.example.studio.generation;

public enum GenerationKind {
    CHARACTER_PORTRAIT("character-portrait"),
    CHARACTER_SKETCH("character-sketch"),
    PAGE_ILLUSTRATION("page-illustration"),
    PAGE_SKETCH("page-sketch");

    private final String assetSegment;

    GenerationKind(String assetSegment) {
        this.assetSegment = assetSegment;
    }

    public String assetSegment() {
        return assetSegment;
    }

    public boolean isSketch() {
        return this == CHARACTER_SKETCH || this == PAGE_SKETCH;
    }
}
