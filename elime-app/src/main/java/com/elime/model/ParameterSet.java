package com.elime.model;

/**
 * Tuning handed to one cascade evaluation pass.
 */
public record ParameterSet(
    double scaleFactor,
    int minNeighbors,
    int flags,
    int minWidth,
    int minHeight
) {
    public static ParameterSet of(double scaleFactor, int minNeighbors, int minSize) {
        return new ParameterSet(scaleFactor, minNeighbors, 0, minSize, minSize);
    }

    @Override
    public String toString() {
        return scaleFactor + " " + minNeighbors + " " + flags + " (" + minWidth + ", " + minHeight + ")";
    }
}
