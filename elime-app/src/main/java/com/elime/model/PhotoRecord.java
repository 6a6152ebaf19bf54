package com.elime.model;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * One row of the eye position store. Eye points are in native image space and
 * are either both present or both absent.
 */
public record PhotoRecord(
    String fileName,
    LocalDateTime captureTimestamp,
    Point leftEye,
    Point rightEye
) {
    public boolean isComplete() {
        return leftEye != null && rightEye != null;
    }

    public LocalDate captureDate() {
        return captureTimestamp.toLocalDate();
    }
}
