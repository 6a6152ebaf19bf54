package com.elime.service.correction;

import com.elime.model.Point;

/**
 * Final native eye points of a photo, or a cancellation.
 */
public record CorrectionResult(SessionStatus status, Point leftEye, Point rightEye) {

    public static CorrectionResult cancelled() {
        return new CorrectionResult(SessionStatus.CANCELLED, null, null);
    }

    public static CorrectionResult committed(Point leftEye, Point rightEye) {
        return new CorrectionResult(SessionStatus.COMMITTED, leftEye, rightEye);
    }

    public boolean isCancelled() {
        return status == SessionStatus.CANCELLED;
    }
}
