package com.elime.service.correction;

/**
 * Fine-mode settings that carry over from one eye to the next within a
 * command run: the crop size and the crosshair style.
 */
public class ZoomSettings {

    static final int MIN_EYE_SIZE = 20;
    static final double EYE_SIZE_FRACTION = 0.10;

    private int eyeSize;
    private int crosshairStyle;

    /**
     * Current crop size, sized from the first image seen if not set yet.
     */
    public int eyeSize(int imageWidth, int imageHeight) {
        if (eyeSize == 0) {
            eyeSize = Math.max(MIN_EYE_SIZE, (int) (EYE_SIZE_FRACTION * Math.max(imageWidth, imageHeight)));
        }
        return eyeSize;
    }

    public int crosshairStyle() {
        return crosshairStyle;
    }

    /** Keeps what the operator chose in a finished session. */
    public void remember(FineState state) {
        this.eyeSize = state.eyeSize();
        this.crosshairStyle = state.crosshairStyle();
    }
}
