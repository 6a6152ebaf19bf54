package com.elime.service.detection;

import com.elime.model.Cascade;
import com.elime.model.ParameterSet;

import java.util.List;

/**
 * Fixed escalation tables for face and eye search.
 */
public final class DetectionParameters {

    /** Eye cascades in the order they are tried. */
    public static final List<Cascade> EYE_CASCADES = List.of(Cascade.EYE_TREE_EYEGLASSES, Cascade.EYE);

    public static final List<ParameterSet> EYE_PARAMETERS = List.of(
        ParameterSet.of(1.1, 3, 20),
        ParameterSet.of(1.01, 3, 10),
        ParameterSet.of(1.05, 3, 15),
        ParameterSet.of(1.025, 3, 10),
        ParameterSet.of(1.075, 3, 10),
        ParameterSet.of(1.125, 3, 10),
        ParameterSet.of(1.15, 3, 15),
        ParameterSet.of(1.1, 2, 30)
    );

    private static final double[] FACE_SIZE_FRACTIONS = {1.0, 0.7, 0.4, 0.1, 0.01};

    private DetectionParameters() {
    }

    /**
     * Face passes for an image whose shorter side is {@code minDimension}:
     * a fixed 20px pass, then minimum sizes shrinking from the whole image
     * down to one percent of it.
     */
    public static List<ParameterSet> faceParameters(int minDimension) {
        ParameterSet[] sets = new ParameterSet[FACE_SIZE_FRACTIONS.length + 1];
        sets[0] = ParameterSet.of(1.1, 3, 20);
        for (int i = 0; i < FACE_SIZE_FRACTIONS.length; i++) {
            sets[i + 1] = ParameterSet.of(1.1, 3, (int) (FACE_SIZE_FRACTIONS[i] * minDimension));
        }
        return List.of(sets);
    }
}
