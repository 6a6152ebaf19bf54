package com.elime.service.detection;

import com.elime.model.Cascade;
import com.elime.model.ParameterSet;
import com.elime.model.Rectangle;

import java.util.List;

/**
 * Hook for watching detection as it happens, used to show every pass when
 * detection debugging is switched on.
 */
public interface DetectionListener {

    DetectionListener NONE = new DetectionListener() {};

    default void onPass(Cascade cascade, ParameterSet parameters, Rectangle region, List<Rectangle> found) {
    }

    default void onResult(EyeDetection detection) {
    }
}
