package com.elime.service.detection;

import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Opens the OpenCV cascades found in a folder.
 */
@Component
public class DetectorProviderFactory {

    /**
     * @throws com.elime.service.ResourceMissingException if the folder or any cascade file is missing
     */
    public DetectorProvider open(Path cascadeFolder) {
        return CascadeLibrary.open(cascadeFolder);
    }
}
