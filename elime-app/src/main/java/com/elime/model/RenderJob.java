package com.elime.model;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;

/**
 * One output frame: which stored photo to align, which date to stamp on it and
 * how bright it should be.
 */
public record RenderJob(
    PhotoRecord sourceRecord,
    LocalDate displayDate,
    double brightness
) {
    private static final DateTimeFormatter FILE_DATE = DateTimeFormatter.ofPattern("yyyy_MM_dd");

    public String outputFileName() {
        return "rendered_" + displayDate.format(FILE_DATE) + ".jpg";
    }
}
