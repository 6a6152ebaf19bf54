package com.elime.service;

/**
 * The eye position store holds more than one record for a photo. Nothing
 * repairs this automatically; the run stops.
 */
public class StoreCorruptionException extends RuntimeException {

    private final String fileName;
    private final int occurrences;

    public StoreCorruptionException(String fileName, int occurrences) {
        super("Database in bad shape. Found " + occurrences + " occurrences of photo named " + fileName);
        this.fileName = fileName;
        this.occurrences = occurrences;
    }

    public String getFileName() {
        return fileName;
    }

    public int getOccurrences() {
        return occurrences;
    }
}
