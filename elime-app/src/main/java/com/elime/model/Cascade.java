package com.elime.model;

/**
 * Haar cascades the detector works with, by file name inside the cascade folder.
 */
public enum Cascade {

    FRONTAL_FACE("haarcascade_frontalface_default.xml"),
    EYE_TREE_EYEGLASSES("haarcascade_eye_tree_eyeglasses.xml"),
    EYE("haarcascade_eye.xml");

    private final String fileName;

    Cascade(String fileName) {
        this.fileName = fileName;
    }

    public String fileName() {
        return fileName;
    }
}
