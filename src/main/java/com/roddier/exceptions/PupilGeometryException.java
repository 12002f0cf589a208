package com.roddier.exceptions;

public class PupilGeometryException extends RoddierException {
    public PupilGeometryException(String message) {
        super("Geometria de pupila invalida: " + message);
    }
}
