package com.roddier.exceptions;

public class RoddierException extends RuntimeException {
    public RoddierException(String message) {
        super(message);
    }
}
