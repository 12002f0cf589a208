package com.roddier.exceptions;

public class ShapeMismatchException extends RoddierException {
    public ShapeMismatchException(String what, String expected, String actual) {
        super("Forma incompatible en " + what + ": se esperaba " + expected + " y se obtuvo " + actual);
    }
}
