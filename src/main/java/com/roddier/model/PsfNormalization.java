package com.roddier.model;

public enum PsfNormalization {
    /** Energia total = 1. */
    SUM,
    /** Pico = 1. */
    PEAK
}
