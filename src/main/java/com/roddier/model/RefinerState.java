package com.roddier.model;

public enum RefinerState {
    INITIAL,
    REGISTERING,
    SOLVING,
    CORRECTING,
    CONVERGED
}
