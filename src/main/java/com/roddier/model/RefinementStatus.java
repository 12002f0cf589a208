package com.roddier.model;

public enum RefinementStatus {
    CONVERGED,
    EXHAUSTED,
    DIVERGED
}
