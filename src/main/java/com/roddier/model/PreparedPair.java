package com.roddier.model;

public class PreparedPair {
    public final double[][] intra;
    public final double[][] extra;

    public PreparedPair(double[][] intra, double[][] extra) {
        this.intra = intra;
        this.extra = extra;
    }
}
