package com.roddier.model;

/**
 * Indice de Noll j con su orden radial n y frecuencia azimutal m.
 * m > 0 usa cos(m*theta), m < 0 usa sin(|m|*theta).
 */
public class ZernikeTerm {

    private static final String[] NAMES = {
            "Piston",
            "Tilt X",
            "Tilt Y",
            "Defocus",
            "Astigmatism 45",
            "Astigmatism 0",
            "Coma Y",
            "Coma X",
            "Trefoil Y",
            "Trefoil X",
            "Spherical",
            "Sec. astigmatism 0",
            "Sec. astigmatism 45",
            "Tetrafoil X",
            "Tetrafoil Y",
            "Sec. coma X",
            "Sec. coma Y",
            "Sec. trefoil X",
            "Sec. trefoil Y",
            "Pentafoil X",
            "Pentafoil Y",
            "Sec. spherical"
    };

    public final int noll;
    public final int n;
    public final int m;

    private ZernikeTerm(int noll, int n, int m) {
        this.noll = noll;
        this.n = n;
        this.m = m;
    }

    public static ZernikeTerm fromNoll(int j) {
        if (j < 1) throw new IllegalArgumentException("Indice de Noll fuera de rango: " + j);
        int n = 0;
        int rest = j - 1;
        while (rest > n) {
            n++;
            rest -= n;
        }
        int m = (n % 2) + 2 * ((rest + ((n + 1) % 2)) / 2);
        if (m != 0 && j % 2 != 0) m = -m;
        return new ZernikeTerm(j, n, m);
    }

    public String name() {
        return noll <= NAMES.length ? NAMES[noll - 1] : "Z" + noll;
    }

    @Override
    public String toString() {
        return String.format("Z%d(n=%d, m=%d) %s", noll, n, m, name());
    }
}
