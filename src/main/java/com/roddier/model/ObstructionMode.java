package com.roddier.model;

/** Como se obtiene el radio interior de la pupila anular. */
public enum ObstructionMode {
    /** Distancia minima de los pixeles umbralizados al centro. */
    AUTO,
    /** R_out * (secundario / primario). */
    PHYSICAL_RATIO
}
