package gov.nih.ncats.molgraph;

import java.util.EnumSet;

/**
 * Switches that change how SMILES is read and written.
 */
public enum SmiFlavor {
    /**
     * Lowercase aromatic atoms are read as aromatic and written back in lowercase.
     */
    USE_AROMATIC_SYMBOLS,
    /**
     * Chiral tags, isotopes and directional bonds are kept.
     */
    ISOMERIC,
    /**
     * Reject dangling bonds, empty atom classes and unknown bracket decorators.
     */
    STRICT,
    /**
     * Read the trailing {@code |...|} CXSMILES layer.
     */
    CXSMILES;

    public static EnumSet<SmiFlavor> defaults(){
        return EnumSet.allOf(SmiFlavor.class);
    }

    /**
     * Flavor used for canonical-ish (non isomeric) output.
     */
    public static EnumSet<SmiFlavor> plain(){
        return EnumSet.of(USE_AROMATIC_SYMBOLS, STRICT);
    }

    public static EnumSet<SmiFlavor> isomeric(){
        return EnumSet.of(USE_AROMATIC_SYMBOLS, ISOMERIC, STRICT);
    }
}
