package gov.nih.ncats.molgraph.model;

/**
 * Tetrahedral chirality tag as written in SMILES.
 */
public enum Chirality {
	NONE,
	CLOCKWISE,
	ANTICLOCKWISE
}
