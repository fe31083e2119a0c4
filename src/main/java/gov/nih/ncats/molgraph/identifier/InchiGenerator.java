package gov.nih.ncats.molgraph.identifier;

import java.io.IOException;

import gov.nih.ncats.molgraph.model.Molecule;
import gov.nih.ncats.molwitch.inchi.InChiResult;

/**
 * Computes the standard InChI of a molecule.
 */
public interface InchiGenerator{

	InChiResult generate(Molecule molecule) throws IOException;
}
