package gov.nih.ncats.molgraph.identifier;

import java.io.IOException;
import java.util.Objects;

import gov.nih.ncats.molgraph.io.MolfileWriter;
import gov.nih.ncats.molgraph.model.Molecule;
import gov.nih.ncats.molwitch.Chemical;
import gov.nih.ncats.molwitch.inchi.InChiResult;
import gov.nih.ncats.molwitch.inchi.Inchi;

/**
 * {@link InchiGenerator} backed by molwitch: the molecule is written as a molfile,
 * read back as a {@link Chemical} and handed to the molwitch implementation
 * found on the classpath.
 */
public class MolwitchInchiGenerator implements InchiGenerator{

	private final MolfileWriter molfileWriter;

	public MolwitchInchiGenerator(){
		this(new MolfileWriter());
	}

	public MolwitchInchiGenerator(MolfileWriter molfileWriter){
		this.molfileWriter = Objects.requireNonNull(molfileWriter);
	}

	@Override
	public InChiResult generate(Molecule molecule) throws IOException{
		Chemical c = Chemical.parseMol(molfileWriter.toMolfile(molecule));
		return Inchi.asStdInchi(c);
	}
}
