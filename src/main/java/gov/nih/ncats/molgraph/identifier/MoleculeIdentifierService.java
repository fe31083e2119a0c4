package gov.nih.ncats.molgraph.identifier;

import java.io.IOException;
import java.util.EnumSet;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

import gov.nih.ncats.molgraph.SmiFlavor;
import gov.nih.ncats.molgraph.model.Molecule;
import gov.nih.ncats.molgraph.smiles.SmilesGenerator;
import gov.nih.ncats.molwitch.inchi.InChiResult;

/**
 * Bundles SMILES, isomeric SMILES, InChI and InChIKey for a molecule.
 * InChI problems never escape {@link #compute(Molecule)}; they are logged
 * and reported through the "Unavailable" text instead.
 */
public class MoleculeIdentifierService{
	private static final Logger logger = Logger.getLogger(MoleculeIdentifierService.class.getName());

	public static final String UNAVAILABLE = "Unavailable";

	private final InchiGenerator inchiGenerator;
	private final SmilesGenerator smilesGenerator;
	private final SmilesGenerator isoSmilesGenerator;

	public MoleculeIdentifierService(){
		this(new MolwitchInchiGenerator());
	}

	public MoleculeIdentifierService(InchiGenerator inchiGenerator){
		this(inchiGenerator, SmiFlavor.plain(), SmiFlavor.isomeric());
	}

	public MoleculeIdentifierService(InchiGenerator inchiGenerator, EnumSet<SmiFlavor> smilesFlavor, EnumSet<SmiFlavor> isoSmilesFlavor){
		this.inchiGenerator = Objects.requireNonNull(inchiGenerator);
		this.smilesGenerator = new SmilesGenerator(smilesFlavor);
		this.isoSmilesGenerator = new SmilesGenerator(isoSmilesFlavor);
	}

	public MoleculeIdentifiers compute(Molecule molecule){
		Objects.requireNonNull(molecule);
		String smiles = smilesGenerator.create(molecule);
		String isoSmiles = isoSmilesGenerator.create(molecule);

		String inchi;
		String inchiKey;
		try{
			InChiResult result = inchiGenerator.generate(molecule);
			String message = result==null? null: result.getMessage();
			inchi = valueOrUnavailable(result==null? null: result.getInchi(), message);
			inchiKey = valueOrUnavailable(result==null? null: result.getKey(), message);
			if(inchi.startsWith(UNAVAILABLE)){
				logger.log(Level.WARNING, "no InChI for " + molecule + ": " + message);
			}
		}catch(IOException | RuntimeException | LinkageError e){
			//LinkageError: the native InChI library could not be loaded
			logger.log(Level.WARNING, "InChI generation failed for " + molecule, e);
			inchi = unavailableText(e.getMessage());
			inchiKey = inchi;
		}
		return new MoleculeIdentifiers(smiles, isoSmiles, inchi, inchiKey);
	}

	private static String valueOrUnavailable(String value, String message){
		if(value==null || value.trim().isEmpty()){
			return unavailableText(message);
		}
		return value;
	}

	/**
	 * @return {@code Unavailable}, or {@code Unavailable (message)} when there is a non blank message.
	 */
	public static String unavailableText(String message){
		String trimmed = message==null? "": message.trim();
		if(trimmed.isEmpty()){
			return UNAVAILABLE;
		}
		return UNAVAILABLE + " (" + trimmed + ")";
	}
}
