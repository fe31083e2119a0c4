package gov.nih.ncats.molgraph.io;

import java.io.IOException;
import java.io.Writer;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;

import gov.nih.ncats.molgraph.ChemException;
import gov.nih.ncats.molgraph.SmiFlavor;
import gov.nih.ncats.molgraph.model.Molecule;
import gov.nih.ncats.molgraph.smiles.SmilesGenerator;

/**
 * Writes molecules as SMILES lines {@code smiles name}, each ending with {@code \n}.
 */
public final class SmilesWriter{

	private SmilesWriter(){
		//can not instantiate
	}

	public static String write(List<Molecule> molecules) throws ChemException{
		return write(molecules, SmiFlavor.plain());
	}

	public static String write(List<Molecule> molecules, EnumSet<SmiFlavor> flavors) throws ChemException{
		Objects.requireNonNull(molecules);
		if(molecules.isEmpty()){
			throw ChemException.emptyInput();
		}
		SmilesGenerator generator = new SmilesGenerator(flavors);
		StringBuilder sb = new StringBuilder();
		for(Molecule m : molecules){
			String smiles = generator.create(m).trim();
			if(smiles.isEmpty()){
				throw ChemException.parseFailed("SMILES generator produced an empty line.");
			}
			sb.append(smiles);
			String name = normalizedName(m.getName());
			if(!name.isEmpty()){
				sb.append(' ').append(name);
			}
			sb.append('\n');
		}
		return sb.toString();
	}

	public static void write(List<Molecule> molecules, EnumSet<SmiFlavor> flavors, Writer out) throws IOException{
		out.write(write(molecules, flavors));
		out.flush();
	}

	private static String normalizedName(String raw){
		if(raw==null){
			return "";
		}
		return raw.replace('\r', ' ').replace('\n', ' ').trim();
	}
}
