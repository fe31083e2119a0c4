package gov.nih.ncats.molgraph.io;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

import gov.nih.ncats.molgraph.ChemException;
import gov.nih.ncats.molgraph.SmiFlavor;
import gov.nih.ncats.molgraph.SmilesOptions;
import gov.nih.ncats.molgraph.model.Molecule;
import gov.nih.ncats.molgraph.smiles.SmilesParser;

/**
 * Reads SMILES files: one structure per line, optionally followed by whitespace and a name.
 * A CXSMILES layer after the SMILES is kept with it; the name is then the text after the layer.
 * Blank lines and lines starting with {@code #} or {@code //} are skipped.
 */
public final class SmilesReader{
	private static final Logger logger = Logger.getLogger(SmilesReader.class.getName());

	private SmilesReader(){
		//can not instantiate
	}

	public static List<Molecule> read(String text) throws ChemException{
		return read(text, null);
	}

	/**
	 * Parse every SMILES line of the given text.
	 * @param text the text to read, can not be null.
	 * @param options the {@link SmilesOptions} to use; if null the defaults are used.
	 * @return the molecules in file order, never empty.
	 * @throws ChemException with kind EMPTY_INPUT if there are no SMILES lines,
	 * or the parse error of the first line that can not be read.
	 */
	public static List<Molecule> read(String text, SmilesOptions options) throws ChemException{
		Objects.requireNonNull(text);
		try{
			return read(new StringReader(text), options);
		}catch(ChemException e){
			throw e;
		}catch(IOException e){
			//a StringReader does not fail
			throw new IllegalStateException(e);
		}
	}

	public static List<Molecule> read(Reader reader) throws IOException{
		return read(reader, null);
	}

	public static List<Molecule> read(Reader reader, SmilesOptions options) throws IOException{
		SmilesOptions opts = Optional.ofNullable(options).orElseGet(SmilesOptions::new);
		SmilesParser parser = new SmilesParser(opts);
		boolean cxSmiles = opts.hasFlavor(SmiFlavor.CXSMILES);
		List<Molecule> molecules = new ArrayList<>();
		try(BufferedReader in = new BufferedReader(reader)){
			String rawLine;
			int lineNumber=0;
			while((rawLine = in.readLine()) !=null){
				lineNumber++;
				String line = rawLine.trim();
				if(line.isEmpty() || line.startsWith("#") || line.startsWith("//")){
					continue;
				}
				String[] parts = line.split("\\s+", 2);
				Molecule m;
				if(cxSmiles && parts.length>1 && parts[1].startsWith("|")){
					//the parser reads the CX layer and takes the text after it as the name
					m = parser.parseSmiles(line);
				}else{
					m = parser.parseSmiles(parts[0]);
					if(parts.length>1 && !parts[1].trim().isEmpty()){
						m.setName(parts[1].trim());
					}
				}
				logger.log(Level.FINE, "line " + lineNumber + ": " + m);
				molecules.add(m);
			}
		}
		if(molecules.isEmpty()){
			throw ChemException.emptyInput();
		}
		return molecules;
	}
}
