package gov.nih.ncats.molgraph.smiles;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import gov.nih.ncats.molgraph.ChemException;
import gov.nih.ncats.molgraph.model.Atom;
import gov.nih.ncats.molgraph.model.Molecule;

/**
 * Splits a CXSMILES line into the core SMILES, the CX layer between {@code |} and an optional title,
 * and reads the subset of CX layers that matter here: atom labels {@code $...$},
 * racemic flags {@code r} / {@code r:...} and fragment groups {@code f:...}.
 * Other layers are ignored.
 */
public final class CxSmilesParser{
	private static final Logger logger = Logger.getLogger(CxSmilesParser.class.getName());

	private static final Pattern ENTITY = Pattern.compile("&#(\\d+);");

	private CxSmilesParser(){
		//can not instantiate
	}

	/**
	 * The three parts of a CXSMILES line.
	 */
	public static final class Split{
		private final String coreSmiles;
		private final String title;
		private final CxSmilesState state;

		Split(String coreSmiles, String title, CxSmilesState state){
			this.coreSmiles = coreSmiles;
			this.title = title;
			this.state = state;
		}

		public String getCoreSmiles() {
			return coreSmiles;
		}

		public Optional<String> getTitle() {
			return Optional.ofNullable(title);
		}

		public CxSmilesState getState() {
			return state;
		}
	}

	/**
	 * Split the given text.
	 * @param input the text to split, may be a plain SMILES.
	 * @param enabled when false the whole (trimmed) text is the core SMILES.
	 * @return the Split; never null.
	 * @throws ChemException if the input is blank or the CX layer is malformed.
	 */
	public static Split split(String input, boolean enabled) throws ChemException{
		String trimmed = input==null? "": input.trim();
		if(trimmed.isEmpty()){
			throw ChemException.emptyInput();
		}
		int firstPipe = trimmed.indexOf('|');
		if(!enabled || firstPipe <0){
			return new Split(trimmed, null, new CxSmilesState());
		}
		int secondPipe = trimmed.indexOf('|', firstPipe+1);
		if(secondPipe <0){
			throw ChemException.parseFailed("Unterminated CXSMILES layer (missing closing '|').");
		}
		String core = trimmed.substring(0, firstPipe).trim();
		String body = trimmed.substring(firstPipe+1, secondPipe);
		String trailing = trimmed.substring(secondPipe+1).trim();

		if(core.isEmpty()){
			throw ChemException.parseFailed("Missing core SMILES before CXSMILES layer.");
		}
		if(trailing.contains("|")){
			throw ChemException.parseFailed("Malformed CXSMILES tail.");
		}
		CxSmilesState state = parseLayers(body);
		logger.log(Level.FINE, "CX layer of " + core + " : " + state);
		return new Split(core, trailing.isEmpty()? null : trailing, state);
	}

	/**
	 * Replace the element of every labelled atom (by zero based index) with its label
	 * and clear its aromatic flag. Out of range indexes are ignored.
	 */
	public static void applyAtomLabels(Molecule molecule, CxSmilesState state){
		applyAtomLabels(molecule, state, 0);
	}

	/**
	 * Same as {@link #applyAtomLabels(Molecule, CxSmilesState)} where label index
	 * {@code offset} is the first atom of this molecule.
	 */
	static void applyAtomLabels(Molecule molecule, CxSmilesState state, int offset){
		List<Atom> atoms = molecule.getAtoms();
		for(Map.Entry<Integer,String> e : state.getAtomLabels().entrySet()){
			int index = e.getKey()-offset;
			if(index <0 || index >= atoms.size()){
				continue;
			}
			atoms.get(index)
				.setElement(e.getValue())
				.setAromatic(false);
		}
	}

	private static CxSmilesState parseLayers(String raw) throws ChemException{
		CxSmilesState state = new CxSmilesState();
		for(String layer : splitTopLevelLayers(raw)){
			String token = layer.trim();
			if(token.isEmpty()){
				continue;
			}
			if(token.startsWith("$")){
				if(token.length()<2 || !token.endsWith("$")){
					throw ChemException.parseFailed("Malformed CXSMILES atom-label layer.");
				}
				parseAtomLabels(token.substring(1, token.length()-1), state);
			}else if(token.equals("r")){
				state.setRacemic(true);
			}else if(token.startsWith("r:")){
				for(String v : token.substring(2).split(",")){
					if(v.isEmpty())continue;
					state.addRacemicFragment(parseIndex(v, "Malformed CXSMILES racemic-fragment layer."));
				}
			}else if(token.startsWith("f:")){
				String body = token.substring(2);
				if(body.isEmpty()){
					continue;
				}
				for(String group : body.split(",")){
					List<Integer> ids = new ArrayList<>();
					for(String v : group.split("\\.")){
						try{
							ids.add(Integer.parseInt(v.trim()));
						}catch(NumberFormatException ex){
							//skip, an all-garbage group is rejected below
							logger.log(Level.FINE, "ignoring fragment entry '" + v + "'");
						}
					}
					if(ids.isEmpty()){
						throw ChemException.parseFailed("Malformed CXSMILES fragment-group layer.");
					}
					state.addFragmentGroup(ids);
				}
			}
		}
		return state;
	}

	private static int parseIndex(String v, String error) throws ChemException{
		try{
			return Integer.parseInt(v.trim());
		}catch(NumberFormatException e){
			throw ChemException.parseFailed(error);
		}
	}

	private static void parseAtomLabels(String content, CxSmilesState state){
		List<String> entries = splitLabelEntries(content);
		for(int i=0; i< entries.size(); i++){
			if(entries.get(i).isEmpty()){
				continue;
			}
			String label = unescape(entries.get(i));
			if(label.startsWith("_")){
				label = label.substring(1);
			}
			state.putAtomLabel(i, label);
		}
	}

	/**
	 * Split the body of a {@code $...$} layer on {@code ;}, keeping empty entries.
	 * A character reference such as {@code &#59;} stays whole, so its closing {@code ;}
	 * is not a separator.
	 */
	static List<String> splitLabelEntries(String content){
		List<String> entries = new ArrayList<>();
		StringBuilder current = new StringBuilder();
		Matcher entity = ENTITY.matcher(content);
		int i=0;
		while(i<content.length()){
			char ch = content.charAt(i);
			if(ch=='&'){
				entity.region(i, content.length());
				if(entity.lookingAt()){
					current.append(entity.group());
					i = entity.end();
					continue;
				}
			}
			if(ch==';'){
				entries.add(current.toString());
				current.setLength(0);
			}else{
				current.append(ch);
			}
			i++;
		}
		entries.add(current.toString());
		return entries;
	}

	private static List<String> splitTopLevelLayers(String input){
		List<String> out = new ArrayList<>();
		StringBuilder current = new StringBuilder();
		boolean inAtomLabel = false;
		int depth=0;
		for(char ch : input.toCharArray()){
			if(ch=='$'){
				inAtomLabel = !inAtomLabel;
			}else if(!inAtomLabel){
				if(ch=='('){
					depth++;
				}else if(ch==')'){
					depth = Math.max(0, depth-1);
				}else if(ch==',' && depth==0){
					out.add(current.toString());
					current.setLength(0);
					continue;
				}
			}
			current.append(ch);
		}
		out.add(current.toString());
		return joinListContinuations(out);
	}

	/**
	 * {@code f:0.1,2.3} and {@code r:0,2} use the layer separator between their entries,
	 * so a chunk starting with a digit belongs to the preceding list layer.
	 */
	private static List<String> joinListContinuations(List<String> chunks){
		List<String> out = new ArrayList<>();
		for(String chunk : chunks){
			String trimmed = chunk.trim();
			if(!out.isEmpty() && !trimmed.isEmpty() && Character.isDigit(trimmed.charAt(0))){
				String previous = out.get(out.size()-1).trim();
				if(previous.startsWith("f:") || previous.startsWith("r:")){
					out.set(out.size()-1, previous + "," + trimmed);
					continue;
				}
			}
			out.add(chunk);
		}
		return out;
	}

	static String unescape(String input){
		String out = input;
		Matcher m = ENTITY.matcher(out);
		while(m.find()){
			int cp;
			try{
				cp = Integer.parseInt(m.group(1));
			}catch(NumberFormatException e){
				break;
			}
			if(!Character.isValidCodePoint(cp)){
				break;
			}
			out = out.substring(0, m.start()) + new String(Character.toChars(cp)) + out.substring(m.end());
			m = ENTITY.matcher(out);
		}
		return out;
	}
}
