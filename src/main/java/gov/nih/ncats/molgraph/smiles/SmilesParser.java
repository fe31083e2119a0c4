package gov.nih.ncats.molgraph.smiles;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

import gov.nih.ncats.molgraph.ChemException;
import gov.nih.ncats.molgraph.SmiFlavor;
import gov.nih.ncats.molgraph.SmilesOptions;
import gov.nih.ncats.molgraph.layout.StructureDiagramGenerator;
import gov.nih.ncats.molgraph.model.Atom;
import gov.nih.ncats.molgraph.model.Bond;
import gov.nih.ncats.molgraph.model.BondOrder;
import gov.nih.ncats.molgraph.model.BondStereo;
import gov.nih.ncats.molgraph.model.Chirality;
import gov.nih.ncats.molgraph.model.Molecule;
import gov.nih.ncats.molgraph.model.Reaction;

/**
 * Reads SMILES (and the CXSMILES layer) into a {@link Molecule}.
 * Instances are immutable and can be shared between threads.
 */
public class SmilesParser{
	private static final Logger logger = Logger.getLogger(SmilesParser.class.getName());

	public static final String DEFAULT_NAME = "SMILES";

	private static final Set<String> ORGANIC_SUBSET = new HashSet<>(Arrays.asList(
			"B","C","N","O","P","S","F","I","H","D","T"));
	private static final Set<Character> AROMATIC_SINGLE = new HashSet<>(Arrays.asList('b','c','n','o','p','s'));
	private static final Set<String> CHIRAL_CLASSES = new HashSet<>(Arrays.asList("TH","AL","SP","TB","OH"));

	private static final Set<String> DONOR_ELEMENTS = new HashSet<>(Arrays.asList("O","S","SE","AS"));
	private static final Set<String> ANIONIC_DONORS = new HashSet<>(Arrays.asList("N","O","S","SE","AS","P"));

	private final SmilesOptions options;

	public SmilesParser(){
		this(new SmilesOptions());
	}

	public SmilesParser(SmilesOptions options){
		this.options = Objects.requireNonNull(options);
	}

	public SmilesOptions getOptions() {
		return options;
	}

	private boolean has(SmiFlavor f){
		return options.hasFlavor(f);
	}

	/**
	 * Parse a single SMILES, optionally followed by a CXSMILES layer and a title.
	 * @param smiles the text to parse.
	 * @return a new Molecule; laid out if coordinate generation is on.
	 * @throws ChemException if the input is empty or malformed.
	 */
	public Molecule parseSmiles(String smiles) throws ChemException{
		CxSmilesParser.Split split = CxSmilesParser.split(smiles, has(SmiFlavor.CXSMILES));
		Molecule m = parseCoreSmiles(split.getCoreSmiles());
		CxSmilesState state = split.getState();
		CxSmilesParser.applyAtomLabels(m, state);
		split.getTitle().ifPresent(m::setName);

		if(state.isRacemic()){
			m.setRacemic(true);
		}else if(!state.getRacemicFragments().isEmpty()){
			int components = m.getConnectedComponents().size();
			m.setRacemic(state.getRacemicFragments().stream().anyMatch(i-> i>=0 && i < components));
		}
		return m;
	}

	public Reaction parseReactionSmiles(String smiles) throws ChemException{
		return new SmilesReactionParser(this).parse(smiles);
	}

	/**
	 * Parse the core grammar only (no CX layer).
	 */
	public Molecule parseCoreSmiles(String smiles) throws ChemException{
		String source = smiles==null? "" : smiles.trim();
		if(source.isEmpty()){
			throw ChemException.emptyInput();
		}
		Molecule molecule = new Cursor(source).parse();

		validateAromaticConstraints(molecule);
		annotateDirectionalDoubleBonds(molecule);

		if(options.isGenerateCoordinates()){
			molecule = new StructureDiagramGenerator(options.getLayoutOptions()).generate(molecule);
			molecule.assignWedgeHashFromChiralCenters();
		}
		logger.log(Level.FINE, "parsed " + source + " into " + molecule);
		return molecule;
	}

	private static final class RingOpening{
		final int atomId;
		final BondOrder order;
		final BondStereo stereo;

		RingOpening(int atomId, BondOrder order, BondStereo stereo){
			this.atomId = atomId;
			this.order = order;
			this.stereo = stereo;
		}
	}

	/**
	 * Single use parse state over one SMILES string.
	 */
	private final class Cursor{
		private final String source;
		private int i=0;

		private final Molecule molecule = new Molecule(DEFAULT_NAME);
		private Integer currentAtom;
		private final Deque<Integer> branchStack = new ArrayDeque<>();
		private final Map<Integer,RingOpening> ringClosures = new TreeMap<>();
		private BondOrder pendingOrder;
		private BondStereo pendingStereo;

		Cursor(String source){
			this.source = source;
		}

		private char peek(int offset){
			int p = i+offset;
			return p < source.length()? source.charAt(p) : 0;
		}

		private char peek(){
			return peek(0);
		}

		private boolean atEnd(){
			return i >= source.length();
		}

		private String readDigits(int max){
			int start = i;
			while(!atEnd() && Character.isDigit(peek()) && (max<0 || i-start < max)){
				i++;
			}
			return source.substring(start, i);
		}

		private String readDigits(){
			return readDigits(-1);
		}

		private Integer readNumber(Integer ifMissing) throws ChemException{
			String digits = readDigits();
			if(digits.isEmpty()){
				return ifMissing;
			}
			try{
				return Integer.parseInt(digits);
			}catch(NumberFormatException e){
				throw ChemException.parseFailed("Number out of range '" + digits + "' in SMILES.");
			}
		}

		Molecule parse() throws ChemException{
			while(!atEnd()){
				char ch = peek();
				switch(ch){
					case '(':
						if(currentAtom==null){
							throw ChemException.parseFailed("Branch start '(' has no parent atom.");
						}
						branchStack.push(currentAtom);
						i++;
						break;
					case ')':
						if(branchStack.isEmpty()){
							throw ChemException.parseFailed("Branch close ')' without matching '('.");
						}
						currentAtom = branchStack.pop();
						i++;
						break;
					case '-':
						setPending(BondOrder.SINGLE, null);
						break;
					case '=':
						setPending(BondOrder.DOUBLE, null);
						break;
					case '#':
						setPending(BondOrder.TRIPLE, null);
						break;
					case ':':
						setPending(BondOrder.AROMATIC, null);
						break;
					case '/':
						setPending(pendingOrder==null? BondOrder.SINGLE: pendingOrder, BondStereo.UP);
						break;
					case '\\':
						setPending(pendingOrder==null? BondOrder.SINGLE: pendingOrder, BondStereo.DOWN);
						break;
					case '.':
						currentAtom = null;
						clearPending();
						i++;
						break;
					case '[':
						connect(parseBracketAtom());
						break;
					default:
						if(Character.isDigit(ch) || ch=='%'){
							ringClosure(parseRingIndex());
						}else{
							Atom atom = parsePlainAtom();
							if(atom==null){
								throw ChemException.parseFailed("Unexpected token '" + ch + "' in SMILES.");
							}
							connect(atom);
						}
				}
			}

			if(molecule.isEmpty()){
				throw ChemException.parseFailed("No atoms found.");
			}
			if(!branchStack.isEmpty()){
				throw ChemException.parseFailed("Unterminated branch in SMILES.");
			}
			if(!ringClosures.isEmpty()){
				String missing = ringClosures.keySet().stream()
						.map(String::valueOf)
						.collect(Collectors.joining(","));
				throw ChemException.parseFailed("Unterminated ring closure(s): " + missing + ".");
			}
			if(has(SmiFlavor.STRICT) && (pendingOrder!=null || pendingStereo!=null)){
				throw ChemException.parseFailed("Dangling bond token at end of SMILES.");
			}
			return molecule;
		}

		private void setPending(BondOrder order, BondStereo stereo){
			pendingOrder = order;
			pendingStereo = stereo;
			i++;
		}

		private void clearPending(){
			pendingOrder = null;
			pendingStereo = null;
		}

		private BondOrder resolveOrder(int a1, int a2, BondOrder explicit){
			if(explicit!=null){
				return explicit;
			}
			if(has(SmiFlavor.USE_AROMATIC_SYMBOLS)
					&& molecule.getAtom(a1).isAromatic()
					&& molecule.getAtom(a2).isAromatic()){
				return BondOrder.AROMATIC;
			}
			return BondOrder.SINGLE;
		}

		private void connect(Atom atom){
			if(currentAtom!=null){
				BondOrder order = resolveOrder(currentAtom, atom.getId(), pendingOrder);
				BondStereo stereo = order==BondOrder.SINGLE && pendingStereo!=null? pendingStereo : BondStereo.NONE;
				molecule.addBond(currentAtom, atom.getId(), order, stereo);
			}
			currentAtom = atom.getId();
			clearPending();
		}

		private int parseRingIndex() throws ChemException{
			char ch = peek();
			if(Character.isDigit(ch)){
				i++;
				return ch-'0';
			}
			//'%'
			i++;
			if(peek()=='('){
				i++;
				String digits = readDigits();
				if(digits.isEmpty() || peek()!=')'){
					throw ChemException.parseFailed("Invalid ring index after '%' in SMILES.");
				}
				i++;
				try{
					return Integer.parseInt(digits);
				}catch(NumberFormatException e){
					throw ChemException.parseFailed("Invalid ring index after '%' in SMILES.");
				}
			}
			String digits = readDigits(2);
			if(digits.length()!=2){
				throw ChemException.parseFailed("Invalid ring index after '%' in SMILES.");
			}
			return Integer.parseInt(digits);
		}

		private void ringClosure(int ringIndex) throws ChemException{
			if(currentAtom==null){
				throw ChemException.parseFailed("Ring closure '" + ringIndex + "' has no current atom.");
			}
			RingOpening open = ringClosures.remove(ringIndex);
			if(open==null){
				ringClosures.put(ringIndex, new RingOpening(currentAtom, pendingOrder, pendingStereo));
			}else{
				if(open.order!=null && pendingOrder!=null && open.order!=pendingOrder){
					throw ChemException.parseFailed("Conflicting ring bond order for closure " + ringIndex + ".");
				}
				if(open.atomId==currentAtom){
					throw ChemException.parseFailed("Ring closure " + ringIndex + " bonds an atom to itself.");
				}
				BondOrder explicit = pendingOrder!=null? pendingOrder : open.order;
				BondOrder order = resolveOrder(open.atomId, currentAtom, explicit);
				BondStereo stereo = BondStereo.NONE;
				if(order==BondOrder.SINGLE){
					if(pendingStereo!=null){
						stereo = pendingStereo;
					}else if(open.stereo!=null){
						stereo = open.stereo;
					}
				}
				molecule.addBond(open.atomId, currentAtom, order, stereo);
			}
			clearPending();
		}

		private Atom newAtom(String rawSymbol, boolean aromatic, Integer isotope){
			String element;
			switch(rawSymbol.toUpperCase()){
				case "D":
					element = "H";
					isotope = isotope==null? 2: isotope;
					break;
				case "T":
					element = "H";
					isotope = isotope==null? 3: isotope;
					break;
				default:
					element = rawSymbol.substring(0,1).toUpperCase() + rawSymbol.substring(1).toLowerCase();
			}
			return molecule.addAtom(element)
					.setAromatic(aromatic)
					.setIsotope(isotope);
		}

		private Atom parsePlainAtom(){
			char c0 = peek();
			char c1 = peek(1);
			if(c0=='*'){
				i++;
				return newAtom("*", false, null);
			}
			if(Character.isLowerCase(c0)){
				String pair = "" + c0 + c1;
				if(pair.equals("se") || pair.equals("as")){
					i+=2;
					return newAtom(pair, true, null);
				}
				if(AROMATIC_SINGLE.contains(c0)){
					i++;
					return newAtom(String.valueOf(c0), true, null);
				}
				return null;
			}
			if(!Character.isUpperCase(c0)){
				return null;
			}
			String pair = "" + c0 + c1;
			if(pair.equals("Cl") || pair.equals("Br")){
				i+=2;
				return newAtom(pair, false, null);
			}
			if(has(SmiFlavor.STRICT) && !ORGANIC_SUBSET.contains(String.valueOf(c0))){
				return null;
			}
			i++;
			return newAtom(String.valueOf(c0), false, null);
		}

		private Atom parseBracketAtom() throws ChemException{
			i++; // '['
			Integer isotope = readNumber(null);
			if(atEnd()){
				throw ChemException.parseFailed("Unterminated bracket atom.");
			}
			char head = peek();
			String rawSymbol;
			boolean aromatic;
			if(head=='*'){
				rawSymbol = "*";
				aromatic = false;
				i++;
			}else if(Character.isUpperCase(head)){
				i++;
				rawSymbol = String.valueOf(head);
				if(Character.isLowerCase(peek())){
					rawSymbol += peek();
					i++;
				}
				aromatic = false;
			}else if(Character.isLowerCase(head)){
				String pair = "" + head + peek(1);
				if(pair.equals("se") || pair.equals("as")){
					rawSymbol = pair;
					i+=2;
				}else{
					rawSymbol = String.valueOf(head);
					i++;
				}
				aromatic = true;
			}else{
				throw ChemException.parseFailed("Invalid bracket atom element token.");
			}
			Atom atom = newAtom(rawSymbol, aromatic, isotope);

			int charge = 0;
			Integer hydrogens = null;
			while(!atEnd() && peek()!=']'){
				char ch = peek();
				switch(ch){
					case '@':
						atom.setChirality(parseChirality());
						break;
					case 'D':
					case 'X':
						i++;
						atom.setSubstitutionCount(readNumber(1));
						break;
					case 'v':
						i++;
						atom.setUnsaturation(readNumber(0));
						break;
					case 'u':
						i++;
						atom.setUnsaturation(readNumber(1));
						break;
					case 'R':
						i++;
						atom.setRingBondCount(readNumber(1));
						break;
					case 'r':
						i++;
						atom.setRingBondCount(readNumber(0));
						break;
					case 'H':
						i++;
						hydrogens = (hydrogens==null? 0: hydrogens) + Math.max(0, readNumber(1));
						break;
					case '+':
					case '-':
						charge += parseCharge();
						break;
					case ':':
						i++;
						Integer cls = readNumber(null);
						if(cls!=null){
							atom.setAtomClass(cls);
							atom.setAtomMapNumber(cls);
						}else if(has(SmiFlavor.STRICT)){
							throw ChemException.parseFailed("Missing atom-class/map index after ':' in bracket atom.");
						}
						break;
					case ';':
					case '&':
					case ',':
						i++;
						break;
					default:
						if(has(SmiFlavor.STRICT)){
							throw ChemException.parseFailed("Unsupported bracket decorator '" + ch + "' in strict SMILES mode.");
						}
						i++;
				}
			}
			if(atEnd()){
				throw ChemException.parseFailed("Unterminated bracket atom.");
			}
			i++; // ']'
			return atom.setCharge(charge)
						.setExplicitHydrogenCount(hydrogens);
		}

		private Chirality parseChirality() throws ChemException{
			int count=0;
			while(peek()=='@'){
				count++;
				i++;
			}
			Chirality chirality = count>=2? Chirality.CLOCKWISE: Chirality.ANTICLOCKWISE;
			String cls = "" + peek() + peek(1);
			if(CHIRAL_CLASSES.contains(cls)){
				i+=2;
				Integer rank = readNumber(null);
				if(cls.equals("TH") && rank!=null && (rank==1 || rank==2)){
					chirality = rank==1? Chirality.ANTICLOCKWISE: Chirality.CLOCKWISE;
				}else{
					//non tetrahedral classes are read but not kept
					chirality = Chirality.NONE;
				}
			}
			return chirality;
		}

		private int parseCharge() throws ChemException{
			char sign = peek();
			int s = sign=='+'? 1: -1;
			i++;
			if(Character.isDigit(peek())){
				return s * readNumber(1);
			}
			int magnitude = 1;
			while(peek()==sign){
				magnitude++;
				i++;
			}
			return s*magnitude;
		}
	}

	private static void validateAromaticConstraints(Molecule molecule) throws ChemException{
		for(Atom atom : molecule.getAtoms()){
			if(!atom.isAromatic()){
				continue;
			}
			int degree = molecule.degree(atom.getId());
			String element = atom.getElement().toUpperCase();
			if(molecule.bondsOf(atom.getId()).stream().anyMatch(b->b.getOrder()==BondOrder.TRIPLE)){
				throw ChemException.parseFailed("Invalid aromatic atom '" + atom.getElement() + "' with triple bond.");
			}
			switch(element){
				case "B":
				case "C":
					if(degree>3){
						throw ChemException.parseFailed("Aromatic atom '" + atom.getElement() + "' exceeds valence-like degree.");
					}
					break;
				case "N":
					break;
				case "O":
					if(degree>2 && atom.getCharge()<=0){
						throw ChemException.parseFailed("Aromatic atom '" + atom.getElement() + "' has invalid degree without positive charge.");
					}
					break;
				case "P":
				case "S":
				case "SE":
				case "AS":
					if(degree>3 && atom.getCharge()<=0){
						throw ChemException.parseFailed("Aromatic atom '" + atom.getElement() + "' has unsupported high degree.");
					}
					break;
				case "*":
					break;
				default:
					throw ChemException.parseFailed("Unsupported aromatic atom '" + atom.getElement() + "'.");
			}
		}

		List<List<Integer>> fiveRings = molecule.simpleCycles(5).stream()
				.filter(r->r.size()==5)
				.filter(r->r.stream().allMatch(id->molecule.getAtom(id).isAromatic()))
				.collect(Collectors.toList());
		for(List<Integer> ring : fiveRings){
			List<Atom> ringAtoms = ring.stream().map(molecule::getAtom).collect(Collectors.toList());
			if(ringAtoms.stream().noneMatch(a->a.isElement("N"))){
				continue;
			}
			boolean hasDonor = ringAtoms.stream().anyMatch(a->isPyrrolicDonor(molecule, a));
			if(!hasDonor){
				throw ChemException.parseFailed("Aromatic five-member N-heterocycle lacks [nH]-like donor.");
			}
		}
	}

	private static boolean isPyrrolicDonor(Molecule molecule, Atom atom){
		String element = atom.getElement().toUpperCase();
		if(atom.getExplicitHydrogenCount()!=null && atom.getExplicitHydrogenCount()>0){
			return true;
		}
		if(atom.getCharge()<0 && ANIONIC_DONORS.contains(element)){
			return true;
		}
		if(DONOR_ELEMENTS.contains(element)){
			return true;
		}
		return element.equals("N") && molecule.degree(atom.getId())>2;
	}

	/**
	 * A double bond gets {@link BondStereo#EITHER} when both of its ends carry
	 * another single bond written with {@code /} or {@code \}.
	 */
	private static void annotateDirectionalDoubleBonds(Molecule molecule){
		for(Bond db : molecule.getBonds()){
			if(db.getOrder()!=BondOrder.DOUBLE){
				continue;
			}
			if(hasDirectionalNeighbor(molecule, db, db.getA1()) && hasDirectionalNeighbor(molecule, db, db.getA2())){
				db.setStereo(BondStereo.EITHER);
			}
		}
	}

	private static boolean hasDirectionalNeighbor(Molecule molecule, Bond db, int end){
		int other = db.getOther(end);
		return molecule.bondsOf(end).stream()
				.filter(b->b.getId()!=db.getId())
				.filter(b->b.getOrder()==BondOrder.SINGLE && b.getStereo().isDirectional())
				.anyMatch(b->b.getOther(end)!=other);
	}
}
