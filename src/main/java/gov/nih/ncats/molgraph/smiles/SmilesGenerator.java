package gov.nih.ncats.molgraph.smiles;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

import gov.nih.ncats.molgraph.SmiFlavor;
import gov.nih.ncats.molgraph.model.Atom;
import gov.nih.ncats.molgraph.model.Bond;
import gov.nih.ncats.molgraph.model.BondOrder;
import gov.nih.ncats.molgraph.model.BondStereo;
import gov.nih.ncats.molgraph.model.Chirality;
import gov.nih.ncats.molgraph.model.Molecule;

/**
 * Writes a {@link Molecule} as SMILES.
 * <p>
 * The output is deterministic but not canonical: each component is walked depth first
 * from its lowest atom id, visiting neighbors in ascending id order.
 * </p>
 */
public class SmilesGenerator{

	private static final Set<String> ELEMENT_SYMBOLS = new HashSet<>(Arrays.asList(
			"H","He","Li","Be","B","C","N","O","F","Ne","Na","Mg","Al","Si","P","S","Cl","Ar",
			"K","Ca","Sc","Ti","V","Cr","Mn","Fe","Co","Ni","Cu","Zn","Ga","Ge","As","Se","Br","Kr",
			"Rb","Sr","Y","Zr","Nb","Mo","Tc","Ru","Rh","Pd","Ag","Cd","In","Sn","Sb","Te","I","Xe",
			"Cs","Ba","La","Ce","Pr","Nd","Pm","Sm","Eu","Gd","Tb","Dy","Ho","Er","Tm","Yb","Lu",
			"Hf","Ta","W","Re","Os","Ir","Pt","Au","Hg","Tl","Pb","Bi","Po","At","Rn",
			"Fr","Ra","Ac","Th","Pa","U","Np","Pu","Am","Cm","Bk","Cf","Es","Fm","Md","No","Lr",
			"Rf","Db","Sg","Bh","Hs","Mt","Ds","Rg","Cn","Nh","Fl","Mc","Lv","Ts","Og"));

	private static final String LABEL_SPECIAL_CHARS = ";$|&,";

	private final EnumSet<SmiFlavor> flavors;

	public SmilesGenerator(){
		this(SmiFlavor.defaults());
	}

	public SmilesGenerator(EnumSet<SmiFlavor> flavors){
		Objects.requireNonNull(flavors);
		this.flavors = flavors.isEmpty()? EnumSet.noneOf(SmiFlavor.class): EnumSet.copyOf(flavors);
	}

	private boolean has(SmiFlavor f){
		return flavors.contains(f);
	}

	/**
	 * Create the SMILES for the given molecule.
	 * Atoms whose element is a label (R1, AP1 ...) are written as {@code *}; with the
	 * {@link SmiFlavor#CXSMILES} flavor their labels follow in a {@code |$...$|} layer.
	 * @return the SMILES, or an empty String for a molecule without atoms.
	 */
	public String create(Molecule molecule){
		Objects.requireNonNull(molecule);
		if(molecule.isEmpty()){
			return "";
		}
		List<Atom> written = new ArrayList<>();
		String smiles = molecule.getConnectedComponents()
				.stream()
				.map(c->new ComponentWriter(molecule, c, written).write())
				.collect(Collectors.joining("."));
		if(has(SmiFlavor.CXSMILES)){
			String labels = atomLabelLayer(written);
			if(!labels.isEmpty()){
				return smiles + " |" + labels + "|";
			}
		}
		return smiles;
	}

	/**
	 * The {@code $...$} layer for atoms in output order, or an empty String when no atom is labelled.
	 */
	static String atomLabelLayer(List<Atom> atomsInOrder){
		List<String> entries = new ArrayList<>();
		boolean any = false;
		for(Atom a : atomsInOrder){
			if(isLabel(a)){
				entries.add(escapeLabel(a.getElement()));
				any = true;
			}else{
				entries.add("");
			}
		}
		return any? "$" + String.join(";", entries) + "$": "";
	}

	static String escapeLabel(String label){
		StringBuilder sb = new StringBuilder();
		for(char ch : label.toCharArray()){
			if(LABEL_SPECIAL_CHARS.indexOf(ch)>=0 || Character.isWhitespace(ch)){
				sb.append("&#").append((int) ch).append(';');
			}else{
				sb.append(ch);
			}
		}
		return sb.toString();
	}

	static boolean isLabel(Atom atom){
		String element = atom.getElement().trim();
		return !element.equals("*") && !ELEMENT_SYMBOLS.contains(normalize(element.toUpperCase()));
	}

	private static boolean isWildcard(Atom atom){
		return "*".equals(atom.getElement().trim()) || isLabel(atom);
	}

	private static final class Closure{
		final int partner;
		final Bond bond;
		final boolean opening;
		int number;

		Closure(int partner, Bond bond, boolean opening){
			this.partner = partner;
			this.bond = bond;
			this.opening = opening;
		}
	}

	/**
	 * Writes one connected component.
	 */
	private final class ComponentWriter{
		private final Molecule molecule;
		private final Set<Integer> members;
		private final List<Atom> written;

		private final Map<Integer,List<Integer>> children = new HashMap<>();
		private final Map<Integer,Integer> order = new HashMap<>();
		private final Set<Long> treeEdges = new HashSet<>();
		private final Map<Integer,List<Closure>> closures = new HashMap<>();
		private final Map<Long,Closure> openClosures = new HashMap<>();
		private final BitSet usedRingNumbers = new BitSet();

		private final StringBuilder out = new StringBuilder();

		ComponentWriter(Molecule molecule, List<Integer> component, List<Atom> written){
			this.molecule = molecule;
			this.members = new HashSet<>(component);
			this.written = written;
			int root = component.get(0);
			buildTree(root);
			findClosures();
			writeAtom(root);
		}

		String write(){
			return out.toString();
		}

		private void buildTree(int atom){
			order.put(atom, order.size());
			for(Integer n : molecule.neighbors(atom)){
				if(!members.contains(n) || order.containsKey(n)){
					continue;
				}
				children.computeIfAbsent(atom, k->new ArrayList<>()).add(n);
				treeEdges.add(Molecule.edgeKey(atom, n));
				buildTree(n);
			}
		}

		private void findClosures(){
			for(Bond b : molecule.getBonds()){
				if(!members.contains(b.getA1()) || treeEdges.contains(Molecule.edgeKey(b.getA1(), b.getA2()))){
					continue;
				}
				int first = order.get(b.getA1()) < order.get(b.getA2())? b.getA1(): b.getA2();
				int second = b.getOther(first);
				closures.computeIfAbsent(first, k->new ArrayList<>()).add(new Closure(second, b, true));
				closures.computeIfAbsent(second, k->new ArrayList<>()).add(new Closure(first, b, false));
			}
			//closing digits before opening ones, each in the order their partner is written
			closures.values().forEach(list->list.sort((c1,c2)->{
				if(c1.opening!=c2.opening){
					return c1.opening? 1: -1;
				}
				return Integer.compare(order.get(c1.partner), order.get(c2.partner));
			}));
		}

		private void writeAtom(int atomId){
			Atom atom = molecule.getAtom(atomId);
			written.add(atom);
			out.append(atomToken(atom));

			List<Closure> freed = new ArrayList<>();
			for(Closure c : closures.getOrDefault(atomId, new ArrayList<>())){
				long key = Molecule.edgeKey(atomId, c.partner);
				if(c.opening){
					int number = usedRingNumbers.nextClearBit(1);
					usedRingNumbers.set(number);
					c.number = number;
					openClosures.put(key, c);
					out.append(bondToken(c.bond, atomId));
					out.append(ringToken(number));
				}else{
					Closure open = openClosures.remove(key);
					out.append(ringToken(open.number));
					freed.add(open);
				}
			}
			freed.forEach(c->usedRingNumbers.clear(c.number));

			List<Integer> kids = children.getOrDefault(atomId, new ArrayList<>());
			for(int i=0; i< kids.size(); i++){
				int child = kids.get(i);
				Bond bond = molecule.getBond(atomId, child).get();
				boolean last = i==kids.size()-1;
				if(!last){
					out.append('(');
				}
				out.append(bondToken(bond, atomId));
				writeAtom(child);
				if(!last){
					out.append(')');
				}
			}
		}

		private String bondToken(Bond bond, int from){
			switch(bond.getOrder()){
				case DOUBLE: return "=";
				case TRIPLE: return "#";
				case AROMATIC:
					return has(SmiFlavor.USE_AROMATIC_SYMBOLS) && bothAromatic(bond)? "": ":";
				default:
					if(has(SmiFlavor.ISOMERIC) && bond.getStereo().isDirectional() && isNextToEitherDoubleBond(bond)){
						boolean up = bond.getStereo()==BondStereo.UP || bond.getStereo()==BondStereo.UP_REVERSED;
						if(from!=bond.getA1()){
							up = !up;
						}
						return up? "/": "\\";
					}
					//keep single bonds between aromatic atoms from being read back as aromatic
					if(has(SmiFlavor.USE_AROMATIC_SYMBOLS) && bothAromatic(bond)){
						return "-";
					}
					return "";
			}
		}

		private boolean bothAromatic(Bond bond){
			return molecule.getAtom(bond.getA1()).isAromatic() && molecule.getAtom(bond.getA2()).isAromatic();
		}

		private boolean isNextToEitherDoubleBond(Bond bond){
			return isNextToEitherDoubleBond(bond, bond.getA1()) || isNextToEitherDoubleBond(bond, bond.getA2());
		}

		private boolean isNextToEitherDoubleBond(Bond bond, int end){
			return molecule.bondsOf(end).stream()
					.anyMatch(b->b.getId()!=bond.getId() && b.getOrder()==BondOrder.DOUBLE && b.getStereo()==BondStereo.EITHER);
		}
	}

	static String ringToken(int number){
		if(number<10){
			return Integer.toString(number);
		}
		if(number<100){
			return "%" + number;
		}
		return "%(" + number + ")";
	}

	String atomToken(Atom atom){
		boolean wildcard = isWildcard(atom);
		if(wildcard && !requiresBracket(atom)){
			return "*";
		}
		String plain = wildcard? null: plainSymbol(atom);
		if(plain!=null && !requiresBracket(atom)){
			return plain;
		}
		StringBuilder token = new StringBuilder("[");
		if(has(SmiFlavor.ISOMERIC) && atom.getIsotope()!=null){
			token.append(atom.getIsotope());
		}
		token.append(wildcard? "*": bracketSymbol(atom));
		if(has(SmiFlavor.ISOMERIC)){
			if(atom.getChirality()==Chirality.ANTICLOCKWISE){
				token.append('@');
			}else if(atom.getChirality()==Chirality.CLOCKWISE){
				token.append("@@");
			}
		}
		if(atom.getExplicitHydrogenCount()!=null){
			token.append(hydrogenToken(atom.getExplicitHydrogenCount()));
		}
		if(atom.getCharge()!=0){
			token.append(chargeToken(atom.getCharge()));
		}
		return token.append(']').toString();
	}

	private boolean requiresBracket(Atom atom){
		if(atom.getCharge()!=0 || atom.getExplicitHydrogenCount()!=null){
			return true;
		}
		if(has(SmiFlavor.ISOMERIC) && (atom.getIsotope()!=null || atom.getChirality()!=Chirality.NONE)){
			return true;
		}
		return false;
	}

	private String plainSymbol(Atom atom){
		String upper = atom.getElement().toUpperCase();
		if(has(SmiFlavor.USE_AROMATIC_SYMBOLS) && atom.isAromatic()){
			switch(upper){
				case "B":
				case "C":
				case "N":
				case "O":
				case "P":
				case "S":
					return upper.toLowerCase();
				default:
					//se and as only exist in brackets
					return null;
			}
		}
		switch(upper){
			case "B":
			case "C":
			case "N":
			case "O":
			case "P":
			case "S":
			case "F":
			case "CL":
			case "BR":
			case "I":
				return normalize(upper);
			default:
				return null;
		}
	}

	private String bracketSymbol(Atom atom){
		String upper = atom.getElement().toUpperCase();
		if(has(SmiFlavor.USE_AROMATIC_SYMBOLS) && atom.isAromatic()){
			switch(upper){
				case "B":
				case "C":
				case "N":
				case "O":
				case "P":
				case "S":
				case "SE":
				case "AS":
					return upper.toLowerCase();
				default:
					break;
			}
		}
		return normalize(upper);
	}

	private static String normalize(String upper){
		if(upper.isEmpty()){
			return upper;
		}
		return upper.substring(0,1) + upper.substring(1).toLowerCase();
	}

	static String hydrogenToken(int count){
		if(count<=0){
			return "H0";
		}
		if(count==1){
			return "H";
		}
		return "H" + count;
	}

	static String chargeToken(int charge){
		String sign = charge>0? "+": "-";
		int magnitude = Math.abs(charge);
		if(magnitude<=3){
			StringBuilder sb = new StringBuilder();
			for(int i=0;i<magnitude;i++){
				sb.append(sign);
			}
			return sb.toString();
		}
		return sign + magnitude;
	}
}
