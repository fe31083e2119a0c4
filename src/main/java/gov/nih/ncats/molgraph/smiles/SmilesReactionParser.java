package gov.nih.ncats.molgraph.smiles;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

import gov.nih.ncats.molgraph.ChemException;
import gov.nih.ncats.molgraph.SmiFlavor;
import gov.nih.ncats.molgraph.layout.StructureDiagramGenerator;
import gov.nih.ncats.molgraph.model.Molecule;
import gov.nih.ncats.molgraph.model.Reaction;

/**
 * Reads reaction SMILES {@code reactants>agents>products}, with an optional CXSMILES layer.
 * Fragment indexes in the CX layer ({@code f:} and {@code r:}) count the
 * dot separated components of all three sides together, left to right.
 */
public class SmilesReactionParser{
	private static final Logger logger = Logger.getLogger(SmilesReactionParser.class.getName());

	private enum Side{
		REACTANT,
		AGENT,
		PRODUCT
	}

	private static final class Component{
		final Molecule molecule;
		final Side side;
		final int index;

		Component(Molecule molecule, Side side, int index){
			this.molecule = molecule;
			this.side = side;
			this.index = index;
		}
	}

	private final SmilesParser parser;

	public SmilesReactionParser(SmilesParser parser){
		this.parser = Objects.requireNonNull(parser);
	}

	public Reaction parse(String reactionSmiles) throws ChemException{
		CxSmilesParser.Split split = CxSmilesParser.split(reactionSmiles,
				parser.getOptions().hasFlavor(SmiFlavor.CXSMILES));
		String[] parts = split.getCoreSmiles().split(">", -1);
		if(parts.length!=3){
			throw ChemException.parseFailed("Reaction SMILES must contain exactly two '>' separators (malformed reaction syntax).");
		}
		List<Component> components = new ArrayList<>();
		parseSide(parts[0], Side.REACTANT, components);
		parseSide(parts[1], Side.AGENT, components);
		parseSide(parts[2], Side.PRODUCT, components);

		CxSmilesState state = split.getState();
		applyAtomLabels(components, state);
		List<Component> grouped = applyFragmentGrouping(components, state);

		List<Molecule> reactants = new ArrayList<>();
		List<Molecule> agents = new ArrayList<>();
		List<Molecule> products = new ArrayList<>();
		for(Component c : grouped){
			switch(c.side){
				case REACTANT: reactants.add(c.molecule); break;
				case AGENT: agents.add(c.molecule); break;
				default: products.add(c.molecule);
			}
		}
		Reaction r = new Reaction(reactants, agents, products, state);
		logger.log(Level.FINE, "parsed reaction " + r);
		return r;
	}

	private void parseSide(String raw, Side side, List<Component> into) throws ChemException{
		String trimmed = raw.trim();
		if(trimmed.isEmpty()){
			return;
		}
		String[] fragments = trimmed.split("\\.", -1);
		for(String f : fragments){
			if(f.trim().isEmpty()){
				throw ChemException.parseFailed("Invalid empty fragment in reaction side.");
			}
		}
		for(String f : fragments){
			into.add(new Component(parser.parseCoreSmiles(f), side, into.size()));
		}
	}

	private static void applyAtomLabels(List<Component> components, CxSmilesState state){
		if(state.getAtomLabels().isEmpty()){
			return;
		}
		int offset=0;
		for(Component c : components){
			CxSmilesParser.applyAtomLabels(c.molecule, state, offset);
			offset += c.molecule.getAtomCount();
		}
	}

	private List<Component> applyFragmentGrouping(List<Component> components, CxSmilesState state) throws ChemException{
		Map<Integer,List<Integer>> groupsByIndex = new HashMap<>();
		for(List<Integer> raw : state.getFragmentGroups()){
			List<Integer> group = new ArrayList<>(new TreeSet<>(raw));
			for(Integer idx : group){
				if(idx <0 || idx >= components.size()){
					throw ChemException.parseFailed("CXSMILES fragment-group index " + idx + " is out of range.");
				}
			}
			Side side = components.get(group.get(0)).side;
			if(group.stream().anyMatch(idx->components.get(idx).side!=side)){
				throw ChemException.parseFailed("CXSMILES fragment group " + group + " spans more than one reaction side.");
			}
			for(Integer idx : group){
				if(groupsByIndex.put(idx, group)!=null){
					throw ChemException.parseFailed("CXSMILES fragment index " + idx + " appears in multiple groups.");
				}
			}
		}

		List<Component> out = new ArrayList<>();
		for(Component c : components){
			List<Integer> group = groupsByIndex.get(c.index);
			Molecule molecule;
			if(group==null){
				molecule = c.molecule;
			}else if(group.get(0)==c.index){
				molecule = merge(group.stream().map(i->components.get(i).molecule).collect(Collectors.toList()));
			}else{
				//merged into the group's first component
				continue;
			}
			List<Integer> members = group==null? Collections.singletonList(c.index): group;
			if(state.isRacemic() || members.stream().anyMatch(state.getRacemicFragments()::contains)){
				molecule.setRacemic(true);
			}
			out.add(new Component(molecule, c.side, c.index));
		}
		return out;
	}

	private Molecule merge(List<Molecule> molecules){
		Molecule merged = Molecule.merge(SmilesParser.DEFAULT_NAME, molecules);
		if(parser.getOptions().isGenerateCoordinates()){
			//bonds keep the wedges of the parts
			merged = new StructureDiagramGenerator(parser.getOptions().getLayoutOptions()).generate(merged);
		}
		return merged;
	}
}
