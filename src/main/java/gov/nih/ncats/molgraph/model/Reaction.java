package gov.nih.ncats.molgraph.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import gov.nih.ncats.molgraph.smiles.CxSmilesState;

/**
 * A reaction as three ordered lists of molecules.
 * The CXSMILES state it was read with, if any, is kept for reference.
 */
public class Reaction{
	private final List<Molecule> reactants;
	private final List<Molecule> agents;
	private final List<Molecule> products;
	private final CxSmilesState cxState;

	public Reaction(List<Molecule> reactants, List<Molecule> agents, List<Molecule> products){
		this(reactants, agents, products, null);
	}

	public Reaction(List<Molecule> reactants, List<Molecule> agents, List<Molecule> products, CxSmilesState cxState){
		this.reactants = new ArrayList<>(Objects.requireNonNull(reactants));
		this.agents = new ArrayList<>(Objects.requireNonNull(agents));
		this.products = new ArrayList<>(Objects.requireNonNull(products));
		this.cxState = cxState;
	}

	public List<Molecule> getReactants() {
		return Collections.unmodifiableList(reactants);
	}

	public List<Molecule> getAgents() {
		return Collections.unmodifiableList(agents);
	}

	public List<Molecule> getProducts() {
		return Collections.unmodifiableList(products);
	}

	public int getReactantCount(){
		return reactants.size();
	}

	public int getAgentCount(){
		return agents.size();
	}

	public int getProductCount(){
		return products.size();
	}

	/**
	 * @return the CXSMILES state or null if the reaction had no CX layer.
	 */
	public CxSmilesState getCxState() {
		return cxState;
	}

	/**
	 * All molecules, reactants first, then agents, then products.
	 */
	public List<Molecule> getAllMolecules(){
		return Stream.of(reactants, agents, products)
				.flatMap(List::stream)
				.collect(Collectors.toList());
	}

	@Override
	public String toString() {
		return "Reaction{" + reactants.size() + ">" + agents.size() + ">" + products.size() + "}";
	}
}
