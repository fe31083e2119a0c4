package gov.nih.ncats.molgraph.smiles;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * What was read from a trailing {@code |...|} CXSMILES layer.
 * Atom label keys are zero based atom indexes in input order.
 */
public class CxSmilesState{
	private final Map<Integer,String> atomLabels = new LinkedHashMap<>();
	private final List<List<Integer>> fragmentGroups = new ArrayList<>();
	private boolean racemic=false;
	private final List<Integer> racemicFragments = new ArrayList<>();

	public Map<Integer, String> getAtomLabels() {
		return Collections.unmodifiableMap(atomLabels);
	}

	public CxSmilesState putAtomLabel(int index, String label){
		atomLabels.put(index, label);
		return this;
	}

	public List<List<Integer>> getFragmentGroups() {
		return Collections.unmodifiableList(fragmentGroups);
	}

	public CxSmilesState addFragmentGroup(List<Integer> group){
		fragmentGroups.add(Collections.unmodifiableList(new ArrayList<>(group)));
		return this;
	}

	public boolean isRacemic() {
		return racemic;
	}

	public CxSmilesState setRacemic(boolean racemic) {
		this.racemic = racemic;
		return this;
	}

	public List<Integer> getRacemicFragments() {
		return Collections.unmodifiableList(racemicFragments);
	}

	public CxSmilesState addRacemicFragment(int index){
		racemicFragments.add(index);
		return this;
	}

	public boolean isEmpty(){
		return atomLabels.isEmpty() && fragmentGroups.isEmpty() && !racemic && racemicFragments.isEmpty();
	}

	@Override
	public String toString() {
		return "CxSmilesState{labels=" + atomLabels + ", fragments=" + fragmentGroups
				+ ", racemic=" + racemic + ", racemicFragments=" + racemicFragments + "}";
	}
}
