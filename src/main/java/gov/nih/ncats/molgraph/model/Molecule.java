package gov.nih.ncats.molgraph.model;

import java.awt.geom.Point2D;
import java.awt.geom.Rectangle2D;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.Stack;
import java.util.TreeSet;
import java.util.function.Consumer;
import java.util.stream.Collectors;

import gov.nih.ncats.common.util.CachedSupplier;
import gov.nih.ncats.molgraph.internal.util.GeomUtil;

/**
 * A molecular graph: a name, an ordered list of {@link Atom}s and an ordered list of {@link Bond}s.
 * Bonds refer to atoms by id. Lookups by id are cached and the caches are
 * reset whenever atoms or bonds are added or removed.
 *
 * Use {@link #copy()} to get an independent instance; two Molecules never share atoms or bonds.
 */
public class Molecule{
	public static final int DEFAULT_MAX_RING_SIZE=8;

	private String name;
	private final List<Atom> atoms = new ArrayList<>();
	private final List<Bond> bonds = new ArrayList<>();
	private boolean racemic=false;

	private int nextAtomId=1;
	private int nextBondId=1;

	private CachedSupplier<Map<Integer,Atom>> _atomMap = CachedSupplier.of(()->_getAtomMap());
	private CachedSupplier<Map<Integer,List<Bond>>> _bondMap = CachedSupplier.of(()->_getBondMap());
	private CachedSupplier<Map<Integer,List<Integer>>> _neighborMap = CachedSupplier.of(()->_getNeighborMap());
	private CachedSupplier<Map<Long,Bond>> _edgeMap = CachedSupplier.of(()->_getEdgeMap());

	public Molecule(){
		this("Untitled");
	}

	public Molecule(String name){
		this.name = name;
	}

	public Molecule copy(){
		Molecule m = new Molecule(name);
		atoms.forEach(a->m.atoms.add(a.copy()));
		bonds.forEach(b->m.bonds.add(b.copy()));
		m.racemic = racemic;
		m.nextAtomId = nextAtomId;
		m.nextBondId = nextBondId;
		return m;
	}

	private void resetCaches(){
		_atomMap.resetCache();
		_bondMap.resetCache();
		_neighborMap.resetCache();
		_edgeMap.resetCache();
	}

	public String getName() {
		return name;
	}

	public Molecule setName(String name) {
		this.name = name;
		return this;
	}

	public boolean isRacemic() {
		return racemic;
	}

	public Molecule setRacemic(boolean racemic) {
		this.racemic = racemic;
		return this;
	}

	public List<Atom> getAtoms(){
		return Collections.unmodifiableList(atoms);
	}

	public List<Bond> getBonds(){
		return Collections.unmodifiableList(bonds);
	}

	public int getAtomCount(){
		return atoms.size();
	}

	public int getBondCount(){
		return bonds.size();
	}

	public boolean isEmpty(){
		return atoms.isEmpty();
	}

	/**
	 * Create a new atom with the next unused id.
	 * @param element the element symbol, can not be null.
	 * @return the new Atom, already added to this molecule.
	 */
	public Atom addAtom(String element){
		Atom a = new Atom(nextAtomId++, element);
		atoms.add(a);
		resetCaches();
		return a;
	}

	/**
	 * Add an existing atom (typically from another molecule) keeping its id.
	 * @throws IllegalArgumentException if an atom with the same id is already present.
	 */
	public Atom addAtom(Atom atom){
		Objects.requireNonNull(atom);
		if(getAtom(atom.getId())!=null){
			throw new IllegalArgumentException("duplicate atom id " + atom.getId());
		}
		atoms.add(atom);
		nextAtomId = Math.max(nextAtomId, atom.getId()+1);
		resetCaches();
		return atom;
	}

	public Bond addBond(int a1, int a2, BondOrder order){
		return addBond(a1,a2,order,BondStereo.NONE);
	}

	public Bond addBond(int a1, int a2, BondOrder order, BondStereo stereo){
		Bond b = new Bond(nextBondId, a1, a2, order, stereo);
		addBond(b);
		return b;
	}

	/**
	 * Add a bond keeping its id.
	 * @throws IllegalArgumentException if either end is not an atom of this molecule,
	 * if it is a self loop, or if the bond id is already used.
	 */
	public Bond addBond(Bond bond){
		Objects.requireNonNull(bond);
		if(bond.getA1()==bond.getA2()){
			throw new IllegalArgumentException("self loop on atom " + bond.getA1());
		}
		if(getAtom(bond.getA1())==null || getAtom(bond.getA2())==null){
			throw new IllegalArgumentException("bond " + bond + " refers to an unknown atom");
		}
		if(bonds.stream().anyMatch(b->b.getId()==bond.getId())){
			throw new IllegalArgumentException("duplicate bond id " + bond.getId());
		}
		bonds.add(bond);
		nextBondId = Math.max(nextBondId, bond.getId()+1);
		resetCaches();
		return bond;
	}

	public boolean removeBond(Bond bond){
		boolean removed = bonds.remove(bond);
		if(removed){
			resetCaches();
		}
		return removed;
	}

	/**
	 * Get the atom with the given id.
	 * @return the Atom or null if there is no such atom.
	 */
	public Atom getAtom(int id){
		return _atomMap.get().get(id);
	}

	public int indexOf(int atomId){
		for(int i=0;i<atoms.size();i++){
			if(atoms.get(i).getId()==atomId){
				return i;
			}
		}
		return -1;
	}

	public Optional<Bond> getBond(int a, int b){
		return Optional.ofNullable(_edgeMap.get().get(edgeKey(a,b)));
	}

	/**
	 * Neighbor atom ids of the given atom, in ascending order.
	 */
	public List<Integer> neighbors(int atomId){
		return _neighborMap.get().getOrDefault(atomId, Collections.emptyList());
	}

	public List<Bond> bondsOf(int atomId){
		return _bondMap.get().getOrDefault(atomId, Collections.emptyList());
	}

	public int degree(int atomId){
		return neighbors(atomId).size();
	}

	public static long edgeKey(int a, int b){
		int lo = Math.min(a, b);
		int hi = Math.max(a, b);
		return (((long)lo) << 32) | (hi & 0xffffffffL);
	}

	private Map<Integer,Atom> _getAtomMap(){
		Map<Integer,Atom> map = new HashMap<>();
		atoms.forEach(a->map.put(a.getId(), a));
		return map;
	}

	private Map<Integer,List<Bond>> _getBondMap(){
		Map<Integer,List<Bond>> map = new HashMap<>();
		for(Bond b: bonds){
			map.computeIfAbsent(b.getA1(), k->new ArrayList<>()).add(b);
			map.computeIfAbsent(b.getA2(), k->new ArrayList<>()).add(b);
		}
		return map;
	}

	private Map<Integer,List<Integer>> _getNeighborMap(){
		Map<Integer,Set<Integer>> sets = new HashMap<>();
		atoms.forEach(a->sets.put(a.getId(), new TreeSet<>()));
		for(Bond b: bonds){
			sets.computeIfAbsent(b.getA1(), k->new TreeSet<>()).add(b.getA2());
			sets.computeIfAbsent(b.getA2(), k->new TreeSet<>()).add(b.getA1());
		}
		Map<Integer,List<Integer>> map = new HashMap<>();
		sets.forEach((k,v)->map.put(k, Collections.unmodifiableList(new ArrayList<>(v))));
		return map;
	}

	private Map<Long,Bond> _getEdgeMap(){
		Map<Long,Bond> map = new HashMap<>();
		bonds.forEach(b->map.putIfAbsent(edgeKey(b.getA1(),b.getA2()), b));
		return map;
	}

	/**
	 * Connected components as sorted atom id lists, ordered by their lowest atom id.
	 */
	public List<List<Integer>> getConnectedComponents(){
		List<List<Integer>> components = new ArrayList<>();
		Set<Integer> seen = new HashSet<>();
		List<Integer> ids = atoms.stream().map(Atom::getId).sorted().collect(Collectors.toList());
		for(Integer seed : ids){
			if(!seen.add(seed))continue;
			List<Integer> comp = new ArrayList<>();
			Stack<Integer> stack = new Stack<>();
			stack.push(seed);
			while(!stack.isEmpty()){
				int cur = stack.pop();
				comp.add(cur);
				for(Integer n : neighbors(cur)){
					if(seen.add(n)){
						stack.push(n);
					}
				}
			}
			Collections.sort(comp);
			components.add(comp);
		}
		return components;
	}

	/**
	 * Simple cycles up to the given size as atom id lists (first atom not repeated).
	 * Each cycle is reported once, in its canonical form: the lexicographically
	 * smallest rotation of either direction. Larger rings are silently ignored.
	 *
	 * @param maxSize the largest ring size to look for.
	 * @return the cycles ordered by size, then lexicographically.
	 */
	public List<List<Integer>> simpleCycles(int maxSize){
		if(atoms.size()<3){
			return Collections.emptyList();
		}
		Set<List<Integer>> unique = new TreeSet<>(RING_ORDER);
		List<Integer> ids = atoms.stream().map(Atom::getId).sorted().collect(Collectors.toList());
		for(Integer start : ids){
			Stack<Integer> path = new Stack<>();
			path.push(start);
			Set<Integer> visited = new HashSet<>();
			visited.add(start);
			consumePathsUntilRing(start, path, visited, maxSize, p->unique.add(canonicalCycle(p)));
		}
		return new ArrayList<>(unique);
	}

	public List<List<Integer>> simpleCycles(){
		return simpleCycles(DEFAULT_MAX_RING_SIZE);
	}

	private void consumePathsUntilRing(int start, Stack<Integer> soFar, Set<Integer> visited, int maxDepth, Consumer<List<Integer>> found){
		if(soFar.size()>maxDepth)return;
		int current = soFar.peek();
		for(Integer next : neighbors(current)){
			if(next==start){
				if(soFar.size()>=3){
					found.accept(new ArrayList<>(soFar));
				}
				continue;
			}
			//only keep cycles where start is the minimum atom id
			if(visited.contains(next) || soFar.size()>=maxDepth || next<start){
				continue;
			}
			visited.add(next);
			soFar.push(next);
			consumePathsUntilRing(start, soFar, visited, maxDepth, found);
			soFar.pop();
			visited.remove(next);
		}
	}

	/**
	 * Size first, then lexicographic order of the atom ids.
	 */
	public static final Comparator<List<Integer>> RING_ORDER = (r1,r2)->{
		if(r1.size()!=r2.size()){
			return Integer.compare(r1.size(), r2.size());
		}
		return compareLexicographically(r1, r2);
	};

	public static int compareLexicographically(List<Integer> l1, List<Integer> l2){
		int n = Math.min(l1.size(), l2.size());
		for(int i=0;i<n;i++){
			int c = Integer.compare(l1.get(i), l2.get(i));
			if(c!=0)return c;
		}
		return Integer.compare(l1.size(), l2.size());
	}

	public static List<Integer> canonicalCycle(List<Integer> cycle){
		int n = cycle.size();
		if(n==0)return new ArrayList<>(cycle);
		List<Integer> reversed = new ArrayList<>(cycle);
		Collections.reverse(reversed);
		List<Integer> best = null;
		for(List<Integer> seq : new List[]{cycle, reversed}){
			for(int i=0;i<n;i++){
				List<Integer> rot = new ArrayList<>(n);
				rot.addAll(seq.subList(i, n));
				rot.addAll(seq.subList(0, i));
				if(best==null || compareLexicographically(rot, best)<0){
					best = rot;
				}
			}
		}
		return best;
	}

	/**
	 * The bonds around a ring, in ring order. Missing bonds are skipped.
	 */
	public List<Bond> ringBonds(List<Integer> ring){
		List<Bond> list = new ArrayList<>();
		if(ring.size()<2)return list;
		for(int i=0;i<ring.size();i++){
			getBond(ring.get(i), ring.get((i+1)%ring.size())).ifPresent(list::add);
		}
		return list;
	}

	/**
	 * Rings of size 5 to 7 that should be drawn as aromatic: every atom aromatic,
	 * every bond aromatic, or an even ring of strictly alternating single/double bonds.
	 */
	public List<List<Integer>> aromaticDisplayRings(){
		return simpleCycles(DEFAULT_MAX_RING_SIZE).stream()
				.filter(r->r.size()>=5 && r.size()<=7)
				.filter(r->{
					List<Bond> rb = ringBonds(r);
					if(rb.size()!=r.size())return false;
					boolean allAtoms = r.stream().allMatch(id->getAtom(id).isAromatic());
					boolean allBonds = rb.stream().allMatch(b->b.getOrder()==BondOrder.AROMATIC);
					return allAtoms || allBonds || isAlternatingSingleDouble(rb);
				})
				.collect(Collectors.toList());
	}

	public Set<Integer> aromaticDisplayBondIds(){
		Set<Integer> ids = bonds.stream()
				.filter(b->b.getOrder()==BondOrder.AROMATIC)
				.map(Bond::getId)
				.collect(Collectors.toCollection(LinkedHashSet::new));
		for(List<Integer> ring : aromaticDisplayRings()){
			ringBonds(ring).forEach(b->ids.add(b.getId()));
		}
		return ids;
	}

	private static boolean isAlternatingSingleDouble(List<Bond> ringBonds){
		if(ringBonds.isEmpty() || ringBonds.size()%2!=0)return false;
		BondOrder first = ringBonds.get(0).getOrder();
		if(first!=BondOrder.SINGLE && first!=BondOrder.DOUBLE)return false;
		BondOrder other = first==BondOrder.SINGLE? BondOrder.DOUBLE: BondOrder.SINGLE;
		for(int i=0;i<ringBonds.size();i++){
			BondOrder expected = i%2==0? first: other;
			if(ringBonds.get(i).getOrder()!=expected)return false;
		}
		return true;
	}

	/**
	 * Heuristic implicit hydrogen count: preferred valence of the element (adjusted for
	 * charge and aromaticity) minus the bond order sum, floored at zero.
	 * An explicit hydrogen count on the atom wins.
	 */
	public int implicitHydrogenCount(int atomId){
		Atom atom = getAtom(atomId);
		if(atom==null || atom.isElement("H")){
			return 0;
		}
		if(atom.getExplicitHydrogenCount()!=null){
			return Math.max(0, atom.getExplicitHydrogenCount());
		}
		double target = preferredValence(atom);
		if(target<=0){
			return 0;
		}
		double sum = bondsOf(atomId).stream().mapToDouble(b->b.getOrder().getValenceContribution()).sum();
		return (int) Math.max(0, Math.round(target - sum));
	}

	private static double preferredValence(Atom atom){
		int charge = atom.getCharge();
		switch(atom.getElement().toUpperCase()){
			case "C": return atom.isAromatic()? 3: 4;
			case "N":
				if(atom.isAromatic())return 3;
				return charge>0? 4: 3;
			case "O":
				if(charge>0)return 3;
				if(charge<0)return 1;
				return 2;
			case "S": return charge>0? 3: 2;
			case "P": return charge>0? 4: 3;
			case "B": return 3;
			case "F":
			case "CL":
			case "BR":
			case "I":
				return 1;
			default: return 0;
		}
	}

	/**
	 * For every chiral atom pick one plain single bond and mark it as a wedge (clockwise)
	 * or hash (anticlockwise). Terminal neighbors are preferred, then the bond whose far
	 * end is least crowded, then the lowest bond id. The reversed markers are used when the
	 * chiral atom is the bond's second atom.
	 */
	public void assignWedgeHashFromChiralCenters(){
		Map<Integer,Point2D> positions = new HashMap<>();
		atoms.forEach(a->positions.put(a.getId(), a.getPosition()));

		for(Atom atom : atoms){
			if(atom.getChirality()==Chirality.NONE)continue;
			int center = atom.getId();

			Optional<Bond> picked = bondsOf(center).stream()
					.filter(b->b.getOrder()==BondOrder.SINGLE && b.getStereo()==BondStereo.NONE)
					.min((l,r)->{
						int lp = wedgePriority(l, center);
						int rp = wedgePriority(r, center);
						if(lp!=rp)return Integer.compare(lp, rp);
						double lc = wedgeClearance(l, center, positions);
						double rc = wedgeClearance(r, center, positions);
						if(Math.abs(lc-rc)>0.0001){
							return lc>rc? -1: 1;
						}
						return Integer.compare(l.getId(), r.getId());
					});
			if(!picked.isPresent())continue;
			Bond b = picked.get();
			boolean fromA1 = b.getA1()==center;
			if(atom.getChirality()==Chirality.CLOCKWISE){
				b.setStereo(fromA1? BondStereo.UP: BondStereo.UP_REVERSED);
			}else{
				b.setStereo(fromA1? BondStereo.DOWN: BondStereo.DOWN_REVERSED);
			}
		}
	}

	private int wedgePriority(Bond b, int center){
		return degree(b.getOther(center))==1? 0: 1;
	}

	private double wedgeClearance(Bond b, int center, Map<Integer,Point2D> positions){
		int neighbor = b.getOther(center);
		Point2D c = positions.get(center);
		Point2D n = positions.get(neighbor);
		double dx = n.getX()-c.getX();
		double dy = n.getY()-c.getY();
		double len = Math.hypot(dx, dy);
		if(len<=0.0001)return 0;
		Point2D tip = new Point2D.Double(n.getX() + dx/len*0.35, n.getY() + dy/len*0.35);

		double minDistance = Double.MAX_VALUE;
		double crowd = 0;
		for(Atom a : atoms){
			if(a.getId()==center || a.getId()==neighbor)continue;
			double d = tip.distance(a.getPosition());
			minDistance = Math.min(minDistance, d);
			crowd += 1/Math.max(0.15, d);
		}
		if(minDistance==Double.MAX_VALUE)return 0;
		return minDistance - crowd*0.14;
	}

	/**
	 * The box around all atom positions; width and height are never below 0.0001.
	 * @return an empty Optional if there are no atoms.
	 */
	public Optional<Rectangle2D> getBoundingBox(){
		return GeomUtil.boundingBox(atoms.stream().map(Atom::getPosition).collect(Collectors.toList()));
	}

	/**
	 * @return false when every atom still sits on the origin (the "not laid out" state).
	 */
	public boolean hasCoordinates(){
		return atoms.stream().anyMatch(a->a.getPosition().getX()!=0 || a.getPosition().getY()!=0);
	}

	public double getAverageBondLength(){
		return bonds.stream()
				.mapToDouble(b->getAtom(b.getA1()).getPosition().distance(getAtom(b.getA2()).getPosition()))
				.average()
				.orElse(0);
	}

	/**
	 * Append all atoms and bonds of the given molecules into a new molecule,
	 * renumbering atom and bond ids from 1 in order.
	 */
	public static Molecule merge(String name, List<Molecule> parts){
		Molecule out = new Molecule(name);
		for(Molecule m : parts){
			Map<Integer,Integer> idMap = new LinkedHashMap<>();
			for(Atom a : m.atoms){
				Atom copy = a.copyWithId(out.nextAtomId);
				idMap.put(a.getId(), copy.getId());
				out.addAtom(copy);
			}
			for(Bond b : m.bonds){
				out.addBond(idMap.get(b.getA1()), idMap.get(b.getA2()), b.getOrder(), b.getStereo());
			}
			out.racemic |= m.racemic;
		}
		return out;
	}

	@Override
	public String toString() {
		return "Molecule{" + name + ", atoms=" + atoms.size() + ", bonds=" + bonds.size() + "}";
	}
}
