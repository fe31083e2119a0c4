package gov.nih.ncats.molgraph.layout;

import java.awt.geom.Point2D;
import java.awt.geom.Rectangle2D;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.Stack;
import java.util.TreeSet;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

import gov.nih.ncats.molgraph.internal.util.GeomUtil;
import gov.nih.ncats.molgraph.model.Atom;
import gov.nih.ncats.molgraph.model.Bond;
import gov.nih.ncats.molgraph.model.BondOrder;
import gov.nih.ncats.molgraph.model.Molecule;

/**
 * Computes 2D coordinates for a molecule.
 * <p>
 * Each connected component is laid out on its own: ring systems as regular polygons
 * attached to each other (fused, then spiro, then bridged), chains as zig-zags and
 * the remaining substituents fanned around their parent. The result is cleaned up by
 * flipping substituents across single bonds and by a short spring relaxation.
 * Components are placed left to right, centered on y=0.
 * </p>
 * <p>
 * The layout is deterministic: the same molecule (same ids) always gives the same coordinates.
 * </p>
 */
public class StructureDiagramGenerator{
	private static final Logger logger = Logger.getLogger(StructureDiagramGenerator.class.getName());

	private static final double CHAIN_HARD = 0.95;
	private static final double CHAIN_HARD_PENALTY = 180;
	private static final double CHAIN_SOFT = 1.20;
	private static final double CHAIN_SOFT_PENALTY = 24;
	private static final double CHAIN_CENTROID_PULL = 0.22;
	private static final double CHAIN_ALTERNATE_SLACK = 1.08;

	private static final double FLIP_HARD_PENALTY = 120;
	private static final double FLIP_SOFT_PENALTY = 16;
	private static final double FLIP_CROSSING_PENALTY = 160;
	private static final double FLIP_NEAR = 0.35;
	private static final double FLIP_NEAR_PENALTY = 40;

	private static final double MIN_COMPONENT_ADVANCE = 6;
	private static final double COMPONENT_GAP = 4;

	private static final double SP2_ANGLE = Math.toRadians(120);
	private static final double SP3_ANGLE = Math.toRadians(109.5);

	private enum AttachmentMode{
		FUSED,
		SPIRO,
		BRIDGED,
		ISOLATED
	}

	private final LayoutOptions options;

	public StructureDiagramGenerator(){
		this(new LayoutOptions());
	}

	public StructureDiagramGenerator(LayoutOptions options){
		this.options = Objects.requireNonNull(options);
	}

	/**
	 * Lay out a copy of the given molecule. The input is not modified.
	 * @param molecule the molecule to lay out.
	 * @return a new Molecule with the same atoms, bonds and ids and new positions.
	 */
	public Molecule generate(Molecule molecule){
		Molecule out = molecule.copy();
		if(out.getAtomCount()<2){
			return out;
		}
		Map<Integer,Point2D> positions = new Session(out).run();
		for(Atom a : out.getAtoms()){
			Point2D p = positions.get(a.getId());
			if(p!=null){
				a.setPosition(p);
			}
		}
		logger.log(Level.FINE, "laid out " + out);
		return out;
	}

	/**
	 * Layout state for one call of {@link #generate(Molecule)}.
	 */
	private final class Session{
		private final Molecule molecule;
		private final double bondLength = options.getBondLength();
		private final Map<Integer,Point2D> positions = new HashMap<>();

		//current component
		private Set<Integer> component;
		private List<List<Integer>> rings;
		private Set<Integer> ringAtoms;
		private Set<Long> ringEdges;
		private List<List<List<Integer>>> systems = Collections.emptyList();

		Session(Molecule molecule){
			this.molecule = molecule;
		}

		private boolean placed(int id){
			return positions.containsKey(id);
		}

		Map<Integer,Point2D> run(){
			List<List<Integer>> sssr = new RingSearch(options.getMaxRingSize()).findRings(molecule);
			double offsetX = 0;
			for(List<Integer> comp : molecule.getConnectedComponents()){
				component = new TreeSet<>(comp);
				rings = sssr.stream()
						.filter(r->r.stream().anyMatch(component::contains))
						.sorted(Molecule.RING_ORDER)
						.collect(Collectors.toList());
				ringAtoms = rings.stream().flatMap(List::stream).collect(Collectors.toSet());
				ringEdges = rings.stream().flatMap(r->RingSearch.edgeKeys(r).stream()).collect(Collectors.toSet());

				layoutComponent(new Point2D.Double(offsetX, 0));

				Optional<Rectangle2D> box = componentBox();
				if(box.isPresent()){
					double dx = offsetX - box.get().getMinX();
					double dy = -box.get().getCenterY();
					for(Integer id : component){
						Point2D p = positions.get(id);
						positions.put(id, new Point2D.Double(p.getX()+dx, p.getY()+dy));
					}
					offsetX += Math.max(MIN_COMPONENT_ADVANCE, componentBox().get().getWidth() + COMPONENT_GAP);
				}else{
					offsetX += MIN_COMPONENT_ADVANCE;
				}
			}
			return positions;
		}

		private Optional<Rectangle2D> componentBox(){
			return GeomUtil.boundingBox(component.stream()
					.map(positions::get)
					.filter(Objects::nonNull)
					.collect(Collectors.toList()));
		}

		private void layoutComponent(Point2D origin){
			Map<Long,Integer> multiplicity = new HashMap<>();
			for(List<Integer> r : rings){
				RingSearch.edgeKeys(r).forEach(e->multiplicity.merge(e, 1, Integer::sum));
			}
			systems = ringSystems(rings);
			systems.sort(Comparator.<List<List<Integer>>>comparingInt(s->-fusedEdgeCount(s, multiplicity))
					.thenComparingInt(s->-(int)s.stream().flatMap(List::stream).distinct().count())
					.thenComparingInt(s->-s.size()));

			if(!systems.isEmpty()){
				placeRingSystem(systems.get(0), origin);
			}
			if(component.stream().noneMatch(this::placed)){
				positions.put(chooseSeed(), new Point2D.Double(origin.getX(), origin.getY()));
			}

			int rounds=0;
			boolean progressed = true;
			while(progressed && rounds < options.getChainPassLimit()){
				progressed = placeLongestUnplacedChains();
				progressed |= placeDistributedPartners(origin);
				rounds++;
			}

			for(List<List<Integer>> system : systems){
				boolean incomplete = system.stream().anyMatch(r->r.stream().anyMatch(id->!placed(id)));
				if(!incomplete){
					continue;
				}
				List<Point2D> anchors = system.stream()
						.flatMap(List::stream)
						.distinct()
						.filter(this::placed)
						.map(positions::get)
						.collect(Collectors.toList());
				placeRingSystem(system, GeomUtil.findCenterOfVertices(anchors).orElse(origin));
			}
			placeDistributedPartners(origin);

			for(Integer id : component){
				if(placed(id)){
					continue;
				}
				Optional<Integer> anchor = molecule.neighbors(id).stream()
						.filter(n->component.contains(n) && placed(n))
						.findFirst();
				if(anchor.isPresent()){
					double angle = Math.toRadians((id*37) % 360);
					positions.put(id, GeomUtil.translate(positions.get(anchor.get()), GeomUtil.unitVector(angle), bondLength));
				}else{
					positions.put(id, new Point2D.Double(origin.getX(), origin.getY()));
				}
			}

			Set<Integer> locked = component.stream()
					.filter(this::isAromaticAtom)
					.collect(Collectors.toSet());
			optimizeByBondFlips(locked);
			relax(locked);
		}

		private boolean isAromaticAtom(int id){
			return molecule.getAtom(id).isAromatic()
					|| molecule.bondsOf(id).stream().anyMatch(b->b.getOrder()==BondOrder.AROMATIC);
		}

		private int chooseSeed(){
			int best = -1;
			int bestScore = Integer.MIN_VALUE;
			for(Integer id : component){
				int score = (ringAtoms.contains(id)? 100: 0) + molecule.degree(id);
				//ties go to the higher id
				if(score >= bestScore){
					best = id;
					bestScore = score;
				}
			}
			return best;
		}

		/*
		 * Ring systems
		 */

		private List<List<List<Integer>>> ringSystems(List<List<Integer>> rings){
			List<List<List<Integer>>> out = new ArrayList<>();
			List<Set<Integer>> sets = rings.stream().map(HashSet::new).collect(Collectors.toList());
			boolean[] seen = new boolean[rings.size()];
			for(int i=0;i<rings.size();i++){
				if(seen[i])continue;
				seen[i]=true;
				List<Integer> group = new ArrayList<>();
				group.add(i);
				Stack<Integer> stack = new Stack<>();
				stack.push(i);
				while(!stack.isEmpty()){
					int cur = stack.pop();
					for(int j=0;j<rings.size();j++){
						if(!seen[j] && !Collections.disjoint(sets.get(cur), sets.get(j))){
							seen[j]=true;
							stack.push(j);
							group.add(j);
						}
					}
				}
				out.add(group.stream().map(rings::get).collect(Collectors.toList()));
			}
			return out;
		}

		private int fusedEdgeCount(List<List<Integer>> system, Map<Long,Integer> multiplicity){
			return (int) system.stream()
					.flatMap(r->RingSearch.edgeKeys(r).stream())
					.distinct()
					.filter(e->multiplicity.getOrDefault(e, 0)>1)
					.count();
		}

		private AttachmentMode attachmentMode(List<Integer> ring, List<Integer> placedRing){
			Set<Integer> shared = new HashSet<>(ring);
			shared.retainAll(placedRing);
			if(shared.size()>=2){
				Set<Long> edges = new HashSet<>(RingSearch.edgeKeys(ring));
				return Collections.disjoint(edges, RingSearch.edgeKeys(placedRing))? AttachmentMode.BRIDGED: AttachmentMode.FUSED;
			}
			if(shared.size()==1){
				return AttachmentMode.SPIRO;
			}
			return AttachmentMode.ISOLATED;
		}

		private List<Integer> placedOf(List<Integer> ring){
			return ring.stream().filter(this::placed).collect(Collectors.toList());
		}

		private void placeRingSystem(List<List<Integer>> system, Point2D center){
			if(system.isEmpty()){
				return;
			}
			List<List<Integer>> ordered = new ArrayList<>(system);
			ordered.sort(Molecule.RING_ORDER);

			int seedIndex = 0;
			for(int i=1;i<ordered.size();i++){
				int ci = placedOf(ordered.get(i)).size();
				int cs = placedOf(ordered.get(seedIndex)).size();
				if(ci>cs || (ci==cs && ordered.get(i).size()<ordered.get(seedIndex).size())){
					seedIndex = i;
				}
			}
			List<Integer> seed = ordered.get(seedIndex);
			List<Integer> seedPlaced = placedOf(seed);
			if(seedPlaced.isEmpty()){
				placeRegularRing(seed, center);
			}else if(seedPlaced.size()<seed.size()){
				//hanging off an atom that is already placed
				completeRing(seed, seedPlaced);
			}

			Set<Integer> placedRings = new HashSet<>();
			List<Integer> placementOrder = new ArrayList<>();
			if(!placedOf(seed).isEmpty()){
				placedRings.add(seedIndex);
				placementOrder.add(seedIndex);
			}

			boolean progress = true;
			while(progress){
				progress = false;
				List<int[]> candidates = new ArrayList<>();
				for(int idx=0; idx<ordered.size(); idx++){
					if(placedRings.contains(idx))continue;
					List<Integer> ring = ordered.get(idx);
					int shared = placedOf(ring).size();
					if(shared==0)continue;

					AttachmentMode bestMode = AttachmentMode.ISOLATED;
					int bestRank = Integer.MAX_VALUE;
					for(int rank=0; rank<placementOrder.size(); rank++){
						AttachmentMode mode = attachmentMode(ring, ordered.get(placementOrder.get(rank)));
						if(mode.ordinal()<bestMode.ordinal() || (mode==bestMode && rank<bestRank)){
							bestMode = mode;
							bestRank = rank;
						}
					}
					if(bestMode==AttachmentMode.ISOLATED){
						bestMode = AttachmentMode.BRIDGED;
						bestRank = Integer.MAX_VALUE/2;
					}
					candidates.add(new int[]{idx, bestMode.ordinal(), bestRank, shared});
				}
				candidates.sort((l,r)->{
					if(l[1]!=r[1])return Integer.compare(l[1], r[1]);
					if(l[2]!=r[2])return Integer.compare(l[2], r[2]);
					if(l[3]!=r[3])return Integer.compare(r[3], l[3]);
					return Molecule.RING_ORDER.compare(ordered.get(l[0]), ordered.get(r[0]));
				});

				for(int[] c : candidates){
					int idx = c[0];
					if(placedRings.contains(idx))continue;
					List<Integer> ring = ordered.get(idx);
					List<Integer> shared = placedOf(ring);
					if(shared.isEmpty())continue;

					if(completeRing(ring, shared) || ring.stream().allMatch(this::placed)){
						placedRings.add(idx);
						placementOrder.add(idx);
						progress = true;
					}
				}
			}
		}

		/**
		 * Place the missing atoms of a ring around the atoms already placed.
		 * @return {@code true} if any atom was placed.
		 */
		private boolean completeRing(List<Integer> ring, List<Integer> shared){
			Map<Integer,Point2D> best = bestRingPlacement(ring, shared);
			if(best==null){
				return false;
			}
			boolean didPlace = false;
			for(Integer id : ring){
				if(!placed(id) && best.containsKey(id)){
					positions.put(id, best.get(id));
					didPlace = true;
				}
			}
			return didPlace;
		}

		/**
		 * Lay out every ring system containing the given atom, starting from its position.
		 */
		private void placeRingSystemsThrough(int atomId){
			if(!ringAtoms.contains(atomId) || !placed(atomId)){
				return;
			}
			for(List<List<Integer>> system : systems){
				if(system.stream().anyMatch(r->r.contains(atomId))){
					placeRingSystem(system, positions.get(atomId));
				}
			}
		}

		private void placeRegularRing(List<Integer> ring, Point2D center){
			if(ring.size()<3){
				return;
			}
			int n = ring.size();
			double radius = bondLength/(2*Math.sin(Math.PI/n));
			double base = Math.toRadians((ring.get(0)*11) % 360);
			double step = 2*Math.PI/n;
			for(int i=0;i<n;i++){
				double angle = base + i*step;
				positions.put(ring.get(i), new Point2D.Double(center.getX() + Math.cos(angle)*radius, center.getY() + Math.sin(angle)*radius));
			}
		}

		private Map<Integer,Point2D> localRing(List<Integer> ring, boolean mirror){
			Map<Integer,Point2D> out = new HashMap<>();
			if(ring.size()<3){
				return out;
			}
			int n = ring.size();
			double radius = bondLength/(2*Math.sin(Math.PI/n));
			double step = 2*Math.PI/n;
			for(int i=0;i<n;i++){
				double y = Math.sin(i*step)*radius;
				out.put(ring.get(i), new Point2D.Double(Math.cos(i*step)*radius, mirror? -y: y));
			}
			return out;
		}

		private Map<Integer,Point2D> bestRingPlacement(List<Integer> ring, List<Integer> shared){
			List<Map<Integer,Point2D>> candidates = new ArrayList<>();
			Map<Integer,Point2D> local = localRing(ring, false);
			Map<Integer,Point2D> mirror = localRing(ring, true);

			if(shared.size()>=2){
				for(int[] pair : anchorPairs(ring, shared)){
					Point2D t1 = positions.get(pair[0]);
					Point2D t2 = positions.get(pair[1]);
					transformedRing(local, ring, pair[0], pair[1], t1, t2).ifPresent(candidates::add);
					transformedRing(mirror, ring, pair[0], pair[1], t1, t2).ifPresent(candidates::add);
				}
			}else{
				candidates.addAll(singleAnchorCandidates(ring, local, mirror, shared.get(0)));
			}
			Map<Integer,Point2D> best = null;
			double bestScore = Double.MAX_VALUE;
			for(Map<Integer,Point2D> c : candidates){
				double score = ringPlacementScore(c, ring, shared);
				if(best==null || score<bestScore){
					best = c;
					bestScore = score;
				}
			}
			return best;
		}

		/**
		 * Anchor pairs to map a new ring onto: bonded shared pairs first,
		 * then the pairs furthest apart around the ring. At most 4.
		 */
		private List<int[]> anchorPairs(List<Integer> ring, List<Integer> shared){
			final int maxPairs = 4;
			Set<Integer> sharedSet = new HashSet<>(shared);
			List<int[]> pairs = new ArrayList<>();
			Set<Long> seen = new HashSet<>();
			int n = ring.size();
			for(int i=0;i<n;i++){
				int a = ring.get(i);
				int b = ring.get((i+1)%n);
				if(sharedSet.contains(a) && sharedSet.contains(b) && seen.add(Molecule.edgeKey(a, b))){
					pairs.add(new int[]{a,b});
				}
			}
			List<int[]> byGap = new ArrayList<>();
			for(int i=0;i<shared.size();i++){
				for(int j=i+1;j<shared.size();j++){
					int a = shared.get(i);
					int b = shared.get(j);
					int diff = Math.abs(ring.indexOf(a) - ring.indexOf(b));
					byGap.add(new int[]{Math.min(diff, n-diff), a, b});
				}
			}
			byGap.sort((l,r)->{
				if(l[0]!=r[0])return Integer.compare(r[0], l[0]);
				if(l[1]!=r[1])return Integer.compare(l[1], r[1]);
				return Integer.compare(l[2], r[2]);
			});
			for(int[] g : byGap){
				if(seen.add(Molecule.edgeKey(g[1], g[2]))){
					pairs.add(new int[]{g[1], g[2]});
				}
				if(pairs.size()>=maxPairs){
					break;
				}
			}
			return pairs.size()>maxPairs? pairs.subList(0, maxPairs): pairs;
		}

		private Optional<Map<Integer,Point2D>> transformedRing(Map<Integer,Point2D> local, List<Integer> ring,
				int anchor1, int anchor2, Point2D target1, Point2D target2){
			Point2D l1 = local.get(anchor1);
			Point2D l2 = local.get(anchor2);
			if(l1==null || l2==null){
				return Optional.empty();
			}
			double[] lv = GeomUtil.vector(l1, l2);
			double[] tv = GeomUtil.vector(target1, target2);
			double ll = GeomUtil.l2Norm(lv);
			double tl = GeomUtil.l2Norm(tv);
			if(ll<=GeomUtil.EPS || tl<=GeomUtil.EPS){
				return Optional.empty();
			}
			double scale = tl/ll;
			double angle = GeomUtil.angle(tv) - GeomUtil.angle(lv);
			double c = Math.cos(angle);
			double s = Math.sin(angle);
			Map<Integer,Point2D> out = new HashMap<>();
			for(Integer id : ring){
				Point2D p = local.get(id);
				double sx = (p.getX()-l1.getX())*scale;
				double sy = (p.getY()-l1.getY())*scale;
				out.put(id, new Point2D.Double(target1.getX() + sx*c - sy*s, target1.getY() + sx*s + sy*c));
			}
			return Optional.of(out);
		}

		private List<Map<Integer,Point2D>> singleAnchorCandidates(List<Integer> ring, Map<Integer,Point2D> local,
				Map<Integer,Point2D> mirror, int sharedAtom){
			List<Map<Integer,Point2D>> out = new ArrayList<>();
			int idx = ring.indexOf(sharedAtom);
			if(idx<0){
				return out;
			}
			double[] preferred = preferredExpansionDirection(sharedAtom);
			Point2D target = positions.get(sharedAtom);

			rotatedOnto(local, ring, sharedAtom, preferred, target).ifPresent(out::add);
			rotatedOnto(mirror, ring, sharedAtom, preferred, target).ifPresent(out::add);
			return out;
		}

		/**
		 * Rotate a local ring (centered on the origin) about the shared atom so its
		 * center lies along the preferred direction, then move the shared atom onto the target.
		 */
		private Optional<Map<Integer,Point2D>> rotatedOnto(Map<Integer,Point2D> base, List<Integer> ring,
				int sharedAtom, double[] preferred, Point2D target){
			Point2D ls = base.get(sharedAtom);
			if(ls==null){
				return Optional.empty();
			}
			double[] uLocal = GeomUtil.normalize(GeomUtil.vector(ls, new Point2D.Double(0, 0)));
			double[] uPref = GeomUtil.normalize(preferred);
			if(uLocal==null || uPref==null){
				return Optional.empty();
			}
			double angle = GeomUtil.angle(uPref) - GeomUtil.angle(uLocal);
			double c = Math.cos(angle);
			double s = Math.sin(angle);
			Map<Integer,Point2D> out = new HashMap<>();
			for(Integer id : ring){
				Point2D p = base.get(id);
				double x = p.getX()-ls.getX();
				double y = p.getY()-ls.getY();
				out.put(id, new Point2D.Double(target.getX() + x*c - y*s, target.getY() + x*s + y*c));
			}
			return Optional.of(out);
		}

		/**
		 * Direction pointing away from the atom's placed neighbors.
		 */
		private double[] preferredExpansionDirection(int atomId){
			Point2D center = positions.get(atomId);
			if(center==null){
				return new double[]{1,0};
			}
			List<Point2D> placedNeighbors = molecule.neighbors(atomId).stream()
					.filter(this::placed)
					.map(positions::get)
					.collect(Collectors.toList());
			if(placedNeighbors.isEmpty()){
				return GeomUtil.unitVector(Math.toRadians((atomId*53) % 360));
			}
			double[] sum = new double[2];
			for(Point2D p : placedNeighbors){
				double[] u = GeomUtil.normalize(GeomUtil.vector(center, p));
				if(u!=null){
					sum[0]+=u[0];
					sum[1]+=u[1];
				}
			}
			double[] open = GeomUtil.normalize(GeomUtil.negate(sum));
			if(open!=null){
				return open;
			}
			double[] v = GeomUtil.vector(center, placedNeighbors.get(0));
			double[] perpendicular = GeomUtil.normalize(new double[]{-v[1], v[0]});
			return perpendicular!=null? perpendicular: new double[]{1,0};
		}

		private double ringPlacementScore(Map<Integer,Point2D> candidate, List<Integer> ring, List<Integer> shared){
			double score = 0;
			Set<Integer> sharedSet = new HashSet<>(shared);
			Set<Integer> ringSet = new HashSet<>(ring);

			for(Integer id : shared){
				Point2D p = candidate.get(id);
				if(p!=null){
					score += p.distance(positions.get(id)) * options.getAnchorDriftPenalty();
				}
			}

			List<Integer> existing = component.stream()
					.filter(id->placed(id) && !ringSet.contains(id))
					.collect(Collectors.toList());
			List<Integer> newAtoms = ring.stream()
					.filter(id->!sharedSet.contains(id))
					.collect(Collectors.toList());

			double hard = bondLength*options.getHardOverlapDistance();
			double soft = bondLength*options.getSoftOverlapDistance();
			for(Integer id : newAtoms){
				Point2D p = candidate.get(id);
				for(Integer other : existing){
					double d = p.distance(positions.get(other));
					if(d<hard){
						score += (hard-d)*(hard-d)*options.getHardOverlapPenalty();
					}else if(d<soft){
						score += (soft-d)*(soft-d)*options.getSoftOverlapPenalty();
					}
				}
			}

			double intra = bondLength*options.getIntraRingDistance();
			for(int i=0;i<newAtoms.size();i++){
				for(int j=i+1;j<newAtoms.size();j++){
					double d = candidate.get(newAtoms.get(i)).distance(candidate.get(newAtoms.get(j)));
					if(d<intra){
						score += (intra-d)*(intra-d)*options.getIntraRingPenalty();
					}
				}
			}

			List<Long> edges = RingSearch.edgeKeys(ring);
			Set<Long> edgeSet = new HashSet<>(edges);
			List<Bond> existingBonds = molecule.getBonds().stream()
					.filter(b->component.contains(b.getA1()) && component.contains(b.getA2()))
					.filter(b->placed(b.getA1()) && placed(b.getA2()))
					.filter(b->!edgeSet.contains(Molecule.edgeKey(b.getA1(), b.getA2())))
					.collect(Collectors.toList());
			double near = bondLength*options.getEdgeNearDistance();
			for(Long e : edges){
				int a = (int)(e >> 32);
				int b = (int)(long)e;
				Point2D pa = candidate.get(a);
				Point2D pb = candidate.get(b);
				for(Bond other : existingBonds){
					if(other.contains(a) || other.contains(b)){
						continue;
					}
					Point2D pu = positions.get(other.getA1());
					Point2D pv = positions.get(other.getA2());
					if(GeomUtil.segmentsIntersect(pa, pb, pu, pv)){
						score += options.getEdgeCrossingPenalty();
					}else{
						double d = GeomUtil.segmentDistance(pa, pb, pu, pv);
						if(d<near){
							score += (near-d)*(near-d)*options.getEdgeNearPenalty();
						}
					}
				}
			}
			return score;
		}

		/*
		 * Substituents
		 */

		private boolean placeDistributedPartners(Point2D fallback){
			boolean progressedAny = false;
			boolean progress = true;
			int passes = 0;
			int maxPasses = Math.max(4, component.size()*2);
			while(progress && passes < maxPasses){
				progress = false;
				passes++;
				for(Integer center : component){
					if(!placed(center))continue;
					List<Integer> neighbors = molecule.neighbors(center).stream()
							.filter(component::contains)
							.collect(Collectors.toList());
					List<Integer> placedNeighbors = neighbors.stream().filter(this::placed).collect(Collectors.toList());
					if(neighbors.stream().allMatch(this::placed))continue;

					for(List<Integer> ring : rings){
						if(ring.contains(center) && ring.stream().anyMatch(id->!placed(id))){
							placeRingSystem(Collections.singletonList(ring), positions.getOrDefault(center, fallback));
						}
					}

					List<Integer> unplaced = neighbors.stream().filter(id->!placed(id)).collect(Collectors.toList());
					if(unplaced.isEmpty())continue;

					List<double[]> dirs = proposedDirections(center, placedNeighbors, unplaced.size());
					Point2D centerPos = positions.get(center);
					for(int i=0;i<unplaced.size();i++){
						int id = unplaced.get(i);
						if(placed(id))continue;
						double[] dir = dirs.get(Math.min(i, dirs.size()-1));
						positions.put(id, GeomUtil.translate(centerPos, dir, bondLength));
						placeRingSystemsThrough(id);
						progress = true;
						progressedAny = true;
					}
				}
			}
			return progressedAny;
		}

		private List<double[]> proposedDirections(int center, List<Integer> placedNeighbors, int unplacedCount){
			Point2D centerPos = positions.get(center);
			if(placedNeighbors.isEmpty()){
				double base = Math.toRadians((center*47) % 360);
				return fanDirections(unplacedCount, base, 2*Math.PI);
			}
			if(placedNeighbors.size()==1){
				int parent = placedNeighbors.get(0);
				double[] uParent = GeomUtil.normalize(GeomUtil.vector(centerPos, positions.get(parent)));
				if(uParent==null){
					uParent = new double[]{-1,0};
				}
				double target = preferredAngle(center);
				if(unplacedCount==1){
					double sign = (center+parent)%2==0? 1: -1;
					return Collections.singletonList(GeomUtil.rotate(uParent, sign*target));
				}
				double base = GeomUtil.angle(GeomUtil.rotate(uParent, Math.PI));
				double spread = Math.min(options.getBranchOpenSpread(), target + 0.5);
				return fanDirections(unplacedCount, base, spread*2);
			}
			double[] sum = new double[2];
			double[] first = null;
			for(Integer n : placedNeighbors){
				double[] u = GeomUtil.normalize(GeomUtil.vector(centerPos, positions.get(n)));
				if(u==null)continue;
				if(first==null)first = u;
				sum[0]+=u[0];
				sum[1]+=u[1];
			}
			double[] open = GeomUtil.normalize(GeomUtil.negate(sum));
			if(open==null && first!=null){
				open = GeomUtil.normalize(new double[]{-first[1], first[0]});
			}
			if(open==null){
				open = new double[]{1,0};
			}
			return fanDirections(unplacedCount, GeomUtil.angle(open), options.getBranchFanSpread());
		}

		/**
		 * 120 degrees next to double, triple or aromatic bonds, tetrahedral otherwise.
		 */
		private double preferredAngle(int atomId){
			Atom atom = molecule.getAtom(atomId);
			boolean piLike = atom.isAromatic()
					|| molecule.bondsOf(atomId).stream().anyMatch(b->b.getOrder().isPiLike())
					|| molecule.neighbors(atomId).stream()
						.anyMatch(n->molecule.bondsOf(n).stream()
								.anyMatch(b->!b.contains(atomId) && b.getOrder().isPiLike()));
			return piLike? SP2_ANGLE: SP3_ANGLE;
		}

		private List<double[]> fanDirections(int count, double baseAngle, double totalSpread){
			List<double[]> out = new ArrayList<>();
			if(count<=0){
				return out;
			}
			if(count==1){
				out.add(GeomUtil.unitVector(baseAngle));
				return out;
			}
			double start = baseAngle - totalSpread/2;
			double step = totalSpread/(count-1);
			for(int i=0;i<count;i++){
				out.add(GeomUtil.unitVector(start + i*step));
			}
			return out;
		}

		/*
		 * Chains
		 */

		private boolean placeLongestUnplacedChains(){
			boolean any = false;
			for(int pass=0; pass<options.getChainPassLimit(); pass++){
				List<Integer> chain = bestUnplacedChain();
				if(chain==null || chain.size()<2){
					break;
				}
				placeLinearChain(chain, initialChainVector(chain.get(0), chain.get(1)));
				placeRingSystemsThrough(chain.get(chain.size()-1));
				any = true;
			}
			return any;
		}

		private List<Integer> bestUnplacedChain(){
			List<Integer> best = new ArrayList<>();
			for(Integer anchor : component){
				if(!placed(anchor))continue;
				for(Integer start : molecule.neighbors(anchor)){
					if(!component.contains(start) || placed(start))continue;
					List<Integer> chain = longestUnplacedChain(anchor, start);
					if(chain.size()>best.size() || (chain.size()==best.size() && precedes(chain, best))){
						best = chain;
					}
				}
			}
			return best.size()>=2? best: null;
		}

		private boolean precedes(List<Integer> lhs, List<Integer> rhs){
			if(rhs.isEmpty()){
				return true;
			}
			return Molecule.compareLexicographically(lhs, rhs)<0;
		}

		private List<Integer> longestUnplacedChain(int anchor, int start){
			List<Integer> initial = new ArrayList<>();
			initial.add(anchor);
			initial.add(start);
			List<List<Integer>> best = new ArrayList<>();
			best.add(initial);
			if(ringAtoms.contains(start)){
				return initial;
			}
			Set<Integer> visited = new HashSet<>(initial);
			extendChain(anchor, start, new ArrayList<>(initial), visited, best);
			return best.get(0);
		}

		private void updateBest(List<Integer> path, List<List<Integer>> best){
			List<Integer> current = best.get(0);
			if(path.size()>current.size() || (path.size()==current.size() && precedes(path, current))){
				best.set(0, new ArrayList<>(path));
			}
		}

		private void extendChain(int prev, int cur, List<Integer> path, Set<Integer> visited, List<List<Integer>> best){
			if(ringAtoms.contains(cur) || !chainEligibleAtom(cur)){
				updateBest(path, best);
				return;
			}
			boolean extended = false;
			for(Integer next : molecule.neighbors(cur)){
				if(!component.contains(next) || next==prev || placed(next) || visited.contains(next)){
					continue;
				}
				if(ringAtoms.contains(next)){
					path.add(next);
					updateBest(path, best);
					path.remove(path.size()-1);
					continue;
				}
				if(!chainEligibleAtom(next) || !chainEligibleEdge(cur, next)){
					continue;
				}
				visited.add(next);
				path.add(next);
				extendChain(cur, next, path, visited, best);
				path.remove(path.size()-1);
				visited.remove(next);
				extended = true;
			}
			if(!extended){
				updateBest(path, best);
			}
		}

		private boolean chainEligibleAtom(int id){
			return !ringAtoms.contains(id) && !molecule.getAtom(id).isElement("H");
		}

		private boolean chainEligibleEdge(int a, int b){
			if(ringEdges.contains(Molecule.edgeKey(a, b))){
				return false;
			}
			return molecule.getBond(a, b).map(bond->bond.getOrder()==BondOrder.SINGLE).orElse(false);
		}

		private double[] initialChainVector(int anchor, int first){
			Point2D center = positions.get(anchor);
			double[] fallback = GeomUtil.unitVector(Math.toRadians((anchor*41 + first*17) % 360));
			if(center==null){
				return fallback;
			}
			double[] sum = new double[2];
			for(Integer n : molecule.neighbors(anchor)){
				if(!component.contains(n) || !placed(n))continue;
				double[] u = GeomUtil.normalize(GeomUtil.vector(center, positions.get(n)));
				if(u==null)continue;
				sum[0]+=u[0];
				sum[1]+=u[1];
			}
			double[] open = GeomUtil.normalize(GeomUtil.negate(sum));
			return open!=null? open: fallback;
		}

		private void placeLinearChain(List<Integer> chain, double[] initial){
			Point2D anchorPos = positions.get(chain.get(0));
			if(chain.size()<2 || anchorPos==null){
				return;
			}
			double[] startDir = GeomUtil.normalize(initial);
			if(startDir==null){
				startDir = new double[]{1,0};
			}
			if(!placed(chain.get(1))){
				positions.put(chain.get(1), GeomUtil.translate(anchorPos, startDir, bondLength));
			}
			if(chain.size()<3){
				return;
			}
			Set<Integer> chainTail = new HashSet<>(chain.subList(1, chain.size()));
			Point2D centroid = GeomUtil.findCenterOfVertices(component.stream()
					.filter(id->!chainTail.contains(id) && placed(id))
					.map(positions::get)
					.collect(Collectors.toList()))
					.orElse(null);

			double chainAngle = Math.toRadians(options.getChainAngleDegrees());
			int lastSign = 0;
			for(int i=2;i<chain.size();i++){
				Point2D pa = positions.get(chain.get(i-2));
				Point2D pb = positions.get(chain.get(i-1));
				double[] back = GeomUtil.normalize(GeomUtil.vector(pb, pa));
				if(back==null){
					back = new double[]{1,0};
				}
				Point2D p1 = GeomUtil.translate(pb, GeomUtil.rotate(back, chainAngle), bondLength);
				Point2D p2 = GeomUtil.translate(pb, GeomUtil.rotate(back, -chainAngle), bondLength);
				double s1 = chainPointScore(p1, centroid);
				double s2 = chainPointScore(p2, centroid);

				boolean pickFirst;
				if(lastSign==0){
					pickFirst = s1<=s2;
				}else{
					//zig-zag unless the other side is clearly better
					int preferredSign = -lastSign;
					double preferred = preferredSign>0? s1: s2;
					double alternate = preferredSign>0? s2: s1;
					if(preferred <= alternate*CHAIN_ALTERNATE_SLACK){
						pickFirst = preferredSign>0;
					}else{
						pickFirst = s1<=s2;
					}
				}
				positions.put(chain.get(i), pickFirst? p1: p2);
				lastSign = pickFirst? 1: -1;
			}
		}

		private double chainPointScore(Point2D point, Point2D centroid){
			double score = 0;
			double hard = bondLength*CHAIN_HARD;
			double soft = bondLength*CHAIN_SOFT;
			for(Point2D q : positions.values()){
				double d = point.distance(q);
				if(d<hard){
					score += (hard-d)*(hard-d)*CHAIN_HARD_PENALTY;
				}else if(d<soft){
					score += (soft-d)*(soft-d)*CHAIN_SOFT_PENALTY;
				}
			}
			if(centroid!=null){
				score -= point.distance(centroid)*CHAIN_CENTROID_PULL;
			}
			return score;
		}

		/*
		 * Clean up
		 */

		private List<Bond> componentBonds(){
			return molecule.getBonds().stream()
					.filter(b->component.contains(b.getA1()) && component.contains(b.getA2()))
					.collect(Collectors.toList());
		}

		private void optimizeByBondFlips(Set<Integer> locked){
			List<Bond> candidates = componentBonds().stream()
					.filter(b->b.getOrder()==BondOrder.SINGLE)
					.sorted(Comparator.comparingInt(Bond::getId))
					.collect(Collectors.toList());
			for(Bond bond : candidates){
				if(ringEdges.contains(Molecule.edgeKey(bond.getA1(), bond.getA2()))){
					continue;
				}
				Set<Integer> left = sideOf(bond);
				if(left.contains(bond.getA2())){
					//not a bridge
					continue;
				}
				Set<Integer> right = new HashSet<>(component);
				right.removeAll(left);
				Set<Integer> flip = left.size()<=right.size()? left: right;
				if(flip.isEmpty() || flip.stream().anyMatch(locked::contains)){
					continue;
				}
				Point2D p1 = positions.get(bond.getA1());
				Point2D p2 = positions.get(bond.getA2());

				double before = layoutPenalty(positions);
				Map<Integer,Point2D> trial = new HashMap<>(positions);
				for(Integer id : flip){
					trial.put(id, GeomUtil.reflect(trial.get(id), p1, p2));
				}
				double after = layoutPenalty(trial);
				if(after < before*options.getBondFlipGain()){
					positions.putAll(trial);
				}
			}
		}

		/**
		 * Atoms reachable from the bond's first atom without crossing the bond.
		 */
		private Set<Integer> sideOf(Bond bond){
			Set<Integer> seen = new HashSet<>();
			Stack<Integer> stack = new Stack<>();
			seen.add(bond.getA1());
			stack.push(bond.getA1());
			while(!stack.isEmpty()){
				int cur = stack.pop();
				for(Integer next : molecule.neighbors(cur)){
					if(!component.contains(next) || bond.connects(cur, next)){
						continue;
					}
					if(seen.add(next)){
						stack.push(next);
					}
				}
			}
			return seen;
		}

		private double layoutPenalty(Map<Integer,Point2D> pos){
			double score = 0;
			List<Integer> atoms = new ArrayList<>(component);
			List<Bond> bonds = componentBonds();
			Set<Long> bonded = bonds.stream().map(b->Molecule.edgeKey(b.getA1(), b.getA2())).collect(Collectors.toSet());
			double hard = bondLength*CHAIN_HARD;
			double soft = bondLength*CHAIN_SOFT;
			for(int i=0;i<atoms.size();i++){
				for(int j=i+1;j<atoms.size();j++){
					if(bonded.contains(Molecule.edgeKey(atoms.get(i), atoms.get(j))))continue;
					double d = pos.get(atoms.get(i)).distance(pos.get(atoms.get(j)));
					if(d<hard){
						score += (hard-d)*(hard-d)*FLIP_HARD_PENALTY;
					}else if(d<soft){
						score += (soft-d)*(soft-d)*FLIP_SOFT_PENALTY;
					}
				}
			}
			double near = bondLength*FLIP_NEAR;
			for(int i=0;i<bonds.size();i++){
				for(int j=i+1;j<bonds.size();j++){
					Bond b1 = bonds.get(i);
					Bond b2 = bonds.get(j);
					if(b1.contains(b2.getA1()) || b1.contains(b2.getA2()))continue;
					Point2D p1 = pos.get(b1.getA1());
					Point2D p2 = pos.get(b1.getA2());
					Point2D q1 = pos.get(b2.getA1());
					Point2D q2 = pos.get(b2.getA2());
					if(GeomUtil.segmentsIntersect(p1, p2, q1, q2)){
						score += FLIP_CROSSING_PENALTY;
					}else{
						double d = GeomUtil.segmentDistance(p1, p2, q1, q2);
						if(d<near){
							score += (near-d)*(near-d)*FLIP_NEAR_PENALTY;
						}
					}
				}
			}
			return score;
		}

		private void move(int id, Set<Integer> locked, double dx, double dy){
			if(locked.contains(id)){
				return;
			}
			Point2D p = positions.get(id);
			positions.put(id, new Point2D.Double(p.getX()+dx, p.getY()+dy));
		}

		private void relax(Set<Integer> locked){
			List<Integer> atoms = new ArrayList<>(component);
			if(atoms.size()<2){
				return;
			}
			List<Bond> bonds = componentBonds();
			Set<Long> bonded = new LinkedHashSet<>();
			molecule.getBonds().forEach(b->bonded.add(Molecule.edgeKey(b.getA1(), b.getA2())));
			double minDistance = bondLength*options.getNonBondedMinimum();
			double push = bondLength*options.getCrossingPush();

			for(int iter=0; iter<Math.max(1, options.getRelaxIterations()); iter++){
				for(Bond b : bonds){
					Point2D p1 = positions.get(b.getA1());
					Point2D p2 = positions.get(b.getA2());
					double dx = p2.getX()-p1.getX();
					double dy = p2.getY()-p1.getY();
					double d = Math.max(GeomUtil.EPS, Math.hypot(dx, dy));
					double delta = (d-bondLength)*options.getBondSpring();
					move(b.getA1(), locked, dx/d*delta, dy/d*delta);
					move(b.getA2(), locked, -dx/d*delta, -dy/d*delta);
				}

				for(int i=0;i<atoms.size();i++){
					for(int j=i+1;j<atoms.size();j++){
						int a = atoms.get(i);
						int b = atoms.get(j);
						if(bonded.contains(Molecule.edgeKey(a, b)))continue;
						Point2D pa = positions.get(a);
						Point2D pb = positions.get(b);
						double dx = pb.getX()-pa.getX();
						double dy = pb.getY()-pa.getY();
						double d = Math.max(GeomUtil.EPS, Math.hypot(dx, dy));
						if(d>=minDistance)continue;
						double amount = (minDistance-d)*options.getNonBondedPush();
						move(a, locked, -dx/d*amount, -dy/d*amount);
						move(b, locked, dx/d*amount, dy/d*amount);
					}
				}

				for(int i=0;i<bonds.size();i++){
					for(int j=i+1;j<bonds.size();j++){
						Bond b1 = bonds.get(i);
						Bond b2 = bonds.get(j);
						if(b1.contains(b2.getA1()) || b1.contains(b2.getA2()))continue;
						Point2D p1 = positions.get(b1.getA1());
						Point2D p2 = positions.get(b1.getA2());
						Point2D q1 = positions.get(b2.getA1());
						Point2D q2 = positions.get(b2.getA2());
						if(!GeomUtil.segmentsIntersect(p1, p2, q1, q2))continue;

						double[] v1 = GeomUtil.normalize(GeomUtil.vector(p1, p2));
						double[] v2 = GeomUtil.normalize(GeomUtil.vector(q1, q2));
						if(v1==null)v1 = new double[]{1,0};
						if(v2==null)v2 = new double[]{0,1};
						double sign = (v1[0]*v2[1] - v1[1]*v2[0])>=0? 1: -1;
						double[] perp1 = {-v1[1]*sign, v1[0]*sign};
						double[] perp2 = {v2[1]*sign, -v2[0]*sign};
						move(b1.getA1(), locked, perp1[0]*push, perp1[1]*push);
						move(b1.getA2(), locked, perp1[0]*push, perp1[1]*push);
						move(b2.getA1(), locked, perp2[0]*push, perp2[1]*push);
						move(b2.getA2(), locked, perp2[0]*push, perp2[1]*push);
					}
				}
			}
		}
	}
}
