package gov.nih.ncats.molgraph.layout;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import gov.nih.ncats.molgraph.model.Bond;
import gov.nih.ncats.molgraph.model.Molecule;

/**
 * Approximate smallest set of smallest rings.
 * <p>
 * The number of rings returned is the cycle rank {@code E - V + C}. Candidates are the
 * shortest cycle through each bond plus all simple cycles up to the maximum size; they are
 * sorted by size and picked greedily as long as they cover a bond no earlier ring covered.
 * </p>
 */
public class RingSearch {

    private final int maxRingSize;

    public RingSearch(int maxRingSize){
        this.maxRingSize = maxRingSize;
    }

    public List<List<Integer>> findRings(Molecule molecule){
        Set<Long> edges = new TreeSet<>();
        for(Bond b : molecule.getBonds()){
            edges.add(Molecule.edgeKey(b.getA1(), b.getA2()));
        }
        int components = molecule.getConnectedComponents().size();
        int rank = Math.max(0, edges.size() - molecule.getAtomCount() + components);
        if(rank==0){
            return Collections.emptyList();
        }

        Set<List<Integer>> unique = new LinkedHashSet<>();
        for(Long edge : edges){
            int a = (int)(edge >> 32);
            int b = (int)(long)edge;
            List<Integer> path = shortestPathExcluding(molecule, a, b, maxRingSize-1);
            if(path!=null && path.size()>=3 && path.size()<=maxRingSize){
                unique.add(Molecule.canonicalCycle(path));
            }
        }
        unique.addAll(molecule.simpleCycles(maxRingSize));

        List<List<Integer>> candidates = new ArrayList<>(unique);
        candidates.sort(Molecule.RING_ORDER);

        List<List<Integer>> selected = new ArrayList<>();
        Set<Long> covered = new HashSet<>();
        for(List<Integer> ring : candidates){
            if(selected.size()>=rank){
                break;
            }
            List<Long> ringEdges = edgeKeys(ring);
            if(!covered.containsAll(ringEdges)){
                selected.add(ring);
                covered.addAll(ringEdges);
            }
        }
        for(List<Integer> ring : candidates){
            if(selected.size()>=rank){
                break;
            }
            if(!selected.contains(ring)){
                selected.add(ring);
            }
        }
        return selected;
    }

    public static List<Long> edgeKeys(List<Integer> ring){
        List<Long> keys = new ArrayList<>(ring.size());
        if(ring.size()<2){
            return keys;
        }
        for(int i=0;i<ring.size();i++){
            keys.add(Molecule.edgeKey(ring.get(i), ring.get((i+1)%ring.size())));
        }
        return keys;
    }

    /**
     * Breadth first shortest path from start to end that does not use the start-end bond.
     * @return the path including both ends, or null if there is none within maxDepth steps.
     */
    private static List<Integer> shortestPathExcluding(Molecule molecule, int start, int end, int maxDepth){
        Deque<Integer> queue = new ArrayDeque<>();
        Map<Integer,Integer> parent = new HashMap<>();
        Map<Integer,Integer> depth = new HashMap<>();
        queue.add(start);
        depth.put(start, 0);
        while(!queue.isEmpty()){
            int cur = queue.poll();
            if(cur==end){
                break;
            }
            int d = depth.get(cur);
            if(d>=maxDepth){
                continue;
            }
            for(Integer next : molecule.neighbors(cur)){
                if((cur==start && next==end) || (cur==end && next==start)){
                    continue;
                }
                if(depth.containsKey(next)){
                    continue;
                }
                depth.put(next, d+1);
                parent.put(next, cur);
                queue.add(next);
            }
        }
        if(!depth.containsKey(end)){
            return null;
        }
        List<Integer> path = new ArrayList<>();
        int cur = end;
        path.add(cur);
        while(cur!=start){
            Integer p = parent.get(cur);
            if(p==null){
                return null;
            }
            cur = p;
            path.add(cur);
        }
        Collections.reverse(path);
        return path;
    }
}
