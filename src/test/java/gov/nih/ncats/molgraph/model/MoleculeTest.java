package gov.nih.ncats.molgraph.model;

import static org.junit.Assert.*;

import java.awt.geom.Rectangle2D;
import java.util.Arrays;
import java.util.List;

import org.junit.Test;

public class MoleculeTest {

	private static Molecule chain(int n){
		Molecule m = new Molecule("chain");
		Atom prev = null;
		for(int i=0;i<n;i++){
			Atom a = m.addAtom("C");
			if(prev !=null){
				m.addBond(prev.getId(), a.getId(), BondOrder.SINGLE);
			}
			prev = a;
		}
		return m;
	}

	private static Molecule ring(int n){
		Molecule m = chain(n);
		m.addBond(n, 1, BondOrder.SINGLE);
		return m;
	}

	@Test
	public void idsStartAtOne(){
		Molecule m = chain(3);
		assertEquals(Arrays.asList(1, 2, 3), Arrays.asList(
				m.getAtoms().get(0).getId(), m.getAtoms().get(1).getId(), m.getAtoms().get(2).getId()));
		assertEquals(1, m.getBonds().get(0).getId());
		assertEquals(2, m.indexOf(3));
		assertEquals(-1, m.indexOf(42));
		assertNull(m.getAtom(42));
	}

	@Test
	public void neighborsAreSorted(){
		Molecule m = new Molecule();
		Atom center = m.addAtom("C");
		Atom c = m.addAtom("C");
		Atom b = m.addAtom("N");
		Atom a = m.addAtom("O");
		m.addBond(center.getId(), a.getId(), BondOrder.SINGLE);
		m.addBond(center.getId(), c.getId(), BondOrder.SINGLE);
		m.addBond(center.getId(), b.getId(), BondOrder.DOUBLE);
		assertEquals(Arrays.asList(2, 3, 4), m.neighbors(center.getId()));
		assertEquals(3, m.degree(center.getId()));
		assertEquals(BondOrder.DOUBLE, m.getBond(3, 1).get().getOrder());
		assertFalse(m.getBond(2, 3).isPresent());
	}

	@Test
	public void cachesAreResetOnChange(){
		Molecule m = chain(2);
		assertEquals(1, m.degree(1));
		Atom extra = m.addAtom("O");
		Bond b = m.addBond(1, extra.getId(), BondOrder.SINGLE);
		assertEquals(2, m.degree(1));
		assertTrue(m.removeBond(b));
		assertEquals(1, m.degree(1));
	}

	@Test(expected = IllegalArgumentException.class)
	public void selfLoopIsRejected(){
		Molecule m = chain(1);
		m.addBond(1, 1, BondOrder.SINGLE);
	}

	@Test(expected = IllegalArgumentException.class)
	public void bondToUnknownAtomIsRejected(){
		chain(2).addBond(1, 7, BondOrder.SINGLE);
	}

	@Test(expected = IllegalArgumentException.class)
	public void duplicateAtomIdIsRejected(){
		Molecule m = chain(2);
		m.addAtom(new Atom(2, "N"));
	}

	@Test
	public void connectedComponents(){
		Molecule m = chain(3);
		m.addAtom("Na");
		Atom o = m.addAtom("O");
		Atom h = m.addAtom("H");
		m.addBond(o.getId(), h.getId(), BondOrder.SINGLE);

		List<List<Integer>> components = m.getConnectedComponents();
		assertEquals(3, components.size());
		assertEquals(Arrays.asList(1, 2, 3), components.get(0));
		assertEquals(Arrays.asList(4), components.get(1));
		assertEquals(Arrays.asList(5, 6), components.get(2));
	}

	@Test
	public void simpleCyclesAreCanonical(){
		Molecule m = ring(6);
		List<List<Integer>> cycles = m.simpleCycles();
		assertEquals(1, cycles.size());
		assertEquals(Arrays.asList(1, 2, 3, 4, 5, 6), cycles.get(0));
		assertTrue(m.simpleCycles(5).isEmpty());
	}

	@Test
	public void fusedRingsReportEveryCycle(){
		//bicyclo[2.2.0]hexane: two 4 rings and the 6 ring around them
		Molecule m = ring(6);
		m.addBond(1, 4, BondOrder.SINGLE);
		List<List<Integer>> cycles = m.simpleCycles();
		assertEquals(3, cycles.size());
		assertEquals(4, cycles.get(0).size());
		assertEquals(4, cycles.get(1).size());
		assertEquals(6, cycles.get(2).size());
	}

	@Test
	public void canonicalCycle(){
		assertEquals(Arrays.asList(1, 2, 3, 4), Molecule.canonicalCycle(Arrays.asList(3, 4, 1, 2)));
		assertEquals(Arrays.asList(1, 2, 3, 4), Molecule.canonicalCycle(Arrays.asList(4, 3, 2, 1)));
	}

	@Test
	public void ringOrder(){
		assertTrue(Molecule.RING_ORDER.compare(Arrays.asList(5, 6, 7), Arrays.asList(1, 2, 3, 4)) < 0);
		assertTrue(Molecule.RING_ORDER.compare(Arrays.asList(1, 2, 4), Arrays.asList(1, 2, 3)) > 0);
	}

	@Test
	public void edgeKeyIsSymmetric(){
		assertEquals(Molecule.edgeKey(3, 9), Molecule.edgeKey(9, 3));
		assertNotEquals(Molecule.edgeKey(3, 9), Molecule.edgeKey(3, 8));
	}

	@Test
	public void alternatingRingIsAromaticForDisplay(){
		Molecule m = chain(6);
		m.getBonds().get(0).setOrder(BondOrder.DOUBLE);
		m.getBonds().get(2).setOrder(BondOrder.DOUBLE);
		m.getBonds().get(4).setOrder(BondOrder.DOUBLE);
		m.addBond(6, 1, BondOrder.SINGLE);

		assertEquals(1, m.aromaticDisplayRings().size());
		assertEquals(6, m.aromaticDisplayBondIds().size());

		assertTrue(ring(6).aromaticDisplayRings().isEmpty());
	}

	@Test
	public void implicitHydrogens(){
		Molecule m = chain(2);
		Atom o = m.addAtom("O");
		m.addBond(2, o.getId(), BondOrder.DOUBLE);
		assertEquals(3, m.implicitHydrogenCount(1));
		assertEquals(1, m.implicitHydrogenCount(2));
		assertEquals(0, m.implicitHydrogenCount(o.getId()));

		Atom n = m.addAtom("N").setCharge(1);
		assertEquals(4, m.implicitHydrogenCount(n.getId()));
		n.setExplicitHydrogenCount(0);
		assertEquals(0, m.implicitHydrogenCount(n.getId()));

		assertEquals(0, m.implicitHydrogenCount(m.addAtom("Fe").getId()));
	}

	@Test
	public void copyIsIndependent(){
		Molecule m = chain(3).setRacemic(true);
		Molecule copy = m.copy();
		copy.getAtoms().get(0).setPosition(5, 5).setElement("N");
		copy.getBonds().get(0).setOrder(BondOrder.TRIPLE);

		assertEquals("C", m.getAtoms().get(0).getElement());
		assertFalse(m.hasCoordinates());
		assertEquals(BondOrder.SINGLE, m.getBonds().get(0).getOrder());
		assertTrue(copy.isRacemic());
		assertEquals("chain", copy.getName());
		assertEquals(4, copy.addAtom("C").getId());
	}

	@Test
	public void mergeRenumbers(){
		Molecule a = chain(2);
		Molecule b = chain(3).setRacemic(true);
		Molecule merged = Molecule.merge("both", Arrays.asList(a, b));
		assertEquals("both", merged.getName());
		assertEquals(5, merged.getAtomCount());
		assertEquals(3, merged.getBondCount());
		assertEquals(2, merged.getConnectedComponents().size());
		assertTrue(merged.getBond(3, 4).isPresent());
		assertTrue(merged.isRacemic());
	}

	@Test
	public void geometry(){
		Molecule m = chain(3);
		assertFalse(m.hasCoordinates());
		m.getAtoms().get(0).setPosition(0, 0);
		m.getAtoms().get(1).setPosition(3, 0);
		m.getAtoms().get(2).setPosition(3, 4);
		assertTrue(m.hasCoordinates());
		assertEquals(3.5, m.getAverageBondLength(), 0.0001);

		Rectangle2D box = m.getBoundingBox().get();
		assertEquals(3, box.getWidth(), 0.0001);
		assertEquals(4, box.getHeight(), 0.0001);

		assertFalse(new Molecule().getBoundingBox().isPresent());
		assertEquals(0, new Molecule().getAverageBondLength(), 0);
	}

	@Test
	public void wedgeGoesToTerminalNeighborWhateverItsId(){
		Molecule m = new Molecule();
		Atom center = m.addAtom("C").setPosition(0, 0).setChirality(Chirality.CLOCKWISE);
		Atom c2 = m.addAtom("C").setPosition(1.2, 0.7);
		Atom c3 = m.addAtom("C").setPosition(2.4, 0);
		Atom n = m.addAtom(new Atom(15, "N")).setPosition(-1.2, 0.7);
		m.addBond(center.getId(), c2.getId(), BondOrder.SINGLE);
		m.addBond(c2.getId(), c3.getId(), BondOrder.SINGLE);
		m.addBond(center.getId(), n.getId(), BondOrder.SINGLE);

		m.assignWedgeHashFromChiralCenters();

		assertEquals(BondStereo.UP, m.getBond(center.getId(), n.getId()).get().getStereo());
		assertEquals(BondStereo.NONE, m.getBond(center.getId(), c2.getId()).get().getStereo());
	}

	@Test
	public void wedgeBetweenTerminalNeighborsGoesToTheLeastCrowdedTip(){
		Molecule m = new Molecule();
		Atom center = m.addAtom("C").setPosition(0, 0).setChirality(Chirality.CLOCKWISE);
		Atom t1 = m.addAtom("O").setPosition(1.4, 0);
		Atom t2 = m.addAtom("N").setPosition(-1.4, 0);
		Atom c4 = m.addAtom("C").setPosition(0, 1.4);
		Atom c5 = m.addAtom("C").setPosition(1.9, 0.9);
		m.addBond(center.getId(), t1.getId(), BondOrder.SINGLE);
		m.addBond(center.getId(), t2.getId(), BondOrder.SINGLE);
		m.addBond(center.getId(), c4.getId(), BondOrder.SINGLE);
		m.addBond(c4.getId(), c5.getId(), BondOrder.SINGLE);

		m.assignWedgeHashFromChiralCenters();

		//c5 crowds the tip of the first bond
		assertEquals(BondStereo.NONE, m.getBond(center.getId(), t1.getId()).get().getStereo());
		assertEquals(BondStereo.UP, m.getBond(center.getId(), t2.getId()).get().getStereo());
		assertEquals(BondStereo.NONE, m.getBond(center.getId(), c4.getId()).get().getStereo());
	}

	@Test
	public void wedgeTieGoesToLowestBondId(){
		Molecule m = new Molecule();
		Atom center = m.addAtom("C").setPosition(0, 0).setChirality(Chirality.ANTICLOCKWISE);
		Atom t1 = m.addAtom("O").setPosition(1.4, 0);
		Atom t2 = m.addAtom("N").setPosition(-1.4, 0);
		m.addBond(t1.getId(), center.getId(), BondOrder.SINGLE);
		m.addBond(center.getId(), t2.getId(), BondOrder.SINGLE);

		m.assignWedgeHashFromChiralCenters();

		//the center is the first bond's second atom
		assertEquals(BondStereo.DOWN_REVERSED, m.getBond(t1.getId(), center.getId()).get().getStereo());
		assertEquals(BondStereo.NONE, m.getBond(center.getId(), t2.getId()).get().getStereo());
	}
}
