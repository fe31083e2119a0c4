package gov.nih.ncats.molgraph.layout;

import static org.junit.Assert.*;

import java.awt.geom.Point2D;
import java.awt.geom.Rectangle2D;
import java.util.List;

import org.junit.Test;

import gov.nih.ncats.molgraph.SmilesOptions;
import gov.nih.ncats.molgraph.internal.util.GeomUtil;
import gov.nih.ncats.molgraph.model.Atom;
import gov.nih.ncats.molgraph.model.Bond;
import gov.nih.ncats.molgraph.model.Molecule;
import gov.nih.ncats.molgraph.smiles.SmilesParser;

public class StructureDiagramGeneratorTest {

	private final SmilesParser parser = new SmilesParser();
	private final SmilesParser noLayout = new SmilesParser(new SmilesOptions().generateCoordinates(false));

	private static double minNonBondedDistance(Molecule m){
		List<Atom> atoms = m.getAtoms();
		double min = Double.MAX_VALUE;
		for(int i=0;i<atoms.size();i++){
			for(int j=i+1;j<atoms.size();j++){
				Atom a = atoms.get(i);
				Atom b = atoms.get(j);
				if(m.getBond(a.getId(), b.getId()).isPresent()){
					continue;
				}
				min = Math.min(min, a.getPosition().distance(b.getPosition()));
			}
		}
		return min;
	}

	@Test
	public void aspirinEsterOxygenIsBent() throws Exception{
		Molecule m = parser.parseSmiles("CC(=O)OC1=CC=CC=C1C(=O)O");

		Atom oxygen = m.getAtoms().stream()
				.filter(a->a.isElement("O"))
				.filter(a->m.neighbors(a.getId()).size()==2)
				.filter(a->m.neighbors(a.getId()).stream().allMatch(n->m.getAtom(n).isElement("C")))
				.findFirst()
				.get();
		List<Integer> neighbors = m.neighbors(oxygen.getId());

		double angle = Math.toDegrees(GeomUtil.angle(
				m.getAtom(neighbors.get(0)).getPosition(),
				oxygen.getPosition(),
				m.getAtom(neighbors.get(1)).getPosition()));
		assertTrue("angle was " + angle, angle > 95);
		assertTrue("angle was " + angle, angle < 170);
	}

	@Test
	public void naphthaleneHasNoSevereOverlap() throws Exception{
		Molecule m = parser.parseSmiles("c1cccc2ccccc12");
		assertTrue(minNonBondedDistance(m) > 0.45);
	}

	@Test
	public void norbornaneHasArea() throws Exception{
		Rectangle2D box = parser.parseSmiles("C1CC2CCC1C2").getBoundingBox().get();
		assertTrue(box.getWidth() > 1);
		assertTrue(box.getHeight() > 1);
	}

	@Test
	public void benzeneIsRegular() throws Exception{
		Molecule m = parser.parseSmiles("c1ccccc1");
		for(Bond b : m.getBonds()){
			double d = m.getAtom(b.getA1()).getPosition().distance(m.getAtom(b.getA2()).getPosition());
			assertEquals(1.4, d, 0.05);
		}
	}

	@Test
	public void ringsHangingOffOneAtomKeepTheBondLength() throws Exception{
		String[] smiles = {
				"c1ccc(cc1)-c1ccccc1",
				"c1ccccc1Cc1ccccc1",
				"O=C(c1ccccc1)c1ccccc1",
				"c1ccc(cc1)-c1ccc(cc1)-c1ccccc1",
				"O=C(Nc1ccccc1)c1ccccn1",
				"C1CCCCC1C1CCCCC1"
		};
		for(String s : smiles){
			Molecule m = parser.parseSmiles(s);
			for(Bond b : m.getBonds()){
				double d = m.getAtom(b.getA1()).getPosition().distance(m.getAtom(b.getA2()).getPosition());
				assertEquals(s + " bond " + b.getA1() + "-" + b.getA2(), 1.4, d, 0.14);
			}
			assertTrue(s, minNonBondedDistance(m) > 0.45);
		}
	}

	@Test
	public void substitutedRingAtomsDoNotCollide() throws Exception{
		Molecule m = parser.parseSmiles("CC(C)(C)c1ccc(cc1)C(=O)NCC1CCCCC1");
		assertTrue(m.hasCoordinates());
		assertTrue(minNonBondedDistance(m) > 0.3);
	}

	@Test
	public void spiroAndBridgedSystemsAreLaidOut() throws Exception{
		for(String smiles : new String[]{"C1CCC2(CC1)CCCC2", "C1CC2CCC1CC2", "c1ccc2c(c1)ccc1ccccc12"}){
			Molecule m = parser.parseSmiles(smiles);
			for(Atom a : m.getAtoms()){
				assertFalse(smiles, Double.isNaN(a.getPosition().getX()));
				assertFalse(smiles, Double.isNaN(a.getPosition().getY()));
			}
			assertTrue(smiles, minNonBondedDistance(m) > 0.3);
		}
	}

	@Test
	public void componentsAreSideBySide() throws Exception{
		Molecule m = parser.parseSmiles("CCO.[Na+]");
		Atom sodium = m.getAtoms().get(3);
		double maxX = m.getAtoms().subList(0, 3).stream()
				.mapToDouble(a->a.getPosition().getX())
				.max()
				.getAsDouble();
		assertTrue(sodium.getPosition().getX() > maxX + 1);
	}

	@Test
	public void inputIsNotModified() throws Exception{
		Molecule input = noLayout.parseSmiles("CCCC");
		Molecule out = new StructureDiagramGenerator().generate(input);

		assertFalse(input.hasCoordinates());
		assertTrue(out.hasCoordinates());
		assertNotSame(input, out);
		for(int i=0;i<input.getAtomCount();i++){
			assertEquals(input.getAtoms().get(i).getId(), out.getAtoms().get(i).getId());
		}
		assertEquals(input.getBondCount(), out.getBondCount());
	}

	@Test
	public void singleAtomStaysAtOrigin() throws Exception{
		Molecule out = new StructureDiagramGenerator().generate(noLayout.parseSmiles("C"));
		assertEquals(new Point2D.Double(0, 0), out.getAtoms().get(0).getPosition());
	}

	@Test
	public void bondLengthOption() throws Exception{
		Molecule input = noLayout.parseSmiles("c1ccccc1");
		Molecule out = new StructureDiagramGenerator(new LayoutOptions().bondLength(2)).generate(input);
		assertEquals(2, out.getAverageBondLength(), 0.1);
	}

	@Test
	public void layoutIsDeterministic() throws Exception{
		Molecule input = noLayout.parseSmiles("CC(=O)Oc1ccccc1C(=O)O");
		Molecule first = new StructureDiagramGenerator().generate(input);
		Molecule second = new StructureDiagramGenerator().generate(input);
		for(int i=0;i<first.getAtomCount();i++){
			assertEquals(first.getAtoms().get(i).getPosition(), second.getAtoms().get(i).getPosition());
		}
	}

	@Test(expected = IllegalArgumentException.class)
	public void bondLengthMustBePositive(){
		new LayoutOptions().bondLength(0);
	}

	@Test(expected = IllegalArgumentException.class)
	public void ringSizeMustBeAtLeastThree(){
		new LayoutOptions().maxRingSize(2);
	}
}
