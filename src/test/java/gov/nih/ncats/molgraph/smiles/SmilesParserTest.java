package gov.nih.ncats.molgraph.smiles;

import static org.junit.Assert.*;

import java.util.List;
import java.util.stream.Collectors;

import org.junit.Test;

import gov.nih.ncats.molgraph.ChemException;
import gov.nih.ncats.molgraph.SmilesOptions;
import gov.nih.ncats.molgraph.model.Atom;
import gov.nih.ncats.molgraph.model.Bond;
import gov.nih.ncats.molgraph.model.BondOrder;
import gov.nih.ncats.molgraph.model.BondStereo;
import gov.nih.ncats.molgraph.model.Chirality;
import gov.nih.ncats.molgraph.model.Molecule;

public class SmilesParserTest {

	private final SmilesParser parser = new SmilesParser();

	private static void assertRejected(SmilesParser parser, String smiles){
		try{
			parser.parseSmiles(smiles);
			fail("should not parse " + smiles);
		}catch(ChemException e){
			assertEquals(smiles, ChemException.Kind.PARSE_FAILED, e.getKind());
		}
	}

	private static BondOrder onlyBondOrder(Molecule m){
		assertEquals(1, m.getBondCount());
		return m.getBonds().get(0).getOrder();
	}

	@Test
	public void bondOrders() throws Exception{
		assertEquals(BondOrder.SINGLE, onlyBondOrder(parser.parseSmiles("C-C")));
		assertEquals(BondOrder.DOUBLE, onlyBondOrder(parser.parseSmiles("C=C")));
		assertEquals(BondOrder.TRIPLE, onlyBondOrder(parser.parseSmiles("C#C")));
		assertEquals(BondOrder.SINGLE, onlyBondOrder(parser.parseSmiles("CC")));
	}

	@Test
	public void upperCaseCoIsCarbonAndAromaticOxygen() throws Exception{
		Molecule m = parser.parseSmiles("Co");
		assertEquals(2, m.getAtomCount());
		assertEquals("C", m.getAtoms().get(0).getElement());
		assertEquals("O", m.getAtoms().get(1).getElement());
		assertTrue(m.getAtoms().get(1).isAromatic());
	}

	@Test
	public void bracketIsotope() throws Exception{
		Molecule m = parser.parseSmiles("[13C]");
		assertEquals(Integer.valueOf(13), m.getAtoms().get(0).getIsotope());
	}

	@Test
	public void bracketChargeAndHydrogens() throws Exception{
		Molecule m = parser.parseSmiles("[OH-]");
		Atom o = m.getAtoms().get(0);
		assertEquals(-1, o.getCharge());
		assertEquals(1, m.implicitHydrogenCount(o.getId()));
	}

	@Test
	public void chargeForms() throws Exception{
		assertEquals(2, parser.parseSmiles("[Fe++]").getAtoms().get(0).getCharge());
		assertEquals(2, parser.parseSmiles("[Fe+2]").getAtoms().get(0).getCharge());
		assertEquals(-3, parser.parseSmiles("[P---]").getAtoms().get(0).getCharge());
	}

	@Test
	public void disconnectedSalt() throws Exception{
		Molecule m = parser.parseSmiles("[Na+].[OH-]");
		assertEquals(2, m.getAtomCount());
		assertEquals(0, m.getBondCount());
		assertEquals(2, m.getConnectedComponents().size());
	}

	@Test
	public void wildcardAtoms() throws Exception{
		assertEquals("*", parser.parseSmiles("*C").getAtoms().get(0).getElement());
		assertEquals("*", parser.parseSmiles("[*]C").getAtoms().get(0).getElement());
	}

	@Test
	public void percentRingClosures() throws Exception{
		Molecule m = parser.parseSmiles("C%10CCCCC%10");
		assertEquals(6, m.getAtomCount());
		assertEquals(6, m.getBondCount());

		m = parser.parseSmiles("C%02CCCCC%02");
		assertEquals(6, m.getAtomCount());
		assertEquals(6, m.getBondCount());

		m = parser.parseSmiles("C%(123)CCCCC%(123)");
		assertEquals(6, m.getBondCount());
	}

	@Test
	public void badPercentRingIndex(){
		assertRejected(parser, "C%1CCCC%1");
		assertRejected(parser, "C%(12CCCC");
	}

	@Test
	public void aromaticSelenium() throws Exception{
		Molecule m = parser.parseSmiles("c1ncc[se]1");
		assertTrue(m.getAtoms().stream().anyMatch(a->a.isElement("Se") && a.isAromatic()));
		assertTrue(m.getBonds().stream().allMatch(b->b.getOrder()==BondOrder.AROMATIC));
	}

	@Test
	public void chiralCenterGetsWedge() throws Exception{
		Molecule m = parser.parseSmiles("C[C@H](N)O");
		Atom center = m.getAtoms().get(1);
		assertEquals(Chirality.ANTICLOCKWISE, center.getChirality());
		assertTrue(m.getBonds().stream().anyMatch(b->b.getStereo().isDirectional()));
	}

	@Test
	public void doubleAtSignIsClockwise() throws Exception{
		Molecule m = parser.parseSmiles("C[C@@H](N)O");
		assertEquals(Chirality.CLOCKWISE, m.getAtoms().get(1).getChirality());
	}

	@Test
	public void directionalBondsMarkDoubleBond() throws Exception{
		Molecule m = parser.parseSmiles("F/C=C/F");
		Bond db = m.getBonds().stream().filter(b->b.getOrder()==BondOrder.DOUBLE).findFirst().get();
		assertEquals(BondStereo.EITHER, db.getStereo());
		assertEquals(BondStereo.UP, m.getBonds().get(0).getStereo());
	}

	@Test
	public void deuteriumAndTritium() throws Exception{
		Molecule m = parser.parseSmiles("D.T");
		List<Integer> isotopes = m.getAtoms().stream().map(Atom::getIsotope).collect(Collectors.toList());
		assertTrue(m.getAtoms().stream().allMatch(a->a.isElement("H")));
		assertEquals(2, isotopes.get(0).intValue());
		assertEquals(3, isotopes.get(1).intValue());
	}

	@Test
	public void ringClosureAcrossDot() throws Exception{
		Molecule m = parser.parseSmiles("C1.O1");
		assertEquals(2, m.getAtomCount());
		assertEquals(1, m.getBondCount());
	}

	@Test
	public void pyrroleNeedsDonor() throws Exception{
		assertRejected(parser, "n1cccc1");
		Molecule m = parser.parseSmiles("[nH]1cccc1");
		assertEquals(5, m.getAtomCount());
		assertEquals(5, m.getBondCount());
	}

	@Test
	public void explicitHydrogenNeighborIsDonor() throws Exception{
		Molecule m = parser.parseSmiles("n1([H])cccc1");
		assertEquals(6, m.getAtomCount());
		assertEquals(1, m.getAtoms().stream().filter(a->a.isElement("H")).count());
	}

	@Test
	public void imidazoleNeedsDonor() throws Exception{
		assertRejected(parser, "n1cncc1");
		assertEquals(5, parser.parseSmiles("n1cc[nH]c1").getAtomCount());
	}

	@Test
	public void substitutedPyrrolesEachNeedDonor() throws Exception{
		assertRejected(parser, "c1cccn1c2cccn2");
		Molecule m = parser.parseSmiles("c1cccn1c2ccc[nH]2");
		assertEquals(10, m.getAtomCount());
	}

	@Test
	public void furanAndThiopheneNeedNoHydrogen() throws Exception{
		assertEquals(5, parser.parseSmiles("c1ccoc1").getAtomCount());
		assertEquals(5, parser.parseSmiles("c1ncsc1").getAtomCount());
	}

	@Test
	public void malformedInput(){
		assertRejected(parser, "C1CC");
		assertRejected(parser, "C)");
		assertRejected(parser, "C(C");
		assertRejected(parser, "(C)");
		assertRejected(parser, "C=");
		assertRejected(parser, "[C");
	}

	@Test
	public void unterminatedRingClosureMessage(){
		try{
			parser.parseSmiles("C1CC");
			fail();
		}catch(ChemException e){
			assertEquals("Unterminated ring closure(s): 1.", e.getDetail());
		}
	}

	@Test
	public void emptyInput(){
		for(String s : new String[]{"", "   "}){
			try{
				parser.parseSmiles(s);
				fail("should not parse '" + s + "'");
			}catch(ChemException e){
				assertEquals(ChemException.Kind.EMPTY_INPUT, e.getKind());
			}
		}
	}

	@Test
	public void strictRejectsOrganicSubsetOutsiders(){
		assertRejected(parser, "CXC");
	}

	@Test
	public void defaultNameAndTitle() throws Exception{
		assertEquals(SmilesParser.DEFAULT_NAME, parser.parseSmiles("CCO").getName());
		assertEquals("ethanol", parser.parseSmiles("CCO |$;;$| ethanol").getName());
	}

	@Test
	public void coordinatesAreGeneratedByDefault() throws Exception{
		Molecule m = parser.parseSmiles("CCO");
		assertTrue(m.hasCoordinates());
		assertEquals(1.4, m.getAverageBondLength(), 0.2);
	}

	@Test
	public void coordinatesCanBeTurnedOff() throws Exception{
		Molecule m = new SmilesParser(new SmilesOptions().generateCoordinates(false)).parseSmiles("CCO");
		assertFalse(m.hasCoordinates());
	}

	@Test
	public void atomClass() throws Exception{
		Atom a = parser.parseSmiles("[CH3:7]C").getAtoms().get(0);
		assertEquals(Integer.valueOf(7), a.getAtomClass());
		assertEquals(Integer.valueOf(7), a.getAtomMapNumber());
		assertEquals(Integer.valueOf(3), a.getExplicitHydrogenCount());
	}
}
