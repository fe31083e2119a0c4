package gov.nih.ncats.molgraph.smiles;

import static org.junit.Assert.*;

import java.util.EnumSet;
import java.util.List;
import java.util.stream.Collectors;

import org.junit.Test;

import gov.nih.ncats.molgraph.SmiFlavor;
import gov.nih.ncats.molgraph.model.Atom;
import gov.nih.ncats.molgraph.model.BondOrder;
import gov.nih.ncats.molgraph.model.Chirality;
import gov.nih.ncats.molgraph.model.Molecule;

public class SmilesGeneratorTest {

	private final SmilesParser parser = new SmilesParser();

	private final SmilesGenerator plain = new SmilesGenerator(SmiFlavor.plain());
	private final SmilesGenerator isomeric = new SmilesGenerator(SmiFlavor.isomeric());

	@Test
	public void ethanol() throws Exception{
		assertEquals("CCO", plain.create(parser.parseSmiles("CCO")));
	}

	@Test
	public void branches() throws Exception{
		assertEquals("CC(=O)O", plain.create(parser.parseSmiles("CC(=O)O")));
	}

	@Test
	public void isomericKeepsChirality() throws Exception{
		Molecule m = parser.parseSmiles("C[C@H](N)O");
		String smiles = isomeric.create(m);
		assertEquals("C[C@H](N)O", smiles);

		Molecule reparsed = parser.parseSmiles(smiles);
		assertEquals(m.getAtomCount(), reparsed.getAtomCount());
		assertEquals(m.getBondCount(), reparsed.getBondCount());
	}

	@Test
	public void plainDropsChirality() throws Exception{
		String smiles = plain.create(parser.parseSmiles("C[C@H](N)O"));
		assertFalse(smiles, smiles.contains("@"));
	}

	@Test
	public void ringClosure() throws Exception{
		String smiles = isomeric.create(parser.parseSmiles("c1ccccc1"));
		assertEquals("c1ccccc1", smiles);

		Molecule reparsed = parser.parseSmiles(smiles);
		assertEquals(6, reparsed.getAtomCount());
		assertEquals(6, reparsed.getBondCount());
	}

	@Test
	public void ringNumbersAreReused() throws Exception{
		String smiles = plain.create(parser.parseSmiles("C1CC1C1CC1"));
		assertEquals("C1CC1C1CC1", smiles);
	}

	@Test
	public void disconnectedComponents() throws Exception{
		String smiles = isomeric.create(parser.parseSmiles("[Na+].[OH-]"));
		assertEquals("[Na+].[OH-]", smiles);

		Molecule reparsed = parser.parseSmiles(smiles);
		assertEquals(2, reparsed.getAtomCount());
		assertEquals(0, reparsed.getBondCount());
	}

	@Test
	public void isotopesOnlyWhenIsomeric() throws Exception{
		Molecule m = parser.parseSmiles("[13CH4]");
		assertEquals("[13CH4]", isomeric.create(m));
		assertEquals("[CH4]", plain.create(m));
	}

	@Test
	public void directionalDoubleBond() throws Exception{
		assertEquals("F/C=C/F", isomeric.create(parser.parseSmiles("F/C=C/F")));
		assertEquals("F/C=C\\F", isomeric.create(parser.parseSmiles("F/C=C\\F")));
		assertEquals("FC=CF", plain.create(parser.parseSmiles("F/C=C/F")));
	}

	@Test
	public void singleBondBetweenAromaticAtomsIsExplicit() throws Exception{
		Molecule m = parser.parseSmiles("c1ccccc1-c1ccccc1");
		String smiles = plain.create(m);
		assertTrue(smiles, smiles.contains("-"));
		Molecule reparsed = parser.parseSmiles(smiles);
		assertEquals(1, reparsed.getBonds().stream().filter(b->b.getOrder()==BondOrder.SINGLE).count());
	}

	@Test
	public void aromaticSymbolsOff() throws Exception{
		SmilesGenerator kekule = new SmilesGenerator(EnumSet.of(SmiFlavor.STRICT));
		String smiles = kekule.create(parser.parseSmiles("c1ccccc1"));
		assertEquals("C:1:C:C:C:C:C1", smiles);
	}

	@Test
	public void emptyMolecule(){
		assertEquals("", plain.create(new Molecule()));
	}

	@Test
	public void unusualElementsAreBracketed(){
		Molecule m = new Molecule();
		Atom fe = m.addAtom("Fe");
		Atom c = m.addAtom("C");
		m.addBond(fe.getId(), c.getId(), BondOrder.SINGLE);
		assertEquals("[Fe]C", plain.create(m));
	}

	@Test
	public void ringTokens(){
		assertEquals("1", SmilesGenerator.ringToken(1));
		assertEquals("%10", SmilesGenerator.ringToken(10));
		assertEquals("%99", SmilesGenerator.ringToken(99));
		assertEquals("%(100)", SmilesGenerator.ringToken(100));
	}

	@Test
	public void chargeAndHydrogenTokens(){
		assertEquals("+", SmilesGenerator.chargeToken(1));
		assertEquals("--", SmilesGenerator.chargeToken(-2));
		assertEquals("+4", SmilesGenerator.chargeToken(4));
		assertEquals("H0", SmilesGenerator.hydrogenToken(0));
		assertEquals("H", SmilesGenerator.hydrogenToken(1));
		assertEquals("H3", SmilesGenerator.hydrogenToken(3));
	}

	@Test
	public void atomLabelsAreWrittenAsCxLayer() throws Exception{
		Molecule m = parser.parseSmiles("C* |$;R1$|");
		String smiles = new SmilesGenerator().create(m);
		assertEquals("C* |$;R1$|", smiles);

		Molecule reparsed = parser.parseSmiles(smiles);
		assertEquals("R1", reparsed.getAtoms().get(1).getElement());
	}

	@Test
	public void atomLabelsWithoutCxFlavorAreWildcards() throws Exception{
		Molecule m = parser.parseSmiles("C* |$;R1$|");
		assertEquals("C*", isomeric.create(m));
		assertEquals(2, parser.parseSmiles(isomeric.create(m)).getAtomCount());
	}

	@Test
	public void atomLabelSpecialCharactersAreEscaped() throws Exception{
		Molecule m = parser.parseSmiles("C* |$;x&#59;y$|");
		assertEquals("x;y", m.getAtoms().get(1).getElement());
		String smiles = new SmilesGenerator().create(m);
		assertEquals("C* |$;x&#59;y$|", smiles);
		assertEquals("x;y", parser.parseSmiles(smiles).getAtoms().get(1).getElement());
	}

	@Test
	public void aromaticSeleniumIsBracketed() throws Exception{
		assertEquals("c1ncc[se]1", isomeric.create(parser.parseSmiles("c1ncc[se]1")));
	}

	private static List<String> elements(Molecule m){
		return m.getAtoms().stream().map(Atom::getElement).sorted().collect(Collectors.toList());
	}

	private static List<Chirality> chiralities(Molecule m){
		return m.getAtoms().stream().map(Atom::getChirality).sorted().collect(Collectors.toList());
	}

	@Test
	public void regressionStructuresSurviveRoundTrip() throws Exception{
		SmilesGenerator generator = new SmilesGenerator();
		String[] corpus = {
				"CCO",
				"CC(=O)O",
				"CC(=O)Oc1ccccc1C(=O)O",
				"C[C@H](N)O",
				"C[C@@H](N)O",
				"CC[C@H](O)[C@H](O)CCCCCC",
				"C[C@H]1CC[C@@H](O)CC1",
				"c1ccccc1",
				"c1ccc2ccccc2c1",
				"c1ccc2c(c1)ccc1ccccc12",
				"c1ccccc1-c1ccccc1",
				"C1CC1C1CC1",
				"C1CC2CCC1C2",
				"C1CCC2(CC1)CCCC2",
				"C%10CCCCC%10",
				"[nH]1cccc1",
				"n1cc[nH]c1",
				"c1ccoc1",
				"c1ncsc1",
				"c1ncc[se]1",
				"[Na+].[OH-]",
				"[Fe++]",
				"[P---]",
				"[13CH4]",
				"D.T",
				"[CH3:7]C",
				"F/C=C/F",
				"F/C=C\\F",
				"C#N",
				"O=C(Nc1ccccc1)c1ccccn1",
				"C* |$;R1$|",
				"*C(*)C |$_AP1;;R2$|"
		};
		for(String s : corpus){
			Molecule first = parser.parseSmiles(s);
			String written = generator.create(first);
			Molecule second = parser.parseSmiles(written);

			assertEquals(s + " -> " + written, first.getAtomCount(), second.getAtomCount());
			assertEquals(s + " -> " + written, first.getBondCount(), second.getBondCount());
			assertEquals(s + " -> " + written, elements(first), elements(second));
			assertEquals(s + " -> " + written, chiralities(first), chiralities(second));
		}
	}
}
