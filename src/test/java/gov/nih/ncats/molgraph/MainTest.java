package gov.nih.ncats.molgraph;

import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.List;

import org.junit.Test;

import gov.nih.ncats.molgraph.io.SmilesReader;
import gov.nih.ncats.molgraph.model.Molecule;

public class MainTest {
    private static final String lineSep = System.lineSeparator();

    @Test
    public void smilesFormat() throws Exception{
        List<Molecule> molecules = SmilesReader.read("C[C@H](N)O first\nCCO second");
        assertEquals("C[C@H](N)O first\nCCO second\n", Main.format(molecules, "smiles"));
    }

    @Test
    public void molFormat() throws Exception{
        List<Molecule> molecules = Arrays.asList(MolGraph.parse("CCO"), MolGraph.parse("CC"));
        String out = Main.format(molecules, "mol");
        assertEquals(2, out.split("M  END", -1).length - 1);
        assertFalse(out, out.contains("$$$$"));
    }

    @Test
    public void sdfFormat() throws Exception{
        List<Molecule> molecules = SmilesReader.read("CCO ethanol");
        String out = Main.format(molecules, "sdf");
        assertTrue(out, out.contains(">  <Molecule Name>" + lineSep + "ethanol" + lineSep + lineSep));
        assertTrue(out, out.contains(">  <SMILES>" + lineSep + "CCO" + lineSep + lineSep));
        assertTrue(out, out.endsWith("$$$$" + lineSep));
    }
}
