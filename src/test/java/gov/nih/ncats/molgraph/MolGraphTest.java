package gov.nih.ncats.molgraph;

import static org.junit.Assert.*;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.junit.Test;

import gov.nih.ncats.molgraph.layout.LayoutOptions;
import gov.nih.ncats.molgraph.model.Molecule;
import gov.nih.ncats.molgraph.model.Reaction;

public class MolGraphTest {
    private static final String lineSep = System.lineSeparator();

    @Test
    public void parseAndWrite() throws Exception{
        Molecule m = MolGraph.parse("CC(=O)Oc1ccccc1C(=O)O");
        assertEquals(13, m.getAtomCount());
        assertTrue(m.hasCoordinates());
        assertEquals("CC(=O)Oc1ccccc1C(=O)O", MolGraph.toSmiles(m));
    }

    @Test
    public void nullOptionsMeansDefaults() throws Exception{
        Molecule m = MolGraph.parse("CCO", null);
        assertTrue(m.hasCoordinates());
    }

    @Test
    public void parseErrorIsChemException(){
        try{
            MolGraph.parse("C1CC");
            fail();
        }catch(ChemException e){
            assertEquals(ChemException.Kind.PARSE_FAILED, e.getKind());
        }catch(Exception e){
            fail("expected ChemException but was " + e);
        }
    }

    @Test(expected = NullPointerException.class)
    public void nullSmiles() throws Exception{
        MolGraph.parse(null);
    }

    @Test
    public void reaction() throws Exception{
        Reaction r = MolGraph.parseReaction("CCO.CC(=O)O>>CCOC(C)=O.O");
        assertEquals(2, r.getReactantCount());
        assertEquals(2, r.getProductCount());
        assertEquals(4, r.getAllMolecules().size());
    }

    @Test
    public void layoutReturnsCopy() throws Exception{
        Molecule flat = MolGraph.parse("CCCC", new SmilesOptions().generateCoordinates(false));
        Molecule laidOut = MolGraph.layout(flat, new LayoutOptions().bondLength(1));
        assertFalse(flat.hasCoordinates());
        assertEquals(1, laidOut.getAverageBondLength(), 0.15);
    }

    @Test
    public void molfile() throws Exception{
        String mol = MolGraph.toMolfile(MolGraph.parse("[NH4+]"));
        assertTrue(mol, mol.contains("  1  0  0  0  0  0  0  0  0  0999 V2000"));
        assertTrue(mol, mol.contains("M  CHG  1   1   1" + lineSep));
    }

    @Test
    public void asyncParse() throws Exception{
        assertEquals(3, MolGraph.parseAsync("CCO").get().getAtomCount());

        ExecutorService executor = Executors.newSingleThreadExecutor();
        try{
            Molecule m = MolGraph.parseAsync("c1ccccc1", null, executor).get();
            assertEquals(6, m.getAtomCount());
        }finally{
            executor.shutdownNow();
        }
    }

    @Test
    public void asyncParseFailure() throws Exception{
        try{
            MolGraph.parseAsync("C)").get();
            fail();
        }catch(ExecutionException e){
            assertTrue(String.valueOf(e.getCause()), e.getCause() instanceof ChemException);
        }
        try{
            MolGraph.parseAsync("C)").join();
            fail();
        }catch(CompletionException e){
            assertTrue(String.valueOf(e.getCause()), e.getCause() instanceof ChemException);
        }
    }

    @Test
    public void asyncReaction() throws Exception{
        assertEquals(1, MolGraph.parseReactionAsync(">C>", null).get().getAgentCount());
    }
}
