package gov.nih.ncats.molgraph.io;

import java.awt.geom.AffineTransform;
import java.awt.geom.Point2D;
import java.awt.geom.Rectangle2D;
import java.text.NumberFormat;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import gov.nih.ncats.molgraph.model.Atom;
import gov.nih.ncats.molgraph.model.Bond;
import gov.nih.ncats.molgraph.model.BondOrder;
import gov.nih.ncats.molgraph.model.BondStereo;
import gov.nih.ncats.molgraph.model.Chirality;
import gov.nih.ncats.molgraph.model.Molecule;

/**
 * Writes MDL V2000 molfiles and SD records.
 * Coordinates are scaled so the average bond length matches {@link #averageBondLength(double)}
 * and, by default, centered on the origin. The y axis is flipped like a screen y axis.
 */
public class MolfileWriter {

    private static final int MAX_PROPERTY_ENTRIES_PER_LINE = 8;

    private double averageBondLength = 1D;
    private boolean center = true;

    public MolfileWriter averageBondLength(double averageBondLength){
        if(averageBondLength <=0){
            throw new IllegalArgumentException("avg bond length must be > 0");
        }
        this.averageBondLength = averageBondLength;
        return this;
    }

    public MolfileWriter center(boolean center){
        this.center = center;
        return this;
    }

    public double getAverageBondLength() {
        return averageBondLength;
    }

    public boolean isCenter() {
        return center;
    }

    /**
     * Write the given molecule as a V2000 molfile ending with {@code M  END}.
     */
    public String toMolfile(Molecule molecule){
        Objects.requireNonNull(molecule);
        AffineTransform at = new AffineTransform();
        double blcur = molecule.getAverageBondLength();
        if(blcur <= 0.0001){
            blcur = 1;
        }
        double scale = averageBondLength/blcur;
        at.scale(scale, scale);
        if(center){
            Optional<Rectangle2D> rect = molecule.getBoundingBox();
            rect.ifPresent(r-> at.translate(-r.getCenterX(), -r.getCenterY()));
        }

        String newLine = System.lineSeparator();
        StringBuilder headerBuilder = new StringBuilder(80);
        if(molecule.getName() !=null){
            headerBuilder.append(molecule.getName().replace('\r', ' ').replace('\n', ' '));
        }
        String header = headerBuilder
                .append(newLine)
                .append("  MolGraph")
                //date/time (M/D/Y,H:m)
                .append(MOL_DATETIME_FORMATTER.format(LocalDateTime.now()))
                .append("2D")
                .append(newLine).append(newLine)
                .toString();

        String countsLine = new StringBuilder(80)
                .append(writeMolInt(molecule.getAtomCount(), 3))
                .append(writeMolInt(molecule.getBondCount(), 3))
                .append("  0  0")
                .append(writeMolInt(hasChiralCenter(molecule)? 1: 0, 3))
                .append("  0  0  0  0  0999 V2000")
                .append(newLine)
                .toString();

        return new StringBuilder()
                .append(header)
                .append(countsLine)
                .append(makeAtomBlock(molecule, at, newLine))
                .append(makeBondBlock(molecule, newLine))
                .append(makePropertyBlock(molecule, newLine))
                .append("M  END")
                .toString();
    }

    /**
     * Write an SD record: the molfile, each property as a data item, then {@code $$$$}.
     * @param properties data items in iteration order; may be null.
     */
    public String toSdRecord(Molecule molecule, Map<String,String> properties){
        String lineSep = System.lineSeparator();
        String mol = toMolfile(molecule);
        StringBuilder sdBuilder = new StringBuilder(mol.length() + 200);
        sdBuilder.append(mol).append(lineSep);
        if(properties !=null){
            for(Map.Entry<String, String> entry: properties.entrySet()){
                sdBuilder.append(">  <").append(entry.getKey()).append('>').append(lineSep)
                        .append(entry.getValue()==null? "": entry.getValue()).append(lineSep).append(lineSep);
            }
        }
        return sdBuilder.append("$$$$").toString();
    }

    private static boolean hasChiralCenter(Molecule molecule){
        return molecule.getAtoms().stream().anyMatch(a-> a.getChirality() !=Chirality.NONE);
    }

    private static boolean isStereoCenter(Molecule molecule, int atomId){
        return molecule.getAtom(atomId).getChirality() !=Chirality.NONE;
    }

    private StringBuilder makeAtomBlock(Molecule molecule, AffineTransform at, String newLine){
        StringBuilder atomBlockBuilder = new StringBuilder(82* molecule.getAtomCount());
        for(Atom a : molecule.getAtoms()){
            Point2D np = at.transform(a.getPosition(), null);

            atomBlockBuilder.append(writeMolDouble(np.getX(), 10))
                    .append(writeMolDouble(-np.getY(), 10))
                    .append(writeMolDouble(Double.NaN, 10))	//only write 2d coords
                    .append(' ')
                    .append(leftPaddWithSpaces(molSymbol(a), 3))
                    //isotopes go in M  ISO
                    .append(writeMolInt(0, 2))
                    .append(writeMolInt(computeMolCharge(a.getCharge()), 3))
                    .append("  0  0  0  0  0  0  0  0  0  0")
                    .append(newLine);
        }
        return atomBlockBuilder;
    }

    private static String molSymbol(Atom a){
        String sym = a.getElement().trim();
        if(sym.isEmpty() || "*".equals(sym) || sym.length()>3){
            return "A";
        }
        return sym;
    }

    private StringBuilder makeBondBlock(Molecule molecule, String newLine){
        StringBuilder bondBuilder = new StringBuilder(molecule.getBondCount() *13);
        for(Bond b : molecule.getBonds()){
            int first = molecule.indexOf(b.getA1())+1;
            int second = molecule.indexOf(b.getA2())+1;
            int bondStereo=0;
            BondStereo stereo = b.getStereo();
            if(stereo.isDirectional() && !isStereoCenter(molecule, stereo.isReversed()? b.getA2(): b.getA1())){
                //a '/' or '\' from SMILES describes the double bond geometry, not a wedge
                stereo = BondStereo.NONE;
            }
            if(b.getOrder()==BondOrder.SINGLE){
                if(stereo==BondStereo.UP || stereo==BondStereo.UP_REVERSED){
                    bondStereo =1; // up
                }else if(stereo==BondStereo.DOWN || stereo==BondStereo.DOWN_REVERSED){
                    bondStereo=6; //down
                }else if(stereo==BondStereo.EITHER){
                    bondStereo=4;
                }
                if(stereo.isReversed()){
                    //the narrow end is always the first atom in a molfile
                    int tmp = first;
                    first = second;
                    second = tmp;
                }
            }

            bondBuilder.append(writeMolInt(first, 3))
                    .append(writeMolInt(second, 3))
                    .append(writeMolInt(b.getOrder().getMolfileCode(), 3))
                    .append(writeMolInt(bondStereo, 3))
                    .append(newLine);
        }
        return bondBuilder;
    }

    private StringBuilder makePropertyBlock(Molecule molecule, String newLine){
        List<int[]> charges = new ArrayList<>();
        List<int[]> isotopes = new ArrayList<>();
        List<Atom> atoms = molecule.getAtoms();
        for(int i=0;i<atoms.size();i++){
            Atom a = atoms.get(i);
            if(a.getCharge()!=0){
                charges.add(new int[]{i+1, a.getCharge()});
            }
            if(a.getIsotope()!=null){
                isotopes.add(new int[]{i+1, a.getIsotope()});
            }
        }
        StringBuilder sb = new StringBuilder();
        appendPropertyLines(sb, "M  CHG", charges, newLine);
        appendPropertyLines(sb, "M  ISO", isotopes, newLine);
        return sb;
    }

    private static void appendPropertyLines(StringBuilder sb, String prefix, List<int[]> entries, String newLine){
        for(int start=0; start<entries.size(); start+=MAX_PROPERTY_ENTRIES_PER_LINE){
            List<int[]> chunk = entries.subList(start, Math.min(entries.size(), start+MAX_PROPERTY_ENTRIES_PER_LINE));
            sb.append(prefix).append(writeMolInt(chunk.size(), 3));
            for(int[] e : chunk){
                sb.append(' ').append(writeMolInt(e[0], 3))
                  .append(' ').append(writeMolInt(e[1], 3));
            }
            sb.append(newLine);
        }
    }

    static int computeMolCharge(int charge){
        switch(charge){
            case -3: return 7;
            case -2: return 6;
            case -1: return 5;
            case 0: return 0;
            case 1: return 3;
            case 2: return 2;
            case 3: return 1;
            default: return 0;
        }
    }

    private static String writeMolInt(int value, int numDigits){
        String s = Integer.toString(value);
        if(s.length()>numDigits){
            s="0";
        }
        return rightPaddWithSpaces(s, numDigits);
    }

    private static String writeMolDouble(double d, int width) {
        String value;
        if (Double.isNaN(d) || Double.isInfinite(d)){
            value = "0.0000";
        }else{
            value = MOL_FLOAT_FORMAT.get().format(d);
        }
        return rightPaddWithSpaces(value, width);
    }

    private static String rightPaddWithSpaces(String value, int numDigits) {
        int padd = numDigits - value.length();
        StringBuilder builder = new StringBuilder(numDigits);
        for(int i=0; i< padd; i++){
            builder.append(' ');
        }
        builder.append(value);
        return builder.toString();
    }

    private static String leftPaddWithSpaces(String value, int numDigits) {
        return value + String.join("", Collections.nCopies(Math.max(0, numDigits - value.length()), " "));
    }

    private static final DateTimeFormatter MOL_DATETIME_FORMATTER = DateTimeFormatter.ofPattern("MMddyyHHmm");

    private static final ThreadLocal<NumberFormat> MOL_FLOAT_FORMAT = ThreadLocal.withInitial(()->{
        NumberFormat nf = NumberFormat.getNumberInstance(Locale.ENGLISH);
        nf.setMinimumIntegerDigits(1);
        nf.setMaximumIntegerDigits(4);
        nf.setMinimumFractionDigits(4);
        nf.setMaximumFractionDigits(4);
        nf.setGroupingUsed(false);

        return nf;
    });
}
