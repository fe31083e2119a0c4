package gov.nih.ncats.molgraph;

import gov.nih.ncats.common.cli.Cli;
import gov.nih.ncats.common.cli.CliSpecification;
import gov.nih.ncats.common.cli.CliValidationException;
import gov.nih.ncats.molgraph.identifier.MoleculeIdentifierService;
import gov.nih.ncats.molgraph.identifier.MoleculeIdentifiers;
import gov.nih.ncats.molgraph.io.MolfileWriter;
import gov.nih.ncats.molgraph.io.SmilesReader;
import gov.nih.ncats.molgraph.io.SmilesWriter;
import gov.nih.ncats.molgraph.model.Molecule;
import gov.nih.ncats.molgraph.smiles.SmilesGenerator;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.LogManager;

import static gov.nih.ncats.common.cli.CliSpecification.*;

/**
 * Command line tool: read SMILES from the command line or a file and write
 * SMILES, molfiles, SD records or identifiers.
 */
public class Main {

    private static final List<String> FORMATS = Arrays.asList("smiles", "mol", "sdf", "ids");

    private static class InputFile{
        private File file;

        public File getFile() {
            return file;
        }

        public void setFile(File file) throws IOException{
            if(!file.exists()){
                throw new FileNotFoundException("file '" + file.getAbsolutePath() + "' does not exist");
            }
            this.file = file;
        }
    }

    public static void main(String[] args) throws Exception{
        configureLogging();

        InputFile inputFile = new InputFile();

        CliSpecification spec = CliSpecification.createWithHelp(
                radio(
                        option("smiles")
                                .argName("text")
                                .description("the SMILES (or CXSMILES) to process. This option or -f is required")
                                .setRequired(true),
                        option("f").longName("file")
                                .argName("path")
                                .description("path to a SMILES file: one structure per line optionally followed by a name. " +
                                        "Lines starting with # or // are skipped. This option or -smiles is required")
                                .setToFile(inputFile::setFile)
                                .setRequired(true)
                ),
                option("reaction").isFlag(true)
                        .addValidation(cli->cli.hasOption("smiles"), "-reaction is only valid with -smiles")
                        .description("read the -smiles value as a reaction SMILES reactants>agents>products; all molecules of the reaction are written"),
                option("format")
                        .argName("smiles|mol|sdf|ids")
                        .description("output format: smiles (default), mol, sdf, or ids (tab separated name, SMILES, isomeric SMILES, InChI, InChIKey)"),
                option("o").longName("out")
                        .argName("path")
                        .description("path of the output file. If not specified output is sent to STDOUT"),
                option("nolayout").isFlag(true)
                        .description("do not compute 2D coordinates")
                )
        .programName("molgraph")
        .description("Reads SMILES, lays out 2D structure diagrams and writes SMILES, molfiles or identifiers.")
        .addValidation(cli->cli.hasOption("smiles") || cli.hasOption("f"),
                "-smiles or -f option is required")
        .example("-smiles CC(=O)Oc1ccccc1C(=O)O", "print the isomeric SMILES of aspirin to STDOUT")
        .example("-smiles CC(=O)Oc1ccccc1C(=O)O -format mol", "print aspirin as a molfile with generated 2D coordinates")
        .example("-f /path/to/file.smi -format sdf -o /path/to/out.sdf", "convert every SMILES line of the file into an sdf file")
        .example("-f /path/to/file.smi -format ids", "print the identifiers of every structure in the file")
        .example("-smiles \"CCO.CC(=O)O>>CCOC(C)=O\" -reaction", "print the molecules of the reaction")
        .footer("Developed by NIH/NCATS")
        ;

        if(spec.helpRequested(args)){
            System.out.println(spec.generateUsage());
            return;
        }
        try {
            Cli cli =spec.parse(args);

            String format = cli.hasOption("format")? cli.getOptionValue("format").trim().toLowerCase() : "smiles";
            if(!FORMATS.contains(format)){
                throw new CliValidationException("unknown format '" + format + "' must be one of " + FORMATS);
            }
            SmilesOptions options = new SmilesOptions()
                                        .generateCoordinates(!cli.hasOption("nolayout"));

            List<Molecule> molecules = new ArrayList<>();
            if(cli.hasOption("smiles")){
                String smiles = cli.getOptionValue("smiles");
                if(cli.hasOption("reaction")){
                    molecules.addAll(MolGraph.parseReaction(smiles, options).getAllMolecules());
                }else{
                    molecules.add(MolGraph.parse(smiles, options));
                }
            }else{
                try(Reader reader = Files.newBufferedReader(inputFile.getFile().toPath(), StandardCharsets.UTF_8)){
                    molecules.addAll(SmilesReader.read(reader, options));
                }
            }

            String output = format(molecules, format);
            if(cli.hasOption("o")){
                File outputFile = new File(cli.getOptionValue("o"));
                File parent = outputFile.getParentFile();
                if(parent !=null){
                    Files.createDirectories(parent.toPath());
                }

                try(PrintWriter writer = new PrintWriter(new FileWriter(outputFile))){
                    writer.print(output);
                }
            }else{
                System.out.print(output);
            }
        }catch(CliValidationException e) {
            System.err.println(e.getMessage());
            System.err.println("\n\n" + spec.generateUsage());
            System.exit(-1);
        }catch(ChemException e){
            System.err.println(e.getMessage());
            System.exit(-1);
        }
    }

    static String format(List<Molecule> molecules, String format) throws ChemException{
        String lineSep = System.lineSeparator();
        switch(format){
            case "mol": {
                MolfileWriter writer = new MolfileWriter();
                StringBuilder sb = new StringBuilder();
                for(Molecule m : molecules){
                    sb.append(writer.toMolfile(m)).append(lineSep);
                }
                return sb.toString();
            }
            case "sdf": {
                MolfileWriter writer = new MolfileWriter();
                SmilesGenerator generator = new SmilesGenerator(SmiFlavor.isomeric());
                StringBuilder sb = new StringBuilder();
                for(Molecule m : molecules){
                    Map<String, String> props = new LinkedHashMap<>();
                    props.put("Molecule Name", m.getName());
                    props.put("SMILES", generator.create(m));
                    sb.append(writer.toSdRecord(m, props)).append(lineSep);
                }
                return sb.toString();
            }
            case "ids": {
                MoleculeIdentifierService service = new MoleculeIdentifierService();
                StringBuilder sb = new StringBuilder();
                for(Molecule m : molecules){
                    MoleculeIdentifiers ids = service.compute(m);
                    sb.append(m.getName()).append('\t')
                      .append(ids.getSmiles()).append('\t')
                      .append(ids.getIsoSmiles()).append('\t')
                      .append(ids.getInchi()).append('\t')
                      .append(ids.getInchiKey()).append(lineSep);
                }
                return sb.toString();
            }
            default:
                return SmilesWriter.write(molecules, SmiFlavor.isomeric());
        }
    }

    private static void configureLogging() throws IOException{
        try(InputStream in = Main.class.getResourceAsStream("/logging.properties")){
            if(in !=null){
                LogManager.getLogManager().readConfiguration(in);
            }
        }
    }
}
