package gov.nih.ncats.molgraph;

import java.io.IOException;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

import gov.nih.ncats.molgraph.identifier.MoleculeIdentifierService;
import gov.nih.ncats.molgraph.identifier.MoleculeIdentifiers;
import gov.nih.ncats.molgraph.io.MolfileWriter;
import gov.nih.ncats.molgraph.layout.LayoutOptions;
import gov.nih.ncats.molgraph.layout.StructureDiagramGenerator;
import gov.nih.ncats.molgraph.model.Molecule;
import gov.nih.ncats.molgraph.model.Reaction;
import gov.nih.ncats.molgraph.smiles.SmilesGenerator;
import gov.nih.ncats.molgraph.smiles.SmilesParser;

/**
 * Entry point for the common operations: read SMILES, write SMILES,
 * lay out a structure and compute identifiers.
 */
public final class MolGraph {

	private static final SmilesOptions DEFAULT_OPTIONS = new SmilesOptions();

	private MolGraph(){
		//can not instantiate
	}

	/**
	 * Parse the given SMILES (with an optional CXSMILES layer) using the default options.
	 * @param smiles the SMILES to parse, can not be null.
	 * @return a new laid out {@link Molecule}.
	 * @throws IOException if the SMILES can not be parsed; this will be a {@link ChemException}.
	 * @throws NullPointerException if smiles is null.
	 */
	public static Molecule parse(String smiles) throws IOException{
		return parse(smiles, DEFAULT_OPTIONS);
	}

	/**
	 * Parse the given SMILES (with an optional CXSMILES layer).
	 * @param smiles the SMILES to parse, can not be null.
	 * @param options the {@link SmilesOptions} to use; if options is null, then the default options are used.
	 * @return a new {@link Molecule}.
	 * @throws IOException if the SMILES can not be parsed; this will be a {@link ChemException}.
	 * @throws NullPointerException if smiles is null.
	 *
	 * @since 0.1.0
	 */
	public static Molecule parse(String smiles, SmilesOptions options) throws IOException{
		Objects.requireNonNull(smiles, "smiles can not be null");
		options = Optional.ofNullable(options).orElse(DEFAULT_OPTIONS);
		return new SmilesParser(options).parseSmiles(smiles);
	}

	/**
	 * Parse a reaction SMILES {@code reactants>agents>products}.
	 * @param smiles the reaction SMILES to parse, can not be null.
	 * @param options the {@link SmilesOptions} to use; if options is null, then the default options are used.
	 * @return a new {@link Reaction}.
	 * @throws IOException if the SMILES can not be parsed; this will be a {@link ChemException}.
	 *
	 * @since 0.1.0
	 */
	public static Reaction parseReaction(String smiles, SmilesOptions options) throws IOException{
		Objects.requireNonNull(smiles, "smiles can not be null");
		options = Optional.ofNullable(options).orElse(DEFAULT_OPTIONS);
		return new SmilesParser(options).parseReactionSmiles(smiles);
	}

	public static Reaction parseReaction(String smiles) throws IOException{
		return parseReaction(smiles, DEFAULT_OPTIONS);
	}

	/**
	 * Write the isomeric SMILES of the given molecule.
	 */
	public static String toSmiles(Molecule molecule){
		return toSmiles(molecule, SmiFlavor.isomeric());
	}

	public static String toSmiles(Molecule molecule, EnumSet<SmiFlavor> flavors){
		return new SmilesGenerator(flavors).create(Objects.requireNonNull(molecule));
	}

	/**
	 * Compute new 2D coordinates.
	 * @param molecule the molecule to lay out; it is not modified.
	 * @param options the {@link LayoutOptions} to use; if options is null, then the default options are used.
	 * @return a laid out copy.
	 *
	 * @since 0.1.0
	 */
	public static Molecule layout(Molecule molecule, LayoutOptions options){
		Objects.requireNonNull(molecule);
		options = Optional.ofNullable(options).orElseGet(LayoutOptions::new);
		return new StructureDiagramGenerator(options).generate(molecule);
	}

	public static Molecule layout(Molecule molecule){
		return layout(molecule, null);
	}

	public static String toMolfile(Molecule molecule){
		return new MolfileWriter().toMolfile(Objects.requireNonNull(molecule));
	}

	/**
	 * SMILES, isomeric SMILES, InChI and InChIKey of the molecule.
	 * InChI failures are reported as "Unavailable" and never thrown.
	 *
	 * @since 0.1.0
	 */
	public static MoleculeIdentifiers identifiers(Molecule molecule){
		return new MoleculeIdentifierService().compute(molecule);
	}

	public static CompletableFuture<Molecule> parseAsync(String smiles){
		return parseAsync(smiles, DEFAULT_OPTIONS);
	}

	/**
	 * Parse on the common pool. A parse error completes the future exceptionally
	 * with a {@link CompletionException} wrapping the {@link ChemException}.
	 */
	public static CompletableFuture<Molecule> parseAsync(String smiles, SmilesOptions options){
		return CompletableFuture.supplyAsync(() -> {
			try{
				return parse(smiles, options);
			}catch(IOException e){
				throw new CompletionException(e);
			}
		});
	}

	public static CompletableFuture<Molecule> parseAsync(String smiles, SmilesOptions options, Executor executor){
		return CompletableFuture.supplyAsync(() -> {
			try{
				return parse(smiles, options);
			}catch(IOException e){
				throw new CompletionException(e);
			}
		},executor);
	}

	public static CompletableFuture<Reaction> parseReactionAsync(String smiles, SmilesOptions options){
		return CompletableFuture.supplyAsync(() -> {
			try{
				return parseReaction(smiles, options);
			}catch(IOException e){
				throw new CompletionException(e);
			}
		});
	}

	public static CompletableFuture<MoleculeIdentifiers> identifiersAsync(Molecule molecule){
		return CompletableFuture.supplyAsync(() -> identifiers(molecule));
	}

	public static CompletableFuture<MoleculeIdentifiers> identifiersAsync(Molecule molecule, Executor executor){
		return CompletableFuture.supplyAsync(() -> identifiers(molecule), executor);
	}
}
