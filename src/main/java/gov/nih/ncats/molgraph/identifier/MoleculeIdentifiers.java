package gov.nih.ncats.molgraph.identifier;

import java.util.Objects;

/**
 * The usual identifiers of one molecule. The InChI fields hold
 * {@link MoleculeIdentifierService#unavailableText(String)} when InChI could not be computed.
 */
public final class MoleculeIdentifiers{
	private final String smiles;
	private final String isoSmiles;
	private final String inchi;
	private final String inchiKey;

	public MoleculeIdentifiers(String smiles, String isoSmiles, String inchi, String inchiKey){
		this.smiles = Objects.requireNonNull(smiles);
		this.isoSmiles = Objects.requireNonNull(isoSmiles);
		this.inchi = Objects.requireNonNull(inchi);
		this.inchiKey = Objects.requireNonNull(inchiKey);
	}

	public String getSmiles() {
		return smiles;
	}

	public String getIsoSmiles() {
		return isoSmiles;
	}

	public String getInchi() {
		return inchi;
	}

	public String getInchiKey() {
		return inchiKey;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof MoleculeIdentifiers)) return false;
		MoleculeIdentifiers that = (MoleculeIdentifiers) o;
		return smiles.equals(that.smiles) &&
				isoSmiles.equals(that.isoSmiles) &&
				inchi.equals(that.inchi) &&
				inchiKey.equals(that.inchiKey);
	}

	@Override
	public int hashCode() {
		return Objects.hash(smiles, isoSmiles, inchi, inchiKey);
	}

	@Override
	public String toString() {
		return "MoleculeIdentifiers{" +
				"smiles='" + smiles + '\'' +
				", isoSmiles='" + isoSmiles + '\'' +
				", inchi='" + inchi + '\'' +
				", inchiKey='" + inchiKey + '\'' +
				'}';
	}
}
