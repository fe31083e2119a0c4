package gov.nih.ncats.molgraph.model;

public enum BondOrder {
	SINGLE(1.0, 1),
	DOUBLE(2.0, 2),
	TRIPLE(3.0, 3),
	AROMATIC(1.5, 4);

	private final double valenceContribution;
	private final int molfileCode;

	BondOrder(double valenceContribution, int molfileCode){
		this.valenceContribution = valenceContribution;
		this.molfileCode = molfileCode;
	}

	/**
	 * Contribution used for simple valence / implicit hydrogen estimation.
	 */
	public double getValenceContribution() {
		return valenceContribution;
	}

	public int getMolfileCode() {
		return molfileCode;
	}

	public boolean isPiLike(){
		return this != SINGLE;
	}
}
