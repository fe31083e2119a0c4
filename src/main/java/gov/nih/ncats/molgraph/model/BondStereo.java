package gov.nih.ncats.molgraph.model;

/**
 * Stereo marker on a bond. The reversed variants put the narrow end
 * of the wedge at the bond's second atom.
 */
public enum BondStereo {
	NONE,
	UP,
	DOWN,
	EITHER,
	UP_REVERSED,
	DOWN_REVERSED;

	public static BondStereo fromMolfile(int code){
		switch(code){
			case 1: return UP;
			case 4: return EITHER;
			case 6: return DOWN;
			default: return NONE;
		}
	}

	public boolean isDirectional(){
		return this==UP || this==DOWN || this==UP_REVERSED || this==DOWN_REVERSED;
	}

	public boolean isReversed(){
		return this==UP_REVERSED || this==DOWN_REVERSED;
	}
}
