package gov.nih.ncats.molgraph.model;

import java.awt.geom.Point2D;
import java.util.Objects;

/**
 * A single atom of a {@link Molecule}. The id is fixed at creation,
 * everything else may be edited by later passes (labels, layout).
 */
public class Atom{
	private final int id;
	private String element;
	private Point2D position = new Point2D.Double();
	private int charge=0;
	private Integer isotope;
	private boolean aromatic=false;
	private Chirality chirality = Chirality.NONE;
	//null means "infer from valence", 0 is an explicit H0
	private Integer explicitHydrogenCount;

	//bracket query decorators
	private Integer substitutionCount;
	private Integer unsaturation;
	private Integer ringBondCount;
	private Integer atomClass;
	private Integer atomMapNumber;

	public Atom(int id, String element){
		this.id = id;
		this.element = Objects.requireNonNull(element, "element can not be null");
	}

	/**
	 * Copy every field, including the position, into a new independent Atom.
	 * @return
	 */
	public Atom copy(){
		return copyWithId(id);
	}

	Atom copyWithId(int newId){
		Atom a = new Atom(newId, element);
		a.position = new Point2D.Double(position.getX(), position.getY());
		a.charge = charge;
		a.isotope = isotope;
		a.aromatic = aromatic;
		a.chirality = chirality;
		a.explicitHydrogenCount = explicitHydrogenCount;
		a.substitutionCount = substitutionCount;
		a.unsaturation = unsaturation;
		a.ringBondCount = ringBondCount;
		a.atomClass = atomClass;
		a.atomMapNumber = atomMapNumber;
		return a;
	}

	public int getId() {
		return id;
	}

	public String getElement() {
		return element;
	}

	public Atom setElement(String element) {
		this.element = Objects.requireNonNull(element, "element can not be null");
		return this;
	}

	public Point2D getPosition() {
		return position;
	}

	public Atom setPosition(Point2D position) {
		this.position = new Point2D.Double(position.getX(), position.getY());
		return this;
	}

	public Atom setPosition(double x, double y) {
		this.position = new Point2D.Double(x, y);
		return this;
	}

	public int getCharge() {
		return charge;
	}

	public Atom setCharge(int charge) {
		this.charge = charge;
		return this;
	}

	public Integer getIsotope() {
		return isotope;
	}

	public Atom setIsotope(Integer isotope) {
		this.isotope = isotope;
		return this;
	}

	public boolean isAromatic() {
		return aromatic;
	}

	public Atom setAromatic(boolean aromatic) {
		this.aromatic = aromatic;
		return this;
	}

	public Chirality getChirality() {
		return chirality;
	}

	public Atom setChirality(Chirality chirality) {
		this.chirality = Objects.requireNonNull(chirality);
		return this;
	}

	public Integer getExplicitHydrogenCount() {
		return explicitHydrogenCount;
	}

	public Atom setExplicitHydrogenCount(Integer explicitHydrogenCount) {
		this.explicitHydrogenCount = explicitHydrogenCount;
		return this;
	}

	public Integer getSubstitutionCount() {
		return substitutionCount;
	}

	public Atom setSubstitutionCount(Integer substitutionCount) {
		this.substitutionCount = substitutionCount;
		return this;
	}

	public Integer getUnsaturation() {
		return unsaturation;
	}

	public Atom setUnsaturation(Integer unsaturation) {
		this.unsaturation = unsaturation;
		return this;
	}

	public Integer getRingBondCount() {
		return ringBondCount;
	}

	public Atom setRingBondCount(Integer ringBondCount) {
		this.ringBondCount = ringBondCount;
		return this;
	}

	public Integer getAtomClass() {
		return atomClass;
	}

	public Atom setAtomClass(Integer atomClass) {
		this.atomClass = atomClass;
		return this;
	}

	public Integer getAtomMapNumber() {
		return atomMapNumber;
	}

	public Atom setAtomMapNumber(Integer atomMapNumber) {
		this.atomMapNumber = atomMapNumber;
		return this;
	}

	public boolean isElement(String symbol){
		return element.equalsIgnoreCase(symbol);
	}

	public String symbolToDraw(){
		if(isotope!=null){
			return isotope + element;
		}
		return element;
	}

	@Override
	public String toString() {
		return "Atom{" + id + " " + symbolToDraw() + (aromatic?" ar":"") + (charge!=0? " " + charge:"") + "}";
	}
}
