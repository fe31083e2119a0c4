package gov.nih.ncats.molgraph.model;

import java.util.Objects;

/**
 * A bond between two atom ids. The pair is undirected for chemistry
 * but the order of a1/a2 decides which end a directional or wedge marker starts from.
 */
public class Bond{
	private final int id;
	private final int a1;
	private final int a2;
	private BondOrder order;
	private BondStereo stereo = BondStereo.NONE;

	public Bond(int id, int a1, int a2, BondOrder order){
		this(id,a1,a2,order,BondStereo.NONE);
	}

	public Bond(int id, int a1, int a2, BondOrder order, BondStereo stereo){
		this.id = id;
		this.a1 = a1;
		this.a2 = a2;
		this.order = Objects.requireNonNull(order);
		this.stereo = Objects.requireNonNull(stereo);
	}

	public Bond copy(){
		return new Bond(id,a1,a2,order,stereo);
	}

	public int getId() {
		return id;
	}

	public int getA1() {
		return a1;
	}

	public int getA2() {
		return a2;
	}

	public BondOrder getOrder() {
		return order;
	}

	public Bond setOrder(BondOrder order) {
		this.order = Objects.requireNonNull(order);
		return this;
	}

	public BondStereo getStereo() {
		return stereo;
	}

	public Bond setStereo(BondStereo stereo) {
		this.stereo = Objects.requireNonNull(stereo);
		return this;
	}

	public boolean contains(int atomId){
		return a1==atomId || a2==atomId;
	}

	public int getOther(int atomId){
		if(a1==atomId)return a2;
		if(a2==atomId)return a1;
		throw new IllegalArgumentException("atom " + atomId + " is not part of bond " + id);
	}

	public boolean connects(int u, int v){
		return (a1==u && a2==v) || (a1==v && a2==u);
	}

	@Override
	public String toString() {
		return "Bond{" + id + " " + a1 + "-" + a2 + " " + order + (stereo!=BondStereo.NONE?" " + stereo:"") + "}";
	}
}
