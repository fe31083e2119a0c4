package gov.nih.ncats.molgraph.layout;

/**
 * Tuning values for {@link StructureDiagramGenerator}.
 * Distances are in multiples of the bond length unless said otherwise.
 */
public class LayoutOptions {

    private double bondLength = 1.4;
    private int maxRingSize = 12;

    //ring placement scoring
    private double anchorDriftPenalty = 260;
    private double hardOverlapDistance = 0.76;
    private double hardOverlapPenalty = 300;
    private double softOverlapDistance = 1.12;
    private double softOverlapPenalty = 70;
    private double intraRingDistance = 0.86;
    private double intraRingPenalty = 115;
    private double edgeCrossingPenalty = 280;
    private double edgeNearDistance = 0.42;
    private double edgeNearPenalty = 34;

    //relaxation
    private int relaxIterations = 150;
    private double bondSpring = 0.40;
    private double nonBondedMinimum = 1.14;
    private double nonBondedPush = 0.28;
    private double crossingPush = 0.15;

    //chains and fans
    private double chainAngleDegrees = 120;
    private double branchFanSpread = Math.PI/2.2;
    private double branchOpenSpread = Math.PI;
    private int chainPassLimit = 32;
    private double bondFlipGain = 0.97;

    public LayoutOptions copy(){
        LayoutOptions o = new LayoutOptions();
        o.bondLength = bondLength;
        o.maxRingSize = maxRingSize;
        o.anchorDriftPenalty = anchorDriftPenalty;
        o.hardOverlapDistance = hardOverlapDistance;
        o.hardOverlapPenalty = hardOverlapPenalty;
        o.softOverlapDistance = softOverlapDistance;
        o.softOverlapPenalty = softOverlapPenalty;
        o.intraRingDistance = intraRingDistance;
        o.intraRingPenalty = intraRingPenalty;
        o.edgeCrossingPenalty = edgeCrossingPenalty;
        o.edgeNearDistance = edgeNearDistance;
        o.edgeNearPenalty = edgeNearPenalty;
        o.relaxIterations = relaxIterations;
        o.bondSpring = bondSpring;
        o.nonBondedMinimum = nonBondedMinimum;
        o.nonBondedPush = nonBondedPush;
        o.crossingPush = crossingPush;
        o.chainAngleDegrees = chainAngleDegrees;
        o.branchFanSpread = branchFanSpread;
        o.branchOpenSpread = branchOpenSpread;
        o.chainPassLimit = chainPassLimit;
        o.bondFlipGain = bondFlipGain;
        return o;
    }

    private static double positive(double v, String name){
        if(!(v > 0)){
            throw new IllegalArgumentException(name + " must be > 0");
        }
        return v;
    }

    private static double nonNegative(double v, String name){
        if(!(v >= 0)){
            throw new IllegalArgumentException(name + " must be >= 0");
        }
        return v;
    }

    public double getBondLength() {
        return bondLength;
    }

    public LayoutOptions bondLength(double bondLength){
        this.bondLength = positive(bondLength, "bond length");
        return this;
    }

    public int getMaxRingSize() {
        return maxRingSize;
    }

    public LayoutOptions maxRingSize(int maxRingSize){
        if(maxRingSize <3){
            throw new IllegalArgumentException("max ring size must be >= 3");
        }
        this.maxRingSize = maxRingSize;
        return this;
    }

    public double getAnchorDriftPenalty() {
        return anchorDriftPenalty;
    }

    public LayoutOptions anchorDriftPenalty(double v){
        this.anchorDriftPenalty = nonNegative(v, "anchor drift penalty");
        return this;
    }

    public double getHardOverlapDistance() {
        return hardOverlapDistance;
    }

    public double getHardOverlapPenalty() {
        return hardOverlapPenalty;
    }

    public LayoutOptions hardOverlap(double distance, double penalty){
        this.hardOverlapDistance = positive(distance, "hard overlap distance");
        this.hardOverlapPenalty = nonNegative(penalty, "hard overlap penalty");
        return this;
    }

    public double getSoftOverlapDistance() {
        return softOverlapDistance;
    }

    public double getSoftOverlapPenalty() {
        return softOverlapPenalty;
    }

    public LayoutOptions softOverlap(double distance, double penalty){
        this.softOverlapDistance = positive(distance, "soft overlap distance");
        this.softOverlapPenalty = nonNegative(penalty, "soft overlap penalty");
        return this;
    }

    public double getIntraRingDistance() {
        return intraRingDistance;
    }

    public double getIntraRingPenalty() {
        return intraRingPenalty;
    }

    public LayoutOptions intraRing(double distance, double penalty){
        this.intraRingDistance = positive(distance, "intra ring distance");
        this.intraRingPenalty = nonNegative(penalty, "intra ring penalty");
        return this;
    }

    public double getEdgeCrossingPenalty() {
        return edgeCrossingPenalty;
    }

    public LayoutOptions edgeCrossingPenalty(double v){
        this.edgeCrossingPenalty = nonNegative(v, "edge crossing penalty");
        return this;
    }

    public double getEdgeNearDistance() {
        return edgeNearDistance;
    }

    public double getEdgeNearPenalty() {
        return edgeNearPenalty;
    }

    public LayoutOptions edgeNear(double distance, double penalty){
        this.edgeNearDistance = positive(distance, "edge near distance");
        this.edgeNearPenalty = nonNegative(penalty, "edge near penalty");
        return this;
    }

    public int getRelaxIterations() {
        return relaxIterations;
    }

    public LayoutOptions relaxIterations(int relaxIterations){
        if(relaxIterations <0){
            throw new IllegalArgumentException("relax iterations must be >= 0");
        }
        this.relaxIterations = relaxIterations;
        return this;
    }

    public double getBondSpring() {
        return bondSpring;
    }

    public LayoutOptions bondSpring(double v){
        this.bondSpring = nonNegative(v, "bond spring");
        return this;
    }

    public double getNonBondedMinimum() {
        return nonBondedMinimum;
    }

    public double getNonBondedPush() {
        return nonBondedPush;
    }

    public LayoutOptions nonBonded(double minimum, double push){
        this.nonBondedMinimum = positive(minimum, "non bonded minimum");
        this.nonBondedPush = nonNegative(push, "non bonded push");
        return this;
    }

    public double getCrossingPush() {
        return crossingPush;
    }

    public LayoutOptions crossingPush(double v){
        this.crossingPush = nonNegative(v, "crossing push");
        return this;
    }

    public double getChainAngleDegrees() {
        return chainAngleDegrees;
    }

    public LayoutOptions chainAngleDegrees(double v){
        if(!(v > 0 && v < 180)){
            throw new IllegalArgumentException("chain angle must be in (0,180)");
        }
        this.chainAngleDegrees = v;
        return this;
    }

    public double getBranchFanSpread() {
        return branchFanSpread;
    }

    public LayoutOptions branchFanSpread(double radians){
        this.branchFanSpread = positive(radians, "branch fan spread");
        return this;
    }

    public double getBranchOpenSpread() {
        return branchOpenSpread;
    }

    public LayoutOptions branchOpenSpread(double radians){
        this.branchOpenSpread = positive(radians, "branch open spread");
        return this;
    }

    public int getChainPassLimit() {
        return chainPassLimit;
    }

    public LayoutOptions chainPassLimit(int v){
        if(v <1){
            throw new IllegalArgumentException("chain pass limit must be >= 1");
        }
        this.chainPassLimit = v;
        return this;
    }

    public double getBondFlipGain() {
        return bondFlipGain;
    }

    public LayoutOptions bondFlipGain(double v){
        if(!(v > 0 && v <= 1)){
            throw new IllegalArgumentException("bond flip gain must be in (0,1]");
        }
        this.bondFlipGain = v;
        return this;
    }
}
