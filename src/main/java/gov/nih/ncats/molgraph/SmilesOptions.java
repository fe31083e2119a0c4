package gov.nih.ncats.molgraph;

import java.util.EnumSet;
import java.util.Objects;

import gov.nih.ncats.molgraph.layout.LayoutOptions;

/**
 * Options for reading SMILES.
 */
public class SmilesOptions {

    private EnumSet<SmiFlavor> flavors = SmiFlavor.defaults();
    private boolean generateCoordinates = true;
    private LayoutOptions layoutOptions = new LayoutOptions();

    public EnumSet<SmiFlavor> getFlavors() {
        return EnumSet.copyOf(flavors);
    }

    public boolean hasFlavor(SmiFlavor flavor){
        return flavors.contains(flavor);
    }

    public SmilesOptions flavors(EnumSet<SmiFlavor> flavors){
        Objects.requireNonNull(flavors);
        this.flavors = flavors.isEmpty()? EnumSet.noneOf(SmiFlavor.class) : EnumSet.copyOf(flavors);
        return this;
    }

    public SmilesOptions addFlavor(SmiFlavor flavor){
        flavors.add(Objects.requireNonNull(flavor));
        return this;
    }

    public SmilesOptions removeFlavor(SmiFlavor flavor){
        flavors.remove(flavor);
        return this;
    }

    /**
     * When true (the default) parsed molecules are laid out and
     * chiral centers get wedge/hash bonds.
     */
    public boolean isGenerateCoordinates() {
        return generateCoordinates;
    }

    public SmilesOptions generateCoordinates(boolean generateCoordinates){
        this.generateCoordinates = generateCoordinates;
        return this;
    }

    public LayoutOptions getLayoutOptions() {
        return layoutOptions;
    }

    public SmilesOptions layoutOptions(LayoutOptions layoutOptions){
        this.layoutOptions = Objects.requireNonNull(layoutOptions);
        return this;
    }
}
