package com.ecoWasteEngine.model.enums;

public enum BinType {
    GREEN,   // organic
    BLUE,    // recyclables
    RED,     // hazardous
    BLACK,   // general
    YELLOW,  // medical
    SPECIAL; // special collection

    /** Display label, e.g. "Blue Bin" */
    public String toLabel() {
        if (this == SPECIAL)
            return "Special Collection";
        return this.name().charAt(0) + this.name().substring(1).toLowerCase() + " Bin";
    }
}
