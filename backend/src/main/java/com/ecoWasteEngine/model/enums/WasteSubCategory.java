package com.ecoWasteEngine.model.enums;

/** Sub-categories, each bound to exactly one parent category. */
public enum WasteSubCategory {
    FOOD_WASTE(WasteCategory.ORGANIC),
    GARDEN_WASTE(WasteCategory.ORGANIC),

    PLASTIC(WasteCategory.RECYCLABLE),
    PAPER(WasteCategory.RECYCLABLE),
    GLASS(WasteCategory.RECYCLABLE),
    METAL(WasteCategory.RECYCLABLE),
    CARDBOARD(WasteCategory.RECYCLABLE),

    CHEMICALS(WasteCategory.HAZARDOUS),
    BATTERIES(WasteCategory.HAZARDOUS),
    PAINT(WasteCategory.HAZARDOUS),
    OIL(WasteCategory.HAZARDOUS),

    SMALL_ELECTRONICS(WasteCategory.ELECTRONIC),
    LARGE_APPLIANCES(WasteCategory.ELECTRONIC),
    CABLES(WasteCategory.ELECTRONIC),

    SHARPS(WasteCategory.MEDICAL),
    PHARMACEUTICALS(WasteCategory.MEDICAL),

    MIXED(WasteCategory.GENERAL),
    TEXTILES(WasteCategory.GENERAL),
    FURNITURE(WasteCategory.GENERAL);

    private final WasteCategory parent;

    WasteSubCategory(WasteCategory parent) {
        this.parent = parent;
    }

    public WasteCategory getParent() {
        return parent;
    }
}
