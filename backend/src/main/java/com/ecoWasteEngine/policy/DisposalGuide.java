package com.ecoWasteEngine.policy;

import com.ecoWasteEngine.model.enums.BinType;
import com.ecoWasteEngine.model.enums.WasteCategory;
import com.ecoWasteEngine.model.enums.WasteSubCategory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/** Static segregation rules: which bin, and what to do before dropping the item in. */
public final class DisposalGuide {

    private static final Map<WasteCategory, BinType> CATEGORY_BINS = new EnumMap<>(WasteCategory.class);
    private static final Map<WasteSubCategory, BinType> SUB_CATEGORY_BINS = new EnumMap<>(WasteSubCategory.class);
    private static final Map<WasteCategory, List<String>> CATEGORY_STEPS = new EnumMap<>(WasteCategory.class);
    private static final Map<WasteSubCategory, String> SUB_CATEGORY_STEPS = new EnumMap<>(WasteSubCategory.class);

    static {
        CATEGORY_BINS.put(WasteCategory.ORGANIC, BinType.GREEN);
        CATEGORY_BINS.put(WasteCategory.RECYCLABLE, BinType.BLUE);
        CATEGORY_BINS.put(WasteCategory.HAZARDOUS, BinType.RED);
        CATEGORY_BINS.put(WasteCategory.ELECTRONIC, BinType.SPECIAL);
        CATEGORY_BINS.put(WasteCategory.GENERAL, BinType.BLACK);
        CATEGORY_BINS.put(WasteCategory.MEDICAL, BinType.YELLOW);

        SUB_CATEGORY_BINS.put(WasteSubCategory.BATTERIES, BinType.RED);
        SUB_CATEGORY_BINS.put(WasteSubCategory.SMALL_ELECTRONICS, BinType.SPECIAL);
        SUB_CATEGORY_BINS.put(WasteSubCategory.LARGE_APPLIANCES, BinType.SPECIAL);
        SUB_CATEGORY_BINS.put(WasteSubCategory.SHARPS, BinType.YELLOW);
        SUB_CATEGORY_BINS.put(WasteSubCategory.PHARMACEUTICALS, BinType.YELLOW);

        CATEGORY_STEPS.put(WasteCategory.ORGANIC, List.of(
                "Remove any packaging, stickers or plastic bags.",
                "Drain excess liquid before disposal."));
        CATEGORY_STEPS.put(WasteCategory.RECYCLABLE, List.of(
                "Rinse off food and drink residue.",
                "Flatten or crush the item to save space."));
        CATEGORY_STEPS.put(WasteCategory.HAZARDOUS, List.of(
                "Keep the item in its original container with the lid closed.",
                "Never mix with other waste or pour down a drain."));
        CATEGORY_STEPS.put(WasteCategory.ELECTRONIC, List.of(
                "Remove batteries if they come out easily.",
                "Wipe personal data from devices before handing them in."));
        CATEGORY_STEPS.put(WasteCategory.GENERAL, List.of(
                "Bag the item securely before disposal."));
        CATEGORY_STEPS.put(WasteCategory.MEDICAL, List.of(
                "Seal the item in a puncture-proof container.",
                "Do not place medical waste with household rubbish."));

        SUB_CATEGORY_STEPS.put(WasteSubCategory.GLASS, "Wrap broken glass before disposal.");
        SUB_CATEGORY_STEPS.put(WasteSubCategory.BATTERIES, "Tape over the terminals of lithium batteries.");
        SUB_CATEGORY_STEPS.put(WasteSubCategory.SHARPS, "Never recap needles.");
        SUB_CATEGORY_STEPS.put(WasteSubCategory.PHARMACEUTICALS, "Return unused medicine to a pharmacy where possible.");
        SUB_CATEGORY_STEPS.put(WasteSubCategory.LARGE_APPLIANCES, "Book a bulky-item pickup instead of using a street bin.");
        SUB_CATEGORY_STEPS.put(WasteSubCategory.TEXTILES, "Donate clothing that is still wearable.");
    }

    private DisposalGuide() {
    }

    /** Sub-category overrides win over the category default. Unknown input maps to BLACK. */
    public static BinType binFor(WasteCategory category, WasteSubCategory subCategory) {
        if (subCategory != null && SUB_CATEGORY_BINS.containsKey(subCategory)) {
            return SUB_CATEGORY_BINS.get(subCategory);
        }
        return CATEGORY_BINS.getOrDefault(category, BinType.BLACK);
    }

    public static List<String> instructionsFor(WasteCategory category, WasteSubCategory subCategory) {
        List<String> steps = new ArrayList<>(CATEGORY_STEPS.getOrDefault(category, List.of()));
        if (subCategory != null && SUB_CATEGORY_STEPS.containsKey(subCategory)) {
            steps.add(SUB_CATEGORY_STEPS.get(subCategory));
        }
        return steps;
    }
}
