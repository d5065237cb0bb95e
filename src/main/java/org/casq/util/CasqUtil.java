package org.casq.util;

import org.apache.commons.lang3.StringUtils;
import org.casq.celldesigner.Species;
import org.casq.util.model.SpeciesRecord;

import java.util.ArrayList;
import java.util.List;

public class CasqUtil {

    public static String speciesClass(Species.Identity identity) {
        if (identity == null || StringUtils.isBlank(identity.getSpeciesClass())) {
            return SpeciesRecord.DEFAULT_CLASS;
        }
        return identity.getSpeciesClass().trim();
    }

    // modification states in document order, duplicates kept
    public static List<String> modificationStates(Species.Identity identity) {
        List<String> states = new ArrayList<>();
        if (identity == null || identity.getModifications() == null) {
            return states;
        }
        for (Species.Modification modification : identity.getModifications()) {
            states.add(modification.getState());
        }
        return states;
    }

    public static String transitionId(String speciesId) {
        return "tr_" + speciesId;
    }

    public static String inputId(String speciesId, int index) {
        return transitionId(speciesId) + "_in_" + index;
    }

    public static String outputId(String speciesId) {
        return transitionId(speciesId) + "_out";
    }
}
