package org.casq.converter;

import org.casq.celldesigner.CdModel;
import org.casq.celldesigner.Reaction;
import org.casq.util.model.Modifier;
import org.casq.util.model.ReactionInfluence;
import org.casq.util.model.SpeciesTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Appends every reaction to the species table as an influence on each of its products.
 * Products missing from the table are reported and skipped.
 */
public class TransitionExtractor {
    private static Logger log = LoggerFactory.getLogger(TransitionExtractor.class);

    private final List<String> unknownProducts = new ArrayList<>();

    public SpeciesTable extract(CdModel model, SpeciesTable table) {
        int influences = 0;
        for (Reaction reaction : model.getReactions()) {
            ReactionInfluence influence = createInfluence(reaction);
            for (Reaction.AliasLink product : reaction.getBaseProducts()) {
                String species = product.getAlias();
                if (table.addInfluence(species, influence)) {
                    influences++;
                } else {
                    log.warn("ignoring unknown species " + species);
                    unknownProducts.add(species);
                }
            }
        }

        log.info("Added " + influences + " influences from " + model.getReactions().size()
                + " reactions (" + unknownProducts.size() + " unknown products ignored).");
        return table;
    }

    /**
     * @return product aliases skipped so far, one entry per occurrence
     */
    public List<String> getUnknownProducts() {
        return Collections.unmodifiableList(unknownProducts);
    }

    private ReactionInfluence createInfluence(Reaction reaction) {
        List<String> reactants = new ArrayList<>();
        for (Reaction.AliasLink reactant : reaction.getBaseReactants()) {
            reactants.add(reactant.getAlias());
        }
        List<Modifier> modifiers = new ArrayList<>();
        for (Reaction.Modification modification : reaction.getModifications()) {
            modifiers.add(new Modifier(modification.getType(), modification.getAliases()));
        }
        return new ReactionInfluence(reaction.getReactionType(), reactants, modifiers);
    }
}
