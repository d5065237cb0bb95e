package org.casq.converter;

import org.casq.qual.Compartment;
import org.casq.qual.Input;
import org.casq.qual.Layout;
import org.casq.qual.Output;
import org.casq.qual.QualModel;
import org.casq.qual.QualitativeSpecies;
import org.casq.qual.Sign;
import org.casq.qual.SpeciesGlyph;
import org.casq.qual.Transition;
import org.casq.qual.TransitionEffect;
import org.casq.util.CasqUtil;
import org.casq.util.model.Modifier;
import org.casq.util.model.ReactionInfluence;
import org.casq.util.model.SpeciesRecord;
import org.casq.util.model.SpeciesTable;

/**
 * Writes a filled species table into a qual model: a glyph, a qualitative species
 * and a transition for every record.
 */
public class QualEmitter {
    public static final int MAX_LEVEL = 1;
    public static final int DEFAULT_LEVEL = 0;

    private final String compartmentId;

    public QualEmitter(String compartmentId) {
        this.compartmentId = compartmentId;
    }

    public QualModel emit(SpeciesTable table, QualModel model) {
        model.getCompartments().add(new Compartment(compartmentId, true));
        Layout layout = new Layout();
        model.getLayouts().add(layout);

        for (SpeciesRecord record : table.getRecords()) {
            layout.getSpeciesGlyphs().add(new SpeciesGlyph(record.getId(),
                    record.getX(), record.getY(), record.getWidth(), record.getHeight()));
            model.getQualitativeSpecies().add(new QualitativeSpecies(record.getId(), record.getName(),
                    compartmentId, MAX_LEVEL, false));
        }
        for (SpeciesRecord record : table.getRecords()) {
            model.getTransitions().add(createTransition(record));
        }
        return model;
    }

    /**
     * Reactants of every influence come first as positive inputs, then its modifiers
     * signed by their type; input ids count across all influences of the species.
     */
    public Transition createTransition(SpeciesRecord record) {
        String species = record.getId();
        Transition transition = new Transition(CasqUtil.transitionId(species));

        int index = 0;
        for (ReactionInfluence influence : record.getTransitions()) {
            for (String reactant : influence.getBaseReactants()) {
                transition.getInputs().add(new Input(CasqUtil.inputId(species, index++), reactant, Sign.POSITIVE));
            }
            for (Modifier modifier : influence.getModifiers()) {
                transition.getInputs().add(new Input(CasqUtil.inputId(species, index++),
                        modifier.getAlias(), Sign.of(modifier.getType())));
            }
        }

        transition.getOutputs().add(new Output(CasqUtil.outputId(species), species, TransitionEffect.ASSIGNMENT_LEVEL));
        transition.getFunctionTerms().setDefaultTerm(new Transition.DefaultTerm(DEFAULT_LEVEL));
        return transition;
    }
}
