package org.casq.util.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A reaction seen from one of its products.
 */
public class ReactionInfluence {
    private final String reactionType;
    private final List<String> baseReactants;
    private final List<Modifier> modifiers;

    public ReactionInfluence(String reactionType, List<String> baseReactants, List<Modifier> modifiers) {
        this.reactionType = reactionType;
        this.baseReactants = Collections.unmodifiableList(new ArrayList<>(baseReactants));
        this.modifiers = Collections.unmodifiableList(new ArrayList<>(modifiers));
    }

    public String getReactionType() {
        return reactionType;
    }

    public List<String> getBaseReactants() {
        return baseReactants;
    }

    public List<Modifier> getModifiers() {
        return modifiers;
    }
}
