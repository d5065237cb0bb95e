package org.casq.util.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One placed species alias: layout data from the alias, semantic data from the
 * species definition, and the reactions that produce it.
 */
public class SpeciesRecord {
    public static final String DEFAULT_CLASS = "PROTEIN";

    private final String id;
    private final String name;
    private final String speciesClass;
    private final String activity;
    private final String x;
    private final String y;
    private final String width;
    private final String height;
    private final List<String> modifications;
    private final List<ReactionInfluence> transitions = new ArrayList<>();

    public SpeciesRecord(String id, String name, String speciesClass, String activity,
                         String x, String y, String width, String height,
                         List<String> modifications)
    {
        this.id = id;
        this.name = name;
        this.speciesClass = (speciesClass == null) ? DEFAULT_CLASS : speciesClass;
        this.activity = activity;
        this.x = x;
        this.y = y;
        this.width = width;
        this.height = height;
        this.modifications = (modifications == null)
                ? Collections.emptyList()
                : Collections.unmodifiableList(new ArrayList<>(modifications));
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getSpeciesClass() {
        return speciesClass;
    }

    public String getActivity() {
        return activity;
    }

    public String getX() {
        return x;
    }

    public String getY() {
        return y;
    }

    public String getWidth() {
        return width;
    }

    public String getHeight() {
        return height;
    }

    public List<String> getModifications() {
        return modifications;
    }

    public List<ReactionInfluence> getTransitions() {
        return Collections.unmodifiableList(transitions);
    }

    void addTransition(ReactionInfluence influence) {
        transitions.add(influence);
    }

    @Override
    public String toString() {
        return id + " (" + speciesClass + ", " + transitions.size() + " influences)";
    }
}
