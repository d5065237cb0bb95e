package org.casq.qual;

import org.casq.util.Namespaces;

import javax.xml.bind.annotation.XmlAttribute;
import javax.xml.bind.annotation.XmlElement;
import javax.xml.bind.annotation.XmlElementWrapper;
import javax.xml.bind.annotation.XmlType;
import java.util.ArrayList;
import java.util.List;

@XmlType(name = "model", propOrder = {"compartments", "layouts", "qualitativeSpecies", "transitions"})
public class QualModel {
    @XmlAttribute
    private String id;
    @XmlElementWrapper(name = "listOfCompartments")
    @XmlElement(name = "compartment")
    private List<Compartment> compartments = new ArrayList<>();
    @XmlElementWrapper(name = "listOfLayouts", namespace = Namespaces.LAYOUT)
    @XmlElement(name = "layout", namespace = Namespaces.LAYOUT)
    private List<Layout> layouts = new ArrayList<>();
    @XmlElementWrapper(name = "listOfQualitativeSpecies", namespace = Namespaces.QUAL)
    @XmlElement(name = "qualitativeSpecies", namespace = Namespaces.QUAL)
    private List<QualitativeSpecies> qualitativeSpecies = new ArrayList<>();
    @XmlElementWrapper(name = "listOfTransitions", namespace = Namespaces.QUAL)
    @XmlElement(name = "transition", namespace = Namespaces.QUAL)
    private List<Transition> transitions = new ArrayList<>();

    public QualModel() {
    }

    public QualModel(String id) {
        this.id = id;
    }

    public String getId() {
        return id;
    }

    public List<Compartment> getCompartments() {
        return compartments;
    }

    public List<Layout> getLayouts() {
        return layouts;
    }

    public List<QualitativeSpecies> getQualitativeSpecies() {
        return qualitativeSpecies;
    }

    public List<Transition> getTransitions() {
        return transitions;
    }
}
