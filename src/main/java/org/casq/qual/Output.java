package org.casq.qual;

import org.casq.util.Namespaces;

import javax.xml.bind.annotation.XmlAttribute;

public class Output {
    @XmlAttribute(namespace = Namespaces.QUAL)
    private String qualitativeSpecies;
    @XmlAttribute(namespace = Namespaces.QUAL)
    private TransitionEffect transitionEffect;
    @XmlAttribute(namespace = Namespaces.QUAL)
    private String id;

    public Output() {
    }

    public Output(String id, String qualitativeSpecies, TransitionEffect transitionEffect) {
        this.id = id;
        this.qualitativeSpecies = qualitativeSpecies;
        this.transitionEffect = transitionEffect;
    }

    public String getQualitativeSpecies() {
        return qualitativeSpecies;
    }

    public TransitionEffect getTransitionEffect() {
        return transitionEffect;
    }

    public String getId() {
        return id;
    }
}
