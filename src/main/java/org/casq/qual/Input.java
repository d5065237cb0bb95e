package org.casq.qual;

import org.casq.util.Namespaces;

import javax.xml.bind.annotation.XmlAttribute;

public class Input {
    @XmlAttribute(namespace = Namespaces.QUAL)
    private String qualitativeSpecies;
    @XmlAttribute(namespace = Namespaces.QUAL)
    private TransitionEffect transitionEffect;
    @XmlAttribute(namespace = Namespaces.QUAL)
    private Sign sign;
    @XmlAttribute(namespace = Namespaces.QUAL)
    private String id;

    public Input() {
    }

    public Input(String id, String qualitativeSpecies, Sign sign) {
        this.id = id;
        this.qualitativeSpecies = qualitativeSpecies;
        this.transitionEffect = TransitionEffect.NONE;
        this.sign = sign;
    }

    public String getQualitativeSpecies() {
        return qualitativeSpecies;
    }

    public TransitionEffect getTransitionEffect() {
        return transitionEffect;
    }

    public Sign getSign() {
        return sign;
    }

    public String getId() {
        return id;
    }
}
