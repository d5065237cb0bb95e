package org.casq.qual;

import org.casq.util.Namespaces;

import javax.xml.bind.annotation.XmlAttribute;
import javax.xml.bind.annotation.XmlElement;
import javax.xml.bind.annotation.XmlElementWrapper;
import javax.xml.bind.annotation.XmlType;
import java.util.ArrayList;
import java.util.List;

@XmlType(propOrder = {"inputs", "outputs", "functionTerms"})
public class Transition {
    @XmlAttribute(namespace = Namespaces.QUAL)
    private String id;
    @XmlElementWrapper(name = "listOfInputs", namespace = Namespaces.QUAL)
    @XmlElement(name = "input", namespace = Namespaces.QUAL)
    private List<Input> inputs = new ArrayList<>();
    @XmlElementWrapper(name = "listOfOutputs", namespace = Namespaces.QUAL)
    @XmlElement(name = "output", namespace = Namespaces.QUAL)
    private List<Output> outputs = new ArrayList<>();
    @XmlElement(name = "listOfFunctionTerms", namespace = Namespaces.QUAL)
    private FunctionTerms functionTerms = new FunctionTerms();

    public Transition() {
    }

    public Transition(String id) {
        this.id = id;
    }

    public String getId() {
        return id;
    }

    public List<Input> getInputs() {
        return inputs;
    }

    public List<Output> getOutputs() {
        return outputs;
    }

    public FunctionTerms getFunctionTerms() {
        return functionTerms;
    }

    /**
     * qual:listOfFunctionTerms. Only the default term is ever written: the
     * converter declares who regulates whom and leaves the logic to the modeller.
     */
    public static class FunctionTerms {
        @XmlElement(namespace = Namespaces.QUAL)
        private DefaultTerm defaultTerm;

        public DefaultTerm getDefaultTerm() {
            return defaultTerm;
        }

        public void setDefaultTerm(DefaultTerm defaultTerm) {
            this.defaultTerm = defaultTerm;
        }
    }

    public static class DefaultTerm {
        @XmlAttribute(namespace = Namespaces.QUAL)
        private int resultLevel;

        public DefaultTerm() {
        }

        public DefaultTerm(int resultLevel) {
            this.resultLevel = resultLevel;
        }

        public int getResultLevel() {
            return resultLevel;
        }
    }
}
