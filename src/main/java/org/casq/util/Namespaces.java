package org.casq.util;

public final class Namespaces {
    public static final String SBML_L2V4 = "http://www.sbml.org/sbml/level2/version4";
    public static final String CELLDESIGNER = "http://www.sbml.org/2001/ns/celldesigner";
    public static final String SBML_L3V1 = "http://www.sbml.org/sbml/level3/version1/core";
    public static final String LAYOUT = "http://www.sbml.org/sbml/level3/version1/layout/version1";
    public static final String QUAL = "http://www.sbml.org/sbml/level3/version1/qual/version1";

    private Namespaces() {
    }
}
