package org.casq.qual;

import javax.xml.bind.annotation.XmlEnum;
import javax.xml.bind.annotation.XmlEnumValue;

@XmlEnum
public enum Sign {
    @XmlEnumValue("positive")
    POSITIVE,
    @XmlEnumValue("negative")
    NEGATIVE;

    public static final String INHIBITION = "INHIBITION";

    /**
     * Only an exact "INHIBITION" tag is negative; every other reaction or
     * modifier type, known or not, counts as a positive influence.
     */
    public static Sign of(String type) {
        return INHIBITION.equals(type) ? NEGATIVE : POSITIVE;
    }
}
