package org.casq.util.model;

public class Modifier {
    private final String type;
    private final String alias;

    public Modifier(String type, String alias) {
        this.type = type;
        this.alias = alias;
    }

    public String getType() {
        return type;
    }

    public String getAlias() {
        return alias;
    }
}
