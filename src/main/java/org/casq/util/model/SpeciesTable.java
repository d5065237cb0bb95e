package org.casq.util.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Species records keyed by alias id, in the order they were added; that order
 * is the order of the written document.
 */
public class SpeciesTable {
    private final Map<String, SpeciesRecord> records = new LinkedHashMap<>();

    public void add(SpeciesRecord record) {
        if (records.containsKey(record.getId())) {
            throw new IllegalArgumentException("Duplicate species alias: " + record.getId());
        }
        records.put(record.getId(), record);
    }

    public boolean contains(String aliasId) {
        return records.containsKey(aliasId);
    }

    public SpeciesRecord get(String aliasId) {
        return records.get(aliasId);
    }

    /**
     * Adds the influence to the product's record.
     *
     * @return false if no record has that alias id
     */
    public boolean addInfluence(String productAlias, ReactionInfluence influence) {
        SpeciesRecord record = records.get(productAlias);
        if (record == null) {
            return false;
        }
        record.addTransition(influence);
        return true;
    }

    public Collection<SpeciesRecord> getRecords() {
        return Collections.unmodifiableCollection(records.values());
    }

    public int size() {
        return records.size();
    }
}
