package org.casq.converter;

import org.casq.celldesigner.CdModel;
import org.casq.celldesigner.Species;
import org.casq.celldesigner.SpeciesAlias;
import org.casq.util.CasqUtil;
import org.casq.util.model.SpeciesRecord;
import org.casq.util.model.SpeciesTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the species table from the complex and simple species aliases that sit in a compartment.
 * Complex aliases come first, then simple ones, each list in document order.
 */
public class SpeciesExtractor {
    private static Logger log = LoggerFactory.getLogger(SpeciesExtractor.class);

    public SpeciesTable extract(CdModel model) {
        Map<String, Species> speciesById = new LinkedHashMap<>();
        for (Species species : model.getSpecies()) {
            speciesById.put(species.getId(), species);
        }

        List<SpeciesAlias> aliases = new ArrayList<>(model.getComplexSpeciesAliases());
        aliases.addAll(model.getSpeciesAliases());

        SpeciesTable table = new SpeciesTable();
        for (SpeciesAlias alias : aliases) {
            // aliases nested in a complex have no compartment and no position of their own
            if (alias.getCompartmentAlias() == null) {
                continue;
            }
            if (table.contains(alias.getId())) {
                log.warn("Alias " + alias.getId() + " is declared more than once. Skipping the repeat.");
                continue;
            }
            table.add(createRecord(alias, speciesById.get(alias.getSpecies())));
        }

        log.info("Extracted " + table.size() + " species from " + aliases.size() + " aliases.");
        return table;
    }

    private SpeciesRecord createRecord(SpeciesAlias alias, Species species) {
        String name = null;
        Species.Identity identity = null;
        if (species == null) {
            log.warn("Alias " + alias.getId() + " refers to undefined species " + alias.getSpecies());
        } else {
            name = species.getName();
            identity = species.getIdentity();
        }

        SpeciesAlias.Bounds bounds = alias.getBounds();
        String x = null, y = null, w = null, h = null;
        if (bounds != null) {
            x = bounds.getX();
            y = bounds.getY();
            w = bounds.getW();
            h = bounds.getH();
        }

        return new SpeciesRecord(alias.getId(), name, CasqUtil.speciesClass(identity),
                alias.getActivity(), x, y, w, h, CasqUtil.modificationStates(identity));
    }
}
