package org.casq.converter;

import org.casq.celldesigner.CdModel;
import org.casq.celldesigner.Sbml;
import org.casq.qual.QualSbml;
import org.casq.util.Namespaces;
import org.casq.util.model.SpeciesTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.xml.bind.JAXBContext;
import javax.xml.bind.JAXBElement;
import javax.xml.bind.JAXBException;
import javax.xml.bind.Unmarshaller;
import javax.xml.namespace.QName;
import javax.xml.transform.stream.StreamSource;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * A CellDesigner (SBML L2V4 with celldesigner annotations) to SBML-qual converter.
 * Species come from the alias lists, transitions from the reactions producing them.
 */
public class CellDesignerConverter extends Converter {
    private static Logger log = LoggerFactory.getLogger(CellDesignerConverter.class);

    public static final QName SBML_ROOT = new QName(Namespaces.SBML_L2V4, "sbml");
    public static final String SCHEMA_MISMATCH = "Currently limited to SBML Level 2 Version 4";

    private TransitionExtractor transitionExtractor = new TransitionExtractor();

    @Override
    public QualSbml convert(InputStream inputStream) throws IOException, SchemaMismatchException {
        CdModel model = read(inputStream);
        SpeciesTable table = new SpeciesExtractor().extract(model);
        transitionExtractor = new TransitionExtractor();
        transitionExtractor.extract(model, table);

        QualSbml document = createNewDocument();
        new QualEmitter(getCompartmentId()).emit(table, document.getModel());
        return document;
    }

    public CdModel read(InputStream inputStream) throws IOException, SchemaMismatchException {
        JAXBElement<Sbml> root;
        try {
            JAXBContext jaxbContext = JAXBContext.newInstance(Sbml.class);
            Unmarshaller unmarshaller = jaxbContext.createUnmarshaller();
            root = unmarshaller.unmarshal(new StreamSource(inputStream), Sbml.class);
        } catch (JAXBException e) {
            throw new IOException("Could not read the CellDesigner document", e);
        }

        if (!SBML_ROOT.equals(root.getName())) {
            log.debug("Unexpected root element " + root.getName());
            throw new SchemaMismatchException(SCHEMA_MISMATCH);
        }

        CdModel model = root.getValue().getModel();
        if (model == null) {
            // an sbml root with no model has nothing to convert
            return new CdModel();
        }
        return model;
    }

    /**
     * @return product aliases ignored by the last conversion
     */
    public List<String> getUnknownProducts() {
        return transitionExtractor.getUnknownProducts();
    }
}
