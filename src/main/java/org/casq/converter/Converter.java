package org.casq.converter;

import org.casq.qual.QualModel;
import org.casq.qual.QualSbml;

import javax.xml.bind.JAXBContext;
import javax.xml.bind.JAXBException;
import javax.xml.bind.Marshaller;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

public abstract class Converter {

    public static final String DEFAULT_MODEL_ID = "model_id";
    public static final String DEFAULT_COMPARTMENT_ID = "comp1";

    private final String modelId = DEFAULT_MODEL_ID;
    private final String compartmentId = DEFAULT_COMPARTMENT_ID;

    public QualSbml createNewDocument() {
        return new QualSbml(new QualModel(getModelId()));
    }

    public String getModelId() {
        return modelId;
    }

    public String getCompartmentId() {
        return compartmentId;
    }

    // a public abstract method to be implemented:
    public abstract QualSbml convert(InputStream inputStream) throws IOException, SchemaMismatchException;

    public void write(QualSbml document, OutputStream outputStream) throws IOException {
        try {
            Marshaller marshaller = JAXBContext.newInstance(QualSbml.class).createMarshaller();
            marshaller.setProperty(Marshaller.JAXB_ENCODING, StandardCharsets.UTF_8.name());
            marshaller.setProperty(Marshaller.JAXB_FORMATTED_OUTPUT, Boolean.TRUE);
            marshaller.marshal(document, outputStream);
        } catch (JAXBException e) {
            throw new IOException("Could not write the SBML-qual document", e);
        }
    }
}
