package org.casq.converter;

import org.casq.qual.QualSbml;
import org.casq.util.Namespaces;
import org.junit.Test;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import javax.xml.parsers.DocumentBuilderFactory;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;

import static org.junit.Assert.*;

public class CellDesignerConverterTest {

    private byte[] convertAndWrite(String resource) throws Exception {
        CellDesignerConverter converter = new CellDesignerConverter();
        QualSbml document = converter.convert(getClass().getResourceAsStream(resource));
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        converter.write(document, out);
        return out.toByteArray();
    }

    private static Document parse(byte[] xml) throws Exception {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(true);
        return factory.newDocumentBuilder().parse(new ByteArrayInputStream(xml));
    }

    private static Element transition(Document doc, String id) {
        NodeList transitions = doc.getElementsByTagNameNS(Namespaces.QUAL, "transition");
        for (int i = 0; i < transitions.getLength(); i++) {
            Element t = (Element) transitions.item(i);
            if (id.equals(t.getAttributeNS(Namespaces.QUAL, "id"))) {
                return t;
            }
        }
        return null;
    }

    @Test
    public void convert() throws Exception {
        byte[] xml = convertAndWrite("/celldesigner_model.xml");
        assertTrue(new String(xml, StandardCharsets.UTF_8).startsWith("<?xml version=\"1.0\" encoding=\"UTF-8\""));

        Document doc = parse(xml);
        Element root = doc.getDocumentElement();
        assertEquals(Namespaces.SBML_L3V1, root.getNamespaceURI());
        assertEquals("sbml", root.getLocalName());
        assertEquals("3", root.getAttribute("level"));
        assertEquals("1", root.getAttribute("version"));
        assertEquals("false", root.getAttributeNS(Namespaces.LAYOUT, "required"));
        assertEquals("true", root.getAttributeNS(Namespaces.QUAL, "required"));

        Element model = (Element) doc.getElementsByTagNameNS(Namespaces.SBML_L3V1, "model").item(0);
        assertEquals("model_id", model.getAttribute("id"));
        Element compartment = (Element) doc.getElementsByTagNameNS(Namespaces.SBML_L3V1, "compartment").item(0);
        assertEquals("comp1", compartment.getAttribute("id"));
        assertEquals("true", compartment.getAttribute("constant"));

        NodeList species = doc.getElementsByTagNameNS(Namespaces.QUAL, "qualitativeSpecies");
        assertEquals(5, species.getLength());
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < species.getLength(); i++) {
            Element qs = (Element) species.item(i);
            assertTrue(ids.add(qs.getAttributeNS(Namespaces.QUAL, "id")));
            assertEquals("1", qs.getAttributeNS(Namespaces.QUAL, "maxLevel"));
            assertEquals("false", qs.getAttributeNS(Namespaces.QUAL, "constant"));
            assertEquals("comp1", qs.getAttributeNS(Namespaces.QUAL, "compartment"));
        }
        assertEquals(new HashSet<>(Arrays.asList("csa1", "sa1", "sa2", "sa3", "sa5")), ids);
        assertEquals("csa1", ((Element) species.item(0)).getAttributeNS(Namespaces.QUAL, "id"));
        assertEquals("AP1", ((Element) species.item(0)).getAttributeNS(Namespaces.QUAL, "name"));

        NodeList glyphs = doc.getElementsByTagNameNS(Namespaces.LAYOUT, "speciesGlyph");
        assertEquals(5, glyphs.getLength());
        Element glyph = (Element) glyphs.item(1);
        assertEquals("sa1", glyph.getAttributeNS(Namespaces.LAYOUT, "species"));
        Element position = (Element) glyph.getElementsByTagNameNS(Namespaces.LAYOUT, "position").item(0);
        assertEquals("100.0", position.getAttributeNS(Namespaces.LAYOUT, "x"));
        assertEquals("120.5", position.getAttributeNS(Namespaces.LAYOUT, "y"));
        Element dimensions = (Element) glyph.getElementsByTagNameNS(Namespaces.LAYOUT, "dimensions").item(0);
        assertEquals("80.0", dimensions.getAttributeNS(Namespaces.LAYOUT, "width"));
        assertEquals("40.0", dimensions.getAttributeNS(Namespaces.LAYOUT, "height"));
    }

    @Test
    public void transitions() throws Exception {
        Document doc = parse(convertAndWrite("/celldesigner_model.xml"));

        NodeList transitions = doc.getElementsByTagNameNS(Namespaces.QUAL, "transition");
        assertEquals(5, transitions.getLength());
        for (int i = 0; i < transitions.getLength(); i++) {
            Element t = (Element) transitions.item(i);
            NodeList outputs = t.getElementsByTagNameNS(Namespaces.QUAL, "output");
            assertEquals(1, outputs.getLength());
            assertEquals("assignmentLevel", ((Element) outputs.item(0)).getAttributeNS(Namespaces.QUAL, "transitionEffect"));

            Element terms = (Element) t.getElementsByTagNameNS(Namespaces.QUAL, "listOfFunctionTerms").item(0);
            int termCount = 0;
            for (Node n = terms.getFirstChild(); n != null; n = n.getNextSibling()) {
                if (n.getNodeType() == Node.ELEMENT_NODE) {
                    termCount++;
                    assertEquals("defaultTerm", n.getLocalName());
                    assertEquals("0", ((Element) n).getAttributeNS(Namespaces.QUAL, "resultLevel"));
                }
            }
            assertEquals(1, termCount);
        }

        Element sa2 = transition(doc, "tr_sa2");
        assertNotNull(sa2);
        NodeList inputs = sa2.getElementsByTagNameNS(Namespaces.QUAL, "input");
        assertEquals(4, inputs.getLength());
        String[][] expected = {
                {"tr_sa2_in_0", "sa1", "positive"},
                {"tr_sa2_in_1", "sa3", "positive"},
                {"tr_sa2_in_2", "sa5", "negative"},
                {"tr_sa2_in_3", "sa3", "positive"},
        };
        for (int i = 0; i < expected.length; i++) {
            Element input = (Element) inputs.item(i);
            assertEquals(expected[i][0], input.getAttributeNS(Namespaces.QUAL, "id"));
            assertEquals(expected[i][1], input.getAttributeNS(Namespaces.QUAL, "qualitativeSpecies"));
            assertEquals(expected[i][2], input.getAttributeNS(Namespaces.QUAL, "sign"));
            assertEquals("none", input.getAttributeNS(Namespaces.QUAL, "transitionEffect"));
        }

        Element sa1 = transition(doc, "tr_sa1");
        assertEquals(0, sa1.getElementsByTagNameNS(Namespaces.QUAL, "input").getLength());
        assertEquals(1, sa1.getElementsByTagNameNS(Namespaces.QUAL, "listOfInputs").getLength());
        Element output = (Element) sa1.getElementsByTagNameNS(Namespaces.QUAL, "output").item(0);
        assertEquals("tr_sa1_out", output.getAttributeNS(Namespaces.QUAL, "id"));
        assertEquals("sa1", output.getAttributeNS(Namespaces.QUAL, "qualitativeSpecies"));

        assertEquals(2, transition(doc, "tr_csa1").getElementsByTagNameNS(Namespaces.QUAL, "input").getLength());
    }

    @Test
    public void unknownProductsAreReported() throws Exception {
        CellDesignerConverter converter = new CellDesignerConverter();
        converter.convert(getClass().getResourceAsStream("/celldesigner_model.xml"));
        assertEquals(Arrays.asList("sa4", "sa99"), converter.getUnknownProducts());
    }

    // reactants are positive inputs, whatever the reaction type
    @Test
    public void inhibitionReactionScenario() throws Exception {
        Document doc = parse(convertAndWrite("/inhibition_scenario.xml"));
        assertEquals(2, doc.getElementsByTagNameNS(Namespaces.QUAL, "qualitativeSpecies").getLength());
        assertEquals(0, transition(doc, "tr_sa1").getElementsByTagNameNS(Namespaces.QUAL, "input").getLength());

        NodeList inputs = transition(doc, "tr_sa2").getElementsByTagNameNS(Namespaces.QUAL, "input");
        assertEquals(1, inputs.getLength());
        Element input = (Element) inputs.item(0);
        assertEquals("tr_sa2_in_0", input.getAttributeNS(Namespaces.QUAL, "id"));
        assertEquals("sa1", input.getAttributeNS(Namespaces.QUAL, "qualitativeSpecies"));
        assertEquals("positive", input.getAttributeNS(Namespaces.QUAL, "sign"));
    }

    @Test
    public void outputIsDeterministic() throws Exception {
        assertArrayEquals(convertAndWrite("/celldesigner_model.xml"), convertAndWrite("/celldesigner_model.xml"));
    }

    @Test(expected = SchemaMismatchException.class)
    public void levelThreeInputIsRejected() throws Exception {
        new CellDesignerConverter().convert(getClass().getResourceAsStream("/sbml_level3.xml"));
    }

    @Test
    public void otherRootIsRejected() {
        String xml = "<notSbml xmlns='http://www.sbml.org/sbml/level2/version4'/>";
        try {
            new CellDesignerConverter().convert(new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8)));
            fail("root element was accepted");
        } catch (SchemaMismatchException e) {
            assertEquals(CellDesignerConverter.SCHEMA_MISMATCH, e.getMessage());
        } catch (IOException e) {
            fail(e.toString());
        }
    }

    @Test(expected = IOException.class)
    public void malformedInputFails() throws Exception {
        String xml = "<sbml xmlns='http://www.sbml.org/sbml/level2/version4'><model>";
        new CellDesignerConverter().convert(new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8)));
    }
}
