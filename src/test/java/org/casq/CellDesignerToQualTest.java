package org.casq;

import org.casq.converter.CellDesignerConverter;
import org.casq.converter.Converter;
import org.casq.qual.QualSbml;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.zip.GZIPOutputStream;

import static org.junit.Assert.*;

public class CellDesignerToQualTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private File copyResource(String resource, String fileName) throws Exception {
        File file = new File(folder.getRoot(), fileName);
        try (InputStream in = getClass().getResourceAsStream(resource)) {
            Files.copy(in, file.toPath());
        }
        return file;
    }

    @Test
    public void wrongArgumentCountIsAUsageError() throws Exception {
        File input = copyResource("/celldesigner_model.xml", "model.xml");
        assertEquals(1, CellDesignerToQual.run(new String[]{}));
        assertEquals(1, CellDesignerToQual.run(new String[]{input.getPath()}));
        File output = new File(folder.getRoot(), "out.xml");
        assertEquals(1, CellDesignerToQual.run(new String[]{input.getPath(), output.getPath(), "extra"}));
        assertFalse(output.exists());
    }

    @Test
    public void doubleDashCountsAsAnArgument() throws Exception {
        File input = copyResource("/celldesigner_model.xml", "model.xml");
        File output = new File(folder.getRoot(), "out.xml");
        assertEquals(1, CellDesignerToQual.run(new String[]{input.getPath(), "--", output.getPath()}));
        assertFalse(output.exists());
    }

    @Test
    public void failedWriteLeavesNoFile() throws Exception {
        File input = copyResource("/celldesigner_model.xml", "model.xml");
        File output = new File(folder.getRoot(), "broken.sbml");
        Converter failing = new CellDesignerConverter() {
            @Override
            public void write(QualSbml document, OutputStream outputStream) throws IOException {
                outputStream.write("<?xml version=\"1.0\"?><sbml".getBytes(StandardCharsets.UTF_8));
                throw new IOException("marshalling failed");
            }
        };

        assertEquals(1, CellDesignerToQual.run(new String[]{input.getPath(), output.getPath()}, failing));
        assertFalse(output.exists());
    }

    @Test
    public void flagsAreNotAccepted() {
        assertEquals(1, CellDesignerToQual.run(new String[]{"--help"}));
    }

    @Test
    public void convertsFile() throws Exception {
        File input = copyResource("/celldesigner_model.xml", "model.xml");
        File output = new File(folder.getRoot(), "model.sbml");

        assertEquals(0, CellDesignerToQual.run(new String[]{input.getPath(), output.getPath()}));
        assertTrue(output.exists());
        String written = new String(Files.readAllBytes(output.toPath()), "UTF-8");
        assertTrue(written.contains("tr_sa2_in_2"));
    }

    @Test
    public void schemaMismatchWritesNothing() throws Exception {
        File input = copyResource("/sbml_level3.xml", "level3.xml");
        File output = new File(folder.getRoot(), "level3.sbml");

        assertEquals(1, CellDesignerToQual.run(new String[]{input.getPath(), output.getPath()}));
        assertFalse(output.exists());
    }

    @Test
    public void missingInputWritesNothing() {
        File output = new File(folder.getRoot(), "none.sbml");
        assertEquals(1, CellDesignerToQual.run(new String[]{
                new File(folder.getRoot(), "none.xml").getPath(), output.getPath()}));
        assertFalse(output.exists());
    }

    @Test
    public void gzippedInputIsRead() throws Exception {
        File plain = copyResource("/celldesigner_model.xml", "model.xml");
        File gzipped = new File(folder.getRoot(), "model.xml.gz");
        try (OutputStream out = new GZIPOutputStream(new FileOutputStream(gzipped))) {
            Files.copy(plain.toPath(), out);
        }
        File fromPlain = new File(folder.getRoot(), "plain.sbml");
        File fromGzip = new File(folder.getRoot(), "gzip.sbml");

        assertEquals(0, CellDesignerToQual.run(new String[]{plain.getPath(), fromPlain.getPath()}));
        assertEquals(0, CellDesignerToQual.run(new String[]{gzipped.getPath(), fromGzip.getPath()}));
        assertArrayEquals(Files.readAllBytes(fromPlain.toPath()), Files.readAllBytes(fromGzip.toPath()));
    }
}
