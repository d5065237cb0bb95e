package org.casq;

import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Options;
import org.apache.commons.lang3.StringUtils;
import org.casq.converter.CellDesignerConverter;
import org.casq.converter.Converter;
import org.casq.converter.SchemaMismatchException;
import org.casq.qual.QualSbml;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.zip.GZIPInputStream;

public class CellDesignerToQual {
    private static Logger log = LoggerFactory.getLogger(CellDesignerToQual.class);
    private static final String helpText = CellDesignerToQual.class.getSimpleName()
            + " <celldesignerinfile.xml> <sbmlqualoutfile.xml>";

    public static void main( String[] args ) {
        int status = run(args);
        if (status != 0) {
            System.exit(status);
        }
    }

    static int run(String[] args) {
        return run(args, new CellDesignerConverter());
    }

    static int run(String[] args, Converter converter) {
        // input and output file names are both required, nothing else is accepted;
        // paths are taken as given, so a leading '-' is not an option
        if (args.length != 2) {
            printUsage(new Options());
            return 1;
        }
        String inputFile = args[0];
        String outputFile = args[1];

        try {
            log.info("parsing " + inputFile + "…");
            QualSbml document;
            try (InputStream inputStream = inputDataStream(inputFile)) {
                document = converter.convert(inputStream);
            }

            // marshal in memory so a failed write never leaves a partial file behind
            ByteArrayOutputStream buffer = new ByteArrayOutputStream();
            converter.write(document, buffer);
            log.info("Done with the conversion. Writing SBML-qual to: " + outputFile);
            try (OutputStream outputStream = new FileOutputStream(outputFile)) {
                buffer.writeTo(outputStream);
            }
            log.info("All done.");
        } catch (SchemaMismatchException e) {
            log.error(e.getMessage());
            return 1;
        } catch (IOException e) {
            log.error("Conversion of " + inputFile + " failed", e);
            return 1;
        }
        return 0;
    }

    static InputStream inputDataStream(String fileName) throws IOException {
        InputStream inputStream = new FileInputStream(fileName);
        if (StringUtils.endsWith(fileName, ".gz")) {
            inputStream = new GZIPInputStream(inputStream);
        }
        return inputStream;
    }

    private static void printUsage(Options options) {
        HelpFormatter helpFormatter = new HelpFormatter();
        helpFormatter.printHelp(helpText, options);
    }
}
