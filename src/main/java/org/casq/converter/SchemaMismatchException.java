package org.casq.converter;

/**
 * The input document is not an SBML Level 2 Version 4 model.
 */
public class SchemaMismatchException extends Exception {
    public SchemaMismatchException(String message) {
        super(message);
    }
}
