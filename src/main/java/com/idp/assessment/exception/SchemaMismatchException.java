package com.idp.assessment.exception;

/**
 * The extraction result disagrees with the attribute schema at some node,
 * e.g. a group attribute whose value is not a JSON object.
 */
public class SchemaMismatchException extends AssessmentException {

    private final String path;

    public SchemaMismatchException(String path, String message) {
        super("Extraction result does not match schema at '" + path + "': " + message);
        this.path = path;
    }

    /** Rendered path of the offending node ("$" for the root). */
    public String getPath() {
        return path;
    }
}
