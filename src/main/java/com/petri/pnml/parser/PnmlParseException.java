package com.petri.pnml.parser;

public class PnmlParseException extends RuntimeException {
    public static final String MISSING_ATTRIBUTE = "MISSING_ATTRIBUTE";
    public static final String DUPLICATE_PLACE = "DUPLICATE_PLACE";
    public static final String DUPLICATE_TRANSITION = "DUPLICATE_TRANSITION";
    public static final String INVALID_MARKING = "INVALID_MARKING";
    public static final String MARKING_OUT_OF_RANGE = "MARKING_OUT_OF_RANGE";
    public static final String MALFORMED_XML = "MALFORMED_XML";
    public static final String UNREADABLE_DOCUMENT = "UNREADABLE_DOCUMENT";

    private final String code;
    private final String elementId;

    public PnmlParseException(String code, String message, String elementId) {
        super(message);
        this.code = code;
        this.elementId = elementId;
    }

    public PnmlParseException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.elementId = null;
    }

    public String code() {
        return code;
    }

    public String elementId() {
        return elementId;
    }
}
