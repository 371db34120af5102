package com.petri.pnml.validation;

import com.petri.pnml.domain.NetModels.ElementType;

import java.util.List;

public class ValidationModels {
    public static final String UNKNOWN_SOURCE = "UNKNOWN_SOURCE";
    public static final String UNKNOWN_TARGET = "UNKNOWN_TARGET";
    public static final String NON_BINARY_MARKING = "NON_BINARY_MARKING";

    // reference: dangling endpoint id for arc findings, marking value for place findings
    public record Finding(String code, String message, ElementType elementType, String elementId, String reference) {}

    public record ValidationResult(List<Finding> errors, List<Finding> warnings) {
        public boolean valid() {
            return errors.isEmpty();
        }
    }
}
