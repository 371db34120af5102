package com.petri.pnml.domain;

import com.petri.pnml.domain.NetModels.ElementType;

public class DuplicateElementException extends RuntimeException {
    private final ElementType elementType;
    private final String elementId;

    public DuplicateElementException(ElementType elementType, String elementId) {
        super("Duplicate " + elementType.name().toLowerCase() + " id: " + elementId);
        this.elementType = elementType;
        this.elementId = elementId;
    }

    public ElementType elementType() {
        return elementType;
    }

    public String elementId() {
        return elementId;
    }
}
