package com.petri.pnml.validation;

import com.petri.pnml.domain.NetModels.Arc;
import com.petri.pnml.domain.NetModels.ElementType;
import com.petri.pnml.domain.NetModels.Place;
import com.petri.pnml.domain.PetriNet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

import static com.petri.pnml.validation.ValidationModels.*;

@Component
public class PetriNetValidator {
    private static final Logger log = LoggerFactory.getLogger(PetriNetValidator.class);

    public ValidationResult validate(PetriNet net) {
        List<Finding> errors = new ArrayList<>();
        for (Arc a : net.arcs()) {
            if (!net.hasNode(a.source())) {
                errors.add(new Finding(UNKNOWN_SOURCE, "Arc " + a.id() + " has unknown source " + a.source(), ElementType.ARC, a.id(), a.source()));
            }
            if (!net.hasNode(a.target())) {
                errors.add(new Finding(UNKNOWN_TARGET, "Arc " + a.id() + " has unknown target " + a.target(), ElementType.ARC, a.id(), a.target()));
            }
        }

        List<Finding> warnings = new ArrayList<>();
        for (Place p : net.places().values()) {
            if (p.initialMarking() != 0 && p.initialMarking() != 1) {
                warnings.add(new Finding(NON_BINARY_MARKING, "Place " + p.id() + " has marking " + p.initialMarking() + " (not 0/1)",
                        ElementType.PLACE, p.id(), String.valueOf(p.initialMarking())));
            }
        }

        log.debug("Validation finished: {} errors, {} warnings", errors.size(), warnings.size());
        return new ValidationResult(List.copyOf(errors), List.copyOf(warnings));
    }
}
