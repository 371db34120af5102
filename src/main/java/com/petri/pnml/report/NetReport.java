package com.petri.pnml.report;

import com.petri.pnml.domain.PetriNet;
import com.petri.pnml.validation.ValidationModels.Finding;
import com.petri.pnml.validation.ValidationModels.ValidationResult;

import java.util.List;

public record NetReport(Counts counts, List<MarkedPlace> markedPlaces, List<Finding> errors, List<Finding> warnings) {

    public static NetReport of(PetriNet net, ValidationResult result) {
        Counts counts = new Counts(net.places().size(), net.transitions().size(), net.arcs().size());
        List<MarkedPlace> marked = net.places().values().stream()
                .filter(p -> p.initialMarking() == 1)
                .map(p -> new MarkedPlace(p.id(), p.name()))
                .toList();
        return new NetReport(counts, marked, result.errors(), result.warnings());
    }

    public record Counts(int places, int transitions, int arcs) {}

    public record MarkedPlace(String id, String name) {}
}
