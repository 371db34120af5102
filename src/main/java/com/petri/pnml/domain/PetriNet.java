package com.petri.pnml.domain;

import com.petri.pnml.domain.NetModels.Arc;
import com.petri.pnml.domain.NetModels.ElementType;
import com.petri.pnml.domain.NetModels.Place;
import com.petri.pnml.domain.NetModels.Transition;

import java.util.*;

public class PetriNet {
    private final Map<String, Place> places = new LinkedHashMap<>();
    private final Map<String, Transition> transitions = new LinkedHashMap<>();
    private final List<Arc> arcs = new ArrayList<>();

    public void addPlace(Place place) {
        if (places.containsKey(place.id())) {
            throw new DuplicateElementException(ElementType.PLACE, place.id());
        }
        places.put(place.id(), place);
    }

    public void addTransition(Transition transition) {
        if (transitions.containsKey(transition.id())) {
            throw new DuplicateElementException(ElementType.TRANSITION, transition.id());
        }
        transitions.put(transition.id(), transition);
    }

    public void addArc(Arc arc) {
        arcs.add(arc);
    }

    public Map<String, Place> places() {
        return Collections.unmodifiableMap(places);
    }

    public Map<String, Transition> transitions() {
        return Collections.unmodifiableMap(transitions);
    }

    public List<Arc> arcs() {
        return Collections.unmodifiableList(arcs);
    }

    public Optional<Place> place(String id) {
        return Optional.ofNullable(places.get(id));
    }

    public Optional<Transition> transition(String id) {
        return Optional.ofNullable(transitions.get(id));
    }

    public boolean hasNode(String id) {
        return places.containsKey(id) || transitions.containsKey(id);
    }
}
