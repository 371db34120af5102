package com.petri.pnml.parser;

import com.petri.pnml.domain.DuplicateElementException;
import com.petri.pnml.domain.NetModels.Arc;
import com.petri.pnml.domain.NetModels.ElementType;
import com.petri.pnml.domain.NetModels.Place;
import com.petri.pnml.domain.NetModels.Transition;
import com.petri.pnml.domain.PetriNet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import java.util.*;
import java.util.regex.Pattern;

import static com.petri.pnml.parser.TagNames.*;

@Component
public class PnmlParser {
    private static final Logger log = LoggerFactory.getLogger(PnmlParser.class);
    private static final Pattern INTEGER = Pattern.compile("[+-]?\\d+");

    public PetriNet parse(Element root) {
        PetriNet net = new PetriNet();
        try {
            for (Element element : selfAndDescendants(root)) {
                switch (TagNames.of(element)) {
                    case PLACE -> net.addPlace(place(element));
                    case TRANSITION -> net.addTransition(transition(element));
                    case ARC -> net.addArc(arc(element));
                    default -> {
                    }
                }
            }
        } catch (DuplicateElementException e) {
            String code = e.elementType() == ElementType.PLACE
                    ? PnmlParseException.DUPLICATE_PLACE
                    : PnmlParseException.DUPLICATE_TRANSITION;
            throw new PnmlParseException(code, e.getMessage(), e.elementId());
        }
        log.info("Parsed net: {} places, {} transitions, {} arcs",
                net.places().size(), net.transitions().size(), net.arcs().size());
        return net;
    }

    private Place place(Element element) {
        String id = required(element, "id");
        String name = firstDescendant(element, NAME)
                .flatMap(label -> firstDescendant(label, TEXT))
                .map(this::labelText)
                .orElse(null);
        long marking = initialMarking(element, id);
        log.debug("place id={} name={} marking={}", id, name, marking);
        return new Place(id, name, marking);
    }

    // first matching direct child, first text inside it
    private long initialMarking(Element place, String placeId) {
        Optional<Element> markingText = children(place).stream()
                .filter(c -> TagNames.of(c).toLowerCase(Locale.ROOT).contains(INITIAL_MARKING))
                .findFirst()
                .flatMap(c -> firstDescendant(c, TEXT));
        if (markingText.isEmpty()) return 0;

        String raw = directText(markingText.get()).trim();
        if (!INTEGER.matcher(raw).matches()) {
            throw new PnmlParseException(PnmlParseException.INVALID_MARKING,
                    "Place " + placeId + " has non-integer initial marking: '" + raw + "'", placeId);
        }
        try {
            return Long.parseLong(raw);
        } catch (NumberFormatException e) {
            throw new PnmlParseException(PnmlParseException.MARKING_OUT_OF_RANGE,
                    "Place " + placeId + " has initial marking out of range: " + raw, placeId);
        }
    }

    // Every text element below the transition is visited; the last non-blank one is kept.
    private Transition transition(Element element) {
        String id = required(element, "id");
        String name = null;
        for (Element text : descendants(element)) {
            if (TagNames.is(text, TEXT)) {
                String value = labelText(text);
                if (value != null) name = value;
            }
        }
        log.debug("transition id={} name={}", id, name);
        return new Transition(id, name);
    }

    private Arc arc(Element element) {
        Arc arc = new Arc(required(element, "id"), required(element, "source"), required(element, "target"));
        log.debug("arc id={} {} -> {}", arc.id(), arc.source(), arc.target());
        return arc;
    }

    private String required(Element element, String attribute) {
        if (!element.hasAttribute(attribute)) {
            String id = element.hasAttribute("id") ? element.getAttribute("id") : null;
            throw new PnmlParseException(PnmlParseException.MISSING_ATTRIBUTE,
                    "<" + TagNames.of(element) + "> is missing required attribute '" + attribute + "'"
                            + (id == null ? "" : " (id=" + id + ")"), id);
        }
        return element.getAttribute(attribute);
    }

    private String labelText(Element text) {
        String value = directText(text);
        if (value.isBlank()) return null;
        return value.trim();
    }

    // text and CDATA children only, nested elements are not included
    private String directText(Element element) {
        StringBuilder sb = new StringBuilder();
        for (Node n = element.getFirstChild(); n != null; n = n.getNextSibling()) {
            if (n.getNodeType() == Node.TEXT_NODE || n.getNodeType() == Node.CDATA_SECTION_NODE) {
                sb.append(n.getNodeValue());
            }
        }
        return sb.toString();
    }

    private Optional<Element> firstDescendant(Element element, String localName) {
        return descendants(element).stream().filter(e -> TagNames.is(e, localName)).findFirst();
    }

    private List<Element> selfAndDescendants(Element root) {
        List<Element> all = new ArrayList<>();
        all.add(root);
        all.addAll(descendants(root));
        return all;
    }

    private List<Element> descendants(Element element) {
        NodeList nodes = element.getElementsByTagName("*");
        List<Element> result = new ArrayList<>(nodes.getLength());
        for (int i = 0; i < nodes.getLength(); i++) {
            result.add((Element) nodes.item(i));
        }
        return result;
    }

    private List<Element> children(Element element) {
        List<Element> result = new ArrayList<>();
        for (Node n = element.getFirstChild(); n != null; n = n.getNextSibling()) {
            if (n.getNodeType() == Node.ELEMENT_NODE) result.add((Element) n);
        }
        return result;
    }
}
