package com.petri.pnml.parser;

import org.w3c.dom.Node;

public final class TagNames {
    public static final String PLACE = "place";
    public static final String TRANSITION = "transition";
    public static final String ARC = "arc";
    public static final String NAME = "name";
    public static final String TEXT = "text";
    public static final String INITIAL_MARKING = "initialmarking";

    private TagNames() {
    }

    // {uri}local and prefix:local both reduce to local
    public static String localName(String tag) {
        if (tag == null) return null;
        int brace = tag.indexOf('}');
        if (tag.startsWith("{") && brace > 0) {
            return tag.substring(brace + 1);
        }
        int colon = tag.indexOf(':');
        return colon >= 0 ? tag.substring(colon + 1) : tag;
    }

    public static String of(Node node) {
        return localName(node.getNodeName());
    }

    public static boolean is(Node node, String localName) {
        return localName.equals(of(node));
    }
}
