package com.petri.pnml.domain;

public class NetModels {
    public record Place(String id, String name, long initialMarking) {}
    public record Transition(String id, String name) {}
    public record Arc(String id, String source, String target) {}

    public enum ElementType { PLACE, TRANSITION, ARC }
}
