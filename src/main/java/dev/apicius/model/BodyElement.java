package dev.apicius.model;

/**
 * An element between a rule's start and its end.
 */
public sealed interface BodyElement {

    record Step(ActionStep step) implements BodyElement {}

    /** A join point passed through mid-rule; the rule continues past it. */
    record Join(TextHandle name) implements BodyElement {}
}
