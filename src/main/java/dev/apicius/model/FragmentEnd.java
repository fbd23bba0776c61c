package dev.apicius.model;

/**
 * How a rule ends.
 */
public sealed interface FragmentEnd {

    /** Rule feeds into join point {@code $name}. */
    record Join(TextHandle name) implements FragmentEnd {}

    /** Rule reaches the end of the recipe, written {@code <>}. */
    record Terminal() implements FragmentEnd {}

    /** Rule stops without reaching a join point or {@code <>}. */
    record Open() implements FragmentEnd {}
}
