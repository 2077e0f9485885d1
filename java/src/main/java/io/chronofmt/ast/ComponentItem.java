package io.chronofmt.ast;

/**
 * A component with resolved modifiers.
 *
 * @param spec the component spec
 */
public record ComponentItem(ComponentSpec spec) implements FormatItem {}
