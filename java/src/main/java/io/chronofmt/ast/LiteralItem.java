package io.chronofmt.ast;

/**
 * Literal text.
 *
 * @param value the text
 */
public record LiteralItem(String value) implements FormatItem {}
