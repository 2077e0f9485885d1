package io.chronofmt;

import io.chronofmt.parsing.Parsed;

/**
 * The result of parsing a prefix of some input.
 *
 * @param parsed the fields decoded from the prefix
 * @param consumed the number of input bytes matched
 */
public record PartialParse(Parsed parsed, int consumed) {}
