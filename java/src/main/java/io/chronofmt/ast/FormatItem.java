package io.chronofmt.ast;

/**
 * One compiled instruction of a format description.
 *
 * <ul>
 *   <li>{@link LiteralItem} - text written and matched verbatim
 *   <li>{@link ComponentItem} - a date/time field
 *   <li>{@link OptionalItem} - a group skipped as a whole when it fails
 *   <li>{@link FirstItem} - alternatives tried in order
 * </ul>
 */
public sealed interface FormatItem permits LiteralItem, ComponentItem, OptionalItem, FirstItem {}
