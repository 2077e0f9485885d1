package io.chronofmt.ast;

import java.util.List;

/**
 * A nested sequence that is dropped (when rendering) or skipped (when parsing) if any part of it
 * fails.
 *
 * @param items the nested items
 */
public record OptionalItem(List<FormatItem> items) implements FormatItem {
  public OptionalItem {
    items = List.copyOf(items);
  }
}
