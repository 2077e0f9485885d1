package io.chronofmt.ast;

import java.util.List;

/**
 * Alternatives tried in order; the first that succeeds is used.
 *
 * @param alternatives the nested sequences, at least one
 */
public record FirstItem(List<List<FormatItem>> alternatives) implements FormatItem {
  public FirstItem {
    if (alternatives.isEmpty()) {
      throw new IllegalArgumentException("first needs at least one alternative");
    }
    alternatives = alternatives.stream().map(List::copyOf).toList();
  }
}
