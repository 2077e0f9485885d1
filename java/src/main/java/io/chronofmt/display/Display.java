package io.chronofmt.display;

import io.chronofmt.ast.ComponentItem;
import io.chronofmt.ast.ComponentSpec;
import io.chronofmt.ast.FirstItem;
import io.chronofmt.ast.FormatItem;
import io.chronofmt.ast.LiteralItem;
import io.chronofmt.ast.ModifierKey;
import io.chronofmt.ast.ModifierValue;
import io.chronofmt.ast.OptionalItem;
import io.chronofmt.lexer.Ascii;
import java.util.List;
import java.util.Map;

/** Renders compiled format items as a canonical format description. */
public final class Display {
  private Display() {}

  /**
   * Renders format items as a description that compiles back to equal items.
   *
   * <p>Components list only their non-default modifiers. Version 2 output starts with a {@code
   * version = 2, } directive.
   *
   * @param items the compiled items
   * @param version the grammar version to write, 1 or 2
   * @return the canonical description
   * @throws IllegalArgumentException if version 1 is requested for items holding optional or
   *     first groups
   */
  public static String render(List<FormatItem> items, int version) {
    if (version != 1 && version != 2) {
      throw new IllegalArgumentException("unsupported version " + version);
    }
    StringBuilder body = new StringBuilder();
    renderItems(items, version, body);

    if (version == 2 || looksLikeDirective(body)) {
      return "version = " + version + ", " + body;
    }
    return body.toString();
  }

  /** Returns true if the text would be read as a {@code version = N,} directive. */
  private static boolean looksLikeDirective(CharSequence text) {
    if (text.length() < 7 || !text.subSequence(0, 7).toString().equals("version")) {
      return false;
    }
    int i = 7;
    while (i < text.length() && Ascii.isWhitespace(text.charAt(i))) {
      i++;
    }
    return i < text.length() && text.charAt(i) == '=';
  }

  private static void renderItems(List<FormatItem> items, int version, StringBuilder sb) {
    for (FormatItem item : items) {
      if (item instanceof LiteralItem literal) {
        renderLiteral(literal.value(), version, sb);
      } else if (item instanceof ComponentItem component) {
        renderComponent(component.spec(), sb);
      } else if (item instanceof OptionalItem optional) {
        requireVersion2(version, "optional");
        sb.append("[optional ");
        renderNested(optional.items(), sb);
        sb.append(']');
      } else if (item instanceof FirstItem first) {
        requireVersion2(version, "first");
        sb.append("[first");
        for (List<FormatItem> alternative : first.alternatives()) {
          sb.append(' ');
          renderNested(alternative, sb);
        }
        sb.append(']');
      } else {
        throw new IllegalStateException("unknown format item: " + item);
      }
    }
  }

  private static void renderNested(List<FormatItem> items, StringBuilder sb) {
    sb.append('[');
    renderItems(items, 2, sb);
    sb.append(']');
  }

  private static void requireVersion2(int version, String keyword) {
    if (version < 2) {
      throw new IllegalArgumentException("`" + keyword + "` needs format description version 2");
    }
  }

  private static void renderLiteral(String value, int version, StringBuilder sb) {
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      if (version == 1) {
        sb.append(c == '[' ? "[[" : String.valueOf(c));
      } else if (c == '[' || c == ']' || c == '\\') {
        sb.append('\\').append(c);
      } else {
        sb.append(c);
      }
    }
  }

  private static void renderComponent(ComponentSpec spec, StringBuilder sb) {
    sb.append('[').append(spec.kind().displayName());
    for (Map.Entry<ModifierKey, ModifierValue> modifier : spec.modifiers().entrySet()) {
      if (spec.isExplicit(modifier.getKey())) {
        sb.append(' ')
            .append(modifier.getKey().token())
            .append(':')
            .append(modifier.getValue().token());
      }
    }
    sb.append(']');
  }
}
