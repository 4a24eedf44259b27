package rubysharp.ast.ruby;

import rubysharp.ast.SourceSpan;

/**
 * Leaf node wrapping one literal token. Rendered under the {@code code} kind.
 */
public record RubyFragment(String value, SourceSpan span) implements RubyNode {
}
