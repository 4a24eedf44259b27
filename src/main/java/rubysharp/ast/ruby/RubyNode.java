package rubysharp.ast.ruby;

import rubysharp.ast.SourceSpan;

public sealed interface RubyNode permits RubyBlock, RubyFragment {
	SourceSpan span();
}
