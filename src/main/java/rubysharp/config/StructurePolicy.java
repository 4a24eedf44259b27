package rubysharp.config;

/**
 * How structural losses are handled.
 */
public enum StructurePolicy {
	/** Drop unclosed blocks and unrenderable kinds without failing. Matches the original tool. */
	LENIENT,
	/** Report unclosed blocks and unrenderable kinds as exceptions. */
	STRICT;
}
