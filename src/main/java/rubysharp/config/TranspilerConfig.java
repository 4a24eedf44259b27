package rubysharp.config;

import rubysharp.print.KeywordTable;

import java.util.Objects;

/**
 * Settings shared by one transpiler pipeline. Immutable; build with {@link #builder()}.
 */
public final class TranspilerConfig {

	private final StructurePolicy structurePolicy;
	private final KeywordTable keywordTable;
	private final String sourceExtension;
	private final String targetExtension;

	private TranspilerConfig(Builder builder) {
		this.structurePolicy = builder.structurePolicy;
		this.keywordTable = builder.keywordTable;
		this.sourceExtension = builder.sourceExtension;
		this.targetExtension = builder.targetExtension;
	}

	public static Builder builder() { return new Builder(); }

	public static TranspilerConfig defaults() { return builder().build(); }

	public StructurePolicy getStructurePolicy() { return structurePolicy; }
	public KeywordTable getKeywordTable() { return keywordTable; }
	public String getSourceExtension() { return sourceExtension; }
	public String getTargetExtension() { return targetExtension; }

	public static final class Builder {
		private StructurePolicy structurePolicy = StructurePolicy.LENIENT;
		private KeywordTable keywordTable = KeywordTable.csharp();
		private String sourceExtension = ".rb";
		private String targetExtension = ".cs";

		public Builder structurePolicy(StructurePolicy policy) {
			this.structurePolicy = Objects.requireNonNull(policy, "structurePolicy");
			return this;
		}

		public Builder keywordTable(KeywordTable table) {
			this.keywordTable = Objects.requireNonNull(table, "keywordTable");
			return this;
		}

		public Builder sourceExtension(String extension) {
			this.sourceExtension = requireExtension(extension, "sourceExtension");
			return this;
		}

		public Builder targetExtension(String extension) {
			this.targetExtension = requireExtension(extension, "targetExtension");
			return this;
		}

		public TranspilerConfig build() { return new TranspilerConfig(this); }

		private static String requireExtension(String extension, String name) {
			Objects.requireNonNull(extension, name);
			if (!extension.startsWith(".") || extension.length() < 2) {
				throw new IllegalArgumentException(name + " must look like '.ext' but was '" + extension + "'");
			}
			return extension;
		}
	}
}
