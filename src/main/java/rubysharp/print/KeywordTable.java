package rubysharp.print;

import rubysharp.exception.KeywordTableException;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import java.util.TreeMap;

/**
 * Exact-match mapping from source keywords to target-syntax fragments.
 *
 * Tables are immutable and are handed to the printer at construction, so
 * several target syntaxes can coexist in one JVM.
 */
public final class KeywordTable {
	public static final String CSHARP_RESOURCE = "rubysharp/keywords/csharp.properties";

	private static final KeywordTable CSHARP;

	static {
		try {
			CSHARP = fromResource(CSHARP_RESOURCE);
		} catch (IOException e) {
			throw new UncheckedIOException("Bundled keyword table is missing", e);
		}
	}

	private final Map<String, String> mappings;

	private KeywordTable(Map<String, String> mappings) {
		this.mappings = Map.copyOf(mappings);
	}

	public static KeywordTable csharp() {
		return CSHARP;
	}

	public static KeywordTable of(Map<String, String> mappings) {
		Objects.requireNonNull(mappings, "mappings");
		return new KeywordTable(mappings);
	}

	public static KeywordTable fromProperties(Properties properties) {
		Map<String, String> m = new LinkedHashMap<>();
		for (String key : properties.stringPropertyNames()) {
			m.put(key, properties.getProperty(key));
		}
		return new KeywordTable(m);
	}

	public static KeywordTable load(Path file) throws IOException {
		try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
			return read(reader, file.toString());
		}
	}

	public static KeywordTable fromResource(String resource) throws IOException {
		ClassLoader loader = KeywordTable.class.getClassLoader();
		try (InputStream in = loader.getResourceAsStream(resource)) {
			if (in == null) {
				throw new IOException("Keyword table resource not found: " + resource);
			}
			return read(new InputStreamReader(in, StandardCharsets.UTF_8), resource);
		}
	}

	private static KeywordTable read(Reader reader, String origin) throws IOException {
		Properties properties = new Properties();
		try {
			properties.load(reader);
		} catch (IllegalArgumentException e) {
			throw new KeywordTableException("Malformed keyword table " + origin + ": " + e.getMessage(), e);
		}
		return fromProperties(properties);
	}

	/**
	 * The target fragment for {@code keyword}, or {@code keyword} itself when the
	 * table has no entry for it.
	 */
	public String translate(String keyword) {
		return mappings.getOrDefault(keyword, keyword);
	}

	/**
	 * The target fragment for a keyword the printer cannot do without.
	 *
	 * @throws KeywordTableException if the table has no entry for it
	 */
	public String require(String keyword) {
		String value = mappings.get(keyword);
		if (value == null) {
			throw new KeywordTableException("Keyword table has no entry for '" + keyword + "'");
		}
		return value;
	}

	public boolean contains(String keyword) {
		return mappings.containsKey(keyword);
	}

	public Map<String, String> asMap() {
		return mappings;
	}

	@Override
	public boolean equals(Object o) {
		return o instanceof KeywordTable other && mappings.equals(other.mappings);
	}

	@Override
	public int hashCode() {
		return mappings.hashCode();
	}

	@Override
	public String toString() {
		return "KeywordTable" + new TreeMap<>(mappings);
	}
}
