package org.javai.pyliteral;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads {@link LiteralOptions} from YAML.
 *
 * <pre>
 * max_depth: 128
 * </pre>
 *
 * Keys that are absent fall back to {@link LiteralOptions#defaults()}; unknown keys are ignored.
 */
public class LiteralOptionsLoader {

	private static final Logger logger = LoggerFactory.getLogger(LiteralOptionsLoader.class);

	public static final String DEFAULT_RESOURCE = "META-INF/pyliteral.yml";

	private final Yaml yaml = new Yaml();

	public LiteralOptions load(Path path) {
		try (var reader = Files.newBufferedReader(path)) {
			return load(reader);
		} catch (IOException e) {
			throw new IllegalArgumentException("Failed to read literal options from path: " + path, e);
		}
	}

	public LiteralOptions load(InputStream inputStream) {
		try {
			return build(yaml.load(inputStream));
		} catch (YAMLException | ClassCastException e) {
			throw new IllegalArgumentException("Failed to parse literal options from input stream", e);
		}
	}

	public LiteralOptions load(Reader reader) {
		try {
			return build(yaml.load(reader));
		} catch (YAMLException | ClassCastException e) {
			throw new IllegalArgumentException("Failed to parse literal options from reader", e);
		}
	}

	public LiteralOptions loadString(String yamlContent) {
		try {
			return build(yaml.load(yamlContent));
		} catch (YAMLException | ClassCastException e) {
			throw new IllegalArgumentException("Failed to parse literal options from string", e);
		}
	}

	/**
	 * Loads {@value #DEFAULT_RESOURCE} from the given class loader, or returns the defaults when
	 * the resource is not present.
	 */
	public LiteralOptions loadFromClasspath(ClassLoader loader) {
		ClassLoader effective = loader != null ? loader : LiteralOptionsLoader.class.getClassLoader();
		InputStream stream = effective.getResourceAsStream(DEFAULT_RESOURCE);
		if (stream == null) {
			logger.debug("No {} on classpath; using default literal options", DEFAULT_RESOURCE);
			return LiteralOptions.defaults();
		}
		try (stream) {
			LiteralOptions options = load(stream);
			logger.debug("Loaded literal options from {}: {}", DEFAULT_RESOURCE, options);
			return options;
		} catch (IOException e) {
			throw new IllegalArgumentException("Failed to close " + DEFAULT_RESOURCE, e);
		}
	}

	private LiteralOptions build(Object data) {
		if (data == null) {
			return LiteralOptions.defaults();
		}
		if (!(data instanceof Map<?, ?> map)) {
			throw new IllegalArgumentException("Literal options must be a YAML mapping, found: "
					+ data.getClass().getSimpleName());
		}
		Object maxDepth = map.get("max_depth");
		if (maxDepth == null) {
			return LiteralOptions.defaults();
		}
		if (!(maxDepth instanceof Integer depth)) {
			throw new IllegalArgumentException("max_depth must be an integer, found: " + maxDepth);
		}
		return new LiteralOptions(depth);
	}
}
