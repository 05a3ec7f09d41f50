package org.javai.pyliteral;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.InputStream;
import java.io.StringReader;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("LiteralOptionsLoader Tests")
class LiteralOptionsLoaderTest {

	private final LiteralOptionsLoader loader = new LiteralOptionsLoader();

	@Nested
	@DisplayName("Reading YAML")
	class ReadingTests {

		@Test
		@DisplayName("should read max_depth and ignore other keys")
		void shouldReadMaxDepth() throws Exception {
			try (InputStream in = getClass().getResourceAsStream("/options/shallow.yml")) {
				assertThat(loader.load(in).maxDepth()).isEqualTo(3);
			}
		}

		@Test
		@DisplayName("should read from a reader")
		void shouldReadFromReader() {
			assertThat(loader.load(new StringReader("max_depth: 12")).maxDepth()).isEqualTo(12);
		}

		@Test
		@DisplayName("should read from a file")
		void shouldReadFromFile(@TempDir Path dir) throws Exception {
			Path file = dir.resolve("pyliteral.yml");
			Files.writeString(file, "max_depth: 64\n");

			assertThat(loader.load(file).maxDepth()).isEqualTo(64);
		}

		@Test
		@DisplayName("should fall back to defaults for empty content or a missing key")
		void shouldFallBackToDefaults() {
			assertThat(loader.loadString("")).isEqualTo(LiteralOptions.defaults());
			assertThat(loader.loadString("other: 1")).isEqualTo(LiteralOptions.defaults());
			assertThat(loader.loadString("").maxDepth()).isEqualTo(LiteralOptions.DEFAULT_MAX_DEPTH);
		}
	}

	@Nested
	@DisplayName("Rejecting invalid YAML")
	class InvalidTests {

		@Test
		@DisplayName("should reject a non-integer depth")
		void shouldRejectNonIntegerDepth() throws Exception {
			try (InputStream in = getClass().getResourceAsStream("/options/invalid-depth.yml")) {
				assertThatThrownBy(() -> loader.load(in))
						.isInstanceOf(IllegalArgumentException.class)
						.hasMessage("max_depth must be an integer, found: deep");
			}
		}

		@Test
		@DisplayName("should reject a depth below one")
		void shouldRejectZeroDepth() {
			assertThatThrownBy(() -> loader.loadString("max_depth: 0"))
					.isInstanceOf(IllegalArgumentException.class)
					.hasMessageContaining("maxDepth must be at least 1");
		}

		@Test
		@DisplayName("should reject a document that is not a mapping")
		void shouldRejectNonMapping() {
			assertThatThrownBy(() -> loader.loadString("- 1\n- 2\n"))
					.isInstanceOf(IllegalArgumentException.class)
					.hasMessageStartingWith("Literal options must be a YAML mapping");
		}

		@Test
		@DisplayName("should wrap malformed YAML")
		void shouldWrapMalformedYaml() {
			assertThatThrownBy(() -> loader.loadString("max_depth: [1"))
					.isInstanceOf(IllegalArgumentException.class)
					.hasMessage("Failed to parse literal options from string");
		}

		@Test
		@DisplayName("should report a missing file")
		void shouldReportMissingFile(@TempDir Path dir) {
			Path missing = dir.resolve("absent.yml");

			assertThatThrownBy(() -> loader.load(missing))
					.isInstanceOf(IllegalArgumentException.class)
					.hasMessage("Failed to read literal options from path: " + missing);
		}
	}

	@Nested
	@DisplayName("Classpath lookup")
	class ClasspathTests {

		@Test
		@DisplayName("should load the bundled resource")
		void shouldLoadBundledResource() {
			assertThat(loader.loadFromClasspath(null).maxDepth()).isEqualTo(256);
		}

		@Test
		@DisplayName("should use defaults when the resource is absent")
		void shouldUseDefaultsWhenAbsent() throws Exception {
			try (URLClassLoader empty = new URLClassLoader(new URL[0], null)) {
				assertThat(loader.loadFromClasspath(empty)).isEqualTo(LiteralOptions.defaults());
			}
		}
	}

	@Test
	@DisplayName("options should validate and copy")
	void optionsValidate() {
		assertThat(LiteralOptions.defaults().withMaxDepth(5).maxDepth()).isEqualTo(5);
		assertThatThrownBy(() -> new LiteralOptions(-1)).isInstanceOf(IllegalArgumentException.class);
	}
}
