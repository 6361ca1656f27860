package ca.gc.cra.warden.config;

import ca.gc.cra.warden.domain.trust.TrustCatalog;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Builds the {@link TrustCatalog} for a run from a YAML catalog file plus operator-supplied additions.
 *
 * <p>The catalog document has a single {@code trustedDomains} list. When no file is configured the
 * bundled {@value #BUNDLED_RESOURCE} resource is used.</p>
 */
public final class TrustCatalogLoader {
  private static final Logger log = LoggerFactory.getLogger(TrustCatalogLoader.class);
  /** Classpath location of the default catalog. */
  public static final String BUNDLED_RESOURCE = "/trusted-domains.yaml";
  private static final String LIST_KEY = "trustedDomains";

  private TrustCatalogLoader() {}

  /**
   * Loads the catalog.
   *
   * @param file optional catalog file replacing the bundled defaults
   * @param additional extra patterns appended after the file entries
   * @return immutable catalog
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the document is malformed, a pattern is invalid or the catalog is empty
   */
  public static TrustCatalog load(Optional<Path> file, List<String> additional) throws IOException {
    Objects.requireNonNull(file, "file");
    List<String> patterns = new ArrayList<>();
    if (file.isPresent()) {
      Path path = file.get();
      try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
        patterns.addAll(parse(reader, path.toString()));
      }
      log.info("Loaded {} trusted pattern(s) from {}", patterns.size(), path);
    } else {
      patterns.addAll(bundledPatterns());
      log.debug("Loaded {} bundled trusted pattern(s)", patterns.size());
    }
    if (additional != null) {
      patterns.addAll(additional);
    }
    return TrustCatalog.load(patterns);
  }

  /**
   * Returns the patterns shipped with WARDEN.
   *
   * @return bundled patterns in file order
   * @throws IOException when the resource cannot be read
   */
  public static List<String> bundledPatterns() throws IOException {
    try (InputStream in = TrustCatalogLoader.class.getResourceAsStream(BUNDLED_RESOURCE)) {
      if (in == null) {
        throw new IOException("Bundled trust catalog missing from classpath: " + BUNDLED_RESOURCE);
      }
      return parse(new InputStreamReader(in, StandardCharsets.UTF_8), BUNDLED_RESOURCE);
    }
  }

  static List<String> parse(Reader reader, String source) {
    Object document;
    try {
      document = new Yaml().load(reader);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse trust catalog " + source, ex);
    }
    if (!(document instanceof Map<?, ?> root)) {
      throw new IllegalArgumentException("Trust catalog " + source + " must be a mapping with a " + LIST_KEY + " list");
    }
    Object list = root.get(LIST_KEY);
    if (!(list instanceof List<?> entries)) {
      throw new IllegalArgumentException("Trust catalog " + source + " must define a " + LIST_KEY + " list");
    }
    List<String> patterns = new ArrayList<>(entries.size());
    for (Object entry : entries) {
      if (entry == null) {
        continue;
      }
      if (entry instanceof Map<?, ?> || entry instanceof List<?>) {
        throw new IllegalArgumentException("Trust catalog " + source + " entries must be strings");
      }
      patterns.add(entry.toString());
    }
    return patterns;
  }
}
