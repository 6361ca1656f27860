package ca.gc.cra.warden.application.port;

import ca.gc.cra.warden.domain.log.LogBundle;
import java.io.IOException;
import java.util.List;

/**
 * Driven port that supplies the session log bundles to analyze.
 *
 * <p>Implementations own retrieval; files they cannot read become bundle retrieval warnings rather
 * than failures.</p>
 *
 * @since 0.1.0
 */
public interface LogBundleSource {
  /**
   * Loads every available bundle.
   *
   * @return bundles in source order
   * @throws IOException when the source itself cannot be read
   */
  List<LogBundle> load() throws IOException;
}
