package ca.gc.cra.warden.domain.events;

/**
 * Package manager that issued an install command.
 *
 * @since 0.1.0
 */
public enum PackageManager {
  PIP,
  CONDA,
  /** Other conda-compatible installers such as {@code mamba} and {@code micromamba}. */
  OTHER
}
