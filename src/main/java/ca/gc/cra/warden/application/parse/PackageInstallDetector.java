package ca.gc.cra.warden.application.parse;

import ca.gc.cra.warden.domain.events.PackageInstallCommand;
import ca.gc.cra.warden.domain.events.PackageManager;
import ca.gc.cra.warden.domain.log.StreamKind;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recognizes package installation commands ({@code pip}, {@code python -m pip}, notebook magics,
 * {@code conda}, {@code mamba}) and pip's {@code Installing collected packages} and
 * {@code Successfully installed} progress lines.
 */
final class PackageInstallDetector {
  private static final Pattern INSTALL = Pattern.compile(
      "(?i)(?:^|[\\s;&|(!%'\"`])"
          + "(pip3?(?:\\.\\d+)?|python(?:3(?:\\.\\d+)?)?\\s+-m\\s+pip|conda|mamba|micromamba)"
          + "\\s+install(?=\\s|$)(.*)");
  private static final Pattern INSTALLED =
      Pattern.compile("\\b(?:Successfully installed|Installing collected packages:)\\s+(.*)");
  private static final Set<String> SEPARATORS = Set.of(";", "&&", "||", "|", ">", ">>", "2>&1", "&");
  private static final Set<String> VALUE_FLAGS = Set.of(
      "-r", "--requirement", "-c", "--constraint", "-i", "--index-url", "--extra-index-url",
      "-f", "--find-links", "-t", "--target", "--prefix", "--root", "--trusted-host",
      "--platform", "--python-version", "--implementation", "--abi", "--src", "-e", "--editable",
      "--channel", "-n", "--name", "-p", "--file", "--proxy", "--cert", "--client-cert",
      "--log", "--cache-dir", "--progress-bar", "--upgrade-strategy");
  private static final String QUOTES = "\"'`()[],";

  Optional<PackageInstallCommand> detect(
      String line, String sanitizedLine, int lineNumber, StreamKind streamKind) {
    Matcher install = INSTALL.matcher(line);
    if (install.find()) {
      String manager = install.group(1).toLowerCase(Locale.ROOT);
      PackageManager family = managerFamily(manager);
      List<String> packages = packageArguments(install.group(2));
      return Optional.of(new PackageInstallCommand(family, sanitizedLine, packages, lineNumber, streamKind));
    }
    Matcher installed = INSTALLED.matcher(line);
    if (installed.find()) {
      List<String> packages = packageArguments(installed.group(1));
      return Optional.of(
          new PackageInstallCommand(PackageManager.PIP, sanitizedLine, packages, lineNumber, streamKind));
    }
    return Optional.empty();
  }

  private static PackageManager managerFamily(String manager) {
    if (manager.contains("pip")) {
      return PackageManager.PIP;
    }
    return manager.equals("conda") ? PackageManager.CONDA : PackageManager.OTHER;
  }

  /**
   * Extracts package specifiers from the text following {@code install}.
   *
   * @param arguments remainder of the command line
   * @return specifiers in order; flags and flag values are skipped
   */
  static List<String> packageArguments(String arguments) {
    List<String> packages = new ArrayList<>();
    if (arguments == null || arguments.isBlank()) {
      return packages;
    }
    boolean skipNext = false;
    for (String raw : arguments.trim().split("\\s+")) {
      if (SEPARATORS.contains(raw) || raw.startsWith("#")) {
        break;
      }
      boolean last = false;
      int cut = firstSeparator(raw);
      if (cut >= 0) {
        raw = raw.substring(0, cut);
        last = true;
      }
      if (skipNext) {
        skipNext = false;
      } else if (raw.startsWith("-")) {
        skipNext = VALUE_FLAGS.contains(raw.toLowerCase(Locale.ROOT));
      } else {
        String token = strip(raw);
        if (!token.isEmpty() && !token.startsWith("-")) {
          packages.add(token);
        }
      }
      if (last) {
        break;
      }
    }
    return packages;
  }

  private static int firstSeparator(String token) {
    int best = -1;
    for (String separator : new String[] {";", "&&", "||", "|", ">"}) {
      int idx = token.indexOf(separator);
      if (idx >= 0 && (best < 0 || idx < best)) {
        best = idx;
      }
    }
    return best;
  }

  private static String strip(String token) {
    int start = 0;
    int end = token.length();
    while (start < end && QUOTES.indexOf(token.charAt(start)) >= 0) {
      start++;
    }
    while (end > start && QUOTES.indexOf(token.charAt(end - 1)) >= 0) {
      end--;
    }
    return token.substring(start, end);
  }
}
