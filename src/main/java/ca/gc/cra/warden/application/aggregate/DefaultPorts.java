package ca.gc.cra.warden.application.aggregate;

import java.util.Map;
import java.util.Optional;

/**
 * Well-known ports for schemes commonly seen in Spark session logs.
 */
final class DefaultPorts {
  private static final Map<String, Integer> PORTS = Map.ofEntries(
      Map.entry("http", 80),
      Map.entry("ws", 80),
      Map.entry("https", 443),
      Map.entry("wss", 443),
      Map.entry("abfs", 443),
      Map.entry("abfss", 443),
      Map.entry("wasb", 443),
      Map.entry("wasbs", 443),
      Map.entry("s3", 443),
      Map.entry("s3a", 443),
      Map.entry("gs", 443),
      Map.entry("ftp", 21),
      Map.entry("sftp", 22),
      Map.entry("ssh", 22),
      Map.entry("mongodb", 27017),
      Map.entry("redis", 6379),
      Map.entry("kafka", 9092),
      Map.entry("jdbc:sqlserver", 1433),
      Map.entry("jdbc:postgresql", 5432),
      Map.entry("jdbc:mysql", 3306),
      Map.entry("jdbc:mariadb", 3306),
      Map.entry("jdbc:oracle", 1521));

  private DefaultPorts() {}

  static Optional<Integer> forScheme(Optional<String> scheme) {
    return scheme.map(PORTS::get);
  }
}
