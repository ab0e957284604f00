package io.intellixity.sealquery.spi.engine;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Properties;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Workspace credentials and engine selection.
 * <p>
 * {@link #load()} layers, lowest precedence first:
 * <ol>
 *   <li>{@code sealquery.properties} on the classpath</li>
 *   <li>{@code sealquery.properties} in the working directory</li>
 *   <li>environment variables ({@code CS_WORKSPACE_CRN}, {@code CS_CLIENT_ID}, {@code CS_CLIENT_KEY},
 *       {@code CS_CLIENT_ACCESS_KEY}, {@code STASH_LOG_LEVEL})</li>
 * </ol>
 */
public class ClientConfig {
  public static final String FILE_NAME = "sealquery.properties";

  private static final Pattern CRN = Pattern.compile("crn:[^:]+:([^:]+)$");

  private static final Map<String, String> ENV_KEYS = Map.of(
      "CS_WORKSPACE_CRN", "sealquery.workspace-crn",
      "CS_CLIENT_ID", "sealquery.client-id",
      "CS_CLIENT_KEY", "sealquery.client-key",
      "CS_CLIENT_ACCESS_KEY", "sealquery.access-key",
      "STASH_LOG_LEVEL", "sealquery.log-level"
  );

  private String workspaceCrn;
  private String clientId;
  private String clientKey;
  private String accessKey;
  private String keysetName;
  private String keysetId;
  private String engine;
  private String logLevel = "info";

  public String getWorkspaceCrn() { return workspaceCrn; }
  public void setWorkspaceCrn(String workspaceCrn) { this.workspaceCrn = workspaceCrn; }
  public String getClientId() { return clientId; }
  public void setClientId(String clientId) { this.clientId = clientId; }
  public String getClientKey() { return clientKey; }
  public void setClientKey(String clientKey) { this.clientKey = clientKey; }
  public String getAccessKey() { return accessKey; }
  public void setAccessKey(String accessKey) { this.accessKey = accessKey; }
  public String getKeysetName() { return keysetName; }
  public void setKeysetName(String keysetName) { this.keysetName = keysetName; }
  public String getKeysetId() { return keysetId; }
  public void setKeysetId(String keysetId) { this.keysetId = keysetId; }

  /** Provider id to use when more than one {@link EncryptionEngineProvider} is registered. */
  public String getEngine() { return engine; }
  public void setEngine(String engine) { this.engine = engine; }
  public String getLogLevel() { return logLevel; }
  public void setLogLevel(String logLevel) { this.logLevel = logLevel; }

  /**
   * Workspace id taken from the CRN ({@code crn:<region>:<workspace-id>}).
   *
   * @throws IllegalArgumentException when no CRN is set or it is malformed
   */
  public String workspaceId() {
    if (workspaceCrn == null || workspaceCrn.isBlank()) {
      throw new IllegalArgumentException("No workspace CRN configured; set CS_WORKSPACE_CRN or sealquery.workspace-crn");
    }
    Matcher m = CRN.matcher(workspaceCrn.trim());
    if (!m.find()) throw new IllegalArgumentException("Invalid CRN format");
    return m.group(1);
  }

  /** @throws IllegalArgumentException when required settings are missing or conflicting */
  public void validate() {
    workspaceId();
    if (isBlank(clientId)) throw new IllegalArgumentException("Missing client id (CS_CLIENT_ID)");
    if (isBlank(clientKey)) throw new IllegalArgumentException("Missing client key (CS_CLIENT_KEY)");
    if (isBlank(accessKey)) throw new IllegalArgumentException("Missing access key (CS_CLIENT_ACCESS_KEY)");
    if (!isBlank(keysetName) && !isBlank(keysetId)) {
      throw new IllegalArgumentException("Specify a keyset by name or by id, not both");
    }
  }

  public static ClientConfig load() {
    return load(System.getenv(), Path.of(""), Thread.currentThread().getContextClassLoader());
  }

  public static ClientConfig load(Map<String, String> env, Path workingDir, ClassLoader cl) {
    Properties merged = new Properties();
    ClassLoader loader = cl == null ? ClientConfig.class.getClassLoader() : cl;
    try (InputStream in = loader.getResourceAsStream(FILE_NAME)) {
      if (in != null) merged.load(in);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to read classpath " + FILE_NAME, e);
    }

    Path file = workingDir.resolve(FILE_NAME);
    if (Files.isRegularFile(file)) {
      try (Reader r = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
        merged.load(r);
      } catch (IOException e) {
        throw new IllegalStateException("Failed to read " + file.toAbsolutePath(), e);
      }
    }

    for (Map.Entry<String, String> e : ENV_KEYS.entrySet()) {
      String v = env.get(e.getKey());
      if (!isBlank(v)) merged.setProperty(e.getValue(), v);
    }
    return fromProperties(merged);
  }

  public static ClientConfig fromProperties(Properties p) {
    ClientConfig c = new ClientConfig();
    c.setWorkspaceCrn(p.getProperty("sealquery.workspace-crn"));
    c.setClientId(p.getProperty("sealquery.client-id"));
    c.setClientKey(p.getProperty("sealquery.client-key"));
    c.setAccessKey(p.getProperty("sealquery.access-key"));
    c.setKeysetName(p.getProperty("sealquery.keyset.name"));
    c.setKeysetId(p.getProperty("sealquery.keyset.id"));
    c.setEngine(p.getProperty("sealquery.engine"));
    c.setLogLevel(p.getProperty("sealquery.log-level", "info"));
    return c;
  }

  private static boolean isBlank(String s) {
    return s == null || s.isBlank();
  }

  @Override
  public String toString() {
    return "ClientConfig{workspaceCrn=" + workspaceCrn + ", clientId=" + clientId + ", engine=" + engine
        + ", keyset=" + (keysetId != null ? keysetId : keysetName) + ", logLevel=" + logLevel + "}";
  }
}
