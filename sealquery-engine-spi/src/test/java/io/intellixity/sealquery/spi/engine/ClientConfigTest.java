package io.intellixity.sealquery.spi.engine;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

final class ClientConfigTest {

  @Test
  void extractsWorkspaceIdFromCrn() {
    ClientConfig c = new ClientConfig();
    c.setWorkspaceCrn("crn:ap-southeast-2.aws:ZVATKW3VHMFG27DY");
    assertEquals("ZVATKW3VHMFG27DY", c.workspaceId());
  }

  @Test
  void malformedCrnFails() {
    ClientConfig c = new ClientConfig();
    c.setWorkspaceCrn("not-a-crn");
    IllegalArgumentException e = assertThrows(IllegalArgumentException.class, c::workspaceId);
    assertEquals("Invalid CRN format", e.getMessage());
  }

  @Test
  void environmentOverridesWorkingDirectoryFile(@TempDir Path dir) throws Exception {
    Files.writeString(dir.resolve(ClientConfig.FILE_NAME), String.join("\n",
        "sealquery.workspace-crn=crn:region.aws:FROMFILE",
        "sealquery.client-id=file-client",
        "sealquery.keyset.name=default",
        "sealquery.engine=ffi"));

    ClientConfig c = ClientConfig.load(
        Map.of("CS_WORKSPACE_CRN", "crn:region.aws:FROMENV", "CS_CLIENT_KEY", "env-key"), dir, getClass().getClassLoader());

    assertEquals("FROMENV", c.workspaceId());
    assertEquals("file-client", c.getClientId());
    assertEquals("env-key", c.getClientKey());
    assertEquals("default", c.getKeysetName());
    assertEquals("ffi", c.getEngine());
    assertEquals("info", c.getLogLevel());
  }

  @Test
  void validateRequiresCredentialsAndOneKeysetSelector() {
    Properties p = new Properties();
    p.setProperty("sealquery.workspace-crn", "crn:region.aws:WS");
    p.setProperty("sealquery.client-id", "id");
    p.setProperty("sealquery.client-key", "key");
    ClientConfig c = ClientConfig.fromProperties(p);
    assertThrows(IllegalArgumentException.class, c::validate);

    c.setAccessKey("access");
    c.validate();

    c.setKeysetName("default");
    c.setKeysetId("7c0a8e2e");
    assertThrows(IllegalArgumentException.class, c::validate);
  }
}
