package helper;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import hybrid.model.Preset;
import hybrid.utils.KeyManagerConfig;

class KeyServerConfigTest
{
  @TempDir
  Path tempDir;

  @Test
  void testFromFile() throws Exception
  {
    Path file = tempDir.resolve( "keyserver.json" );
    Files.writeString( file, "{\n"
                           + "  \"serviceId\": \"ks-test\",\n"
                           + "  \"addressPrefix\": \"ks\",\n"
                           + "  \"workerPoolSize\": 2,\n"
                           + "  \"rotationIntervalMs\": 5000,\n"
                           + "  \"unknownSetting\": 1,\n"
                           + "  \"keyManager\": { \"preset\": \"high_security\", \"autoGenerate\": \"false\", \"rotationIntervalInWeeks\": \"2\" }\n"
                           + "}" );

    KeyServerConfig config = KeyServerConfig.fromFile( file.toString() );

    assertEquals( "ks-test", config.getServiceId() );
    assertEquals( "ks.decrypt", config.address( "decrypt" ));
    assertEquals( 2, config.getWorkerPoolSize() );
    assertEquals( Long.valueOf( 5000 ), config.getRotationIntervalMs() );

    KeyManagerConfig km = config.toKeyManagerConfig();
    assertEquals( Preset.HIGH_SECURITY, km.getPreset() );
    assertFalse( km.isAutoGenerate() );
    assertEquals( 2, km.getRotationIntervalInWeeks() );
    assertEquals( 5000, config.effectiveRotationIntervalMs( km ));
  }

  @Test
  void testDefaults()
  {
    KeyServerConfig config = new KeyServerConfig( null, null, 0, null, null );

    assertEquals( KeyServerConfig.DefaultServiceId, config.getServiceId() );
    assertEquals( "keyserver.status", config.address( "status" ));
    assertEquals( KeyServerConfig.DefaultWorkerPool, config.getWorkerPoolSize() );
    assertTrue( config.getKeyManager().isEmpty() );

    KeyManagerConfig km = config.toKeyManagerConfig();
    assertEquals( Preset.NORMAL, km.getPreset() );
    assertEquals( TimeUnit.DAYS.toMillis( 21 ), config.effectiveRotationIntervalMs( km ));
  }

  @Test
  void testMissingFile()
  {
    assertThrows( IOException.class, () -> KeyServerConfig.fromFile( tempDir.resolve( "absent.json" ).toString() ));
  }
}
