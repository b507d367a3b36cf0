package hybrid.service;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import hybrid.exceptions.EncryptionException;
import hybrid.exceptions.ErrorKind;
import hybrid.model.KeyManagerIF;
import hybrid.utils.KeyManagerConfig;

class KeyConfigurationServiceTest
{
  @TempDir
  Path tempDir;

  private Map<String, String> baseConfig()
  {
    Map<String, String> map = KeyManagerConfig.defaults();
    map.put( KeyManagerIF.CertPath,    tempDir.resolve( "keys" ).toString() );
    map.put( KeyManagerIF.AllowedRoot, tempDir.toString() );
    return map;
  }

  @Test
  void testDefaultsInsideRootAreValid() throws Exception
  {
    KeyConfigurationService service = new KeyConfigurationService( new KeyManagerConfig( baseConfig() ));

    assertTrue( service.collectErrors().isEmpty() );
    service.validateConfig();
  }

  @Test
  void testDefaultValues()
  {
    KeyManagerConfig config = new KeyManagerConfig();

    assertEquals( "normal", config.getPresetValue() );
    assertEquals( KeyManagerIF.DefaultCertPath, config.getCertPath() );
    assertEquals( 1, config.getKeyExpiryMonths() );
    assertTrue( config.isAutoGenerate() );
    assertTrue( config.isEnableFileBackup() );
    assertEquals( 15, config.getRotationGracePeriod().toMinutes() );
    assertEquals( 3, config.getRotationIntervalInWeeks() );
  }

  @Test
  void testTraversalIsRejected()
  {
    Map<String, String> map = baseConfig();
    map.put( KeyManagerIF.CertPath, tempDir.toString() + "/../elsewhere" );

    List<String> errors = new KeyConfigurationService( new KeyManagerConfig( map )).collectErrors();

    assertEquals( 2, errors.size(), errors.toString() );
  }

  @Test
  void testPathOutsideRootIsRejected()
  {
    Map<String, String> map = baseConfig();
    map.put( KeyManagerIF.AllowedRoot, tempDir.resolve( "jail" ).toString() );

    List<String> errors = new KeyConfigurationService( new KeyManagerConfig( map )).collectErrors();

    assertEquals( 1, errors.size() );
    assertTrue( errors.get( 0 ).contains( "outside the allowed root" ));
  }

  @Test
  void testEmptyPathIsRejected()
  {
    Map<String, String> map = baseConfig();
    map.put( KeyManagerIF.CertPath, "  " );

    assertEquals( List.of( "certPath must not be empty" ), new KeyConfigurationService( new KeyManagerConfig( map )).collectErrors() );
  }

  @Test
  void testAllDefectsReportedTogether()
  {
    Map<String, String> map = baseConfig();
    map.put( KeyManagerIF.Preset,                       "extreme" );
    map.put( KeyManagerIF.KeyExpiryMonths,              "0" );
    map.put( KeyManagerIF.RotationGracePeriodInMinutes, "-1" );
    map.put( KeyManagerIF.RotationIntervalInWeeks,      "31" );

    KeyConfigurationService service = new KeyConfigurationService( new KeyManagerConfig( map ));
    assertEquals( 4, service.collectErrors().size() );

    EncryptionException e = assertThrows( EncryptionException.class, service::validateConfig );
    assertEquals( ErrorKind.CONFIG, e.getKind() );
    assertTrue( e.getMessage().contains( "extreme" ));
  }

  @Test
  void testNonNumericValuesAreReported()
  {
    Map<String, String> map = new HashMap<>( baseConfig() );
    map.put( KeyManagerIF.KeyExpiryMonths, "soon" );

    List<String> errors = new KeyConfigurationService( new KeyManagerConfig( map )).collectErrors();

    assertEquals( 1, errors.size() );
    assertTrue( errors.get( 0 ).contains( KeyManagerIF.KeyExpiryMonths ));
  }
}
