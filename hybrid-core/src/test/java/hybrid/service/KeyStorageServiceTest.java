package hybrid.service;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import io.vertx.core.Future;
import io.vertx.core.Vertx;

import hybrid.model.KeyManagerIF;
import hybrid.model.KeyMetadata;
import hybrid.model.KeyPair;
import hybrid.model.Preset;
import hybrid.utils.KeyManagerConfig;

class KeyStorageServiceTest
{
  @TempDir
  Path tempDir;

  private Vertx             vertx;
  private Path              keyDir;
  private KeyStorageService storage;

  @BeforeEach
  void setUp()
  {
    vertx   = Vertx.vertx();
    keyDir  = tempDir.resolve( "certs" ).resolve( "keys" );
    storage = new KeyStorageService( vertx, config( true ));
  }

  @AfterEach
  void tearDown() throws Exception
  {
    await( vertx.close() );
  }

  private KeyManagerConfig config( boolean backup )
  {
    Map<String, String> map = KeyManagerConfig.defaults();
    map.put( KeyManagerIF.CertPath,         keyDir.toString() );
    map.put( KeyManagerIF.AllowedRoot,      tempDir.toString() );
    map.put( KeyManagerIF.EnableFileBackup, String.valueOf( backup ));
    return new KeyManagerConfig( map );
  }

  private static <T> T await( Future<T> future ) throws Exception
  {
    return future.toCompletionStage().toCompletableFuture().get( 30, TimeUnit.SECONDS );
  }

  private static KeyPair samplePair( int version )
  {
    Instant created = Instant.now().truncatedTo( ChronoUnit.MILLIS );
    return new KeyPair( new byte[] { 1, 2, 3 }, new byte[] { 4, 5, 6, 7 }, new KeyMetadata( Preset.NORMAL, version, created, created.plus( 30, ChronoUnit.DAYS )));
  }

  @Test
  void testEnsureCertDirectoryCreatesPath() throws Exception
  {
    await( storage.ensureCertDirectory() );
    assertTrue( Files.isDirectory( keyDir ));

    await( storage.ensureCertDirectory() );
  }

  @Test
  void testLoadReturnsNullWhenMissing() throws Exception
  {
    await( storage.ensureCertDirectory() );
    assertNull( await( storage.loadKeysFromFile() ));
  }

  @Test
  void testSaveAndLoad() throws Exception
  {
    await( storage.ensureCertDirectory() );

    KeyPair pair = samplePair( 4 );
    await( storage.saveKeysToFile( pair ));

    assertTrue( Files.exists( keyDir.resolve( KeyManagerIF.PublicKeyFile )));
    assertTrue( Files.exists( keyDir.resolve( KeyManagerIF.SecretKeyFile )));

    String json = Files.readString( keyDir.resolve( KeyManagerIF.KeyMetadataFile ));
    assertTrue( json.contains( "\"preset\" : \"normal\"" ), json );

    KeyPair loaded = await( storage.loadKeysFromFile() );
    assertNotNull( loaded );
    assertArrayEquals( pair.getPublicKey(), loaded.getPublicKey() );
    assertArrayEquals( pair.getSecretKey(), loaded.getSecretKey() );
    assertEquals( pair.getMetadata(), loaded.getMetadata() );
  }

  @Test
  void testSecretKeyFileIsOwnerOnly() throws Exception
  {
    if( !FileSystems.getDefault().supportedFileAttributeViews().contains( "posix" ))
      return;

    await( storage.ensureCertDirectory() );
    await( storage.saveKeysToFile( samplePair( 1 )));

    Set<PosixFilePermission> perms = Files.getPosixFilePermissions( keyDir.resolve( KeyManagerIF.SecretKeyFile ));
    assertEquals( PosixFilePermissions.fromString( "rw-------" ), perms );
  }

  @Test
  void testCorruptMetadataLoadsAsAbsent() throws Exception
  {
    await( storage.ensureCertDirectory() );
    await( storage.saveKeysToFile( samplePair( 1 )));

    Files.writeString( keyDir.resolve( KeyManagerIF.KeyMetadataFile ), "{ broken", StandardCharsets.UTF_8 );
    assertNull( await( storage.loadKeysFromFile() ));

    Files.writeString( keyDir.resolve( KeyManagerIF.KeyMetadataFile ), "{ \"preset\": \"normal\", \"version\": 1 }", StandardCharsets.UTF_8 );
    assertNull( await( storage.loadKeysFromFile() ));
  }

  @Test
  void testSaveRejectsIncompletePair()
  {
    KeyPair noSecret = new KeyPair( new byte[] { 1 }, null, samplePair( 1 ).getMetadata() );
    assertThrows( Exception.class, () -> await( storage.saveKeysToFile( noSecret )));
  }

  @Test
  void testBackupWritesDatedFiles() throws Exception
  {
    await( storage.ensureCertDirectory() );
    await( storage.backupExpiredKeys( samplePair( 2 )));

    String stamp = LocalDate.now( ZoneOffset.UTC ).toString();
    assertTrue( Files.exists( keyDir.resolve( "backup" ).resolve( "pub-key-expired-" + stamp + ".bin" )));
    assertTrue( Files.exists( keyDir.resolve( "backup" ).resolve( "secret-key-expired-" + stamp + ".bin" )));
  }

  @Test
  void testBackupDisabled() throws Exception
  {
    KeyStorageService noBackup = new KeyStorageService( vertx, config( false ));
    await( noBackup.ensureCertDirectory() );
    await( noBackup.backupExpiredKeys( samplePair( 2 )));

    assertFalse( Files.exists( keyDir.resolve( "backup" )));
  }

  @Test
  void testCleanupRemovesOnlyOldBackups() throws Exception
  {
    Path backup = Files.createDirectories( keyDir.resolve( "backup" ));
    Path old    = Files.write( backup.resolve( "pub-key-expired-2000-01-15.bin" ), new byte[] { 1 } );
    Path recent = Files.write( backup.resolve( "pub-key-expired-" + LocalDate.now( ZoneOffset.UTC ) + ".bin" ), new byte[] { 1 } );
    Path other  = Files.write( backup.resolve( "notes.txt" ), new byte[] { 1 } );

    assertEquals( 1, await( storage.cleanupOldBackups() ));

    assertFalse( Files.exists( old ));
    assertTrue( Files.exists( recent ));
    assertTrue( Files.exists( other ));
  }

  @Test
  void testCleanupWithoutBackupDirectory() throws Exception
  {
    assertEquals( 0, await( storage.cleanupOldBackups() ));
  }

  @Test
  void testBackupAgeMatching()
  {
    YearMonth cutoff = YearMonth.of( 2024, 6 );

    assertTrue(  KeyStorageService.isOlderThan( "secret-key-expired-2024-02-01.bin", cutoff ));
    assertFalse( KeyStorageService.isOlderThan( "secret-key-expired-2024-06-01.bin", cutoff ));
    assertFalse( KeyStorageService.isOlderThan( "secret-key.bin", cutoff ));
  }
}
