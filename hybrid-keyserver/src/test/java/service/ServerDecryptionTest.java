package service;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import io.vertx.core.Future;
import io.vertx.core.Vertx;

import hybrid.crypto.HybridEncryption;
import hybrid.exceptions.EncryptionException;
import hybrid.exceptions.ErrorKind;
import hybrid.handler.KeyManager;
import hybrid.model.EncryptedData;
import hybrid.model.HealthReport;
import hybrid.model.KeyManagerIF;
import hybrid.model.Preset;
import hybrid.model.RotationReason;
import hybrid.provider.MlKemKeyProvider;
import hybrid.utils.Base64Codec;
import hybrid.utils.DeepComparison;
import hybrid.utils.KeyManagerConfig;

class ServerDecryptionTest
{
  @TempDir
  Path tempDir;

  private Vertx            vertx;
  private KeyManager       keyManager;
  private ServerDecryption server;

  private final HybridEncryption client = new HybridEncryption( Preset.NORMAL );

  @BeforeEach
  void setUp()
  {
    vertx      = Vertx.vertx();
    keyManager = new KeyManager( vertx, new KeyManagerConfig( configMap( Preset.NORMAL.getWireName() )));
    server     = new ServerDecryption( vertx, keyManager );
  }

  @AfterEach
  void tearDown() throws Exception
  {
    keyManager.close();
    await( vertx.close() );
  }

  private Map<String, String> configMap( String preset )
  {
    Map<String, String> map = KeyManagerConfig.defaults();
    map.put( KeyManagerIF.Preset,      preset );
    map.put( KeyManagerIF.CertPath,    tempDir.resolve( "keys" ).toString() );
    map.put( KeyManagerIF.AllowedRoot, tempDir.toString() );
    return map;
  }

  private static <T> T await( Future<T> future ) throws Exception
  {
    return future.toCompletionStage().toCompletableFuture().get( 30, TimeUnit.SECONDS );
  }

  private static Map<String, Object> payload()
  {
    Map<String, Object> data = new LinkedHashMap<>();
    data.put( "user",   "alice" );
    data.put( "amount", 125 );
    data.put( "tags",   List.of( "a", "b" ));
    return data;
  }

  private byte[] serverPublicKey() throws Exception
  {
    return Base64Codec.decode( await( server.getPublicKeyBase64() ));
  }

  @Test
  void testDecryptsClientPayload() throws Exception
  {
    EncryptedData sealed = client.encrypt( payload(), serverPublicKey() );

    Object opened = await( server.decryptData( sealed ));

    assertTrue( DeepComparison.deepEqual( payload(), opened ), String.valueOf( opened ));
  }

  @Test
  void testDecryptsIntoType() throws Exception
  {
    EncryptedData sealed = client.encrypt( payload(), serverPublicKey() );

    @SuppressWarnings( "rawtypes" )
    Map opened = await( server.decryptData( sealed, Map.class ));

    assertEquals( "alice", opened.get( "user" ));
  }

  @Test
  void testPreviousKeyStillDecryptsAfterRotation() throws Exception
  {
    EncryptedData sealedBefore = client.encrypt( payload(), serverPublicKey() );

    await( server.rotateKeys( RotationReason.MANUAL_ROTATION ));
    assertEquals( 2, await( server.getStatus() ).getCurrentKeyVersion() );

    assertTrue( DeepComparison.deepEqual( payload(), await( server.decryptData( sealedBefore ))));

    EncryptedData sealedAfter = client.encrypt( payload(), serverPublicKey() );
    assertTrue( DeepComparison.deepEqual( payload(), await( server.decryptData( sealedAfter ))));
  }

  @Test
  void testMalformedRecordIsFormatError() throws Exception
  {
    EncryptedData sealed = client.encrypt( payload(), serverPublicKey() ).withNonce( "" );

    ExecutionException e = assertThrows( ExecutionException.class, () -> await( server.decryptData( sealed )));
    assertInstanceOf( EncryptionException.class, e.getCause() );
    assertEquals( ErrorKind.FORMAT, ((EncryptionException)e.getCause()).getKind() );
  }

  @Test
  void testForeignKeyCannotDecrypt() throws Exception
  {
    await( server.initializeIfNeeded() );

    byte[]        foreignKey = new MlKemKeyProvider( Preset.NORMAL ).generateKeyPair().getPublicKey();
    EncryptedData sealed     = client.encrypt( payload(), foreignKey );

    ExecutionException e = assertThrows( ExecutionException.class, () -> await( server.decryptData( sealed )));
    assertInstanceOf( EncryptionException.class, e.getCause() );
  }

  @Test
  void testHealthCheck() throws Exception
  {
    HealthReport report = await( server.healthCheck() );

    assertTrue( report.isHealthy(), report.toString() );
  }

  @Test
  void testInitializationFailureIsConfigError() throws Exception
  {
    KeyManager       broken       = new KeyManager( vertx, new KeyManagerConfig( configMap( "ultra" )));
    ServerDecryption brokenServer = new ServerDecryption( vertx, broken );

    ExecutionException e = assertThrows( ExecutionException.class, () -> await( brokenServer.initializeIfNeeded() ));
    assertEquals( ErrorKind.CONFIG, ((EncryptionException)e.getCause()).getKind() );

    HealthReport report = await( brokenServer.healthCheck() );
    assertFalse( report.isHealthy() );
  }
}
