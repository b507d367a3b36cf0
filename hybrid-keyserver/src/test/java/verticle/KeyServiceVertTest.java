package verticle;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.eventbus.ReplyException;
import io.vertx.core.json.JsonObject;

import hybrid.crypto.HybridEncryption;
import hybrid.handler.KeyManager;
import hybrid.model.EncryptedData;
import hybrid.model.KeyManagerIF;
import hybrid.model.Preset;
import hybrid.utils.Base64Codec;
import hybrid.utils.KeyManagerConfig;
import service.ServerDecryption;

class KeyServiceVertTest
{
  private static final String PREFIX = "ks-test";

  @TempDir
  Path tempDir;

  private Vertx          vertx;
  private KeyManager     keyManager;
  private KeyServiceVert vert;

  @BeforeEach
  void setUp() throws Exception
  {
    vertx = Vertx.vertx();

    Map<String, String> map = KeyManagerConfig.defaults();
    map.put( KeyManagerIF.CertPath,    tempDir.resolve( "keys" ).toString() );
    map.put( KeyManagerIF.AllowedRoot, tempDir.toString() );

    keyManager = new KeyManager( vertx, new KeyManagerConfig( map ));
    vert       = new KeyServiceVert( new ServerDecryption( vertx, keyManager ), PREFIX );

    await( vertx.deployVerticle( vert ));
  }

  @AfterEach
  void tearDown() throws Exception
  {
    keyManager.close();
    await( vertx.close() );
  }

  private static <T> T await( Future<T> future ) throws Exception
  {
    return future.toCompletionStage().toCompletableFuture().get( 30, TimeUnit.SECONDS );
  }

  private JsonObject request( String suffix, JsonObject body ) throws Exception
  {
    return await( vertx.eventBus().<JsonObject>request( vert.address( suffix ), body )).body();
  }

  private ReplyException requestFailure( String suffix, JsonObject body )
  {
    ExecutionException e = assertThrows( ExecutionException.class, () -> request( suffix, body ));
    assertInstanceOf( ReplyException.class, e.getCause() );
    return (ReplyException)e.getCause();
  }

  private static JsonObject toJson( EncryptedData data )
  {
    return new JsonObject().put( "preset",           data.getPreset() )
                           .put( "encryptedContent", data.getEncryptedContent() )
                           .put( "cipherText",       data.getCipherText() )
                           .put( "nonce",            data.getNonce() );
  }

  @Test
  void testPublicKeyAndDecrypt() throws Exception
  {
    JsonObject pk = request( KeyServiceVert.PublicKeyAddr, new JsonObject() );
    assertEquals( "normal", pk.getString( "preset" ));
    assertEquals( 1, pk.getInteger( "version" ));

    EncryptedData sealed = new HybridEncryption( Preset.NORMAL ).encrypt( Map.of( "orderId", "A-17", "qty", 3 ), Base64Codec.decode( pk.getString( "publicKey" )));

    JsonObject reply = request( KeyServiceVert.DecryptAddr, toJson( sealed ));
    JsonObject data  = reply.getJsonObject( "data" );
    assertEquals( "A-17", data.getString( "orderId" ));
    assertEquals( 3, data.getInteger( "qty" ));
  }

  @Test
  void testMalformedDecryptRequestIsBadRequest() throws Exception
  {
    JsonObject body = new JsonObject().put( "preset", "normal" ).put( "nonce", "not base64!" );

    ReplyException e = requestFailure( KeyServiceVert.DecryptAddr, body );
    assertEquals( KeyServiceVert.BadRequest, e.failureCode() );
    assertTrue( e.getMessage().startsWith( "format: " ), e.getMessage() );
  }

  @Test
  void testRotateAndStatus() throws Exception
  {
    JsonObject status = request( KeyServiceVert.StatusAddr, new JsonObject() );
    assertTrue( status.getBoolean( "hasKeys" ));
    assertEquals( 1, status.getInteger( "currentKeyVersion" ));

    JsonObject rotated = request( KeyServiceVert.RotateAddr, new JsonObject().put( "reason", "emergency_rotation" ));
    assertEquals( 2, rotated.getInteger( "currentKeyVersion" ));
    assertTrue( rotated.getBoolean( "isRotating" ));
  }

  @Test
  void testUnknownRotationReasonIsRejected()
  {
    ReplyException e = requestFailure( KeyServiceVert.RotateAddr, new JsonObject().put( "reason", "because" ));

    assertEquals( KeyServiceVert.BadRequest, e.failureCode() );
    assertTrue( e.getMessage().startsWith( "validation: " ), e.getMessage() );
  }

  @Test
  void testHealth() throws Exception
  {
    JsonObject health = request( KeyServiceVert.HealthAddr, new JsonObject() );

    assertTrue( health.getBoolean( "healthy" ), health.encode() );
    assertTrue( health.getJsonArray( "issues" ).isEmpty() );
  }
}
