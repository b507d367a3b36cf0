package service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.vertx.core.Future;
import io.vertx.core.Vertx;

import hybrid.crypto.HybridEncryption;
import hybrid.exceptions.EncryptionException;
import hybrid.exceptions.ErrorKind;
import hybrid.exceptions.KeyManagerException;
import hybrid.handler.KeyManager;
import hybrid.model.EncryptedData;
import hybrid.model.HealthReport;
import hybrid.model.KeyManagerStatus;
import hybrid.model.KeyPair;
import hybrid.model.RotationReason;
import hybrid.model.ValidationResult;
import hybrid.utils.Base64Codec;
import hybrid.utils.DeepComparison;
import hybrid.utils.EncryptedDataValidator;

/**
 * Server side of the hybrid scheme: opens client payloads with the current
 * key, or the previous one while a rotation grace period lasts.
 */
public class ServerDecryption
{
  private static final Logger LOGGER = LoggerFactory.getLogger( ServerDecryption.class );

  private final Vertx      vertx;
  private final KeyManager keyManager;

  private HybridEncryption engine     = null;
  private Future<Void>     initFuture = null;

  public ServerDecryption( Vertx vertx, KeyManager keyManager )
  {
    if( vertx == null || keyManager == null )
      throw new IllegalArgumentException( "vertx and keyManager are required" );

    this.vertx      = vertx;
    this.keyManager = keyManager;
  }

  public KeyManager getKeyManager() { return keyManager; }

  public synchronized Future<Void> initializeIfNeeded()
  {
    if( initFuture != null && !initFuture.failed() )
      return initFuture;

    initFuture = keyManager.initialize()
                           .onSuccess( v -> createEngine() )
                           .recover( err ->
                            {
                              LOGGER.error( "ServerDecryption initialization failed: {}", err.getMessage() );
                              return Future.failedFuture( new EncryptionException( "ServerDecryption initialization failed: " + err.getMessage(),
                                                                                   ErrorKind.CONFIG, keyManager.getPreset(), "initialize", err ));
                            });
    return initFuture;
  }

  private synchronized void createEngine()
  {
    if( engine == null )
      engine = new HybridEncryption( keyManager.getPreset() );
  }

  private synchronized HybridEncryption engine()
  {
    return engine;
  }

  public Future<Object> decryptData( EncryptedData encryptedData )
  {
    return decryptData( encryptedData, Object.class );
  }

  /**
   * Validates the payload, then tries each decryption key in order.
   */
  public <T> Future<T> decryptData( EncryptedData encryptedData, Class<T> type )
  {
    ValidationResult validation = EncryptedDataValidator.validate( encryptedData );
    if( !validation.isOk() )
      return Future.failedFuture( EncryptionException.create( "Invalid encrypted data: " + String.join( "; ", validation.getErrors() ),
                                                              ErrorKind.FORMAT, keyManager.getPreset(), "decryptData" ));

    return initializeIfNeeded()
             .compose( v -> keyManager.getDecryptionKeys() )
             .<T>compose( keys ->
              {
                if( keys == null || keys.isEmpty() )
                  return Future.<T>failedFuture( new KeyManagerException( "No decryption keys available", keyManager.getPreset(), "decryptData" ));

                return vertx.executeBlocking( () -> openWith( encryptedData, keys, type ), false );
              });
  }

  private <T> T openWith( EncryptedData encryptedData, List<KeyPair> keys, Class<T> type )
   throws EncryptionException
  {
    List<byte[]> secretKeys = new ArrayList<>( keys.size() );
    for( KeyPair kp : keys )
      secretKeys.add( kp.getSecretKey() );

    try
    {
      return engine().decryptWithGracePeriod( encryptedData, secretKeys, type );
    }
    catch( RuntimeException e )
    {
      throw EncryptionException.wrap( e, "Failed to decrypt data", ErrorKind.OPERATION, keyManager.getPreset(), "decryptData" );
    }
    finally
    {
      for( byte[] sk : secretKeys )
      {
        if( sk != null )
          Arrays.fill( sk, (byte)0 );
      }
      keys.forEach( KeyPair::destroy );
    }
  }

  public Future<String> getPublicKeyBase64()
  {
    return initializeIfNeeded().compose( v -> keyManager.ensureValidKeys() )
                               .map( kp -> Base64Codec.encode( kp.getPublicKey() ));
  }

  public Future<KeyManagerStatus> getStatus()
  {
    return initializeIfNeeded().map( v -> keyManager.getStatus() );
  }

  public Future<KeyPair> rotateKeys( RotationReason reason )
  {
    return initializeIfNeeded().compose( v -> keyManager.rotateKeys( reason ));
  }

  /**
   * Key manager health plus an encrypt and decrypt round trip with the
   * current key pair.
   */
  public Future<HealthReport> healthCheck()
  {
    return initializeIfNeeded()
             .compose( v -> keyManager.ensureValidKeys() )
             .compose( kp -> vertx.executeBlocking( () -> selfTest( kp ), false ))
             .map( selfTestIssue ->
              {
                List<String> issues = new ArrayList<>( keyManager.healthCheck().getIssues() );
                if( selfTestIssue != null )
                  issues.add( selfTestIssue );

                return new HealthReport( issues );
              })
             .recover( err -> Future.succeededFuture( new HealthReport( List.of( "Health check failed: " + err.getMessage() ))));
  }

  private String selfTest( KeyPair keyPair )
  {
    Map<String, Object> sample = new LinkedHashMap<>();
    sample.put( "check",  "self-test" );
    sample.put( "at",     Instant.now().toString() );
    sample.put( "values", List.of( 1, 2, 3 ));

    byte[] secretKey = keyPair.getSecretKey();
    try
    {
      EncryptedData sealed = engine().encrypt( sample, keyPair.getPublicKey() );
      Object        opened = engine().decrypt( sealed, secretKey );

      if( !DeepComparison.deepEqual( sample, opened ))
        return "Self-test round trip returned different data";

      return null;
    }
    catch( EncryptionException e )
    {
      LOGGER.warn( "Self-test failed: {}", e.getMessage() );
      return "Self-test failed: " + e.getKind().getCode() + ": " + e.getMessage();
    }
    finally
    {
      Arrays.fill( secretKey, (byte)0 );
    }
  }
}
