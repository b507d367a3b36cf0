package verticle;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.vertx.core.AbstractVerticle;
import io.vertx.core.Promise;
import io.vertx.core.eventbus.Message;
import io.vertx.core.eventbus.MessageConsumer;
import io.vertx.core.json.JsonObject;

import hybrid.exceptions.EncryptionException;
import hybrid.exceptions.ErrorKind;
import hybrid.model.EncryptedData;
import hybrid.model.RotationReason;
import hybrid.utils.Serialization;
import service.ServerDecryption;

/**
 * Event bus front of the key server. Addresses, relative to the configured
 * prefix:
 * <ul>
 *   <li>publicKey - reply { publicKey, preset, version }</li>
 *   <li>decrypt   - body is an EncryptedData record, reply { data }</li>
 *   <li>rotate    - optional { reason }, reply is the status after rotation</li>
 *   <li>status    - reply is the key manager status</li>
 *   <li>health    - reply { healthy, issues }</li>
 * </ul>
 * Failures are returned with msg.fail where the message starts with the
 * error kind, e.g. "format: Invalid encrypted data ...".
 */
public class KeyServiceVert extends AbstractVerticle
{
  private static final Logger LOGGER = LoggerFactory.getLogger( KeyServiceVert.class );

  public static final String PublicKeyAddr = "publicKey";
  public static final String DecryptAddr   = "decrypt";
  public static final String RotateAddr    = "rotate";
  public static final String StatusAddr    = "status";
  public static final String HealthAddr    = "health";

  public static final int BadRequest  = 400;
  public static final int ServerError = 500;

  private final ServerDecryption serverDecryption;
  private final String           addressPrefix;

  private final List<MessageConsumer<JsonObject>> consumers = new ArrayList<>();

  public KeyServiceVert( ServerDecryption serverDecryption, String addressPrefix )
  {
    this.serverDecryption = serverDecryption;
    this.addressPrefix    = addressPrefix;
  }

  @Override
  public void start( Promise<Void> startPromise )
  {
    LOGGER.info( "KeyServiceVert starting on address prefix {}", addressPrefix );

    consumers.add( vertx.eventBus().consumer( address( PublicKeyAddr ), this::handlePublicKey ));
    consumers.add( vertx.eventBus().consumer( address( DecryptAddr   ), this::handleDecrypt   ));
    consumers.add( vertx.eventBus().consumer( address( RotateAddr    ), this::handleRotate    ));
    consumers.add( vertx.eventBus().consumer( address( StatusAddr    ), this::handleStatus    ));
    consumers.add( vertx.eventBus().consumer( address( HealthAddr    ), this::handleHealth    ));

    serverDecryption.initializeIfNeeded()
                    .onSuccess( v ->
                     {
                       LOGGER.info( "KeyServiceVert started" );
                       startPromise.complete();
                     })
                    .onFailure( err ->
                     {
                       LOGGER.error( "KeyServiceVert failed to start: {}", err.getMessage() );
                       unregisterAll();
                       startPromise.fail( err );
                     });
  }

  @Override
  public void stop( Promise<Void> stopPromise )
  {
    LOGGER.info( "Stopping KeyServiceVert" );
    unregisterAll();
    stopPromise.complete();
  }

  public String address( String suffix )
  {
    return addressPrefix + "." + suffix;
  }

  private void unregisterAll()
  {
    for( MessageConsumer<JsonObject> c : consumers )
      c.unregister();

    consumers.clear();
  }

  private void handlePublicKey( Message<JsonObject> msg )
  {
    serverDecryption.getPublicKeyBase64()
                    .onSuccess( pk ->
                     {
                       Integer version = serverDecryption.getKeyManager().getKeyPair() == null ? null : serverDecryption.getKeyManager().getKeyPair().getVersion();
                       msg.reply( new JsonObject().put( "publicKey", pk )
                                                  .put( "preset",    serverDecryption.getKeyManager().getPreset().getWireName() )
                                                  .put( "version",   version ));
                     })
                    .onFailure( err -> fail( msg, err ));
  }

  private void handleDecrypt( Message<JsonObject> msg )
  {
    EncryptedData encryptedData;
    try
    {
      JsonObject body = msg.body();
      if( body == null )
        throw new EncryptionException( "Request body is missing", ErrorKind.VALIDATION, null, "decrypt" );

      encryptedData = Serialization.mapper().convertValue( body.getMap(), EncryptedData.class );
    }
    catch( EncryptionException e )
    {
      fail( msg, e );
      return;
    }
    catch( IllegalArgumentException e )
    {
      fail( msg, new EncryptionException( "Request body is not an encrypted data record", ErrorKind.FORMAT, null, "decrypt", e ));
      return;
    }

    serverDecryption.decryptData( encryptedData )
                    .onSuccess( data -> msg.reply( new JsonObject().put( "data", data )))
                    .onFailure( err -> fail( msg, err ));
  }

  private void handleRotate( Message<JsonObject> msg )
  {
    RotationReason reason = RotationReason.MANUAL_ROTATION;
    JsonObject     body   = msg.body();
    if( body != null && body.getString( "reason" ) != null )
    {
      try
      {
        reason = RotationReason.fromValue( body.getString( "reason" ));
      }
      catch( IllegalArgumentException e )
      {
        fail( msg, new EncryptionException( e.getMessage(), ErrorKind.VALIDATION, null, "rotate", e ));
        return;
      }
    }

    LOGGER.info( "Rotation requested over the event bus ({})", reason.getValue() );
    serverDecryption.rotateKeys( reason )
                    .onSuccess( kp -> msg.reply( serverDecryption.getKeyManager().getStatus().toJson() ))
                    .onFailure( err -> fail( msg, err ));
  }

  private void handleStatus( Message<JsonObject> msg )
  {
    serverDecryption.getStatus()
                    .onSuccess( status -> msg.reply( status.toJson() ))
                    .onFailure( err -> fail( msg, err ));
  }

  private void handleHealth( Message<JsonObject> msg )
  {
    serverDecryption.healthCheck()
                    .onSuccess( report -> msg.reply( report.toJson() ))
                    .onFailure( err -> fail( msg, err ));
  }

  private void fail( Message<JsonObject> msg, Throwable err )
  {
    if( err instanceof EncryptionException )
    {
      EncryptionException ee   = (EncryptionException)err;
      int                 code = ( ee.getKind() == ErrorKind.VALIDATION || ee.getKind() == ErrorKind.FORMAT ) ? BadRequest : ServerError;

      LOGGER.warn( "Request on {} failed: {}", msg.address(), ee.getMessage() );
      msg.fail( code, ee.getKind().getCode() + ": " + ee.getMessage() );
      return;
    }

    LOGGER.error( "Request on {} failed: {}", msg.address(), err.getMessage(), err );
    msg.fail( ServerError, ErrorKind.OPERATION.getCode() + ": " + err.getMessage() );
  }
}
