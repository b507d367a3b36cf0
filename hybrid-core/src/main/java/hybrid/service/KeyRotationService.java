package hybrid.service;

import java.time.Duration;
import java.time.Instant;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.vertx.core.Future;
import io.vertx.core.Vertx;

import hybrid.model.KeyPair;
import hybrid.model.RotationReason;
import hybrid.utils.KeyManagerConfig;

/**
 * Rotation policy and the persistence sequence of a single rotation. State
 * changes of the live key pair stay with the caller.
 */
public class KeyRotationService
{
  private static final Logger LOGGER = LoggerFactory.getLogger( KeyRotationService.class );

  private final Vertx                  vertx;
  private final KeyManagerConfig       config;
  private final KeyLifecycleService    lifecycle;
  private final KeyStorageService      storage;
  private final RotationHistoryService history;

  public KeyRotationService( Vertx vertx, KeyManagerConfig config, KeyLifecycleService lifecycle, KeyStorageService storage, RotationHistoryService history )
  {
    this.vertx     = vertx;
    this.config    = config;
    this.lifecycle = lifecycle;
    this.storage   = storage;
    this.history   = history;
  }

  public boolean needsRotation( KeyPair current )
  {
    if( current == null || current.getMetadata() == null || current.getMetadata().getExpiresAt() == null )
      return true;

    return Instant.now().isAfter( current.getMetadata().getExpiresAt() );
  }

  public boolean isInGracePeriod( Instant rotationStartTime )
  {
    if( rotationStartTime == null )
      return false;

    return Duration.between( rotationStartTime, Instant.now() ).compareTo( config.getRotationGracePeriod() ) < 0;
  }

  /**
   * Next version from history, generation off the event loop, backup of the
   * outgoing pair, save, history entry. Generation and save failures fail the
   * returned future; backup and history failures are only logged.
   */
  public Future<KeyPair> performKeyRotation( KeyPair current, RotationReason reason )
  {
    return history.getNextVersionNumber()
                  .compose( version ->
                   {
                     LOGGER.info( "Generating key pair version {}", version );
                     return vertx.executeBlocking( () -> lifecycle.createNewKeyPair( version ), false );
                   })
                  .compose( newPair -> storage.backupExpiredKeys( current )
                                              .compose( v -> storage.saveKeysToFile( newPair ))
                                              .compose( v -> history.updateRotationHistory( newPair, reason ))
                                              .map( v -> newPair )
                                              .onFailure( err -> lifecycle.securelyClearKey( newPair ) ));
  }

  public Duration getGracePeriod()
  {
    return config.getRotationGracePeriod();
  }
}
