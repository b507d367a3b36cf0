package verticle;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.vertx.core.AbstractVerticle;
import io.vertx.core.Promise;

import hybrid.handler.KeyManager;
import hybrid.model.RotationReason;

/**
 * Rotates the key pair on a fixed schedule and prunes old backups after each
 * rotation.
 */
public class KeyRotationVert extends AbstractVerticle
{
  private static final Logger LOGGER = LoggerFactory.getLogger( KeyRotationVert.class );

  private final KeyManager keyManager;
  private final long       rotationIntervalMs;

  private long timerId = -1;

  public KeyRotationVert( KeyManager keyManager, long rotationIntervalMs )
  {
    if( rotationIntervalMs <= 0 )
      throw new IllegalArgumentException( "rotationIntervalMs must be positive" );

    this.keyManager         = keyManager;
    this.rotationIntervalMs = rotationIntervalMs;
  }

  @Override
  public void start( Promise<Void> startPromise )
  {
    LOGGER.info( "KeyRotationVert started, rotating every {} ms", rotationIntervalMs );

    timerId = vertx.setPeriodic( rotationIntervalMs, id -> rotate() );
    startPromise.complete();
  }

  @Override
  public void stop( Promise<Void> stopPromise )
  {
    if( timerId >= 0 )
      vertx.cancelTimer( timerId );

    LOGGER.info( "KeyRotationVert stopped" );
    stopPromise.complete();
  }

  void rotate()
  {
    LOGGER.info( "Scheduled key rotation starting" );

    keyManager.rotateKeys( RotationReason.SCHEDULED_ROTATION )
              .onSuccess( kp -> LOGGER.info( "Scheduled rotation complete, key version {}", kp.getVersion() ))
              .compose( kp -> keyManager.cleanupOldBackups() )
              .onSuccess( removed -> LOGGER.info( "Backup cleanup removed {} files", removed ))
              .onFailure( err -> LOGGER.error( "Scheduled key rotation failed: {}", err.getMessage() ));
  }
}
