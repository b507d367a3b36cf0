package hybrid.handler;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;

import hybrid.exceptions.EncryptionException;
import hybrid.exceptions.KeyManagerException;
import hybrid.model.HealthReport;
import hybrid.model.KeyManagerIF;
import hybrid.model.KeyPair;
import hybrid.model.KeyManagerStatus;
import hybrid.model.KeyValidationResult;
import hybrid.model.Preset;
import hybrid.model.RotationHistory;
import hybrid.model.RotationReason;
import hybrid.model.RotationStats;
import hybrid.provider.KeyProvider;
import hybrid.provider.KeyProviderFactory;
import hybrid.service.KeyConfigurationService;
import hybrid.service.KeyLifecycleService;
import hybrid.service.KeyRotationService;
import hybrid.service.KeyStorageService;
import hybrid.service.RotationHistoryService;
import hybrid.utils.Base64Codec;
import hybrid.utils.KeyManagerConfig;

/**
 * Owns the live key pair of one storage directory.
 *
 * Lifecycle is UNINITIALIZED -> INITIALIZING -> READY, and READY <-> ROTATING
 * while a rotation is in flight. Only one rotation runs at a time: callers
 * arriving during a rotation receive the future of the running one.
 *
 * After a rotation the outgoing pair stays available for decryption until
 * the configured grace period has elapsed, then it is zeroed.
 */
public class KeyManager implements AutoCloseable
{
  private static final Logger LOGGER = LoggerFactory.getLogger( KeyManager.class );

  public enum State
  {
    UNINITIALIZED,
    INITIALIZING,
    READY,
    ROTATING
  }

  private final Vertx                   vertx;
  private final KeyManagerConfig        config;
  private final KeyConfigurationService configService;
  private final KeyStorageService       storage;
  private final RotationHistoryService  history;

  private KeyLifecycleService lifecycle = null;
  private KeyRotationService  rotation  = null;

  private volatile State   state             = State.UNINITIALIZED;
  private volatile KeyPair currentKeys       = null;
  private volatile KeyPair previousKeys      = null;
  private volatile boolean rotating          = false;
  private volatile Instant rotationStartTime = null;
  private volatile Instant lastRotation      = null;

  // guarded by this
  private Future<Void>    initFuture     = null;
  private Future<KeyPair> rotationFuture = null;
  private Long            cleanupTimerId = null;
  private long            generation     = 0;  // bumped whenever keys are cleared

  public KeyManager( Vertx vertx, KeyManagerConfig config )
  {
    if( vertx == null || config == null )
      throw new IllegalArgumentException( "vertx and config are required" );

    this.vertx         = vertx;
    this.config        = config;
    this.configService = new KeyConfigurationService( config );
    this.storage       = new KeyStorageService( vertx, config );
    this.history       = new RotationHistoryService( vertx, config );
  }

  public KeyManagerConfig getConfig() { return config; }
  public State            getState()  { return state;  }

  public boolean isInitialized()
  {
    return state == State.READY || state == State.ROTATING;
  }

  /**
   * Validates the configuration, prepares the storage directory and loads or
   * generates the key pair. Repeated calls return the same result; a failed
   * attempt may be retried.
   */
  public synchronized Future<Void> initialize()
  {
    if( isInitialized() )
      return Future.succeededFuture();
    if( initFuture != null && !initFuture.failed() )
      return initFuture;

    state = State.INITIALIZING;
    LOGGER.info( "Initializing KeyManager for {}", config.getCertDirectory() );

    long            startedIn = generation;
    Future<KeyPair> steps;
    try
    {
      configService.validateConfig();
      buildServices();
      steps = storage.ensureCertDirectory()
                     .compose( v -> loadOrGenerateKeys() )
                     .compose( this::verifyKeys );
    }
    catch( EncryptionException e )
    {
      steps = Future.failedFuture( e );
    }

    initFuture = steps.transform( ar -> completeInitialize( ar.succeeded() ? ar.result() : null, ar.cause(), startedIn ));

    return initFuture;
  }

  private synchronized Future<Void> completeInitialize( KeyPair keys, Throwable cause, long startedIn )
  {
    if( generation != startedIn )
    {
      lifecycle.securelyClearKey( keys );
      LOGGER.warn( "KeyManager was reset during initialization, discarding loaded keys" );
      return Future.failedFuture( new KeyManagerException( "KeyManager initialization abandoned: KeyManager was reset", config.getPreset(), "initialize", null, cause ));
    }

    if( cause == null )
    {
      currentKeys  = keys;
      lastRotation = keys.getMetadata().getCreatedAt();
      state        = State.READY;
      LOGGER.info( "KeyManager ready with key version {}", keys.getVersion() );
      return Future.succeededFuture();
    }

    state = State.UNINITIALIZED;
    LOGGER.error( "KeyManager initialization failed: {}", cause.getMessage() );
    return Future.failedFuture( new KeyManagerException( "KeyManager initialization failed: " + cause.getMessage(), config.getPreset(), "initialize", null, cause ));
  }

  private void buildServices()
   throws EncryptionException
  {
    if( lifecycle != null )
      return;

    KeyProvider provider = KeyProviderFactory.create( KeyManagerIF.KemAlgorithm, config.getPreset(), config.getKeyExpiryMonths() );
    this.lifecycle = new KeyLifecycleService( provider );
    this.rotation  = new KeyRotationService( vertx, config, lifecycle, storage, history );
  }

  private Future<KeyPair> loadOrGenerateKeys()
  {
    return storage.loadKeysFromFile().compose( loaded ->
    {
      if( loaded != null && loaded.getPreset() == config.getPreset() && !rotation.needsRotation( loaded ))
        return Future.succeededFuture( loaded );

      if( loaded != null && loaded.getPreset() != config.getPreset() )
        LOGGER.warn( "Stored keys use preset {} but {} is configured", loaded.getPreset(), config.getPreset() );

      if( !config.isAutoGenerate() )
      {
        if( loaded != null )
          return Future.succeededFuture( loaded );

        return Future.<KeyPair>failedFuture( new KeyManagerException( "No keys found in " + storage.getCertDirectory() + " and autoGenerate is disabled",
                                                                      config.getPreset(), "loadOrGenerateKeys" ));
      }

      return rotation.performKeyRotation( loaded, null )
                     .onComplete( ar -> lifecycle.securelyClearKey( loaded ));
    });
  }

  private Future<KeyPair> verifyKeys( KeyPair keys )
  {
    KeyValidationResult result = lifecycle.validateKeys( keys );
    if( result.isValid() )
      return Future.succeededFuture( keys );

    lifecycle.securelyClearKey( keys );
    return Future.failedFuture( new KeyManagerException( "Key validation failed: " + String.join( "; ", result.getErrors() ),
                                                         config.getPreset(), "validateCurrentKeys", keys == null ? null : keys.getVersion(), null ));
  }

  private Future<Void> ensureInitialized()
  {
    return isInitialized() ? Future.succeededFuture() : initialize();
  }

  /**
   * @return a valid current pair, rotating first when it is missing or expired
   */
  public Future<KeyPair> ensureValidKeys()
  {
    return ensureInitialized().compose( v ->
    {
      Future<KeyPair> inFlight = inFlightRotation();
      if( inFlight != null )
        return inFlight;

      if( rotation.needsRotation( currentKeys ))
      {
        LOGGER.info( "Current keys need rotation" );
        return rotateKeys( null );
      }

      return Future.succeededFuture( currentKeys );
    });
  }

  private synchronized Future<KeyPair> inFlightRotation()
  {
    return rotationFuture;
  }

  public Future<KeyPair> rotateKeys()
  {
    return rotateKeys( RotationReason.MANUAL_ROTATION );
  }

  /**
   * Replaces the current pair. The previous pair remains usable for
   * decryption during the grace period.
   *
   * @param reason recorded in the rotation history; null lets the history
   *               choose between initial and scheduled rotation
   */
  public Future<KeyPair> rotateKeys( RotationReason reason )
  {
    Promise<KeyPair> promise;
    KeyPair          outgoing;
    long             startedIn;

    synchronized( this )
    {
      if( rotationFuture != null )
      {
        LOGGER.info( "Rotation already in progress, joining it" );
        return rotationFuture;
      }
      if( !isInitialized() )
        return Future.failedFuture( new KeyManagerException( "KeyManager is not initialized", config.getPreset(), "rotateKeys" ));

      promise        = Promise.promise();
      rotationFuture = promise.future();
      outgoing       = currentKeys;
      startedIn      = generation;
      state          = State.ROTATING;
    }

    LOGGER.info( "Starting key rotation from version {}", outgoing == null ? null : outgoing.getVersion() );

    rotation.performKeyRotation( outgoing, reason ).onComplete( ar ->
    {
      synchronized( this )
      {
        if( generation != startedIn )
        {
          if( ar.succeeded() )
            lifecycle.securelyClearKey( ar.result() );

          LOGGER.warn( "KeyManager was reset during rotation, discarding the new key pair" );
          promise.fail( new KeyManagerException( "Key rotation abandoned: KeyManager was reset", config.getPreset(), "rotateKeys",
                                                 outgoing == null ? null : outgoing.getVersion(), ar.failed() ? ar.cause() : null ));
          return;
        }

        rotationFuture = null;
        state          = State.READY;

        if( ar.failed() )
        {
          rotating = previousKeys != null;
          LOGGER.error( "Key rotation failed: {}", ar.cause().getMessage() );
          promise.fail( new KeyManagerException( "Key rotation failed: " + ar.cause().getMessage(), config.getPreset(), "rotateKeys",
                                                 outgoing == null ? null : outgoing.getVersion(), ar.cause() ));
          return;
        }

        KeyPair replaced = previousKeys;
        previousKeys      = outgoing;
        currentKeys       = ar.result();
        rotating          = true;
        rotationStartTime = Instant.now();
        lastRotation      = rotationStartTime;

        if( replaced != null && lifecycle != null )
          lifecycle.securelyClearKey( replaced );

        scheduleGraceCleanup();
      }

      LOGGER.info( "Key rotation complete, now on version {}", ar.result().getVersion() );
      promise.complete( ar.result() );
    });

    return promise.future();
  }

  // caller holds the lock
  private void scheduleGraceCleanup()
  {
    cancelCleanupTimer();

    long delay = Math.max( 1L, config.getRotationGracePeriod().toMillis() );
    cleanupTimerId = vertx.setTimer( delay, id -> endGracePeriod() );

    LOGGER.debug( "Previous keys retained for {} ms", delay );
  }

  private synchronized void endGracePeriod()
  {
    cleanupTimerId = null;

    if( previousKeys != null )
    {
      LOGGER.info( "Grace period over, clearing key version {}", previousKeys.getVersion() );
      lifecycle.securelyClearKey( previousKeys );
    }

    previousKeys      = null;
    rotating          = false;
    rotationStartTime = null;
  }

  private synchronized void cancelCleanupTimer()
  {
    if( cleanupTimerId != null )
    {
      vertx.cancelTimer( cleanupTimerId );
      cleanupTimerId = null;
    }
  }

  /**
   * Current pair first, then the previous one while the grace period lasts.
   * The pairs are copies owned by the caller, who should destroy them once
   * done; the grace timer or a reset cannot zero them in the meantime.
   */
  public Future<List<KeyPair>> getDecryptionKeys()
  {
    return ensureValidKeys().compose( ignored ->
    {
      List<KeyPair> keys = new ArrayList<>( 2 );
      synchronized( this )
      {
        KeyPair current = currentKeys;
        if( current == null || current.isDestroyed() )
          return Future.<List<KeyPair>>failedFuture( new KeyManagerException( "KeyManager keys were cleared", config.getPreset(), "getDecryptionKeys" ));

        keys.add( current.copy() );

        KeyPair previous = previousKeys;
        if( previous != null && !previous.isDestroyed() && rotation.isInGracePeriod( rotationStartTime ))
          keys.add( previous.copy() );
      }

      return Future.succeededFuture( Collections.unmodifiableList( keys ));
    });
  }

  public boolean needsRotation()
  {
    return rotation == null || rotation.needsRotation( currentKeys );
  }

  public KeyValidationResult validateCurrentKeys()
  {
    if( lifecycle == null )
      return new KeyValidationResult( List.of( "KeyManager not initialized" ), false, false, false, true );

    return lifecycle.validateKeys( currentKeys );
  }

  public KeyManagerStatus getStatus()
  {
    KeyPair             current    = currentKeys;
    KeyValidationResult validation = current == null ? null : validateCurrentKeys();

    return new KeyManagerStatus( current != null,
                                 validation != null && validation.isValid(),
                                 current != null && current.isExpired(),
                                 rotating,
                                 current == null ? null : current.getVersion(),
                                 current == null ? null : current.getMetadata().getCreatedAt(),
                                 current == null ? null : current.getMetadata().getExpiresAt(),
                                 storage.getCertDirectory().toString(),
                                 lastRotation );
  }

  public HealthReport healthCheck()
  {
    List<String> issues = new ArrayList<>();

    if( !isInitialized() )
      issues.add( "KeyManager not initialized" );

    if( currentKeys == null )
    {
      issues.add( "No keys available" );
    }
    else
    {
      if( needsRotation() )
        issues.add( "Keys need rotation" );

      KeyValidationResult validation = validateCurrentKeys();
      if( !validation.isValid() )
        issues.add( "Key validation failed: " + String.join( "; ", validation.getErrors() ));
    }

    return new HealthReport( issues );
  }

  /**
   * Discards the current and previous pairs without a grace period and
   * installs a freshly generated pair.
   */
  public Future<KeyPair> forceRegenerate()
  {
    synchronized( this )
    {
      if( rotationFuture != null )
        return Future.failedFuture( new KeyManagerException( "Cannot regenerate keys while a rotation is in progress", config.getPreset(), "forceRegenerate" ));
    }

    return ensureInitialized().compose( v ->
    {
      KeyPair outgoing;
      synchronized( this )
      {
        cancelCleanupTimer();
        outgoing = currentKeys;
        lifecycle.securelyClearKey( previousKeys );

        previousKeys      = null;
        rotating          = false;
        rotationStartTime = null;
      }

      LOGGER.warn( "Forcing key regeneration" );
      return rotateKeys( RotationReason.EMERGENCY_ROTATION ).map( regenerated ->
      {
        synchronized( this )
        {
          cancelCleanupTimer();
          if( previousKeys == outgoing )
            lifecycle.securelyClearKey( outgoing );

          previousKeys      = null;
          rotating          = false;
          rotationStartTime = null;
        }
        return regenerated;
      });
    });
  }

  /**
   * @return a copy of the current public key
   */
  public byte[] getPublicKey()
   throws KeyManagerException
  {
    KeyPair current = currentKeys;
    if( current == null )
      throw new KeyManagerException( "No public key available", config.getPreset(), "getPublicKey" );

    return current.getPublicKey();
  }

  public String getPublicKeyBase64()
   throws KeyManagerException
  {
    return Base64Codec.encode( getPublicKey() );
  }

  public KeyPair getKeyPair()
  {
    return currentKeys;
  }

  public Preset getPreset()
  {
    return config.getPreset();
  }

  public Future<RotationHistory> getRotationHistory()
  {
    return history.getRotationHistory();
  }

  public Future<RotationStats> getRotationStats()
  {
    return history.getRotationStats();
  }

  public Future<Integer> cleanupOldBackups()
  {
    return storage.cleanupOldBackups();
  }

  /**
   * Zeroes every key held in memory and drops the references. A rotation or
   * initialization still running is abandoned: its pair is zeroed when it
   * completes and its future fails. The manager must be initialized again.
   */
  public synchronized void securelyClearKeys()
  {
    if( currentKeys  != null ) currentKeys.destroy();
    if( previousKeys != null ) previousKeys.destroy();

    currentKeys    = null;
    previousKeys   = null;
    rotationFuture = null;
    initFuture     = null;
    state          = State.UNINITIALIZED;
    generation++;

    LOGGER.info( "KeyManager keys cleared" );
  }

  /**
   * Cancels timers, clears all keys and returns to UNINITIALIZED.
   */
  public synchronized void reset()
  {
    cancelCleanupTimer();
    securelyClearKeys();

    rotating          = false;
    rotationStartTime = null;
    lastRotation      = null;
  }

  @Override
  public void close()
  {
    reset();
  }
}
