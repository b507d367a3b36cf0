package hybrid.model;

import java.time.Instant;

import io.vertx.core.json.JsonObject;

/**
 * Snapshot of the key manager state for status reporting.
 */
public class KeyManagerStatus
{
  private final boolean hasKeys;
  private final boolean keysValid;
  private final boolean keysExpired;
  private final boolean rotating;
  private final Integer currentKeyVersion;
  private final Instant createdAt;
  private final Instant expiresAt;
  private final String  certPath;
  private final Instant lastRotation;

  public KeyManagerStatus( boolean hasKeys, boolean keysValid, boolean keysExpired, boolean rotating, Integer currentKeyVersion,
                           Instant createdAt, Instant expiresAt, String certPath, Instant lastRotation )
  {
    this.hasKeys           = hasKeys;
    this.keysValid         = keysValid;
    this.keysExpired       = keysExpired;
    this.rotating          = rotating;
    this.currentKeyVersion = currentKeyVersion;
    this.createdAt         = createdAt;
    this.expiresAt         = expiresAt;
    this.certPath          = certPath;
    this.lastRotation      = lastRotation;
  }

  public boolean hasKeys()              { return hasKeys;           }
  public boolean isKeysValid()          { return keysValid;         }
  public boolean isKeysExpired()        { return keysExpired;       }
  public boolean isRotating()           { return rotating;          }
  public Integer getCurrentKeyVersion() { return currentKeyVersion; }
  public Instant getCreatedAt()         { return createdAt;         }
  public Instant getExpiresAt()         { return expiresAt;         }
  public String  getCertPath()          { return certPath;          }
  public Instant getLastRotation()      { return lastRotation;      }

  public JsonObject toJson()
  {
    return new JsonObject().put( "hasKeys",           hasKeys )
                           .put( "keysValid",         keysValid )
                           .put( "keysExpired",       keysExpired )
                           .put( "isRotating",        rotating )
                           .put( "currentKeyVersion", currentKeyVersion )
                           .put( "createdAt",         createdAt    == null ? null : createdAt.toString() )
                           .put( "expiresAt",         expiresAt    == null ? null : expiresAt.toString() )
                           .put( "certPath",          certPath )
                           .put( "lastRotation",      lastRotation == null ? null : lastRotation.toString() );
  }

  @Override
  public String toString()
  {
    return String.format( "KeyManagerStatus{hasKeys=%s, valid=%s, expired=%s, rotating=%s, version=%s}", hasKeys, keysValid, keysExpired, rotating, currentKeyVersion );
  }
}
