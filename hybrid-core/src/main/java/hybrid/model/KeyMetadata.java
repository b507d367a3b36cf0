package hybrid.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Metadata stamped on every generated key pair. Fields are nullable so that a
 * malformed pair can be represented and reported by validation.
 */
public class KeyMetadata
{
  private final Preset  preset;
  private final int     version;
  private final Instant createdAt;
  private final Instant expiresAt;

  public KeyMetadata( Preset preset, int version, Instant createdAt, Instant expiresAt )
  {
    this.preset    = preset;
    this.version   = version;
    this.createdAt = createdAt;
    this.expiresAt = expiresAt;
  }

  public Preset  getPreset()    { return preset;    }
  public int     getVersion()   { return version;   }
  public Instant getCreatedAt() { return createdAt; }
  public Instant getExpiresAt() { return expiresAt; }

  public KeyMetadata withVersion( int newVersion )
  {
    return new KeyMetadata( preset, newVersion, createdAt, expiresAt );
  }

  public boolean isExpired( Instant now )
  {
    return expiresAt == null || now.isAfter( expiresAt );
  }

  @Override
  public boolean equals( Object obj )
  {
    if( this == obj )
      return true;
    if( obj == null || getClass() != obj.getClass() )
      return false;

    KeyMetadata that = (KeyMetadata)obj;
    return version == that.version && preset == that.preset && Objects.equals( createdAt, that.createdAt ) && Objects.equals( expiresAt, that.expiresAt );
  }

  @Override
  public int hashCode()
  {
    return Objects.hash( preset, version, createdAt, expiresAt );
  }

  @Override
  public String toString()
  {
    return String.format( "KeyMetadata{preset=%s, version=%d, createdAt=%s, expiresAt=%s}", preset, version, createdAt, expiresAt );
  }
}
