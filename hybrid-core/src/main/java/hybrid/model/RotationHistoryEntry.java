package hybrid.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties( ignoreUnknown = true )
public class RotationHistoryEntry
{
  @JsonProperty( "version"   ) private final int            version;
  @JsonProperty( "createdAt" ) private final String         createdAt;
  @JsonProperty( "expiresAt" ) private final String         expiresAt;
  @JsonProperty( "preset"    ) private final Preset         preset;
  @JsonProperty( "rotatedAt" ) private final String         rotatedAt;
  @JsonProperty( "reason"    ) private final RotationReason reason;

  @JsonCreator
  public RotationHistoryEntry( @JsonProperty( "version"   ) int            version,
                               @JsonProperty( "createdAt" ) String         createdAt,
                               @JsonProperty( "expiresAt" ) String         expiresAt,
                               @JsonProperty( "preset"    ) Preset         preset,
                               @JsonProperty( "rotatedAt" ) String         rotatedAt,
                               @JsonProperty( "reason"    ) RotationReason reason )
  {
    this.version   = version;
    this.createdAt = createdAt;
    this.expiresAt = expiresAt;
    this.preset    = preset;
    this.rotatedAt = rotatedAt;
    this.reason    = reason;
  }

  public int            getVersion()   { return version;   }
  public String         getCreatedAt() { return createdAt; }
  public String         getExpiresAt() { return expiresAt; }
  public Preset         getPreset()    { return preset;    }
  public String         getRotatedAt() { return rotatedAt; }
  public RotationReason getReason()    { return reason;    }

  @Override
  public String toString()
  {
    return String.format( "RotationHistoryEntry{version=%d, preset=%s, reason=%s, rotatedAt=%s}", version, preset, reason, rotatedAt );
  }
}
