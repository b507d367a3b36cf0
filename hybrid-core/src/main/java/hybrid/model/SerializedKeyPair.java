package hybrid.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Text form of a {@link KeyPair}: base64 keys and ISO-8601 metadata. Also the
 * shape of key-metadata.json (the metadata part only).
 */
@JsonIgnoreProperties( ignoreUnknown = true )
public class SerializedKeyPair
{
  @JsonProperty( "publicKey" ) private final String   publicKey;
  @JsonProperty( "secretKey" ) private final String   secretKey;
  @JsonProperty( "metadata"  ) private final Metadata metadata;

  @JsonCreator
  public SerializedKeyPair( @JsonProperty( "publicKey" ) String   publicKey,
                            @JsonProperty( "secretKey" ) String   secretKey,
                            @JsonProperty( "metadata"  ) Metadata metadata )
  {
    this.publicKey = publicKey;
    this.secretKey = secretKey;
    this.metadata  = metadata;
  }

  public String   getPublicKey() { return publicKey; }
  public String   getSecretKey() { return secretKey; }
  public Metadata getMetadata()  { return metadata;  }

  @JsonIgnoreProperties( ignoreUnknown = true )
  public static class Metadata
  {
    @JsonProperty( "preset"    ) private final String  preset;
    @JsonProperty( "version"   ) private final Integer version;
    @JsonProperty( "createdAt" ) private final String  createdAt;
    @JsonProperty( "expiresAt" ) private final String  expiresAt;

    @JsonCreator
    public Metadata( @JsonProperty( "preset"    ) String  preset,
                     @JsonProperty( "version"   ) Integer version,
                     @JsonProperty( "createdAt" ) String  createdAt,
                     @JsonProperty( "expiresAt" ) String  expiresAt )
    {
      this.preset    = preset;
      this.version   = version;
      this.createdAt = createdAt;
      this.expiresAt = expiresAt;
    }

    public String  getPreset()    { return preset;    }
    public Integer getVersion()   { return version;   }
    public String  getCreatedAt() { return createdAt; }
    public String  getExpiresAt() { return expiresAt; }

    @JsonIgnore
    public boolean isComplete()
    {
      return preset != null && version != null && createdAt != null && expiresAt != null;
    }
  }
}
