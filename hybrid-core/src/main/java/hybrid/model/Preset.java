package hybrid.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Security level bundle. Each preset fixes the ML-KEM parameter set and all
 * derived key, nonce and salt sizes used by the hybrid scheme.
 */
public enum Preset
{
  //             wire name        kem bits  pk    sk    ct    ss  aes  nonce  hkdf       salt
  NORMAL(        "normal",        768,      1184, 2400, 1088, 32, 32,  12,    "SHA-256", 32 ),
  HIGH_SECURITY( "high_security", 1024,     1568, 3168, 1568, 32, 32,  16,    "SHA-512", 64 );

  private final String wireName;
  private final int    kemLevel;
  private final int    publicKeyLength;
  private final int    secretKeyLength;
  private final int    cipherTextLength;
  private final int    sharedSecretLength;
  private final int    aesKeyLength;
  private final int    nonceLength;
  private final String hkdfHash;
  private final int    hkdfSaltLength;

  Preset( String wireName, int kemLevel, int publicKeyLength, int secretKeyLength, int cipherTextLength,
          int sharedSecretLength, int aesKeyLength, int nonceLength, String hkdfHash, int hkdfSaltLength )
  {
    this.wireName           = wireName;
    this.kemLevel           = kemLevel;
    this.publicKeyLength    = publicKeyLength;
    this.secretKeyLength    = secretKeyLength;
    this.cipherTextLength   = cipherTextLength;
    this.sharedSecretLength = sharedSecretLength;
    this.aesKeyLength       = aesKeyLength;
    this.nonceLength        = nonceLength;
    this.hkdfHash           = hkdfHash;
    this.hkdfSaltLength     = hkdfSaltLength;
  }

  @JsonValue
  public String getWireName()           { return wireName;           }
  public int    getKemLevel()           { return kemLevel;           }
  public int    getPublicKeyLength()    { return publicKeyLength;    }
  public int    getSecretKeyLength()    { return secretKeyLength;    }
  public int    getCipherTextLength()   { return cipherTextLength;   }
  public int    getSharedSecretLength() { return sharedSecretLength; }
  public int    getAesKeyLength()       { return aesKeyLength;       }
  public int    getNonceLength()        { return nonceLength;        }
  public String getHkdfHash()           { return hkdfHash;           }
  public int    getHkdfSaltLength()     { return hkdfSaltLength;     }

  public String getKemName()
  {
    return "ML-KEM-" + kemLevel;
  }

  /**
   * Resolves a preset by wire name or enum name, case-insensitive.
   *
   * @return the preset, or null when the value is not recognized
   */
  @JsonCreator
  public static Preset fromString( String value )
  {
    if( value == null )
      return null;

    String trimmed = value.trim();
    for( Preset p : values() )
    {
      if( p.wireName.equalsIgnoreCase( trimmed ) || p.name().equalsIgnoreCase( trimmed ) )
        return p;
    }
    return null;
  }

  public static boolean isValid( String value )
  {
    return fromString( value ) != null;
  }
}
