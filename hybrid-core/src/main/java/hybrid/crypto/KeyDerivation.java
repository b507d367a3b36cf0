package hybrid.crypto;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import org.bouncycastle.crypto.Digest;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.digests.SHA512Digest;
import org.bouncycastle.crypto.generators.HKDFBytesGenerator;
import org.bouncycastle.crypto.params.HKDFParameters;

import hybrid.exceptions.EncryptionException;
import hybrid.exceptions.ErrorKind;
import hybrid.model.Preset;

/**
 * HKDF derivation of the AES key from a KEM shared secret.
 *
 * The salt is itself derived from the shared secret, so sender and receiver
 * arrive at the same key without transmitting it.
 */
public class KeyDerivation
{
  public static final String KEY_INFO  = "HybridEncryption-v2.0";
  public static final String SALT_INFO = "HKDF-SALT-DERIVATION";

  public static byte[] deriveKey( Preset preset, byte[] sharedSecret )
   throws EncryptionException
  {
    if( preset == null )
      throw new IllegalArgumentException( "preset cannot be null" );
    if( sharedSecret == null || sharedSecret.length != preset.getSharedSecretLength() )
      throw new EncryptionException( "Shared secret must be " + preset.getSharedSecretLength() + " bytes, got " + ( sharedSecret == null ? 0 : sharedSecret.length ),
                                     ErrorKind.ALGORITHM_KDF, preset, "deriveKey" );

    byte[] salt = null;
    try
    {
      salt = hkdf( preset, sharedSecret, new byte[0], SALT_INFO, preset.getHkdfSaltLength() );
      return hkdf( preset, sharedSecret, salt, KEY_INFO, preset.getAesKeyLength() );
    }
    catch( RuntimeException e )
    {
      throw new EncryptionException( "HKDF key derivation failed", ErrorKind.ALGORITHM_KDF, preset, "deriveKey", e );
    }
    finally
    {
      if( salt != null )
        Arrays.fill( salt, (byte)0 );
    }
  }

  private static byte[] hkdf( Preset preset, byte[] ikm, byte[] salt, String info, int length )
  {
    HKDFBytesGenerator hkdf = new HKDFBytesGenerator( digestFor( preset ) );
    hkdf.init( new HKDFParameters( ikm, salt, info.getBytes( StandardCharsets.UTF_8 ) ) );

    byte[] out = new byte[length];
    hkdf.generateBytes( out, 0, length );
    return out;
  }

  private static Digest digestFor( Preset preset )
  {
    return "SHA-512".equals( preset.getHkdfHash() ) ? new SHA512Digest() : new SHA256Digest();
  }
}
