package hybrid.crypto;

import java.util.Arrays;

import javax.security.auth.Destroyable;

/**
 * Result of an ML-KEM encapsulation: the shared secret kept by the sender
 * and the ciphertext sent to the holder of the secret key.
 */
public class KemEncapsulation implements Destroyable
{
  private final byte[] sharedSecret;
  private final byte[] cipherText;

  private boolean destroyed = false;

  public KemEncapsulation( byte[] sharedSecret, byte[] cipherText )
  {
    if( sharedSecret == null || cipherText == null )
      throw new IllegalArgumentException( "sharedSecret and cipherText cannot be null" );

    this.sharedSecret = sharedSecret;
    this.cipherText   = cipherText;
  }

  public byte[] getSharedSecret() { return sharedSecret.clone(); }
  public byte[] getCipherText()   { return cipherText.clone();   }

  @Override
  public void destroy()
  {
    Arrays.fill( sharedSecret, (byte)0 );
    destroyed = true;
  }

  @Override
  public boolean isDestroyed()
  {
    return destroyed;
  }
}
