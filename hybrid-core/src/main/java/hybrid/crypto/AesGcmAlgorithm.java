package hybrid.crypto;

import java.security.SecureRandom;
import java.util.Arrays;

import org.bouncycastle.crypto.InvalidCipherTextException;
import org.bouncycastle.crypto.engines.AESLightEngine;
import org.bouncycastle.crypto.modes.GCMBlockCipher;
import org.bouncycastle.crypto.modes.GCMModeCipher;
import org.bouncycastle.crypto.params.AEADParameters;
import org.bouncycastle.crypto.params.KeyParameter;

import hybrid.exceptions.EncryptionException;
import hybrid.exceptions.ErrorKind;
import hybrid.model.Preset;

/**
 * AES-256-GCM with a 128-bit tag. The output of {@link #encrypt} is the
 * ciphertext followed by the tag.
 */
public class AesGcmAlgorithm
{
  public static final int GCM_TAG_LENGTH = 16;   // 128 bits (bytes)

  private static final SecureRandom SECURE_RANDOM = new SecureRandom();

  private final Preset preset;

  public AesGcmAlgorithm( Preset preset )
  {
    if( preset == null )
      throw new IllegalArgumentException( "preset cannot be null" );

    this.preset = preset;
  }

  public Preset getPreset() { return preset; }

  public byte[] generateNonce()
  {
    byte[] nonce = new byte[preset.getNonceLength()];
    SECURE_RANDOM.nextBytes( nonce );
    return nonce;
  }

  public byte[] encrypt( byte[] plaintext, byte[] key, byte[] nonce )
   throws EncryptionException
  {
    if( plaintext == null )
      throw new EncryptionException( "plaintext cannot be null", ErrorKind.VALIDATION, preset, "encrypt" );
    checkKeyMaterial( key, nonce, "encrypt" );

    try
    {
      // Fresh cipher per call
      GCMModeCipher gcm = GCMBlockCipher.newInstance( new AESLightEngine() );
      gcm.init( true, new AEADParameters( new KeyParameter( key ), GCM_TAG_LENGTH * 8, nonce ) );

      byte[] output = new byte[gcm.getOutputSize( plaintext.length )];
      int len = gcm.processBytes( plaintext, 0, plaintext.length, output, 0 );
      len += gcm.doFinal( output, len );

      return len == output.length ? output : Arrays.copyOf( output, len );
    }
    catch( InvalidCipherTextException | RuntimeException e )
    {
      throw new EncryptionException( "AES-256-GCM encryption failed", ErrorKind.ALGORITHM_SYMMETRIC, preset, "encrypt", e );
    }
  }

  /**
   * @throws EncryptionException of kind ALGORITHM_SYMMETRIC when the tag does not verify
   */
  public byte[] decrypt( byte[] cipherTextWithTag, byte[] key, byte[] nonce )
   throws EncryptionException
  {
    if( cipherTextWithTag == null || cipherTextWithTag.length < GCM_TAG_LENGTH )
      throw new EncryptionException( "AES-256-GCM input is shorter than the authentication tag", ErrorKind.ALGORITHM_SYMMETRIC, preset, "decrypt" );
    checkKeyMaterial( key, nonce, "decrypt" );

    byte[] output = null;
    try
    {
      GCMModeCipher gcm = GCMBlockCipher.newInstance( new AESLightEngine() );
      gcm.init( false, new AEADParameters( new KeyParameter( key ), GCM_TAG_LENGTH * 8, nonce ) );

      output = new byte[gcm.getOutputSize( cipherTextWithTag.length )];
      int len = gcm.processBytes( cipherTextWithTag, 0, cipherTextWithTag.length, output, 0 );
      len += gcm.doFinal( output, len );

      return len == output.length ? output : Arrays.copyOf( output, len );
    }
    catch( InvalidCipherTextException e )
    {
      if( output != null )
        Arrays.fill( output, (byte)0 );
      throw new EncryptionException( "AES-256-GCM authentication failed", ErrorKind.ALGORITHM_SYMMETRIC, preset, "decrypt", e );
    }
    catch( RuntimeException e )
    {
      throw new EncryptionException( "AES-256-GCM decryption failed", ErrorKind.ALGORITHM_SYMMETRIC, preset, "decrypt", e );
    }
  }

  private void checkKeyMaterial( byte[] key, byte[] nonce, String operation )
   throws EncryptionException
  {
    if( key == null || key.length != preset.getAesKeyLength() )
      throw new EncryptionException( "AES-256-GCM requires a " + preset.getAesKeyLength() + "-byte key, got " + ( key == null ? 0 : key.length ) + " bytes",
                                     ErrorKind.ALGORITHM_SYMMETRIC, preset, operation );
    if( nonce == null || nonce.length != preset.getNonceLength() )
      throw new EncryptionException( "AES-GCM requires a " + preset.getNonceLength() + "-byte nonce, got " + ( nonce == null ? 0 : nonce.length ) + " bytes",
                                     ErrorKind.ALGORITHM_SYMMETRIC, preset, operation );
  }
}
