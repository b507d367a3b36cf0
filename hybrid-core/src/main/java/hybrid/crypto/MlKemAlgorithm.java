package hybrid.crypto;

import java.security.SecureRandom;

import org.bouncycastle.crypto.AsymmetricCipherKeyPair;
import org.bouncycastle.crypto.SecretWithEncapsulation;
import org.bouncycastle.pqc.crypto.mlkem.MLKEMExtractor;
import org.bouncycastle.pqc.crypto.mlkem.MLKEMGenerator;
import org.bouncycastle.pqc.crypto.mlkem.MLKEMKeyGenerationParameters;
import org.bouncycastle.pqc.crypto.mlkem.MLKEMKeyPairGenerator;
import org.bouncycastle.pqc.crypto.mlkem.MLKEMParameters;
import org.bouncycastle.pqc.crypto.mlkem.MLKEMPrivateKeyParameters;
import org.bouncycastle.pqc.crypto.mlkem.MLKEMPublicKeyParameters;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import hybrid.exceptions.EncryptionException;
import hybrid.exceptions.ErrorKind;
import hybrid.model.Preset;

/**
 * ML-KEM key generation, encapsulation and decapsulation over the
 * BouncyCastle lightweight API. The parameter set follows the preset:
 * ML-KEM-768 for NORMAL and ML-KEM-1024 for HIGH_SECURITY.
 */
public class MlKemAlgorithm
{
  private static final Logger LOGGER = LoggerFactory.getLogger( MlKemAlgorithm.class );

  // SecureRandom is thread-safe and OK to share.
  private static final SecureRandom SECURE_RANDOM = new SecureRandom();

  private final Preset          preset;
  private final MLKEMParameters parameters;

  public MlKemAlgorithm( Preset preset )
  {
    if( preset == null )
      throw new IllegalArgumentException( "preset cannot be null" );

    this.preset     = preset;
    this.parameters = preset == Preset.HIGH_SECURITY ? MLKEMParameters.ml_kem_1024 : MLKEMParameters.ml_kem_768;
  }

  public Preset getPreset() { return preset; }

  public String getName()
  {
    return preset.getKemName();
  }

  /**
   * @return { publicKey, secretKey } raw encodings
   */
  public byte[][] generateKeyPair()
  {
    MLKEMKeyPairGenerator generator = new MLKEMKeyPairGenerator();
    generator.init( new MLKEMKeyGenerationParameters( SECURE_RANDOM, parameters ) );

    AsymmetricCipherKeyPair pair = generator.generateKeyPair();

    byte[] publicKey = ((MLKEMPublicKeyParameters)pair.getPublic()).getEncoded();
    byte[] secretKey = ((MLKEMPrivateKeyParameters)pair.getPrivate()).getEncoded();

    LOGGER.debug( "Generated {} key pair (pk={} bytes, sk={} bytes)", getName(), publicKey.length, secretKey.length );
    return new byte[][] { publicKey, secretKey };
  }

  public KemEncapsulation encapsulate( byte[] publicKey )
   throws EncryptionException
  {
    if( publicKey == null )
      throw new EncryptionException( "Public key must be provided", ErrorKind.VALIDATION, preset, "encapsulate" );
    if( publicKey.length != preset.getPublicKeyLength() )
      throw new EncryptionException( "Invalid " + getName() + " public key length: expected " + preset.getPublicKeyLength() + " bytes, got " + publicKey.length,
                                     ErrorKind.ALGORITHM_ASYMMETRIC, preset, "encapsulate" );

    try
    {
      MLKEMGenerator          generator = new MLKEMGenerator( SECURE_RANDOM );
      SecretWithEncapsulation result    = generator.generateEncapsulated( new MLKEMPublicKeyParameters( parameters, publicKey ) );

      KemEncapsulation encapsulation = new KemEncapsulation( result.getSecret(), result.getEncapsulation() );
      result.destroy();
      return encapsulation;
    }
    catch( Exception e )
    {
      throw new EncryptionException( getName() + " encapsulation failed", ErrorKind.ALGORITHM_ASYMMETRIC, preset, "encapsulate", e );
    }
  }

  /**
   * Recovers the shared secret. ML-KEM rejects implicitly: a ciphertext that
   * does not belong to the key yields an unrelated secret rather than an error.
   */
  public byte[] decapsulate( byte[] cipherText, byte[] secretKey )
   throws EncryptionException
  {
    if( secretKey == null )
      throw new EncryptionException( "Secret key must be provided", ErrorKind.VALIDATION, preset, "decapsulate" );
    if( secretKey.length != preset.getSecretKeyLength() )
      throw new EncryptionException( "Invalid " + getName() + " secret key length: expected " + preset.getSecretKeyLength() + " bytes, got " + secretKey.length,
                                     ErrorKind.ALGORITHM_ASYMMETRIC, preset, "decapsulate" );
    if( cipherText == null || cipherText.length != preset.getCipherTextLength() )
      throw new EncryptionException( "Invalid " + getName() + " ciphertext length: expected " + preset.getCipherTextLength() + " bytes, got " + ( cipherText == null ? 0 : cipherText.length ),
                                     ErrorKind.ALGORITHM_ASYMMETRIC, preset, "decapsulate" );

    try
    {
      MLKEMExtractor extractor = new MLKEMExtractor( new MLKEMPrivateKeyParameters( parameters, secretKey ) );
      return extractor.extractSecret( cipherText );
    }
    catch( Exception e )
    {
      throw new EncryptionException( getName() + " decapsulation failed", ErrorKind.ALGORITHM_ASYMMETRIC, preset, "decapsulate", e );
    }
  }
}
