package hybrid.crypto;

import java.util.Arrays;
import java.util.List;

import com.fasterxml.jackson.core.type.TypeReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import hybrid.exceptions.EncryptionException;
import hybrid.exceptions.ErrorKind;
import hybrid.model.EncryptedData;
import hybrid.model.Preset;
import hybrid.model.ValidationResult;
import hybrid.utils.Base64Codec;
import hybrid.utils.EncryptedDataValidator;
import hybrid.utils.Serialization;

/**
 * ML-KEM + AES-256-GCM hybrid encryption for one preset.
 *
 * Encryption serializes the value to canonical JSON, encapsulates a fresh
 * shared secret against the recipient public key, derives the AES key with
 * HKDF and seals the bytes under a random nonce. The engine holds no key
 * material between calls and is safe for concurrent use.
 */
public class HybridEncryption
{
  private static final Logger LOGGER = LoggerFactory.getLogger( HybridEncryption.class );

  private final Preset          preset;
  private final MlKemAlgorithm  asymmetric;
  private final AesGcmAlgorithm symmetric;

  public HybridEncryption()
  {
    this( Preset.NORMAL );
  }

  public HybridEncryption( Preset preset )
  {
    if( preset == null )
      throw new IllegalArgumentException( "preset cannot be null" );

    this.preset     = preset;
    this.asymmetric = new MlKemAlgorithm( preset );
    this.symmetric  = new AesGcmAlgorithm( preset );
  }

  public Preset getPreset() { return preset; }

  public EncryptedData encrypt( Object data, byte[] publicKey )
   throws EncryptionException
  {
    if( publicKey == null )
      throw new EncryptionException( "Public key must be provided", ErrorKind.VALIDATION, preset, "encrypt" );
    if( publicKey.length != preset.getPublicKeyLength() )
      throw new EncryptionException( "Invalid " + asymmetric.getName() + " public key length", ErrorKind.ALGORITHM_ASYMMETRIC, preset, "encrypt" );

    byte[]           plaintext     = Serialization.serialize( data );
    KemEncapsulation encapsulation = asymmetric.encapsulate( publicKey );
    byte[]           sharedSecret  = encapsulation.getSharedSecret();
    byte[]           derivedKey    = null;
    try
    {
      derivedKey = KeyDerivation.deriveKey( preset, sharedSecret );

      byte[] nonce  = symmetric.generateNonce();
      byte[] sealed = symmetric.encrypt( plaintext, derivedKey, nonce );

      EncryptedData result = new EncryptedData( preset, Base64Codec.encode( sealed ), Base64Codec.encode( encapsulation.getCipherText() ), Base64Codec.encode( nonce ) );

      ValidationResult validation = EncryptedDataValidator.validate( result );
      if( !validation.isOk() )
        throw new EncryptionException( "Generated encrypted data is invalid: " + String.join( ", ", validation.getErrors() ), ErrorKind.VALIDATION, preset, "encrypt" );

      return result;
    }
    finally
    {
      Arrays.fill( sharedSecret, (byte)0 );
      Arrays.fill( plaintext, (byte)0 );
      if( derivedKey != null )
        Arrays.fill( derivedKey, (byte)0 );
      encapsulation.destroy();
    }
  }

  /**
   * Decrypts into the plain JSON model (Map, List, String, Number, Boolean or null).
   */
  public Object decrypt( EncryptedData encryptedData, byte[] secretKey )
   throws EncryptionException
  {
    return Serialization.deserialize( open( encryptedData, secretKey ) );
  }

  public <T> T decrypt( EncryptedData encryptedData, byte[] secretKey, Class<T> type )
   throws EncryptionException
  {
    return Serialization.deserialize( open( encryptedData, secretKey ), type );
  }

  public <T> T decrypt( EncryptedData encryptedData, byte[] secretKey, TypeReference<T> type )
   throws EncryptionException
  {
    return Serialization.deserialize( open( encryptedData, secretKey ), type );
  }

  /**
   * Tries each secret key in order and returns the first successful result.
   * The error raised when every key fails reports only how many keys were tried.
   */
  public Object decryptWithGracePeriod( EncryptedData encryptedData, List<byte[]> secretKeys )
   throws EncryptionException
  {
    return Serialization.deserialize( openWithGracePeriod( encryptedData, secretKeys ) );
  }

  public <T> T decryptWithGracePeriod( EncryptedData encryptedData, List<byte[]> secretKeys, Class<T> type )
   throws EncryptionException
  {
    return Serialization.deserialize( openWithGracePeriod( encryptedData, secretKeys ), type );
  }

  public <T> T decryptWithGracePeriod( EncryptedData encryptedData, List<byte[]> secretKeys, TypeReference<T> type )
   throws EncryptionException
  {
    return Serialization.deserialize( openWithGracePeriod( encryptedData, secretKeys ), type );
  }

  private byte[] openWithGracePeriod( EncryptedData encryptedData, List<byte[]> secretKeys )
   throws EncryptionException
  {
    if( secretKeys == null || secretKeys.isEmpty() )
      throw new EncryptionException( "At least one secret key must be provided", ErrorKind.OPERATION, preset, "decryptWithGracePeriod" );

    EncryptionException lastError = null;
    for( int i = 0; i < secretKeys.size(); i++ )
    {
      try
      {
        byte[] result = open( encryptedData, secretKeys.get( i ) );
        if( i > 0 )
          LOGGER.info( "Decryption succeeded with fallback key {} during grace period", i );

        return result;
      }
      catch( EncryptionException e )
      {
        if( e.getKind() == ErrorKind.FORMAT )
          throw e;

        lastError = e;
        if( i < secretKeys.size() - 1 )
          LOGGER.warn( "Decryption failed with key {}, trying next key", i );
      }
    }

    throw new EncryptionException( "Grace period decryption failed with all " + secretKeys.size() + " available keys", ErrorKind.OPERATION, preset, "decryptWithGracePeriod", lastError );
  }

  /**
   * Validates the record, then decapsulates, derives and opens it.
   */
  private byte[] open( EncryptedData encryptedData, byte[] secretKey )
   throws EncryptionException
  {
    ValidationResult validation = EncryptedDataValidator.validate( encryptedData );
    if( !validation.isOk() )
      throw EncryptionException.create( "Invalid encrypted data format: " + String.join( ", ", validation.getErrors() ), ErrorKind.FORMAT, preset, "decrypt" );

    Preset dataPreset = Preset.fromString( encryptedData.getPreset() );
    if( dataPreset != preset )
      throw new EncryptionException( "Preset mismatch: data was encrypted with " + dataPreset.getWireName() + ", engine is configured for " + preset.getWireName(),
                                     ErrorKind.OPERATION, preset, "decrypt" );

    if( secretKey == null )
      throw new EncryptionException( "Secret key must be provided", ErrorKind.VALIDATION, preset, "decrypt" );
    if( secretKey.length != preset.getSecretKeyLength() )
      throw new EncryptionException( "Invalid " + asymmetric.getName() + " secret key length", ErrorKind.ALGORITHM_ASYMMETRIC, preset, "decrypt" );

    byte[] cipherText = Base64Codec.decode( encryptedData.getCipherText() );
    byte[] content    = Base64Codec.decode( encryptedData.getEncryptedContent() );
    byte[] nonce      = Base64Codec.decode( encryptedData.getNonce() );

    byte[] sharedSecret = null;
    byte[] derivedKey   = null;
    try
    {
      sharedSecret = asymmetric.decapsulate( cipherText, secretKey );
      derivedKey   = KeyDerivation.deriveKey( preset, sharedSecret );

      try
      {
        return symmetric.decrypt( content, derivedKey, nonce );
      }
      catch( EncryptionException e )
      {
        // ML-KEM rejects implicitly, so a wrong key or altered KEM ciphertext first shows up here.
        throw new EncryptionException( "Decryption failed: the secret key does not open this ciphertext", ErrorKind.ALGORITHM_ASYMMETRIC, preset, "decrypt", e );
      }
    }
    catch( EncryptionException e )
    {
      throw e;
    }
    catch( RuntimeException e )
    {
      throw new EncryptionException( "Decryption failed", ErrorKind.OPERATION, preset, "decrypt", e );
    }
    finally
    {
      if( sharedSecret != null )
        Arrays.fill( sharedSecret, (byte)0 );
      if( derivedKey != null )
        Arrays.fill( derivedKey, (byte)0 );
    }
  }
}
