package hybrid.provider;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import hybrid.crypto.KemEncapsulation;
import hybrid.crypto.MlKemAlgorithm;
import hybrid.exceptions.EncryptionException;
import hybrid.exceptions.ErrorKind;
import hybrid.exceptions.FormatConversionException;
import hybrid.model.KeyManagerIF;
import hybrid.model.KeyMetadata;
import hybrid.model.KeyPair;
import hybrid.model.Preset;
import hybrid.model.SerializedKeyPair;
import hybrid.model.ValidationResult;
import hybrid.utils.Base64Codec;
import hybrid.utils.ConstantTime;

public class MlKemKeyProvider implements KeyProvider
{
  private static final Logger LOGGER = LoggerFactory.getLogger( MlKemKeyProvider.class );

  public static final int MIN_EXPIRY_MONTHS = 1;
  public static final int MAX_EXPIRY_MONTHS = 12;

  private final Preset         preset;
  private final int            expiryMonths;
  private final MlKemAlgorithm algorithm;

  public MlKemKeyProvider( Preset preset )
  {
    this( preset, KeyManagerIF.DefaultKeyExpiryMonths );
  }

  public MlKemKeyProvider( Preset preset, int expiryMonths )
  {
    if( preset == null )
      throw new IllegalArgumentException( "preset cannot be null" );

    this.preset       = preset;
    this.expiryMonths = expiryMonths;
    this.algorithm    = new MlKemAlgorithm( preset );
  }

  @Override
  public String getAlgorithmName() { return KeyManagerIF.KemAlgorithm; }

  @Override
  public Preset getPreset() { return preset; }

  public int getExpiryMonths() { return expiryMonths; }

  @Override
  public KeyPair generateKeyPair()
   throws EncryptionException
  {
    return generateKeyPair( null, null );
  }

  @Override
  public KeyPair generateKeyPair( Integer version, Instant expiresAt )
   throws EncryptionException
  {
    Instant now = Instant.now();
    Instant exp = expiresAt != null ? expiresAt : now.atZone( ZoneOffset.UTC ).plusMonths( expiryMonths ).toInstant();
    int     ver = version   != null ? version   : 1;

    byte[][] keys;
    try
    {
      keys = algorithm.generateKeyPair();
    }
    catch( RuntimeException e )
    {
      throw new EncryptionException( algorithm.getName() + " key generation failed", ErrorKind.ALGORITHM_ASYMMETRIC, preset, "generateKeyPair", e );
    }

    KeyPair pair = new KeyPair( keys[0], keys[1], new KeyMetadata( preset, ver, now, exp ) );
    Arrays.fill( keys[1], (byte)0 );

    LOGGER.info( "Generated {} key pair version {} expiring {}", algorithm.getName(), ver, exp );
    return pair;
  }

  @Override
  public ValidationResult validateKeyPair( KeyPair keyPair )
  {
    List<String> errors = new ArrayList<>();

    if( keyPair == null )
    {
      errors.add( "Key pair is missing" );
      return new ValidationResult( errors );
    }

    KeyMetadata metadata = keyPair.getMetadata();
    Preset      kpPreset = metadata == null ? null : metadata.getPreset();

    if( !keyPair.hasPublicKey() )
      errors.add( "publicKey must be a byte array" );
    else if( kpPreset != null && keyPair.getPublicKeyLength() != kpPreset.getPublicKeyLength() )
      errors.add( "publicKey must be " + kpPreset.getPublicKeyLength() + " bytes for " + kpPreset.getWireName() + " (got " + keyPair.getPublicKeyLength() + ")" );

    if( !keyPair.hasSecretKey() )
      errors.add( "secretKey must be a byte array" );
    else if( kpPreset != null && keyPair.getSecretKeyLength() != kpPreset.getSecretKeyLength() )
      errors.add( "secretKey must be " + kpPreset.getSecretKeyLength() + " bytes for " + kpPreset.getWireName() + " (got " + keyPair.getSecretKeyLength() + ")" );

    if( metadata == null )
    {
      errors.add( "metadata is missing" );
      return new ValidationResult( errors );
    }

    if( kpPreset == null )
      errors.add( "preset is not a recognized value" );

    if( metadata.getVersion() < 1 )
      errors.add( "version must be a positive integer (got " + metadata.getVersion() + ")" );

    if( metadata.getCreatedAt() == null )
      errors.add( "createdAt must be a valid date" );
    if( metadata.getExpiresAt() == null )
      errors.add( "expiresAt must be a valid date" );
    if( metadata.getCreatedAt() != null && metadata.getExpiresAt() != null && !metadata.getCreatedAt().isBefore( metadata.getExpiresAt() ))
      errors.add( "createdAt must be before expiresAt" );

    return new ValidationResult( errors );
  }

  @Override
  public boolean isKeyPairExpired( KeyPair keyPair )
  {
    return keyPair == null || keyPair.isExpired();
  }

  @Override
  public boolean keyPairMatches( KeyPair keyPair )
  {
    if( keyPair == null || keyPair.getPreset() != preset )
      return false;

    byte[]           secretKey = keyPair.getSecretKey();
    byte[]           expected  = null;
    byte[]           recovered = null;
    KemEncapsulation probe     = null;
    try
    {
      probe     = algorithm.encapsulate( keyPair.getPublicKey() );
      recovered = algorithm.decapsulate( probe.getCipherText(), secretKey );
      expected  = probe.getSharedSecret();
      return ConstantTime.areEqual( expected, recovered );
    }
    catch( EncryptionException e )
    {
      LOGGER.debug( "Key pair match probe failed: {}", e.getMessage() );
      return false;
    }
    finally
    {
      if( secretKey != null ) Arrays.fill( secretKey, (byte)0 );
      if( expected  != null ) Arrays.fill( expected,  (byte)0 );
      if( recovered != null ) Arrays.fill( recovered, (byte)0 );
      if( probe     != null ) probe.destroy();
    }
  }

  @Override
  public SerializedKeyPair serializeKeyPair( KeyPair keyPair )
  {
    if( keyPair == null || !keyPair.hasPublicKey() || !keyPair.hasSecretKey() )
      throw new IllegalArgumentException( "Key pair keys must be raw byte arrays" );

    KeyMetadata md = keyPair.getMetadata();
    SerializedKeyPair.Metadata smd = md == null ? null
                                                : new SerializedKeyPair.Metadata( md.getPreset()    == null ? null : md.getPreset().getWireName(),
                                                                                  md.getVersion(),
                                                                                  md.getCreatedAt() == null ? null : md.getCreatedAt().toString(),
                                                                                  md.getExpiresAt() == null ? null : md.getExpiresAt().toString() );

    return new SerializedKeyPair( Base64Codec.encode( keyPair.getPublicKey() ), Base64Codec.encode( keyPair.getSecretKey() ), smd );
  }

  @Override
  public KeyPair deserializeKeyPair( SerializedKeyPair serialized )
   throws EncryptionException
  {
    if( serialized == null || serialized.getMetadata() == null || !serialized.getMetadata().isComplete() )
      throw new FormatConversionException( "Serialized key pair is incomplete", "json", "KeyPair", preset, "deserializeKeyPair", null );

    SerializedKeyPair.Metadata smd = serialized.getMetadata();

    Preset p = Preset.fromString( smd.getPreset() );
    if( p == null )
      throw new FormatConversionException( "Serialized key pair has an unknown preset", "json", "KeyPair", preset, "deserializeKeyPair", null );

    try
    {
      KeyMetadata md = new KeyMetadata( p, smd.getVersion(), Instant.parse( smd.getCreatedAt() ), Instant.parse( smd.getExpiresAt() ));
      return new KeyPair( Base64Codec.decode( serialized.getPublicKey() ), Base64Codec.decode( serialized.getSecretKey() ), md );
    }
    catch( DateTimeParseException e )
    {
      throw new FormatConversionException( "Serialized key pair has an invalid date", "json", "KeyPair", preset, "deserializeKeyPair", e );
    }
  }

  @Override
  public List<String> validateConfig( KeyGenerationConfig config )
  {
    List<String> errors = new ArrayList<>();

    if( config == null )
    {
      errors.add( "Key generation config is missing" );
      return errors;
    }

    if( config.getPreset() == null || config.getPreset().trim().isEmpty() )
      errors.add( "preset is required" );
    else if( !Preset.isValid( config.getPreset() ))
      errors.add( "preset is not recognized: " + config.getPreset() );

    if( config.getExpiryMonths() != null )
    {
      try
      {
        int months = Integer.parseInt( config.getExpiryMonths().trim() );
        if( months < MIN_EXPIRY_MONTHS || months > MAX_EXPIRY_MONTHS )
          errors.add( "expiryMonths must be between " + MIN_EXPIRY_MONTHS + " and " + MAX_EXPIRY_MONTHS + " (got " + months + ")" );
      }
      catch( NumberFormatException e )
      {
        errors.add( "expiryMonths must be numeric (got " + config.getExpiryMonths() + ")" );
      }
    }

    return errors;
  }
}
