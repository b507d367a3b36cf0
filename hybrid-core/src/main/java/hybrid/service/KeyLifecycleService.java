package hybrid.service;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import hybrid.exceptions.EncryptionException;
import hybrid.exceptions.KeyManagerException;
import hybrid.model.KeyPair;
import hybrid.model.KeyValidationResult;
import hybrid.model.Preset;
import hybrid.model.ValidationResult;
import hybrid.provider.KeyProvider;

/**
 * Creation, checking and disposal of key pairs through a {@link KeyProvider}.
 */
public class KeyLifecycleService
{
  private static final Logger LOGGER = LoggerFactory.getLogger( KeyLifecycleService.class );

  private final KeyProvider provider;

  public KeyLifecycleService( KeyProvider provider )
  {
    if( provider == null )
      throw new IllegalArgumentException( "provider cannot be null" );

    this.provider = provider;
  }

  public KeyProvider getProvider() { return provider; }

  /**
   * Generates and validates a pair with the given version. Blocking; callers
   * on an event loop must run it through executeBlocking.
   */
  public KeyPair createNewKeyPair( int version )
   throws EncryptionException
  {
    KeyPair pair = provider.generateKeyPair( version, null );

    ValidationResult result = provider.validateKeyPair( pair );
    if( !result.isOk() )
    {
      pair.destroy();
      throw new KeyManagerException( "Generated key pair failed validation: " + String.join( "; ", result.getErrors() ),
                                     provider.getPreset(), "createNewKeyPair", version, null );
    }

    return pair;
  }

  public KeyValidationResult validateKeys( KeyPair keyPair )
  {
    List<String> errors = new ArrayList<>();

    if( keyPair == null )
    {
      errors.add( "No key pair loaded" );
      return new KeyValidationResult( errors, false, false, false, true );
    }

    ValidationResult structural = provider.validateKeyPair( keyPair );
    errors.addAll( structural.getErrors() );

    Preset  preset         = keyPair.getPreset();
    boolean publicKeyValid = preset != null && keyPair.getPublicKeyLength() == preset.getPublicKeyLength();
    boolean secretKeyValid = preset != null && keyPair.getSecretKeyLength() == preset.getSecretKeyLength();
    boolean matches        = structural.isOk() && provider.keyPairMatches( keyPair );
    boolean expired        = provider.isKeyPairExpired( keyPair );

    if( structural.isOk() && !matches )
      errors.add( "Public and secret key do not belong together" );
    if( expired )
      errors.add( "Key pair has expired" );

    return new KeyValidationResult( errors, publicKeyValid, secretKeyValid, matches, expired );
  }

  public boolean haveKeysExpired( KeyPair keyPair )
  {
    return provider.isKeyPairExpired( keyPair );
  }

  public void securelyClearKey( KeyPair keyPair )
  {
    if( keyPair != null && !keyPair.isDestroyed() )
    {
      keyPair.destroy();
      LOGGER.debug( "Cleared key pair version {}", keyPair.getVersion() );
    }
  }

  public void securelyClearKeys( KeyPair... keyPairs )
  {
    for( KeyPair kp : keyPairs )
      securelyClearKey( kp );
  }
}
