package hybrid.service;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import hybrid.exceptions.EncryptionException;
import hybrid.exceptions.ErrorKind;
import hybrid.model.KeyManagerIF;
import hybrid.utils.KeyManagerConfig;

/**
 * Checks a {@link KeyManagerConfig} before the manager touches the file system.
 */
public class KeyConfigurationService
{
  private static final Logger LOGGER = LoggerFactory.getLogger( KeyConfigurationService.class );

  private final KeyManagerConfig config;

  public KeyConfigurationService( KeyManagerConfig config )
  {
    if( config == null )
      throw new IllegalArgumentException( "config cannot be null" );

    this.config = config;
  }

  public KeyManagerConfig getConfig() { return config; }

  /**
   * @return every configuration defect found, empty when the config is usable
   */
  public List<String> collectErrors()
  {
    List<String> errors = new ArrayList<>( config.getParseErrors() );

    if( config.getPreset() == null )
      errors.add( "Invalid preset: " + config.getPresetValue() );

    if( config.getKeyExpiryMonths() <= 0 )
      errors.add( "keyExpiryMonths must be positive (got " + config.getKeyExpiryMonths() + ")" );

    if( config.getRotationGracePeriod().isNegative() )
      errors.add( "rotationGracePeriod must not be negative (got " + config.getRotationGracePeriod() + ")" );

    if( config.getRotationIntervalInWeeks() <= 0 || config.getRotationIntervalInWeeks() > KeyManagerIF.MaxRotationIntervalWeeks )
      errors.add( "rotationIntervalInWeeks must be between 1 and " + KeyManagerIF.MaxRotationIntervalWeeks + " (got " + config.getRotationIntervalInWeeks() + ")" );

    errors.addAll( checkCertPath( config.getCertPath(), config.getAllowedRoot() ));

    return errors;
  }

  public void validateConfig()
   throws EncryptionException
  {
    List<String> errors = collectErrors();
    if( !errors.isEmpty() )
    {
      String msg = "Invalid key manager configuration: " + String.join( "; ", errors );
      LOGGER.error( msg );
      throw new EncryptionException( msg, ErrorKind.CONFIG, config.getPreset(), "validateConfig" );
    }

    LOGGER.debug( "Key manager configuration is valid" );
  }

  static List<String> checkCertPath( String certPath, Path allowedRoot )
  {
    List<String> errors = new ArrayList<>();

    if( certPath == null || certPath.trim().isEmpty() )
    {
      errors.add( "certPath must not be empty" );
      return errors;
    }

    if( certPath.contains( "../" ) || certPath.contains( "..\\" ))
      errors.add( "certPath must not contain traversal sequences: " + certPath );

    try
    {
      Path resolved = Path.of( certPath ).toAbsolutePath().normalize();
      if( !resolved.startsWith( allowedRoot ))
        errors.add( "certPath " + resolved + " is outside the allowed root " + allowedRoot );
    }
    catch( InvalidPathException e )
    {
      errors.add( "certPath is not a valid path: " + certPath );
    }

    return errors;
  }
}
