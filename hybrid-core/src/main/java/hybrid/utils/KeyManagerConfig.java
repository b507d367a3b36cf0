package hybrid.utils;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import hybrid.model.KeyManagerIF;
import hybrid.model.Preset;

/**
 * Key manager settings read from a string map. Unparsable values are
 * recorded rather than thrown so that configuration validation can report
 * them together with every other defect.
 */
public class KeyManagerConfig
{
  private static final Logger LOGGER = LoggerFactory.getLogger( KeyManagerConfig.class );

  private final String   presetValue;
  private final Preset   preset;
  private final String   certPath;
  private final int      keyExpiryMonths;
  private final boolean  autoGenerate;
  private final boolean  enableFileBackup;
  private final Duration rotationGracePeriod;
  private final int      rotationIntervalInWeeks;
  private final Path     allowedRoot;

  private final List<String> parseErrors;

  public KeyManagerConfig()
  {
    this( Collections.emptyMap() );
  }

  public KeyManagerConfig( Map<String, String> data )
  {
    List<String> errors = new ArrayList<>();

    String presetStr = data.get( KeyManagerIF.Preset );
    this.presetValue = presetStr == null ? Preset.NORMAL.getWireName() : presetStr;
    this.preset      = Preset.fromString( presetValue );

    this.certPath                = data.get( KeyManagerIF.CertPath ) != null ? data.get( KeyManagerIF.CertPath ) : KeyManagerIF.DefaultCertPath;
    this.keyExpiryMonths         = parseInt( data, KeyManagerIF.KeyExpiryMonths, KeyManagerIF.DefaultKeyExpiryMonths, errors );
    this.autoGenerate            = parseBoolean( data, KeyManagerIF.AutoGenerate, true );
    this.enableFileBackup        = parseBoolean( data, KeyManagerIF.EnableFileBackup, true );
    this.rotationGracePeriod     = Duration.ofMinutes( parseInt( data, KeyManagerIF.RotationGracePeriodInMinutes, KeyManagerIF.DefaultGracePeriodMinutes, errors ));
    this.rotationIntervalInWeeks = parseInt( data, KeyManagerIF.RotationIntervalInWeeks, KeyManagerIF.DefaultRotationIntervalWeeks, errors );

    String root = data.get( KeyManagerIF.AllowedRoot );
    this.allowedRoot = Paths.get( root != null ? root : System.getProperty( "user.dir" ) ).toAbsolutePath().normalize();
    this.parseErrors = Collections.unmodifiableList( errors );

    LOGGER.info( "***************** Key Manager Config is set for ******************" );
    LOGGER.info( KeyManagerIF.Preset                       + "                       = " + presetValue );
    LOGGER.info( KeyManagerIF.CertPath                     + "                     = " + certPath );
    LOGGER.info( KeyManagerIF.KeyExpiryMonths              + "              = " + keyExpiryMonths );
    LOGGER.info( KeyManagerIF.AutoGenerate                 + "                 = " + autoGenerate );
    LOGGER.info( KeyManagerIF.EnableFileBackup             + "             = " + enableFileBackup );
    LOGGER.info( KeyManagerIF.RotationGracePeriodInMinutes + " = " + rotationGracePeriod.toMinutes() );
    LOGGER.info( KeyManagerIF.RotationIntervalInWeeks      + "      = " + rotationIntervalInWeeks );
    LOGGER.info( KeyManagerIF.AllowedRoot                  + "                  = " + allowedRoot );
    LOGGER.info( "***************** End of Key Manager Config ******************" );
  }

  private KeyManagerConfig( KeyManagerConfig other, Duration gracePeriod )
  {
    this.presetValue             = other.presetValue;
    this.preset                  = other.preset;
    this.certPath                = other.certPath;
    this.keyExpiryMonths         = other.keyExpiryMonths;
    this.autoGenerate            = other.autoGenerate;
    this.enableFileBackup        = other.enableFileBackup;
    this.rotationGracePeriod     = gracePeriod;
    this.rotationIntervalInWeeks = other.rotationIntervalInWeeks;
    this.allowedRoot             = other.allowedRoot;
    this.parseErrors             = other.parseErrors;
  }

  /**
   * Copy of this configuration with a grace period finer than whole minutes.
   */
  public KeyManagerConfig withRotationGracePeriod( Duration gracePeriod )
  {
    if( gracePeriod == null )
      throw new IllegalArgumentException( "gracePeriod cannot be null" );

    return new KeyManagerConfig( this, gracePeriod );
  }

  public static Map<String, String> defaults()
  {
    Map<String, String> map = new HashMap<>();
    map.put( KeyManagerIF.Preset,                       Preset.NORMAL.getWireName() );
    map.put( KeyManagerIF.CertPath,                     KeyManagerIF.DefaultCertPath );
    map.put( KeyManagerIF.KeyExpiryMonths,              String.valueOf( KeyManagerIF.DefaultKeyExpiryMonths ));
    map.put( KeyManagerIF.AutoGenerate,                 "true" );
    map.put( KeyManagerIF.EnableFileBackup,             "true" );
    map.put( KeyManagerIF.RotationGracePeriodInMinutes, String.valueOf( KeyManagerIF.DefaultGracePeriodMinutes ));
    map.put( KeyManagerIF.RotationIntervalInWeeks,      String.valueOf( KeyManagerIF.DefaultRotationIntervalWeeks ));
    return map;
  }

  private static int parseInt( Map<String, String> data, String key, int defaultValue, List<String> errors )
  {
    String value = data.get( key );
    if( value == null )
      return defaultValue;

    try
    {
      return Integer.parseInt( value.trim() );
    }
    catch( NumberFormatException e )
    {
      errors.add( key + " must be numeric (got " + value + ")" );
      return defaultValue;
    }
  }

  private static boolean parseBoolean( Map<String, String> data, String key, boolean defaultValue )
  {
    String value = data.get( key );
    return value == null ? defaultValue : Boolean.parseBoolean( value.trim() );
  }

  public String       getPresetValue()             { return presetValue;             }
  public Preset       getPreset()                  { return preset;                  }
  public String       getCertPath()                { return certPath;                }
  public int          getKeyExpiryMonths()         { return keyExpiryMonths;         }
  public boolean      isAutoGenerate()             { return autoGenerate;            }
  public boolean      isEnableFileBackup()         { return enableFileBackup;        }
  public Duration     getRotationGracePeriod()     { return rotationGracePeriod;     }
  public int          getRotationIntervalInWeeks() { return rotationIntervalInWeeks; }
  public Path         getAllowedRoot()             { return allowedRoot;             }
  public List<String> getParseErrors()             { return parseErrors;             }

  public Path getCertDirectory()
  {
    return Paths.get( certPath ).toAbsolutePath().normalize();
  }

  @Override
  public String toString()
  {
    return String.format( "KeyManagerConfig{preset=%s, certPath='%s', expiryMonths=%d, autoGenerate=%s, backup=%s, grace=%s, intervalWeeks=%d}",
                          presetValue, certPath, keyExpiryMonths, autoGenerate, enableFileBackup, rotationGracePeriod, rotationIntervalInWeeks );
  }
}
