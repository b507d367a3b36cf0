package helper;

import java.io.File;
import java.io.IOException;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;

import hybrid.utils.KeyManagerConfig;

/**
 * Key server settings read from a JSON file:
 * <pre>
 * {
 *   "serviceId":          "keyserver",
 *   "addressPrefix":      "keyserver",
 *   "workerPoolSize":     4,
 *   "rotationIntervalMs": null,
 *   "keyManager":         { "preset": "normal", "certPath": "./config/certs/keys", ... }
 * }
 * </pre>
 * When rotationIntervalMs is absent the key manager's rotationIntervalInWeeks
 * drives the rotation schedule.
 */
@JsonIgnoreProperties( ignoreUnknown = true )
public class KeyServerConfig
{
  private static final Logger LOGGER = LoggerFactory.getLogger( KeyServerConfig.class );

  public static final String DefaultServiceId     = "keyserver";
  public static final String DefaultAddressPrefix = "keyserver";
  public static final int    DefaultWorkerPool    = 4;

  @JsonProperty( "serviceId"          ) private final String              serviceId;
  @JsonProperty( "addressPrefix"      ) private final String              addressPrefix;
  @JsonProperty( "workerPoolSize"     ) private final int                 workerPoolSize;
  @JsonProperty( "rotationIntervalMs" ) private final Long                rotationIntervalMs;
  @JsonProperty( "keyManager"         ) private final Map<String, String> keyManager;

  @JsonCreator
  public KeyServerConfig( @JsonProperty( "serviceId"          ) String              serviceId,
                          @JsonProperty( "addressPrefix"      ) String              addressPrefix,
                          @JsonProperty( "workerPoolSize"     ) Integer             workerPoolSize,
                          @JsonProperty( "rotationIntervalMs" ) Long                rotationIntervalMs,
                          @JsonProperty( "keyManager"         ) Map<String, String> keyManager )
  {
    this.serviceId          = serviceId     != null ? serviceId     : DefaultServiceId;
    this.addressPrefix      = addressPrefix != null ? addressPrefix : DefaultAddressPrefix;
    this.workerPoolSize     = workerPoolSize != null && workerPoolSize > 0 ? workerPoolSize : DefaultWorkerPool;
    this.rotationIntervalMs = rotationIntervalMs;
    this.keyManager         = keyManager == null ? Collections.emptyMap() : Collections.unmodifiableMap( new HashMap<>( keyManager ));
  }

  public static KeyServerConfig fromFile( String path )
   throws IOException
  {
    File file = new File( path );
    if( !file.isFile() )
      throw new IOException( "Key server config file not found: " + path );

    KeyServerConfig config = new ObjectMapper().readValue( file, KeyServerConfig.class );

    LOGGER.info( "***************** Key Server Config is set for ******************" );
    LOGGER.info( "serviceId          = " + config.serviceId );
    LOGGER.info( "addressPrefix      = " + config.addressPrefix );
    LOGGER.info( "workerPoolSize     = " + config.workerPoolSize );
    LOGGER.info( "rotationIntervalMs = " + config.rotationIntervalMs );
    LOGGER.info( "***************** End of Key Server Config ******************" );

    return config;
  }

  public String              getServiceId()          { return serviceId;          }
  public String              getAddressPrefix()      { return addressPrefix;      }
  public int                 getWorkerPoolSize()     { return workerPoolSize;     }
  public Long                getRotationIntervalMs() { return rotationIntervalMs; }
  public Map<String, String> getKeyManager()         { return keyManager;         }

  public KeyManagerConfig toKeyManagerConfig()
  {
    return new KeyManagerConfig( keyManager );
  }

  /**
   * Explicit interval if configured, otherwise rotationIntervalInWeeks.
   */
  public long effectiveRotationIntervalMs( KeyManagerConfig kmConfig )
  {
    if( rotationIntervalMs != null && rotationIntervalMs > 0 )
      return rotationIntervalMs;

    return TimeUnit.DAYS.toMillis( 7L * kmConfig.getRotationIntervalInWeeks() );
  }

  public String address( String suffix )
  {
    return addressPrefix + "." + suffix;
  }
}
