package hybrid.service;

import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.file.FileSystem;

import hybrid.exceptions.KeyManagerException;
import hybrid.model.KeyManagerIF;
import hybrid.model.KeyMetadata;
import hybrid.model.KeyPair;
import hybrid.model.Preset;
import hybrid.model.SerializedKeyPair;
import hybrid.utils.KeyManagerConfig;
import hybrid.utils.Serialization;

/**
 * Reads and writes the key files of one storage directory:
 * public-key.bin, secret-key.bin, key-metadata.json and the backup folder.
 */
public class KeyStorageService
{
  private static final Logger LOGGER = LoggerFactory.getLogger( KeyStorageService.class );

  private static final String  OWNER_ONLY         = "rw-------";
  private static final Pattern BACKUP_STAMP       = Pattern.compile( "expired-(\\d{4}-\\d{2})" );
  private static final int     BACKUP_KEEP_MONTHS = 3;

  private final Vertx            vertx;
  private final KeyManagerConfig config;
  private final Path             certDir;

  public KeyStorageService( Vertx vertx, KeyManagerConfig config )
  {
    this.vertx   = vertx;
    this.config  = config;
    this.certDir = config.getCertDirectory();
  }

  public Path getCertDirectory() { return certDir; }

  private FileSystem fs()
  {
    return vertx.fileSystem();
  }

  private String file( String name )
  {
    return certDir.resolve( name ).toString();
  }

  private String backupFile( String name )
  {
    return certDir.resolve( KeyManagerIF.BackupDir ).resolve( name ).toString();
  }

  public Future<Void> ensureCertDirectory()
  {
    String dir = certDir.toString();

    return fs().exists( dir )
               .compose( exists -> exists ? Future.<Void>succeededFuture() : fs().mkdirs( dir ) )
               .onSuccess( v -> LOGGER.debug( "Key storage directory ready: {}", dir ) )
               .recover( err -> Future.failedFuture( new KeyManagerException( "Failed to create key storage directory " + dir + ": " + err.getMessage(),
                                                                              config.getPreset(), "ensureCertDirectory", null, err ) ));
  }

  /**
   * @return the stored pair, or null when a file is missing or the metadata
   *         cannot be used
   */
  public Future<KeyPair> loadKeysFromFile()
  {
    String pubFile  = file( KeyManagerIF.PublicKeyFile   );
    String secFile  = file( KeyManagerIF.SecretKeyFile   );
    String metaFile = file( KeyManagerIF.KeyMetadataFile );

    return Future.all( fs().exists( pubFile ), fs().exists( secFile ), fs().exists( metaFile ) )
                 .<KeyPair>compose( cf ->
                  {
                    if( !cf.<Boolean>resultAt( 0 ) || !cf.<Boolean>resultAt( 1 ) || !cf.<Boolean>resultAt( 2 ) )
                    {
                      LOGGER.info( "No complete key set found in {}", certDir );
                      return Future.<KeyPair>succeededFuture( null );
                    }

                    return Future.all( fs().readFile( pubFile ), fs().readFile( secFile ), fs().readFile( metaFile ) )
                                 .map( rf -> toKeyPair( rf.<Buffer>resultAt( 0 ), rf.<Buffer>resultAt( 1 ), rf.<Buffer>resultAt( 2 ) ) );
                  })
                 .recover( err ->
                  {
                    LOGGER.warn( "Failed to load keys from {}: {}", certDir, err.getMessage() );
                    return Future.<KeyPair>succeededFuture( null );
                  });
  }

  private KeyPair toKeyPair( Buffer pub, Buffer sec, Buffer meta )
  {
    SerializedKeyPair.Metadata md;
    try
    {
      md = Serialization.mapper().readValue( meta.getBytes(), SerializedKeyPair.Metadata.class );
    }
    catch( Exception e )
    {
      LOGGER.warn( "Key metadata file is not valid JSON: {}", e.getMessage() );
      return null;
    }

    if( md == null || !md.isComplete() )
    {
      LOGGER.warn( "Key metadata file is incomplete" );
      return null;
    }

    Preset preset = Preset.fromString( md.getPreset() );
    if( preset == null )
    {
      LOGGER.warn( "Key metadata names an unknown preset: {}", md.getPreset() );
      return null;
    }

    byte[] secretKey = sec.getBytes();
    try
    {
      KeyMetadata metadata = new KeyMetadata( preset, md.getVersion(), Instant.parse( md.getCreatedAt() ), Instant.parse( md.getExpiresAt() ));
      KeyPair     pair     = new KeyPair( pub.getBytes(), secretKey, metadata );

      LOGGER.info( "Loaded key pair version {} ({}) from {}", metadata.getVersion(), preset.getWireName(), certDir );
      return pair;
    }
    catch( DateTimeParseException e )
    {
      LOGGER.warn( "Key metadata has an invalid date: {}", e.getMessage() );
      return null;
    }
    finally
    {
      Arrays.fill( secretKey, (byte)0 );
    }
  }

  public Future<Void> saveKeysToFile( KeyPair keyPair )
  {
    if( keyPair == null || !keyPair.hasPublicKey() || !keyPair.hasSecretKey() || keyPair.getMetadata() == null )
      return Future.failedFuture( new KeyManagerException( "Cannot save an incomplete key pair", config.getPreset(), "saveKeysToFile" ));

    KeyMetadata md       = keyPair.getMetadata();
    byte[]      metaJson;
    try
    {
      SerializedKeyPair.Metadata smd = new SerializedKeyPair.Metadata( md.getPreset().getWireName(), md.getVersion(),
                                                                       md.getCreatedAt().toString(), md.getExpiresAt().toString() );
      metaJson = Serialization.mapper().writerWithDefaultPrettyPrinter().writeValueAsBytes( smd );
    }
    catch( Exception e )
    {
      return Future.failedFuture( new KeyManagerException( "Failed to encode key metadata", md.getPreset(), "saveKeysToFile", md.getVersion(), e ));
    }

    String secFile   = file( KeyManagerIF.SecretKeyFile );
    byte[] secretKey = keyPair.getSecretKey();
    Buffer secBuffer = Buffer.buffer( secretKey );
    Arrays.fill( secretKey, (byte)0 );

    return fs().writeFile( file( KeyManagerIF.PublicKeyFile ), Buffer.buffer( keyPair.getPublicKey() ))
               .compose( v -> fs().writeFile( secFile, secBuffer ))
               .compose( v -> restrictToOwner( secFile ))
               .compose( v -> fs().writeFile( file( KeyManagerIF.KeyMetadataFile ), Buffer.buffer( metaJson )))
               .onSuccess( v -> LOGGER.info( "Saved key pair version {} to {}", md.getVersion(), certDir ))
               .recover( err -> Future.failedFuture( new KeyManagerException( "Failed to save keys to " + certDir + ": " + err.getMessage(),
                                                                              md.getPreset(), "saveKeysToFile", md.getVersion(), err ) ));
  }

  /**
   * Owner-only permissions where the file system supports POSIX attributes.
   */
  private Future<Void> restrictToOwner( String path )
  {
    return fs().chmod( path, OWNER_ONLY )
               .recover( err ->
                {
                  LOGGER.warn( "Could not restrict permissions on {}: {}", path, err.getMessage() );
                  return Future.succeededFuture();
                });
  }

  /**
   * Copies a superseded pair into the backup folder. Never fails; problems
   * are logged.
   */
  public Future<Void> backupExpiredKeys( KeyPair keyPair )
  {
    if( !config.isEnableFileBackup() || keyPair == null || !keyPair.hasPublicKey() || !keyPair.hasSecretKey() )
      return Future.succeededFuture();

    String stamp   = LocalDate.now( ZoneOffset.UTC ).toString();
    String pubName = backupFile( "pub-key-expired-"    + stamp + ".bin" );
    String secName = backupFile( "secret-key-expired-" + stamp + ".bin" );

    byte[] secretKey = keyPair.getSecretKey();
    Buffer secBuffer = Buffer.buffer( secretKey );
    Arrays.fill( secretKey, (byte)0 );

    return fs().mkdirs( certDir.resolve( KeyManagerIF.BackupDir ).toString() )
               .compose( v -> fs().writeFile( pubName, Buffer.buffer( keyPair.getPublicKey() )))
               .compose( v -> fs().writeFile( secName, secBuffer ))
               .compose( v -> restrictToOwner( secName ))
               .onSuccess( v -> LOGGER.info( "Backed up key pair version {} as {}", keyPair.getVersion(), stamp ))
               .recover( err ->
                {
                  LOGGER.warn( "Key backup failed: {}", err.getMessage() );
                  return Future.succeededFuture();
                });
  }

  /**
   * Deletes backups stamped more than three months ago.
   *
   * @return number of files removed
   */
  public Future<Integer> cleanupOldBackups()
  {
    String    dir    = certDir.resolve( KeyManagerIF.BackupDir ).toString();
    YearMonth cutoff = YearMonth.now( ZoneOffset.UTC ).minusMonths( BACKUP_KEEP_MONTHS );

    return fs().exists( dir )
               .<Integer>compose( exists ->
                {
                  if( !exists )
                    return Future.succeededFuture( 0 );

                  return fs().readDir( dir ).compose( files ->
                  {
                    List<Future<Void>> deletes = new ArrayList<>();
                    for( String f : files )
                    {
                      if( isOlderThan( Path.of( f ).getFileName().toString(), cutoff ))
                        deletes.add( fs().delete( f ).onSuccess( v -> LOGGER.info( "Removed old key backup {}", f )));
                    }

                    return Future.all( deletes ).map( cf -> deletes.size() );
                  });
                })
               .recover( err ->
                {
                  LOGGER.warn( "Backup cleanup failed: {}", err.getMessage() );
                  return Future.succeededFuture( 0 );
                });
  }

  static boolean isOlderThan( String fileName, YearMonth cutoff )
  {
    Matcher m = BACKUP_STAMP.matcher( fileName );
    if( !m.find() )
      return false;

    try
    {
      return YearMonth.parse( m.group( 1 )).isBefore( cutoff );
    }
    catch( DateTimeParseException e )
    {
      return false;
    }
  }
}
