package hybrid.service;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;

import hybrid.model.KeyManagerIF;
import hybrid.model.KeyPair;
import hybrid.model.RotationHistory;
import hybrid.model.RotationHistoryEntry;
import hybrid.model.RotationReason;
import hybrid.model.RotationStats;
import hybrid.utils.KeyManagerConfig;
import hybrid.utils.Serialization;

/**
 * Maintains rotation-history.json. Reads are served from a short lived cache
 * that is dropped whenever the history is written.
 */
public class RotationHistoryService
{
  private static final Logger LOGGER = LoggerFactory.getLogger( RotationHistoryService.class );

  private static final String CACHE_KEY = "history";

  private final Vertx                          vertx;
  private final String                         historyFile;
  private final Cache<String, RotationHistory> cache = Caffeine.newBuilder()
                                                               .expireAfterWrite( KeyManagerIF.DefaultGracePeriodMinutes, TimeUnit.MINUTES )
                                                               .maximumSize( 1 )
                                                               .build();

  public RotationHistoryService( Vertx vertx, KeyManagerConfig config )
  {
    this.vertx       = vertx;
    this.historyFile = config.getCertDirectory().resolve( KeyManagerIF.RotationHistoryFile ).toString();
  }

  /**
   * @return the persisted history, or an empty one when the file is missing
   *         or unreadable
   */
  public Future<RotationHistory> getRotationHistory()
  {
    RotationHistory cached = cache.getIfPresent( CACHE_KEY );
    if( cached != null )
      return Future.succeededFuture( cached );

    return vertx.fileSystem().exists( historyFile )
                .<RotationHistory>compose( exists ->
                 {
                   if( !exists )
                     return Future.succeededFuture( RotationHistory.empty() );

                   return vertx.fileSystem().readFile( historyFile ).map( this::parse );
                 })
                .recover( err ->
                 {
                   LOGGER.warn( "Could not read rotation history: {}", err.getMessage() );
                   return Future.succeededFuture( RotationHistory.empty() );
                 })
                .onSuccess( h -> cache.put( CACHE_KEY, h ));
  }

  private RotationHistory parse( Buffer buffer )
  {
    try
    {
      RotationHistory history = Serialization.mapper().readValue( buffer.getBytes(), RotationHistory.class );
      return history == null ? RotationHistory.empty() : history;
    }
    catch( Exception e )
    {
      LOGGER.warn( "Rotation history is not valid JSON, starting a new one: {}", e.getMessage() );
      return RotationHistory.empty();
    }
  }

  public Future<Integer> getNextVersionNumber()
  {
    return getRotationHistory().map( h -> h.isEmpty() ? 1 : h.getMaxVersion() + 1 );
  }

  /**
   * Appends an entry for the pair. A null reason is recorded as
   * initial_generation for the first entry and scheduled_rotation afterwards.
   * Write failures are logged and the returned future still succeeds.
   */
  public Future<Void> updateRotationHistory( KeyPair keyPair, RotationReason reason )
  {
    if( keyPair == null || keyPair.getMetadata() == null )
      return Future.succeededFuture();

    return getRotationHistory()
             .compose( history ->
              {
                RotationReason effective = reason != null ? reason
                                                          : history.isEmpty() ? RotationReason.INITIAL_GENERATION : RotationReason.SCHEDULED_ROTATION;

                RotationHistoryEntry entry = new RotationHistoryEntry( keyPair.getVersion(),
                                                                       toString( keyPair.getMetadata().getCreatedAt() ),
                                                                       toString( keyPair.getMetadata().getExpiresAt() ),
                                                                       keyPair.getPreset(),
                                                                       Instant.now().toString(),
                                                                       effective );
                RotationHistory updated = history.append( entry );

                byte[] json;
                try
                {
                  json = Serialization.mapper().writerWithDefaultPrettyPrinter().writeValueAsBytes( updated );
                }
                catch( Exception e )
                {
                  return Future.<Void>failedFuture( e );
                }

                return vertx.fileSystem().writeFile( historyFile, Buffer.buffer( json ))
                            .onSuccess( v -> LOGGER.info( "Recorded rotation to version {} ({})", entry.getVersion(), effective.getValue() ));
              })
             .onComplete( ar -> cache.invalidate( CACHE_KEY ))
             .recover( err ->
              {
                LOGGER.warn( "Failed to update rotation history: {}", err.getMessage() );
                return Future.succeededFuture();
              });
  }

  public Future<RotationStats> getRotationStats()
  {
    return getRotationHistory().map( RotationHistoryService::computeStats );
  }

  static RotationStats computeStats( RotationHistory history )
  {
    List<RotationHistoryEntry> entries = new ArrayList<>( history.getRotations() );
    if( entries.isEmpty() )
      return new RotationStats( 0, 0, null, null, 0, 0 );

    List<Instant> created = new ArrayList<>();
    for( RotationHistoryEntry e : entries )
    {
      Instant t = parseInstant( e.getCreatedAt() );
      if( t != null )
        created.add( t );
    }
    created.sort( Comparator.naturalOrder() );

    long averageDays = 0;
    if( created.size() > 1 )
    {
      long totalMillis = 0;
      for( int i = 1; i < created.size(); i++ )
        totalMillis += Duration.between( created.get( i - 1 ), created.get( i )).toMillis();

      double avgMillis = (double)totalMillis / ( created.size() - 1 );
      averageDays = Math.round( avgMillis / Duration.ofDays( 1 ).toMillis() );
    }

    ZonedDateTime now       = ZonedDateTime.now( ZoneOffset.UTC );
    int           thisYear  = 0;
    int           thisMonth = 0;
    for( RotationHistoryEntry e : entries )
    {
      Instant rotated = parseInstant( e.getRotatedAt() );
      if( rotated == null )
        continue;

      ZonedDateTime at = rotated.atZone( ZoneOffset.UTC );
      if( at.getYear() == now.getYear() )
      {
        thisYear++;
        if( at.getMonth() == now.getMonth() )
          thisMonth++;
      }
    }

    return new RotationStats( entries.size(), averageDays, entries.get( 0 ), entries.get( entries.size() - 1 ), thisYear, thisMonth );
  }

  private static Instant parseInstant( String value )
  {
    if( value == null )
      return null;

    try
    {
      return Instant.parse( value );
    }
    catch( DateTimeParseException e )
    {
      return null;
    }
  }

  private static String toString( Instant instant )
  {
    return instant == null ? null : instant.toString();
  }
}
