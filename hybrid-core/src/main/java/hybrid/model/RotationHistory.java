package hybrid.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Append-only rotation log persisted as rotation-history.json.
 * totalRotations always equals the number of entries.
 */
@JsonIgnoreProperties( ignoreUnknown = true )
public class RotationHistory
{
  @JsonProperty( "totalRotations" ) private final int                        totalRotations;
  @JsonProperty( "rotations"      ) private final List<RotationHistoryEntry> rotations;
  @JsonProperty( "createdAt"      ) private final String                     createdAt;
  @JsonProperty( "lastUpdated"    ) private final String                     lastUpdated;

  @JsonCreator
  public RotationHistory( @JsonProperty( "totalRotations" ) int                        totalRotations,
                          @JsonProperty( "rotations"      ) List<RotationHistoryEntry> rotations,
                          @JsonProperty( "createdAt"      ) String                     createdAt,
                          @JsonProperty( "lastUpdated"    ) String                     lastUpdated )
  {
    this.rotations      = rotations == null ? new ArrayList<>() : new ArrayList<>( rotations );
    this.totalRotations = this.rotations.size();
    this.createdAt      = createdAt;
    this.lastUpdated    = lastUpdated;
  }

  public static RotationHistory empty()
  {
    String now = Instant.now().toString();
    return new RotationHistory( 0, null, now, now );
  }

  public int                        getTotalRotations() { return totalRotations; }
  public List<RotationHistoryEntry> getRotations()      { return Collections.unmodifiableList( rotations ); }
  public String                     getCreatedAt()      { return createdAt;      }
  public String                     getLastUpdated()    { return lastUpdated;    }

  @JsonIgnore
  public boolean isEmpty()
  {
    return rotations.isEmpty();
  }

  @JsonIgnore
  public int getMaxVersion()
  {
    int max = 0;
    for( RotationHistoryEntry e : rotations )
      max = Math.max( max, e.getVersion() );

    return max;
  }

  public RotationHistory append( RotationHistoryEntry entry )
  {
    List<RotationHistoryEntry> updated = new ArrayList<>( rotations );
    updated.add( entry );
    return new RotationHistory( updated.size(), updated, createdAt, Instant.now().toString() );
  }
}
