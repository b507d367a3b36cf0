package hybrid.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum RotationReason
{
  INITIAL_GENERATION( "initial_generation" ),
  SCHEDULED_ROTATION( "scheduled_rotation" ),
  MANUAL_ROTATION(    "manual_rotation"    ),
  EMERGENCY_ROTATION( "emergency_rotation" );

  private final String value;

  RotationReason( String value )
  {
    this.value = value;
  }

  @JsonValue
  public String getValue() { return value; }

  @JsonCreator
  public static RotationReason fromValue( String value )
  {
    for( RotationReason r : values() )
    {
      if( r.value.equals( value ) )
        return r;
    }
    throw new IllegalArgumentException( "Unknown rotation reason: " + value );
  }
}
