package hybrid.utils;

import java.lang.reflect.Array;
import java.nio.charset.StandardCharsets;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import hybrid.exceptions.FormatConversionException;

/**
 * Canonical conversion between structured values and UTF-8 JSON bytes.
 *
 * Values are normalized before writing:
 * <ul>
 *   <li>non-finite doubles and floats (NaN, +/-Infinity) are written as null and
 *       therefore decode as null. This loss is intentional and stable.</li>
 *   <li>a map entry holding {@code Optional.empty()} is dropped, which is how an
 *       "undefined" field is expressed. Inside a list it becomes null.</li>
 *   <li>{@code Optional.of(x)} is written as x.</li>
 *   <li>dates and instants are written as ISO-8601 strings.</li>
 * </ul>
 * Untyped decoding yields Map, List, String, Number, Boolean or null.
 */
public class Serialization
{
  private static final ObjectMapper MAPPER = new ObjectMapper().configure( DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false );

  public static ObjectMapper mapper()
  {
    return MAPPER;
  }

  public static byte[] serialize( Object data )
   throws FormatConversionException
  {
    try
    {
      return MAPPER.writeValueAsBytes( normalize( data ));
    }
    catch( JsonProcessingException | IllegalArgumentException e )
    {
      throw new FormatConversionException( "Data serialization failed: " + e.getMessage(), typeName( data ), "bytes", e );
    }
  }

  public static String serializeToString( Object data )
   throws FormatConversionException
  {
    return new String( serialize( data ), StandardCharsets.UTF_8 );
  }

  public static Object deserialize( byte[] bytes )
   throws FormatConversionException
  {
    return deserialize( bytes, Object.class );
  }

  public static <T> T deserialize( byte[] bytes, Class<T> type )
   throws FormatConversionException
  {
    if( bytes == null )
      throw new FormatConversionException( "Data deserialization failed: no bytes", "bytes", type.getSimpleName(), null );

    try
    {
      return MAPPER.readValue( bytes, type );
    }
    catch( Exception e )
    {
      throw new FormatConversionException( "Data deserialization failed: " + e.getClass().getSimpleName(), "bytes", type.getSimpleName(), e );
    }
  }

  public static <T> T deserialize( byte[] bytes, TypeReference<T> type )
   throws FormatConversionException
  {
    if( bytes == null )
      throw new FormatConversionException( "Data deserialization failed: no bytes", "bytes", type.getType().getTypeName(), null );

    try
    {
      return MAPPER.readValue( bytes, type );
    }
    catch( Exception e )
    {
      throw new FormatConversionException( "Data deserialization failed: " + e.getClass().getSimpleName(), "bytes", type.getType().getTypeName(), e );
    }
  }

  /**
   * Rewrites a value into the plain JSON model applying the canonical rules.
   */
  static Object normalize( Object value )
  {
    if( value == null )
      return null;

    if( value instanceof Optional )
      return normalize( ((Optional<?>)value).orElse( null ));

    if( value instanceof Double )
    {
      double d = (Double)value;
      return Double.isFinite( d ) ? value : null;
    }
    if( value instanceof Float )
    {
      float f = (Float)value;
      return Float.isFinite( f ) ? value : null;
    }

    if( value instanceof String || value instanceof Number || value instanceof Boolean || value instanceof byte[] )
      return value;

    if( value instanceof Character || value instanceof Enum )
      return value.toString();

    if( value instanceof Date )
      return ((Date)value).toInstant().toString();
    if( value instanceof TemporalAccessor )
      return value.toString();

    if( value instanceof JsonObject )
      return normalize( ((JsonObject)value).getMap() );
    if( value instanceof JsonArray )
      return normalize( ((JsonArray)value).getList() );

    if( value instanceof Map )
    {
      Map<String, Object> out = new LinkedHashMap<>();
      for( Map.Entry<?, ?> e : ((Map<?, ?>)value).entrySet() )
      {
        Object v = e.getValue();
        if( v instanceof Optional && ((Optional<?>)v).isEmpty() )
          continue;

        out.put( String.valueOf( e.getKey() ), normalize( v ));
      }
      return out;
    }

    if( value instanceof Collection )
    {
      List<Object> out = new ArrayList<>();
      for( Object item : (Collection<?>)value )
        out.add( normalize( item ));

      return out;
    }

    if( value.getClass().isArray() )
    {
      int          len = Array.getLength( value );
      List<Object> out = new ArrayList<>( len );
      for( int i = 0; i < len; i++ )
        out.add( normalize( Array.get( value, i )));

      return out;
    }

    // Beans are flattened to maps so their fields receive the same treatment.
    return normalize( MAPPER.convertValue( value, Object.class ));
  }

  private static String typeName( Object data )
  {
    return data == null ? "null" : data.getClass().getSimpleName();
  }
}
