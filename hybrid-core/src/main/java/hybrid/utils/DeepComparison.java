package hybrid.utils;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Date;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Structural equality for nested maps, lists, sets, arrays, dates and
 * patterns. {@code Optional.empty()} plays the role of an undefined value.
 *
 * Cyclic structures are handled by tracking the pairs currently being
 * compared; a pair met again on the same path is treated as equal.
 */
public class DeepComparison
{
  public static final int DEFAULT_MAX_DEPTH = 100;

  public static class Options
  {
    private boolean ignoreUndefined    = false;
    private boolean nullUndefinedEqual = false;
    private boolean strictTypes        = true;
    private int     maxDepth           = DEFAULT_MAX_DEPTH;

    public Options ignoreUndefined( boolean v )    { this.ignoreUndefined = v;    return this; }
    public Options nullUndefinedEqual( boolean v ) { this.nullUndefinedEqual = v; return this; }
    public Options strictTypes( boolean v )        { this.strictTypes = v;        return this; }
    public Options maxDepth( int v )               { this.maxDepth = v;           return this; }

    public boolean isIgnoreUndefined()    { return ignoreUndefined;    }
    public boolean isNullUndefinedEqual() { return nullUndefinedEqual; }
    public boolean isStrictTypes()        { return strictTypes;        }
    public int     getMaxDepth()          { return maxDepth;           }
  }

  private enum Kind { NULL, UNDEFINED, NUMBER, STRING, BOOLEAN, DATE, PATTERN, LIST, MAP, SET, BYTES, SHORTS, INTS, LONGS, FLOATS, DOUBLES, CHARS, BOOLEANS, OBJECT }

  private final Options options;

  public DeepComparison()
  {
    this( new Options() );
  }

  public DeepComparison( Options options )
  {
    this.options = options == null ? new Options() : options;
  }

  public static boolean deepEqual( Object a, Object b )
  {
    return new DeepComparison().equal( a, b );
  }

  public static boolean deepEqual( Object a, Object b, Options options )
  {
    return new DeepComparison( options ).equal( a, b );
  }

  /**
   * @throws IllegalStateException when nesting exceeds the configured maximum depth
   */
  public boolean equal( Object a, Object b )
  {
    return compare( a, b, 0, new HashSet<>() );
  }

  private boolean compare( Object a, Object b, int depth, Set<IdentityPair> visited )
  {
    if( depth > options.maxDepth )
      throw new IllegalStateException( "Maximum comparison depth of " + options.maxDepth + " exceeded" );

    if( a instanceof Optional && ((Optional<?>)a).isPresent() )
      a = ((Optional<?>)a).get();
    if( b instanceof Optional && ((Optional<?>)b).isPresent() )
      b = ((Optional<?>)b).get();

    Kind ka = kindOf( a );
    Kind kb = kindOf( b );

    if( isNullish( ka ) || isNullish( kb ) )
    {
      if( options.nullUndefinedEqual )
        return isNullish( ka ) && isNullish( kb );
      return ka == kb;
    }

    if( ka != kb )
    {
      if( options.strictTypes )
        return false;
      return looseEqual( a, b );
    }

    if( a == b )
      return true;

    switch( ka )
    {
      case NUMBER:   return compareNumbers( (Number)a, (Number)b );
      case STRING:
      case BOOLEAN:  return a.equals( b );
      case DATE:     return toInstant( a ).equals( toInstant( b ));
      case PATTERN:  return ((Pattern)a).pattern().equals( ((Pattern)b).pattern() ) && ((Pattern)a).flags() == ((Pattern)b).flags();
      case BYTES:    return Arrays.equals( (byte[])a,    (byte[])b    );
      case SHORTS:   return Arrays.equals( (short[])a,   (short[])b   );
      case INTS:     return Arrays.equals( (int[])a,     (int[])b     );
      case LONGS:    return Arrays.equals( (long[])a,    (long[])b    );
      case FLOATS:   return Arrays.equals( (float[])a,   (float[])b   );
      case DOUBLES:  return Arrays.equals( (double[])a,  (double[])b  );
      case CHARS:    return Arrays.equals( (char[])a,    (char[])b    );
      case BOOLEANS: return Arrays.equals( (boolean[])a, (boolean[])b );
      case OBJECT:   return a.equals( b );
      default:
        break;
    }

    IdentityPair pair = new IdentityPair( a, b );
    if( !visited.add( pair ))
      return true;

    try
    {
      switch( ka )
      {
        case LIST: return compareLists( toList( a ), toList( b ), depth, visited );
        case MAP:  return compareMaps( (Map<?, ?>)a, (Map<?, ?>)b, depth, visited );
        case SET:  return compareSets( (Set<?>)a, (Set<?>)b, depth, visited );
        default:   return a.equals( b );
      }
    }
    finally
    {
      visited.remove( pair );
    }
  }

  private boolean compareLists( List<?> a, List<?> b, int depth, Set<IdentityPair> visited )
  {
    if( a.size() != b.size() )
      return false;

    for( int i = 0; i < a.size(); i++ )
    {
      if( !compare( a.get( i ), b.get( i ), depth + 1, visited ))
        return false;
    }
    return true;
  }

  private boolean compareMaps( Map<?, ?> a, Map<?, ?> b, int depth, Set<IdentityPair> visited )
  {
    Set<Object> keysA = keys( a );
    Set<Object> keysB = keys( b );

    if( !keysA.equals( keysB ))
      return false;

    for( Object key : keysA )
    {
      if( !compare( a.get( key ), b.get( key ), depth + 1, visited ))
        return false;
    }
    return true;
  }

  private boolean compareSets( Set<?> a, Set<?> b, int depth, Set<IdentityPair> visited )
  {
    if( a.size() != b.size() )
      return false;

    List<Object> remaining = new ArrayList<>( b );
    for( Object itemA : a )
    {
      boolean found = false;
      for( int i = 0; i < remaining.size(); i++ )
      {
        if( compare( itemA, remaining.get( i ), depth + 1, visited ))
        {
          remaining.remove( i );
          found = true;
          break;
        }
      }
      if( !found )
        return false;
    }
    return true;
  }

  private Set<Object> keys( Map<?, ?> map )
  {
    Set<Object> result = new HashSet<>();
    for( Map.Entry<?, ?> e : map.entrySet() )
    {
      if( options.ignoreUndefined && isUndefined( e.getValue() ))
        continue;
      result.add( e.getKey() );
    }
    return result;
  }

  /**
   * NaN equals NaN, and +0.0 differs from -0.0.
   */
  private static boolean compareNumbers( Number a, Number b )
  {
    if( isIntegral( a ) && isIntegral( b ))
      return toBigInteger( a ).equals( toBigInteger( b ));

    if( a instanceof BigDecimal && b instanceof BigDecimal )
      return ((BigDecimal)a).compareTo( (BigDecimal)b ) == 0;

    double da = a.doubleValue();
    double db = b.doubleValue();

    if( Double.isNaN( da ) || Double.isNaN( db ))
      return Double.isNaN( da ) && Double.isNaN( db );

    return Double.compare( da, db ) == 0;
  }

  private static boolean looseEqual( Object a, Object b )
  {
    if( a instanceof Number && b instanceof String || a instanceof String && b instanceof Number )
    {
      try
      {
        Number n = a instanceof Number ? (Number)a : (Number)b;
        String s = a instanceof String ? (String)a : (String)b;
        return compareNumbers( n, new BigDecimal( s.trim() ));
      }
      catch( NumberFormatException e )
      {
        return false;
      }
    }
    return Objects.equals( String.valueOf( a ), String.valueOf( b ));
  }

  private static boolean isIntegral( Number n )
  {
    return n instanceof Integer || n instanceof Long || n instanceof Short || n instanceof Byte || n instanceof BigInteger;
  }

  private static BigInteger toBigInteger( Number n )
  {
    return n instanceof BigInteger ? (BigInteger)n : BigInteger.valueOf( n.longValue() );
  }

  private static Instant toInstant( Object o )
  {
    return o instanceof Date ? ((Date)o).toInstant() : (Instant)o;
  }

  private static List<?> toList( Object o )
  {
    if( o instanceof List )
      return (List<?>)o;
    if( o instanceof Object[] )
      return Arrays.asList( (Object[])o );
    return new ArrayList<>( (Collection<?>)o );
  }

  private static boolean isUndefined( Object o )
  {
    return o instanceof Optional && ((Optional<?>)o).isEmpty();
  }

  private static boolean isNullish( Kind k )
  {
    return k == Kind.NULL || k == Kind.UNDEFINED;
  }

  private static Kind kindOf( Object o )
  {
    if( o == null )                  return Kind.NULL;
    if( isUndefined( o ))            return Kind.UNDEFINED;
    if( o instanceof Number )        return Kind.NUMBER;
    if( o instanceof CharSequence || o instanceof Character ) return Kind.STRING;
    if( o instanceof Boolean )       return Kind.BOOLEAN;
    if( o instanceof Date || o instanceof Instant ) return Kind.DATE;
    if( o instanceof Pattern )       return Kind.PATTERN;
    if( o instanceof Map )           return Kind.MAP;
    if( o instanceof Set )           return Kind.SET;
    if( o instanceof Collection || o instanceof Object[] ) return Kind.LIST;
    if( o instanceof byte[] )        return Kind.BYTES;
    if( o instanceof short[] )       return Kind.SHORTS;
    if( o instanceof int[] )         return Kind.INTS;
    if( o instanceof long[] )        return Kind.LONGS;
    if( o instanceof float[] )       return Kind.FLOATS;
    if( o instanceof double[] )      return Kind.DOUBLES;
    if( o instanceof char[] )        return Kind.CHARS;
    if( o instanceof boolean[] )     return Kind.BOOLEANS;
    return Kind.OBJECT;
  }

  private static final class IdentityPair
  {
    private final Object a;
    private final Object b;

    IdentityPair( Object a, Object b )
    {
      this.a = a;
      this.b = b;
    }

    @Override
    public boolean equals( Object obj )
    {
      if( !(obj instanceof IdentityPair) )
        return false;
      IdentityPair other = (IdentityPair)obj;
      return a == other.a && b == other.b;
    }

    @Override
    public int hashCode()
    {
      return 31 * System.identityHashCode( a ) + System.identityHashCode( b );
    }
  }
}
