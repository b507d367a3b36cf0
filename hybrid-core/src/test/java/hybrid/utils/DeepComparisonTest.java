package hybrid.utils;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

import org.junit.jupiter.api.Test;

class DeepComparisonTest
{
  @Test
  void testNestedMapsAndLists()
  {
    Map<String, Object> a = new LinkedHashMap<>();
    a.put( "name", "x" );
    a.put( "items", List.of( 1, 2, Map.of( "k", "v" )));

    Map<String, Object> b = new HashMap<>();
    b.put( "items", List.of( 1, 2, Map.of( "k", "v" )));
    b.put( "name", "x" );

    assertTrue( DeepComparison.deepEqual( a, b ));

    b.put( "name", "y" );
    assertFalse( DeepComparison.deepEqual( a, b ));
  }

  @Test
  void testIntegralTypesCompareByValue()
  {
    assertTrue(  DeepComparison.deepEqual( 5, 5L ));
    assertFalse( DeepComparison.deepEqual( 5, 6L ));
  }

  @Test
  void testNaNAndSignedZero()
  {
    assertTrue(  DeepComparison.deepEqual( Double.NaN, Double.NaN ));
    assertFalse( DeepComparison.deepEqual( 0.0, -0.0 ));
  }

  @Test
  void testDatesPatternsAndArrays()
  {
    Instant now = Instant.now();
    assertTrue(  DeepComparison.deepEqual( Date.from( now ), Date.from( now )));
    assertTrue(  DeepComparison.deepEqual( Pattern.compile( "a+", Pattern.CASE_INSENSITIVE ), Pattern.compile( "a+", Pattern.CASE_INSENSITIVE )));
    assertFalse( DeepComparison.deepEqual( Pattern.compile( "a+" ), Pattern.compile( "a+", Pattern.CASE_INSENSITIVE )));
    assertTrue(  DeepComparison.deepEqual( new byte[] { 1, 2 }, new byte[] { 1, 2 } ));
    assertFalse( DeepComparison.deepEqual( new byte[] { 1, 2 }, new int[] { 1, 2 } ));
  }

  @Test
  void testSetsIgnoreOrder()
  {
    assertTrue(  DeepComparison.deepEqual( Set.of( List.of( 1 ), List.of( 2 )), Set.of( List.of( 2 ), List.of( 1 ))));
    assertFalse( DeepComparison.deepEqual( Set.of( 1, 2 ), Set.of( 1, 3 )));
  }

  @Test
  void testUndefinedHandling()
  {
    Map<String, Object> a = new HashMap<>();
    a.put( "x", 1 );
    a.put( "y", Optional.empty() );

    Map<String, Object> b = new HashMap<>();
    b.put( "x", 1 );

    assertFalse( DeepComparison.deepEqual( a, b ));
    assertTrue(  DeepComparison.deepEqual( a, b, new DeepComparison.Options().ignoreUndefined( true )));

    assertFalse( DeepComparison.deepEqual( null, Optional.empty() ));
    assertTrue(  DeepComparison.deepEqual( null, Optional.empty(), new DeepComparison.Options().nullUndefinedEqual( true )));
  }

  @Test
  void testLooseTypes()
  {
    assertFalse( DeepComparison.deepEqual( 1, "1" ));
    assertTrue(  DeepComparison.deepEqual( 1, "1", new DeepComparison.Options().strictTypes( false )));
  }

  @Test
  void testCyclicStructures()
  {
    List<Object> a = new ArrayList<>();
    a.add( "head" );
    a.add( a );

    List<Object> b = new ArrayList<>();
    b.add( "head" );
    b.add( b );

    assertTrue( DeepComparison.deepEqual( a, b ));
  }

  @Test
  void testMaximumDepth()
  {
    List<Object> a = deepList( 20 );
    List<Object> b = deepList( 20 );

    assertTrue( DeepComparison.deepEqual( a, b ));
    assertThrows( IllegalStateException.class, () -> DeepComparison.deepEqual( a, b, new DeepComparison.Options().maxDepth( 10 )));
  }

  private static List<Object> deepList( int depth )
  {
    List<Object> root    = new ArrayList<>();
    List<Object> current = root;
    for( int i = 0; i < depth; i++ )
    {
      List<Object> next = new ArrayList<>();
      current.add( next );
      current = next;
    }
    current.add( "leaf" );
    return root;
  }
}
