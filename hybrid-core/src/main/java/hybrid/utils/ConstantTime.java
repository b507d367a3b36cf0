package hybrid.utils;

import org.bouncycastle.util.Arrays;

public class ConstantTime
{
  /**
   * Compares two byte arrays without short-circuiting on the first differing
   * byte. Lengths are not secret, so a length mismatch returns false at once.
   */
  public static boolean areEqual( byte[] a, byte[] b )
  {
    if( a == null || b == null )
      return a == b;
    if( a.length != b.length )
      return false;

    return Arrays.constantTimeAreEqual( a, b );
  }
}
