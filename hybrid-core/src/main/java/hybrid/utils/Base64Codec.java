package hybrid.utils;

import java.util.Base64;

import hybrid.exceptions.FormatConversionException;

/**
 * Standard alphabet, padded base64 without line breaks.
 */
public class Base64Codec
{
  public static String encode( byte[] data )
  {
    if( data == null )
      throw new IllegalArgumentException( "data cannot be null" );

    return Base64.getEncoder().encodeToString( data );
  }

  public static byte[] decode( String val )
   throws FormatConversionException
  {
    if( val == null )
      throw new FormatConversionException( "Base64 decoding failed: value is missing", "base64", "bytes", null );
    if( val.length() % 4 != 0 )
      throw new FormatConversionException( "Base64 decoding failed: length " + val.length() + " is not a multiple of 4", "base64", "bytes", null );

    try
    {
      return Base64.getDecoder().decode( val );
    }
    catch( IllegalArgumentException e )
    {
      throw new FormatConversionException( "Base64 decoding failed: " + e.getMessage(), "base64", "bytes", e );
    }
  }

  public static boolean isValid( String val )
  {
    try
    {
      decode( val );
      return true;
    }
    catch( FormatConversionException e )
    {
      return false;
    }
  }
}
