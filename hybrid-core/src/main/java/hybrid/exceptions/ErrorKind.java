package hybrid.exceptions;

/**
 * Machine-checkable classification of an {@link EncryptionException}.
 */
public enum ErrorKind
{
  VALIDATION(           "validation"           ),  // malformed caller input
  ALGORITHM_ASYMMETRIC( "algorithm-asymmetric" ),
  ALGORITHM_SYMMETRIC(  "algorithm-symmetric"  ),
  ALGORITHM_KDF(        "algorithm-kdf"        ),
  OPERATION(            "operation"            ),  // higher level operation failed, wraps a cause
  FORMAT(               "format"               ),  // malformed wire data
  CONFIG(               "config"               ),
  KEYMANAGER(           "keymanager"           );  // lifecycle, rotation and storage failures

  private final String code;

  ErrorKind( String code )
  {
    this.code = code;
  }

  public String getCode() { return code; }

  public static ErrorKind fromCode( String code )
  {
    for( ErrorKind k : values() )
    {
      if( k.code.equals( code ) )
        return k;
    }
    return null;
  }
}
