package hybrid.exceptions;

import hybrid.model.Preset;

/**
 * Typed failure of any encryption, decryption or key management operation.
 * Messages never carry key material.
 */
public class EncryptionException extends Exception
{
  private static final long serialVersionUID = 4410285117213845961L;

  private final ErrorKind kind;
  private final Preset    preset;
  private final String    operation;

  public EncryptionException( String message, ErrorKind kind, Preset preset, String operation )
  {
    this( message, kind, preset, operation, null );
  }

  public EncryptionException( String message, ErrorKind kind, Preset preset, String operation, Throwable cause )
  {
    super( message, cause );
    this.kind      = kind == null ? ErrorKind.OPERATION : kind;
    this.preset    = preset;
    this.operation = operation;
  }

  public ErrorKind getKind()      { return kind;      }
  public Preset    getPreset()    { return preset;    }
  public String    getOperation() { return operation; }

  /**
   * Builds the exception subtype matching the kind: FORMAT yields a
   * {@link FormatConversionException}, KEYMANAGER a {@link KeyManagerException}.
   */
  public static EncryptionException create( String message, ErrorKind kind, Preset preset, String operation, Throwable cause )
  {
    if( kind == ErrorKind.FORMAT )
      return new FormatConversionException( message, null, null, preset, operation, cause );
    if( kind == ErrorKind.KEYMANAGER )
      return new KeyManagerException( message, preset, operation, null, cause );

    return new EncryptionException( message, kind, preset, operation, cause );
  }

  public static EncryptionException create( String message, ErrorKind kind, Preset preset, String operation )
  {
    return create( message, kind, preset, operation, null );
  }

  /**
   * Returns the throwable as an EncryptionException, wrapping anything else
   * with the given kind.
   */
  public static EncryptionException wrap( Throwable t, String message, ErrorKind kind, Preset preset, String operation )
  {
    if( t instanceof EncryptionException )
      return (EncryptionException)t;

    String detail = t == null || t.getMessage() == null ? "Unknown error" : t.getMessage();
    return create( message + ": " + detail, kind, preset, operation, t );
  }

  @Override
  public String toString()
  {
    return String.format( "%s[%s]{preset=%s, operation=%s}: %s", getClass().getSimpleName(), kind.getCode(), preset, operation, getMessage() );
  }
}
