package hybrid.exceptions;

import hybrid.model.Preset;

/**
 * Thrown when data cannot be converted between representations, e.g. bad
 * base64 or JSON that cannot be decoded.
 */
public class FormatConversionException extends EncryptionException
{
  private static final long serialVersionUID = -2388143508512773307L;

  private final String sourceFormat;
  private final String targetFormat;

  public FormatConversionException( String message, String sourceFormat, String targetFormat, Preset preset, String operation, Throwable cause )
  {
    super( message, ErrorKind.FORMAT, preset, operation, cause );
    this.sourceFormat = sourceFormat;
    this.targetFormat = targetFormat;
  }

  public FormatConversionException( String message, String sourceFormat, String targetFormat, Throwable cause )
  {
    this( message, sourceFormat, targetFormat, null, "convert", cause );
  }

  public String getSourceFormat() { return sourceFormat; }
  public String getTargetFormat() { return targetFormat; }
}
