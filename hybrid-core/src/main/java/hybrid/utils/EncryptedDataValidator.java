package hybrid.utils;

import java.util.ArrayList;
import java.util.List;

import hybrid.exceptions.FormatConversionException;
import hybrid.model.EncryptedData;
import hybrid.model.Preset;
import hybrid.model.ValidationResult;

/**
 * Structural checks of an {@link EncryptedData} record. Runs before any
 * cryptography so malformed input never reaches the primitives.
 */
public class EncryptedDataValidator
{
  public static final int GCM_TAG_LENGTH = 16;

  public static ValidationResult validate( EncryptedData data )
  {
    List<String> errors = new ArrayList<>();

    if( data == null )
    {
      errors.add( "Encrypted data is missing" );
      return new ValidationResult( errors );
    }

    Preset preset = null;
    if( isBlank( data.getPreset() ))
      errors.add( "preset is missing" );
    else
    {
      preset = Preset.fromString( data.getPreset() );
      if( preset == null )
        errors.add( "preset is not recognized: " + data.getPreset() );
    }

    byte[] content    = decodeField( "encryptedContent", data.getEncryptedContent(), errors );
    byte[] cipherText = decodeField( "cipherText",       data.getCipherText(),       errors );
    byte[] nonce      = decodeField( "nonce",            data.getNonce(),            errors );

    if( content != null && content.length < GCM_TAG_LENGTH )
      errors.add( "encryptedContent is shorter than the authentication tag (" + content.length + " bytes)" );

    if( preset != null )
    {
      if( cipherText != null && cipherText.length != preset.getCipherTextLength() )
        errors.add( "cipherText must be " + preset.getCipherTextLength() + " bytes for " + preset.getWireName() + " (got " + cipherText.length + ")" );
      if( nonce != null && nonce.length != preset.getNonceLength() )
        errors.add( "nonce must be " + preset.getNonceLength() + " bytes for " + preset.getWireName() + " (got " + nonce.length + ")" );
    }

    return new ValidationResult( errors );
  }

  private static byte[] decodeField( String name, String value, List<String> errors )
  {
    if( isBlank( value ))
    {
      errors.add( name + " is missing" );
      return null;
    }

    try
    {
      return Base64Codec.decode( value );
    }
    catch( FormatConversionException e )
    {
      errors.add( name + " is not valid base64" );
      return null;
    }
  }

  private static boolean isBlank( String s )
  {
    return s == null || s.trim().isEmpty();
  }
}
