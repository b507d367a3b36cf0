package hybrid.model;

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire record produced by the hybrid engine. The byte carrying fields are
 * standard base64 with padding. The preset is kept as the raw string received
 * so an unrecognized value can be reported by validation instead of failing
 * JSON binding.
 */
@JsonIgnoreProperties( ignoreUnknown = true )
public class EncryptedData
{
  @JsonProperty( "preset"           ) private final String preset;
  @JsonProperty( "encryptedContent" ) private final String encryptedContent;
  @JsonProperty( "cipherText"       ) private final String cipherText;
  @JsonProperty( "nonce"            ) private final String nonce;

  @JsonCreator
  public EncryptedData( @JsonProperty( "preset"           ) String preset,
                        @JsonProperty( "encryptedContent" ) String encryptedContent,
                        @JsonProperty( "cipherText"       ) String cipherText,
                        @JsonProperty( "nonce"            ) String nonce )
  {
    this.preset           = preset;
    this.encryptedContent = encryptedContent;
    this.cipherText       = cipherText;
    this.nonce            = nonce;
  }

  public EncryptedData( Preset preset, String encryptedContent, String cipherText, String nonce )
  {
    this( preset == null ? null : preset.getWireName(), encryptedContent, cipherText, nonce );
  }

  public String getPreset()           { return preset;           }
  public String getEncryptedContent() { return encryptedContent; }
  public String getCipherText()       { return cipherText;       }
  public String getNonce()            { return nonce;            }

  public EncryptedData withPreset( String newPreset )                 { return new EncryptedData( newPreset, encryptedContent, cipherText, nonce ); }
  public EncryptedData withEncryptedContent( String newContent )      { return new EncryptedData( preset, newContent, cipherText, nonce );         }
  public EncryptedData withCipherText( String newCipherText )         { return new EncryptedData( preset, encryptedContent, newCipherText, nonce ); }
  public EncryptedData withNonce( String newNonce )                   { return new EncryptedData( preset, encryptedContent, cipherText, newNonce ); }

  @Override
  public boolean equals( Object obj )
  {
    if( this == obj )
      return true;
    if( obj == null || getClass() != obj.getClass() )
      return false;

    EncryptedData that = (EncryptedData)obj;
    return Objects.equals( preset, that.preset ) && Objects.equals( encryptedContent, that.encryptedContent ) && Objects.equals( cipherText, that.cipherText ) && Objects.equals( nonce, that.nonce );
  }

  @Override
  public int hashCode()
  {
    return Objects.hash( preset, encryptedContent, cipherText, nonce );
  }

  @Override
  public String toString()
  {
    return String.format( "EncryptedData{preset='%s', encryptedContent=%d chars, cipherText=%d chars, nonce=%d chars}", preset,
                          encryptedContent == null ? 0 : encryptedContent.length(),
                          cipherText       == null ? 0 : cipherText.length(),
                          nonce            == null ? 0 : nonce.length() );
  }
}
