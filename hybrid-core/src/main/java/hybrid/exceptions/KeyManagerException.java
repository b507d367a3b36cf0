package hybrid.exceptions;

import hybrid.model.Preset;

/**
 * Key lifecycle failure: initialization, rotation, storage or retrieval.
 */
public class KeyManagerException extends EncryptionException
{
  private static final long serialVersionUID = 7031949905263401786L;

  private final Integer keyVersion;

  public KeyManagerException( String message, Preset preset, String operation, Integer keyVersion, Throwable cause )
  {
    super( message, ErrorKind.KEYMANAGER, preset, operation, cause );
    this.keyVersion = keyVersion;
  }

  public KeyManagerException( String message, Preset preset, String operation )
  {
    this( message, preset, operation, null, null );
  }

  public Integer getKeyVersion() { return keyVersion; }
}
