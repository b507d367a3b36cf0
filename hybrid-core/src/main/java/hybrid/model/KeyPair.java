package hybrid.model;

import java.time.Instant;
import java.util.Arrays;

import javax.security.auth.Destroyable;

/**
 * ML-KEM key pair with its metadata. Getters hand out copies; the held
 * buffers are zero-filled by {@link #destroy()} or {@link #close()}.
 *
 * The constructor performs no checks. Structural validation is the job of
 * the key provider so that every defect of a pair can be reported at once.
 */
public class KeyPair implements Destroyable, AutoCloseable
{
  private final byte[]      publicKey;
  private final byte[]      secretKey;
  private final KeyMetadata metadata;

  private volatile boolean destroyed = false;

  public KeyPair( byte[] publicKey, byte[] secretKey, KeyMetadata metadata )
  {
    this.publicKey = publicKey == null ? null : publicKey.clone();
    this.secretKey = secretKey == null ? null : secretKey.clone();
    this.metadata  = metadata;
  }

  public byte[]      getPublicKey() { return publicKey == null ? null : publicKey.clone(); }
  public byte[]      getSecretKey() { return secretKey == null ? null : secretKey.clone(); }
  public KeyMetadata getMetadata()  { return metadata; }

  public boolean hasPublicKey() { return publicKey != null; }
  public boolean hasSecretKey() { return secretKey != null; }

  public int getPublicKeyLength() { return publicKey == null ? -1 : publicKey.length; }
  public int getSecretKeyLength() { return secretKey == null ? -1 : secretKey.length; }

  public Preset getPreset()
  {
    return metadata == null ? null : metadata.getPreset();
  }

  public int getVersion()
  {
    return metadata == null ? 0 : metadata.getVersion();
  }

  public boolean isExpired()
  {
    return metadata == null || metadata.isExpired( Instant.now() );
  }

  /**
   * Returns an independent copy; destroying either pair leaves the other intact.
   */
  public KeyPair copy()
  {
    return new KeyPair( publicKey, secretKey, metadata );
  }

  /**
   * Returns a copy of this pair carrying a different version number.
   */
  public KeyPair withVersion( int version )
  {
    KeyMetadata md = metadata == null ? null : metadata.withVersion( version );
    return new KeyPair( publicKey, secretKey, md );
  }

  @Override
  public void destroy()
  {
    if( secretKey != null )
      Arrays.fill( secretKey, (byte)0 );
    if( publicKey != null )
      Arrays.fill( publicKey, (byte)0 );

    destroyed = true;
  }

  @Override
  public boolean isDestroyed()
  {
    return destroyed;
  }

  @Override
  public void close()
  {
    destroy();
  }

  @Override
  public String toString()
  {
    return String.format( "KeyPair{publicKey=%d bytes, secretKey=%d bytes, metadata=%s, destroyed=%s}", getPublicKeyLength(), getSecretKeyLength(), metadata, destroyed );
  }
}
