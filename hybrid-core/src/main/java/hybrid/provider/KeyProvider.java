package hybrid.provider;

import java.time.Instant;
import java.util.List;

import hybrid.exceptions.EncryptionException;
import hybrid.model.KeyPair;
import hybrid.model.Preset;
import hybrid.model.SerializedKeyPair;
import hybrid.model.ValidationResult;

/**
 * Algorithm specific key pair handling. The key manager and the engine only
 * talk to this contract, so a new KEM is added by adding an implementation
 * and registering it with {@link KeyProviderFactory}.
 *
 * Validation methods never throw for bad input; every defect becomes an
 * entry of the returned error list.
 */
public interface KeyProvider
{
  public String getAlgorithmName();

  public Preset getPreset();

  /**
   * Fresh pair sized for the preset, created now, expiring after the
   * configured number of months, version 1.
   */
  public KeyPair generateKeyPair() throws EncryptionException;

  /**
   * @param version   replaces the default version 1 when not null
   * @param expiresAt replaces the computed expiry when not null
   */
  public KeyPair generateKeyPair( Integer version, Instant expiresAt ) throws EncryptionException;

  public ValidationResult validateKeyPair( KeyPair keyPair );

  public boolean isKeyPairExpired( KeyPair keyPair );

  /**
   * True when a secret recovered with the secret key from an encapsulation
   * against the public key equals the encapsulated secret.
   */
  public boolean keyPairMatches( KeyPair keyPair );

  /**
   * @throws IllegalArgumentException when either key is missing
   */
  public SerializedKeyPair serializeKeyPair( KeyPair keyPair );

  public KeyPair deserializeKeyPair( SerializedKeyPair serialized ) throws EncryptionException;

  public List<String> validateConfig( KeyGenerationConfig config );
}
