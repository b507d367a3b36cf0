package hybrid.model;

import java.util.Collections;
import java.util.List;

/**
 * Detailed check of the manager's current key pair.
 */
public class KeyValidationResult
{
  private final boolean      valid;
  private final List<String> errors;
  private final boolean      publicKeyValid;
  private final boolean      secretKeyValid;
  private final boolean      keyPairMatches;
  private final boolean      expired;

  public KeyValidationResult( List<String> errors, boolean publicKeyValid, boolean secretKeyValid, boolean keyPairMatches, boolean expired )
  {
    this.errors         = Collections.unmodifiableList( errors );
    this.publicKeyValid = publicKeyValid;
    this.secretKeyValid = secretKeyValid;
    this.keyPairMatches = keyPairMatches;
    this.expired        = expired;
    this.valid          = publicKeyValid && secretKeyValid && keyPairMatches && !expired;
  }

  public boolean      isValid()          { return valid;          }
  public List<String> getErrors()        { return errors;         }
  public boolean      isPublicKeyValid() { return publicKeyValid; }
  public boolean      isSecretKeyValid() { return secretKeyValid; }
  public boolean      isKeyPairMatches() { return keyPairMatches; }
  public boolean      isExpired()        { return expired;        }
}
