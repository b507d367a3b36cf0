package hybrid.provider;

import hybrid.model.Preset;

/**
 * Raw generation settings as received from a caller. Values stay textual so
 * that {@link KeyProvider#validateConfig} can report non-numeric input.
 */
public class KeyGenerationConfig
{
  private final String preset;
  private final String expiryMonths;

  public KeyGenerationConfig( String preset, String expiryMonths )
  {
    this.preset       = preset;
    this.expiryMonths = expiryMonths;
  }

  public KeyGenerationConfig( Preset preset, int expiryMonths )
  {
    this( preset == null ? null : preset.getWireName(), String.valueOf( expiryMonths ) );
  }

  public String getPreset()       { return preset;       }
  public String getExpiryMonths() { return expiryMonths; }
}
