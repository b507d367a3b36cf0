package hybrid.model;

/**
 * Configuration keys and storage names shared by the key manager and the
 * services that host it.
 */
public interface KeyManagerIF
{
  // Configuration map keys
  public static final String Preset                       = "preset";
  public static final String CertPath                     = "certPath";
  public static final String KeyExpiryMonths              = "keyExpiryMonths";
  public static final String AutoGenerate                 = "autoGenerate";
  public static final String EnableFileBackup             = "enableFileBackup";
  public static final String RotationGracePeriodInMinutes = "rotationGracePeriodInMinutes";
  public static final String RotationIntervalInWeeks      = "rotationIntervalInWeeks";
  public static final String AllowedRoot                  = "allowedRoot";

  // Defaults
  public static final String DefaultCertPath              = "./config/certs/keys";
  public static final int    DefaultKeyExpiryMonths       = 1;
  public static final int    DefaultGracePeriodMinutes    = 15;
  public static final int    DefaultRotationIntervalWeeks = 3;
  public static final int    MaxRotationIntervalWeeks     = 30;

  // Storage layout
  public static final String PublicKeyFile       = "public-key.bin";
  public static final String SecretKeyFile       = "secret-key.bin";
  public static final String KeyMetadataFile     = "key-metadata.json";
  public static final String RotationHistoryFile = "rotation-history.json";
  public static final String BackupDir           = "backup";

  public static final String KemAlgorithm = "ML-KEM";
}
