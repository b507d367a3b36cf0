package hybrid.provider;

import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.BiFunction;

import hybrid.exceptions.EncryptionException;
import hybrid.exceptions.ErrorKind;
import hybrid.model.KeyManagerIF;
import hybrid.model.Preset;

/**
 * Registry of key providers by algorithm name.
 */
public class KeyProviderFactory
{
  private static final Map<String, BiFunction<Preset, Integer, KeyProvider>> PROVIDERS = new ConcurrentHashMap<>();

  static
  {
    register( KeyManagerIF.KemAlgorithm, MlKemKeyProvider::new );
  }

  public static void register( String algorithm, BiFunction<Preset, Integer, KeyProvider> constructor )
  {
    if( algorithm == null || constructor == null )
      throw new IllegalArgumentException( "algorithm and constructor are required" );

    PROVIDERS.put( algorithm.toUpperCase(), constructor );
  }

  public static KeyProvider create( String algorithm, Preset preset, int expiryMonths )
   throws EncryptionException
  {
    BiFunction<Preset, Integer, KeyProvider> constructor = algorithm == null ? null : PROVIDERS.get( algorithm.toUpperCase() );
    if( constructor == null )
      throw new EncryptionException( "Unsupported key provider algorithm: " + algorithm + "; supported = " + supportedAlgorithms(), ErrorKind.CONFIG, preset, "createProvider" );
    if( preset == null )
      throw new EncryptionException( "A preset is required to create a key provider", ErrorKind.CONFIG, null, "createProvider" );

    return constructor.apply( preset, expiryMonths );
  }

  public static KeyProvider create( Preset preset )
   throws EncryptionException
  {
    return create( KeyManagerIF.KemAlgorithm, preset, KeyManagerIF.DefaultKeyExpiryMonths );
  }

  public static Set<String> supportedAlgorithms()
  {
    return new TreeSet<>( PROVIDERS.keySet() );
  }

  public static boolean isSupported( String algorithm )
  {
    return algorithm != null && PROVIDERS.containsKey( algorithm.toUpperCase() );
  }
}
