package hybrid.crypto;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;

import org.junit.jupiter.api.Test;

import hybrid.exceptions.EncryptionException;
import hybrid.exceptions.ErrorKind;
import hybrid.model.Preset;

class KeyDerivationTest
{
  @Test
  void testDeterministicPerSecret() throws Exception
  {
    byte[] secret = new byte[32];
    secret[0] = 7;

    byte[] k1 = KeyDerivation.deriveKey( Preset.NORMAL, secret );
    byte[] k2 = KeyDerivation.deriveKey( Preset.NORMAL, secret );

    assertEquals( 32, k1.length );
    assertArrayEquals( k1, k2 );
  }

  @Test
  void testPresetsDeriveDifferentKeys() throws Exception
  {
    byte[] secret = new byte[32];

    assertFalse( Arrays.equals( KeyDerivation.deriveKey( Preset.NORMAL, secret ), KeyDerivation.deriveKey( Preset.HIGH_SECURITY, secret )));
  }

  @Test
  void testWrongSecretLength()
  {
    EncryptionException e = assertThrows( EncryptionException.class, () -> KeyDerivation.deriveKey( Preset.NORMAL, new byte[16] ));
    assertEquals( ErrorKind.ALGORITHM_KDF, e.getKind() );
  }
}
