package hybrid.crypto;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.Test;

import hybrid.exceptions.EncryptionException;
import hybrid.exceptions.ErrorKind;
import hybrid.model.Preset;

class AesGcmAlgorithmTest
{
  private final AesGcmAlgorithm aes = new AesGcmAlgorithm( Preset.NORMAL );
  private final byte[]          key = new byte[32];

  @Test
  void testSealAndOpen() throws Exception
  {
    byte[] nonce  = aes.generateNonce();
    byte[] sealed = aes.encrypt( "payload".getBytes( StandardCharsets.UTF_8 ), key, nonce );

    assertEquals( 7 + AesGcmAlgorithm.GCM_TAG_LENGTH, sealed.length );
    assertEquals( "payload", new String( aes.decrypt( sealed, key, nonce ), StandardCharsets.UTF_8 ));
  }

  @Test
  void testTagMismatch() throws Exception
  {
    byte[] nonce  = aes.generateNonce();
    byte[] sealed = aes.encrypt( new byte[] { 1, 2, 3 }, key, nonce );
    sealed[sealed.length - 1] ^= 0x10;

    EncryptionException e = assertThrows( EncryptionException.class, () -> aes.decrypt( sealed, key, nonce ));
    assertEquals( ErrorKind.ALGORITHM_SYMMETRIC, e.getKind() );
  }

  @Test
  void testBadKeyAndNonceLengths()
  {
    assertThrows( EncryptionException.class, () -> aes.encrypt( new byte[1], new byte[16], aes.generateNonce() ));
    assertThrows( EncryptionException.class, () -> aes.encrypt( new byte[1], key, new byte[5] ));
  }

  @Test
  void testNonceSizes()
  {
    assertEquals( 12, aes.generateNonce().length );
    assertEquals( 16, new AesGcmAlgorithm( Preset.HIGH_SECURITY ).generateNonce().length );
  }
}
