package hybrid.service;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Instant;
import java.time.temporal.ChronoUnit;

import org.junit.jupiter.api.Test;

import hybrid.model.KeyMetadata;
import hybrid.model.KeyPair;
import hybrid.model.KeyValidationResult;
import hybrid.model.Preset;
import hybrid.provider.MlKemKeyProvider;

class KeyLifecycleServiceTest
{
  private final KeyLifecycleService lifecycle = new KeyLifecycleService( new MlKemKeyProvider( Preset.NORMAL ));

  @Test
  void testCreatedPairIsValid() throws Exception
  {
    KeyPair pair = lifecycle.createNewKeyPair( 7 );

    assertEquals( 7, pair.getVersion() );

    KeyValidationResult result = lifecycle.validateKeys( pair );
    assertTrue( result.isValid(), result.getErrors().toString() );
    assertTrue( result.isKeyPairMatches() );
    assertFalse( lifecycle.haveKeysExpired( pair ));
  }

  @Test
  void testMissingPair()
  {
    KeyValidationResult result = lifecycle.validateKeys( null );

    assertFalse( result.isValid() );
    assertEquals( "No key pair loaded", result.getErrors().get( 0 ));
  }

  @Test
  void testForeignSecretKeyDetected() throws Exception
  {
    KeyPair a = lifecycle.createNewKeyPair( 1 );
    KeyPair b = lifecycle.createNewKeyPair( 2 );

    KeyValidationResult result = lifecycle.validateKeys( new KeyPair( a.getPublicKey(), b.getSecretKey(), a.getMetadata() ));

    assertFalse( result.isValid() );
    assertTrue( result.isPublicKeyValid() );
    assertTrue( result.isSecretKeyValid() );
    assertFalse( result.isKeyPairMatches() );
  }

  @Test
  void testExpiredPair() throws Exception
  {
    KeyPair     fresh   = lifecycle.createNewKeyPair( 1 );
    Instant     past    = Instant.now().minus( 60, ChronoUnit.DAYS );
    KeyMetadata expired = new KeyMetadata( Preset.NORMAL, 1, past, past.plus( 30, ChronoUnit.DAYS ));

    KeyValidationResult result = lifecycle.validateKeys( new KeyPair( fresh.getPublicKey(), fresh.getSecretKey(), expired ));

    assertFalse( result.isValid() );
    assertTrue( result.isExpired() );
    assertTrue( result.getErrors().contains( "Key pair has expired" ));
  }

  @Test
  void testClearKeys() throws Exception
  {
    KeyPair a = lifecycle.createNewKeyPair( 1 );
    KeyPair b = lifecycle.createNewKeyPair( 2 );

    lifecycle.securelyClearKeys( a, null, b );

    assertTrue( a.isDestroyed() );
    assertTrue( b.isDestroyed() );
    assertArrayEquals( new byte[Preset.NORMAL.getSecretKeyLength()], a.getSecretKey() );
  }
}
