package verticle;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import io.vertx.core.Future;
import io.vertx.core.Vertx;

import hybrid.handler.KeyManager;
import hybrid.model.KeyManagerIF;
import hybrid.model.RotationReason;
import hybrid.utils.KeyManagerConfig;

class KeyRotationVertTest
{
  @TempDir
  Path tempDir;

  private Vertx      vertx;
  private KeyManager keyManager;

  @BeforeEach
  void setUp() throws Exception
  {
    vertx = Vertx.vertx();

    Map<String, String> map = KeyManagerConfig.defaults();
    map.put( KeyManagerIF.CertPath,    tempDir.resolve( "keys" ).toString() );
    map.put( KeyManagerIF.AllowedRoot, tempDir.toString() );

    keyManager = new KeyManager( vertx, new KeyManagerConfig( map ));
    await( keyManager.initialize() );
  }

  @AfterEach
  void tearDown() throws Exception
  {
    keyManager.close();
    await( vertx.close() );
  }

  private static <T> T await( Future<T> future ) throws Exception
  {
    return future.toCompletionStage().toCompletableFuture().get( 30, TimeUnit.SECONDS );
  }

  @Test
  void testRejectsNonPositiveInterval()
  {
    assertThrows( IllegalArgumentException.class, () -> new KeyRotationVert( keyManager, 0 ));
  }

  @Test
  void testPeriodicRotation() throws Exception
  {
    String id = await( vertx.deployVerticle( new KeyRotationVert( keyManager, 200 )));

    long deadline = System.currentTimeMillis() + 20_000;
    while( keyManager.getKeyPair().getVersion() < 2 && System.currentTimeMillis() < deadline )
      Thread.sleep( 50 );

    await( vertx.undeploy( id ));

    assertTrue( keyManager.getKeyPair().getVersion() >= 2 );
    assertEquals( RotationReason.SCHEDULED_ROTATION, await( keyManager.getRotationHistory() ).getRotations().get( 1 ).getReason() );
  }
}
