package service;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import io.vertx.core.json.JsonObject;

import helper.KeyServerConfig;
import hybrid.model.KeyManagerIF;
import verticle.KeyServiceVert;

class KeyServerMainTest
{
  @TempDir
  Path tempDir;

  @Test
  void testStartServeStop() throws Exception
  {
    Map<String, String> km = Map.of( KeyManagerIF.CertPath,    tempDir.resolve( "keys" ).toString(),
                                     KeyManagerIF.AllowedRoot, tempDir.toString() );

    KeyServerMain main = new KeyServerMain( new KeyServerConfig( "main-test", "main", 2, 3_600_000L, km ));
    try
    {
      main.start();

      assertTrue( main.getKeyManager().isInitialized() );

      JsonObject status = main.getVertx().eventBus().<JsonObject>request( "main." + KeyServiceVert.StatusAddr, new JsonObject() )
                                                    .toCompletionStage().toCompletableFuture().get( 30, TimeUnit.SECONDS ).body();
      assertEquals( 1, status.getInteger( "currentKeyVersion" ));
    }
    finally
    {
      main.stop();
    }

    assertNull( main.getKeyManager().getKeyPair() );
  }
}
