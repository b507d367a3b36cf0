package service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.vertx.core.DeploymentOptions;
import io.vertx.core.Verticle;
import io.vertx.core.Vertx;
import io.vertx.core.VertxOptions;

import helper.ChildVerticle;
import helper.KeyServerConfig;
import hybrid.handler.KeyManager;
import hybrid.utils.KeyManagerConfig;
import verticle.KeyRotationVert;
import verticle.KeyServiceVert;

/**
 * Key server entry point. Reads the JSON config named by the first argument
 * or the KEYSERVER_CONFIG environment variable, then deploys the event bus
 * service and the rotation scheduler.
 */
public class KeyServerMain
{
  private static final Logger LOGGER = LoggerFactory.getLogger( KeyServerMain.class );

  public static final String ConfigEnv     = "KEYSERVER_CONFIG";
  public static final String DefaultConfig = "./config/keyserver.json";

  private final KeyServerConfig  serverConfig;
  private final KeyManagerConfig keyManagerConfig;
  private final Vertx            vertx;
  private final KeyManager       keyManager;
  private final ServerDecryption serverDecryption;

  private final List<ChildVerticle> deployedVerticles = new ArrayList<>();

  public KeyServerMain( KeyServerConfig serverConfig )
  {
    this.serverConfig     = serverConfig;
    this.keyManagerConfig = serverConfig.toKeyManagerConfig();

    VertxOptions options = new VertxOptions().setWorkerPoolSize( serverConfig.getWorkerPoolSize() ).setMaxWorkerExecuteTime( 60000 ).setMaxWorkerExecuteTimeUnit( TimeUnit.MILLISECONDS );
    this.vertx            = Vertx.vertx( options );
    this.keyManager       = new KeyManager( vertx, keyManagerConfig );
    this.serverDecryption = new ServerDecryption( vertx, keyManager );

    LOGGER.info( "KeyServerMain created for service {}", serverConfig.getServiceId() );
  }

  public Vertx            getVertx()            { return vertx;            }
  public KeyManager       getKeyManager()       { return keyManager;       }
  public ServerDecryption getServerDecryption() { return serverDecryption; }

  /**
   * Deploys the service verticle, which initializes the key manager, and then
   * the rotation verticle. Blocks until both are deployed.
   */
  public void start()
   throws Exception
  {
    LOGGER.info( "Starting key server..." );

    KeyServiceVert serviceVert = new KeyServiceVert( serverDecryption, serverConfig.getAddressPrefix() );
    deploy( serviceVert );

    KeyRotationVert rotationVert = new KeyRotationVert( keyManager, serverConfig.effectiveRotationIntervalMs( keyManagerConfig ));
    deploy( rotationVert );

    LOGGER.info( "Key server started with {} verticles", deployedVerticles.size() );
  }

  private void deploy( Verticle verticle )
   throws Exception
  {
    String id = vertx.deployVerticle( verticle, new DeploymentOptions() ).toCompletionStage().toCompletableFuture().get( 60, TimeUnit.SECONDS );
    deployedVerticles.add( new ChildVerticle( verticle.getClass().getSimpleName(), id ));
    LOGGER.info( "{} deployed: {}", verticle.getClass().getSimpleName(), id );
  }

  public void stop()
  {
    LOGGER.info( "Stopping key server" );

    for( int i = deployedVerticles.size() - 1; i >= 0; i-- )
    {
      ChildVerticle child = deployedVerticles.get( i );
      try
      {
        vertx.undeploy( child.id() ).toCompletionStage().toCompletableFuture().get( 10, TimeUnit.SECONDS );
      }
      catch( Exception e )
      {
        LOGGER.warn( "Error undeploying verticle {}: {}", child.vertName(), e.getMessage() );
      }
    }
    deployedVerticles.clear();

    keyManager.close();

    try
    {
      vertx.close().toCompletionStage().toCompletableFuture().get( 10, TimeUnit.SECONDS );
    }
    catch( Exception e )
    {
      LOGGER.warn( "Error closing Vert.x: {}", e.getMessage() );
    }

    LOGGER.info( "Key server stopped" );
  }

  public static void main( String[] args )
  {
    String path = args.length > 0 ? args[0] : System.getenv( ConfigEnv ) != null ? System.getenv( ConfigEnv ) : DefaultConfig;
    LOGGER.info( "KeyServerMain.main - reading config from {}", path );

    final KeyServerMain svc;
    try
    {
      svc = new KeyServerMain( KeyServerConfig.fromFile( path ));
    }
    catch( Exception e )
    {
      LOGGER.error( "Failed to read key server config: {}", e.getMessage(), e );
      System.exit( 1 );
      return;
    }

    Runtime.getRuntime().addShutdownHook( new Thread( () ->
    {
      LOGGER.info( "Shutdown hook triggered - cleaning up resources" );
      svc.stop();
    }));

    try
    {
      svc.start();
    }
    catch( Exception e )
    {
      LOGGER.error( "Fatal error starting key server: {}", e.getMessage(), e );
      svc.stop();
      System.exit( 1 );
    }
  }
}
