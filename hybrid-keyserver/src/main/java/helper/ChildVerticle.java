package helper;

/**
 * Name and deployment id of a verticle deployed by a service main.
 */
public record ChildVerticle( String vertName, String id )
{
}
