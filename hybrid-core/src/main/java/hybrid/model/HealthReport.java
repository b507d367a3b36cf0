package hybrid.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

public class HealthReport
{
  private final List<String> issues;

  public HealthReport( List<String> issues )
  {
    this.issues = Collections.unmodifiableList( new ArrayList<>( issues ) );
  }

  public boolean      isHealthy() { return issues.isEmpty(); }
  public List<String> getIssues() { return issues; }

  public JsonObject toJson()
  {
    return new JsonObject().put( "healthy", isHealthy() ).put( "issues", new JsonArray( new ArrayList<>( issues ) ) );
  }

  @Override
  public String toString()
  {
    return "HealthReport{healthy=" + isHealthy() + ", issues=" + issues + "}";
  }
}
