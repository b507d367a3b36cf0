package hybrid.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of a non-throwing validation: ok is true exactly when no errors
 * were collected.
 */
public class ValidationResult
{
  private final List<String> errors;

  public ValidationResult( List<String> errors )
  {
    this.errors = errors == null ? Collections.emptyList() : Collections.unmodifiableList( new ArrayList<>( errors ) );
  }

  public static ValidationResult ok()
  {
    return new ValidationResult( null );
  }

  public boolean      isOk()      { return errors.isEmpty(); }
  public List<String> getErrors() { return errors; }

  @Override
  public String toString()
  {
    return isOk() ? "ValidationResult{ok}" : "ValidationResult{errors=" + errors + "}";
  }
}
