package socialpublish.jdbc.dialect;

import socialpublish.SqlUpdateException;
import socialpublish.jdbc.spi.Dialect;

import java.sql.SQLException;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Base dialect: falls back to {@link SqlUpdateException.Unknown} for anything a
 * subclass does not recognize as a constraint violation.
 *
 * <p>Subclasses implement {@link #violationOf(SQLException)} for their engine's
 * error reporting.
 */
public abstract class AbstractDialect implements Dialect {

  @Override
  public SqlUpdateException classify(SQLException e) {
    SqlUpdateException violation = violationOf(e);
    return violation != null ? violation : new SqlUpdateException.Unknown(e.getMessage(), e);
  }

  /**
   * Returns the classified violation, or {@code null} if {@code e} is not one.
   */
  protected abstract SqlUpdateException violationOf(SQLException e);

  protected static boolean containsIgnoreCase(String text, String fragment) {
    return text != null && text.toLowerCase(Locale.ROOT).contains(fragment.toLowerCase(Locale.ROOT));
  }

  protected static String group(Pattern pattern, String text, int group) {
    if (text == null) {
      return null;
    }
    Matcher m = pattern.matcher(text);
    return m.find() ? lower(m.group(group)) : null;
  }

  protected static String lower(String identifier) {
    return identifier == null ? null : identifier.toLowerCase(Locale.ROOT);
  }
}
