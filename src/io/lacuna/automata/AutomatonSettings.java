package io.lacuna.automata;

import java.util.Objects;
import java.util.Properties;

/**
 * Process-wide switches consulted whenever an automaton is built.
 * <p>
 * {@code validate} controls whether a newly built automaton is checked for structural violations, and
 * {@code allowMutableAutomata} lets an automaton share its builder's collections instead of forking them into
 * persistent ones.
 */
public final class AutomatonSettings {

  public static final String VALIDATE_PROPERTY = "automata.validate";
  public static final String ALLOW_MUTABLE_PROPERTY = "automata.allowMutable";

  public static final AutomatonSettings DEFAULT = new AutomatonSettings(true, false);

  private static volatile AutomatonSettings global = DEFAULT;

  private final boolean validate;
  private final boolean allowMutableAutomata;

  private AutomatonSettings(boolean validate, boolean allowMutableAutomata) {
    this.validate = validate;
    this.allowMutableAutomata = allowMutableAutomata;
  }

  public static AutomatonSettings global() {
    return global;
  }

  public static void setGlobal(AutomatonSettings settings) {
    global = Objects.requireNonNull(settings, "settings");
  }

  public static AutomatonSettings fromProperties(Properties properties) {
    return new AutomatonSettings(
            Boolean.parseBoolean(properties.getProperty(VALIDATE_PROPERTY, "true")),
            Boolean.parseBoolean(properties.getProperty(ALLOW_MUTABLE_PROPERTY, "false")));
  }

  public static AutomatonSettings fromSystemProperties() {
    return fromProperties(System.getProperties());
  }

  public boolean validate() {
    return validate;
  }

  public boolean allowMutableAutomata() {
    return allowMutableAutomata;
  }

  public AutomatonSettings withValidation(boolean validate) {
    return new AutomatonSettings(validate, allowMutableAutomata);
  }

  public AutomatonSettings withMutableAutomata(boolean allowMutableAutomata) {
    return new AutomatonSettings(validate, allowMutableAutomata);
  }

  @Override
  public boolean equals(Object obj) {
    if (obj instanceof AutomatonSettings) {
      AutomatonSettings s = (AutomatonSettings) obj;
      return validate == s.validate && allowMutableAutomata == s.allowMutableAutomata;
    }
    return false;
  }

  @Override
  public int hashCode() {
    return (validate ? 2 : 0) + (allowMutableAutomata ? 1 : 0);
  }

  @Override
  public String toString() {
    return "settings[validate=" + validate + ", allowMutableAutomata=" + allowMutableAutomata + "]";
  }
}
