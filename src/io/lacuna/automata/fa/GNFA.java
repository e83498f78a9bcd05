package io.lacuna.automata.fa;

import io.lacuna.automata.AutomatonException;
import io.lacuna.automata.AutomatonSettings;
import io.lacuna.automata.FinalStateException;
import io.lacuna.automata.InitialStateException;
import io.lacuna.automata.MissingStateException;
import io.lacuna.automata.Step;
import io.lacuna.automata.Utils;
import io.lacuna.automata.regex.InvalidRegexException;
import io.lacuna.automata.regex.Regex;
import io.lacuna.automata.regex.RegexException;
import io.lacuna.bifurcan.IMap;
import io.lacuna.bifurcan.ISet;
import io.lacuna.bifurcan.LinearList;
import io.lacuna.bifurcan.LinearMap;
import io.lacuna.bifurcan.LinearSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * A generalized NFA, whose edges are labelled with regular expressions. There is exactly one edge, possibly absent,
 * between every ordered pair of states, except that nothing enters the initial state and nothing leaves the final
 * state. An edge labelled with the empty string accepts only the empty word.
 * <p>
 * A GNFA exists to be reduced, one state at a time, until a single edge describes its whole language.
 *
 * @param <S> the state type
 */
public class GNFA<S> extends FiniteAutomaton<S, Void> {

  private static final Logger logger = LoggerFactory.getLogger(GNFA.class);

  private static final String LABEL_OPERATORS = "*|()?";

  private final IMap<S, IMap<S, Optional<String>>> transitions;
  private final S finalState;

  private GNFA(
          AutomatonSettings settings,
          ISet<S> states,
          ISet<String> inputSymbols,
          IMap<S, IMap<S, Optional<String>>> transitions,
          S initialState,
          S finalState) {
    super(settings, states, inputSymbols, initialState);
    this.transitions = transitions;
    this.finalState = finalState;
  }

  public static <S> Builder<S> builder() {
    return new Builder<>();
  }

  public static final class Builder<S> {

    private final LinearSet<S> states = new LinearSet<>();
    private final LinearSet<String> inputSymbols = new LinearSet<>();
    private final LinearMap<S, LinearMap<S, Optional<String>>> transitions = new LinearMap<>();
    private S initialState;
    private S finalState;
    private AutomatonSettings settings = AutomatonSettings.global();

    private Builder() {
    }

    public Builder<S> state(S state) {
      states.add(state);
      return this;
    }

    public Builder<S> states(Iterable<S> states) {
      states.forEach(this.states::add);
      return this;
    }

    @SafeVarargs
    public final Builder<S> states(S... states) {
      for (S s : states) {
        this.states.add(s);
      }
      return this;
    }

    public Builder<S> inputSymbols(Iterable<String> symbols) {
      symbols.forEach(inputSymbols::add);
      return this;
    }

    public Builder<S> inputSymbols(String... symbols) {
      for (String s : symbols) {
        inputSymbols.add(s);
      }
      return this;
    }

    /**
     * Sets the edge from {@code from} to {@code to}. A null {@code regex} declares the edge absent.
     */
    public Builder<S> transition(S from, S to, String regex) {
      LinearMap<S, Optional<String>> row = transitions.get(from, null);
      if (row == null) {
        row = new LinearMap<>();
        transitions.put(from, row);
      }
      row.put(to, Optional.ofNullable(regex));
      return this;
    }

    public Builder<S> initialState(S state) {
      initialState = state;
      return this;
    }

    public Builder<S> finalState(S state) {
      finalState = state;
      return this;
    }

    public Builder<S> settings(AutomatonSettings settings) {
      this.settings = settings;
      return this;
    }

    public GNFA<S> build() {
      if (initialState == null) {
        throw new MissingStateException("no initial state was specified");
      } else if (finalState == null) {
        throw new MissingStateException("no final state was specified");
      }

      boolean mutable = settings.allowMutableAutomata();
      LinearMap<S, IMap<S, Optional<String>>> t = new LinearMap<>();
      for (S s : transitions.keys()) {
        LinearMap<S, Optional<String>> row = transitions.get(s, null);
        t.put(s, mutable ? row : row.forked());
      }

      GNFA<S> gnfa = new GNFA<>(
              settings,
              mutable ? states : states.forked(),
              mutable ? inputSymbols : inputSymbols.forked(),
              mutable ? t : t.forked(),
              initialState,
              finalState);

      if (settings.validate()) {
        gnfa.validate();
      }
      return gnfa;
    }
  }

  public Builder<S> toBuilder() {
    Builder<S> b = GNFA.<S>builder()
            .settings(settings)
            .states(states)
            .inputSymbols(inputSymbols)
            .initialState(initialState)
            .finalState(finalState);
    for (S from : transitions.keys()) {
      IMap<S, Optional<String>> row = transitions.get(from, null);
      for (S to : row.keys()) {
        b.transition(from, to, row.get(to, null).orElse(null));
      }
    }
    return b;
  }

  ///

  public IMap<S, IMap<S, Optional<String>>> transitions() {
    return transitions;
  }

  public S finalState() {
    return finalState;
  }

  /**
   * @return the label of the edge from {@code from} to {@code to}, or nothing if the edge is absent
   */
  public Optional<String> edge(S from, S to) {
    IMap<S, Optional<String>> row = transitions.get(from, null);
    return row == null ? Optional.empty() : row.get(to, Optional.empty());
  }

  /**
   * @return every edge which is not absent
   */
  @Override
  public Iterable<Transition<S>> iterTransitions() {
    LinearList<Transition<S>> result = new LinearList<>();
    for (S from : transitions.keys()) {
      IMap<S, Optional<String>> row = transitions.get(from, null);
      for (S to : row.keys()) {
        Optional<String> label = row.get(to, null);
        if (label.isPresent()) {
          result.addLast(new Transition<>(from, label.get(), to));
        }
      }
    }
    return result;
  }

  @Override
  public Optional<AutomatonException> findViolation() {
    if (initialState.equals(finalState)) {
      return Optional.of(new InitialStateException("the initial state " + initialState + " cannot also be final"));
    }

    Optional<AutomatonException> e = checkInitialState();
    if (!e.isPresent()) {
      e = checkState(finalState);
    }
    if (e.isPresent()) {
      return e;
    }

    for (S from : transitions.keys()) {
      e = checkState(from);
      if (e.isPresent()) {
        return e;
      }

      IMap<S, Optional<String>> row = transitions.get(from, null);
      if (from.equals(finalState) && row.size() > 0) {
        return Optional.of(new FinalStateException("the final state " + finalState + " has outgoing transitions"));
      }

      for (S to : row.keys()) {
        e = checkState(to);
        if (e.isPresent()) {
          return e;
        } else if (to.equals(initialState)) {
          return Optional.of(new InitialStateException("the initial state " + initialState + " has incoming transitions"));
        }

        Optional<String> label = row.get(to, null);
        if (label.isPresent()) {
          e = checkLabel(from, to, label.get());
          if (e.isPresent()) {
            return e;
          }
        }
      }
    }

    for (S from : states) {
      if (from.equals(finalState)) {
        continue;
      }
      IMap<S, Optional<String>> row = transitions.get(from, null);
      if (row == null) {
        return Optional.of(new MissingStateException("state " + from + " is missing from the transitions"));
      }
      for (S to : states) {
        if (!to.equals(initialState) && !row.contains(to)) {
          return Optional.of(new MissingStateException("state " + from + " is missing a transition to " + to));
        }
      }
    }
    return Optional.empty();
  }

  private Optional<AutomatonException> checkLabel(S from, S to, String label) {
    for (String c : Utils.symbols(label)) {
      if (!inputSymbols.contains(c) && !LABEL_OPERATORS.contains(c)) {
        return Optional.of(new InvalidRegexException(
                "the label '" + label + "' on " + from + " -> " + to + " uses an invalid symbol '" + c + "'"));
      }
    }
    try {
      Regex.validate(label);
    } catch (RegexException ex) {
      return Optional.of(ex);
    }
    return Optional.empty();
  }

  /**
   * @throws UnsupportedOperationException always, as a GNFA only exists to be reduced to a regular expression
   */
  @Override
  public Iterator<Step<Void>> readInputStepwise(String input) {
    throw new UnsupportedOperationException("a GNFA cannot read input");
  }

  /**
   * @throws UnsupportedOperationException always; convert with {@link #toRegex()} and {@link NFA#fromRegex(String)}
   * to test membership
   */
  @Override
  public boolean acceptsInput(String input) {
    throw new UnsupportedOperationException("a GNFA cannot test membership, convert it to a regex or an NFA first");
  }

  @Override
  public GNFA<S> copy() {
    return new GNFA<>(settings, states, inputSymbols, transitions, initialState, finalState);
  }

  /// construction

  public static <S> GNFA<Integer> fromDFA(DFA<S> dfa) {
    return fromTransitions(dfa.settings(), dfa.inputSymbols(), dfa.states(), dfa.initialState(), dfa.finalStates(), dfa.iterTransitions());
  }

  public static <S> GNFA<Integer> fromNFA(NFA<S> nfa) {
    return fromTransitions(nfa.settings(), nfa.inputSymbols(), nfa.states(), nfa.initialState(), nfa.finalStates(), nfa.iterTransitions());
  }

  /**
   * Numbers the original states from 1, adding a new initial state 0 and a new final state after the last original
   * one, each connected by an empty-string edge. Parallel transitions are joined into a single label.
   */
  private static <S> GNFA<Integer> fromTransitions(
          AutomatonSettings settings,
          ISet<String> inputSymbols,
          ISet<S> states,
          S initial,
          ISet<S> finals,
          Iterable<Transition<S>> transitions) {
    AtomicInteger counter = new AtomicInteger();
    int init = counter.getAndIncrement();
    Function<S, Integer> name = Utils.renamer(counter);
    states.forEach(name::apply);
    int fin = counter.getAndIncrement();

    LinearMap<Integer, LinearMap<Integer, LinearSet<String>>> labels = new LinearMap<>();
    for (Transition<S> t : transitions) {
      int from = name.apply(t.from());
      LinearMap<Integer, LinearSet<String>> row = labels.get(from, null);
      if (row == null) {
        row = new LinearMap<>();
        labels.put(from, row);
      }
      LinearSet<String> symbols = row.get(name.apply(t.to()), null);
      if (symbols == null) {
        symbols = new LinearSet<>();
        row.put(name.apply(t.to()), symbols);
      }
      symbols.add(t.label());
    }

    Builder<Integer> builder = GNFA.<Integer>builder()
            .settings(settings)
            .inputSymbols(inputSymbols)
            .initialState(init)
            .finalState(fin)
            .state(init)
            .state(fin);

    for (int to = 1; to <= fin; to++) {
      builder.transition(init, to, to == name.apply(initial) ? NFA.EPSILON : null);
    }
    for (S s : states) {
      int from = name.apply(s);
      builder.state(from);
      LinearMap<Integer, LinearSet<String>> row = labels.get(from, null);
      for (int to = 1; to < fin; to++) {
        LinearSet<String> symbols = row == null ? null : row.get(to, null);
        builder.transition(from, to, symbols == null ? null : label(symbols));
      }
      builder.transition(from, fin, finals.contains(s) ? NFA.EPSILON : null);
    }
    return builder.build();
  }

  // symbols are joined by '|', and an epsilon among them makes the whole label optional
  private static String label(ISet<String> symbols) {
    List<String> sorted = new ArrayList<>();
    for (String s : Utils.sorted(symbols)) {
      if (!s.equals(NFA.EPSILON)) {
        sorted.add(s);
      }
    }
    String body = String.join("|", sorted);
    if (!symbols.contains(NFA.EPSILON)) {
      return body;
    }
    return body.isEmpty() ? "" : group(body) + "?";
  }

  /// state elimination

  /**
   * Repeatedly removes the interior state with the fewest edges, rerouting each path through it onto a direct edge,
   * until only the initial and final states remain.
   *
   * @return a regular expression for this automaton's language, or nothing if the language is empty
   */
  public Optional<String> toRegex() {
    LinearMap<S, LinearMap<S, Optional<String>>> edges = new LinearMap<>();
    for (S from : transitions.keys()) {
      IMap<S, Optional<String>> row = transitions.get(from, null);
      LinearMap<S, Optional<String>> r = new LinearMap<>();
      for (S to : row.keys()) {
        r.put(to, row.get(to, null));
      }
      edges.put(from, r);
    }

    List<S> remaining = new ArrayList<>();
    for (S s : states) {
      if (!s.equals(initialState) && !s.equals(finalState)) {
        remaining.add(s);
      }
    }

    while (!remaining.isEmpty()) {
      S q = remaining.get(0);
      int min = degree(edges, q);
      for (S s : remaining) {
        int d = degree(edges, s);
        if (d < min) {
          q = s;
          min = d;
        }
      }
      remaining.remove(q);

      Optional<String> loop = edge(edges, q, q);

      List<S> sources = new ArrayList<>(remaining);
      sources.add(initialState);
      List<S> targets = new ArrayList<>(remaining);
      targets.add(finalState);

      for (S p : sources) {
        Optional<String> in = edge(edges, p, q);
        if (!in.isPresent()) {
          continue;
        }
        for (S t : targets) {
          Optional<String> out = edge(edges, q, t);
          if (out.isPresent()) {
            edges.get(p, null).put(t, Optional.of(reroute(in.get(), loop, out.get(), edge(edges, p, t))));
          }
        }
      }

      edges.remove(q);
      for (S s : edges.keys()) {
        edges.get(s, null).remove(q);
      }
    }

    Optional<String> regex = edge(edges, initialState, finalState);
    logger.debug("reduced {} states to {}", states.size(), regex.orElse("nothing"));
    return regex;
  }

  private static <S> Optional<String> edge(LinearMap<S, LinearMap<S, Optional<String>>> edges, S from, S to) {
    LinearMap<S, Optional<String>> row = edges.get(from, null);
    return row == null ? Optional.empty() : row.get(to, Optional.empty());
  }

  // number of present edges into or out of q, ignoring loops
  private static <S> int degree(LinearMap<S, LinearMap<S, Optional<String>>> edges, S q) {
    int degree = 0;
    for (S s : edges.keys()) {
      if (s.equals(q)) {
        continue;
      }
      if (edge(edges, s, q).isPresent()) {
        degree++;
      }
      if (edge(edges, q, s).isPresent()) {
        degree++;
      }
    }
    return degree;
  }

  /**
   * @return the label for the path {@code in (loop)* out}, combined with the existing {@code direct} edge
   */
  static String reroute(String in, Optional<String> loop, String out, Optional<String> direct) {
    String path = concatOperand(in)
            + (loop.isPresent() && !loop.get().isEmpty() ? group(loop.get()) + "*" : "")
            + concatOperand(out);

    if (!direct.isPresent()) {
      return path;
    } else if (direct.get().isEmpty()) {
      return path.isEmpty() ? "" : group(path) + "?";
    } else if (path.isEmpty()) {
      return group(direct.get()) + "?";
    }
    return path + "|" + direct.get();
  }

  private static String concatOperand(String regex) {
    return hasTopLevelOperator(regex) ? "(" + regex + ")" : regex;
  }

  private static String group(String regex) {
    if (regex.codePointCount(0, regex.length()) == 1 || isWrapped(regex)) {
      return regex;
    }
    return "(" + regex + ")";
  }

  // true if the whole of the regex is a single parenthesized group
  private static boolean isWrapped(String regex) {
    if (!regex.startsWith("(") || !regex.endsWith(")")) {
      return false;
    }
    int depth = 0;
    for (int i = 0; i < regex.length(); i++) {
      char c = regex.charAt(i);
      if (c == '(') {
        depth++;
      } else if (c == ')') {
        depth--;
        if (depth == 0 && i < regex.length() - 1) {
          return false;
        }
      }
    }
    return true;
  }

  private static boolean hasTopLevelOperator(String regex) {
    int depth = 0;
    for (int i = 0; i < regex.length(); i++) {
      char c = regex.charAt(i);
      if (c == '(') {
        depth++;
      } else if (c == ')') {
        depth--;
      } else if (depth == 0 && (c == '|' || c == '&' || c == '^')) {
        return true;
      }
    }
    return false;
  }

  ///

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    } else if (obj instanceof GNFA) {
      GNFA<?> other = (GNFA<?>) obj;
      if (!Utils.sameElements(inputSymbols, other.inputSymbols)) {
        return false;
      }

      Optional<String> a = toRegex();
      Optional<String> b = other.toRegex();
      if (!a.isPresent() || !b.isPresent()) {
        return a.isPresent() == b.isPresent();
      }
      return Regex.isEqual(a.get(), b.get(), inputSymbols);
    }
    return false;
  }

  @Override
  public int hashCode() {
    return Utils.hash(inputSymbols);
  }

  @Override
  public String toString() {
    return "GNFA[states=" + states.size()
            + ", symbols=" + Utils.sorted(inputSymbols)
            + ", initial=" + initialState
            + ", final=" + finalState
            + "]";
  }
}
