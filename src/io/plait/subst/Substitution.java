/*
 * Copyright 2018-present Facebook, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License"); you may
 * not use this file except in compliance with the License. You may obtain
 * a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS, WITHOUT
 * WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the
 * License for the specific language governing permissions and limitations
 * under the License.
 */

package io.plait.subst;

import com.google.common.base.CharMatcher;
import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import io.plait.util.Origin;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import javax.annotation.Nullable;

/**
 * Expands {@code $var}, {@code ${var}}, {@code $tool.var} and {@code ${func(args)}} references
 * against a {@link Namespace}.
 *
 * <p>{@code $$} yields a literal {@code $} and is never expanded further, which is how command
 * templates spell executor variables such as {@code $$out}. A {@code $} that does not start a
 * reference is kept as is.
 *
 * <p>Expansion is recursive: a variable's value is itself expanded before it is used. Undefined
 * variables and self-referencing chains are errors.
 *
 * <p>There are two modes:
 *
 * <ul>
 *   <li>{@link #expand} produces a string. Whitespace in the template is kept and sequence values
 *       are joined with single spaces.
 *   <li>{@link #expandToSequence} produces tokens. The template is split on whitespace outside
 *       {@code ${...}} spans; a token that is exactly one reference to a sequence becomes one
 *       token per element, and a token that is exactly one reference to a scalar holding further
 *       references is split and expanded again. A scalar without references stays a single token
 *       even if it contains spaces.
 * </ul>
 *
 * <p>Functions always produce sequences: {@code prefix(p, list)}, {@code suffix(list, s)}, {@code
 * wrap(p, list, s)}, {@code join(sep, list)} and {@code pairwise(flag, list)}.
 */
public final class Substitution {

  private static final char MARKER = '$';
  private static final Pattern NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_.]*");
  private static final Pattern FUNCTION = Pattern.compile("(\\w+)\\(([^)]*)\\)");
  private static final Pattern SIMPLE_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
  private static final Splitter ARG_SPLITTER = Splitter.on(',').trimResults();

  /** Utility class: do not instantiate. */
  private Substitution() {}

  public static String expand(String template, Namespace namespace) {
    return expand(template, namespace, null);
  }

  public static String expand(String template, Namespace namespace, @Nullable Origin origin) {
    return new Expansion(namespace, origin).scalar(template);
  }

  public static ImmutableList<String> expandToSequence(String template, Namespace namespace) {
    return expandToSequence(template, namespace, null);
  }

  public static ImmutableList<String> expandToSequence(
      String template, Namespace namespace, @Nullable Origin origin) {
    return expandToSequence(tokenize(template), namespace, origin);
  }

  /**
   * Splits {@code template} on whitespace outside of {@code ${...}} spans, so a function call with
   * spaces between its arguments stays one token.
   */
  public static ImmutableList<String> tokenize(String template) {
    ImmutableList.Builder<String> tokens = ImmutableList.builder();
    StringBuilder current = new StringBuilder();
    int depth = 0;
    int i = 0;
    while (i < template.length()) {
      char c = template.charAt(i);
      if (c == MARKER && i + 1 < template.length()) {
        char next = template.charAt(i + 1);
        if (next == MARKER || next == '{') {
          current.append(c).append(next);
          if (next == '{') {
            depth++;
          }
          i += 2;
          continue;
        }
      }
      if (depth > 0 && c == '}') {
        depth--;
      } else if (depth == 0 && CharMatcher.whitespace().matches(c)) {
        if (current.length() > 0) {
          tokens.add(current.toString());
          current.setLength(0);
        }
        i++;
        continue;
      }
      current.append(c);
      i++;
    }
    if (current.length() > 0) {
      tokens.add(current.toString());
    }
    return tokens.build();
  }

  /** Expands a template that is already split into tokens; tokens are not split again. */
  public static ImmutableList<String> expandToSequence(
      List<String> tokens, Namespace namespace, @Nullable Origin origin) {
    Expansion expansion = new Expansion(namespace, origin);
    ImmutableList.Builder<String> result = ImmutableList.builder();
    for (String token : tokens) {
      result.addAll(expansion.token(token));
    }
    return result.build();
  }

  /** @return whether {@code text} contains anything that expansion would change. */
  public static boolean hasReferences(String text) {
    return text.indexOf(MARKER) >= 0;
  }

  /** One reference found in a template: a variable or a function call. */
  private static final class Reference {
    private final int start;
    private final int end;
    @Nullable private final String variable;
    @Nullable private final String function;
    @Nullable private final String arguments;

    private Reference(
        int start,
        int end,
        @Nullable String variable,
        @Nullable String function,
        @Nullable String arguments) {
      this.start = start;
      this.end = end;
      this.variable = variable;
      this.function = function;
      this.arguments = arguments;
    }

    boolean spans(String text) {
      return start == 0 && end == text.length();
    }
  }

  /** The state of one top-level expansion: the variables currently being expanded. */
  private static final class Expansion {
    private final Namespace namespace;
    @Nullable private final Origin origin;
    private final LinkedHashSet<String> inProgress = new LinkedHashSet<>();

    private Expansion(Namespace namespace, @Nullable Origin origin) {
      this.namespace = namespace;
      this.origin = origin;
    }

    String scalar(String text) {
      if (!hasReferences(text)) {
        return text;
      }
      StringBuilder out = new StringBuilder(text.length());
      int i = 0;
      while (i < text.length()) {
        char c = text.charAt(i);
        if (c != MARKER) {
          out.append(c);
          i++;
          continue;
        }
        if (i + 1 < text.length() && text.charAt(i + 1) == MARKER) {
          out.append(MARKER);
          i += 2;
          continue;
        }
        Reference ref = parseReference(text, i);
        if (ref == null) {
          out.append(c);
          i++;
          continue;
        }
        out.append(Joiner.on(' ').join(referenceAsScalarParts(ref)));
        i = ref.end;
      }
      return out.toString();
    }

    List<String> token(String token) {
      if (!hasReferences(token)) {
        return ImmutableList.of(token);
      }
      Reference whole = token.charAt(0) == MARKER ? parseReference(token, 0) : null;
      if (whole == null || !whole.spans(token)) {
        String expanded = scalar(token);
        return expanded.isEmpty() ? ImmutableList.of() : ImmutableList.of(expanded);
      }
      if (whole.function != null) {
        return callFunction(whole.function, whole.arguments);
      }
      String name = whole.variable;
      Value value = lookup(name);
      List<String> result = new ArrayList<>();
      inProgress.add(name);
      if (value.isList()) {
        for (String element : value.asList()) {
          result.addAll(token(element));
        }
      } else {
        String scalar = value.asScalar();
        if (hasReferences(scalar)) {
          for (String part : tokenize(scalar)) {
            result.addAll(token(part));
          }
        } else if (!scalar.isEmpty()) {
          result.add(scalar);
        }
      }
      inProgress.remove(name);
      return result;
    }

    private List<String> referenceAsScalarParts(Reference ref) {
      if (ref.function != null) {
        return callFunction(ref.function, ref.arguments);
      }
      return ImmutableList.of(variableAsScalar(ref.variable));
    }

    private String variableAsScalar(String name) {
      Value value = lookup(name);
      inProgress.add(name);
      String result;
      if (value.isList()) {
        List<String> parts = new ArrayList<>();
        for (String element : value.asList()) {
          parts.add(scalar(element));
        }
        result = Joiner.on(' ').join(parts);
      } else {
        result = scalar(value.asScalar());
      }
      inProgress.remove(name);
      return result;
    }

    /** Resolves a variable and expands each element, keeping the value's shape. */
    private List<String> variableAsList(String name) {
      Value value = lookup(name);
      inProgress.add(name);
      List<String> result = new ArrayList<>();
      for (String element : value.asList()) {
        result.add(scalar(element));
      }
      inProgress.remove(name);
      return result;
    }

    private Value lookup(String name) {
      if (inProgress.contains(name)) {
        List<String> chain = new ArrayList<>();
        boolean inCycle = false;
        for (String entry : inProgress) {
          inCycle |= entry.equals(name);
          if (inCycle) {
            chain.add(entry);
          }
        }
        chain.add(name);
        throw new CircularReferenceException(chain, origin);
      }
      Optional<Value> value = namespace.lookup(name);
      if (!value.isPresent()) {
        throw new MissingVariableException(name, origin);
      }
      return value.get();
    }

    @Nullable
    private Reference parseReference(String text, int start) {
      int i = start + 1;
      if (i >= text.length()) {
        return null;
      }
      if (text.charAt(i) == '{') {
        int close = matchingBrace(text, i);
        if (close < 0) {
          throw new SubstitutionException(origin, "unterminated ${ in: " + text);
        }
        String body = text.substring(i + 1, close).trim();
        Matcher function = FUNCTION.matcher(body);
        if (function.matches()) {
          return new Reference(start, close + 1, null, function.group(1), function.group(2));
        }
        if (!NAME.matcher(body).matches()) {
          throw new SubstitutionException(
              origin, String.format("invalid reference ${%s} in: %s", body, text));
        }
        return new Reference(start, close + 1, body, null, null);
      }
      Matcher name = NAME.matcher(text);
      name.region(i, text.length());
      if (!name.lookingAt()) {
        return null;
      }
      int end = name.end();
      // A trailing dot ends the sentence, not the name.
      while (text.charAt(end - 1) == '.') {
        end--;
      }
      return new Reference(start, end, text.substring(i, end), null, null);
    }

    private int matchingBrace(String text, int open) {
      int depth = 0;
      for (int i = open; i < text.length(); i++) {
        char c = text.charAt(i);
        if (c == '{') {
          depth++;
        } else if (c == '}' && --depth == 0) {
          return i;
        }
      }
      return -1;
    }

    private List<String> callFunction(String function, String argumentText) {
      List<String> args = new ArrayList<>();
      for (String arg : ARG_SPLITTER.split(argumentText)) {
        if (!arg.isEmpty()) {
          args.add(arg);
        }
      }
      switch (function) {
        case "prefix":
          checkArity(function, args, 2);
          return wrapEach(argumentAsScalar(args.get(0)), argumentAsList(args.get(1)), "");
        case "suffix":
          checkArity(function, args, 2);
          return wrapEach("", argumentAsList(args.get(0)), argumentAsScalar(args.get(1)));
        case "wrap":
          checkArity(function, args, 3);
          return wrapEach(
              argumentAsScalar(args.get(0)),
              argumentAsList(args.get(1)),
              argumentAsScalar(args.get(2)));
        case "join":
          checkArity(function, args, 2);
          return ImmutableList.of(
              Joiner.on(argumentAsScalar(args.get(0))).join(argumentAsList(args.get(1))));
        case "pairwise":
          checkArity(function, args, 2);
          String flag = argumentAsScalar(args.get(0));
          List<String> pairs = new ArrayList<>();
          for (String item : argumentAsList(args.get(1))) {
            pairs.add(flag);
            pairs.add(item);
          }
          return pairs;
        default:
          throw new SubstitutionException(origin, "unknown function: " + function);
      }
    }

    private List<String> wrapEach(String prefix, List<String> items, String suffix) {
      List<String> result = new ArrayList<>(items.size());
      for (String item : items) {
        result.add(prefix + item + suffix);
      }
      return result;
    }

    private void checkArity(String function, List<String> args, int expected) {
      if (args.size() != expected) {
        throw new SubstitutionException(
            origin,
            String.format(
                "%s() requires %d arguments, got %d", function, expected, args.size()));
      }
    }

    private String argumentAsScalar(String arg) {
      Optional<String> variable = argumentVariable(arg);
      return variable.isPresent() ? variableAsScalar(variable.get()) : arg;
    }

    private List<String> argumentAsList(String arg) {
      Optional<String> variable = argumentVariable(arg);
      return variable.isPresent() ? variableAsList(variable.get()) : ImmutableList.of(arg);
    }

    /**
     * Function arguments are variable references ({@code $x}, {@code ${x}}, or a bare dotted name
     * like {@code cc.includes}), bare names that happen to be defined, or literals.
     */
    private Optional<String> argumentVariable(String arg) {
      if (arg.startsWith("${") && arg.endsWith("}")) {
        return Optional.of(arg.substring(2, arg.length() - 1).trim());
      }
      if (arg.length() > 1 && arg.charAt(0) == MARKER && arg.charAt(1) != MARKER) {
        return Optional.of(arg.substring(1));
      }
      if (NAME.matcher(arg).matches() && arg.indexOf('.') > 0) {
        return Optional.of(arg);
      }
      if (SIMPLE_NAME.matcher(arg).matches() && namespace.lookup(arg).isPresent()) {
        return Optional.of(arg);
      }
      return Optional.empty();
    }
  }
}
