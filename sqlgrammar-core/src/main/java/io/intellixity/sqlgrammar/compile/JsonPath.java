package io.intellixity.sqlgrammar.compile;

import io.intellixity.sqlgrammar.plan.MalformedPlanException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A JSON selector such as {@code meta->tags[0]->name}, split into its base column and the
 * ordered keys / array indexes below it.
 */
public record JsonPath(String column, List<Segment> segments) {
  public static final String ARROW = "->";

  private static final Pattern INDEX = Pattern.compile("-?\\d+");
  private static final Pattern TRAILING_INDEXES = Pattern.compile("(\\[-?\\d+])+$");
  private static final Pattern BRACKET = Pattern.compile("\\[(-?\\d+)]");

  public JsonPath {
    Objects.requireNonNull(column, "column");
    segments = List.copyOf(segments == null ? List.of() : segments);
  }

  public sealed interface Segment {
    record Key(String name) implements Segment {
      public Key {
        Objects.requireNonNull(name, "name");
      }
    }

    record Index(int position) implements Segment {}
  }

  public static boolean isSelector(String value) {
    return value != null && value.contains(ARROW);
  }

  public static JsonPath parse(String selector) {
    Objects.requireNonNull(selector, "selector");
    String[] parts = selector.split(ARROW, -1);
    String column = parts[0].trim();
    if (column.isEmpty()) throw new MalformedPlanException("JSON selector has no column: '" + selector + "'");
    List<Segment> segments = new ArrayList<>();
    for (int i = 1; i < parts.length; i++) {
      segments.addAll(parseSegment(parts[i], selector));
    }
    return new JsonPath(column, segments);
  }

  private static List<Segment> parseSegment(String raw, String selector) {
    if (raw.isEmpty()) throw new MalformedPlanException("Empty JSON path segment in '" + selector + "'");
    if (INDEX.matcher(raw).matches()) return List.of(new Segment.Index(Integer.parseInt(raw)));

    Matcher trailing = TRAILING_INDEXES.matcher(raw);
    if (!trailing.find()) return List.of(new Segment.Key(raw));

    List<Segment> out = new ArrayList<>();
    String key = raw.substring(0, trailing.start());
    if (!key.isEmpty()) out.add(new Segment.Key(key));
    Matcher idx = BRACKET.matcher(trailing.group());
    while (idx.find()) out.add(new Segment.Index(Integer.parseInt(idx.group(1))));
    return out;
  }

  public boolean hasSegments() {
    return !segments.isEmpty();
  }

  public Segment last() {
    if (segments.isEmpty()) throw new MalformedPlanException("JSON selector has no path: '" + column + "'");
    return segments.get(segments.size() - 1);
  }

  /** This path without its last segment. */
  public JsonPath parent() {
    if (segments.isEmpty()) throw new MalformedPlanException("JSON selector has no path: '" + column + "'");
    return new JsonPath(column, segments.subList(0, segments.size() - 1));
  }

  /** Arrow form of this path, parseable by {@link #parse(String)}. */
  public String selector() {
    StringBuilder sb = new StringBuilder(column);
    for (Segment s : segments) {
      sb.append(ARROW);
      if (s instanceof Segment.Key k) sb.append(k.name());
      else sb.append(((Segment.Index) s).position());
    }
    return sb.toString();
  }
}
