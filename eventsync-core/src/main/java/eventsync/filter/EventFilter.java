package eventsync.filter;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Include/exclude predicate over event type names.
 *
 * <p>Policy, in order:
 * <ol>
 *   <li>if the include list is not the wildcard {@code "*"} and does not contain the type, reject</li>
 *   <li>if the exclude list contains the type, reject</li>
 *   <li>otherwise accept</li>
 * </ol>
 * Exclusion always wins: a type listed in both lists is rejected. Instances are immutable
 * and thread-safe.
 */
public final class EventFilter {
  public static final String WILDCARD = "*";

  private static final EventFilter ALLOW_ALL = new EventFilter(Set.of(WILDCARD), Set.of());

  private final Set<String> include;
  private final Set<String> exclude;

  private EventFilter(Set<String> include, Set<String> exclude) {
    this.include = include;
    this.exclude = exclude;
  }

  /**
   * Returns a filter that accepts every type.
   */
  public static EventFilter allowAll() {
    return ALLOW_ALL;
  }

  /**
   * Creates a filter from include and exclude collections. Blank entries are dropped and
   * entries are trimmed. An empty include collection means "all types".
   *
   * @param include types to include, or {@code "*"} for all
   * @param exclude types to exclude
   * @return the filter
   */
  public static EventFilter of(Collection<String> include, Collection<String> exclude) {
    Set<String> in = normalize(include);
    if (in.isEmpty()) {
      in = Set.of(WILDCARD);
    }
    return new EventFilter(in, normalize(exclude));
  }

  /**
   * Creates a filter from comma-separated configuration values, e.g.
   * {@code parse("user.created,order.placed", "post.deleted")}.
   *
   * @param includeCsv comma-separated include list; {@code null} or blank means {@code "*"}
   * @param excludeCsv comma-separated exclude list; {@code null} or blank means none
   * @return the filter
   */
  public static EventFilter parse(String includeCsv, String excludeCsv) {
    return of(splitCsv(includeCsv), splitCsv(excludeCsv));
  }

  /**
   * Applies the include/exclude policy to a single type.
   *
   * @param eventType   the type to test
   * @param includeList types to include; containing {@code "*"} means all
   * @param excludeList types to exclude
   * @return {@code true} if the type passes
   */
  public static boolean shouldInclude(String eventType, Set<String> includeList, Set<String> excludeList) {
    if (!includeList.contains(WILDCARD) && !includeList.contains(eventType)) {
      return false;
    }
    return !excludeList.contains(eventType);
  }

  /**
   * Tests a type against this filter's lists.
   */
  public boolean shouldInclude(String eventType) {
    return shouldInclude(eventType, include, exclude);
  }

  public Set<String> include() {
    return include;
  }

  public Set<String> exclude() {
    return exclude;
  }

  public boolean includesAll() {
    return include.contains(WILDCARD);
  }

  /**
   * Splits a comma-separated value into trimmed, non-blank entries, preserving order.
   */
  public static Set<String> splitCsv(String csv) {
    if (csv == null || csv.isBlank()) {
      return Collections.emptySet();
    }
    Set<String> result = new LinkedHashSet<>();
    for (String part : csv.split(",")) {
      String trimmed = part.trim();
      if (!trimmed.isEmpty()) {
        result.add(trimmed);
      }
    }
    return Collections.unmodifiableSet(result);
  }

  private static Set<String> normalize(Collection<String> values) {
    if (values == null || values.isEmpty()) {
      return Collections.emptySet();
    }
    Set<String> result = new LinkedHashSet<>();
    for (String value : values) {
      if (value != null && !value.isBlank()) {
        result.add(value.trim());
      }
    }
    return Collections.unmodifiableSet(result);
  }

  @Override
  public String toString() {
    return "EventFilter{include=" + include + ", exclude=" + exclude + '}';
  }
}
