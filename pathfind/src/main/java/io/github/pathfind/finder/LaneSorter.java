package io.github.pathfind.finder;

import io.github.pathfind.lane.Lane;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import javax.inject.Inject;
import javax.inject.Singleton;

/**
 * Orders lanes by name, then by partition name. Run-style names ({@code <run>_<lane>#<tag>})
 * compare numerically, so 5477_6#2 comes before 5477_6#10. The sort is stable.
 */
@Singleton
public class LaneSorter {

  private static final Pattern RUN_LANE_TAG = Pattern.compile("^(\\d+)_(\\d+)(?:#(\\d+))?$");

  /**
   * Lane name ordering.
   */
  public static final Comparator<String> NAME_ORDER = LaneSorter::compareNames;

  /**
   * Lane ordering.
   */
  public static final Comparator<Lane> LANE_ORDER = Comparator
      .comparing(Lane::name, NAME_ORDER)
      .thenComparing(lane -> lane.partition().name());

  /**
   * Instantiates a new lane sorter.
   */
  @Inject
  public LaneSorter() {
    // injectable
  }

  /**
   * Sorted copy of the lanes. The input is not modified.
   *
   * @param lanes the lanes
   * @return the sorted lanes
   */
  public List<Lane> sort(final Collection<Lane> lanes) {
    final List<Lane> sorted = new ArrayList<>(lanes);
    sorted.sort(LANE_ORDER);
    return sorted;
  }

  private static int compareNames(final String a, final String b) {
    final Matcher ma = RUN_LANE_TAG.matcher(a);
    final Matcher mb = RUN_LANE_TAG.matcher(b);
    final boolean runA = ma.matches();
    final boolean runB = mb.matches();
    if (runA && runB) {
      int result = compareDigits(ma.group(1), mb.group(1));
      if (result == 0) {
        result = compareDigits(ma.group(2), mb.group(2));
      }
      if (result == 0) {
        result = compareTags(ma.group(3), mb.group(3));
      }
      // leading zeros
      return result != 0 ? result : a.compareTo(b);
    }
    if (runA != runB) {
      return runA ? -1 : 1;
    }
    return a.compareTo(b);
  }

  private static int compareTags(final String a, final String b) {
    if (a == null || b == null) {
      return a == null ? (b == null ? 0 : -1) : 1;
    }
    return compareDigits(a, b);
  }

  private static int compareDigits(final String a, final String b) {
    final String x = stripLeadingZeros(a);
    final String y = stripLeadingZeros(b);
    if (x.length() != y.length()) {
      return Integer.compare(x.length(), y.length());
    }
    return x.compareTo(y);
  }

  private static String stripLeadingZeros(final String digits) {
    int i = 0;
    while (i < digits.length() - 1 && digits.charAt(i) == '0') {
      i++;
    }
    return digits.substring(i);
  }
}
