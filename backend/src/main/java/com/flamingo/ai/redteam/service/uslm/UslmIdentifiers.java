package com.flamingo.ai.redteam.service.uslm;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parsing and formatting of USLM path identifiers such as {@code /us/usc/t42/s1983}.
 *
 * <p>All methods are total: malformed input yields partial or empty results, never an exception.
 */
public final class UslmIdentifiers {

  private static final Map<String, String> BILL_TYPE_LABELS =
      Map.of(
          "hr", "H.R.",
          "s", "S.",
          "hjres", "H.J.Res.",
          "sjres", "S.J.Res.",
          "hconres", "H.Con.Res.",
          "sconres", "S.Con.Res.",
          "hres", "H.Res.",
          "sres", "S.Res.");

  // Longest prefixes first so "sch" is not read as "s" + "ch".
  private static final List<String[]> USC_LEVEL_LABELS =
      List.of(
          new String[] {"subch", "subch."},
          new String[] {"sch", "subch."},
          new String[] {"subpt", "subpt."},
          new String[] {"spt", "subpt."},
          new String[] {"st", "subtit."},
          new String[] {"ch", "ch."},
          new String[] {"pt", "pt."});

  private UslmIdentifiers() {}

  /**
   * Splits {@code identifier} on {@code /}, drops empty segments and pairs consecutive segments as
   * key and value. A trailing unpaired segment is dropped.
   *
   * @param identifier USLM path, may be {@code null}
   * @return segment pairs in path order
   */
  public static Map<String, String> parseIdentifier(String identifier) {
    List<String> parts = segments(identifier);
    Map<String, String> result = new LinkedHashMap<>();
    for (int i = 0; i + 1 < parts.size(); i += 2) {
      result.put(parts.get(i), parts.get(i + 1));
    }
    return result;
  }

  /** Joins key/value pairs back into a path, in map iteration order. */
  public static String formatIdentifier(Map<String, String> segments) {
    StringBuilder sb = new StringBuilder();
    segments.forEach((key, value) -> sb.append('/').append(key).append('/').append(value));
    return sb.toString();
  }

  /**
   * Returns {@code identifier} without its final {@code /}-delimited segment, e.g. {@code
   * /us/usc/t42/s100} becomes {@code /us/usc/t42}. Returns the empty string when there is no
   * separator.
   */
  public static String basePath(String identifier) {
    if (identifier == null) {
      return "";
    }
    int idx = identifier.lastIndexOf('/');
    return idx < 0 ? "" : identifier.substring(0, idx);
  }

  /** Non-empty path segments in order. */
  public static List<String> segments(String identifier) {
    List<String> parts = new ArrayList<>();
    if (identifier == null) {
      return parts;
    }
    for (String part : identifier.split("/")) {
      if (!part.isEmpty()) {
        parts.add(part);
      }
    }
    return parts;
  }

  /**
   * Renders an identifier as a human-readable citation, e.g. {@code 42 U.S.C. § 1983}. Identifiers
   * that match no known pattern are returned unchanged.
   */
  public static String toCitation(String identifier) {
    if (identifier == null || identifier.isBlank()) {
      return "";
    }
    List<String> parts = segments(identifier);
    if (parts.size() >= 3 && "usc".equals(parts.get(1)) && parts.get(2).startsWith("t")) {
      return uscCitation(identifier, parts);
    }
    if (parts.size() >= 5 && "bill".equals(parts.get(1))) {
      String citation = billCitation(parts);
      if (citation != null) {
        return citation;
      }
    }
    return identifier;
  }

  // ---- private helpers ----

  private static String uscCitation(String identifier, List<String> parts) {
    String title = parts.get(2).substring(1);
    if (parts.size() == 3) {
      return "Title " + title + ", U.S.C.";
    }
    String section = null;
    String level = null;
    for (int i = 3; i < parts.size(); i++) {
      String part = parts.get(i);
      if (isSectionSegment(part)) {
        section = part.substring(1);
        break;
      }
      if (level == null) {
        level = levelLabel(part);
      }
    }
    if (section != null) {
      return title + " U.S.C. § " + section;
    }
    if (level != null) {
      return title + " U.S.C. " + level;
    }
    return identifier;
  }

  private static String billCitation(List<String> parts) {
    String label = BILL_TYPE_LABELS.get(parts.get(3));
    if (label == null) {
      return null;
    }
    String congress = parts.get(2);
    StringBuilder sb =
        new StringBuilder(label)
            .append(' ')
            .append(parts.get(4))
            .append(" (")
            .append(congress)
            .append(ordinalSuffix(congress))
            .append(" Congress)");
    if (parts.size() > 5 && isSectionSegment(parts.get(5))) {
      sb.append(" § ").append(parts.get(5).substring(1));
    }
    return sb.toString();
  }

  private static boolean isSectionSegment(String part) {
    return part.length() > 1 && part.charAt(0) == 's' && Character.isDigit(part.charAt(1));
  }

  private static String levelLabel(String part) {
    for (String[] label : USC_LEVEL_LABELS) {
      String prefix = label[0];
      if (part.startsWith(prefix) && part.length() > prefix.length()) {
        return label[1] + " " + part.substring(prefix.length());
      }
    }
    return null;
  }

  private static String ordinalSuffix(String number) {
    int value;
    try {
      value = Integer.parseInt(number);
    } catch (NumberFormatException e) {
      return "";
    }
    int lastTwo = value % 100;
    if (lastTwo >= 11 && lastTwo <= 13) {
      return "th";
    }
    switch (value % 10) {
      case 1:
        return "st";
      case 2:
        return "nd";
      case 3:
        return "rd";
      default:
        return "th";
    }
  }
}
