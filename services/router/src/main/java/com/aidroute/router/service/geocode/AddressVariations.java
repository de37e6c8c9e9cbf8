// =============================================================================
// AidRoute - Address Variations
// =============================================================================
package com.aidroute.router.service.geocode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rewrites of a free-text address to retry with when the verbatim text finds
 * nothing. Abbreviation rewrites touch only the street line (text before the
 * first comma) so state codes such as {@code CT} or {@code NE} survive.
 */
public final class AddressVariations {

    private static final Map<Pattern, String> STREET_TYPES = new LinkedHashMap<>();
    private static final Map<Pattern, String> DIRECTIONS = new LinkedHashMap<>();

    static {
        streetType("St", "Street");
        streetType("Ave", "Avenue");
        streetType("Blvd", "Boulevard");
        streetType("Dr", "Drive");
        streetType("Ln", "Lane");
        streetType("Rd", "Road");
        streetType("Ct", "Court");
        streetType("Pl", "Place");
        streetType("Pkwy", "Parkway");
        streetType("Hwy", "Highway");
        streetType("Cir", "Circle");
        streetType("Trl", "Trail");
        streetType("Ter", "Terrace");

        // Two-letter forms first so "NE" is not read as "N" + "E"
        direction("NE", "Northeast");
        direction("NW", "Northwest");
        direction("SE", "Southeast");
        direction("SW", "Southwest");
        direction("N", "North");
        direction("S", "South");
        direction("E", "East");
        direction("W", "West");
    }

    private static final String STREET_TYPE_WORDS =
            "St|Street|Ave|Avenue|Blvd|Boulevard|Dr|Drive|Ln|Lane|Rd|Road|Ct|Court|Pl|Place"
                    + "|Pkwy|Parkway|Hwy|Highway|Cir|Circle|Trl|Trail|Ter|Terrace|Way";

    private static final Pattern UNIT_QUALIFIER = Pattern.compile(
            ",?\\s*(?:\\b(?:Suite|Ste|Unit|Apt|Apartment)\\b\\.?|#)\\s*[\\w-]+",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern TRAILING_UNIT_NUMBER = Pattern.compile(
            "^(.*\\b(?:" + STREET_TYPE_WORDS + ")\\.?)\\s+#?\\d+[A-Za-z]?$",
            Pattern.CASE_INSENSITIVE);

    // Trailing position only, so five-digit house numbers are kept
    private static final Pattern ZIP_CODE = Pattern.compile(
            "\\b\\d{5}(?:-\\d{4})?(?=\\s*(?:,\\s*(?:USA|US|United States)\\s*)?$)",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern COUNTRY_SUFFIX = Pattern.compile(
            ",\\s*(?:USA|US|United States(?: of America)?)\\s*$", Pattern.CASE_INSENSITIVE);

    private AddressVariations() {
    }

    /**
     * Variations in retry priority order, starting with the cleaned-up
     * verbatim address. Duplicates and blanks are dropped.
     *
     * @param address       raw address text
     * @param maxVariations upper bound on the number returned, at least 1
     */
    public static List<String> of(String address, int maxVariations) {
        String verbatim = tidy(address);
        if (verbatim.isEmpty()) {
            return List.of();
        }

        String withoutUnit = withoutUnitQualifier(verbatim);

        Set<String> variations = new LinkedHashSet<>();
        variations.add(verbatim);
        variations.add(withoutUnit);
        variations.add(expandAbbreviations(verbatim));
        variations.add(expandAbbreviations(withoutUnit));
        variations.add(withoutTrailingUnitNumber(withoutUnit));
        variations.add(withoutZip(withoutUnit));
        if (!COUNTRY_SUFFIX.matcher(withoutUnit).find()) {
            variations.add(withoutUnit + ", USA");
        }
        variations.remove("");

        List<String> ordered = new ArrayList<>(variations);
        return List.copyOf(ordered.subList(0, Math.min(Math.max(1, maxVariations), ordered.size())));
    }

    static String withoutUnitQualifier(String address) {
        return tidy(UNIT_QUALIFIER.matcher(address).replaceAll(""));
    }

    static String expandAbbreviations(String address) {
        String[] parts = splitStreetLine(address);
        String street = parts[0];
        for (Map.Entry<Pattern, String> entry : STREET_TYPES.entrySet()) {
            street = entry.getKey().matcher(street).replaceAll(entry.getValue());
        }
        for (Map.Entry<Pattern, String> entry : DIRECTIONS.entrySet()) {
            street = entry.getKey().matcher(street).replaceAll(entry.getValue());
        }
        return tidy(street + parts[1]);
    }

    static String withoutTrailingUnitNumber(String address) {
        String[] parts = splitStreetLine(address);
        Matcher matcher = TRAILING_UNIT_NUMBER.matcher(parts[0].trim());
        if (!matcher.matches()) {
            return address;
        }
        return tidy(matcher.group(1) + parts[1]);
    }

    static String withoutZip(String address) {
        return tidy(ZIP_CODE.matcher(address).replaceAll(""));
    }

    /**
     * Collapses whitespace and repairs commas left behind by removals.
     */
    static String tidy(String address) {
        if (address == null) {
            return "";
        }
        String text = address.trim().replaceAll("\\s+", " ");
        text = text.replaceAll("\\s*,\\s*", ", ");
        text = text.replaceAll("(?:,\\s*)+,", ",");
        text = text.replaceAll("^[,\\s]+|[,\\s]+$", "");
        return text;
    }

    private static String[] splitStreetLine(String address) {
        int comma = address.indexOf(',');
        if (comma < 0) {
            return new String[]{address, ""};
        }
        return new String[]{address.substring(0, comma), address.substring(comma)};
    }

    private static void streetType(String abbreviation, String expansion) {
        STREET_TYPES.put(Pattern.compile("\\b" + abbreviation + "\\b\\.?", Pattern.CASE_INSENSITIVE), expansion);
    }

    private static void direction(String abbreviation, String expansion) {
        // Only when another word follows, i.e. a prefix direction like "N Main"
        DIRECTIONS.put(Pattern.compile("\\b" + abbreviation + "\\b\\.?(?=\\s+[A-Za-z0-9])"), expansion);
    }
}
