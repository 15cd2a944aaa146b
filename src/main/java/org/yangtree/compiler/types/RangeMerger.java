package org.yangtree.compiler.types;

/**
 * Merges a use-site range (or length) restriction into the restriction of the type it refines.
 * <p>
 * {@code min} and {@code max} in the refining expression stand for the lowest and highest
 * bound of the refined expression:
 * <pre>
 *   merge("1..200", "min..100")  -> "1..100"
 *   merge("1..200", "100..max")  -> "100..200"
 *   merge(null, "5..10")         -> "5..10"
 * </pre>
 */
public final class RangeMerger {

    private RangeMerger() {
    }

    /**
     * @param parent the restriction of the refined type, or {@code null}.
     * @param child  the restriction written at the use site, or {@code null}.
     * @return the effective restriction, or {@code null} if neither is present.
     */
    public static String merge(String parent, String child) {
        if (parent == null) {
            return child;
        }
        if (child == null) {
            return parent;
        }
        String lowest = lowestBound(parent);
        String highest = highestBound(parent);
        StringBuilder merged = new StringBuilder();
        for (String part : child.split("\\|")) {
            if (merged.length() > 0) {
                merged.append('|');
            }
            String[] bounds = part.split("\\.\\.", -1);
            merged.append(substitute(bounds[0].trim(), lowest, highest));
            if (bounds.length > 1) {
                merged.append("..").append(substitute(bounds[1].trim(), lowest, highest));
            }
        }
        return merged.toString();
    }

    private static String substitute(String bound, String lowest, String highest) {
        return switch (bound) {
            case "min" -> lowest;
            case "max" -> highest;
            default -> bound;
        };
    }

    static String lowestBound(String expression) {
        String first = expression.split("\\|")[0];
        return first.split("\\.\\.", -1)[0].trim();
    }

    static String highestBound(String expression) {
        String[] parts = expression.split("\\|");
        String[] bounds = parts[parts.length - 1].split("\\.\\.", -1);
        return bounds[bounds.length - 1].trim();
    }
}
