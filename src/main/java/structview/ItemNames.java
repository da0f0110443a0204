package structview;

import java.util.Locale;

/**
 * Guesses a singular item type name from a plural collection label
 * ("users" → "User", "categories" → "Category"). Best-effort only; irregular plurals are not handled.
 */
public final class ItemNames {

    private ItemNames() {}

    public static String singularize(String plural) {
        if (plural == null || plural.isEmpty()) {
            return "Item";
        }

        String result = Character.toUpperCase(plural.charAt(0)) + plural.substring(1);
        String lower = result.toLowerCase(Locale.ROOT);
        int len = result.length();

        if (lower.endsWith("ies") && len > 3) {
            return result.substring(0, len - 3) + "y";
        }
        if (lower.endsWith("ses") || lower.endsWith("xes") || lower.endsWith("zes")
                || lower.endsWith("ches") || lower.endsWith("shes")) {
            return result.substring(0, len - 2);
        }
        if (lower.endsWith("ves") && len > 3) {
            return result.substring(0, len - 3) + "f";
        }
        if (lower.endsWith("s") && !lower.endsWith("ss") && !lower.endsWith("us") && !lower.endsWith("is")) {
            return result.substring(0, len - 1);
        }
        return result;
    }
}
