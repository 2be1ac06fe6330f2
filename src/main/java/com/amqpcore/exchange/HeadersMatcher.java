package com.amqpcore.exchange;

import com.amqpcore.model.Arguments;

import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Header-table matching for headers exchanges.
 *
 * <p>The binding argument {@code x-match} selects {@code all} (the default) or {@code any}. Other
 * arguments starting with {@code x-} are not match criteria. A criterion with a null value only
 * requires the header to be present. Headers missing from the message never match.
 */
public final class HeadersMatcher {
    public static final String X_MATCH = "x-match";
    public static final String MATCH_ALL = "all";
    public static final String MATCH_ANY = "any";

    private HeadersMatcher() {
    }

    public static boolean matches(Map<String, Object> bindingArguments, Map<String, Object> headers) {
        boolean any = MATCH_ANY.equals(matchMode(bindingArguments));

        for (Map.Entry<String, Object> criterion : bindingArguments.entrySet()) {
            String key = criterion.getKey();
            if (key.startsWith("x-")) {
                continue;
            }
            boolean matched = headers != null && headers.containsKey(key)
                && (criterion.getValue() == null || Arguments.valuesEqual(criterion.getValue(), headers.get(key)));

            if (any && matched) {
                return true;
            }
            if (!any && !matched) {
                return false;
            }
        }
        // all: every criterion matched, vacuously so when there were none. any: nothing matched
        return !any;
    }

    public static String matchMode(Map<String, Object> bindingArguments) {
        Object mode = bindingArguments.get(X_MATCH);
        if (mode instanceof byte[]) {
            return new String((byte[]) mode, StandardCharsets.UTF_8);
        }
        return mode != null ? mode.toString() : MATCH_ALL;
    }
}
