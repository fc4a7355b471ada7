package io.judgebridge.security;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.judgebridge.util.Jsons;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

public final class SensitiveDataMasker {
    private static final String MASK = "***";
    private static final String WITHHELD = "<withheld: possible credential>";
    private static final Pattern KEY_SEPARATORS = Pattern.compile("[-_.]");
    private static final Set<String> CREDENTIAL_WORDS = Set.of(
            "key", "password", "passwd", "secret", "token", "authorization", "apikey", "credential"
    );

    private SensitiveDataMasker() {
    }

    // Returns a copy; the input is left untouched.
    public static JsonNode masked(JsonNode input) {
        if (input == null) {
            return Jsons.mapper().nullNode();
        }
        JsonNode copy = input.deepCopy();
        redactInPlace(copy);
        return copy;
    }

    public static String maskedPacket(String raw) {
        if (raw == null) {
            return "";
        }
        JsonNode node;
        try {
            node = Jsons.readTree(raw);
        } catch (IOException e) {
            node = null;
        }
        if (node != null && node.isContainerNode()) {
            return Jsons.toCompactJson(masked(node));
        }
        return raw.contains("\"key\"") ? WITHHELD : raw;
    }

    // "key", "auth_token" and "api-key" name credentials; "monkey" and "keyboard" do not.
    static boolean namesCredential(String field) {
        if (field == null || field.isBlank()) {
            return false;
        }
        String lower = field.toLowerCase(Locale.ROOT);
        if (CREDENTIAL_WORDS.contains(KEY_SEPARATORS.matcher(lower).replaceAll(""))) {
            return true;
        }
        for (String part : KEY_SEPARATORS.split(lower)) {
            if (CREDENTIAL_WORDS.contains(part)) {
                return true;
            }
        }
        return false;
    }

    private static void redactInPlace(JsonNode node) {
        if (node.isArray()) {
            for (JsonNode element : node) {
                redactInPlace(element);
            }
            return;
        }
        if (!node.isObject()) {
            return;
        }
        ObjectNode object = (ObjectNode) node;
        List<String> fields = new ArrayList<>();
        object.fieldNames().forEachRemaining(fields::add);
        for (String field : fields) {
            if (namesCredential(field)) {
                object.put(field, MASK);
            } else {
                redactInPlace(object.get(field));
            }
        }
    }
}
