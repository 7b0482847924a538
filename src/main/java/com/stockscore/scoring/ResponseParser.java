package com.stockscore.scoring;

import org.json.JSONException;
import org.json.JSONObject;
import org.json.JSONTokener;

import java.util.regex.Pattern;

/**
 * Pulls a single JSON object out of free-form model output.
 */
public final class ResponseParser {
    private static final Pattern THINK_BLOCK = Pattern.compile("(?is)<think>.*?</think>");
    private static final Pattern LEADING_FENCE = Pattern.compile("(?i)^```[a-z0-9_+-]*[ \\t]*\\r?\\n?");
    private static final Pattern TRAILING_FENCE = Pattern.compile("\\r?\\n?[ \\t]*```\\s*$");

    public JSONObject parse(String rawText) throws ResponseParseException {
        String text = stripFences(rawText);
        if (text.isEmpty()) {
            throw new ResponseParseException(ResponseParseException.Reason.NOT_FOUND, "empty response");
        }

        char first = text.charAt(0);
        if (first == '{' || first == '[') {
            Object whole = parseWhole(text);
            if (whole instanceof JSONObject) {
                return (JSONObject) whole;
            }
            if (whole != null) {
                throw new ResponseParseException(
                        ResponseParseException.Reason.NOT_AN_OBJECT,
                        "expected a JSON object but got " + whole.getClass().getSimpleName()
                );
            }
        }

        int from = text.indexOf('{');
        while (from >= 0) {
            int end = matchingBrace(text, from);
            if (end < 0) {
                from = text.indexOf('{', from + 1);
                continue;
            }
            try {
                return new JSONObject(text.substring(from, end + 1));
            } catch (JSONException ignored) {
                from = text.indexOf('{', from + 1);
            }
        }
        throw new ResponseParseException(ResponseParseException.Reason.NOT_FOUND, "no JSON object found in response");
    }

    static String stripFences(String rawText) {
        String text = rawText == null ? "" : rawText;
        text = THINK_BLOCK.matcher(text).replaceAll("").trim();
        text = LEADING_FENCE.matcher(text).replaceFirst("");
        text = TRAILING_FENCE.matcher(text).replaceFirst("");
        return text.trim();
    }

    // Returns null when the text is not exactly one JSON value.
    private static Object parseWhole(String text) {
        try {
            JSONTokener tokener = new JSONTokener(text);
            Object value = tokener.nextValue();
            if (tokener.nextClean() != 0) {
                return null;
            }
            return value;
        } catch (JSONException e) {
            return null;
        }
    }

    /**
     * Index of the brace closing the one at {@code open}, skipping braces inside
     * string literals; -1 when unbalanced.
     */
    static int matchingBrace(String text, int open) {
        int depth = 0;
        boolean inString = false;
        boolean escaped = false;
        for (int i = open; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (ch == '\\') {
                    escaped = true;
                } else if (ch == '"') {
                    inString = false;
                }
                continue;
            }
            if (ch == '"') {
                inString = true;
            } else if (ch == '{') {
                depth++;
            } else if (ch == '}') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }
}
