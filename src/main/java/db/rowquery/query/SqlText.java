package db.rowquery.query;

import java.util.ArrayList;
import java.util.List;

/**
 * Character-scanning helpers shared by the clause parsers. All of them track single and
 * double quoted literals (a doubled quote inside a literal is an escaped quote) and, where
 * relevant, parenthesis depth.
 */
final class SqlText {
    /** Position of a keyword occurrence: start inclusive, end exclusive. */
    record Match(int start, int end) {}

    private SqlText() {}

    /**
     * Splits on a separator that is outside quotes and parentheses. Items are trimmed and
     * empty items are kept so callers can reject them.
     */
    static List<String> splitTopLevel(String text, char separator, String clause) {
        List<String> out = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        int depth = 0;
        char quote = 0;
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (quote != 0) {
                current.append(ch);
                if (ch == quote) {
                    if (i + 1 < text.length() && text.charAt(i + 1) == quote) {
                        current.append(quote);
                        i++;
                    } else {
                        quote = 0;
                    }
                }
            } else if (ch == '\'' || ch == '"') {
                quote = ch;
                current.append(ch);
            } else if (ch == '(') {
                depth++;
                current.append(ch);
            } else if (ch == ')') {
                depth--;
                if (depth < 0) throw new QuerySyntaxException("Mismatched parentheses in " + clause);
                current.append(ch);
            } else if (ch == separator && depth == 0) {
                out.add(current.toString().trim());
                current.setLength(0);
            } else {
                current.append(ch);
            }
        }
        if (quote != 0) throw new QuerySyntaxException("Unclosed quote in " + clause);
        if (depth != 0) throw new QuerySyntaxException("Mismatched parentheses in " + clause);
        out.add(current.toString().trim());
        return out;
    }

    /**
     * Finds the first top-level occurrence of a keyword at or after {@code from}.
     * Words of a multi-word keyword ("GROUP BY") may be separated by any whitespace; the
     * occurrence must be bounded by whitespace or the ends of the text. Returns null when absent.
     */
    static Match findKeyword(String text, String keyword, int from) {
        String[] words = keyword.split(" ");
        int depth = 0;
        char quote = 0;
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (quote != 0) {
                if (ch == quote) {
                    if (i + 1 < text.length() && text.charAt(i + 1) == quote) i++;
                    else quote = 0;
                }
                continue;
            }
            if (ch == '\'' || ch == '"') { quote = ch; continue; }
            if (ch == '(') { depth++; continue; }
            if (ch == ')') { depth--; continue; }
            if (i < from || depth != 0) continue;
            if (i > 0 && !Character.isWhitespace(text.charAt(i - 1))) continue;
            int end = matchWords(text, i, words);
            if (end >= 0) return new Match(i, end);
        }
        return null;
    }

    private static int matchWords(String text, int pos, String[] words) {
        int p = pos;
        for (int w = 0; w < words.length; w++) {
            if (w > 0) {
                int ws = p;
                while (p < text.length() && Character.isWhitespace(text.charAt(p))) p++;
                if (p == ws) return -1;
            }
            String word = words[w];
            if (!text.regionMatches(true, p, word, 0, word.length())) return -1;
            p += word.length();
        }
        if (p < text.length() && !Character.isWhitespace(text.charAt(p))) return -1;
        return p;
    }

    static boolean balancedParentheses(String text) {
        int depth = 0;
        char quote = 0;
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (quote != 0) {
                if (ch == quote) quote = 0;
            } else if (ch == '\'' || ch == '"') {
                quote = ch;
            } else if (ch == '(') {
                depth++;
            } else if (ch == ')') {
                depth--;
                if (depth < 0) return false;
            }
        }
        return depth == 0;
    }

    // A quote of the other kind inside a literal is plain text
    static boolean balancedQuotes(String text) {
        char quote = 0;
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (quote != 0) {
                if (ch == quote) {
                    if (i + 1 < text.length() && text.charAt(i + 1) == quote) i++;
                    else quote = 0;
                }
            } else if (ch == '\'' || ch == '"') {
                quote = ch;
            }
        }
        return quote == 0;
    }

    static boolean isQuoted(String s) {
        return s.length() >= 2
            && (s.charAt(0) == '\'' || s.charAt(0) == '"')
            && s.charAt(s.length() - 1) == s.charAt(0);
    }
}
