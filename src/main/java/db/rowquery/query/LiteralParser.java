package db.rowquery.query;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import db.rowquery.exec.Coercions;
import db.rowquery.value.Value;

/**
 * Parses WHERE literals.
 * NULL, TRUE/FALSE (any case), single- or double-quoted strings, numbers; anything else is kept
 * as a bare string token.
 */
public final class LiteralParser {
    private LiteralParser() {}

    public static Value parse(String raw) {
        String s = raw.trim();
        if (s.isEmpty()) return Value.ofString("");
        String upper = s.toUpperCase(Locale.ROOT);
        if (upper.equals("NULL")) return Value.NULL;
        if (upper.equals("TRUE")) return Value.TRUE;
        if (upper.equals("FALSE")) return Value.FALSE;
        if (SqlText.isQuoted(s)) return Value.ofString(unescape(s.substring(1, s.length() - 1)));
        return Coercions.parseNumber(s).orElse(Value.ofString(s));
    }

    /** Comma-separated IN list body (without the parentheses); empty items are skipped. */
    public static List<Value> parseList(String body) {
        List<Value> out = new ArrayList<>();
        if (body.isBlank()) return out;
        for (String item : SqlText.splitTopLevel(body, ',', "IN list")) {
            if (!item.isEmpty()) out.add(parse(item));
        }
        return out;
    }

    /**
     * Resolves doubled quotes ('' and "") and the backslash escapes \n, \t, \r and \\.
     * An unknown backslash sequence is kept verbatim.
     */
    static String unescape(String s) {
        StringBuilder sb = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); i++) {
            char ch = s.charAt(i);
            char next = i + 1 < s.length() ? s.charAt(i + 1) : 0;
            if ((ch == '\'' || ch == '"') && next == ch) {
                sb.append(ch);
                i++;
            } else if (ch == '\\' && next != 0) {
                switch (next) {
                    case 'n' -> sb.append('\n');
                    case 't' -> sb.append('\t');
                    case 'r' -> sb.append('\r');
                    case '\\' -> sb.append('\\');
                    default -> sb.append(ch).append(next);
                }
                i++;
            } else {
                sb.append(ch);
            }
        }
        return sb.toString();
    }
}
