package db.rowquery.exec;

import java.util.regex.Pattern;

/**
 * SQL LIKE pattern compiled to a case-insensitive regex: '%' matches any run of characters,
 * '_' exactly one. The match is a search anywhere in the text, not a full match.
 */
public final class LikePattern {
    private final String source;
    private final Pattern regex;

    private LikePattern(String source, Pattern regex) {
        this.source = source;
        this.regex = regex;
    }

    public static LikePattern compile(String sqlPattern) {
        StringBuilder sb = new StringBuilder();
        StringBuilder literal = new StringBuilder();
        for (int i = 0; i < sqlPattern.length(); i++) {
            char ch = sqlPattern.charAt(i);
            if (ch == '%' || ch == '_') {
                if (literal.length() > 0) {
                    sb.append(Pattern.quote(literal.toString()));
                    literal.setLength(0);
                }
                sb.append(ch == '%' ? ".*" : ".");
            } else {
                literal.append(ch);
            }
        }
        if (literal.length() > 0) sb.append(Pattern.quote(literal.toString()));
        Pattern p = Pattern.compile(sb.toString(), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.DOTALL);
        return new LikePattern(sqlPattern, p);
    }

    public boolean matches(String text) {
        return regex.matcher(text).find();
    }

    @Override
    public String toString() { return "LIKE '" + source + "'"; }
}
