package com.mimecast.mailbuilder.textproto;

/**
 * Header field name canonicalization.
 *
 * <p>The canonical form upper-cases the first letter and any letter following a hyphen,
 * <br>the rest are lower-cased. For example {@code content-transfer-encoding} becomes {@code Content-Transfer-Encoding}.
 * <br>Names containing a space or any other byte that is not a valid RFC 7230 token character are returned unmodified.
 */
public class HeaderKeys {

    /**
     * RFC 7230 tchar lookup table.
     */
    private static final boolean[] TOKEN = new boolean[127];

    static {
        for (char c = '0'; c <= '9'; c++) {
            TOKEN[c] = true;
        }
        for (char c = 'a'; c <= 'z'; c++) {
            TOKEN[c] = true;
            TOKEN[c - 'a' + 'A'] = true;
        }
        for (char c : "!#$%&'*+-.^_`|~".toCharArray()) {
            TOKEN[c] = true;
        }
    }

    /**
     * Private constructor.
     */
    private HeaderKeys() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Checks if character is a valid header field name character.
     *
     * @param c Character.
     * @return Boolean.
     */
    public static boolean isToken(int c) {
        return c >= 0 && c < TOKEN.length && TOKEN[c];
    }

    /**
     * Gets canonical header name.
     *
     * @param name Header name.
     * @return Canonical name, or the input itself when already canonical or not a valid token.
     */
    public static String canonical(String name) {
        if (name == null) {
            return "";
        }

        boolean canonical = true;
        boolean upper = true;
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (!isToken(c)) {
                return name;
            }
            if ((upper && c >= 'a' && c <= 'z') || (!upper && c >= 'A' && c <= 'Z')) {
                canonical = false;
            }
            upper = c == '-';
        }

        if (canonical) {
            return name;
        }

        char[] chars = name.toCharArray();
        upper = true;
        for (int i = 0; i < chars.length; i++) {
            char c = chars[i];
            if (upper && c >= 'a' && c <= 'z') {
                c = (char) (c - ('a' - 'A'));
            } else if (!upper && c >= 'A' && c <= 'Z') {
                c = (char) (c + ('a' - 'A'));
            }
            chars[i] = c;
            upper = c == '-';
        }

        return new String(chars);
    }
}
