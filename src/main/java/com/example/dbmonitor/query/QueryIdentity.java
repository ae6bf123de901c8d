package com.example.dbmonitor.query;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.regex.Pattern;

/**
 * Identity of a query within a target: SHA-256 of the whitespace-normalized text.
 *
 * Both the collection engine and the alert engine resolve statistics rows through
 * this type, as does the alert opt-in path, so an operator-entered query that only
 * differs in spacing or line breaks still matches what the extension reports.
 * Literals are not normalized beyond what pg_stat_statements already does.
 */
public final class QueryIdentity {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern TRAILING_SEMICOLONS = Pattern.compile(";+$");

    private final String normalizedText;
    private final String hash;

    private QueryIdentity(String normalizedText, String hash) {
        this.normalizedText = normalizedText;
        this.hash = hash;
    }

    public static QueryIdentity of(String queryText) {
        String normalized = normalize(queryText);
        return new QueryIdentity(normalized, sha256(normalized));
    }

    static String normalize(String queryText) {
        if (queryText == null) {
            return "";
        }
        String collapsed = WHITESPACE.matcher(queryText.strip()).replaceAll(" ");
        return TRAILING_SEMICOLONS.matcher(collapsed).replaceAll("").stripTrailing();
    }

    private static String sha256(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public String hash() {
        return hash;
    }

    public String normalizedText() {
        return normalizedText;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof QueryIdentity other)) return false;
        return hash.equals(other.hash);
    }

    @Override
    public int hashCode() {
        return hash.hashCode();
    }

    @Override
    public String toString() {
        return "QueryIdentity[" + hash.substring(0, 12) + "]";
    }
}
