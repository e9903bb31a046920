package com.autorestart.common.logging;

import java.util.List;
import java.util.regex.MatchResult;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Masks credentials before text reaches a log line: bearer tokens and the
 * token/password fields of dashboard JSON bodies. Group 1 of each rule is the
 * secret; the rest of the match is kept.
 */
public final class LogRedact {

    private static final int SHORT_SECRET = 18;
    private static final int HEAD = 6;
    private static final int TAIL = 4;

    private static final List<Pattern> RULES = List.of(
            Pattern.compile("Authorization\\s*[:=]\\s*Bearer\\s+([A-Za-z0-9._\\-+=/]+)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bBearer\\s+([A-Za-z0-9._\\-+=/]{18,})\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\"(?:token|password|passwd|secret|accessToken)\"\\s*:\\s*\"([^\"]+)\"",
                    Pattern.CASE_INSENSITIVE));

    private LogRedact() {
    }

    public static String redactSensitiveText(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        String out = text;
        for (Pattern rule : RULES) {
            out = rule.matcher(out).replaceAll(LogRedact::maskSecretGroup);
        }
        return out;
    }

    /**
     * Short secrets become {@code ***}; longer ones keep a few characters at
     * each end so two tokens in a log can still be told apart.
     */
    public static String maskToken(String token) {
        if (token.length() < SHORT_SECRET) {
            return "***";
        }
        return token.substring(0, HEAD) + "…" + token.substring(token.length() - TAIL);
    }

    private static String maskSecretGroup(MatchResult match) {
        String whole = match.group();
        if (match.group(1) == null || match.group(1).isEmpty()) {
            return Matcher.quoteReplacement(whole);
        }
        int from = match.start(1) - match.start();
        int to = match.end(1) - match.start();
        String masked = whole.substring(0, from) + maskToken(match.group(1)) + whole.substring(to);
        return Matcher.quoteReplacement(masked);
    }
}
