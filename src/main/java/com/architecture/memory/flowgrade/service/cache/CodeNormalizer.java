package com.architecture.memory.flowgrade.service.cache;

import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Canonicalizes pseudocode before hashing so that inputs differing only in comments,
 * semicolons, whitespace layout or letter case produce the same cache key.
 *
 * Steps run in a fixed order, each on the previous step's output:
 * 1. strip "//" and "#" line comments
 * 2. strip block comments
 * 3. drop semicolons
 * 4. collapse whitespace runs to one space
 * 5. trim
 * 6. lower-case
 */
@Component
public class CodeNormalizer {

    private static final Pattern SLASH_LINE_COMMENT = Pattern.compile("//.*$", Pattern.MULTILINE);
    private static final Pattern HASH_LINE_COMMENT = Pattern.compile("#.*$", Pattern.MULTILINE);
    private static final Pattern BLOCK_COMMENT = Pattern.compile("/\\*.*?\\*/", Pattern.DOTALL);
    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+");

    public String normalize(String code) {
        if (code == null) {
            return "";
        }

        String text = SLASH_LINE_COMMENT.matcher(code).replaceAll("");
        text = HASH_LINE_COMMENT.matcher(text).replaceAll("");
        text = BLOCK_COMMENT.matcher(text).replaceAll("");
        text = text.replace(";", "");
        text = WHITESPACE_RUN.matcher(text).replaceAll(" ");
        return text.trim().toLowerCase(Locale.ROOT);
    }
}
