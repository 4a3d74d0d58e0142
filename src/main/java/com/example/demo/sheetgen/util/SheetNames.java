package com.example.demo.sheetgen.util;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Derives document titles and sheet names from the classified document type.
 *
 * "bank_statement" becomes the title "Bank Statement"; the sheet name is the title
 * reduced to letters, digits and single spaces, at most 31 characters long.
 */
public final class SheetNames {

    public static final int MAX_LENGTH = 31;
    public static final String FALLBACK = "Document";

    private static final Pattern WORD_SEPARATORS = Pattern.compile("[_\\-\\s]+");
    private static final Pattern DISALLOWED = Pattern.compile("[^A-Za-z0-9 ]");
    private static final Pattern SPACES = Pattern.compile(" {2,}");
    private static final Pattern VALID = Pattern.compile("[A-Za-z0-9 ]+");

    private SheetNames() {
    }

    /**
     * Title text for a document: the classified type in title case, else the file name
     * without extension, else {@value #FALLBACK}.
     */
    public static String titleFor(String classifiedType, String fileName) {
        String title = titleCase(classifiedType);
        if (!title.isEmpty()) {
            return title;
        }
        String base = stripExtension(fileName);
        return base.isEmpty() ? FALLBACK : base;
    }

    public static String sheetNameFor(String title, String fileName) {
        String name = sanitize(title);
        if (name.isEmpty()) {
            name = sanitize(stripExtension(fileName));
        }
        return name.isEmpty() ? FALLBACK : name;
    }

    public static String sanitize(String candidate) {
        if (candidate == null) {
            return "";
        }
        String cleaned = DISALLOWED.matcher(candidate).replaceAll("");
        cleaned = SPACES.matcher(cleaned).replaceAll(" ").trim();
        if (cleaned.length() > MAX_LENGTH) {
            cleaned = cleaned.substring(0, MAX_LENGTH).trim();
        }
        return cleaned;
    }

    /**
     * "Bank Statement" with n = 2 gives "Bank Statement 2", shortening the base so the
     * result stays within {@value #MAX_LENGTH} characters.
     */
    public static String withSuffix(String base, int n) {
        String suffix = " " + n;
        String head = base.length() + suffix.length() > MAX_LENGTH
                ? base.substring(0, MAX_LENGTH - suffix.length()).trim()
                : base;
        return head + suffix;
    }

    public static boolean isValid(String sheetName) {
        return sheetName != null
                && sheetName.length() <= MAX_LENGTH
                && !sheetName.isBlank()
                && VALID.matcher(sheetName).matches();
    }

    private static String titleCase(String classifiedType) {
        if (classifiedType == null || classifiedType.isBlank()) {
            return "";
        }
        StringBuilder title = new StringBuilder();
        for (String word : WORD_SEPARATORS.split(classifiedType.trim())) {
            if (word.isEmpty()) {
                continue;
            }
            if (title.length() > 0) {
                title.append(' ');
            }
            // acronyms such as "IRS" keep their case
            if (word.equals(word.toUpperCase(Locale.ROOT))) {
                title.append(word);
            } else {
                title.append(Character.toUpperCase(word.charAt(0))).append(word.substring(1));
            }
        }
        return title.toString();
    }

    private static String stripExtension(String fileName) {
        if (fileName == null) {
            return "";
        }
        String name = fileName.trim();
        int slash = Math.max(name.lastIndexOf('/'), name.lastIndexOf('\\'));
        if (slash >= 0) {
            name = name.substring(slash + 1);
        }
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
