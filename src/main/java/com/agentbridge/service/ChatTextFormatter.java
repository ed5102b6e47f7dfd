package com.agentbridge.service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Shapes agent output for chat: message splitting and file path handling.
 */
public final class ChatTextFormatter {

    private static final String FILE_EXTENSIONS = "png|jpe?g|gif|webp|svg|bmp|pdf|docx|pptx|xlsx|csv|json|txt";

    private static final Pattern FILE_PATH = Pattern.compile(
        "(?<=^|[\\s`'\"(\\[])(/[^\\s`'\"()\\[\\]<>]+\\.(?:" + FILE_EXTENSIONS + "))(?=$|[\\s`'\"),.\\]:;!?])",
        Pattern.CASE_INSENSITIVE | Pattern.MULTILINE);

    private ChatTextFormatter() {
    }

    /**
     * Splits {@code text} at newline boundaries into chunks of at most
     * {@code maxLength} characters. Joining the chunks with {@code "\n"} gives
     * back the input exactly. A single line longer than the limit becomes its
     * own oversized chunk rather than being cut.
     */
    public static List<String> split(String text, int maxLength) {
        if (text.length() <= maxLength) {
            return List.of(text);
        }
        List<String> chunks = new ArrayList<>();
        StringBuilder current = null;
        for (String line : text.split("\n", -1)) {
            if (current == null) {
                current = new StringBuilder(line);
            } else if (current.length() + 1 + line.length() <= maxLength) {
                current.append('\n').append(line);
            } else {
                chunks.add(current.toString());
                current = new StringBuilder(line);
            }
        }
        chunks.add(current.toString());
        return chunks;
    }

    /**
     * Absolute paths with a known attachment extension, in order of first
     * appearance, without duplicates.
     */
    public static List<String> extractFilePaths(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        Set<String> paths = new LinkedHashSet<>();
        Matcher matcher = FILE_PATH.matcher(text);
        while (matcher.find()) {
            paths.add(matcher.group(1));
        }
        return new ArrayList<>(paths);
    }

    public static String stripFilePaths(String text, List<String> paths) {
        String result = text;
        for (String path : paths) {
            result = result.replace("`" + path + "`", "").replace(path, "");
        }
        return result.replaceAll("\n{3,}", "\n\n").trim();
    }
}
