package com.agentbridge.service;

import com.agentbridge.model.StyledFrame;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Text helpers for terminal captures: escape stripping, frame flattening and
 * locating the last prompt block.
 */
public final class TerminalOutput {

    // CSI sequences, OSC sequences (BEL or ST terminated) and charset selection
    private static final Pattern ANSI_ESCAPE =
        Pattern.compile("\\x1B(?:\\[[0-9;?]*[A-Za-z]|\\].*?(?:\\x07|\\x1B\\\\)|\\([A-Z0-9])");

    private static final Pattern LINE_BREAK = Pattern.compile("\\r?\\n");

    private TerminalOutput() {
    }

    public static String stripAnsi(String text) {
        if (text == null) {
            return "";
        }
        return ANSI_ESCAPE.matcher(text).replaceAll("");
    }

    public static String frameText(StyledFrame frame) {
        return String.join("\n", frame.plainLines());
    }

    public static String trimTrailingBlankLines(String text) {
        List<String> lines = new ArrayList<>(Arrays.asList(LINE_BREAK.split(text, -1)));
        while (!lines.isEmpty() && lines.get(lines.size() - 1).isBlank()) {
            lines.remove(lines.size() - 1);
        }
        return String.join("\n", lines);
    }

    /**
     * Returns the text from the last line that starts with {@code promptMarker}
     * followed by whitespace, through to the end. Indented markers (selection
     * cursors inside menus) are ignored. Without any prompt line the whole text
     * is returned. Trailing blank lines are removed either way.
     */
    public static String extractLastCommandBlock(String text, String promptMarker) {
        String[] lines = LINE_BREAK.split(text, -1);
        int start = -1;
        for (int i = lines.length - 1; i >= 0; i--) {
            if (isPromptLine(lines[i], promptMarker)) {
                start = i;
                break;
            }
        }
        if (start < 0) {
            return trimTrailingBlankLines(text);
        }
        return trimTrailingBlankLines(String.join("\n", Arrays.copyOfRange(lines, start, lines.length)));
    }

    private static boolean isPromptLine(String line, String promptMarker) {
        if (!line.startsWith(promptMarker) || line.length() == promptMarker.length()) {
            return false;
        }
        return Character.isWhitespace(line.charAt(promptMarker.length()));
    }
}
