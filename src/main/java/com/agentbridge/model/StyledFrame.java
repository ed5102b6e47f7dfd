package com.agentbridge.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A rendered terminal screen: lines of styled text segments.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class StyledFrame {
    private List<Line> lines = new ArrayList<>();

    public List<String> plainLines() {
        if (lines == null) {
            return List.of();
        }
        return lines.stream()
            .map(Line::plainText)
            .collect(Collectors.toList());
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Line {
        private List<Segment> segments = new ArrayList<>();

        public String plainText() {
            if (segments == null) {
                return "";
            }
            StringBuilder text = new StringBuilder();
            for (Segment segment : segments) {
                if (segment != null && segment.getText() != null) {
                    text.append(segment.getText());
                }
            }
            return text.toString();
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Segment {
        private String text;
        private String fg;
        private String bg;
        private boolean bold;

        public Segment(String text) {
            this.text = text;
        }
    }
}
