package com.agentbridge.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MessageAttachment {
    private String url;
    private String filename;
    private String contentType;
    private long size;
    private Map<String, String> authHeaders;
}
