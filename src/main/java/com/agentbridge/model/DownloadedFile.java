package com.agentbridge.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.nio.file.Path;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class DownloadedFile {
    private Path localPath;
    private String originalName;
    private String contentType;
}
