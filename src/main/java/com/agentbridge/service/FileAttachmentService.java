package com.agentbridge.service;

import com.agentbridge.config.BridgeProperties;
import com.agentbridge.model.DownloadedFile;
import com.agentbridge.model.MessageAttachment;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Downloads chat attachments into the project's {@code .discode/files}
 * directory so the agent can read them from disk.
 */
@Service
@Slf4j
public class FileAttachmentService {

    static final String FILES_DIR = ".discode/files";

    private static final Set<String> SUPPORTED_TYPES = Set.of(
        "image/png", "image/jpeg", "image/gif", "image/webp", "image/svg+xml", "image/bmp",
        "application/pdf", "text/plain", "text/csv", "application/json",
        "application/vnd.openxmlformats-officedocument.wordprocessingml.document",
        "application/vnd.openxmlformats-officedocument.presentationml.presentation",
        "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet"
    );

    private static final Set<String> SUPPORTED_EXTENSIONS = Set.of(
        ".png", ".jpg", ".jpeg", ".gif", ".webp", ".svg", ".bmp",
        ".pdf", ".txt", ".csv", ".json", ".docx", ".pptx", ".xlsx"
    );

    private final OkHttpClient httpClient;
    private final Clock clock;
    private final long maxSizeBytes;
    private final int maxCached;

    public FileAttachmentService(OkHttpClient httpClient, Clock clock, BridgeProperties properties) {
        this.httpClient = httpClient;
        this.clock = clock;
        this.maxSizeBytes = properties.getFiles().getMaxSizeBytes();
        this.maxCached = properties.getFiles().getMaxCached();
    }

    /**
     * Downloads every supported attachment. Unsupported, oversized and failed
     * downloads are skipped with a log line; the rest are returned in order.
     */
    public List<DownloadedFile> download(List<MessageAttachment> attachments, String projectPath) {
        List<DownloadedFile> downloaded = new ArrayList<>();
        if (attachments == null || attachments.isEmpty()) {
            return downloaded;
        }

        Path filesDir = Paths.get(projectPath).resolve(FILES_DIR);
        try {
            Files.createDirectories(filesDir);
        } catch (IOException e) {
            log.error("Cannot create attachment directory {}", filesDir, e);
            return downloaded;
        }

        for (MessageAttachment attachment : attachments) {
            if (!isSupported(attachment)) {
                log.info("Skipping unsupported attachment {} ({})", attachment.getFilename(), attachment.getContentType());
                continue;
            }
            if (attachment.getSize() > maxSizeBytes) {
                log.info("Skipping attachment {}: {} bytes exceeds the {} byte limit",
                    attachment.getFilename(), attachment.getSize(), maxSizeBytes);
                continue;
            }
            try {
                downloaded.add(fetch(attachment, filesDir));
            } catch (IOException e) {
                log.warn("Failed to download attachment {}: {}", attachment.getFilename(), e.getMessage());
            }
        }

        prune(filesDir);
        return downloaded;
    }

    /**
     * Markers appended to the prompt so the agent knows where the files are:
     * one {@code [file:<path>]} per line, preceded by a newline.
     */
    public String buildFileMarkers(List<DownloadedFile> files) {
        if (files == null || files.isEmpty()) {
            return "";
        }
        return "\n" + files.stream()
            .map(file -> "[file:" + file.getLocalPath() + "]")
            .collect(Collectors.joining("\n"));
    }

    boolean isSupported(MessageAttachment attachment) {
        String contentType = attachment.getContentType();
        if (contentType != null) {
            String mime = contentType.split(";")[0].trim().toLowerCase(Locale.ROOT);
            if (SUPPORTED_TYPES.contains(mime)) {
                return true;
            }
        }
        return SUPPORTED_EXTENSIONS.contains(extensionOf(attachment.getFilename()));
    }

    private DownloadedFile fetch(MessageAttachment attachment, Path filesDir) throws IOException {
        Request.Builder builder = new Request.Builder().url(attachment.getUrl()).get();
        Map<String, String> headers = attachment.getAuthHeaders();
        if (headers != null) {
            headers.forEach(builder::header);
        }

        try (Response response = httpClient.newCall(builder.build()).execute()) {
            if (!response.isSuccessful()) {
                throw new IOException("HTTP " + response.code());
            }
            ResponseBody body = response.body();
            if (body == null) {
                throw new IOException("empty response body");
            }
            byte[] bytes = body.bytes();
            if (bytes.length > maxSizeBytes) {
                throw new IOException(bytes.length + " bytes exceeds the " + maxSizeBytes + " byte limit");
            }

            Path target = filesDir.resolve(storedName(attachment.getFilename()));
            Files.write(target, bytes);
            log.info("Downloaded attachment {} -> {}", attachment.getFilename(), target);
            return new DownloadedFile(target, attachment.getFilename(), attachment.getContentType());
        }
    }

    String storedName(String originalName) {
        String name = originalName != null ? Paths.get(originalName).getFileName().toString() : "file";
        String extension = extensionOf(name);
        String base = name.substring(0, name.length() - extension.length())
            .replaceAll("[^A-Za-z0-9._-]", "_");
        if (base.isEmpty()) {
            base = "file";
        }
        return clock.millis() + "-" + base + extension;
    }

    private void prune(Path filesDir) {
        try (Stream<Path> files = Files.list(filesDir)) {
            List<Path> sorted = files
                .filter(Files::isRegularFile)
                .sorted(Comparator.comparing(FileAttachmentService::modifiedTime).reversed())
                .collect(Collectors.toList());
            for (Path stale : sorted.subList(Math.min(maxCached, sorted.size()), sorted.size())) {
                Files.deleteIfExists(stale);
            }
        } catch (IOException e) {
            log.warn("Failed to prune {}: {}", filesDir, e.getMessage());
        }
    }

    private static FileTime modifiedTime(Path path) {
        try {
            return Files.getLastModifiedTime(path);
        } catch (IOException e) {
            return FileTime.fromMillis(0);
        }
    }

    private static String extensionOf(String filename) {
        if (filename == null) {
            return "";
        }
        int dot = filename.lastIndexOf('.');
        if (dot <= 0 || dot == filename.length() - 1) {
            return "";
        }
        return filename.substring(dot).toLowerCase(Locale.ROOT);
    }
}
