package com.project.image.bichrome.service;

import com.project.image.bichrome.exceptions.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Set;

/** Keeps uploaded originals and single-image results under {@code app.upload.dir}. */
@Service
public class StorageService {
    private static final Logger log = LoggerFactory.getLogger(StorageService.class);
    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss_SSS");
    public static final Set<String> RESULT_FORMATS = Set.of("jpg", "png");

    private final Path rootDir;

    public StorageService(@Value("${app.upload.dir:uploads}") String root) {
        this.rootDir = Paths.get(root).toAbsolutePath().normalize();
        try {
            Files.createDirectories(this.rootDir);
            log.info("Using upload directory: {}", this.rootDir);
        } catch (IOException e) {
            throw new StorageException("Cannot create upload directory: " + rootDir, e);
        }
    }

    public record StoredFile(Path path, String filename, String relativeWebPath) {}

    public StoredFile store(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new StorageException("Empty upload");
        }
        String contentType = file.getContentType();
        if (contentType == null || !contentType.startsWith("image/")) {
            throw new StorageException("Only image uploads are allowed (received: " + contentType + ")");
        }
        String original = StringUtils.cleanPath(file.getOriginalFilename() == null ? "upload" : file.getOriginalFilename());
        String safeBase = original.replaceAll("[^a-zA-Z0-9._-]", "_");
        StoredFile target = newFile(safeBase);
        try (InputStream in = file.getInputStream()) {
            Files.copy(in, target.path(), StandardCopyOption.REPLACE_EXISTING);
            log.debug("Stored upload {} as {}", original, target.filename());
            return target;
        } catch (IOException e) {
            throw new StorageException("Failed to store file", e);
        }
    }

    /** Reserves a path for a processed image; the encoder creates the file. */
    public StoredFile allocateResult(String format) {
        String extension = format == null ? "" : format.toLowerCase();
        if (!RESULT_FORMATS.contains(extension)) {
            throw new StorageException("Unsupported result format: " + format + " (use jpg or png)");
        }
        return newFile("bichrome." + extension);
    }

    public Path rootDir() {
        return rootDir;
    }

    private StoredFile newFile(String suffix) {
        String filename = STAMP.format(LocalDateTime.now()) + "_" + suffix;
        return new StoredFile(rootDir.resolve(filename), filename, "uploads/" + filename);
    }
}
