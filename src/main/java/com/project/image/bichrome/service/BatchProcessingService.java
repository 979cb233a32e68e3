package com.project.image.bichrome.service;

import com.project.image.bichrome.DTOs.BatchResult;
import com.project.image.bichrome.DTOs.BatchResult.FileOutcome;
import com.project.image.bichrome.DTOs.ConversionResult;
import com.project.image.bichrome.DTOs.ProcessingRequest;
import com.project.image.bichrome.exceptions.BichromeException;
import com.project.image.bichrome.exceptions.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Runs the pipeline over every supported image directly inside a folder and writes the
 * results to a subfolder of it. A failing file is recorded and the run moves on.
 */
@Service
public class BatchProcessingService {
    private static final Logger log = LoggerFactory.getLogger(BatchProcessingService.class);

    public static final Set<String> SUPPORTED_EXTENSIONS = Set.of("png", "jpg", "jpeg", "bmp", "gif");

    private final BichromeService bichromeService;
    private final String outputFolderName;

    public BatchProcessingService(BichromeService bichromeService,
                                  @Value("${app.bichrome.output-folder:processed_images}") String outputFolderName) {
        this.bichromeService = bichromeService;
        this.outputFolderName = outputFolderName;
    }

    public BatchResult processFolder(Path folder, ProcessingRequest request) {
        Path source = folder.toAbsolutePath().normalize();
        if (!Files.isDirectory(source)) {
            throw new StorageException("Not a folder: " + source);
        }

        Path output = source.resolve(outputFolderName);
        try {
            Files.createDirectories(output);
        } catch (IOException e) {
            throw new StorageException("Cannot create output folder: " + output, e);
        }

        List<Path> images = listImages(source);
        log.info("Batch started: {} image(s) in {}", images.size(), source);

        List<FileOutcome> outcomes = new ArrayList<>(images.size());
        for (Path image : images) {
            String name = image.getFileName().toString();
            try {
                ConversionResult result = bichromeService.process(image, output.resolve(name), request);
                outcomes.add(FileOutcome.success(name, result.output()));
            } catch (BichromeException e) {
                log.warn("Failed {} [{}]: {}", name, e.kind(), e.getMessage());
                outcomes.add(FileOutcome.failure(name, e.kind(), e.getMessage()));
            }
        }

        BatchResult result = new BatchResult(source, output, outcomes);
        log.info("Batch finished: {} attempted, {} succeeded, {} failed; output in {}",
                result.attempted(), result.succeeded(), result.failed(), output);
        return result;
    }

    public static boolean isSupportedImage(Path path) {
        return SUPPORTED_EXTENSIONS.contains(ImageEncoderService.extensionOf(path));
    }

    // Sorted by name so runs are reproducible across platforms.
    private List<Path> listImages(Path folder) {
        try (Stream<Path> entries = Files.list(folder)) {
            return entries
                    .filter(Files::isRegularFile)
                    .filter(BatchProcessingService::isSupportedImage)
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .toList();
        } catch (IOException e) {
            throw new StorageException("Cannot list folder: " + folder, e);
        }
    }
}
