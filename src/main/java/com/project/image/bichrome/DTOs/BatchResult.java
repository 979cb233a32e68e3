package com.project.image.bichrome.DTOs;

import com.project.image.bichrome.exceptions.ErrorKind;

import java.nio.file.Path;
import java.util.List;

/** Summary of a folder run: one outcome per attempted file, in processing order. */
public record BatchResult(Path sourceFolder, Path outputFolder, List<FileOutcome> outcomes) {

    public BatchResult {
        outcomes = List.copyOf(outcomes);
    }

    /**
     * @param fileName source file name
     * @param output   written file, null when failed
     * @param error    failure kind, null when succeeded
     * @param message  failure reason, null when succeeded
     */
    public record FileOutcome(String fileName, Path output, ErrorKind error, String message) {
        public static FileOutcome success(String fileName, Path output) {
            return new FileOutcome(fileName, output, null, null);
        }

        public static FileOutcome failure(String fileName, ErrorKind error, String message) {
            return new FileOutcome(fileName, null, error, message);
        }

        public boolean succeeded() {
            return error == null;
        }
    }

    public int attempted() {
        return outcomes.size();
    }

    public int succeeded() {
        return (int) outcomes.stream().filter(FileOutcome::succeeded).count();
    }

    public int failed() {
        return attempted() - succeeded();
    }

    public List<FileOutcome> failures() {
        return outcomes.stream().filter(o -> !o.succeeded()).toList();
    }
}
