package com.project.image.bichrome.controller;

import com.project.image.bichrome.DTOs.BatchResult;
import com.project.image.bichrome.DTOs.ProcessingRequest;
import com.project.image.bichrome.exceptions.BichromeException;
import com.project.image.bichrome.service.BatchProcessingService;
import com.project.image.bichrome.service.ProcessingRequestFactory;
import com.project.image.bichrome.service.TextColorResolver;
import jakarta.validation.constraints.NotBlank;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Controller;
import org.springframework.ui.Model;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;

import java.nio.file.Path;
import java.util.Optional;

/** Converts every image in a server-side folder into its processed_images subfolder. */
@Controller
@Validated
public class BatchController {
    private static final Logger log = LoggerFactory.getLogger(BatchController.class);

    private final BatchProcessingService batchService;
    private final ProcessingRequestFactory requestFactory;

    public BatchController(BatchProcessingService batchService, ProcessingRequestFactory requestFactory) {
        this.batchService = batchService;
        this.requestFactory = requestFactory;
    }

    @GetMapping("/batch")
    public String showForm(Model model) {
        FormDefaults.populate(model, requestFactory);
        return "batch";
    }

    @PostMapping("/batch")
    public String run(
            @RequestParam("folder") @NotBlank(message = "Folder is required") String folder,
            @RequestParam(name = "darkColor", required = false) String darkColor,
            @RequestParam(name = "lightColor", required = false) String lightColor,
            @RequestParam(name = "cleanup", defaultValue = "false") boolean cleanup,
            @RequestParam(name = "resize", required = false) String resize,
            Model model
    ) {
        try {
            Optional<ProcessingRequest> request = requestFactory.create(
                    new TextColorResolver(darkColor, lightColor), cleanup, resize);
            if (request.isEmpty()) {
                return formWithError(model, "Color selection was cancelled; nothing was converted.");
            }

            BatchResult result = batchService.processFolder(Path.of(folder.trim()), request.get());
            model.addAttribute("result", result);
            return "batch-result";
        } catch (BichromeException e) {
            log.warn("Batch over {} failed [{}]: {}", folder, e.kind(), e.getMessage());
            return formWithError(model, e.getMessage());
        } catch (IllegalArgumentException e) {
            log.warn("Rejected batch input: {}", e.getMessage());
            return formWithError(model, e.getMessage());
        }
    }

    private String formWithError(Model model, String error) {
        FormDefaults.populate(model, requestFactory);
        model.addAttribute("error", error);
        return "batch";
    }
}
