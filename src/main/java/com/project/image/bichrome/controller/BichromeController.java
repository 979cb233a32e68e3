package com.project.image.bichrome.controller;

import com.project.image.bichrome.DTOs.ConversionResult;
import com.project.image.bichrome.DTOs.ProcessingRequest;
import com.project.image.bichrome.exceptions.BichromeException;
import com.project.image.bichrome.service.BichromeService;
import com.project.image.bichrome.service.ProcessingRequestFactory;
import com.project.image.bichrome.service.StorageService;
import com.project.image.bichrome.service.TextColorResolver;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Controller;
import org.springframework.ui.Model;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.multipart.MultipartFile;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/** Converts one uploaded image and shows it next to the original. */
@Controller
@Validated
public class BichromeController {
    private static final Logger log = LoggerFactory.getLogger(BichromeController.class);

    private static final List<String> SUPPORTED_FORMATS = Arrays.asList(
            "image/jpeg", "image/jpg", "image/png", "image/gif", "image/bmp"
    );
    private static final long MAX_UPLOAD_BYTES = 10 * 1024 * 1024;

    private final BichromeService bichromeService;
    private final StorageService storageService;
    private final ProcessingRequestFactory requestFactory;

    public BichromeController(BichromeService bichromeService, StorageService storageService,
                              ProcessingRequestFactory requestFactory) {
        this.bichromeService = bichromeService;
        this.storageService = storageService;
        this.requestFactory = requestFactory;
    }

    @GetMapping("/bichrome")
    public String showForm(Model model) {
        FormDefaults.populate(model, requestFactory);
        model.addAttribute("supportedFormats", String.join(", ", SUPPORTED_FORMATS));
        return "bichrome";
    }

    @PostMapping(value = "/bichrome", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public String convert(
            @RequestParam("file") @NotNull MultipartFile file,
            @RequestParam(name = "darkColor", required = false) String darkColor,
            @RequestParam(name = "lightColor", required = false) String lightColor,
            @RequestParam(name = "cleanup", defaultValue = "false") boolean cleanup,
            @RequestParam(name = "resize", required = false) String resize,
            @RequestParam(name = "format", defaultValue = "jpg")
            @Pattern(regexp = "jpg|png", message = "Output format must be jpg or png") String format,
            Model model
    ) {
        try {
            validateUploadedFile(file);
            Optional<ProcessingRequest> request = requestFactory.create(
                    new TextColorResolver(darkColor, lightColor), cleanup, resize);
            if (request.isEmpty()) {
                return formWithError(model, "Color selection was cancelled; nothing was converted.");
            }

            var storedOriginal = storageService.store(file);
            var storedResult = storageService.allocateResult(format);
            ConversionResult result = bichromeService.process(storedOriginal.path(), storedResult.path(), request.get());

            model.addAttribute("originalPath", "/" + storedOriginal.relativeWebPath());
            model.addAttribute("resultPath", "/" + storedResult.relativeWebPath());
            model.addAttribute("width", result.width());
            model.addAttribute("height", result.height());
            model.addAttribute("outputBytes", result.outputBytes());
            model.addAttribute("darkColor", request.get().darkColor().toHex());
            model.addAttribute("lightColor", request.get().lightColor().toHex());
            model.addAttribute("cleanup", cleanup);

            log.info("Converted {} to {}", file.getOriginalFilename(), storedResult.filename());
            return "result";
        } catch (BichromeException e) {
            log.warn("Conversion failed for {} [{}]: {}", file.getOriginalFilename(), e.kind(), e.getMessage());
            return formWithError(model, e.getMessage());
        } catch (IllegalArgumentException e) {
            log.warn("Rejected input for {}: {}", file.getOriginalFilename(), e.getMessage());
            return formWithError(model, e.getMessage());
        }
    }

    private void validateUploadedFile(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new IllegalArgumentException("Please choose an image to upload");
        }
        String contentType = file.getContentType();
        if (contentType == null || !SUPPORTED_FORMATS.contains(contentType.toLowerCase())) {
            throw new IllegalArgumentException(
                    "Unsupported file type: " + contentType + ". Supported: " + String.join(", ", SUPPORTED_FORMATS));
        }
        if (file.getSize() > MAX_UPLOAD_BYTES) {
            throw new IllegalArgumentException("File is too large. Maximum size: 10MB");
        }
    }

    private String formWithError(Model model, String error) {
        FormDefaults.populate(model, requestFactory);
        model.addAttribute("supportedFormats", String.join(", ", SUPPORTED_FORMATS));
        model.addAttribute("error", error);
        return "bichrome";
    }
}
