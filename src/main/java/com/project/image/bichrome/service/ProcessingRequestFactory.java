package com.project.image.bichrome.service;

import com.project.image.bichrome.DTOs.ColorResolution;
import com.project.image.bichrome.DTOs.ColorRole;
import com.project.image.bichrome.DTOs.ProcessingRequest;
import com.project.image.bichrome.DTOs.ResizeDimensions;
import com.project.image.bichrome.DTOs.RgbColor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Optional;

/** Builds the immutable request for one run from operator input and configured defaults. */
@Service
public class ProcessingRequestFactory {
    private static final Logger log = LoggerFactory.getLogger(ProcessingRequestFactory.class);

    private final RgbColor defaultDark;
    private final RgbColor defaultLight;

    public ProcessingRequestFactory(@Value("${app.bichrome.dark-color:#000000}") String defaultDark,
                                    @Value("${app.bichrome.light-color:#f3efdd}") String defaultLight) {
        this.defaultDark = RgbColor.parse(defaultDark);
        this.defaultLight = RgbColor.parse(defaultLight);
    }

    /**
     * @return the request, or empty when the operator cancelled a color selection
     */
    public Optional<ProcessingRequest> create(ColorResolver resolver, boolean cleanup, String resize) {
        ColorResolution dark = resolver.resolve(ColorRole.DARK, defaultDark);
        if (dark.isCancelled()) {
            log.info("No color selected for {}; nothing will be processed", ColorRole.DARK.label());
            return Optional.empty();
        }
        ColorResolution light = resolver.resolve(ColorRole.LIGHT, defaultLight);
        if (light.isCancelled()) {
            log.info("No color selected for {}; nothing will be processed", ColorRole.LIGHT.label());
            return Optional.empty();
        }

        Optional<ResizeDimensions> dimensions = resize == null || resize.isBlank()
                ? Optional.empty()
                : Optional.of(ResizeDimensions.parse(resize));

        return Optional.of(new ProcessingRequest(dark.color().get(), light.color().get(), cleanup, dimensions));
    }

    public RgbColor defaultColor(ColorRole role) {
        return role == ColorRole.DARK ? defaultDark : defaultLight;
    }
}
