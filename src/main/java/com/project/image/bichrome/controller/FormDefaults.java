package com.project.image.bichrome.controller;

import com.project.image.bichrome.DTOs.ColorRole;
import com.project.image.bichrome.service.ProcessingRequestFactory;
import org.springframework.ui.Model;

/** Shared model attributes for the single-image and folder forms. */
final class FormDefaults {

    private FormDefaults() {}

    static void populate(Model model, ProcessingRequestFactory requestFactory) {
        model.addAttribute("defaultDarkColor", requestFactory.defaultColor(ColorRole.DARK).toHex());
        model.addAttribute("defaultLightColor", requestFactory.defaultColor(ColorRole.LIGHT).toHex());
    }
}
