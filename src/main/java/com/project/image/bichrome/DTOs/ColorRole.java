package com.project.image.bichrome.DTOs;

/** Which of the two classes a replacement color is for. */
public enum ColorRole {
    DARK("dark"),
    LIGHT("light");

    private final String label;

    ColorRole(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
