package org.example.studio.generation;

import org.example.studio.entity.CharacterEntity;
import org.example.studio.entity.PageEntity;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.StringJoiner;

/**
 * Turns character and page descriptions into generation prompts. Open customer feedback is
 * appended so a regeneration addresses it.
 */
@Component
public class GenerationPromptBuilder {

    private final String stylePrompt;

    public GenerationPromptBuilder(
            @Value("${generation.style-prompt:children's book illustration, soft watercolor, warm colors}") String stylePrompt) {
        this.stylePrompt = stylePrompt;
    }

    public String characterPortrait(CharacterEntity character) {
        List<String> parts = new ArrayList<>();
        parts.add("full body character portrait of " + nonBlank(character.getName(), "a character"));
        addIfPresent(parts, character.getAge(), "age ");
        addIfPresent(parts, character.getGender(), "");
        addIfPresent(parts, character.getSkinColor(), "skin: ");
        addIfPresent(parts, character.getHairColor(), "hair color: ");
        addIfPresent(parts, character.getHairStyle(), "hair style: ");
        addIfPresent(parts, character.getEyeColor(), "eyes: ");
        addIfPresent(parts, character.getClothing(), "wearing ");
        addIfPresent(parts, character.getAccessories(), "accessories: ");
        addIfPresent(parts, character.getSpecialFeatures(), "");
        addIfPresent(parts, character.getStoryRole(), "role in story: ");
        if (character.getFeedback().hasOpenFeedback()) {
            parts.add("revision request: " + character.getFeedback().getFeedbackNotes().trim());
        }
        parts.add("plain white background");
        parts.add(stylePrompt);
        return join(parts);
    }

    public String characterSketch(CharacterEntity character) {
        return "pencil sketch of " + nonBlank(character.getName(), "a character") + ", same pose and outfit";
    }

    public String pageIllustration(PageEntity page) {
        List<String> parts = new ArrayList<>();
        String scene = nonBlank(page.getSceneDescription(), page.getStoryText());
        parts.add(nonBlank(scene, "illustration for page " + page.getPageNumber()));
        if (page.getFeedback().hasOpenFeedback()) {
            parts.add("revision request: " + page.getFeedback().getFeedbackNotes().trim());
        }
        parts.add(stylePrompt);
        return join(parts);
    }

    public String pageSketch(PageEntity page) {
        return "pencil sketch of the scene on page " + page.getPageNumber() + ", same composition";
    }

    private static void addIfPresent(List<String> parts, String value, String label) {
        if (value != null && !value.isBlank()) {
            parts.add(label + value.trim());
        }
    }

    private static String nonBlank(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value.trim();
    }

    private static String join(List<String> parts) {
        StringJoiner joiner = new StringJoiner(", ");
        parts.forEach(joiner::add);
        return joiner.toString();
    }
}
