package org.example.studio.model;

import org.example.studio.entity.CharacterEntity;

public record CharacterView(
        String id,
        String name,
        boolean main,
        String role,
        String storyRole,
        String age,
        String gender,
        String skinColor,
        String hairColor,
        String hairStyle,
        String eyeColor,
        String clothing,
        String accessories,
        String specialFeatures,
        ArtifactView image,
        ArtifactView sketch,
        FeedbackView feedback
) {
    public static CharacterView from(CharacterEntity character) {
        return new CharacterView(
                character.getId(),
                character.getName(),
                character.isMain(),
                character.getRole(),
                character.getStoryRole(),
                character.getAge(),
                character.getGender(),
                character.getSkinColor(),
                character.getHairColor(),
                character.getHairStyle(),
                character.getEyeColor(),
                character.getClothing(),
                character.getAccessories(),
                character.getSpecialFeatures(),
                ArtifactView.from(character.getImage()),
                ArtifactView.from(character.getSketch()),
                FeedbackView.from(character.getFeedback())
        );
    }
}
