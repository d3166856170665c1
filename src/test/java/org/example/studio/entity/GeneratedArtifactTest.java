package org.example.studio.entity;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GeneratedArtifactTest {

    @Test
    void newSlot_needsGeneration() {
        GeneratedArtifact artifact = new GeneratedArtifact();

        assertEquals(ArtifactStatus.NOT_STARTED, artifact.getStatus());
        assertInstanceOf(ArtifactState.NotStarted.class, artifact.state());
        assertTrue(artifact.needsGeneration());
    }

    @Test
    void failedSlot_dropsReferenceAndStaysRetryable() {
        GeneratedArtifact artifact = new GeneratedArtifact();
        artifact.markReady("/assets/a.png");

        artifact.markFailed(" ");

        assertNull(artifact.getUrl());
        assertEquals("Generation failed", artifact.getErrorMessage());
        assertEquals(new ArtifactState.Failed("Generation failed"), artifact.state());
        assertTrue(artifact.needsGeneration());
    }

    @Test
    void generatingAndReadySlots_areNotDispatched() {
        GeneratedArtifact artifact = new GeneratedArtifact();
        artifact.markGenerating();
        assertFalse(artifact.needsGeneration());

        artifact.markReady("/assets/b.png");
        assertEquals(new ArtifactState.Ready("/assets/b.png"), artifact.state());
        assertTrue(artifact.isReady());
        assertNull(artifact.getErrorMessage());
    }

    @Test
    void fromLegacyUrl_mapsErrorSentinelToFailure() {
        GeneratedArtifact failed = GeneratedArtifact.fromLegacyUrl("error: timed out");
        GeneratedArtifact ready = GeneratedArtifact.fromLegacyUrl("https://cdn.example.com/x.png");
        GeneratedArtifact empty = GeneratedArtifact.fromLegacyUrl("");

        assertEquals(ArtifactStatus.FAILED, failed.getStatus());
        assertEquals("timed out", failed.getErrorMessage());
        assertEquals(ArtifactStatus.READY, ready.getStatus());
        assertEquals(ArtifactStatus.NOT_STARTED, empty.getStatus());
    }

    @Test
    void upgradeLegacy_onlyRereadsSlotsWithoutStatus() {
        GeneratedArtifact current = new GeneratedArtifact();
        current.markReady("error:not-a-sentinel.png");

        assertSame(current, GeneratedArtifact.upgradeLegacy(current));
        assertEquals(ArtifactStatus.READY, GeneratedArtifact.upgradeLegacy(current).getStatus());
        assertEquals(ArtifactStatus.NOT_STARTED, GeneratedArtifact.upgradeLegacy(null).getStatus());
    }

    @Test
    void characterPendingGeneration_excludesMainCharacter() {
        ProjectEntity project = new ProjectEntity("Book");
        CharacterEntity main = new CharacterEntity(project, "Fox", true);
        CharacterEntity owl = new CharacterEntity(project, "Owl", false);

        assertFalse(main.isPendingGeneration());
        assertTrue(owl.isPendingGeneration());
        owl.getImage().markGenerating();
        assertFalse(owl.isPendingGeneration());
    }

    @Test
    void pageIsPendingUntilIllustrationIsGenerating() {
        PageEntity page = new PageEntity(new ProjectEntity("Fox and Owl"), 1, "Once upon a time");

        assertTrue(page.isPendingGeneration());
        page.getIllustration().markFailed("timeout");
        assertTrue(page.isPendingGeneration());
        page.getIllustration().markReady("/assets/p1.png");
        assertFalse(page.isPendingGeneration());
    }
}
