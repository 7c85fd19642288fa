package com.amcrest2mqtt.topics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.google.common.base.CharMatcher;
import org.junit.jupiter.api.Test;

public class SlugsTest {
    @Test
    public void slugify() {
        assertEquals("front_door", Slugs.slugify("Front Door", '_'));
        assertEquals("front_door_cam", Slugs.slugify("  Front -- Door   Cam!", '_'));
        assertEquals("cafe_2", Slugs.slugify("Café #2", '_'));
        assertEquals("ad410-doorbell", Slugs.slugify("AD410 Doorbell", '-'));
        assertEquals("", Slugs.slugify("***", '_'));
    }

    @Test
    public void lettersWithoutDecompositionAreTransliterated() {
        assertEquals("strasse_kamera", Slugs.slugify("Straße Kamera", '_'));
        assertEquals("ostre_dor", Slugs.slugify("Østre Dør", '_'));
        assertEquals("aero_garage", Slugs.slugify("Ærø Garage", '_'));
    }

    @Test
    public void otherScriptsBecomeAsciiSlugs() {
        for (String name : new String[] {"Кухня", "前门", "Κήπος"}) {
            String slug = Slugs.slugify(name, '_');
            assertFalse(slug.isEmpty(), name);
            assertTrue(Slugs.SLUG_CHARS.or(CharMatcher.is('_')).matchesAllOf(slug), slug);
        }
    }
}
