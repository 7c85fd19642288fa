package com.amcrest2mqtt.topics;

import com.google.common.base.CharMatcher;
import com.ibm.icu.text.Transliterator;
import java.text.Normalizer;
import java.util.Locale;

public final class Slugs {
    static final CharMatcher SLUG_CHARS = CharMatcher.inRange('a', 'z').or(CharMatcher.inRange('0', '9'));
    static final Transliterator TO_ASCII = Transliterator.getInstance("Any-Latin; Latin-ASCII");

    private Slugs() {}

    /** "Front Door Cam" -> "front_door_cam", "Café #2" -> "cafe_2", "Straße" -> "strasse" */
    public static String slugify(String text, char separator) {
        String ascii = Normalizer.normalize(transliterate(text), Normalizer.Form.NFKD)
                .replaceAll("\\p{M}", "")
                .toLowerCase(Locale.ROOT);
        return SLUG_CHARS.negate().trimAndCollapseFrom(ascii, separator);
    }

    static String transliterate(String text) {
        synchronized (TO_ASCII) {
            return TO_ASCII.transliterate(text);
        }
    }
}
