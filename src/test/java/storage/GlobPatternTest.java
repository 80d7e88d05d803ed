package storage;

import org.junit.jupiter.api.Test;

import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.*;

class GlobPatternTest {

    private static boolean matches(String glob, String key) {
        return GlobPattern.compile(glob).matcher(key).matches();
    }

    @Test
    void wildcards() {
        assertTrue(matches("*", ""));
        assertTrue(matches("*", "anything"));
        assertTrue(matches("user:*", "user:42"));
        assertFalse(matches("user:*", "users"));
        assertTrue(matches("h?llo", "hello"));
        assertFalse(matches("h?llo", "hllo"));
    }

    @Test
    void character_classes() {
        assertTrue(matches("h[ae]llo", "hallo"));
        assertFalse(matches("h[ae]llo", "hillo"));
        assertTrue(matches("h[^e]llo", "hallo"));
        assertFalse(matches("h[^e]llo", "hello"));
        assertTrue(matches("key[0-9]", "key7"));
        assertFalse(matches("key[0-9]", "keyx"));
    }

    @Test
    void regex_metacharacters_are_literal() {
        assertTrue(matches("a.b", "a.b"));
        assertFalse(matches("a.b", "axb"));
        assertTrue(matches("price$(1)", "price$(1)"));
        assertTrue(matches("star\\*", "star*"));
        assertFalse(matches("star\\*", "starry"));
        assertTrue(matches("open[", "open["));
    }

    @Test
    void newlines_in_keys_are_matched_by_wildcards() {
        Pattern pattern = GlobPattern.compile("a*b");

        assertTrue(pattern.matcher("a\nb").matches());
    }
}
