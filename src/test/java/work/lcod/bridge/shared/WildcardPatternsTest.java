package work.lcod.bridge.shared;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import work.lcod.bridge.error.ValidationException;

class WildcardPatternsTest {
    @Test
    void wildcardsMatchWholeNamesIgnoringCase() {
        var pattern = WildcardPatterns.compile("Player*", false);
        assertTrue(pattern.matcher("player_01").matches());
        assertFalse(pattern.matcher("NPC_Player").matches());

        var single = WildcardPatterns.compile("Enemy?", false);
        assertTrue(single.matcher("enemy1").matches());
        assertFalse(single.matcher("enemy12").matches());
    }

    @Test
    void regexMetacharactersInWildcardsAreLiteral() {
        var pattern = WildcardPatterns.compile("a.b*", false);
        assertTrue(pattern.matcher("a.bc").matches());
        assertFalse(pattern.matcher("axbc").matches());
        assertEquals("^\\Qa.b\\E.*$", WildcardPatterns.toRegex("a.b*"));
    }

    @Test
    void wildcardsAreAnchoredButRegexIsASubstringSearch() {
        var wildcard = WildcardPatterns.compile("Enemy_*", false);
        assertFalse(wildcard.matcher("Level/Enemy_01").find());
        assertTrue(wildcard.matcher("enemy_01").find());

        var regex = WildcardPatterns.compile("Enemy_\\d+", true);
        assertTrue(regex.matcher("Level/Enemy_01").find());
        assertFalse(regex.matcher("Level/Enemy_").find());
    }

    @Test
    void invalidRegexIsRejected() {
        var error = assertThrows(ValidationException.class, () -> WildcardPatterns.compile("[unclosed", true));
        assertTrue(error.getMessage().contains("[unclosed"));
        assertThrows(ValidationException.class, () -> WildcardPatterns.compile(null, false));
    }

    @Test
    void detectsWildcards() {
        assertTrue(WildcardPatterns.hasWildcard("a*"));
        assertFalse(WildcardPatterns.hasWildcard("plain"));
    }
}
