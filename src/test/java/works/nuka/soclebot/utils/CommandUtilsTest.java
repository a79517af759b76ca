package works.nuka.soclebot.utils;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CommandUtilsTest {

    @Test
    void parseArgs_emptyArgs_returnsEmptyArray() {
        // Arrange
        String content = "!command";
        String prefix = "!";
        String commandName = "command";

        // Act
        String[] result = CommandUtils.parseArgs(content, prefix, commandName);

        // Assert
        assertEquals(0, result.length);
    }

    @Test
    void parseArgs_simpleArgs_returnsCorrectArray() {
        // Arrange
        String content = "!command arg1 arg2   arg3";
        String prefix = "!";
        String commandName = "command";

        // Act
        String[] result = CommandUtils.parseArgs(content, prefix, commandName);

        // Assert
        assertArrayEquals(new String[]{"arg1", "arg2", "arg3"}, result);
    }

    @Test
    void parseArgs_quotedArgs_handlesQuotesCorrectly() {
        // Arrange
        String content = "!command arg1 \"argument with spaces\" arg3";
        String prefix = "!";
        String commandName = "command";

        // Act
        String[] result = CommandUtils.parseArgs(content, prefix, commandName);

        // Assert
        assertEquals(3, result.length);
        assertEquals("arg1", result[0]);
        assertEquals("argument with spaces", result[1]);
        assertEquals("arg3", result[2]);
    }

    @Test
    void splitArgs_nullOrBlank_returnsEmptyArray() {
        assertEquals(0, CommandUtils.splitArgs(null).length);
        assertEquals(0, CommandUtils.splitArgs("   ").length);
    }

    @Test
    void extractCommandName_returnsFirstWordAfterPrefix() {
        assertEquals("greet", CommandUtils.extractCommandName("!greet a b", "!"));
        assertEquals("ping", CommandUtils.extractCommandName("sb!ping", "sb!"));
        assertEquals("", CommandUtils.extractCommandName("!", "!"));
        assertEquals("", CommandUtils.extractCommandName("! greet", "!"));
    }

    @Test
    void joinFrom_emptyTail_returnsEmptyString() {
        // Arrange
        String[] args = {"target"};

        // Act
        String result = CommandUtils.joinFrom(args, 1);

        // Assert
        assertEquals("", result);
    }

    @Test
    void joinFrom_validArgs_returnsJoinedString() {
        // Arrange
        String[] args = {"target", "This", "is", "reason"};

        // Act
        String result = CommandUtils.joinFrom(args, 1);

        // Assert
        assertEquals("This is reason", result);
    }

    @Test
    void parseDuration_validFormat_returnsDurationInMillis() {
        // Act & Assert
        assertEquals(1000, CommandUtils.parseDuration("1s")); // 1 seconde
        assertEquals(60000, CommandUtils.parseDuration("1m")); // 1 minute
        assertEquals(3600000, CommandUtils.parseDuration("1h")); // 1 heure
        assertEquals(86400000, CommandUtils.parseDuration("1d")); // 1 jour
    }

    @Test
    void parseDuration_invalidFormat_returnsNegativeOne() {
        // Act & Assert
        assertEquals(-1, CommandUtils.parseDuration("1x")); // Unité invalide
        assertEquals(-1, CommandUtils.parseDuration("")); // Chaîne vide
        assertEquals(-1, CommandUtils.parseDuration(null)); // Null
        assertEquals(-1, CommandUtils.parseDuration("m5"));
    }
}
