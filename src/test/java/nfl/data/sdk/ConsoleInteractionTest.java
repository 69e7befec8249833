package nfl.data.sdk;

import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class ConsoleInteractionTest {

    @Test
    void confirm_yes_returnsTrue() {
        assertTrue(console("y\n").confirm("Clear?"));
        assertTrue(console(" Y \n").confirm("Clear?"));
    }

    @Test
    void confirm_anythingElse_returnsFalse() {
        assertFalse(console("yes\n").confirm("Clear?"));
        assertFalse(console("\n").confirm("Clear?"));
        assertFalse(console("").confirm("Clear?"));
    }

    @Test
    void confirm_printsQuestionWithDefault() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        new ConsoleInteraction(new BufferedReader(new StringReader("n\n")),
                new PrintStream(out, true, StandardCharsets.UTF_8)).confirm("Clear all cached data?");

        assertEquals("Clear all cached data? (y/N): ", out.toString(StandardCharsets.UTF_8));
    }

    private static ConsoleInteraction console(String input) {
        return new ConsoleInteraction(new BufferedReader(new StringReader(input)),
                new PrintStream(new ByteArrayOutputStream(), true, StandardCharsets.UTF_8));
    }
}
