package nfl.data.sdk;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Вопрос да/нет в консоли. Любой ответ, кроме {@code y}, считается отказом.
 */
public class ConsoleInteraction implements UserInteraction {
    private final BufferedReader in;
    private final PrintStream out;

    public ConsoleInteraction() {
        this(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)), System.out);
    }

    public ConsoleInteraction(BufferedReader in, PrintStream out) {
        this.in = in;
        this.out = out;
    }

    @Override
    public boolean confirm(String question) {
        out.print(question + " (y/N): ");
        out.flush();
        try {
            String answer = in.readLine();
            return answer != null && answer.trim().equalsIgnoreCase("y");
        } catch (IOException e) {
            throw new UncheckedIOException("Не удалось прочитать подтверждение", e);
        }
    }
}
