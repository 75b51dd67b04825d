package bigo.cli;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class MainTest {

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private PrintStream originalOut;

    @TempDir
    Path dir;

    @BeforeEach
    void captureStdout() {
        originalOut = System.out;
        System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void restoreStdout() {
        System.setOut(originalOut);
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    @Test
    void usage_error_exits_with_two() {
        assertEquals(2, Main.run(new String[0]));
        assertEquals(2, Main.run(new String[]{"frobnicate", "x"}));
        assertEquals(2, Main.run(new String[]{"solve", "nosuchmethod", "T(n) = T(n-1) + O(1)"}));
    }

    @Test
    void analyze_prints_facts_per_subroutine() throws Exception {
        Path file = dir.resolve("fact.txt");
        Files.writeString(file, """
            factorial(n)
            begin
                if n <= 1 then
                begin
                    return 1
                end
                else
                begin
                    return n * factorial(n - 1)
                end
            end
            begin
                x := factorial(5)
            end
            """);

        assertEquals(0, Main.run(new String[]{"analyze", file.toString()}));
        assertTrue(stdout().contains("\"subroutine\" : \"factorial\""));
        assertTrue(stdout().contains("\"condition\" : \"n <= 1\""));
    }

    @Test
    void ast_command_prints_json() throws Exception {
        Path file = dir.resolve("main.txt");
        Files.writeString(file, "begin\n  x := 1\nend\n");

        assertEquals(0, Main.run(new String[]{"ast", file.toString()}));
        assertTrue(stdout().contains("\"type\" : \"Program\""));
    }

    @Test
    void syntax_error_exits_with_one() throws Exception {
        Path file = dir.resolve("bad.txt");
        Files.writeString(file, "begin\n  if x\nend\n");
        assertEquals(1, Main.run(new String[]{"ast", file.toString()}));
    }

    @Test
    void missing_file_exits_with_one() {
        assertEquals(1, Main.run(new String[]{"ast", dir.resolve("absent.txt").toString()}));
    }

    @Test
    void solve_prints_resolution() {
        assertEquals(0, Main.run(new String[]{"solve", "master", "T(n) = 2T(n/2) + O(n)"}));
        assertTrue(stdout().contains("\"complexity\" : \"n log n\""));

        assertEquals(1, Main.run(new String[]{"solve", "summation", "nonsense"}));
    }

    @Test
    void json_is_utf8_even_on_an_ascii_console() {
        System.setOut(new PrintStream(out, true, StandardCharsets.US_ASCII));
        assertEquals(0, Main.run(new String[]{"solve", "summation", "Σ(i=1 to n) i"}));
        assertTrue(stdout().contains("O(n²)"), stdout());
    }
}
