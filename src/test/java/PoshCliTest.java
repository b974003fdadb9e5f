import com.posh.script.PoshCli;
import com.posh.script.parser.PropertyMap;
import com.posh.script.parser.Value;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class PoshCliTest {

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private int run(String stdin, String... args) {
        return PoshCli.run(args,
                new ByteArrayInputStream(stdin.getBytes(StandardCharsets.UTF_8)),
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private String out() {
        return out.toString(StandardCharsets.UTF_8).replace("\r\n", "\n");
    }

    private String err() {
        return err.toString(StandardCharsets.UTF_8);
    }

    @Test
    void commandOption() {
        assertEquals(0, run("", "-c", "1 + 2"));
        assertEquals("3\n", out());
    }

    @Test
    void listsPrintOneItemPerLine() {
        assertEquals(0, run("", "-c", "@(1, 2, 3) | Where-Object { $_ -gt 1 }"));
        assertEquals("2\n3\n", out());
    }

    @Test
    void runtimeErrorExitsWithOne() {
        assertEquals(1, run("", "-c", "$nope"));
        assertTrue(err().contains("nope"));
    }

    @Test
    void usageErrorsExitWithTwo() {
        assertEquals(2, run("", "--bogus"));
        assertEquals(2, run("", "--max-depth", "zero"));
        assertEquals(2, run("", "-c"));
        assertTrue(err().contains("Usage"));
    }

    @Test
    void unreadableScriptExitsWithThree() {
        assertEquals(3, run("", "/definitely/not/here.ps1"));
    }

    @Test
    void runsScriptFiles(@TempDir Path dir) throws Exception {
        Path script = dir.resolve("demo.ps1");
        Files.writeString(script, "function Add($a, $b) { $a + $b }\n$x = Add 2 3\n$x\n\"done\"\n");
        assertEquals(0, run("", script.toString()));
        assertEquals("5\ndone\n", out());
    }

    @Test
    void maxDepthOption() {
        assertEquals(1, run("", "--max-depth", "3", "-c", "function R { R }; R"));
        assertTrue(err().toLowerCase().contains("depth"));
    }

    @Test
    void jsonOutput() {
        assertEquals(0, run("", "--json", "-c", "@{A=1}"));
        assertTrue(out().contains("\"A\" : 1"));
    }

    @Test
    void replKeepsStateAndJoinsOpenBlocks() {
        String session = "$x = 2\nfunction F {\n  $x * 3\n}\nF\n$nope\n'after'\nexit\n'never'\n";
        assertEquals(0, run(session));
        String printed = out();
        assertTrue(printed.contains("PS> "));
        assertTrue(printed.contains(">> "));
        assertTrue(printed.contains("6\n"));
        assertTrue(printed.contains("after\n"));
        assertFalse(printed.contains("never"));
        assertTrue(err().contains("nope"));
    }

    @Test
    void completenessCheck() {
        assertFalse(PoshCli.isComplete("function F {"));
        assertFalse(PoshCli.isComplete("$x = (1 +"));
        assertFalse(PoshCli.isComplete("'open"));
        assertTrue(PoshCli.isComplete("'{'"));
        assertTrue(PoshCli.isComplete("$x = 1 # {"));
        assertTrue(PoshCli.isComplete("function F { 1 }"));
    }

    @Test
    void recordsPrintAsAlignedProperties() {
        PropertyMap<Value> p = new PropertyMap<>();
        p.put("Name", Value.string("x"));
        p.put("Age", Value.number(3));
        assertEquals("Name : x\nAge  : 3", PoshCli.format(Value.record(p)));
        assertEquals("1, 2", PoshCli.format(Value.list(Value.number(1), Value.number(2))));
    }
}
