package structview;

import org.junit.After;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import picocli.CommandLine;

import java.io.File;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class MainTest {

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int run(String... args) {
        CommandLine cmd = new CommandLine(new Main());
        cmd.setOut(new PrintWriter(out));
        cmd.setErr(new PrintWriter(err));
        return cmd.execute(args);
    }

    @After
    public void resetLogging() {
        DebugLog.setEnabled(false);
    }

    @Test
    public void printsTreeOfFile() throws Exception {
        File f = tmp.newFile("data.json");
        Files.writeString(f.toPath(), "{\"users\": [{\"name\": \"Ann\"}], \"ok\": true}");

        assertEquals(0, run("--print", "-f", f.getPath()));
        String[] lines = out.toString().split("\\R");
        assertEquals("(Object)", lines[0]);
        assertEquals("  ok: true (boolean)", lines[1]);
        assertEquals("  users: (1 items) (Array)", lines[2]);
        assertEquals("    [0] (User)", lines[3]);
        assertEquals("      name: \"Ann\" (string)", lines[4]);
    }

    @Test
    public void maxDepthLimitsPrintedTree() throws Exception {
        File f = tmp.newFile("deep.json");
        Files.writeString(f.toPath(), "{\"a\": {\"b\": 1}}");

        assertEquals(0, run("-p", "--max-depth", "1", "-f", f.getPath()));
        assertTrue(out.toString(), out.toString().contains("a: (max depth reached) (Object)"));
        assertTrue(!out.toString().contains("b:"));
    }

    @Test
    public void forcedFormatIsUsed() throws Exception {
        File f = tmp.newFile("rows.txt");
        Files.writeString(f.toPath(), "k: v\n");

        assertEquals(0, run("-p", "-y", "-f", f.getPath()));
        assertTrue(out.toString().contains("k: \"v\" (string)"));
    }

    @Test
    public void negativeMaxDepthIsUsageError() {
        assertEquals(2, run("--max-depth", "-1", "-p"));
        assertTrue(err.toString(), err.toString().contains("--max-depth"));
    }

    @Test
    public void formatFlagsAreExclusive() {
        assertEquals(2, run("-x", "-j", "-p"));
    }

    @Test
    public void missingFileFails() {
        assertEquals(1, run("-p", "-f", new File(tmp.getRoot(), "nope.json").getPath()));
        assertTrue(err.toString().contains("file not found"));
    }

    @Test
    public void parseErrorsGoToStderr() throws Exception {
        File f = tmp.newFile("bad.json");
        Files.writeString(f.toPath(), "{\"a\": ");

        assertEquals(1, run("-p", "-f", f.getPath()));
        assertTrue(err.toString(), err.toString().contains("Error reading JSON data"));
    }

    @Test
    public void helpAndVersion() {
        assertEquals(0, run("--help"));
        assertTrue(out.toString().contains("--max-depth"));
        assertEquals(0, run("-V"));
        assertTrue(out.toString().contains("1.0.0"));
    }
}
