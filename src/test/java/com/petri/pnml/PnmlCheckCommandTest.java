package com.petri.pnml;

import com.petri.pnml.cli.PnmlCheckCommand;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class PnmlCheckCommandTest {
    @TempDir
    Path dir;

    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() {
        out = new StringWriter();
        err = new StringWriter();
    }

    private int execute(String... args) {
        CommandLine cmd = new CommandLine(new PnmlCheckCommand());
        cmd.setOut(new PrintWriter(out));
        cmd.setErr(new PrintWriter(err));
        return cmd.execute(args);
    }

    private Path write(String name, String content) throws IOException {
        return Files.writeString(dir.resolve(name), content);
    }

    @Test
    void printsSummaryAndExitsZeroEvenWithFindings() throws IOException {
        Path file = write("net.pnml", """
                <pnml><net id="n">
                  <place id="p1"><name><text>start</text></name><initialMarking><text>1</text></initialMarking></place>
                  <place id="p2"><initialMarking><text>3</text></initialMarking></place>
                  <arc id="a1" source="p1" target="t1"/>
                </net></pnml>
                """);

        assertEquals(0, execute(file.toString()));
        String text = out.toString();
        assertTrue(text.contains("Places: 2"));
        assertTrue(text.contains("Transitions: 0"));
        assertTrue(text.contains("Arcs: 1"));
        assertTrue(text.contains(" - p1 (start)"));
        assertTrue(text.contains("Arc a1 has unknown target t1"));
        assertTrue(text.contains("Place p2 has marking 3 (not 0/1)"));
    }

    @Test
    void fatalParseErrorPrintsNoSummary() throws IOException {
        Path file = write("dup.pnml", """
                <pnml><net id="n"><place id="p1"/><place id="p1"/></net></pnml>
                """);

        assertEquals(1, execute(file.toString()));
        assertEquals("", out.toString());
        assertTrue(err.toString().contains("Duplicate place id: p1"));
    }

    @Test
    void malformedXmlIsAParseError() throws IOException {
        Path file = write("broken.pnml", "<pnml><net>");

        assertEquals(1, execute(file.toString()));
        assertTrue(err.toString().startsWith("Parse error:"));
    }

    @Test
    void missingFileExitsWithOne() {
        assertEquals(1, execute(dir.resolve("nope.pnml").toString()));
        assertTrue(err.toString().contains("File not found"));
    }

    @Test
    void requiresExactlyOneArgument() throws IOException {
        assertEquals(2, execute());
        Path file = write("a.pnml", "<pnml/>");
        assertEquals(2, execute(file.toString(), file.toString()));
    }
}
