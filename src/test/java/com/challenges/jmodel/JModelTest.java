package com.challenges.jmodel;

import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;

import static org.junit.jupiter.api.Assertions.*;

public class JModelTest {

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int run(String... args) {
        CommandLine commandLine = new CommandLine(new JModel());
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
        return commandLine.execute(args);
    }

    @Test
    public void testDefaultSampleIsCourse() {
        assertEquals(0, run());
        assertEquals("{\"name\":\"PA\",\"credits\":6,\"evaluation\":["
                        + "{\"name\":\"quizzes\",\"percentage\":0.2,\"mandatory\":false,\"type\":null},"
                        + "{\"name\":\"project\",\"percentage\":0.8,\"mandatory\":true,\"type\":\"PROJECT\"}]}",
                out.toString().trim());
    }

    @Test
    public void testStudentSample() {
        assertEquals(0, run("--sample", "STUDENT", "--validate"));
        assertEquals("{\"name\":\"Catarina\",\"age\":37,\"isStudent\":true,\"scores\":[17,15,18]}",
                out.toString().trim());
        assertEquals("", err.toString());
    }

    @Test
    public void testExcludeDropsTopLevelMembers() {
        assertEquals(0, run("-s", "STUDENT", "-x", "age", "--exclude", "scores"));
        assertEquals("{\"name\":\"Catarina\",\"isStudent\":true}", out.toString().trim());
    }

    @Test
    public void testExcludingEverythingPrintsEmptyObject() {
        assertEquals(0, run("-s", "COURSE", "-x", "name", "-x", "credits", "-x", "evaluation"));
        assertEquals("{}", out.toString().trim());
    }

    @Test
    public void testInvalidDocumentIsPrintedWithoutValidation() {
        assertEquals(0, run("--sample", "GRADES"));
        assertEquals("[17,null,18]", out.toString().trim());
    }

    @Test
    public void testValidateRefusesInvalidDocument() {
        assertEquals(JModel.INVALID_DOCUMENT, run("--sample", "GRADES", "--validate"));
        assertEquals("", out.toString());
        assertTrue(err.toString().contains("failed validation"));
    }

    @Test
    public void testUnknownSampleIsUsageError() {
        assertEquals(CommandLine.ExitCode.USAGE, run("--sample", "NOPE"));
        assertTrue(err.toString().contains("NOPE"));
    }
}
