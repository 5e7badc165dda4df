package org.dxworks.syntaxview;

import org.dxworks.syntaxview.tree.DisplayNode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class AppTest {

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();
    private PrintStream originalOut;
    private PrintStream originalErr;

    @BeforeEach
    void captureOutput() {
        originalOut = System.out;
        originalErr = System.err;
        System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
        System.setErr(new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void restoreOutput() {
        System.setOut(originalOut);
        System.setErr(originalErr);
    }

    @Test
    void options_accept_flags_in_any_order() {
        App.Options options = App.Options.parse(new String[]{"--json", "Foo.java", "--select", "0.1"});

        assertEquals("Foo.java", options.file);
        assertTrue(options.json);
        assertFalse(options.color);
        assertEquals("0.1", options.selectPath);
    }

    @Test
    void options_reject_unknown_flags_missing_values_and_extra_files() {
        assertNull(App.Options.parse(new String[]{}));
        assertNull(App.Options.parse(new String[]{"Foo.java", "--verbose"}));
        assertNull(App.Options.parse(new String[]{"Foo.java", "--select"}));
        assertNull(App.Options.parse(new String[]{"Foo.java", "Bar.java"}));
    }

    @Test
    void select_follows_child_index_path() {
        DisplayNode root = new SyntaxTreeViewer().buildDisplayTree(TestTrees.classFoo()).getRoot();

        assertEquals(root, App.select(root, "").orElseThrow());
        assertEquals("identifier: \"Bar\"", App.select(root, "0.3.1").orElseThrow().getLabel());
        assertTrue(App.select(root, "0.9").isEmpty());
        assertTrue(App.select(root, "0.x").isEmpty());
        assertTrue(App.select(root, "-1").isEmpty());
    }

    @Test
    void read_source_strips_byte_order_mark() throws IOException {
        Path file = tempDir.resolve("Bom.cs");
        Files.writeString(file, "\uFEFFclass A {}", StandardCharsets.UTF_8);

        assertEquals("class A {}", App.readSource(file));
    }

    @Test
    void run_reports_usage_errors() throws IOException {
        assertEquals(2, App.run(new String[]{}));

        Path text = Files.writeString(tempDir.resolve("notes.txt"), "hello");
        assertEquals(2, App.run(new String[]{text.toString()}));
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("Unsupported file type: notes.txt"));

        assertEquals(1, App.run(new String[]{tempDir.resolve("Missing.java").toString()}));
    }

    @Test
    void run_prints_tree_and_selected_properties() throws IOException {
        Path file = Files.writeString(tempDir.resolve("Foo.java"), "class Foo { }\n");

        int exitCode = App.run(new String[]{file.toString(), "--select", "0"});

        assertEquals(0, exitCode);
        String printed = out.toString(StandardCharsets.UTF_8);
        assertTrue(printed.startsWith("program - ProgramSyntax\n"));
        assertTrue(printed.contains("    class: \"class\"\n"));
        assertTrue(printed.contains("  Kind "));
        assertTrue(printed.contains("class_declaration"));
    }

    @Test
    void run_prints_json_when_requested() throws IOException {
        Path file = Files.writeString(tempDir.resolve("Foo.java"), "class Foo { }\n");

        assertEquals(0, App.run(new String[]{file.toString(), "--json"}));
        assertTrue(out.toString(StandardCharsets.UTF_8).contains("\"label\" : \"program - ProgramSyntax\""));
    }
}
