package com.scadformatter.cli;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import com.scadformatter.config.ConfigurationLoader;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FormatterCliTest {

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private int run(String stdin, String... args) {
        FormatterCli cli = new FormatterCli(
                new ByteArrayInputStream(stdin.getBytes(StandardCharsets.UTF_8)),
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
        return cli.run(args);
    }

    // stdout encodes as US-ASCII, so only raw bytes survive it unchanged
    private int runBytes(byte[] stdin, String... args) {
        FormatterCli cli = new FormatterCli(
                new ByteArrayInputStream(stdin),
                new PrintStream(out, true, StandardCharsets.US_ASCII),
                new PrintStream(err, true, StandardCharsets.UTF_8));
        return cli.run(args);
    }

    private String noConfig() {
        return "--config=" + tempDir.resolve("none.yml");
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    @Test
    void formatsStdinToStdout() {
        int exitCode = run("if(x>5) cube(1);", "--stdin", noConfig());

        assertThat(exitCode).isZero();
        assertThat(stdout()).isEqualTo("if (x > 5)\n    cube(1);\n");
    }

    @Test
    void stdinEchoesInvalidInput() {
        String source = "cube(;\n";

        int exitCode = run(source, "--stdin", noConfig());

        assertThat(exitCode).isZero();
        assertThat(stdout()).isEqualTo(source);
        assertThat(err.toString(StandardCharsets.UTF_8)).isNotEmpty();
    }

    @Test
    void stdinKeepsNonAsciiTextOnSuccess() {
        byte[] input = "// \u00e9t\u00e9\ncube( 1 );\n".getBytes(StandardCharsets.UTF_8);

        int exitCode = runBytes(input, "--stdin", noConfig());

        assertThat(exitCode).isZero();
        assertThat(out.toByteArray()).isEqualTo("// \u00e9t\u00e9\ncube(1);\n".getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void stdinEchoesNonAsciiInputBytesOnFailure() {
        byte[] input = "// \u00e9\ncube(;\n".getBytes(StandardCharsets.UTF_8);

        int exitCode = runBytes(input, "--stdin", noConfig());

        assertThat(exitCode).isZero();
        assertThat(out.toByteArray()).isEqualTo(input);
        assertThat(err.toString(StandardCharsets.UTF_8)).isNotEmpty();
    }

    @Test
    void stdinEchoesUndecodableBytes() {
        byte[] input = {'c', 'u', 'b', 'e', '(', '1', ')', ';', ' ', '/', '/', ' ', (byte) 0xE9, '\n'};

        int exitCode = runBytes(input, "--stdin", noConfig());

        assertThat(exitCode).isZero();
        assertThat(out.toByteArray()).isEqualTo(input);
        assertThat(err.toString(StandardCharsets.UTF_8)).contains("not valid UTF-8");
    }

    @Test
    void commandLineOverridesConfig() {
        int exitCode = run("module m(){cube(1);}", "--stdin", noConfig(), "--indent-size=2");

        assertThat(exitCode).isZero();
        assertThat(stdout()).isEqualTo("module m() {\n  cube(1);\n}\n");
    }

    @Test
    void invalidOverrideIsIgnored() {
        run("module m(){cube(1);}", "--stdin", noConfig(), "--indent-size=zero");

        assertThat(stdout()).isEqualTo("module m() {\n    cube(1);\n}\n");
    }

    @Test
    void readsConfigFile() throws IOException {
        Path config = tempDir.resolve("custom.yml");
        Files.writeString(config, "general:\n  useTabs: true\n");

        run("module m(){cube(1);}", "--stdin", "--config=" + config);

        assertThat(stdout()).isEqualTo("module m() {\n\tcube(1);\n}\n");
    }

    @Test
    void checkThenFormatThenCheck() throws IOException {
        Path project = Files.createDirectories(tempDir.resolve("project"));
        Path part = project.resolve("part.scad");
        Files.writeString(part, "cube([1,2,3]);");
        Files.writeString(project.resolve("clean.scad"), "sphere(1);\n");

        assertThat(run("", "check", project.toString(), noConfig(), "--no-color")).isEqualTo(1);
        assertThat(stdout()).contains("File needs formatting: " + part);

        assertThat(run("", "format", project.toString(), noConfig(), "--no-color", "--ci")).isZero();
        assertThat(Files.readString(part)).isEqualTo("cube([1, 2, 3]);\n");
        assertThat(stdout()).contains("RESULT:files=2;changed=1;errors=0");

        assertThat(run("", "check", project.toString(), noConfig(), "--no-color")).isZero();
    }

    @Test
    void formatReportsBrokenFiles() throws IOException {
        Path broken = tempDir.resolve("broken.scad");
        Files.writeString(broken, "cube(;");

        int exitCode = run("", "format", broken.toString(), noConfig(), "--no-color");

        assertThat(exitCode).isEqualTo(1);
        assertThat(Files.readString(broken)).isEqualTo("cube(;");
        assertThat(stdout()).contains("Failed to format: " + broken);
    }

    @Test
    void includeFiltersDirectoryFiles() throws IOException {
        Files.writeString(tempDir.resolve("a_part.scad"), "a();");
        Files.writeString(tempDir.resolve("b_lib.scad"), "b();");

        run("", "format", tempDir.toString(), noConfig(), "--no-color", "--ci", "--include=*_part.scad");

        assertThat(stdout()).contains("RESULT:files=1;changed=1;errors=0");
        assertThat(Files.readString(tempDir.resolve("b_lib.scad"))).isEqualTo("b();");
    }

    @Test
    void initWritesConfigOnce() throws IOException {
        Path config = tempDir.resolve(FormatterCli.CONFIG_FILE_NAME);

        assertThat(run("", "init", "--config=" + config, "--no-color")).isZero();
        assertThat(ConfigurationLoader.loadConfig(config).getGeneralConfig("indentSize", 0)).isEqualTo(4);

        Files.writeString(config, "general:\n  indentSize: 2\n");
        assertThat(run("", "init", "--config=" + config, "--no-color")).isZero();
        assertThat(Files.readString(config)).contains("indentSize: 2");

        assertThat(run("", "init", "--config=" + config, "--force", "--no-color")).isZero();
        assertThat(ConfigurationLoader.loadConfig(config).getGeneralConfig("indentSize", 0)).isEqualTo(4);
    }

    @Test
    void printsVersion() {
        assertThat(run("", "--version")).isZero();
        assertThat(stdout()).contains("SCAD Formatter version 1.0.0");
    }

    @Test
    void rejectsUnknownCommand() {
        assertThat(run("", "reformat", "--no-color")).isEqualTo(1);
        assertThat(stdout()).contains("Unknown command: reformat");
    }

    @Test
    void missingPathFails() {
        assertThat(run("", "check", tempDir.resolve("absent").toString(), "--no-color")).isEqualTo(1);
        assertThat(run("", "format", "--no-color")).isEqualTo(1);
    }
}
