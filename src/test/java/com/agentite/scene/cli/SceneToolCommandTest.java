package com.agentite.scene.cli;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for the scenetool command line.
 */
class SceneToolCommandTest {

    @TempDir
    Path tempDir;

    private StringWriter out;
    private CommandLine commandLine;

    @BeforeEach
    void setUp() {
        out = new StringWriter();
        commandLine = new CommandLine(new SceneToolCommand());
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(new StringWriter()));
    }

    private Path write(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
        return file;
    }

    private int run(Object... args) {
        String[] strings = new String[args.length];
        for (int i = 0; i < args.length; i++) {
            strings[i] = args[i].toString();
        }
        return commandLine.execute(strings);
    }

    @Test
    void testCheckValidFiles() throws IOException {
        Path scene = write("level.scene", """
                Player @(100, 100) {
                    Health: 100
                    Sprite: { texture: "player.png" }
                    Weapon { Damage: 3 }
                }
                Enemy { prefab: "enemies/goblin.prefab" }
                """);
        Path prefab = write("goblin.prefab", "Goblin { Health: 30 }");

        int exitCode = run("check", scene, prefab);

        assertThat(exitCode).isEqualTo(SceneToolCommand.EXIT_OK);
        assertThat(out.toString())
                .contains("Scene check report")
                .contains(scene + " [scene]")
                .contains("OK: 2 root(s), 3 entities, 3 components")
                .contains("asset TEXTURE: player.png")
                .contains("asset PREFAB: enemies/goblin.prefab")
                .contains(prefab + " [prefab]")
                .contains("2 passed, 0 failed");
    }

    @Test
    void testCheckReportsParseFailure() throws IOException {
        Path good = write("good.scene", "A { }");
        Path bad = write("bad.scene", "{ not a valid scene }");

        int exitCode = run("check", good, bad);

        assertThat(exitCode).isEqualTo(SceneToolCommand.EXIT_FAILED);
        assertThat(out.toString())
                .contains("FAILED: scene: Failed to parse 'bad.scene'")
                .contains("1 passed, 1 failed");
    }

    @Test
    void testPrefabModeRejectsSeveralRoots() throws IOException {
        Path file = write("two.scene", "A { }\nB { }");

        assertThat(run("check", file)).isEqualTo(SceneToolCommand.EXIT_OK);
        assertThat(run("check", "--prefab", file)).isEqualTo(SceneToolCommand.EXIT_FAILED);
        assertThat(out.toString()).contains("Unexpected content after entity");
    }

    @Test
    void testFormatToStdout() throws IOException {
        Path file = write("messy.prefab", "Entity   Player @( 1 ,2 ){Health:5 Tag:{ }}");

        int exitCode = run("format", file);

        assertThat(exitCode).isEqualTo(SceneToolCommand.EXIT_OK);
        assertThat(out.toString()).isEqualTo("""
                Player @(1, 2) {
                    Health: 5
                    Tag: {}
                }
                """);
    }

    @Test
    void testFormatToFile() throws IOException {
        Path file = write("in.scene", "A { Health: 1 } B { }");
        Path target = tempDir.resolve("out.scene");

        assertThat(run("format", file, "-o", target)).isEqualTo(SceneToolCommand.EXIT_OK);
        assertThat(Files.readString(target)).isEqualTo("A {\n    Health: 1\n}\n\nB {\n}\n");

        assertThat(run("format", file, "-o", target)).isEqualTo(SceneToolCommand.EXIT_USAGE);
        assertThat(run("format", file, "-o", target, "--force")).isEqualTo(SceneToolCommand.EXIT_OK);
    }

    @Test
    void testAssets() throws IOException {
        Path file = write("level.scene", """
                A {
                    Sprite: { texture: "a.png" }
                    Music: "theme.xm"
                }
                B { Sprite: { texture: "a.png" } }
                """);

        assertThat(run("assets", file)).isEqualTo(SceneToolCommand.EXIT_OK);
        assertThat(out.toString().lines()).containsExactly("TEXTURE\ta.png", "MUSIC\ttheme.xm");
    }

    @Test
    void testUsageErrors() throws IOException {
        Path file = write("a.scene", "A { }");

        assertThat(run("check")).isEqualTo(SceneToolCommand.EXIT_USAGE);
        assertThat(run("check", "--scene", "--prefab", file)).isEqualTo(SceneToolCommand.EXIT_USAGE);
        assertThat(run("check", tempDir.resolve("missing.scene"))).isEqualTo(SceneToolCommand.EXIT_USAGE);
        assertThat(run("format", file, file)).isEqualTo(SceneToolCommand.EXIT_USAGE);
        assertThat(run()).isEqualTo(SceneToolCommand.EXIT_USAGE);
    }
}
