package org.neurosync.cli;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.neurosync.config.LoggingConfigurator;
import org.neurosync.junit.extensions.logging.AllowLog;
import org.neurosync.junit.extensions.logging.LogLevel;
import org.neurosync.junit.extensions.logging.LogWatchExtension;
import org.neurosync.test.utils.FakeAnnotationBackend;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.util.Base64;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("integration")
@ExtendWith(LogWatchExtension.class)
@AllowLog(level = LogLevel.WARN, loggerPattern = "(io\\.javalin|org\\.eclipse\\.jetty).*")
class CommandLineInterfaceTest {

    private FakeAnnotationBackend backend;
    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() {
        backend = FakeAnnotationBackend.start();
        out = new StringWriter();
        err = new StringWriter();
    }

    @AfterEach
    void tearDown() {
        backend.close();
        LoggingConfigurator.reset();
    }

    private int run(String... args) {
        CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setOut(new PrintWriter(out, true));
        commandLine.setErr(new PrintWriter(err, true));
        return commandLine.execute(args);
    }

    private String source(String query) {
        return backend.url("/v2/mito" + query);
    }

    @Test
    void commandName() {
        assertThat(new CommandLine(new CommandLineInterface()).getCommandName()).isEqualTo("neurosync");
    }

    @Test
    void noSubcommandPrintsUsage() {
        assertThat(run()).isZero();
        assertThat(out.toString()).contains("Usage: neurosync").contains("add-point").contains("delete");
    }

    @Test
    void addPoint_thenList() {
        // When
        int added = run("add-point", source("?user=alice"), "1", "2", "3", "--comment", "hello", "--title", "Soma");
        int listed = run("list", source("?user=alice"));

        // Then
        assertThat(added).isZero();
        assertThat(listed).isZero();
        assertThat(backend.entries()).containsKey("Pt1_2_3");
        assertThat(backend.entries().get("Pt1_2_3").get("user").asText()).isEqualTo("alice");
        assertThat(out.toString())
            .contains("Pt1_2_3[user:alice]")
            .contains("Soma: hello")
            .contains("1 annotation(s)");
    }

    @Test
    void addPoint_sendsLiteralToken() {
        String token = "h." + Base64.getUrlEncoder().withoutPadding()
            .encodeToString("{\"user\":\"alice\"}".getBytes(StandardCharsets.UTF_8)) + ".s";

        int exitCode = run("add-point", source("?token=" + token), "4", "5", "6");

        assertThat(exitCode).isZero();
        assertThat(out.toString().trim()).isEqualTo("Pt4_5_6[user:alice]");
        assertThat(backend.authorizations()).containsOnly("Bearer " + token);
    }

    @Test
    void addPoint_conflictsWithExistingAnnotation() throws Exception {
        backend.put("Pt1_2_3", "{\"kind\":\"point\",\"pos\":[1,2,3],\"user\":\"alice\"}");

        int exitCode = run("add-point", source("?user=alice"), "1", "2", "3");

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("Cannot overwrite existing annotation: Pt1_2_3[user:alice]");
        assertThat(backend.requests()).containsExactly("GET /v2/annotations/mito");
    }

    @Test
    void delete_ownAnnotation() throws Exception {
        backend.put("Pt1_2_3", "{\"kind\":\"point\",\"pos\":[1,2,3],\"user\":\"alice\"}");

        int exitCode = run("delete", source("?user=alice"), "Pt1_2_3[user:alice]");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("Deleted Pt1_2_3[user:alice]");
        assertThat(backend.entries()).isEmpty();
    }

    @Test
    void delete_foreignAnnotationIsRefused() throws Exception {
        backend.put("Pt1_2_3", "{\"kind\":\"point\",\"pos\":[1,2,3],\"user\":\"bob\"}");

        int exitCode = run("delete", source("?user=alice"), "Pt1_2_3[user:bob]");

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("Unable to delete annotation owned by bob.");
        assertThat(backend.entries()).containsKey("Pt1_2_3");
    }

    @Test
    void list_asJson() throws Exception {
        backend.put("Sp0_0_0_4_0_0", "{\"kind\":\"sphere\",\"pos\":[0,0,0,4,0,0],\"user\":\"alice\",\"verified\":true}");

        int exitCode = run("list", source("?user=alice"), "--format", "json");

        assertThat(exitCode).isZero();
        assertThat(out.toString())
            .contains("\"id\" : \"Sp0_0_0_4_0_0[user:alice]\"")
            .contains("\"type\" : \"SPHERE\"")
            .contains("\"checked\" : true");
    }

    @Test
    void list_unknownFormat() {
        assertThat(run("list", source("?user=alice"), "-f", "xml")).isEqualTo(2);
        assertThat(err.toString()).contains("Unknown format: xml");
    }

    @Test
    void invalidSourceUrl() {
        assertThat(run("list", "not-a-url")).isEqualTo(1);
        assertThat(err.toString()).contains("Invalid annotation source URL");
    }

    @Test
    void missingConfigFile() {
        assertThat(run("-c", "/does/not/exist.conf", "list", source(""))).isEqualTo(2);
        assertThat(err.toString()).contains("was not found");
    }
}
