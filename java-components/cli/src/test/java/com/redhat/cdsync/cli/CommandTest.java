package com.redhat.cdsync.cli;

import static com.github.stefanbirkner.systemlambda.SystemLambda.tapSystemOut;
import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicInteger;

import jakarta.inject.Inject;

import org.junit.jupiter.api.Test;

import com.redhat.cdsync.engine.app.ApplicationRepository;
import com.redhat.cdsync.engine.pipeline.PipelineOutcome;
import com.redhat.cdsync.resources.model.v1alpha1.ModelConstants;

import io.quarkus.test.junit.QuarkusTest;
import picocli.CommandLine;

@QuarkusTest
public class CommandTest {

    @Inject
    CommandLine.IFactory factory;

    @Inject
    ApplicationRepository applications;

    @Inject
    StubPipelineEngine pipelineEngine;

    @Test
    public void testCreateSyncAndDelete() throws Exception {
        Path repo = createRepository();
        assertThat(run("create-application", "web", "--repo", repo.toString(), "--path", "app",
                "--dest-namespace", "web-prod", "--prune").exitCode).isEqualTo(ExitCodes.SUCCESS);
        assertThat(applications.get("web").getSpec().getSyncPolicy().isPrune()).isTrue();

        Result dryRun = run("sync", "web", "--dry-run");
        assertThat(dryRun.exitCode).isEqualTo(ExitCodes.SUCCESS);
        assertThat(dryRun.out).contains("ConfigMap/web-prod/settings   Create   Planned");
        assertThat(applications.get("web").getStatus().getPhase()).isEqualTo(ModelConstants.PHASE_IDLE);

        Result sync = run("sync", "web");
        assertThat(sync.exitCode).isEqualTo(ExitCodes.SUCCESS);
        assertThat(sync.out).contains("ConfigMap/web-prod/settings   Create   Applied");
        assertThat(sync.out).contains("Sync Settled");

        Result status = run("get-status", "web");
        assertThat(status.exitCode).isEqualTo(ExitCodes.SUCCESS);
        assertThat(status.out).contains("Phase:            Settled");
        assertThat(status.out).contains("Destination:      web-prod");

        Result json = run("get-status", "web", "--json");
        assertThat(json.exitCode).isEqualTo(ExitCodes.SUCCESS);
        assertThat(json.out).contains("\"application\" : \"web\"");

        Result delete = run("delete-application", "web", "--cascade");
        assertThat(delete.exitCode).isEqualTo(ExitCodes.SUCCESS);
        assertThat(delete.out).contains("deleted with 1 owned objects");
        assertThat(applications.find("web")).isEmpty();
    }

    @Test
    public void testRenderFailureExitsWithSyncFailure() throws Exception {
        Path repo = createRepository();
        Files.writeString(repo.resolve("app").resolve("broken.yaml"), "kind: [unterminated\n");
        assertThat(run("create-application", "broken", "--repo", repo.toString(), "--path", "app",
                "--dest-namespace", "web-prod").exitCode).isEqualTo(ExitCodes.SUCCESS);

        Result sync = run("sync", "broken");
        assertThat(sync.exitCode).isEqualTo(ExitCodes.SYNC_FAILURE);
        assertThat(sync.out).contains("RenderError");

        Result status = run("get-status", "broken");
        assertThat(status.exitCode).isEqualTo(ExitCodes.SUCCESS);
        assertThat(status.out).contains("Error:            RenderError");
    }

    @Test
    public void testUserErrors() throws Exception {
        assertThat(run("get-status", "does-not-exist").exitCode).isEqualTo(ExitCodes.USER_ERROR);
        assertThat(run("sync", "does-not-exist").exitCode).isEqualTo(ExitCodes.USER_ERROR);
        assertThat(run("delete-application", "does-not-exist").exitCode).isEqualTo(ExitCodes.USER_ERROR);
        assertThat(run("create-application", "no-repo", "--path", "app", "--dest-namespace", "web-prod").exitCode)
                .isEqualTo(ExitCodes.USER_ERROR);
        assertThat(run("create-application", "bad-namespace", "--repo", "/tmp", "--path", "app",
                "--dest-namespace", "Not_A_Namespace").exitCode).isEqualTo(ExitCodes.USER_ERROR);
        assertThat(run("pipeline", "await", "missing-run", "--timeout", "1s").exitCode)
                .isEqualTo(ExitCodes.USER_ERROR);
        assertThat(run("pipeline", "await", "missing-run", "--timeout", "soon").exitCode)
                .isEqualTo(ExitCodes.USER_ERROR);
    }

    @Test
    public void testPipelineSubmitAndAwait() throws Exception {
        Result submit = run("pipeline", "submit", "--source-ref", "main", "--image-tag", "quay.io/acme/demo-app:latest");
        assertThat(submit.exitCode).isEqualTo(ExitCodes.SUCCESS);
        String runId = submit.lastLine();
        assertThat(runId).startsWith("stub-build-");

        Result pending = run("pipeline", "await", runId, "--timeout", "100ms");
        assertThat(pending.exitCode).isEqualTo(ExitCodes.SYNC_FAILURE);
        assertThat(pending.out).contains("still Pending");

        pipelineEngine.finish(runId, PipelineOutcome.SUCCEEDED, "sha256:0123", null);
        Result done = run("pipeline", "await", runId, "--timeout", "5s");
        assertThat(done.exitCode).isEqualTo(ExitCodes.SUCCESS);
        assertThat(done.out).contains(runId + " Succeeded quay.io/acme/demo-app:latest@sha256:0123");

        Result again = run("pipeline", "await", runId);
        assertThat(again.exitCode).isEqualTo(ExitCodes.SUCCESS);
        assertThat(again.out).contains(runId + " Succeeded quay.io/acme/demo-app:latest@sha256:0123");
    }

    @Test
    public void testFailedPipeline() throws Exception {
        String runId = run("pipeline", "submit", "--source-ref", "main", "--image-tag", "quay.io/acme/other").lastLine();
        pipelineEngine.finish(runId, PipelineOutcome.FAILED, null, "build step failed");

        Result done = run("pipeline", "await", runId, "--timeout", "5s");
        assertThat(done.exitCode).isEqualTo(ExitCodes.SYNC_FAILURE);
        assertThat(done.out).contains("Failed: build step failed");
    }

    private Result run(String... args) throws Exception {
        AtomicInteger exitCode = new AtomicInteger();
        String out = tapSystemOut(() -> exitCode.set(Main.commandLine(factory).execute(args)));
        return new Result(exitCode.get(), out);
    }

    private static Path createRepository() throws IOException {
        Path repo = Files.createTempDirectory("cdsync-cli-test");
        Path app = Files.createDirectories(repo.resolve("app"));
        Files.writeString(app.resolve("settings.yaml"), """
                apiVersion: v1
                kind: ConfigMap
                metadata:
                  name: settings
                data:
                  mode: blue
                """);
        return repo;
    }

    record Result(int exitCode, String out) {

        String lastLine() {
            return out.lines().filter(l -> !l.isBlank()).reduce((first, second) -> second).orElse("").trim();
        }
    }
}
