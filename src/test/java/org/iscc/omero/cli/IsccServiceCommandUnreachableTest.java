package org.iscc.omero.cli;

import io.quarkus.test.junit.QuarkusTestProfile;
import io.quarkus.test.junit.TestProfile;
import io.quarkus.test.junit.main.LaunchResult;
import io.quarkus.test.junit.main.QuarkusMainLauncher;
import io.quarkus.test.junit.main.QuarkusMainTest;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@QuarkusMainTest
@TestProfile(IsccServiceCommandUnreachableTest.SingleAttempt.class)
class IsccServiceCommandUnreachableTest {

    public static class SingleAttempt implements QuarkusTestProfile {
        @Override
        public Map<String, String> getConfigOverrides() {
            return Map.of("omero-iscc.startup-connect-attempts", "1");
        }
    }

    @Test
    void shouldExitWhenRepositoryIsUnreachable(QuarkusMainLauncher launcher) {
        LaunchResult result = launcher.launch("--once", "--repository-root", "/nonexistent/omero-repository");

        assertEquals(IsccServiceCommand.EXIT_REPOSITORY_UNREACHABLE, result.exitCode());
    }
}
