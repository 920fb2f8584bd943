package com.edafunc;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the entry point's exit code handling.
 */
class EdaFuncApplicationTest {

    @Test
    @DisplayName("no shutdown is reported while the JVM runs normally")
    void shutdownInProgress_falseWhileRunning() {
        assertFalse(EdaFuncApplication.shutdownInProgress());
    }

    @Test
    @DisplayName("a handler of neither shape fails startup with exit code 1")
    void invalidHandler_exitsWithOne() {
        int exitCode = EdaFuncApplication.start("not a handler",
                "--spring.main.web-application-type=none",
                "--eda.routing.file=target/no-such-routing.yaml");

        assertEquals(1, exitCode);
    }
}
