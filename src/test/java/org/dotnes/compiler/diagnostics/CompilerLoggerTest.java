package org.dotnes.compiler.diagnostics;

import org.dotnes.junit.extensions.logging.ExpectLog;
import org.dotnes.junit.extensions.logging.LogLevel;
import org.dotnes.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import static org.assertj.core.api.Assertions.assertThat;

@ExtendWith(LogWatchExtension.class)
public class CompilerLoggerTest {

    @AfterEach
    void restoreLevel() {
        CompilerLogger.setLevel(CompilerLogger.INFO);
    }

    @Test
    @Tag("unit")
    void levelIsClamped() {
        CompilerLogger.setLevel(-3);
        assertThat(CompilerLogger.getLevel()).isEqualTo(CompilerLogger.ERROR);

        CompilerLogger.setLevel(9);
        assertThat(CompilerLogger.getLevel()).isEqualTo(CompilerLogger.TRACE);
    }

    @Test
    @Tag("unit")
    @ExpectLog(level = LogLevel.WARN, messagePattern = "shown")
    void messagesAboveTheLevelAreDropped() {
        CompilerLogger.setLevel(CompilerLogger.WARN);

        CompilerLogger.info("hidden");
        CompilerLogger.warn("shown");
    }

    @Test
    @Tag("unit")
    @ExpectLog(level = LogLevel.ERROR, messagePattern = "always")
    void errorsAreLoggedAtEveryLevel() {
        CompilerLogger.setLevel(CompilerLogger.ERROR);

        CompilerLogger.error("always");
        CompilerLogger.debug("never");
    }
}
