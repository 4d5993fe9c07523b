package com.phillippitts.actiontracker.service.sink;

import org.apache.logging.log4j.Logger;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class LoggerSummarySinkTest {

    @Test
    void writesAtInfoOnNewLine() {
        Logger logger = mock(Logger.class);
        LoggerSummarySink sink = new LoggerSummarySink(logger);

        sink.write("| users |");

        verify(logger).info("\n{}", (Object) "| users |");
    }

    @Test
    void defaultConstructorUsesNamedLogger() {
        assertThatCode(() -> new LoggerSummarySink().write("hello")).doesNotThrowAnyException();
    }
}
