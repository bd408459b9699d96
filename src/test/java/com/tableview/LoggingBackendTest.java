package com.tableview;

import com.tableview.tree.TreeRenderer;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class LoggingBackendTest {

    @Test
    public void testSlf4jBindsToLog4j() {
        assertEquals("org.apache.logging.slf4j.Log4jLoggerFactory",
            LoggerFactory.getILoggerFactory().getClass().getName());

        Logger log = LoggerFactory.getLogger(LoggingBackendTest.class);
        assertDoesNotThrow(() -> log.warn("backend check {}", 1));
    }

    @Test
    public void testLog4jApiMatchesCore() throws ClassNotFoundException {
        Package api = Class.forName("org.apache.logging.log4j.LogManager").getPackage();
        Package core = Class.forName("org.apache.logging.log4j.core.LoggerContext").getPackage();
        assertEquals(core.getImplementationVersion(), api.getImplementationVersion());
    }

    @Test
    public void testClassesWithLoggersInitialize() {
        assertEquals(1, new TreeRenderer().render(Map.of("a", 1)).size());
    }
}
