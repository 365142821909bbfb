package org.janelia.calibration.client;

import java.io.File;
import java.text.SimpleDateFormat;
import java.util.Date;

import org.janelia.calibration.util.FileUtil;
import org.junit.After;
import org.junit.Assert;
import org.junit.Test;
import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.Appender;

import static org.slf4j.Logger.ROOT_LOGGER_NAME;

/**
 * Tests the {@link LogbackTools} class.
 */
public class LogbackToolsTest {

    private File logDirectory;

    @After
    public void tearDown() {
        final Logger rootLogger = getRootLogger();
        final Appender<ILoggingEvent> fileAppender = rootLogger.getAppender(LogbackTools.ROOT_FILE_APPENDER_NAME);
        if (fileAppender != null) {
            rootLogger.detachAppender(fileAppender);
            fileAppender.stop();
        }
        if (logDirectory != null) {
            FileUtil.deleteRecursive(logDirectory);
        }
    }

    @Test
    public void testSetRootFileAppenderWithTimestamp() {

        final SimpleDateFormat sdf = new SimpleDateFormat("yyyyMMddHHmmssSSS");
        logDirectory = new File("target", "test_logback_tools_" + sdf.format(new Date())).getAbsoluteFile();

        final File logFile = LogbackTools.setRootFileAppenderWithTimestamp(logDirectory, "master_bias");

        LoggerFactory.getLogger(LogbackToolsTest.class).warn("testSetRootFileAppenderWithTimestamp: logged");

        Assert.assertTrue("invalid log file name " + logFile.getName(),
                          logFile.getName().startsWith("master_bias.") && logFile.getName().endsWith(".log"));
        Assert.assertTrue("log file " + logFile + " should exist", logFile.exists());
        Assert.assertTrue("log file should contain the logged message", logFile.length() > 0);
        Assert.assertNotNull("file appender should be attached",
                             getRootLogger().getAppender(LogbackTools.ROOT_FILE_APPENDER_NAME));
    }

    private static Logger getRootLogger() {
        final LoggerContext loggerContext = (LoggerContext) LoggerFactory.getILoggerFactory();
        return loggerContext.getLogger(ROOT_LOGGER_NAME);
    }
}
