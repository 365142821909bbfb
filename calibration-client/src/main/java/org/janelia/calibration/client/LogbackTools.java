package org.janelia.calibration.client;

import java.io.File;
import java.text.SimpleDateFormat;
import java.util.Date;

import org.janelia.calibration.util.FileUtil;
import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.Appender;
import ch.qos.logback.core.FileAppender;
import ch.qos.logback.core.OutputStreamAppender;

import static org.slf4j.Logger.ROOT_LOGGER_NAME;

/**
 * Tools for attaching additional logback appenders from code.
 */
public class LogbackTools {

    public static final String CONSOLE_APPENDER_NAME = "STDOUT";
    public static final String ROOT_FILE_APPENDER_NAME = "rootFileAppender";

    /**
     * Copies root logger output to a timestamped file in the specified directory.
     *
     * @return the log file.
     */
    public static File setRootFileAppenderWithTimestamp(final File logDirectory,
                                                        final String logFileNamePrefix) {
        FileUtil.ensureWritableDirectory(logDirectory);
        final SimpleDateFormat sdf = new SimpleDateFormat("yyyyMMdd_HHmmss");
        final String logFileName = logFileNamePrefix + "." + sdf.format(new Date()) + ".log";
        final File logFile = new File(logDirectory, logFileName);
        setRootFileAppender(logFile);
        return logFile;
    }

    /**
     * Copies root logger output to the specified file using the console appender's encoder.
     *
     * @throws IllegalStateException
     *   if the logging configuration has no {@value #CONSOLE_APPENDER_NAME} appender.
     */
    public static void setRootFileAppender(final File logFile)
            throws IllegalStateException {

        final LoggerContext loggerContext = (LoggerContext) LoggerFactory.getILoggerFactory();
        final Logger rootLogger = loggerContext.getLogger(ROOT_LOGGER_NAME);
        final Appender<ILoggingEvent> consoleAppender = rootLogger.getAppender(CONSOLE_APPENDER_NAME);

        if (! (consoleAppender instanceof OutputStreamAppender)) {
            throw new IllegalStateException("root logger does not have a '" + CONSOLE_APPENDER_NAME + "' appender");
        }

        // detach previous file appender if it already exists
        if (rootLogger.getAppender(ROOT_FILE_APPENDER_NAME) != null) {
            rootLogger.detachAppender(ROOT_FILE_APPENDER_NAME);
        }

        final FileAppender<ILoggingEvent> fileAppender = new FileAppender<>();
        fileAppender.setName(ROOT_FILE_APPENDER_NAME);
        fileAppender.setFile(logFile.getAbsolutePath());
        fileAppender.setEncoder(((OutputStreamAppender<ILoggingEvent>) consoleAppender).getEncoder());
        fileAppender.setContext(loggerContext);
        fileAppender.start();
        rootLogger.addAppender(fileAppender);
    }
}
