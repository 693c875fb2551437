/**
 * License: GPL
 *
 * This program is free software; you can redistribute it and/or
 * modify it under the terms of the GNU General Public License 2
 * as published by the Free Software Foundation.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with this program; if not, write to the Free Software
 * Foundation, Inc., 59 Temple Place - Suite 330, Boston, MA  02111-1307, USA.
 */
package org.rephoto.alignment.util;

import java.io.File;

import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.Appender;
import ch.qos.logback.core.FileAppender;
import ch.qos.logback.core.OutputStreamAppender;
import ch.qos.logback.core.encoder.Encoder;

import static org.slf4j.Logger.ROOT_LOGGER_NAME;

/**
 * Tools for adjusting logback logging from code (used by command line tools).
 */
public class LogbackTools {

    public static void setRootLogLevel(final String levelName)
            throws IllegalArgumentException {
        final Level level = Level.toLevel(levelName, null);
        if (level == null) {
            throw new IllegalArgumentException("invalid log level '" + levelName + "'");
        }
        setLogLevel(ROOT_LOGGER_NAME, level);
    }

    public static void setLogLevel(final String loggerName,
                                   final Level logLevel) {
        getLogger(loggerName).setLevel(logLevel);
    }

    /**
     * Adds (or replaces) a root file appender that writes events with the same pattern as the console appender.
     */
    public static void setRootFileAppender(final File logFile) {

        final Logger rootLogger = getLogger(ROOT_LOGGER_NAME);

        // the replaced appender must release its file before another appender can open the same path
        final Appender<ILoggingEvent> existingAppender = rootLogger.getAppender(ROOT_FILE_APPENDER_NAME);
        if (existingAppender != null) {
            existingAppender.stop();
            rootLogger.detachAppender(existingAppender);
        }

        final FileAppender<ILoggingEvent> fileAppender = new FileAppender<>();
        fileAppender.setName(ROOT_FILE_APPENDER_NAME);
        fileAppender.setFile(logFile.getAbsolutePath());
        fileAppender.setContext(rootLogger.getLoggerContext());
        fileAppender.setEncoder(buildEncoder(rootLogger));
        fileAppender.start();
        rootLogger.addAppender(fileAppender);
    }

    private static Logger getLogger(final String loggerName) {
        final LoggerContext loggerContext = (LoggerContext) LoggerFactory.getILoggerFactory();
        final Logger logger = loggerContext.getLogger(loggerName);
        if (logger == null) {
            throw new IllegalArgumentException("logger with name '" + loggerName + "' not found");
        }
        return logger;
    }

    private static Encoder<ILoggingEvent> buildEncoder(final Logger rootLogger) {

        final Appender<ILoggingEvent> consoleAppender = rootLogger.getAppender(CONSOLE_APPENDER_NAME);
        String pattern = DEFAULT_PATTERN;
        if (consoleAppender instanceof OutputStreamAppender) {
            final Encoder<ILoggingEvent> consoleEncoder =
                    ((OutputStreamAppender<ILoggingEvent>) consoleAppender).getEncoder();
            if (consoleEncoder instanceof PatternLayoutEncoder) {
                pattern = ((PatternLayoutEncoder) consoleEncoder).getPattern();
            }
        }

        final PatternLayoutEncoder encoder = new PatternLayoutEncoder();
        encoder.setContext(rootLogger.getLoggerContext());
        encoder.setPattern(pattern);
        encoder.start();
        return encoder;
    }

    public static final String CONSOLE_APPENDER_NAME = "STDOUT";
    public static final String ROOT_FILE_APPENDER_NAME = "rootFileAppender";

    private static final String DEFAULT_PATTERN = "%d{yyyy-MM-dd HH:mm:ss.SSS} [%thread] %-5level %logger{36} - %msg%n";
}
