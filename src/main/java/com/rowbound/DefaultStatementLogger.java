/*
 * Copyright 2015-2022 Transmogrify LLC, 2022-2026 Revetware LLC.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.rowbound;

import org.jspecify.annotations.NonNull;

import javax.annotation.concurrent.ThreadSafe;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;
import static java.util.stream.Collectors.joining;

/**
 * Basic implementation of {@link StatementLogger} which logs via <a href="https://docs.oracle.com/en/java/javase/17/docs/api/java.logging/java/util/logging/package-summary.html">java.util.logging</a>.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
public class DefaultStatementLogger implements StatementLogger {
	@NonNull
	public static final String DEFAULT_LOGGER_NAME = "com.rowbound.SQL";
	@NonNull
	public static final Level DEFAULT_LOGGER_LEVEL = Level.FINE;

	/**
	 * The point at which we ellipsize output for parameters.
	 */
	private static final int MAXIMUM_PARAMETER_LOGGING_LENGTH = 100;

	/**
	 * Write chunks can carry tens of thousands of parameters; only this many are printed.
	 */
	private static final int MAXIMUM_PARAMETERS_LOGGED = 50;

	@NonNull
	private final Logger logger;
	@NonNull
	private final Level loggerLevel;

	/**
	 * Creates a new statement logger with the default logger name <code>{@value #DEFAULT_LOGGER_NAME}</code> and level.
	 */
	public DefaultStatementLogger() {
		this(DEFAULT_LOGGER_NAME, DEFAULT_LOGGER_LEVEL);
	}

	/**
	 * Creates a new statement logger with the given logger name and level.
	 *
	 * @param loggerName  the logger name to use
	 * @param loggerLevel the logger level to use
	 */
	public DefaultStatementLogger(@NonNull String loggerName,
																@NonNull Level loggerLevel) {
		requireNonNull(loggerName);
		requireNonNull(loggerLevel);

		this.logger = Logger.getLogger(loggerName);
		this.loggerLevel = loggerLevel;
	}

	@Override
	public void log(@NonNull StatementLog statementLog) {
		requireNonNull(statementLog);

		if (getLogger().isLoggable(getLoggerLevel()))
			getLogger().log(getLoggerLevel(), formatStatementLog(statementLog));
	}

	@NonNull
	protected String formatStatementLog(@NonNull StatementLog statementLog) {
		requireNonNull(statementLog);

		List<String> timingEntries = new ArrayList<>(4);

		statementLog.getConnectionAcquisitionDuration().ifPresent(duration -> timingEntries.add(format("%s acquiring connection", duration)));
		statementLog.getPreparationDuration().ifPresent(duration -> timingEntries.add(format("%s preparing statement", duration)));
		statementLog.getExecutionDuration().ifPresent(duration -> timingEntries.add(format("%s executing statement", duration)));
		statementLog.getResultSetMappingDuration().ifPresent(duration -> timingEntries.add(format("%s processing resultset", duration)));

		List<String> lines = new ArrayList<>(5);

		lines.add(statementLog.getSql());

		List<Object> parameters = statementLog.getParameters();

		if (parameters.size() > 0) {
			String parameterLine = parameters.stream()
					.limit(MAXIMUM_PARAMETERS_LOGGED)
					.map(parameter -> formatParameter(parameter))
					.collect(joining(", ", "Parameters: ", parameters.size() > MAXIMUM_PARAMETERS_LOGGED
							? format(", ...(%d more)", parameters.size() - MAXIMUM_PARAMETERS_LOGGED) : ""));

			lines.add(parameterLine);
		}

		statementLog.getRowCount().ifPresent(rowCount -> lines.add(format("Rows in chunk: %d", rowCount)));

		if (timingEntries.size() > 0)
			lines.add(timingEntries.stream().collect(joining(", ")));

		Throwable exception = statementLog.getException().orElse(null);

		if (exception != null) {
			if (exception instanceof DatabaseException && exception.getCause() != null)
				exception = exception.getCause();

			lines.add(format("Failed due to %s", exception.toString()));
		}

		return lines.stream().collect(joining("\n"));
	}

	@NonNull
	protected String formatParameter(Object parameter) {
		if (parameter == null)
			return "null";

		if (parameter instanceof Number)
			return format("%s", parameter);

		if (parameter instanceof byte[])
			return format("[byte array of length %d]", ((byte[]) parameter).length);

		return format("'%s'", ellipsize(parameter.toString(), MAXIMUM_PARAMETER_LOGGING_LENGTH));
	}

	/**
	 * Ellipsizes the given {@code string}, capping at {@code maximumLength}.
	 *
	 * @param string        the string to ellipsize
	 * @param maximumLength the maximum length of the ellipsized string, not including ellipsis
	 * @return an ellipsized version of {@code string}
	 */
	@NonNull
	protected String ellipsize(@NonNull String string,
														 int maximumLength) {
		requireNonNull(string);

		string = string.trim();

		if (string.length() <= maximumLength)
			return string;

		return format("%s...", string.substring(0, maximumLength));
	}

	@NonNull
	protected Logger getLogger() {
		return this.logger;
	}

	@NonNull
	protected Level getLoggerLevel() {
		return this.loggerLevel;
	}
}
