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

import org.hsqldb.jdbc.JDBCDataSource;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.stream.Collectors;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
public class DefaultStatementLoggerTests {
	public record Employee(Long id, String name) {}

	@Test
	public void testLogsSqlParametersAndChunkRowCount() {
		List<Object> parameters = new ArrayList<>();

		for (int i = 0; i < 60; ++i)
			parameters.add(i);

		StatementLog statementLog = StatementLog.withSql("insert ignore into employee(id) values (?)")
				.parameters(parameters)
				.rowCount(60)
				.build();

		List<String> messages = captureLog(DefaultStatementLogger.DEFAULT_LOGGER_NAME, Level.FINE,
				() -> new DefaultStatementLogger().log(statementLog));

		Assertions.assertEquals(1, messages.size());

		List<String> lines = Arrays.asList(messages.get(0).split("\n"));

		Assertions.assertEquals(3, lines.size(), messages.get(0));
		Assertions.assertEquals("insert ignore into employee(id) values (?)", lines.get(0));
		Assertions.assertTrue(lines.get(1).startsWith("Parameters: 0, 1, 2, "), lines.get(1));
		Assertions.assertTrue(lines.get(1).endsWith(", 48, 49, ...(10 more)"), lines.get(1));
		Assertions.assertFalse(lines.get(1).contains(" 50,"), lines.get(1));
		Assertions.assertEquals("Rows in chunk: 60", lines.get(2));
	}

	@Test
	public void testEllipsizesParametersAndReportsUnderlyingFailure() {
		String longValue = "x".repeat(150);

		StatementLog statementLog = StatementLog.withSql("delete from employee where id < ?")
				.parameters(Arrays.<Object>asList(longValue, null, new byte[3]))
				.exception(new DatabaseException("Unable to delete", new SQLException("boom")))
				.build();

		List<String> messages = captureLog(DefaultStatementLogger.DEFAULT_LOGGER_NAME, Level.FINE,
				() -> new DefaultStatementLogger().log(statementLog));

		List<String> lines = Arrays.asList(messages.get(0).split("\n"));

		Assertions.assertEquals(format("Parameters: '%s...', null, [byte array of length 3]", "x".repeat(100)), lines.get(1));
		Assertions.assertEquals("Failed due to java.sql.SQLException: boom", lines.get(lines.size() - 1));
	}

	@Test
	public void testNothingIsFormattedBelowLoggerLevel() {
		String loggerName = "com.rowbound.SQL.quiet";
		List<String> messages = captureLog(loggerName, Level.INFO,
				() -> new DefaultStatementLogger(loggerName, Level.FINE).log(StatementLog.withSql("select 1").build()));

		Assertions.assertEquals(List.of(), messages);
	}

	@Test
	public void testLogsEveryChunkOfModelWrite() {
		JDBCDataSource dataSource = new JDBCDataSource();
		dataSource.setUrl("jdbc:hsqldb:mem:statement_logger_write;sql.syntax_mys=true");
		dataSource.setUser("sa");
		dataSource.setPassword("");

		Model model = Model.withDataSourceRegistry(DataSourceRegistry.withDataSourceFactory((dataSourceName) -> dataSource))
				.driverName("mysql")
				.dataSourceName("statement_logger_write")
				.batchSize(2)
				.statementLogger(new DefaultStatementLogger())
				.build();

		List<String> messages = captureLog(DefaultStatementLogger.DEFAULT_LOGGER_NAME, Level.FINE, () -> {
			model.execute("CREATE TABLE employee (id BIGINT PRIMARY KEY, name VARCHAR(64))");
			model.create("employee", List.of(new Employee(1L, "a"), new Employee(2L, "b"), new Employee(3L, "c")));
		});

		List<String> insertMessages = messages.stream()
				.filter(message -> message.startsWith("insert ignore into employee(id,name) values "))
				.collect(Collectors.toList());

		Assertions.assertEquals(2, insertMessages.size(), messages.toString());
		Assertions.assertTrue(insertMessages.get(0).startsWith("insert ignore into employee(id,name) values (?,?),(?,?)\n"));
		Assertions.assertTrue(insertMessages.get(0).contains("Parameters: 1, 'a', 2, 'b'"), insertMessages.get(0));
		Assertions.assertTrue(insertMessages.get(0).contains("\nRows in chunk: 2"), insertMessages.get(0));
		Assertions.assertTrue(insertMessages.get(1).contains("\nRows in chunk: 1"), insertMessages.get(1));
	}

	@NonNull
	protected List<String> captureLog(@NonNull String loggerName,
																		@Nullable Level level,
																		@NonNull Runnable runnable) {
		requireNonNull(loggerName);
		requireNonNull(runnable);

		Logger logger = Logger.getLogger(loggerName);
		Level originalLevel = logger.getLevel();
		List<String> messages = new CopyOnWriteArrayList<>();

		Handler handler = new Handler() {
			@Override
			public void publish(LogRecord logRecord) {
				messages.add(logRecord.getMessage());
			}

			@Override
			public void flush() {}

			@Override
			public void close() {}
		};

		logger.addHandler(handler);
		logger.setLevel(level);

		try {
			runnable.run();
		} finally {
			logger.removeHandler(handler);
			logger.setLevel(originalLevel);
		}

		return messages;
	}
}
