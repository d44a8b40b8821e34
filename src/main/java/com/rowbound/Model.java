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
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;
import javax.annotation.concurrent.ThreadSafe;
import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.lang.System.nanoTime;
import static java.util.Objects.requireNonNull;
import static java.util.logging.Level.INFO;
import static java.util.logging.Level.WARNING;

/**
 * Main class for reading and writing records against one MySQL data source.
 * <p>
 * A {@code Model} binds lazily: nothing is validated and no pool is created until its first operation, at which point
 * the {@link DataSourceRegistry} hands back the shared pool for this model's driver and data-source names.
 * <pre>{@code  Model model = Model.withDataSourceRegistry(registry)
 *   .driverName("mysql")
 *   .dataSourceName("jdbc:mysql://localhost:3306/app?user=app&password=secret")
 *   .build();
 *
 * model.create("users", List.of(new User(1L, "a"), new User(2L, "b")));
 * List<User> users = model.read("users", List.of("id", "name"), "where id > 0 order by id", User.class);}</pre>
 * Writes are safe to issue concurrently, each in its own transaction. The result of the most recent
 * {@link #read(String, List, String, Class)} is stored on the model, so reads are not.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@NotThreadSafe
public final class Model {
	/**
	 * Upper bound on records per write statement when the builder does not specify one.
	 */
	public static final int DEFAULT_BATCH_SIZE = 4096;

	@NonNull
	private final DataSourceRegistry dataSourceRegistry;
	@Nullable
	private final String driverName;
	@Nullable
	private final String dataSourceName;
	@NonNull
	private final Integer batchSize;
	@NonNull
	private final SchemaExtractor schemaExtractor;
	@NonNull
	private final ResultSetMapper resultSetMapper;
	@NonNull
	private final PreparedStatementBinder preparedStatementBinder;
	@NonNull
	private final InstanceProvider instanceProvider;
	@NonNull
	private final StatementLogger statementLogger;
	@NonNull
	private final Logger logger;

	@Nullable
	private volatile DataSource dataSource;
	@NonNull
	private volatile DatabaseOperationSupportStatus executeLargeUpdateSupported;

	@NonNull
	private List<@NonNull Object> records;
	@NonNull
	private List<@NonNull List<@Nullable Object>> rows;
	@NonNull
	private List<@NonNull ReadFailure> readFailures;

	protected Model(@NonNull Builder builder) {
		requireNonNull(builder);

		this.dataSourceRegistry = requireNonNull(builder.dataSourceRegistry);
		this.driverName = builder.driverName;
		this.dataSourceName = builder.dataSourceName;
		this.batchSize = builder.batchSize == null ? DEFAULT_BATCH_SIZE : builder.batchSize;
		this.schemaExtractor = builder.schemaExtractor == null ? SchemaExtractor.withDefaultConfiguration() : builder.schemaExtractor;
		this.resultSetMapper = builder.resultSetMapper == null ? ResultSetMapper.withDefaultConfiguration() : builder.resultSetMapper;
		this.preparedStatementBinder = builder.preparedStatementBinder == null ? PreparedStatementBinder.withDefaultConfiguration() : builder.preparedStatementBinder;
		this.instanceProvider = builder.instanceProvider == null ? new InstanceProvider() {} : builder.instanceProvider;
		this.statementLogger = builder.statementLogger == null ? (statementLog) -> {} : builder.statementLogger;
		this.logger = Logger.getLogger(getClass().getName());
		this.executeLargeUpdateSupported = DatabaseOperationSupportStatus.UNKNOWN;
		this.records = List.of();
		this.rows = List.of();
		this.readFailures = List.of();

		if (this.batchSize < 1)
			throw new IllegalArgumentException(format("Batch size must be at least 1, was %d", this.batchSize));
	}

	/**
	 * Provides a {@link Model} builder backed by the given {@link DataSourceRegistry}.
	 *
	 * @param dataSourceRegistry supplies the pooled data source, shared with other models that use the same names
	 * @return a {@link Model} builder
	 */
	@NonNull
	public static Builder withDataSourceRegistry(@NonNull DataSourceRegistry dataSourceRegistry) {
		requireNonNull(dataSourceRegistry);
		return new Builder(dataSourceRegistry);
	}

	/**
	 * Executes raw SQL, typically DDL such as {@code CREATE TABLE}, outside of any transaction.
	 *
	 * @param sql the SQL to execute
	 * @return the number of rows affected, {@code 0} for statements that affect none
	 */
	@NonNull
	public Long execute(@NonNull String sql) {
		requireNonNull(sql);
		return executeUpdate(null, sql, List.of(), null);
	}

	/**
	 * Inserts {@code records} into {@code table}, skipping any that collide with an existing row on a unique key.
	 *
	 * @param table   the table to write to
	 * @param records non-empty collection of same-typed, non-null records
	 * @return the number of rows inserted
	 * @see #write(String, Collection, WriteMode)
	 */
	@NonNull
	public Long create(@NonNull String table,
										 @NonNull Collection<?> records) {
		return write(table, records, WriteMode.CREATE);
	}

	/**
	 * Inserts {@code records} into {@code table}, overwriting every mapped column of rows that collide on a unique key.
	 *
	 * @param table   the table to write to
	 * @param records non-empty collection of same-typed, non-null records
	 * @return MySQL's advisory affected-row count, see {@link WriteMode#UPDATE}
	 * @see #write(String, Collection, WriteMode)
	 */
	@NonNull
	public Long update(@NonNull String table,
										 @NonNull Collection<?> records) {
		return write(table, records, WriteMode.UPDATE);
	}

	/**
	 * Writes {@code records} to {@code table} in one transaction.
	 * <p>
	 * Records are sent in chunks of at most {@code min(batchSize, 65535 / columns)} rows, one multi-row
	 * {@code INSERT} per chunk. The affected-row counts of the chunks are summed.
	 * <p>
	 * If any chunk fails, the transaction is rolled back, later chunks are not attempted and a {@link WriteException}
	 * reports the rows affected before the failure. If the commit fails, the {@link WriteException} reports {@code 0}.
	 *
	 * @param table     the table to write to
	 * @param records   non-empty collection of same-typed, non-null records
	 * @param writeMode how to treat unique-key conflicts
	 * @return the summed affected-row count
	 * @throws IllegalArgumentException if {@code records} is empty, contains {@code null} or mixes types, or if the
	 *                                  record type has no columns; no SQL is executed
	 * @throws WriteException           if a chunk or the commit fails
	 */
	@NonNull
	public Long write(@NonNull String table,
										@NonNull Collection<?> records,
										@NonNull WriteMode writeMode) {
		requireNonNull(table);
		requireNonNull(records);
		requireNonNull(writeMode);

		RecordSchema<?> recordSchema = getSchemaExtractor().extract(determineRecordType(records));
		List<ColumnDescriptor> columns = recordSchema.getColumns();

		if (columns.isEmpty())
			throw new IllegalArgumentException(format("%s has no columns to write", recordSchema.getRecordType().getName()));

		InsertStatement insertStatement = StatementBuilder.insert(table, columns, writeMode);
		int chunkSize = StatementBuilder.chunkSize(columns.size(), getBatchSize());
		List<Object> recordsAsList = new ArrayList<>(records);

		Transaction transaction = new Transaction(getDataSource());
		WriteException thrown = null;
		long rowsAffected = 0;

		try {
			try {
				for (int start = 0; start < recordsAsList.size(); start += chunkSize) {
					List<Object> chunk = recordsAsList.subList(start, Math.min(recordsAsList.size(), start + chunkSize));
					List<Object> parameters = new ArrayList<>(chunk.size() * columns.size());

					for (Object record : chunk)
						parameters.addAll(recordSchema.extractValues(record));

					rowsAffected += executeUpdate(transaction, insertStatement.getSql(chunk.size()), parameters, chunk.size());
				}
			} catch (RuntimeException e) {
				rollback(transaction, e);
				thrown = new WriteException(format("Unable to write to table %s", table), e, rowsAffected);
				throw thrown;
			}

			try {
				transaction.commit();
			} catch (RuntimeException e) {
				rollback(transaction, e);
				thrown = new WriteException(format("Unable to commit write to table %s", table), e, 0L);
				throw thrown;
			}

			return rowsAffected;
		} finally {
			try {
				transaction.close();
			} catch (RuntimeException cleanupException) {
				if (thrown != null)
					thrown.addSuppressed(cleanupException);
				else
					throw cleanupException;
			}
		}
	}

	/**
	 * Selects {@code columns} from {@code table} and maps each row to a new {@code recordType} instance.
	 * <p>
	 * Mapping is by position: the first selected column feeds the first flattened column of {@code recordType}, and so
	 * on. Rows that cannot be scanned or converted are logged, skipped and made available via {@link #getReadFailures()}.
	 * <p>
	 * The records, their raw rows and the failures replace whatever the previous read stored on this model.
	 *
	 * @param table      the table to read from
	 * @param columns    columns to select, one per flattened column of {@code recordType}
	 * @param condition  raw SQL appended after the table name, e.g. {@code where id > 10 order by id}, or {@code null}
	 * @param recordType the type to build per row
	 * @param <T>        record type token
	 * @return the records that could be mapped
	 * @throws IllegalArgumentException if the number of {@code columns} differs from the number of columns of
	 *                                  {@code recordType}
	 */
	@NonNull
	public <T> List<@NonNull T> read(@NonNull String table,
																	 @NonNull List<@NonNull String> columns,
																	 @Nullable String condition,
																	 @NonNull Class<T> recordType) {
		requireNonNull(table);
		requireNonNull(columns);
		requireNonNull(recordType);

		RecordSchema<T> recordSchema = getSchemaExtractor().extract(recordType);

		if (columns.size() != recordSchema.getColumns().size())
			throw new IllegalArgumentException(format("%d columns were requested but %s maps to %d columns %s",
					columns.size(), recordType.getName(), recordSchema.getColumns().size(), recordSchema.getColumnNames()));

		String sql = StatementBuilder.select(table, columns, condition);

		this.records = List.of();
		this.rows = List.of();
		this.readFailures = List.of();

		List<T> records = new ArrayList<>();
		List<List<Object>> rows = new ArrayList<>();
		List<ReadFailure> readFailures = new ArrayList<>();

		performDatabaseOperation(null, sql, List.of(), null, (preparedStatement) -> {
			long startTime = nanoTime();

			try (ResultSet resultSet = preparedStatement.executeQuery()) {
				Duration executionDuration = Duration.ofNanos(nanoTime() - startTime);
				startTime = nanoTime();
				int rowNumber = 0;

				while (resultSet.next()) {
					++rowNumber;
					List<Object> row = null;

					try {
						row = getResultSetMapper().scanRow(resultSet, columns.size());
						records.add(getResultSetMapper().map(row, recordSchema, getInstanceProvider()));
						rows.add(Collections.unmodifiableList(row));
					} catch (SQLException | RuntimeException e) {
						logger.log(WARNING, format("Skipping row %d of table %s; unable to map it to %s", rowNumber, table, recordType.getName()), e);
						readFailures.add(new ReadFailure(rowNumber, row, e));
					}
				}

				return new DatabaseOperationResult(executionDuration, Duration.ofNanos(nanoTime() - startTime));
			}
		});

		this.records = Collections.unmodifiableList(new ArrayList<>(records));
		this.rows = Collections.unmodifiableList(rows);
		this.readFailures = Collections.unmodifiableList(readFailures);

		return Collections.unmodifiableList(records);
	}

	/**
	 * Deletes rows of {@code table} whose {@code timeColumn} is strictly less than {@code cutoff}.
	 *
	 * @param table      the table to clean up
	 * @param timeColumn the column compared against {@code cutoff}
	 * @param cutoff     rows older than this are deleted, typically epoch seconds
	 * @return the number of rows deleted
	 */
	@NonNull
	public Long cleanup(@NonNull String table,
											@NonNull String timeColumn,
											@NonNull Long cutoff) {
		requireNonNull(table);
		requireNonNull(timeColumn);
		requireNonNull(cutoff);

		Long rowsDeleted = executeUpdate(null, StatementBuilder.deleteOlderThan(table, timeColumn), List.of(cutoff), null);
		logger.log(INFO, format("Cleaned up %d records from table %s", rowsDeleted, table));

		return rowsDeleted;
	}

	/**
	 * Describes the connected database.
	 *
	 * @return a single entry of the form {@code system db version: 8.0.36}
	 */
	@NonNull
	public List<@NonNull String> info() {
		return performRawConnectionOperation((connection) -> {
			DatabaseMetaData databaseMetaData = connection.getMetaData();
			return Optional.of(List.of(format("system db version: %s", databaseMetaData.getDatabaseProductVersion())));
		}).orElseThrow();
	}

	/**
	 * Exposes a transient {@link DatabaseMetaData} instance on its own newly-borrowed connection.
	 * <p>
	 * The connection is closed as soon as {@link DatabaseMetaDataReader#read(DatabaseMetaData)} completes.
	 *
	 * @param databaseMetaDataReader reads the metadata
	 */
	public void readDatabaseMetaData(@NonNull DatabaseMetaDataReader databaseMetaDataReader) {
		requireNonNull(databaseMetaDataReader);

		performRawConnectionOperation((connection) -> {
			databaseMetaDataReader.read(connection.getMetaData());
			return Optional.empty();
		});
	}

	/**
	 * Records stored by the most recent {@link #read(String, List, String, Class)}.
	 *
	 * @return the most recently read records, empty before the first read
	 */
	@NonNull
	public List<@NonNull Object> getRecords() {
		return this.records;
	}

	/**
	 * Records stored by the most recent {@link #read(String, List, String, Class)}, typed as {@code recordType}.
	 *
	 * @param recordType the type the records were read as
	 * @param <T>        record type token
	 * @return the most recently read records
	 * @throws IllegalArgumentException if the most recent read produced a different type
	 */
	@NonNull
	public <T> List<@NonNull T> getRecords(@NonNull Class<T> recordType) {
		requireNonNull(recordType);

		List<T> typedRecords = new ArrayList<>(this.records.size());

		for (Object record : this.records) {
			if (!recordType.isInstance(record))
				throw new IllegalArgumentException(format("Most recent read produced %s, not %s", record.getClass().getName(), recordType.getName()));

			typedRecords.add(recordType.cast(record));
		}

		return Collections.unmodifiableList(typedRecords);
	}

	/**
	 * Raw per-column values of the rows behind {@link #getRecords()}, in the same order.
	 *
	 * @return the most recently read raw rows
	 */
	@NonNull
	public List<@NonNull List<@Nullable Object>> getRows() {
		return this.rows;
	}

	/**
	 * Rows the most recent {@link #read(String, List, String, Class)} skipped.
	 *
	 * @return the most recent read's failures, empty if every row mapped
	 */
	@NonNull
	public List<@NonNull ReadFailure> getReadFailures() {
		return this.readFailures;
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{driverName=%s, batchSize=%s}", getClass().getSimpleName(), getDriverName().orElse(null), getBatchSize());
	}

	@NonNull
	protected Class<?> determineRecordType(@NonNull Collection<?> records) {
		requireNonNull(records);

		if (records.isEmpty())
			throw new IllegalArgumentException("No records were provided");

		Class<?> recordType = null;

		for (Object record : records) {
			if (record == null)
				throw new IllegalArgumentException("Records must not contain null");

			if (recordType == null)
				recordType = record.getClass();
			else if (!recordType.equals(record.getClass()))
				throw new IllegalArgumentException(format("Records must all be of the same type, found both %s and %s",
						recordType.getName(), record.getClass().getName()));
		}

		return recordType;
	}

	@NonNull
	protected Long executeUpdate(@Nullable Transaction transaction,
															 @NonNull String sql,
															 @NonNull List<@Nullable Object> parameters,
															 @Nullable Integer rowCount) {
		requireNonNull(sql);
		requireNonNull(parameters);

		ResultHolder<Long> resultHolder = new ResultHolder<>();

		performDatabaseOperation(transaction, sql, parameters, rowCount, (preparedStatement) -> {
			long startTime = nanoTime();

			DatabaseOperationSupportStatus executeLargeUpdateSupported = getExecuteLargeUpdateSupported();

			// Use the appropriate "large" value if we know it.
			// If we don't know it, detect it and store it.
			if (executeLargeUpdateSupported == DatabaseOperationSupportStatus.YES) {
				resultHolder.value = preparedStatement.executeLargeUpdate();
			} else if (executeLargeUpdateSupported == DatabaseOperationSupportStatus.NO) {
				resultHolder.value = (long) preparedStatement.executeUpdate();
			} else {
				try {
					resultHolder.value = preparedStatement.executeLargeUpdate();
					setExecuteLargeUpdateSupported(DatabaseOperationSupportStatus.YES);
				} catch (SQLFeatureNotSupportedException | UnsupportedOperationException | AbstractMethodError e) {
					setExecuteLargeUpdateSupported(DatabaseOperationSupportStatus.NO);
					resultHolder.value = (long) preparedStatement.executeUpdate();
				}
			}

			return new DatabaseOperationResult(Duration.ofNanos(nanoTime() - startTime), null);
		});

		return resultHolder.value;
	}

	/**
	 * Prepares {@code sql}, binds {@code parameters}, runs {@code databaseOperation} and reports a {@link StatementLog}.
	 * <p>
	 * Inside a {@link Transaction} the transaction's connection is used and left open; otherwise a connection is
	 * borrowed for this statement alone.
	 */
	protected void performDatabaseOperation(@Nullable Transaction transaction,
																					@NonNull String sql,
																					@NonNull List<@Nullable Object> parameters,
																					@Nullable Integer rowCount,
																					@NonNull DatabaseOperation databaseOperation) {
		requireNonNull(sql);
		requireNonNull(parameters);
		requireNonNull(databaseOperation);

		long startTime = nanoTime();
		Duration connectionAcquisitionDuration = null;
		Duration preparationDuration = null;
		Duration executionDuration = null;
		Duration resultSetMappingDuration = null;
		Exception exception = null;
		Throwable thrown = null;
		Connection connection = null;

		try {
			boolean alreadyHasConnection = transaction != null && transaction.hasConnection();
			connection = transaction != null ? transaction.getConnection() : acquireConnection();
			connectionAcquisitionDuration = alreadyHasConnection ? null : Duration.ofNanos(nanoTime() - startTime);
			startTime = nanoTime();

			try (PreparedStatement preparedStatement = connection.prepareStatement(sql)) {
				for (int i = 0; i < parameters.size(); ++i)
					getPreparedStatementBinder().bindParameter(preparedStatement, i + 1, parameters.get(i));

				preparationDuration = Duration.ofNanos(nanoTime() - startTime);

				DatabaseOperationResult databaseOperationResult = databaseOperation.perform(preparedStatement);
				executionDuration = databaseOperationResult.getExecutionDuration().orElse(null);
				resultSetMappingDuration = databaseOperationResult.getResultSetMappingDuration().orElse(null);
			}
		} catch (DatabaseException e) {
			exception = e;
			thrown = e;
			throw e;
		} catch (Error e) {
			exception = new DatabaseException(e);
			thrown = e;
			throw e;
		} catch (Exception e) {
			exception = e;
			DatabaseException wrapped = new DatabaseException(e);
			thrown = wrapped;
			throw wrapped;
		} finally {
			Throwable cleanupFailure = null;

			// Single-shot statements own their connection
			if (connection != null && transaction == null) {
				try {
					connection.close();
				} catch (Throwable cleanupException) {
					cleanupFailure = cleanupException;
				}
			}

			StatementLog statementLog = StatementLog.withSql(sql)
					.parameters(parameters)
					.connectionAcquisitionDuration(connectionAcquisitionDuration)
					.preparationDuration(preparationDuration)
					.executionDuration(executionDuration)
					.resultSetMappingDuration(resultSetMappingDuration)
					.rowCount(rowCount)
					.exception(exception)
					.build();

			try {
				getStatementLogger().log(statementLog);
			} catch (Throwable cleanupException) {
				if (cleanupFailure == null)
					cleanupFailure = cleanupException;
				else
					cleanupFailure.addSuppressed(cleanupException);
			}

			if (cleanupFailure != null) {
				if (thrown != null) {
					thrown.addSuppressed(cleanupFailure);
				} else if (cleanupFailure instanceof RuntimeException) {
					throw (RuntimeException) cleanupFailure;
				} else if (cleanupFailure instanceof Error) {
					throw (Error) cleanupFailure;
				} else {
					throw new DatabaseException(cleanupFailure);
				}
			}
		}
	}

	/**
	 * Runs {@code rawConnectionOperation} on a freshly-borrowed connection and closes it afterwards.
	 */
	@NonNull
	protected <R> Optional<R> performRawConnectionOperation(@NonNull RawConnectionOperation<R> rawConnectionOperation) {
		requireNonNull(rawConnectionOperation);

		Connection connection = null;
		Throwable thrown = null;

		try {
			connection = acquireConnection();
			return rawConnectionOperation.perform(connection);
		} catch (DatabaseException e) {
			thrown = e;
			throw e;
		} catch (Exception e) {
			DatabaseException wrapped = new DatabaseException(e);
			thrown = wrapped;
			throw wrapped;
		} finally {
			if (connection != null) {
				try {
					connection.close();
				} catch (SQLException cleanupException) {
					if (thrown != null)
						thrown.addSuppressed(cleanupException);
					else
						throw new DatabaseException("Unable to close database connection", cleanupException);
				}
			}
		}
	}

	protected void rollback(@NonNull Transaction transaction,
													@NonNull Exception cause) {
		requireNonNull(transaction);
		requireNonNull(cause);

		try {
			transaction.rollback();
		} catch (RuntimeException rollbackException) {
			logger.log(WARNING, "Unable to roll back transaction", rollbackException);
			cause.addSuppressed(rollbackException);
		}
	}

	@NonNull
	protected Connection acquireConnection() {
		try {
			return getDataSource().getConnection();
		} catch (SQLException e) {
			throw new DatabaseException("Unable to acquire database connection", e);
		}
	}

	/**
	 * The pooled data source for this model's driver and data-source names, looked up on first use.
	 *
	 * @return the shared data source
	 * @throws IllegalStateException if the driver name is not supported
	 * @throws DatabaseException     if the data-source name is blank or the pool cannot be created
	 */
	@NonNull
	protected DataSource getDataSource() {
		DataSource dataSource = this.dataSource;

		if (dataSource == null) {
			dataSource = getDataSourceRegistry().getDataSource(getDriverName().orElse(null), getDataSourceName().orElse(null));
			this.dataSource = dataSource;
		}

		return dataSource;
	}

	@NonNull
	public Optional<String> getDriverName() {
		return Optional.ofNullable(this.driverName);
	}

	@NonNull
	public Optional<String> getDataSourceName() {
		return Optional.ofNullable(this.dataSourceName);
	}

	@NonNull
	public Integer getBatchSize() {
		return this.batchSize;
	}

	@NonNull
	protected DataSourceRegistry getDataSourceRegistry() {
		return this.dataSourceRegistry;
	}

	@NonNull
	protected SchemaExtractor getSchemaExtractor() {
		return this.schemaExtractor;
	}

	@NonNull
	protected ResultSetMapper getResultSetMapper() {
		return this.resultSetMapper;
	}

	@NonNull
	protected PreparedStatementBinder getPreparedStatementBinder() {
		return this.preparedStatementBinder;
	}

	@NonNull
	protected InstanceProvider getInstanceProvider() {
		return this.instanceProvider;
	}

	@NonNull
	protected StatementLogger getStatementLogger() {
		return this.statementLogger;
	}

	@NonNull
	protected DatabaseOperationSupportStatus getExecuteLargeUpdateSupported() {
		return this.executeLargeUpdateSupported;
	}

	protected void setExecuteLargeUpdateSupported(@NonNull DatabaseOperationSupportStatus executeLargeUpdateSupported) {
		requireNonNull(executeLargeUpdateSupported);
		this.executeLargeUpdateSupported = executeLargeUpdateSupported;
	}

	/**
	 * Builder used to construct instances of {@link Model}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 * @since 1.0.0
	 */
	@NotThreadSafe
	public static class Builder {
		@NonNull
		private final DataSourceRegistry dataSourceRegistry;
		@Nullable
		private String driverName;
		@Nullable
		private String dataSourceName;
		@Nullable
		private Integer batchSize;
		@Nullable
		private SchemaExtractor schemaExtractor;
		@Nullable
		private ResultSetMapper resultSetMapper;
		@Nullable
		private PreparedStatementBinder preparedStatementBinder;
		@Nullable
		private InstanceProvider instanceProvider;
		@Nullable
		private StatementLogger statementLogger;

		private Builder(@NonNull DataSourceRegistry dataSourceRegistry) {
			this.dataSourceRegistry = requireNonNull(dataSourceRegistry);
		}

		/**
		 * The driver name, which must be {@value DataSourceRegistry#SUPPORTED_DRIVER_NAME}. Checked on first use.
		 *
		 * @param driverName the driver name
		 * @return this {@code Builder}, for chaining
		 */
		@NonNull
		public Builder driverName(@Nullable String driverName) {
			this.driverName = driverName;
			return this;
		}

		/**
		 * The data-source name handed to the registry's {@link DataSourceFactory}, normally a JDBC URL. Checked on first use.
		 *
		 * @param dataSourceName the data-source name
		 * @return this {@code Builder}, for chaining
		 */
		@NonNull
		public Builder dataSourceName(@Nullable String dataSourceName) {
			this.dataSourceName = dataSourceName;
			return this;
		}

		/**
		 * Upper bound on records per write statement, {@value Model#DEFAULT_BATCH_SIZE} if unset.
		 *
		 * @param batchSize a positive batch size, or {@code null} for the default
		 * @return this {@code Builder}, for chaining
		 */
		@NonNull
		public Builder batchSize(@Nullable Integer batchSize) {
			this.batchSize = batchSize;
			return this;
		}

		@NonNull
		public Builder schemaExtractor(@Nullable SchemaExtractor schemaExtractor) {
			this.schemaExtractor = schemaExtractor;
			return this;
		}

		@NonNull
		public Builder resultSetMapper(@Nullable ResultSetMapper resultSetMapper) {
			this.resultSetMapper = resultSetMapper;
			return this;
		}

		@NonNull
		public Builder preparedStatementBinder(@Nullable PreparedStatementBinder preparedStatementBinder) {
			this.preparedStatementBinder = preparedStatementBinder;
			return this;
		}

		@NonNull
		public Builder instanceProvider(@Nullable InstanceProvider instanceProvider) {
			this.instanceProvider = instanceProvider;
			return this;
		}

		@NonNull
		public Builder statementLogger(@Nullable StatementLogger statementLogger) {
			this.statementLogger = statementLogger;
			return this;
		}

		@NonNull
		public Model build() {
			return new Model(this);
		}
	}

	@FunctionalInterface
	protected interface DatabaseOperation {
		@NonNull
		DatabaseOperationResult perform(@NonNull PreparedStatement preparedStatement) throws Exception;
	}

	@FunctionalInterface
	protected interface RawConnectionOperation<R> {
		@NonNull
		Optional<R> perform(@NonNull Connection connection) throws Exception;
	}

	@ThreadSafe
	static class DatabaseOperationResult {
		@Nullable
		private final Duration executionDuration;
		@Nullable
		private final Duration resultSetMappingDuration;

		DatabaseOperationResult(@Nullable Duration executionDuration,
														@Nullable Duration resultSetMappingDuration) {
			this.executionDuration = executionDuration;
			this.resultSetMappingDuration = resultSetMappingDuration;
		}

		@NonNull
		Optional<Duration> getExecutionDuration() {
			return Optional.ofNullable(this.executionDuration);
		}

		@NonNull
		Optional<Duration> getResultSetMappingDuration() {
			return Optional.ofNullable(this.resultSetMappingDuration);
		}
	}

	@NotThreadSafe
	static class ResultHolder<T> {
		T value;
	}

	enum DatabaseOperationSupportStatus {
		UNKNOWN,
		YES,
		NO
	}
}
