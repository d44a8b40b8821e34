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
import javax.sql.DataSource;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Proxy;
import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
public class ModelTests {
	public record User(int id, String name) {}

	public record Employee(Long id, @DatabaseColumn("name") String displayName) {}

	public record Aged(int id, String name, int age) {}

	public record Being(String name, Integer age) {}

	public record Staff(Being being, @DatabaseColumn("title") String role) {}

	public record Balance(int id, int amount) {}

	public record Reading(int id, @DatabaseColumn("reading_value") Double value) {}

	public record ExactReading(int id, @DatabaseColumn("reading_value") BigDecimal value) {}

	public record Event(Long id, @DatabaseColumn("created_at") Long createdAt) {}

	public enum Color {
		RED,
		BLUE
	}

	public record Thing(Long id, Color color, UUID token, LocalDate born, Boolean active, BigDecimal price, Locale locale) {}

	public static class Address {
		private String city;
		private @DatabaseColumn("zip") String postalCode;
	}

	public static class Customer {
		private Long id;
		private @Embedded Address address;
	}

	@Test
	public void testWriteThenReadScenario() {
		Model model = createModel("model_scenario");
		model.execute("CREATE TABLE users (id INT PRIMARY KEY, name VARCHAR(64))");

		List<User> users = List.of(new User(1, "a"), new User(2, "b"));
		Long rowsAffected = model.update("users", users);

		Assertions.assertTrue(rowsAffected >= 0);
		Assertions.assertEquals(users, model.read("users", List.of("id", "name"), "", User.class));
		Assertions.assertEquals(users, model.getRecords(User.class));
		Assertions.assertEquals(2, model.getRecords().size());
		Assertions.assertEquals(List.of(List.of(1, "a"), List.of(2, "b")), model.getRows());
		Assertions.assertEquals(List.of(), model.getReadFailures());

		// Re-reading unchanged data yields the same records
		Assertions.assertEquals(users, model.read("users", List.of("id", "name"), "", User.class));
	}

	@Test
	public void testCreateLeavesExistingRowsIntact() {
		Model model = createModel("model_create_conflict");
		model.execute("CREATE TABLE employee (id BIGINT PRIMARY KEY, name VARCHAR(64))");

		Assertions.assertEquals(1L, model.create("employee", List.of(new Employee(1L, "first"))));
		Assertions.assertEquals(0L, model.create("employee", List.of(new Employee(1L, "second"))));

		Assertions.assertEquals(List.of(new Employee(1L, "first")),
				model.read("employee", List.of("id", "name"), null, Employee.class));
	}

	@Test
	public void testUpdateOverwritesExistingRows() {
		Model model = createModel("model_update_conflict");
		model.execute("CREATE TABLE employee (id BIGINT PRIMARY KEY, name VARCHAR(64))");

		model.update("employee", List.of(new Employee(1L, "first"), new Employee(2L, "other")));
		model.update("employee", List.of(new Employee(1L, "second")));

		Assertions.assertEquals(List.of(new Employee(1L, "second"), new Employee(2L, "other")),
				model.read("employee", List.of("id", "name"), "order by id", Employee.class));
	}

	@Test
	public void testWritesAreChunkedByBatchSize() {
		List<StatementLog> statementLogs = new CopyOnWriteArrayList<>();
		Model model = createModel("model_chunking", statementLogs::add, 3);
		model.execute("CREATE TABLE employee (id BIGINT PRIMARY KEY, name VARCHAR(64))");

		statementLogs.clear();
		Assertions.assertEquals(3L, model.create("employee", employees(1, 3)));
		Assertions.assertEquals(List.of(3), insertRowCounts(statementLogs));

		statementLogs.clear();
		Assertions.assertEquals(4L, model.create("employee", employees(4, 4)));
		Assertions.assertEquals(List.of(3, 1), insertRowCounts(statementLogs));

		Assertions.assertEquals(7, model.read("employee", List.of("id", "name"), null, Employee.class).size());
	}

	@Test
	public void testEmptyInputIsRejectedWithoutExecutingSql() {
		List<StatementLog> statementLogs = new CopyOnWriteArrayList<>();
		Model model = createModel("model_empty_input", statementLogs::add, null);

		Assertions.assertThrows(IllegalArgumentException.class, () -> model.update("employee", List.of()));
		Assertions.assertThrows(IllegalArgumentException.class, () -> model.create("employee", Arrays.asList(new Employee(1L, "a"), null)));
		Assertions.assertThrows(IllegalArgumentException.class,
				() -> model.create("employee", List.of(new Employee(1L, "a"), new User(2, "b"))));
		Assertions.assertEquals(List.of(), statementLogs);
	}

	@Test
	public void testFailedChunkRollsBackWholeWrite() {
		List<StatementLog> statementLogs = new CopyOnWriteArrayList<>();
		Model model = createModel("model_rollback", statementLogs::add, 1);
		model.execute("CREATE TABLE employee (id BIGINT PRIMARY KEY, name VARCHAR(64) NOT NULL)");

		statementLogs.clear();

		WriteException writeException = Assertions.assertThrows(WriteException.class, () -> model.update("employee",
				List.of(new Employee(1L, "a"), new Employee(2L, "b"), new Employee(3L, null), new Employee(4L, "d"))));

		Assertions.assertEquals(2L, writeException.getRowsAffected());
		Assertions.assertTrue(writeException.getSqlState().isPresent());

		// The fourth chunk is never attempted
		Assertions.assertEquals(3, statementLogs.size());
		Assertions.assertTrue(statementLogs.get(2).getException().isPresent());

		Assertions.assertEquals(List.of(), model.read("employee", List.of("id", "name"), null, Employee.class));
	}

	@Test
	public void testCommitFailureCreditsZeroRows() {
		String databaseName = "model_commit_failure";
		DataSourceRegistry dataSourceRegistry = DataSourceRegistry.withDataSourceFactory((dataSourceName) ->
				failingCommitDataSource(createInMemoryDataSource(dataSourceName)));

		Model model = Model.withDataSourceRegistry(dataSourceRegistry)
				.driverName("mysql")
				.dataSourceName(databaseName)
				.build();

		model.execute("CREATE TABLE employee (id BIGINT PRIMARY KEY, name VARCHAR(64))");

		WriteException writeException = Assertions.assertThrows(WriteException.class,
				() -> model.create("employee", List.of(new Employee(1L, "a"), new Employee(2L, "b"))));

		Assertions.assertEquals(0L, writeException.getRowsAffected());
		Assertions.assertEquals("commit refused", rootCause(writeException).getMessage());
		Assertions.assertEquals(List.of(), model.read("employee", List.of("id", "name"), null, Employee.class));
	}

	@Test
	public void testUnmappableRowsAreSkipped() {
		Model model = createModel("model_bad_rows");
		model.execute("CREATE TABLE people (id INT PRIMARY KEY, name VARCHAR(64), age INT)");
		model.execute("INSERT INTO people VALUES (1, 'a', 30)");
		model.execute("INSERT INTO people VALUES (2, 'b', NULL)");
		model.execute("INSERT INTO people VALUES (3, 'c', 40)");

		List<Aged> people = model.read("people", List.of("id", "name", "age"), "order by id", Aged.class);

		Assertions.assertEquals(List.of(new Aged(1, "a", 30), new Aged(3, "c", 40)), people);
		Assertions.assertEquals(2, model.getRows().size());
		Assertions.assertEquals(1, model.getReadFailures().size());

		ReadFailure readFailure = model.getReadFailures().get(0);

		Assertions.assertEquals(2, readFailure.getRowNumber());
		Assertions.assertEquals(Arrays.asList(2, "b", null), readFailure.getRow().orElseThrow());
		Assertions.assertTrue(readFailure.getException() instanceof DatabaseException);
	}

	@Test
	public void testOutOfRangeValuesAreSkippedNotTruncated() {
		Model model = createModel("model_out_of_range");
		model.execute("CREATE TABLE balance (id INT PRIMARY KEY, amount BIGINT)");
		model.execute("INSERT INTO balance VALUES (1, 5000000000)");
		model.execute("INSERT INTO balance VALUES (2, 7)");

		List<Balance> balances = model.read("balance", List.of("id", "amount"), "order by id", Balance.class);

		Assertions.assertEquals(List.of(new Balance(2, 7)), balances);
		Assertions.assertEquals(1, model.getRows().size());
		Assertions.assertEquals(1, model.getReadFailures().size());
		Assertions.assertEquals(1, model.getReadFailures().get(0).getRowNumber());
		Assertions.assertTrue(model.getReadFailures().get(0).getException() instanceof DatabaseException);
	}

	@Test
	public void testNonFiniteValueSkipsOnlyItsRow() {
		Model model = createModel("model_non_finite");
		model.execute("CREATE TABLE reading (id INT PRIMARY KEY, reading_value DOUBLE)");
		model.execute("INSERT INTO reading VALUES (1, 1.5)");
		model.execute("INSERT INTO reading VALUES (3, 2.5)");
		model.create("reading", List.of(new Reading(2, Double.NaN)));

		List<ExactReading> readings = model.read("reading", List.of("id", "reading_value"), "order by id", ExactReading.class);

		Assertions.assertEquals(List.of(new ExactReading(1, new BigDecimal("1.5")), new ExactReading(3, new BigDecimal("2.5"))), readings);
		Assertions.assertEquals(1, model.getReadFailures().size());
		Assertions.assertEquals(2, model.getReadFailures().get(0).getRowNumber());
	}

	@Test
	public void testUnexpectedRuntimeFailureSkipsOnlyItsRow() {
		DataSourceRegistry dataSourceRegistry = DataSourceRegistry.withDataSourceFactory((dataSourceName) -> createInMemoryDataSource(dataSourceName));
		IllegalStateException rejection = new IllegalStateException("rejected");

		Model model = Model.withDataSourceRegistry(dataSourceRegistry)
				.driverName("mysql")
				.dataSourceName("model_runtime_failure")
				.instanceProvider(new InstanceProvider() {
					@Override
					public <T extends Record> T provideRecord(Class<T> recordType,
																										Object... initargs) {
						if (Integer.valueOf(2).equals(initargs[0]))
							throw rejection;

						return InstanceProvider.super.provideRecord(recordType, initargs);
					}
				})
				.build();

		model.execute("CREATE TABLE users (id INT PRIMARY KEY, name VARCHAR(64))");
		model.update("users", List.of(new User(1, "a"), new User(2, "b"), new User(3, "c")));

		List<User> users = model.read("users", List.of("id", "name"), "order by id", User.class);

		Assertions.assertEquals(List.of(new User(1, "a"), new User(3, "c")), users);
		Assertions.assertEquals(1, model.getReadFailures().size());
		Assertions.assertSame(rejection, model.getReadFailures().get(0).getException());
		Assertions.assertEquals(List.of(2, "b"), model.getReadFailures().get(0).getRow().orElseThrow());
	}

	@Test
	public void testReadReplacesPreviousResults() {
		Model model = createModel("model_read_replaces");
		model.execute("CREATE TABLE people (id INT PRIMARY KEY, name VARCHAR(64), age INT)");
		model.execute("INSERT INTO people VALUES (1, 'a', NULL)");
		model.execute("INSERT INTO people VALUES (2, 'b', 20)");

		model.read("people", List.of("id", "name", "age"), null, Aged.class);
		Assertions.assertEquals(1, model.getReadFailures().size());

		model.read("people", List.of("id", "name"), "where id = 1", User.class);

		Assertions.assertEquals(List.of(new User(1, "a")), model.getRecords(User.class));
		Assertions.assertEquals(List.of(), model.getReadFailures());
		Assertions.assertThrows(IllegalArgumentException.class, () -> model.getRecords(Aged.class));
	}

	@Test
	public void testReadColumnCountMustMatchRecordType() {
		List<StatementLog> statementLogs = new CopyOnWriteArrayList<>();
		Model model = createModel("model_column_mismatch", statementLogs::add, null);

		Assertions.assertThrows(IllegalArgumentException.class,
				() -> model.read("employee", List.of("id"), null, Employee.class));
		Assertions.assertEquals(List.of(), statementLogs);
	}

	@Test
	public void testNestedAndEmbeddedTypesRoundTrip() {
		Model model = createModel("model_nested");
		model.execute("CREATE TABLE staff (name VARCHAR(64) PRIMARY KEY, age INT, title VARCHAR(64))");
		model.execute("CREATE TABLE customer (id BIGINT PRIMARY KEY, city VARCHAR(64), zip VARCHAR(16))");

		List<Staff> staff = List.of(new Staff(new Being("a", 30), "boss"), new Staff(new Being("b", 25), "clerk"));
		model.update("staff", staff);

		Assertions.assertEquals(staff, model.read("staff", List.of("name", "age", "title"), "order by name", Staff.class));

		Customer customer = new Customer();
		customer.id = 1L;
		customer.address = new Address();
		customer.address.city = "Oslo";
		customer.address.postalCode = "0150";

		model.create("customer", List.of(customer));

		Customer readCustomer = model.read("customer", List.of("id", "city", "zip"), null, Customer.class).get(0);

		Assertions.assertEquals(1L, readCustomer.id);
		Assertions.assertEquals("Oslo", readCustomer.address.city);
		Assertions.assertEquals("0150", readCustomer.address.postalCode);
	}

	@Test
	public void testValueTypesRoundTrip() {
		Model model = createModel("model_value_types");
		model.execute("CREATE TABLE thing (id BIGINT PRIMARY KEY, color VARCHAR(16), token VARCHAR(36), born DATE, "
				+ "active BOOLEAN, price DECIMAL(10,2), locale VARCHAR(16))");

		List<Thing> things = List.of(
				new Thing(1L, Color.RED, UUID.randomUUID(), LocalDate.of(2020, 2, 29), true, new BigDecimal("9.99"), Locale.forLanguageTag("pt-BR")),
				new Thing(2L, null, null, null, null, null, null));

		model.create("thing", things);

		Assertions.assertEquals(things, model.read("thing",
				List.of("id", "color", "token", "born", "active", "price", "locale"), "order by id", Thing.class));
	}

	@Test
	public void testCleanupDeletesOlderRows() {
		Model model = createModel("model_cleanup");
		model.execute("CREATE TABLE audit_event (id BIGINT PRIMARY KEY, created_at BIGINT)");
		model.create("audit_event", List.of(new Event(1L, 100L), new Event(2L, 200L), new Event(3L, 300L)));

		Assertions.assertEquals(2L, model.cleanup("audit_event", "created_at", 250L));
		Assertions.assertEquals(List.of(new Event(3L, 300L)),
				model.read("audit_event", List.of("id", "created_at"), null, Event.class));
	}

	@Test
	public void testInfoReportsDatabaseVersion() {
		Model model = createModel("model_info");
		List<String> info = model.info();

		Assertions.assertEquals(1, info.size());
		Assertions.assertTrue(info.get(0).startsWith("system db version: "), info.get(0));

		StringBuilder productName = new StringBuilder();
		model.readDatabaseMetaData((databaseMetaData) -> productName.append(databaseMetaData.getDatabaseProductName()));
		Assertions.assertTrue(productName.toString().contains("HSQL"));
	}

	@Test
	public void testExecuteFailureIsWrappedAndLogged() {
		List<StatementLog> statementLogs = new CopyOnWriteArrayList<>();
		Model model = createModel("model_execute_failure", statementLogs::add, null);

		DatabaseException databaseException = Assertions.assertThrows(DatabaseException.class,
				() -> model.execute("DELETE FROM missing_table"));

		Assertions.assertTrue(databaseException.getCause() instanceof SQLException);
		Assertions.assertEquals(1, statementLogs.size());
		Assertions.assertTrue(statementLogs.get(0).getException().isPresent());
	}

	@Test
	public void testStatementLoggerFailureIsSuppressedWhenOperationFails() {
		RuntimeException loggerFailure = new RuntimeException("logger failed");
		Model model = createModel("model_logger_failure", (statementLog) -> {
			throw loggerFailure;
		}, null);

		DatabaseException databaseException = Assertions.assertThrows(DatabaseException.class,
				() -> model.execute("DELETE FROM missing_table"));

		Assertions.assertTrue(Arrays.asList(databaseException.getSuppressed()).contains(loggerFailure));
	}

	@Test
	public void testUnsupportedDriverHaltsOnFirstUse() {
		DataSourceRegistry dataSourceRegistry = DataSourceRegistry.withDataSourceFactory((dataSourceName) -> createInMemoryDataSource(dataSourceName));
		Model model = Model.withDataSourceRegistry(dataSourceRegistry)
				.driverName("postgres")
				.dataSourceName("model_unsupported_driver")
				.build();

		Assertions.assertThrows(IllegalStateException.class, () -> model.create("employee", List.of(new Employee(1L, "a"))));
		Assertions.assertEquals(0, dataSourceRegistry.size());
	}

	@Test
	public void testModelsWithSameNamesSharePool() {
		DataSourceRegistry dataSourceRegistry = DataSourceRegistry.withDataSourceFactory((dataSourceName) -> createInMemoryDataSource(dataSourceName));
		Model first = Model.withDataSourceRegistry(dataSourceRegistry).driverName("mysql").dataSourceName("model_shared").build();
		Model second = Model.withDataSourceRegistry(dataSourceRegistry).driverName("mysql").dataSourceName("model_shared").build();

		first.execute("CREATE TABLE employee (id BIGINT PRIMARY KEY, name VARCHAR(64))");
		first.create("employee", List.of(new Employee(1L, "a")));

		Assertions.assertEquals(List.of(new Employee(1L, "a")), second.read("employee", List.of("id", "name"), null, Employee.class));
		Assertions.assertEquals(1, dataSourceRegistry.size());
	}

	@Test
	public void testBatchSizeMustBePositive() {
		DataSourceRegistry dataSourceRegistry = DataSourceRegistry.withDataSourceFactory((dataSourceName) -> createInMemoryDataSource(dataSourceName));

		Assertions.assertThrows(IllegalArgumentException.class,
				() -> Model.withDataSourceRegistry(dataSourceRegistry).batchSize(0).build());
		Assertions.assertEquals(Model.DEFAULT_BATCH_SIZE, Model.withDataSourceRegistry(dataSourceRegistry).build().getBatchSize());
	}

	@NonNull
	protected List<Employee> employees(int firstId,
																		 int count) {
		List<Employee> employees = new ArrayList<>(count);

		for (int i = 0; i < count; ++i)
			employees.add(new Employee((long) (firstId + i), format("employee %d", firstId + i)));

		return employees;
	}

	@NonNull
	protected List<Integer> insertRowCounts(@NonNull List<StatementLog> statementLogs) {
		return statementLogs.stream()
				.filter(statementLog -> statementLog.getSql().startsWith("insert"))
				.map(statementLog -> statementLog.getRowCount().orElseThrow())
				.collect(Collectors.toList());
	}

	@NonNull
	protected Model createModel(@NonNull String databaseName) {
		return createModel(databaseName, null, null);
	}

	@NonNull
	protected Model createModel(@NonNull String databaseName,
															@Nullable StatementLogger statementLogger,
															@Nullable Integer batchSize) {
		requireNonNull(databaseName);

		DataSourceRegistry dataSourceRegistry = DataSourceRegistry.withDataSourceFactory((dataSourceName) -> createInMemoryDataSource(dataSourceName));

		return Model.withDataSourceRegistry(dataSourceRegistry)
				.driverName("mysql")
				.dataSourceName(databaseName)
				.statementLogger(statementLogger)
				.batchSize(batchSize)
				.build();
	}

	@NonNull
	protected DataSource createInMemoryDataSource(@NonNull String databaseName) {
		requireNonNull(databaseName);

		JDBCDataSource dataSource = new JDBCDataSource();
		dataSource.setUrl(format("jdbc:hsqldb:mem:%s;sql.syntax_mys=true", databaseName));
		dataSource.setUser("sa");
		dataSource.setPassword("");

		return dataSource;
	}

	@NonNull
	protected DataSource failingCommitDataSource(@NonNull DataSource dataSource) {
		requireNonNull(dataSource);

		return (DataSource) Proxy.newProxyInstance(getClass().getClassLoader(), new Class<?>[]{DataSource.class}, (proxy, method, args) -> {
			Object result = invoke(dataSource, method, args);

			if (!"getConnection".equals(method.getName()))
				return result;

			Connection connection = (Connection) result;

			return Proxy.newProxyInstance(getClass().getClassLoader(), new Class<?>[]{Connection.class}, (connectionProxy, connectionMethod, connectionArgs) -> {
				if ("commit".equals(connectionMethod.getName()))
					throw new SQLException("commit refused");

				return invoke(connection, connectionMethod, connectionArgs);
			});
		});
	}

	@Nullable
	protected static Object invoke(@NonNull Object target,
																 @NonNull Method method,
																 Object @Nullable [] args) throws Throwable {
		try {
			return method.invoke(target, args);
		} catch (InvocationTargetException e) {
			throw e.getCause();
		}
	}

	@NonNull
	protected Throwable rootCause(@NonNull Throwable throwable) {
		Throwable current = throwable;

		while (current.getCause() != null)
			current = current.getCause();

		return current;
	}
}
