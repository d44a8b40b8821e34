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

import javax.annotation.concurrent.ThreadSafe;
import javax.sql.DataSource;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Process-wide cache of pooled {@link DataSource} instances, keyed by driver name and data-source name.
 * <p>
 * The cache key is the plain concatenation {@code driverName + dataSourceName}. Only the {@value #SUPPORTED_DRIVER_NAME}
 * driver is supported.
 * <p>
 * Pools live until {@link #close()} is called. Share one registry across every {@link Model} that should share pools.
 * <pre>{@code  try (DataSourceRegistry registry = DataSourceRegistry.withDefaultConfiguration()) {
 *   Model model = Model.withDataSourceRegistry(registry)
 *     .driverName("mysql")
 *     .dataSourceName("jdbc:mysql://localhost:3306/app?user=app&password=secret")
 *     .build();
 *   ...
 * }}</pre>
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
public final class DataSourceRegistry implements AutoCloseable {
	/**
	 * The only driver name accepted by {@link #getDataSource(String, String)}.
	 */
	@NonNull
	public static final String SUPPORTED_DRIVER_NAME = "mysql";

	@NonNull
	private final DataSourceFactory dataSourceFactory;
	@NonNull
	private final ConcurrentMap<String, DataSource> dataSourcesByKey;
	@NonNull
	private final Logger logger;

	private DataSourceRegistry(@NonNull DataSourceFactory dataSourceFactory) {
		requireNonNull(dataSourceFactory);

		this.dataSourceFactory = dataSourceFactory;
		this.dataSourcesByKey = new ConcurrentHashMap<>();
		this.logger = Logger.getLogger(getClass().getName());
	}

	/**
	 * Acquires a registry whose pools are created by {@link DataSourceFactory#withDefaultConfiguration()}.
	 *
	 * @return a new registry
	 */
	@NonNull
	public static DataSourceRegistry withDefaultConfiguration() {
		return withDataSourceFactory(DataSourceFactory.withDefaultConfiguration());
	}

	/**
	 * Acquires a registry whose pools are created by the given {@code dataSourceFactory}.
	 *
	 * @param dataSourceFactory creates a data source the first time a data-source name is seen
	 * @return a new registry
	 */
	@NonNull
	public static DataSourceRegistry withDataSourceFactory(@NonNull DataSourceFactory dataSourceFactory) {
		requireNonNull(dataSourceFactory);
		return new DataSourceRegistry(dataSourceFactory);
	}

	/**
	 * Returns the cached data source for the given identity pair, creating and registering it on first use.
	 * <p>
	 * Creation is serialized per key, so concurrent first use never creates two pools for the same pair.
	 *
	 * @param driverName     must be {@value #SUPPORTED_DRIVER_NAME}
	 * @param dataSourceName the data-source name handed to the {@link DataSourceFactory}
	 * @return the shared data source
	 * @throws IllegalStateException if {@code driverName} is not supported
	 * @throws DatabaseException     if {@code dataSourceName} is blank or the data source cannot be created
	 */
	@NonNull
	public DataSource getDataSource(@Nullable String driverName,
																	@Nullable String dataSourceName) {
		if (!SUPPORTED_DRIVER_NAME.equals(driverName))
			throw new IllegalStateException(format("Unsupported driver '%s'; only '%s' is supported", driverName, SUPPORTED_DRIVER_NAME));

		if (dataSourceName == null || dataSourceName.trim().isEmpty())
			throw new DatabaseException("Unable to connect to database: no data source name was provided");

		return getDataSourcesByKey().computeIfAbsent(driverName + dataSourceName, (key) -> createDataSource(dataSourceName));
	}

	/**
	 * How many data sources are currently registered.
	 *
	 * @return the number of registered data sources
	 */
	@NonNull
	public Integer size() {
		return getDataSourcesByKey().size();
	}

	/**
	 * Closes every registered data source that is {@link AutoCloseable} and empties the registry.
	 * <p>
	 * If closing a data source fails, the remaining ones are still closed and the first failure is rethrown with the
	 * others attached as suppressed exceptions.
	 * <p>
	 * Entries are removed one at a time, so every removed data source is closed. A data source registered concurrently
	 * with this call either is closed here or stays registered.
	 */
	@Override
	public void close() {
		List<String> keys = new ArrayList<>(getDataSourcesByKey().keySet());
		DatabaseException closeFailure = null;

		for (String key : keys) {
			DataSource dataSource = getDataSourcesByKey().remove(key);

			if (!(dataSource instanceof AutoCloseable))
				continue;

			try {
				((AutoCloseable) dataSource).close();
			} catch (Exception e) {
				if (closeFailure == null)
					closeFailure = new DatabaseException("Unable to close data source", e);
				else
					closeFailure.addSuppressed(e);
			}
		}

		if (closeFailure != null)
			throw closeFailure;
	}

	@NonNull
	protected DataSource createDataSource(@NonNull String dataSourceName) {
		requireNonNull(dataSourceName);

		DataSource dataSource;

		try {
			dataSource = getDataSourceFactory().createDataSource(dataSourceName);
		} catch (DatabaseException e) {
			throw e;
		} catch (Exception e) {
			throw new DatabaseException("Unable to connect to database", e);
		}

		if (dataSource == null)
			throw new DatabaseException(format("Unable to connect to database: %s returned no data source",
					DataSourceFactory.class.getSimpleName()));

		logger.fine("Registered new data source");
		return dataSource;
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{size=%s}", getClass().getSimpleName(), size());
	}

	@NonNull
	protected DataSourceFactory getDataSourceFactory() {
		return this.dataSourceFactory;
	}

	@NonNull
	protected ConcurrentMap<String, DataSource> getDataSourcesByKey() {
		return this.dataSourcesByKey;
	}
}
