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

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.jspecify.annotations.NonNull;

import javax.annotation.concurrent.ThreadSafe;
import javax.sql.DataSource;

import static java.util.Objects.requireNonNull;

/**
 * Contract for creating the pooled {@link DataSource} behind a data-source name.
 * <p>
 * {@link DataSourceRegistry} invokes this at most once per distinct driver/data-source pair.
 * <p>
 * Implementations should be threadsafe.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
@FunctionalInterface
public interface DataSourceFactory {
	/**
	 * Creates a {@link DataSource} for the given {@code dataSourceName}.
	 *
	 * @param dataSourceName the data-source name, normally a JDBC URL such as {@code jdbc:mysql://localhost:3306/app?user=app}
	 * @return a data source, ready for use
	 * @throws Exception if the data source cannot be created
	 */
	@NonNull
	DataSource createDataSource(@NonNull String dataSourceName) throws Exception;

	/**
	 * Acquires a factory that creates a HikariCP connection pool, using {@code dataSourceName} as its JDBC URL.
	 * <p>
	 * Credentials and driver options are carried in the URL. The JDBC driver itself must be on the classpath.
	 *
	 * @return a HikariCP-backed factory
	 */
	@NonNull
	static DataSourceFactory withDefaultConfiguration() {
		return (dataSourceName) -> {
			requireNonNull(dataSourceName);

			HikariConfig hikariConfig = new HikariConfig();
			hikariConfig.setJdbcUrl(dataSourceName);
			hikariConfig.setPoolName("rowbound");

			return new HikariDataSource(hikariConfig);
		};
	}
}
