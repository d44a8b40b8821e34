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
import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A single database transaction spanning every chunk of one write.
 * <p>
 * The connection is borrowed lazily and autocommit is switched off for the duration of the transaction.
 * {@link #close()} restores autocommit and returns the connection to the pool.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@NotThreadSafe
final class Transaction implements AutoCloseable {
	@NonNull
	private static final AtomicLong ID_GENERATOR;

	static {
		ID_GENERATOR = new AtomicLong(0);
	}

	@NonNull
	private final Long id;
	@NonNull
	private final DataSource dataSource;
	@NonNull
	private final Logger logger;

	@Nullable
	private Connection connection;
	@Nullable
	private Boolean initialAutoCommit;

	Transaction(@NonNull DataSource dataSource) {
		requireNonNull(dataSource);

		this.id = ID_GENERATOR.incrementAndGet();
		this.dataSource = dataSource;
		this.logger = Logger.getLogger(Transaction.class.getName());
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{id=%s, hasConnection=%s}", getClass().getSimpleName(), getId(), hasConnection());
	}

	@NonNull
	Long getId() {
		return this.id;
	}

	@NonNull
	Boolean hasConnection() {
		return this.connection != null;
	}

	/**
	 * The connection associated with this transaction.
	 * <p>
	 * If no connection is associated yet, we ask the {@link DataSource} for one.
	 *
	 * @return the connection associated with this transaction
	 * @throws DatabaseException if unable to acquire a connection
	 */
	@NonNull
	Connection getConnection() {
		if (this.connection != null)
			return this.connection;

		Connection connection;

		try {
			connection = getDataSource().getConnection();
		} catch (SQLException e) {
			throw new DatabaseException("Unable to acquire database connection", e);
		}

		this.connection = connection;

		try {
			this.initialAutoCommit = connection.getAutoCommit();

			// Flipped back in close() if it was on
			if (this.initialAutoCommit)
				connection.setAutoCommit(false);
		} catch (SQLException e) {
			throw new DatabaseException("Unable to disable database connection autocommit", e);
		}

		logger.finer(format("Transaction %s started", getId()));
		return connection;
	}

	void commit() {
		if (!hasConnection()) {
			logger.finer("Transaction has no connection, so nothing to commit");
			return;
		}

		logger.finer(format("Committing transaction %s...", getId()));

		try {
			getConnection().commit();
			logger.finer(format("Transaction %s committed.", getId()));
		} catch (SQLException e) {
			throw new DatabaseException("Unable to commit transaction", e);
		}
	}

	void rollback() {
		if (!hasConnection()) {
			logger.finer("Transaction has no connection, so nothing to roll back");
			return;
		}

		logger.finer(format("Rolling back transaction %s...", getId()));

		try {
			getConnection().rollback();
			logger.finer(format("Transaction %s rolled back.", getId()));
		} catch (SQLException e) {
			throw new DatabaseException("Unable to roll back transaction", e);
		}
	}

	/**
	 * Restores the connection's initial autocommit setting and closes it.
	 * <p>
	 * Both steps are always attempted. A failure in the second is suppressed into the first.
	 */
	@Override
	public void close() {
		Connection connection = this.connection;

		if (connection == null)
			return;

		this.connection = null;
		DatabaseException closeFailure = null;

		try {
			if (getInitialAutoCommit().orElse(false))
				connection.setAutoCommit(true);
		} catch (SQLException e) {
			closeFailure = new DatabaseException("Unable to restore database connection autocommit", e);
		}

		try {
			connection.close();
		} catch (SQLException e) {
			if (closeFailure == null)
				closeFailure = new DatabaseException("Unable to close database connection", e);
			else
				closeFailure.addSuppressed(e);
		}

		if (closeFailure != null)
			throw closeFailure;
	}

	@NonNull
	Optional<Boolean> getInitialAutoCommit() {
		return Optional.ofNullable(this.initialAutoCommit);
	}

	@NonNull
	DataSource getDataSource() {
		return this.dataSource;
	}
}
