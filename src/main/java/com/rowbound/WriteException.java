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

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Thrown when a {@link Model#write(String, java.util.Collection, WriteMode)} call fails.
 * <p>
 * The transaction backing the write has been rolled back by the time this exception is thrown, so nothing from the
 * call is durable. {@link #getRowsAffected()} reports the affected-row count the backend had acknowledged for chunks
 * executed before the failure, or {@code 0} if the failure happened at commit time.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@NotThreadSafe
public class WriteException extends DatabaseException {
	@NonNull
	private final Long rowsAffected;

	/**
	 * Creates a {@code WriteException} which wraps the given {@code cause}.
	 *
	 * @param message      a message describing this exception
	 * @param cause        the cause of this exception
	 * @param rowsAffected rows acknowledged before the failure
	 */
	public WriteException(@Nullable String message,
												@Nullable Throwable cause,
												@NonNull Long rowsAffected) {
		super(message, cause);
		this.rowsAffected = requireNonNull(rowsAffected);
	}

	@Override
	public String toString() {
		return format("%s, rowsAffected=%s", super.toString(), getRowsAffected());
	}

	/**
	 * Rows the backend acknowledged before the write was aborted.
	 * <p>
	 * Advisory only: none of these rows were committed.
	 *
	 * @return the affected-row count accumulated before the failure
	 */
	@NonNull
	public Long getRowsAffected() {
		return this.rowsAffected;
	}
}
