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
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A result row that {@link Model#read(String, List, String, Class)} skipped because it could not be scanned or mapped.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
public final class ReadFailure {
	@NonNull
	private final Integer rowNumber;
	@Nullable
	private final List<@Nullable Object> row;
	@NonNull
	private final Exception exception;

	ReadFailure(@NonNull Integer rowNumber,
							@Nullable List<@Nullable Object> row,
							@NonNull Exception exception) {
		requireNonNull(rowNumber);
		requireNonNull(exception);

		this.rowNumber = rowNumber;
		this.row = row == null ? null : Collections.unmodifiableList(new ArrayList<>(row));
		this.exception = exception;
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{rowNumber=%s, row=%s, exception=%s}", getClass().getSimpleName(), getRowNumber(),
				getRow().orElse(null), getException());
	}

	/**
	 * The 1-based position of the row in the result set.
	 *
	 * @return the row's position
	 */
	@NonNull
	public Integer getRowNumber() {
		return this.rowNumber;
	}

	/**
	 * The raw column values, if the row could be scanned before mapping failed.
	 *
	 * @return the row's raw values, if available
	 */
	@NonNull
	public Optional<List<@Nullable Object>> getRow() {
		return Optional.ofNullable(this.row);
	}

	@NonNull
	public Exception getException() {
		return this.exception;
	}
}
