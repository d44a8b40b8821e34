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

/**
 * How a write treats rows that collide with an existing row on a unique key.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
public enum WriteMode {
	/**
	 * {@code INSERT IGNORE}: conflicting rows are skipped and existing data is left untouched.
	 * <p>
	 * Skipped rows contribute {@code 0} to the affected-row count.
	 */
	CREATE,
	/**
	 * {@code INSERT ... ON DUPLICATE KEY UPDATE}: conflicting rows overwrite every mapped column of the existing row.
	 * <p>
	 * MySQL counts {@code 1} per inserted row, {@code 2} per updated row and {@code 0} per row updated to identical
	 * values, so the affected-row count is advisory.
	 */
	UPDATE
}
