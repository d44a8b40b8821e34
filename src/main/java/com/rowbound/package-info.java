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

/**
 * Rowbound maps plain Java records and classes to MySQL tables and back, with batched {@code INSERT IGNORE} and
 * {@code INSERT ... ON DUPLICATE KEY UPDATE} writes.
 *
 * <pre>
 * record Employee(Long id, String name) {}
 *
 * try (DataSourceRegistry registry = DataSourceRegistry.withDefaultConfiguration()) {
 *   Model model = Model.withDataSourceRegistry(registry)
 *     .driverName("mysql")
 *     .dataSourceName("jdbc:mysql://localhost:3306/app?user=app&amp;password=secret")
 *     .build();
 *
 *   // Writes, chunked and run in one transaction
 *   long created = model.create("employee", List.of(new Employee(1L, "a"), new Employee(2L, "b")));
 *   long updated = model.update("employee", List.of(new Employee(2L, "c")));
 *
 *   // Reads, mapped by position
 *   List&lt;Employee&gt; employees = model.read("employee", List.of("id", "name"), "where id &gt; 0 order by id", Employee.class);
 *
 *   // Housekeeping
 *   long deleted = model.cleanup("event", "created_at", cutoffEpochSeconds);
 * }</pre>
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
package com.rowbound;
