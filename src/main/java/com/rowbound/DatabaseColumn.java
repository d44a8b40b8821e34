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

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Overrides the column name used for a field or record component when generating SQL.
 * <p>
 * Without this annotation the field's own name is used verbatim. Whether that fallback matches a column is up to the
 * backend's identifier rules; MySQL treats column names case-insensitively, so {@code emailAddress} matches a column
 * named {@code emailaddress}.
 * <p>
 * For example:
 *
 * <pre>
 * record Employee(
 *   &#064;DatabaseColumn(&quot;id&quot;) Long employeeId,
 *   &#064;DatabaseColumn(&quot;name&quot;) String displayName
 * ) {}
 *
 * model.update(&quot;employee&quot;, List.of(new Employee(1L, &quot;Employee One&quot;)));
 * </pre>
 * <p>
 * Column names are not checked for uniqueness. Two fields mapped to the same column produce that column twice in
 * generated SQL.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@Documented
@Target({ElementType.FIELD, ElementType.RECORD_COMPONENT})
@Retention(RetentionPolicy.RUNTIME)
public @interface DatabaseColumn {
	/**
	 * @return the column name for the annotated field
	 */
	String value();
}
