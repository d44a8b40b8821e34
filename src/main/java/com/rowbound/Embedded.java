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
 * Marks a field whose own fields should be flattened into the enclosing type's columns.
 * <p>
 * Record-typed fields and record components are always flattened, so this annotation is only needed for plain
 * classes. The embedded type's columns are spliced in at the position of the annotated field.
 *
 * <pre>
 * class Audit {
 *   &#064;DatabaseColumn(&quot;created_at&quot;) Long createdAt;
 * }
 *
 * class Widget {
 *   Long id;
 *   &#064;Embedded Audit audit;   // columns: id, created_at
 * }
 * </pre>
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@Documented
@Target({ElementType.FIELD, ElementType.RECORD_COMPONENT})
@Retention(RetentionPolicy.RUNTIME)
public @interface Embedded {}
