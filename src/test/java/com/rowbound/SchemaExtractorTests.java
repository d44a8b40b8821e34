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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import java.util.Arrays;
import java.util.List;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @since 1.0.0
 */
@ThreadSafe
public class SchemaExtractorTests {
	public record Employee(Long id, @DatabaseColumn("name") String displayName) {}

	public record Being(String name, Integer age) {}

	public record Staff(Being being, @DatabaseColumn("title") String role) {}

	public static class Audited {
		private Long createdAt;
		private static String IGNORED_STATIC = "static";
	}

	public static class Account extends Audited {
		private Long id;
		private @DatabaseColumn(" owner_name ") String ownerName;
		private transient String cachedDisplay;
	}

	public static class Address {
		private String city;
		private @DatabaseColumn("zip") String postalCode;
	}

	public static class Customer {
		private Long id;
		private @Embedded Address address;
		private Boolean active;
	}

	public static class Twice {
		private @DatabaseColumn("value") String first;
		private @DatabaseColumn("value") String second;
	}

	public static class Node {
		private Long id;
		private @Embedded Node next;
	}

	public static class BadEmbedding {
		private @Embedded String name;
	}

	@Test
	public void testRecordComponentsAndColumnOverride() {
		RecordSchema<Employee> recordSchema = SchemaExtractor.withDefaultConfiguration().extract(Employee.class);

		Assertions.assertEquals(List.of("id", "name"), recordSchema.getColumnNames());
		Assertions.assertEquals(List.of("id", "displayName"), recordSchema.getFieldNames());
		Assertions.assertEquals(Long.class, recordSchema.getColumns().get(0).getFieldType());
		Assertions.assertEquals(String.class, recordSchema.getColumns().get(1).getFieldType());
	}

	@Test
	public void testSuperclassFieldsComeFirstAndStaticTransientAreSkipped() {
		RecordSchema<Account> recordSchema = SchemaExtractor.withDefaultConfiguration().extract(Account.class);

		// Override is trimmed
		Assertions.assertEquals(List.of("createdAt", "id", "owner_name"), recordSchema.getColumnNames());
	}

	@Test
	public void testNestedRecordIsFlattenedInPlace() {
		RecordSchema<Staff> recordSchema = SchemaExtractor.withDefaultConfiguration().extract(Staff.class);

		Assertions.assertEquals(List.of("name", "age", "title"), recordSchema.getColumnNames());
		Assertions.assertEquals(Arrays.asList("a", 30, "boss"),
				recordSchema.extractValues(new Staff(new Being("a", 30), "boss")));
	}

	@Test
	public void testNullNestedRecordYieldsNullColumns() {
		RecordSchema<Staff> recordSchema = SchemaExtractor.withDefaultConfiguration().extract(Staff.class);

		Assertions.assertEquals(Arrays.asList(null, null, "boss"), recordSchema.extractValues(new Staff(null, "boss")));
	}

	@Test
	public void testEmbeddedClassIsFlattenedInPlace() {
		RecordSchema<Customer> recordSchema = SchemaExtractor.withDefaultConfiguration().extract(Customer.class);

		Assertions.assertEquals(List.of("id", "city", "zip", "active"), recordSchema.getColumnNames());

		Customer customer = recordSchema.instantiate(Arrays.asList(7L, "Oslo", "0150", true), new InstanceProvider() {});

		Assertions.assertEquals(7L, customer.id);
		Assertions.assertEquals("Oslo", customer.address.city);
		Assertions.assertEquals("0150", customer.address.postalCode);
		Assertions.assertEquals(true, customer.active);
	}

	@Test
	public void testNestedRecordInstantiation() {
		RecordSchema<Staff> recordSchema = SchemaExtractor.withDefaultConfiguration().extract(Staff.class);
		Staff staff = recordSchema.instantiate(Arrays.asList("a", 30, "boss"), new InstanceProvider() {});

		Assertions.assertEquals(new Staff(new Being("a", 30), "boss"), staff);
	}

	@Test
	public void testDuplicateColumnNamesArePreserved() {
		RecordSchema<Twice> recordSchema = SchemaExtractor.withDefaultConfiguration().extract(Twice.class);

		Assertions.assertEquals(List.of("value", "value"), recordSchema.getColumnNames());
		Assertions.assertEquals(List.of("first", "second"), recordSchema.getFieldNames());
	}

	@Test
	public void testSelfEmbeddingIsRejected() {
		Assertions.assertThrows(IllegalArgumentException.class,
				() -> SchemaExtractor.withDefaultConfiguration().extract(Node.class));
	}

	@Test
	public void testEmbeddingJdkTypeIsRejected() {
		Assertions.assertThrows(IllegalArgumentException.class,
				() -> SchemaExtractor.withDefaultConfiguration().extract(BadEmbedding.class));
	}

	@Test
	public void testUnmappableTypesAreRejected() {
		SchemaExtractor schemaExtractor = SchemaExtractor.withDefaultConfiguration();

		Assertions.assertThrows(IllegalArgumentException.class, () -> schemaExtractor.extract(int.class));
		Assertions.assertThrows(IllegalArgumentException.class, () -> schemaExtractor.extract(String[].class));
		Assertions.assertThrows(IllegalArgumentException.class, () -> schemaExtractor.extract(Runnable.class));
	}

	@Test
	public void testSchemasAreCachedPerType() {
		SchemaExtractor schemaExtractor = SchemaExtractor.withDefaultConfiguration();

		Assertions.assertSame(schemaExtractor.extract(Employee.class), schemaExtractor.extract(Employee.class));
	}

	@Test
	public void testExtractValuesRejectsOtherTypes() {
		RecordSchema<Employee> recordSchema = SchemaExtractor.withDefaultConfiguration().extract(Employee.class);

		Assertions.assertThrows(IllegalArgumentException.class, () -> recordSchema.extractValues("not an employee"));
	}

	@Test
	public void testInstantiateRequiresOneValuePerColumn() {
		RecordSchema<Employee> recordSchema = SchemaExtractor.withDefaultConfiguration().extract(Employee.class);

		Assertions.assertThrows(IllegalArgumentException.class,
				() -> recordSchema.instantiate(List.of(1L), new InstanceProvider() {}));
	}
}
