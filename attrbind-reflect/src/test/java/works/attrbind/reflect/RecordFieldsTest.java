package works.attrbind.reflect;

import java.util.List;
import org.junit.jupiter.api.Test;
import works.attrbind.annotations.Attr;
import works.attrbind.annotations.Embedded;
import works.attrbind.exceptions.InvalidComponentException;
import works.attrbind.exceptions.InvalidRecordTypeException;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class RecordFieldsTest {

	record Person(@Attr("name") String name, @Attr("age") int age) { }

	record Address(@Attr("street") String street, @Attr("city") String city) { }

	record Customer(@Attr("name") String name, @Embedded Address address, @Attr("tier") String tier) { }

	@Test
	void taggedComponents_inDeclarationOrder() throws InvalidRecordTypeException {
		List<FieldDescriptor> fields = RecordFields.of(Person.class);
		assertEquals(List.of("name", "age"), names(fields));
		assertEquals("age", fields.get(1).component().getName());
		assertEquals(int.class, fields.get(1).genericType());
	}

	@Test
	void ignoredComponent_isOmitted() throws InvalidRecordTypeException {
		record WithIgnored(@Attr("name") String name, @Attr(Attr.IGNORE) String scratch) { }
		assertEquals(List.of("name"), names(RecordFields.of(WithIgnored.class)));
	}

	@Test
	void embeddedRecord_promotesFieldsInPlace() throws InvalidRecordTypeException {
		List<FieldDescriptor> fields = RecordFields.of(Customer.class);
		assertEquals(List.of("name", "street", "city", "tier"), names(fields));
		assertEquals(2, fields.get(2).components().size());
		assertEquals("city <- Customer.address.city", fields.get(2).toString());
	}

	@Test
	void read_followsEmbeddedComponents() throws InvalidRecordTypeException {
		List<FieldDescriptor> fields = RecordFields.of(Customer.class);
		Customer customer = new Customer("Ana", new Address("Main St", "Springfield"), "gold");
		assertEquals("Springfield", fields.get(2).read(customer));
		assertEquals("gold", fields.get(3).read(customer));
	}

	@Test
	void read_nullEmbeddedRecord_returnsNull() throws InvalidRecordTypeException {
		List<FieldDescriptor> fields = RecordFields.of(Customer.class);
		assertNull(fields.get(2).read(new Customer("Ana", null, "gold")));
	}

	@Test
	void untaggedComponent_throws() {
		record Untagged(@Attr("name") String name, int age) { }
		InvalidComponentException e = assertThrows(InvalidComponentException.class, () -> RecordFields.of(Untagged.class));
		assertEquals("age", e.componentName());
		assertEquals(Untagged.class, e.containingClass());
		assertThat(e.getMessage(), containsString("must be annotated with @Attr or @Embedded"));
	}

	@Test
	void blankName_throws() {
		record Blank(@Attr(" ") String name) { }
		assertThrows(InvalidComponentException.class, () -> RecordFields.of(Blank.class));
	}

	@Test
	void duplicateName_throws() {
		record Duplicate(@Attr("name") String first, @Attr("name") String second) { }
		InvalidComponentException e = assertThrows(InvalidComponentException.class, () -> RecordFields.of(Duplicate.class));
		assertEquals("second", e.componentName());
	}

	@Test
	void duplicateNameViaEmbedding_throws() {
		record Clash(@Attr("city") String city, @Embedded Address address) { }
		InvalidComponentException e = assertThrows(InvalidComponentException.class, () -> RecordFields.of(Clash.class));
		assertThat(e.getMessage(), containsString("\"city\" is already used"));
	}

	@Test
	void embeddedNonRecord_throws() {
		record BadEmbed(@Embedded String notARecord) { }
		assertThrows(InvalidComponentException.class, () -> RecordFields.of(BadEmbed.class));
	}

	@Test
	void bothAnnotations_throws() {
		record Both(@Attr("address") @Embedded Address address) { }
		assertThrows(InvalidComponentException.class, () -> RecordFields.of(Both.class));
	}

	record Loop(@Attr("name") String name, @Embedded Loop inner) { }

	@Test
	void selfEmbedding_throws() {
		InvalidComponentException e = assertThrows(InvalidComponentException.class, () -> RecordFields.of(Loop.class));
		assertThat(e.getMessage(), containsString("contains itself"));
	}

	@Test
	void sameRecordEmbeddedTwice_collides() {
		record Twice(@Embedded Address home, @Embedded Address work) { }
		assertThrows(InvalidComponentException.class, () -> RecordFields.of(Twice.class));
	}

	@Test
	void notARecord_throws() {
		InvalidRecordTypeException e = assertThrows(InvalidRecordTypeException.class, () -> RecordFields.of(String.class));
		assertThat(e.getMessage(), containsString("Expected a record type"));
	}

	private static List<String> names(List<FieldDescriptor> fields) {
		return fields.stream().map(FieldDescriptor::name).toList();
	}

}
