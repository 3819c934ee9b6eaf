package works.attrbind.reflect;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import works.attrbind.ConversionContext;
import works.attrbind.annotations.Attr;
import works.attrbind.annotations.Embedded;
import works.attrbind.attr.AttrType;
import works.attrbind.diag.AttributeDiagnostic;
import works.attrbind.diag.Result;
import works.attrbind.path.Path;
import works.attrbind.types.AttrTypes;
import works.attrbind.wire.WireNumber;
import works.attrbind.wire.WireObject;
import works.attrbind.wire.WireString;
import works.attrbind.wire.WireValue;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static works.attrbind.types.AttrTypes.NUMBER;
import static works.attrbind.types.AttrTypes.STRING;

class RecordDecoderTest {
	final ConversionContext ctx = ConversionContext.background();
	final RecordDecoder decoder = new RecordDecoder(new DefaultValueConverter());

	static final AttrType PERSON_TYPE = AttrTypes.objectOf(Map.of("name", STRING, "age", NUMBER));
	static final WireObject ANA = WireObject.of(Map.of("name", WireString.of("Ana"), "age", WireNumber.of(30)));

	record Person(@Attr("name") String name, @Attr("age") int age) { }

	@Test
	void matchingObject_decodes() {
		Result<Person> result = decoder.decode(ctx, PERSON_TYPE, ANA, Person.class, Path.empty());
		assertFalse(result.hasError());
		assertEquals(new Person("Ana", 30), result.get());
	}

	@Test
	void recordOnlyField_isMismatch() {
		record PersonWithExtra(@Attr("name") String name, @Attr("extra") String extra) { }
		AttrType type = AttrTypes.objectOf(Map.of("name", STRING));
		WireObject object = WireObject.of(Map.of("name", WireString.of("Ana")));

		Result<PersonWithExtra> result = decoder.decode(ctx, type, object, PersonWithExtra.class, Path.empty());

		IncompatibleTypeDiagnostic d = onlyIncompatible(result, "");
		assertEquals("mismatch between record and object: Record defines fields not found in object: extra.", d.reason());
		assertNull(result.value());
	}

	@Test
	void objectOnlyField_isMismatch() {
		record NameOnly(@Attr("name") String name) { }
		Result<NameOnly> result = decoder.decode(ctx, PERSON_TYPE, ANA, NameOnly.class, Path.empty());
		assertEquals("mismatch between record and object: Object defines fields not found in record: age.",
			onlyIncompatible(result, "").reason());
	}

	record Inner(@Attr("inner") int inner) { }

	record Outer(@Attr("a") String a, @Attr("z") Inner z, @Attr("c") String c) { }

	static final AttrType OUTER_TYPE = AttrTypes.objectOf(Map.of(
		"a", STRING,
		"z", AttrTypes.objectOf(Map.of("inner", STRING)),
		"c", STRING));

	@Test
	void nestedError_stopsBeforeLaterFields() {
		WireObject object = WireObject.of(Map.of(
			"a", WireString.of("first"),
			"z", WireObject.of(Map.of("inner", WireString.of("not a number"))),
			"c", WireString.of("never")));
		RecordingConverter converter = new RecordingConverter();

		Result<Outer> result = new RecordDecoder(converter).decode(ctx, OUTER_TYPE, object, Outer.class, Path.empty());

		IncompatibleTypeDiagnostic d = onlyIncompatible(result, "z.inner");
		assertThat(d.reason(), containsString("don't know how to reflect string into int"));
		assertEquals(List.of("a", "z"), converter.paths);
	}

	@Test
	void ignoredComponents_keepZeroValues() {
		record WithIgnored(@Attr("name") String name, @Attr(Attr.IGNORE) int cache, @Attr(Attr.IGNORE) String note) { }
		AttrType type = AttrTypes.objectOf(Map.of("name", STRING));
		WireObject object = WireObject.of(Map.of("name", WireString.of("Ana")));

		Result<WithIgnored> result = decoder.decode(ctx, type, object, WithIgnored.class, Path.empty());

		assertEquals(new WithIgnored("Ana", 0, null), result.get());
	}

	record Address(@Attr("city") String city, @Attr(Attr.IGNORE) boolean verified) { }

	record Customer(@Attr("name") String name, @Embedded Address address) { }

	@Test
	void embeddedRecord_isAssembledFromParentAttributes() {
		AttrType type = AttrTypes.objectOf(Map.of("name", STRING, "city", STRING));
		WireObject object = WireObject.of(Map.of("name", WireString.of("Ana"), "city", WireString.of("Lisbon")));

		Result<Customer> result = decoder.decode(ctx, type, object, Customer.class, Path.empty());

		assertEquals(new Customer("Ana", new Address("Lisbon", false)), result.get());
	}

	@Test
	void cancelledContext_abortsBeforeFirstField() {
		ConversionContext cancelled = ctx.withCancel();
		cancelled.cancel();
		RecordingConverter converter = new RecordingConverter();

		Result<Person> result = new RecordDecoder(converter).decode(cancelled, PERSON_TYPE, ANA, Person.class, Path.root("p"));

		AttributeDiagnostic d = onlyError(result);
		assertEquals(ConversionDiagnostics.CONVERSION_CANCELLED, d.summary());
		assertThat(d.detail(), containsString(ConversionContext.CANCELED));
		assertEquals(List.of(), converter.paths);
	}

	@Test
	void cancellationDuringLoop_stopsBeforeNextField() {
		ConversionContext cancellable = ctx.withCancel();
		RecordingConverter converter = new RecordingConverter();
		converter.afterEach = p -> cancellable.cancel();

		Result<Person> result = new RecordDecoder(converter).decode(cancellable, PERSON_TYPE, ANA, Person.class, Path.empty());

		assertEquals(ConversionDiagnostics.CONVERSION_CANCELLED, onlyError(result).summary());
		assertEquals(List.of("name"), converter.paths);
	}

	@Test
	void nonObjectValue_isIncompatible() {
		Result<Person> result = decoder.decode(ctx, PERSON_TYPE, WireString.of("Ana"), Person.class, Path.root("person"));
		assertEquals("cannot convert string into a record, must be an object",
			onlyIncompatible(result, "person").reason());
	}

	@Test
	void typeWithoutAttributeTypes_isIncompatible() {
		Result<Person> result = decoder.decode(ctx, STRING, ANA, Person.class, Path.empty());
		assertThat(onlyIncompatible(result, "").reason(), containsString("must implement TypeWithAttributeTypes"));
	}

	@Test
	void nonRecordTarget_isIncompatible() {
		Result<String> result = decoder.decode(ctx, PERSON_TYPE, ANA, String.class, Path.empty());
		assertThat(onlyIncompatible(result, "").reason(), containsString("expected a record type"));
	}

	@Test
	void invalidRecordType_isIncompatible() {
		record Untagged(@Attr("name") String name, int age) { }
		Result<Untagged> result = decoder.decode(ctx, PERSON_TYPE, ANA, Untagged.class, Path.empty());
		assertThat(onlyIncompatible(result, "").reason(), containsString("Invalid component Untagged.age"));
	}

	@Test
	void missingAttributeType_isError() {
		AttrType nameOnly = AttrTypes.objectOf(Map.of("name", STRING));
		Result<Person> result = decoder.decode(ctx, nameOnly, ANA, Person.class, Path.empty());
		AttributeDiagnostic d = onlyError(result);
		assertThat(d.detail(), containsString("Could not find type information for attribute \"age\""));
	}

	record NonNegative(@Attr("n") int n) {
		NonNegative {
			if (n < 0) {
				throw new IllegalArgumentException("n must not be negative");
			}
		}
	}

	@Test
	void throwingConstructor_isConversionError() {
		AttrType type = AttrTypes.objectOf(Map.of("n", NUMBER));
		WireObject object = WireObject.of(Map.of("n", WireNumber.of(-1)));

		Result<NonNegative> result = decoder.decode(ctx, type, object, NonNegative.class, Path.empty());

		AttributeDiagnostic d = onlyError(result);
		assertEquals(ConversionDiagnostics.VALUE_CONVERSION_ERROR, d.summary());
		assertThat(d.detail(), containsString("n must not be negative"));
	}

	@Test
	void nullAttribute_intoReferenceComponent_isNull() {
		record Nickname(@Attr("nick") String nick) { }
		AttrType type = AttrTypes.objectOf(Map.of("nick", STRING));
		WireObject object = WireObject.of(Map.of("nick", WireValue.nullOf(STRING.wireType())));
		assertEquals(new Nickname(null), decoder.decode(ctx, type, object, Nickname.class, Path.empty()).get());
	}

	static AttributeDiagnostic onlyError(Result<?> result) {
		assertEquals(1, result.diagnostics().errors().size(), () -> "Expected one error: " + result.diagnostics());
		return (AttributeDiagnostic) result.diagnostics().errors().get(0);
	}

	static IncompatibleTypeDiagnostic onlyIncompatible(Result<?> result, String expectedPath) {
		AttributeDiagnostic d = onlyError(result);
		assertEquals(expectedPath, d.path().toString());
		return assertInstanceOf(IncompatibleTypeDiagnostic.class, d.diagnostic());
	}

}
