package works.attrbind.jackson;

import java.io.StringWriter;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.core.JacksonException;
import tools.jackson.core.JsonGenerator;
import tools.jackson.core.JsonParser;
import tools.jackson.core.JsonToken;
import tools.jackson.databind.json.JsonMapper;
import works.attrbind.wire.ListWireType;
import works.attrbind.wire.MapWireType;
import works.attrbind.wire.ObjectWireType;
import works.attrbind.wire.PrimitiveWireType;
import works.attrbind.wire.SetWireType;
import works.attrbind.wire.WireBool;
import works.attrbind.wire.WireList;
import works.attrbind.wire.WireMap;
import works.attrbind.wire.WireNumber;
import works.attrbind.wire.WireObject;
import works.attrbind.wire.WireSet;
import works.attrbind.wire.WireString;
import works.attrbind.wire.WireType;
import works.attrbind.wire.WireValue;

import static tools.jackson.core.JsonToken.END_ARRAY;
import static tools.jackson.core.JsonToken.END_OBJECT;
import static tools.jackson.core.JsonToken.START_ARRAY;
import static tools.jackson.core.JsonToken.START_OBJECT;
import static tools.jackson.core.JsonToken.VALUE_NULL;
import static tools.jackson.core.JsonToken.VALUE_STRING;
import static works.attrbind.jackson.WireTypeJson.expect;

/**
 * Reads and writes {@link WireValue}s as plain JSON.
 * <p>
 * The JSON carries no type information, so reading requires the expected {@link WireType}.
 * Sets are arrays; maps and objects are JSON objects.
 * An object attribute missing from the JSON is read as null.
 * Unknown values have no JSON form and can't be written.
 */
public final class WireValueJson {
	private static final JsonMapper MAPPER = JsonMapper.builder().build();

	private WireValueJson() { }

	/**
	 * @throws WireFormatException if {@code value} is or contains an unknown value
	 */
	public static String toJson(WireValue value) {
		StringWriter out = new StringWriter();
		try (JsonGenerator gen = MAPPER.createGenerator(out)) {
			write(value, gen);
		}
		return out.toString();
	}

	/**
	 * @throws WireFormatException if {@code json} is malformed or doesn't match {@code type}
	 */
	public static WireValue fromJson(String json, WireType type) {
		try (JsonParser p = MAPPER.createParser(json)) {
			p.nextToken();
			WireValue result = read(p, type);
			if (p.nextToken() != null) {
				throw new WireFormatException("Unexpected content after value: " + p.currentToken());
			}
			return result;
		} catch (JacksonException e) {
			throw new WireFormatException("Malformed JSON: " + e.getMessage(), e);
		}
	}

	public static void write(WireValue value, JsonGenerator gen) {
		if (!value.isKnown()) {
			throw new WireFormatException("Unknown value of type " + value.type() + " can't be written as JSON");
		} else if (value.isNull()) {
			gen.writeNull();
		} else if (value instanceof WireString s) {
			gen.writeString(s.value());
		} else if (value instanceof WireNumber n) {
			writeNumber(n.value(), gen);
		} else if (value instanceof WireBool b) {
			gen.writeBoolean(b.value());
		} else if (value instanceof WireList l) {
			writeElements(l.elements(), gen);
		} else if (value instanceof WireSet s) {
			writeElements(s.elements(), gen);
		} else if (value instanceof WireMap m) {
			writeEntries(m.elements(), gen);
		} else if (value instanceof WireObject o) {
			writeEntries(o.attributes(), gen);
		} else {
			throw new AssertionError("Unexpected wire value: " + value);
		}
	}

	private static void writeNumber(BigDecimal number, JsonGenerator gen) {
		// Integral values are written without a fraction or exponent unless that would be too long
		if (number.signum() == 0) {
			gen.writeNumber(BigInteger.ZERO);
			return;
		}
		BigDecimal stripped = number.stripTrailingZeros();
		if (stripped.scale() <= 0 && WireNumber.fitsPlain(stripped)) {
			gen.writeNumber(stripped.toBigInteger());
		} else {
			gen.writeNumber(number);
		}
	}

	private static void writeElements(List<WireValue> elements, JsonGenerator gen) {
		gen.writeStartArray();
		for (WireValue element : elements) {
			write(element, gen);
		}
		gen.writeEndArray();
	}

	private static void writeEntries(Map<String, WireValue> entries, JsonGenerator gen) {
		gen.writeStartObject();
		for (var entry : new TreeMap<>(entries).entrySet()) {
			gen.writeName(entry.getKey());
			write(entry.getValue(), gen);
		}
		gen.writeEndObject();
	}

	/**
	 * Reads a value of the given type starting at the parser's current token,
	 * leaving the parser on the value's last token.
	 */
	public static WireValue read(JsonParser p, WireType type) {
		if (p.currentToken() == VALUE_NULL) {
			return WireValue.nullOf(type);
		}
		if (type instanceof PrimitiveWireType primitive) {
			return readPrimitive(p, primitive);
		} else if (type instanceof ListWireType l) {
			return new WireList(l, readElements(p, l.element()));
		} else if (type instanceof SetWireType s) {
			List<WireValue> elements = readElements(p, s.element());
			if (new HashSet<>(elements).size() != elements.size()) {
				throw new WireFormatException("Set of " + s.element() + " contains duplicate elements");
			}
			return new WireSet(s, elements);
		} else if (type instanceof MapWireType m) {
			return new WireMap(m, readEntries(p, m.element()));
		} else if (type instanceof ObjectWireType o) {
			return readObject(p, o);
		} else {
			throw new AssertionError("Unexpected wire type: " + type);
		}
	}

	private static WireValue readPrimitive(JsonParser p, PrimitiveWireType type) {
		JsonToken token = p.currentToken();
		switch (type) {
			case STRING:
				expect(VALUE_STRING, p);
				return WireString.of(p.getString());
			case NUMBER:
				if (token != JsonToken.VALUE_NUMBER_INT && token != JsonToken.VALUE_NUMBER_FLOAT) {
					throw new WireFormatException("Expected a number; found " + token);
				}
				return WireNumber.of(p.getDecimalValue());
			case BOOL:
				if (token != JsonToken.VALUE_TRUE && token != JsonToken.VALUE_FALSE) {
					throw new WireFormatException("Expected a boolean; found " + token);
				}
				return WireBool.of(p.getBooleanValue());
			default:
				throw new AssertionError("Unexpected primitive type: " + type);
		}
	}

	private static List<WireValue> readElements(JsonParser p, WireType elementType) {
		expect(START_ARRAY, p);
		List<WireValue> elements = new ArrayList<>();
		while (p.nextToken() != END_ARRAY) {
			elements.add(read(p, elementType));
		}
		return elements;
	}

	private static Map<String, WireValue> readEntries(JsonParser p, WireType elementType) {
		expect(START_OBJECT, p);
		Map<String, WireValue> entries = new LinkedHashMap<>();
		while (p.nextToken() != END_OBJECT) {
			p.nextValue();
			String key = p.currentName();
			if (entries.put(key, read(p, elementType)) != null) {
				throw new WireFormatException("Duplicate key \"" + key + "\"");
			}
		}
		return entries;
	}

	private static WireObject readObject(JsonParser p, ObjectWireType type) {
		expect(START_OBJECT, p);
		Map<String, WireType> declared = type.attributeTypes();
		Map<String, WireValue> attributes = new LinkedHashMap<>();
		while (p.nextToken() != END_OBJECT) {
			p.nextValue();
			String name = p.currentName();
			WireType attributeType = declared.get(name);
			if (attributeType == null) {
				throw new WireFormatException("Unexpected attribute \"" + name + "\" for " + type);
			}
			if (attributes.put(name, read(p, attributeType)) != null) {
				throw new WireFormatException("Duplicate attribute \"" + name + "\"");
			}
		}
		declared.forEach((name, attributeType) -> {
			if (!attributes.containsKey(name)) {
				LOGGER.trace("Attribute \"{}\" absent from JSON; reading as null", name);
				attributes.put(name, WireValue.nullOf(attributeType));
			}
		});
		return new WireObject(type, attributes);
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(WireValueJson.class);
}
