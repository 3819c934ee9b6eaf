package works.attrbind.jackson;

import java.io.StringWriter;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;
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
import works.attrbind.wire.WireType;

import static tools.jackson.core.JsonToken.END_ARRAY;
import static tools.jackson.core.JsonToken.END_OBJECT;
import static tools.jackson.core.JsonToken.START_ARRAY;
import static tools.jackson.core.JsonToken.START_OBJECT;
import static tools.jackson.core.JsonToken.VALUE_STRING;

/**
 * Reads and writes {@link WireType}s in their JSON form.
 * <p>
 * Primitive types are strings ({@code "string"}, {@code "number"}, {@code "bool"});
 * collection types are two-element arrays like {@code ["list", "string"]};
 * object types are {@code ["object", {"name": "string", ...}]}.
 * Object attributes are written in name order so the output is deterministic.
 */
public final class WireTypeJson {
	private static final JsonMapper MAPPER = JsonMapper.builder().build();

	private WireTypeJson() { }

	public static String toJson(WireType type) {
		StringWriter out = new StringWriter();
		try (JsonGenerator gen = MAPPER.createGenerator(out)) {
			write(type, gen);
		}
		return out.toString();
	}

	/**
	 * @throws WireFormatException if {@code json} is malformed or doesn't describe a type
	 */
	public static WireType fromJson(String json) {
		try (JsonParser p = MAPPER.createParser(json)) {
			p.nextToken();
			WireType result = read(p);
			if (p.nextToken() != null) {
				throw new WireFormatException("Unexpected content after type: " + p.currentToken());
			}
			return result;
		} catch (JacksonException e) {
			throw new WireFormatException("Malformed type JSON: " + e.getMessage(), e);
		}
	}

	public static void write(WireType type, JsonGenerator gen) {
		if (type instanceof PrimitiveWireType p) {
			gen.writeString(p.toString());
		} else if (type instanceof ListWireType l) {
			writeCollection("list", l.element(), gen);
		} else if (type instanceof SetWireType s) {
			writeCollection("set", s.element(), gen);
		} else if (type instanceof MapWireType m) {
			writeCollection("map", m.element(), gen);
		} else if (type instanceof ObjectWireType o) {
			gen.writeStartArray();
			gen.writeString("object");
			gen.writeStartObject();
			for (var entry : new TreeMap<>(o.attributeTypes()).entrySet()) {
				gen.writeName(entry.getKey());
				write(entry.getValue(), gen);
			}
			gen.writeEndObject();
			gen.writeEndArray();
		} else {
			throw new AssertionError("Unexpected wire type: " + type);
		}
	}

	private static void writeCollection(String kind, WireType element, JsonGenerator gen) {
		gen.writeStartArray();
		gen.writeString(kind);
		write(element, gen);
		gen.writeEndArray();
	}

	/**
	 * Reads the type starting at the parser's current token,
	 * leaving the parser on the type's last token.
	 */
	public static WireType read(JsonParser p) {
		if (p.currentToken() == VALUE_STRING) {
			return primitive(p.getString());
		}
		expect(START_ARRAY, p);
		p.nextToken();
		expect(VALUE_STRING, p);
		String kind = p.getString();
		p.nextToken();
		WireType result = switch (kind) {
			case "list" -> new ListWireType(read(p));
			case "set" -> new SetWireType(read(p));
			case "map" -> new MapWireType(read(p));
			case "object" -> readObject(p);
			default -> throw new WireFormatException("Unknown type kind \"" + kind + "\"");
		};
		p.nextToken();
		expect(END_ARRAY, p);
		return result;
	}

	private static PrimitiveWireType primitive(String name) {
		return switch (name) {
			case "string" -> WireType.STRING;
			case "number" -> WireType.NUMBER;
			case "bool" -> WireType.BOOL;
			default -> throw new WireFormatException("Unknown primitive type \"" + name + "\"");
		};
	}

	private static ObjectWireType readObject(JsonParser p) {
		expect(START_OBJECT, p);
		Map<String, WireType> attributeTypes = new LinkedHashMap<>();
		while (p.nextToken() != END_OBJECT) {
			p.nextValue();
			String name = p.currentName();
			if (attributeTypes.put(name, read(p)) != null) {
				throw new WireFormatException("Duplicate attribute \"" + name + "\"");
			}
		}
		return new ObjectWireType(attributeTypes);
	}

	static void expect(JsonToken expected, JsonParser p) {
		if (p.currentToken() != expected) {
			throw new WireFormatException("Expected " + expected + "; found " + p.currentToken());
		}
	}
}
