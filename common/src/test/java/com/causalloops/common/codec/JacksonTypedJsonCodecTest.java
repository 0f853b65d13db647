package com.causalloops.common.codec;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class JacksonTypedJsonCodecTest {

    record Person(String name, int age) {}

    @Test
    void decode_generic_via_TypeReference() {
        Codec<List<Person>, String> c = Codec.typeRefCodec(new TypeReference<List<Person>>() {});

        List<Person> back = c.decode("[{\"name\":\"Alice\",\"age\":42},{\"name\":\"Bob\",\"age\":30}]").valueOrThrow();

        assertEquals(List.of(new Person("Alice", 42), new Person("Bob", 30)), back);
    }

    @Test
    void encode_writes_record_components() {
        String json = Codec.clazzCodec(Person.class).encode(new Person("Carol", 25)).valueOrThrow();
        assertTrue(json.contains("\"name\":\"Carol\""));
        assertTrue(json.contains("\"age\":25"));
    }

    @Test
    void unknown_properties_are_ignored() {
        Person p = Codec.clazzCodec(Person.class).decode("{\"name\":\"Dan\",\"age\":3,\"extra\":true}").valueOrThrow();
        assertEquals(new Person("Dan", 3), p);
    }

    @Test
    void objectMapper_returns_copy_not_same_instance() {
        ObjectMapper base = new ObjectMapper();
        JacksonTypedJsonCodec<Person> c = new JacksonTypedJsonCodec<>(base, Person.class);
        assertNotSame(base, c.objectMapper(), "Codec should copy the provided ObjectMapper");
    }

    @Test
    void decode_with_bad_json_returns_error() {
        var result = Codec.clazzCodec(Person.class).decode("{ this is not valid json");
        assertTrue(result.isError());
        assertTrue(result.getErrors().get(0).startsWith("Failed to decode from JSON"));
    }

    @Test
    void decode_with_type_mismatch_returns_error() {
        var result = Codec.clazzCodec(Person.class).decode("{\"name\":\"Dave\",\"age\":\"old\"}");
        assertThrows(RuntimeException.class, result::valueOrThrow, "valueOrThrow should fail on type mismatch");
    }

    @Test
    void decode_of_blank_or_null_literal_is_an_error() {
        assertTrue(Codec.clazzCodec(Person.class).decode("  ").isError());
        assertTrue(Codec.clazzCodec(Person.class).decode("null").isError());
    }
}
