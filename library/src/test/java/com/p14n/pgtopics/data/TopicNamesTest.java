package com.p14n.pgtopics.data;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TopicNamesTest {

    record UserCreated(String id) {
    }

    record HTTPRequest(String url) {
    }

    record OrderV2Created(String id) {
    }

    record Snake_Case(String id) {
    }

    @Test
    void convertsSimpleNameToSnakeCase() {
        assertEquals("user_created", TopicNames.of(UserCreated.class));
        assertEquals("http_request", TopicNames.of(HTTPRequest.class));
        assertEquals("order_v2_created", TopicNames.of(OrderV2Created.class));
        assertEquals("snake_case", TopicNames.of(Snake_Case.class));
        assertEquals("string", TopicNames.of(String.class));
    }

    @Test
    void rejectsTypesWithoutName() {
        Object anonymous = new Object() {
        };

        assertThrows(IllegalArgumentException.class, () -> TopicNames.of(anonymous.getClass()));
        assertThrows(IllegalArgumentException.class, () -> TopicNames.of(null));
    }
}
