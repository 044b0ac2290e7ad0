package com.p14n.entitystream.auth;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TopicTest {

    @Test
    void shouldParseEntityTopics() {
        Topic topic = Topic.parse("entity.product.42");
        assertEquals(Topic.Kind.ENTITY, topic.kind());
        assertEquals("product", topic.entityType());
        assertEquals("42", topic.entityId());
        assertTrue(topic.isEntityScoped());

        Topic typeWide = Topic.parse("entity.product");
        assertEquals(Topic.Kind.ENTITY_TYPE, typeWide.kind());
        assertEquals("product", typeWide.entityType());
        assertNull(typeWide.entityId());
    }

    @Test
    void shouldParseUserAndPublicTopics() {
        Topic user = Topic.parse("user.u1.notifications");
        assertEquals(Topic.Kind.USER, user.kind());
        assertEquals("u1", user.userId());
        assertFalse(user.isEntityScoped());

        assertEquals(Topic.Kind.PUBLIC, Topic.parse("public.news").kind());
    }

    @Test
    void shouldTreatUnknownShapesAsOther() {
        assertEquals(Topic.Kind.OTHER, Topic.parse("admin.secrets").kind());
        assertEquals(Topic.Kind.OTHER, Topic.parse("entity").kind());
        assertEquals(Topic.Kind.OTHER, Topic.parse("entity.a.b.c").kind());
        assertEquals(Topic.Kind.OTHER, Topic.parse("user.u1").kind());
        assertEquals(Topic.Kind.OTHER, Topic.parse("public.a.b").kind());
    }

    @Test
    void shouldRejectMalformedNames() {
        assertFalse(Topic.isWellFormed(null));
        assertFalse(Topic.isWellFormed(""));
        assertFalse(Topic.isWellFormed("entity..42"));
        assertFalse(Topic.isWellFormed(".entity"));
        assertFalse(Topic.isWellFormed("entity.product."));
        assertFalse(Topic.isWellFormed("entity.*.42"));
        assertFalse(Topic.isWellFormed("entity.#"));
        assertFalse(Topic.isWellFormed("entity product"));
        assertFalse(Topic.isWellFormed("x".repeat(250)));
        assertThrows(IllegalArgumentException.class, () -> Topic.parse("entity..42"));
    }

    @Test
    void shouldAcceptIdsWithDashesAndUnderscores() {
        assertTrue(Topic.isWellFormed("entity.order_line.3f2a-11ee-9"));
        assertEquals("3f2a-11ee-9", Topic.parse("entity.order_line.3f2a-11ee-9").entityId());
    }

    @Test
    void shouldRejectCharactersKafkaCannotCarry() {
        assertFalse(Topic.isWellFormed("public.a:b"));
        assertFalse(Topic.isWellFormed("entity.product.x@y"));
        assertFalse(Topic.isWellFormed("entity.product.caf\u00e9"));
    }

    @Test
    void shouldOnlyTreatLowerCaseEntityTypesAsCanonical() {
        assertTrue(Topic.parse("entity.product.42").isCanonical());
        assertTrue(Topic.parse("entity.product").isCanonical());
        assertFalse(Topic.parse("entity.Product.42").isCanonical());
        assertFalse(Topic.parse("entity.PRODUCT").isCanonical());
        assertTrue(Topic.parse("user.U1.notifications").isCanonical());
        assertTrue(Topic.parse("public.News").isCanonical());
    }

    @Test
    void shouldLowerCaseEntityTypeForEventTopics() {
        assertEquals("entity.product.42", Topic.forEntity("Product", "42"));
    }
}
